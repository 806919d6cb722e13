package com.e2eq.insights.quota;

import com.e2eq.insights.model.usage.QuotaPeriod;
import com.e2eq.insights.rest.models.QuotaStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Outcome of an admission check for one period. {@code failOpen} marks a check that could not
 * read the usage store and admitted the request anyway.
 */
@Getter
@ToString
@AllArgsConstructor
public class QuotaCheck {

    private final boolean allowed;
    private final QuotaPeriod period;
    private final long limit;
    private final long consumed;
    private final long remaining;
    private final Instant resetsAt;
    private final boolean failOpen;

    static QuotaCheck failOpen(QuotaPeriod period, long limit, Instant resetsAt) {
        return new QuotaCheck(true, period, limit, 0L, limit, resetsAt, true);
    }

    public QuotaStatus toStatus() {
        return QuotaStatus.builder()
            .period(period.getLabel())
            .limit(limit)
            .consumed(consumed)
            .remaining(remaining)
            .resetsAt(resetsAt)
            .build();
    }
}

package com.e2eq.insights.exceptions;

import com.e2eq.insights.model.usage.QuotaPeriod;
import com.e2eq.insights.rest.models.ResponseStatus;

import java.time.Instant;
import java.util.Locale;

/**
 * Thrown when an identity's consumption for a period would pass its limit. Generation is
 * not invoked; the request may be retried after {@link #getResetsAt()}.
 */
public class QuotaExceededException extends InsightsException {
    private static final long serialVersionUID = 1L;

    private final QuotaPeriod period;
    private final long limit;
    private final long consumed;
    private final Instant resetsAt;

    public QuotaExceededException(String message, QuotaPeriod period, long limit, long consumed, Instant resetsAt) {
        super(message, resetsAt != null
            ? "Wait until the quota resets at " + resetsAt + " or ask an administrator to raise your limit."
            : "Ask an administrator to raise your limit.");
        this.period = period;
        this.limit = limit;
        this.consumed = consumed;
        this.resetsAt = resetsAt;
    }

    public static QuotaExceededException forPeriod(QuotaPeriod period, long limit, long consumed, Instant resetsAt) {
        String message = String.format(Locale.ROOT, "You have exceeded your %s token quota. Used: %,d / Limit: %,d tokens.",
            period.getLabel(), consumed, limit);
        return new QuotaExceededException(message, period, limit, consumed, resetsAt);
    }

    public QuotaPeriod getPeriod() {
        return period;
    }

    public long getLimit() {
        return limit;
    }

    public long getConsumed() {
        return consumed;
    }

    /** Always zero: an exceeded quota has nothing left for the period. */
    public long getRemaining() {
        return 0L;
    }

    public Instant getResetsAt() {
        return resetsAt;
    }

    @Override
    public ResponseStatus getStatus() {
        return ResponseStatus.QUOTA_EXCEEDED;
    }
}

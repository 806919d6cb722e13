package com.e2eq.insights.testsupport;

import com.e2eq.insights.model.persistent.QuotaRecord;
import com.e2eq.insights.model.persistent.store.UsageStore;
import com.e2eq.insights.model.usage.QuotaPeriod;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class FakeUsageStore implements UsageStore {

    private final Map<String, QuotaRecord> records = new HashMap<>();
    private boolean failing;

    private static String key(String userId, QuotaPeriod period, Instant start) {
        return userId + "|" + period + "|" + start;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public QuotaRecord seed(String userId, QuotaPeriod period, Instant at, long consumed, Long limitOverride) {
        QuotaRecord record = new QuotaRecord();
        record.setUserId(userId);
        record.setPeriod(period);
        record.setPeriodStart(period.periodStart(at));
        record.setPeriodEnd(period.periodEnd(at));
        record.setTokensConsumed(consumed);
        record.setLimitOverride(limitOverride);
        records.put(key(userId, period, record.getPeriodStart()), record);
        return record;
    }

    public long consumed(String userId, QuotaPeriod period, Instant at) {
        QuotaRecord record = records.get(key(userId, period, period.periodStart(at)));
        return record == null ? 0L : record.getTokensConsumed();
    }

    @Override
    public Optional<QuotaRecord> find(String userId, QuotaPeriod period, Instant periodStart) {
        if (failing) {
            throw new IllegalStateException("usage store unavailable");
        }
        return Optional.ofNullable(records.get(key(userId, period, periodStart)));
    }

    @Override
    public QuotaRecord increment(String userId, QuotaPeriod period, Instant periodStart, Instant periodEnd,
                                 long tokens, Instant at) {
        if (failing) {
            throw new IllegalStateException("usage store unavailable");
        }
        QuotaRecord record = records.computeIfAbsent(key(userId, period, periodStart), k -> {
            QuotaRecord created = new QuotaRecord();
            created.setUserId(userId);
            created.setPeriod(period);
            created.setPeriodStart(periodStart);
            return created;
        });
        record.setPeriodEnd(periodEnd);
        record.setTokensConsumed(record.getTokensConsumed() + tokens);
        record.setRequestCount(record.getRequestCount() + 1);
        record.setUpdatedAt(at);
        return record;
    }
}

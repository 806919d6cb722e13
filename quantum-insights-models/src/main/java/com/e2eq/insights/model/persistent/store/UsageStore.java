package com.e2eq.insights.model.persistent.store;

import com.e2eq.insights.model.persistent.QuotaRecord;
import com.e2eq.insights.model.usage.QuotaPeriod;

import java.time.Instant;
import java.util.Optional;

public interface UsageStore {

    Optional<QuotaRecord> find(String userId, QuotaPeriod period, Instant periodStart);

    /**
     * Atomically adds the tokens (and one request) to the record for the period, creating it when absent.
     */
    QuotaRecord increment(String userId, QuotaPeriod period, Instant periodStart, Instant periodEnd, long tokens, Instant at);
}

package com.e2eq.insights.model.persistent.morphia;

import com.e2eq.insights.model.persistent.QuotaRecord;
import com.e2eq.insights.model.persistent.store.UsageStore;
import com.e2eq.insights.model.usage.QuotaPeriod;
import com.mongodb.client.model.ReturnDocument;
import dev.morphia.ModifyOptions;
import dev.morphia.query.Query;
import dev.morphia.query.filters.Filters;
import dev.morphia.query.updates.UpdateOperators;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Instant;
import java.util.Optional;

/**
 * Per-identity, per-period consumption counters. Increments use findAndModify with upsert so
 * concurrent requests never lose an update.
 */
@ApplicationScoped
public class QuotaRecordRepo implements UsageStore {

    @Inject
    MorphiaDataStore morphiaDataStore;

    private Query<QuotaRecord> forPeriod(String userId, QuotaPeriod period, Instant periodStart) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return morphiaDataStore.getDataStore()
            .find(QuotaRecord.class)
            .filter(Filters.eq("userId", userId),
                Filters.eq("period", period),
                Filters.eq("periodStart", periodStart));
    }

    @Override
    public Optional<QuotaRecord> find(String userId, QuotaPeriod period, Instant periodStart) {
        return Optional.ofNullable(forPeriod(userId, period, periodStart).first());
    }

    @Override
    public QuotaRecord increment(String userId, QuotaPeriod period, Instant periodStart, Instant periodEnd,
                                 long tokens, Instant at) {
        return forPeriod(userId, period, periodStart)
            .modify(new ModifyOptions().upsert(true).returnDocument(ReturnDocument.AFTER),
                UpdateOperators.inc("tokensConsumed", tokens),
                UpdateOperators.inc("requestCount", 1),
                UpdateOperators.set("periodEnd", periodEnd),
                UpdateOperators.set("updatedAt", at));
    }
}

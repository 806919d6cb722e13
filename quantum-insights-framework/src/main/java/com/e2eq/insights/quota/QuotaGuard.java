package com.e2eq.insights.quota;

import com.e2eq.insights.exceptions.QuotaExceededException;
import com.e2eq.insights.model.persistent.QuotaRecord;
import com.e2eq.insights.model.persistent.store.UsageStore;
import com.e2eq.insights.model.usage.QuotaPeriod;
import com.e2eq.insights.util.ExceptionLoggingUtils;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-identity token quota across daily and monthly periods.
 * <p>
 * Admission fails open: if usage cannot be read the request is admitted and a warning is logged.
 * Recording after a successful answer never fails the request.
 */
@ApplicationScoped
public class QuotaGuard {

    @Inject
    UsageStore usageStore;

    @Inject
    Clock clock;

    @ConfigProperty(name = "quantum.insights.quota.enabled", defaultValue = "true")
    boolean enabled = true;

    @ConfigProperty(name = "quantum.insights.quota.daily-limit", defaultValue = "100000")
    long dailyLimit = 100_000L;

    @ConfigProperty(name = "quantum.insights.quota.monthly-limit", defaultValue = "2000000")
    long monthlyLimit = 2_000_000L;

    /**
     * Checks every period. The first period that would be exceeded is returned as a disallowed
     * check; otherwise the check with the least remaining allowance is returned.
     */
    public QuotaCheck check(String userId, long estimatedTokens) {
        Instant now = clock.instant();
        QuotaCheck tightest = null;
        for (QuotaPeriod period : QuotaPeriod.values()) {
            QuotaCheck check = checkPeriod(userId, period, Math.max(0L, estimatedTokens), now);
            if (!check.isAllowed()) {
                return check;
            }
            if (tightest == null || check.getRemaining() < tightest.getRemaining()) {
                tightest = check;
            }
        }
        return tightest;
    }

    /**
     * @throws QuotaExceededException when a period's limit would be passed
     */
    public QuotaCheck enforce(String userId, long estimatedTokens) {
        QuotaCheck check = check(userId, estimatedTokens);
        if (!check.isAllowed()) {
            Log.infof("Quota exceeded for user %s (%s: %d of %d)", userId, check.getPeriod().getLabel(),
                check.getConsumed(), check.getLimit());
            throw QuotaExceededException.forPeriod(check.getPeriod(), check.getLimit(), check.getConsumed(),
                check.getResetsAt());
        }
        return check;
    }

    /**
     * Adds consumed tokens to every period. Failures are logged and ignored.
     */
    public void record(String userId, long tokens) {
        if (!enabled || tokens <= 0) {
            return;
        }
        Instant now = clock.instant();
        for (QuotaPeriod period : QuotaPeriod.values()) {
            try {
                usageStore.increment(userId, period, period.periodStart(now), period.periodEnd(now), tokens, now);
            } catch (RuntimeException e) {
                ExceptionLoggingUtils.logWarn(e, "Failed to record %d tokens of %s usage for user %s",
                    tokens, period.getLabel(), userId);
            }
        }
    }

    /**
     * Current standing in each period, without admitting anything.
     */
    public List<QuotaCheck> usage(String userId) {
        Instant now = clock.instant();
        List<QuotaCheck> checks = new ArrayList<>();
        for (QuotaPeriod period : QuotaPeriod.values()) {
            checks.add(checkPeriod(userId, period, 0L, now));
        }
        return checks;
    }

    public long configuredLimit(QuotaPeriod period) {
        return period == QuotaPeriod.DAILY ? dailyLimit : monthlyLimit;
    }

    private QuotaCheck checkPeriod(String userId, QuotaPeriod period, long cost, Instant now) {
        long limit = configuredLimit(period);
        Instant resetsAt = period.periodEnd(now);
        if (!enabled) {
            return new QuotaCheck(true, period, limit, 0L, limit, resetsAt, false);
        }
        Optional<QuotaRecord> record;
        try {
            record = usageStore.find(userId, period, period.periodStart(now));
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logWarn(e, "Quota lookup failed for user %s; admitting request", userId);
            return QuotaCheck.failOpen(period, limit, resetsAt);
        }
        long consumed = 0L;
        if (record.isPresent()) {
            consumed = record.get().getTokensConsumed();
            if (record.get().getLimitOverride() != null) {
                limit = record.get().getLimitOverride();
            }
        }
        boolean allowed = consumed + cost <= limit;
        return new QuotaCheck(allowed, period, limit, consumed, Math.max(0L, limit - consumed), resetsAt, false);
    }
}

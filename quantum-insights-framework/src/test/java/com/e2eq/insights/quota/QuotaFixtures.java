package com.e2eq.insights.quota;

import com.e2eq.insights.model.persistent.store.UsageStore;

import java.time.Clock;

public final class QuotaFixtures {

    private QuotaFixtures() {
    }

    public static QuotaGuard guard(UsageStore store, Clock clock, long dailyLimit, long monthlyLimit) {
        QuotaGuard guard = new QuotaGuard();
        guard.usageStore = store;
        guard.clock = clock;
        guard.dailyLimit = dailyLimit;
        guard.monthlyLimit = monthlyLimit;
        return guard;
    }
}

package com.e2eq.insights.config;

import com.e2eq.insights.cache.TtlCache;
import com.e2eq.insights.model.security.PermissionBundle;
import com.e2eq.insights.router.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InsightsProducers unit tests")
class InsightsProducersTest {

    @Test
    @DisplayName("retry policy follows the configured attempts")
    void retryPolicy() {
        InsightsProducers producers = new InsightsProducers();
        producers.retryMaxAttempts = 4;
        producers.retryBaseDelay = Duration.ofMillis(10);
        producers.retryMaxDelay = Duration.ofMillis(50);

        RetryPolicy policy = producers.upstreamRetryPolicy();

        assertEquals(4, policy.getMaxAttempts());
    }

    @Test
    @DisplayName("permission cache is built on the supplied clock")
    void permissionCache() {
        InsightsProducers producers = new InsightsProducers();
        Clock clock = producers.clock();

        TtlCache<String, PermissionBundle> cache = producers.permissionCache(clock);

        assertNotNull(cache);
        assertTrue(cache.get("nobody").isEmpty());
    }
}

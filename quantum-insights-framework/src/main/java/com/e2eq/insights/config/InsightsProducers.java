package com.e2eq.insights.config;

import com.e2eq.insights.cache.TtlCache;
import com.e2eq.insights.model.security.PermissionBundle;
import com.e2eq.insights.router.RetryPolicy;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared infrastructure beans. Each is a {@link DefaultBean} so applications and tests can
 * supply their own.
 */
@ApplicationScoped
public class InsightsProducers {

    @ConfigProperty(name = "quantum.insights.retry.max-attempts", defaultValue = "3")
    int retryMaxAttempts;

    @ConfigProperty(name = "quantum.insights.retry.base-delay", defaultValue = "PT0.2S")
    Duration retryBaseDelay;

    @ConfigProperty(name = "quantum.insights.retry.max-delay", defaultValue = "PT2S")
    Duration retryMaxDelay;

    @Produces
    @DefaultBean
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Per-identity permission bundles. Constructed here and injected, never held statically.
     */
    @Produces
    @DefaultBean
    @Singleton
    public TtlCache<String, PermissionBundle> permissionCache(Clock clock) {
        return new TtlCache<>(clock);
    }

    @Produces
    @DefaultBean
    @Singleton
    public RetryPolicy upstreamRetryPolicy() {
        return RetryPolicy.forUpstream(retryMaxAttempts, retryBaseDelay, retryMaxDelay);
    }
}

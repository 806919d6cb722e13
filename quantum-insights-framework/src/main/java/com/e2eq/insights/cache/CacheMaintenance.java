package com.e2eq.insights.cache;

import com.e2eq.insights.util.ExceptionLoggingUtils;
import io.quarkus.logging.Log;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Removes expired cache entries of every identity when the application starts.
 */
@ApplicationScoped
public class CacheMaintenance {

    @Inject
    CacheGateway cacheGateway;

    @ConfigProperty(name = "quantum.insights.cache.cleanup-on-start", defaultValue = "true")
    boolean cleanupOnStart;

    void onStart(@Observes StartupEvent event) {
        if (!cleanupOnStart) {
            return;
        }
        purgeExpired();
    }

    public long purgeExpired() {
        try {
            long removed = cacheGateway.evictExpired();
            Log.infof("Removed %d expired cache entries", removed);
            return removed;
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logWarn(e, "Expired cache cleanup failed");
            return 0;
        }
    }
}

package com.e2eq.insights.security;

import com.e2eq.insights.cache.TtlCache;
import com.e2eq.insights.model.persistent.ResourceGrant;
import com.e2eq.insights.model.persistent.RoleAssignment;
import com.e2eq.insights.model.persistent.RolePermission;
import com.e2eq.insights.model.persistent.store.PermissionStore;
import com.e2eq.insights.model.security.PermissionBundle;
import com.e2eq.insights.model.security.PermissionSource;
import com.e2eq.insights.util.ExceptionLoggingUtils;
import com.e2eq.insights.util.IdentifierUtils;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resolves the roles, permissions and dataset/table grants of an identity.
 * <p>
 * Bundles are cached per identity for {@code quantum.insights.permissions.cache-ttl}. When the
 * permission store fails, a cached bundle younger than ttl + grace window is served; otherwise
 * the identity gets a bundle that grants nothing, which is not cached. Concurrent resolutions for
 * the same identity may both hit the store; the last write wins and both results are valid.
 * Bundles older than ttl + grace window are swept at most once per ttl, on hydration.
 */
@ApplicationScoped
public class PermissionResolver {

    @Inject
    PermissionStore permissionStore;

    @Inject
    TtlCache<String, PermissionBundle> permissionCache;

    @Inject
    Clock clock;

    @ConfigProperty(name = "quantum.insights.permissions.cache-ttl", defaultValue = "PT5M")
    Duration cacheTtl;

    @ConfigProperty(name = "quantum.insights.permissions.grace-window", defaultValue = "PT15M")
    Duration graceWindow;

    private final AtomicReference<Instant> lastSweep = new AtomicReference<>(Instant.EPOCH);

    public PermissionBundle resolve(String userId) {
        if (StringUtils.isBlank(userId)) {
            throw new IllegalArgumentException("userId is required");
        }
        Instant now = clock.instant();
        Optional<TtlCache.Entry<PermissionBundle>> cached = permissionCache.get(userId);
        if (cached.isPresent() && cached.get().isFresh(now, cacheTtl)) {
            return cached.get().getValue().withSource(PermissionSource.CACHE);
        }

        try {
            PermissionBundle bundle = hydrate(userId, now);
            permissionCache.put(userId, bundle);
            sweepExpired(now);
            return bundle;
        } catch (RuntimeException e) {
            if (cached.isPresent() && cached.get().isFresh(now, cacheTtl.plus(graceWindow))) {
                ExceptionLoggingUtils.logWarn(e, "Permission store unavailable for user %s; serving cached grants from %s",
                    userId, cached.get().getStoredAt());
                return cached.get().getValue().withSource(PermissionSource.STALE_CACHE);
            }
            ExceptionLoggingUtils.logWarn(e, "Permission store unavailable for user %s; failing closed", userId);
            return PermissionBundle.failClosed(userId, now);
        }
    }

    public void invalidate(String userId) {
        if (userId != null) {
            permissionCache.invalidate(userId);
        }
    }

    public void invalidateAll() {
        permissionCache.invalidateAll();
    }

    void sweepExpired(Instant now) {
        Instant last = lastSweep.get();
        if (now.isBefore(last.plus(cacheTtl)) || !lastSweep.compareAndSet(last, now)) {
            return;
        }
        int removed = permissionCache.evictOlderThan(cacheTtl.plus(graceWindow));
        if (removed > 0) {
            Log.debugf("Evicted %d expired permission bundles", removed);
        }
    }

    PermissionBundle hydrate(String userId, Instant now) {
        List<RoleAssignment> assignments = permissionStore.findRoleAssignments(userId);
        Set<String> roleIds = new LinkedHashSet<>();
        Set<String> roleNames = new LinkedHashSet<>();
        for (RoleAssignment assignment : assignments) {
            if (StringUtils.isNotBlank(assignment.getRoleId())) {
                roleIds.add(assignment.getRoleId().strip());
                roleNames.add(StringUtils.defaultIfBlank(assignment.getRoleName(), assignment.getRoleId()).strip());
            }
        }

        Set<String> permissions = new LinkedHashSet<>();
        Set<String> datasets = new LinkedHashSet<>();
        Map<String, Set<String>> tables = new HashMap<>();
        if (!roleIds.isEmpty()) {
            for (RolePermission permission : permissionStore.findPermissions(roleIds)) {
                if (StringUtils.isNotBlank(permission.getPermission())) {
                    permissions.add(permission.getPermission().strip());
                }
            }
            for (ResourceGrant grant : permissionStore.findGrants(roleIds)) {
                String dataset = IdentifierUtils.normalize(grant.getDatasetId());
                if (dataset == null) {
                    continue;
                }
                datasets.add(dataset);
                String table = IdentifierUtils.normalize(grant.getTableId());
                tables.computeIfAbsent(dataset, k -> new LinkedHashSet<>())
                    .add(table == null ? IdentifierUtils.WILDCARD : table);
            }
        }

        Log.debugf("Resolved %d roles, %d permissions, %d datasets for user %s",
            roleNames.size(), permissions.size(), datasets.size(), userId);
        return new PermissionBundle(userId, roleNames, permissions, datasets, tables, now, PermissionSource.BACKEND);
    }
}

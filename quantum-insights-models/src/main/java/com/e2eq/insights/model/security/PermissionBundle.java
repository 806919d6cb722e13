package com.e2eq.insights.model.security;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merged roles, permissions and resource grants for one identity, as hydrated from the permission store.
 * Dataset and table identifiers are already normalized.
 */
public final class PermissionBundle {

    private final String userId;
    private final Set<String> roles;
    private final Set<String> permissions;
    private final Set<String> allowedDatasets;
    private final Map<String, Set<String>> allowedTables;
    private final Instant resolvedAt;
    private final PermissionSource source;

    public PermissionBundle(String userId, Set<String> roles, Set<String> permissions, Set<String> allowedDatasets,
                            Map<String, ? extends Set<String>> allowedTables, Instant resolvedAt, PermissionSource source) {
        this.userId = userId;
        this.roles = roles == null ? ImmutableSet.of() : ImmutableSet.copyOf(roles);
        this.permissions = permissions == null ? ImmutableSet.of() : ImmutableSet.copyOf(permissions);
        this.allowedDatasets = allowedDatasets == null ? ImmutableSet.of() : ImmutableSet.copyOf(allowedDatasets);
        ImmutableMap.Builder<String, Set<String>> tables = ImmutableMap.builder();
        if (allowedTables != null) {
            allowedTables.forEach((dataset, names) -> tables.put(dataset, ImmutableSet.copyOf(names)));
        }
        this.allowedTables = tables.build();
        this.resolvedAt = resolvedAt;
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * A bundle that grants nothing, returned when permissions cannot be resolved.
     */
    public static PermissionBundle failClosed(String userId, Instant at) {
        return new PermissionBundle(userId, Set.of(), Set.of(), Set.of(), Map.of(), at, PermissionSource.FAIL_CLOSED);
    }

    /**
     * Same grants, different provenance. Used when a cached bundle is served.
     */
    public PermissionBundle withSource(PermissionSource newSource) {
        return new PermissionBundle(userId, roles, permissions, allowedDatasets, allowedTables, resolvedAt, newSource);
    }

    public String getUserId() {
        return userId;
    }

    public Set<String> getRoles() {
        return roles;
    }

    public Set<String> getPermissions() {
        return permissions;
    }

    public Set<String> getAllowedDatasets() {
        return allowedDatasets;
    }

    public Map<String, Set<String>> getAllowedTables() {
        return allowedTables;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public PermissionSource getSource() {
        return source;
    }

    public boolean grantsNothing() {
        return permissions.isEmpty() && allowedDatasets.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PermissionBundle)) return false;
        PermissionBundle that = (PermissionBundle) o;
        return Objects.equals(userId, that.userId) && roles.equals(that.roles) && permissions.equals(that.permissions)
            && allowedDatasets.equals(that.allowedDatasets) && allowedTables.equals(that.allowedTables)
            && Objects.equals(resolvedAt, that.resolvedAt) && source == that.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, roles, permissions, allowedDatasets, allowedTables, resolvedAt, source);
    }
}

package com.e2eq.insights.model.security;

import com.e2eq.insights.util.IdentifierUtils;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.quarkus.runtime.annotations.RegisterForReflection;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Immutable snapshot of a validated identity and its resolved permissions. Built once per
 * request (or per permission cache window) and never mutated; a change of grants produces a
 * new context.
 * <p>
 * Dataset and table identifiers are compared case-insensitively with quoting stripped.
 * {@code *} as a dataset authorizes every dataset; {@code *} as a table authorizes every table of
 * its dataset. An allowed dataset without a table entry authorizes all of its tables.
 */
@RegisterForReflection
public final class AccessContext {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final String userId;
    private final String email;
    private final Set<String> roles;
    private final Set<String> permissions;
    private final Set<String> allowedDatasets;
    private final Map<String, Set<String>> allowedTables;
    private final Instant expiresAt;
    private final PermissionSource source;

    private AccessContext(Builder b) {
        this.userId = b.userId;
        this.email = b.email;
        this.roles = ImmutableSet.copyOf(b.roles);
        this.permissions = ImmutableSet.copyOf(b.permissions);
        this.allowedDatasets = ImmutableSet.copyOf(b.allowedDatasets);
        ImmutableMap.Builder<String, Set<String>> tables = ImmutableMap.builder();
        b.allowedTables.forEach((dataset, names) -> tables.put(dataset, ImmutableSet.copyOf(names)));
        this.allowedTables = tables.build();
        this.expiresAt = b.expiresAt;
        this.source = b.source;
    }

    public String getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
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

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public PermissionSource getSource() {
        return source;
    }

    public boolean hasPermission(String permission) {
        return permission != null && permissions.contains(permission.strip());
    }

    public boolean canAccessDataset(String datasetId) {
        String dataset = IdentifierUtils.normalize(datasetId);
        if (dataset == null) {
            return false;
        }
        return allowedDatasets.contains(IdentifierUtils.WILDCARD) || allowedDatasets.contains(dataset);
    }

    public boolean canAccessTable(String datasetId, String tableId) {
        String dataset = IdentifierUtils.normalize(datasetId);
        String table = IdentifierUtils.normalize(tableId);
        if (table == null || !canAccessDataset(dataset)) {
            return false;
        }
        if (allowedDatasets.contains(IdentifierUtils.WILDCARD)) {
            // a dataset wildcard overrides table-level grants
            return true;
        }
        Set<String> tables = allowedTables.get(dataset);
        if (tables == null) {
            return true;
        }
        return tables.contains(IdentifierUtils.WILDCARD) || tables.contains(table);
    }

    public boolean canAccess(TableReference reference) {
        return reference != null && reference.hasDataset()
            && canAccessTable(reference.getDataset(), reference.getTable());
    }

    /**
     * True once the token this context was built from has expired. A context without an
     * expiry never expires on its own.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isExpired() {
        return isExpired(Instant.now());
    }

    /**
     * The caller's own authorized resources as {@code dataset.table} or {@code dataset.*}, sorted.
     */
    public List<String> authorizedResources() {
        List<String> resources = new ArrayList<>();
        for (String dataset : new TreeSet<>(allowedDatasets)) {
            Set<String> tables = allowedTables.get(dataset);
            if (tables == null || tables.contains(IdentifierUtils.WILDCARD)) {
                resources.add(dataset + ".*");
            } else {
                for (String table : new TreeSet<>(tables)) {
                    resources.add(dataset + "." + table);
                }
            }
        }
        return resources;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccessContext)) return false;
        AccessContext that = (AccessContext) o;
        return userId.equals(that.userId) && Objects.equals(email, that.email) && roles.equals(that.roles)
            && permissions.equals(that.permissions) && allowedDatasets.equals(that.allowedDatasets)
            && allowedTables.equals(that.allowedTables) && Objects.equals(expiresAt, that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, email, roles, permissions, allowedDatasets, allowedTables, expiresAt);
    }

    @Override
    public String toString() {
        return "AccessContext{userId='" + userId + "', roles=" + roles + ", permissions=" + permissions
            + ", datasets=" + allowedDatasets + ", expiresAt=" + expiresAt + ", source=" + source + '}';
    }

    public static class Builder {
        private String userId;
        private String email;
        private final Set<String> roles = new LinkedHashSet<>();
        private final Set<String> permissions = new LinkedHashSet<>();
        private final Set<String> allowedDatasets = new LinkedHashSet<>();
        private final Map<String, Set<String>> allowedTables = new HashMap<>();
        private Instant expiresAt;
        private PermissionSource source = PermissionSource.BACKEND;

        public Builder withUserId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder withEmail(String email) {
            this.email = email;
            return this;
        }

        public Builder withRoles(Collection<String> roles) {
            if (roles != null) {
                roles.stream().filter(StringUtils::isNotBlank).map(String::strip).forEach(this.roles::add);
            }
            return this;
        }

        public Builder withPermissions(Collection<String> permissions) {
            if (permissions != null) {
                permissions.stream().filter(StringUtils::isNotBlank).map(String::strip).forEach(this.permissions::add);
            }
            return this;
        }

        public Builder withPermission(String permission) {
            return withPermissions(List.of(permission));
        }

        public Builder withAllowedDatasets(Collection<String> datasets) {
            if (datasets != null) {
                for (String dataset : datasets) {
                    String normalized = IdentifierUtils.normalize(dataset);
                    if (normalized != null) {
                        allowedDatasets.add(normalized);
                    }
                }
            }
            return this;
        }

        /**
         * Restricts a dataset to the given tables. The dataset itself is also allowed.
         */
        public Builder withAllowedTables(String datasetId, Collection<String> tables) {
            String dataset = IdentifierUtils.normalize(datasetId);
            if (dataset == null) {
                return this;
            }
            allowedDatasets.add(dataset);
            Set<String> names = allowedTables.computeIfAbsent(dataset, k -> new LinkedHashSet<>());
            if (tables != null) {
                for (String table : tables) {
                    String normalized = IdentifierUtils.normalize(table);
                    if (normalized != null) {
                        names.add(normalized);
                    }
                }
            }
            return this;
        }

        public Builder withAllowedTables(Map<String, ? extends Collection<String>> tablesByDataset) {
            if (tablesByDataset != null) {
                tablesByDataset.forEach(this::withAllowedTables);
            }
            return this;
        }

        public Builder withBundle(PermissionBundle bundle) {
            if (bundle != null) {
                withRoles(bundle.getRoles());
                withPermissions(bundle.getPermissions());
                withAllowedDatasets(bundle.getAllowedDatasets());
                withAllowedTables(bundle.getAllowedTables());
                withSource(bundle.getSource());
            }
            return this;
        }

        public Builder withExpiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder withSource(PermissionSource source) {
            if (source != null) {
                this.source = source;
            }
            return this;
        }

        /**
         * @throws IllegalArgumentException when the user id is blank or the email is malformed
         */
        public AccessContext build() {
            if (StringUtils.isBlank(userId)) {
                throw new IllegalArgumentException("userId is required");
            }
            userId = userId.strip();
            if (email != null) {
                email = email.strip();
                if (email.isEmpty()) {
                    email = null;
                } else if (!EMAIL.matcher(email).matches()) {
                    throw new IllegalArgumentException("email is not a valid address: " + email);
                }
            }
            return new AccessContext(this);
        }
    }
}

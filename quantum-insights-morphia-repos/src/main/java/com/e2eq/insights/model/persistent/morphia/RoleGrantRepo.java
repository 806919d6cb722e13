package com.e2eq.insights.model.persistent.morphia;

import com.e2eq.insights.model.persistent.ResourceGrant;
import com.e2eq.insights.model.persistent.RoleAssignment;
import com.e2eq.insights.model.persistent.RolePermission;
import com.e2eq.insights.model.persistent.store.PermissionStore;
import dev.morphia.query.filters.Filters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.List;

/**
 * Roles, role permissions and resource grants. Reads only; administration writes go through {@link #save}.
 */
@ApplicationScoped
public class RoleGrantRepo implements PermissionStore {

    @Inject
    MorphiaDataStore morphiaDataStore;

    @Override
    public List<RoleAssignment> findRoleAssignments(String userId) {
        if (StringUtils.isBlank(userId)) {
            return List.of();
        }
        return morphiaDataStore.getDataStore()
            .find(RoleAssignment.class)
            .filter(Filters.eq("userId", userId))
            .iterator()
            .toList();
    }

    @Override
    public List<RolePermission> findPermissions(Collection<String> roleIds) {
        if (roleIds == null || roleIds.isEmpty()) {
            return List.of();
        }
        return morphiaDataStore.getDataStore()
            .find(RolePermission.class)
            .filter(Filters.in("roleId", roleIds))
            .iterator()
            .toList();
    }

    @Override
    public List<ResourceGrant> findGrants(Collection<String> roleIds) {
        if (roleIds == null || roleIds.isEmpty()) {
            return List.of();
        }
        return morphiaDataStore.getDataStore()
            .find(ResourceGrant.class)
            .filter(Filters.in("roleId", roleIds))
            .iterator()
            .toList();
    }

    public <T> T save(T entity) {
        return morphiaDataStore.getDataStore().save(entity);
    }
}

package com.e2eq.insights.model.persistent.store;

import com.e2eq.insights.model.persistent.ResourceGrant;
import com.e2eq.insights.model.persistent.RoleAssignment;
import com.e2eq.insights.model.persistent.RolePermission;

import java.util.Collection;
import java.util.List;

/**
 * Read-only access to role assignments, role permissions and resource grants.
 * Implementations throw on backend failure; callers decide how to degrade.
 */
public interface PermissionStore {

    List<RoleAssignment> findRoleAssignments(String userId);

    List<RolePermission> findPermissions(Collection<String> roleIds);

    List<ResourceGrant> findGrants(Collection<String> roleIds);
}

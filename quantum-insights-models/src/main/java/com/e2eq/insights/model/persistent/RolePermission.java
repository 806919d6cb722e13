package com.e2eq.insights.model.persistent;

import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Id;
import dev.morphia.annotations.Indexed;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bson.types.ObjectId;

/**
 * Grants a permission tag such as {@code query:execute} to a role.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
@Entity(value = "rolePermissions", useDiscriminator = false)
public class RolePermission {

    @Id
    private ObjectId id;

    @Indexed
    private String roleId;

    private String permission;

    public RolePermission(String roleId, String permission) {
        this(null, roleId, permission);
    }
}

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
 * Assigns a role to an identity. Administrator managed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
@Entity(value = "roleAssignments", useDiscriminator = false)
public class RoleAssignment {

    @Id
    private ObjectId id;

    @Indexed
    private String userId;

    private String roleId;

    private String roleName;

    public RoleAssignment(String userId, String roleId, String roleName) {
        this(null, userId, roleId, roleName);
    }
}

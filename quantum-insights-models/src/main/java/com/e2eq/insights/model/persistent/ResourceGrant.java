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
 * Grants a role access to a dataset, or to one table of it. A null or {@code *} table id grants
 * every table of the dataset; a {@code *} dataset id grants every dataset.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
@Entity(value = "resourceGrants", useDiscriminator = false)
public class ResourceGrant {

    public static final String READ = "read";

    @Id
    private ObjectId id;

    @Indexed
    private String roleId;

    private String datasetId;

    private String tableId;

    private String accessLevel = READ;

    public ResourceGrant(String roleId, String datasetId, String tableId) {
        this(null, roleId, datasetId, tableId, READ);
    }
}

package com.e2eq.insights.model.analytics;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog description of one dataset and its tables.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class DatasetDescriptor {

    private String datasetId;

    private String description;

    private List<TableDescriptor> tables = new ArrayList<>();
}

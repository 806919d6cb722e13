package com.e2eq.insights.api.engine;

import com.e2eq.insights.model.analytics.DatasetDescriptor;
import com.e2eq.insights.model.security.AccessContext;

import java.util.List;

/**
 * Read-only listing of datasets and their tables.
 */
public interface MetadataCatalog {

    /**
     * Datasets visible to the context. Implementations may scope the lookup; callers still
     * filter the result against the context.
     */
    List<DatasetDescriptor> listDatasets(AccessContext context);
}

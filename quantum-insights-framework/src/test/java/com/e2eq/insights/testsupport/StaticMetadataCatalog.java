package com.e2eq.insights.testsupport;

import com.e2eq.insights.api.engine.MetadataCatalog;
import com.e2eq.insights.model.analytics.DatasetDescriptor;
import com.e2eq.insights.model.analytics.TableDescriptor;
import com.e2eq.insights.model.security.AccessContext;

import java.util.ArrayList;
import java.util.List;

public class StaticMetadataCatalog implements MetadataCatalog {

    private final List<DatasetDescriptor> datasets = new ArrayList<>();
    private int calls;

    public StaticMetadataCatalog dataset(String datasetId, TableDescriptor... tables) {
        datasets.add(new DatasetDescriptor(datasetId, null, new ArrayList<>(List.of(tables))));
        return this;
    }

    public static TableDescriptor table(String tableId, String... columns) {
        return new TableDescriptor(tableId, null, new ArrayList<>(List.of(columns)), null);
    }

    public int getCalls() {
        return calls;
    }

    @Override
    public List<DatasetDescriptor> listDatasets(AccessContext context) {
        calls++;
        return datasets;
    }
}

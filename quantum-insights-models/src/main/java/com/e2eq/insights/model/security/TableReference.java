package com.e2eq.insights.model.security;

import com.e2eq.insights.util.IdentifierUtils;

import java.util.Objects;

/**
 * One table mentioned in a SQL statement. Parts are normalized; project and dataset may be null
 * when the statement did not qualify the table.
 */
public final class TableReference {

    private final String project;
    private final String dataset;
    private final String table;

    private TableReference(String project, String dataset, String table) {
        this.project = project;
        this.dataset = dataset;
        this.table = table;
    }

    public static TableReference of(String project, String dataset, String table) {
        String normalizedTable = IdentifierUtils.normalize(table);
        if (normalizedTable == null) {
            throw new IllegalArgumentException("table name is required");
        }
        return new TableReference(IdentifierUtils.normalize(project), IdentifierUtils.normalize(dataset), normalizedTable);
    }

    public String getProject() {
        return project;
    }

    public String getDataset() {
        return dataset;
    }

    public String getTable() {
        return table;
    }

    public boolean hasDataset() {
        return dataset != null;
    }

    /**
     * {@code dataset.table}, or the bare table when no dataset is known.
     */
    public String datasetQualifiedName() {
        return dataset == null ? table : dataset + "." + table;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableReference)) return false;
        TableReference that = (TableReference) o;
        return Objects.equals(project, that.project) && Objects.equals(dataset, that.dataset) && table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(project, dataset, table);
    }

    @Override
    public String toString() {
        return (project == null ? "" : project + ".") + datasetQualifiedName();
    }
}

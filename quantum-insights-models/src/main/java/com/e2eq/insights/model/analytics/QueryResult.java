package com.e2eq.insights.model.analytics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rows returned by the analytical engine for one statement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class QueryResult {

    @Builder.Default
    private List<String> columns = new ArrayList<>();

    @Builder.Default
    private List<Map<String, Object>> rows = new ArrayList<>();

    private long totalRows;

    private long bytesProcessed;

    private boolean cacheHit;

    @JsonIgnore
    public boolean isEmpty() {
        return totalRows == 0 && (rows == null || rows.isEmpty());
    }
}

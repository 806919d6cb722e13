package com.e2eq.insights.rest.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Answer to one question. Errors carry a {@code message} and a concrete {@code nextStep}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InsightResponse {

    private ResponseStatus status;

    private String message;

    private String nextStep;

    /** METADATA or DATA. */
    private String questionType;

    private String sql;

    private List<String> columns;

    private List<Map<String, Object>> rows;

    private Long rowCount;

    private String summary;

    private List<String> chartSuggestions;

    private Object metadata;

    private boolean cached;

    private Long tokensUsed;

    /** Set on quota failures. */
    private QuotaStatus quota;

    @JsonIgnore
    public boolean isSuccess() {
        return status == ResponseStatus.SUCCESS;
    }
}

package com.e2eq.insights.api.llm;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class SqlGenerationRequest {

    private String question;

    private String userId;

    /** {@code dataset.*} or {@code dataset.table} entries the caller may read. */
    @Builder.Default
    private List<String> authorizedResources = new ArrayList<>();

    /** Descriptions of tables that look relevant to the question. */
    @Builder.Default
    private List<String> schemaHints = new ArrayList<>();

    /** Recent turns of the same session, oldest first. */
    @Builder.Default
    private List<PriorTurn> history = new ArrayList<>();

    private String defaultProject;
}

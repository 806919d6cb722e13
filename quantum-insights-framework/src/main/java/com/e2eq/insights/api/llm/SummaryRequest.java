package com.e2eq.insights.api.llm;

import com.e2eq.insights.model.analytics.QueryResult;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class SummaryRequest {

    private String question;

    private String sql;

    private QueryResult result;
}

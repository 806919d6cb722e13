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
public class ResultNarrative {

    private String summary;

    /** e.g. "bar: revenue by region". */
    @Builder.Default
    private List<String> chartSuggestions = new ArrayList<>();

    private long tokensUsed;
}

package com.e2eq.insights.api.llm;

import com.e2eq.insights.exceptions.UpstreamException;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Used when no language model provider is connected. Every call fails as a non-retryable
 * upstream error so callers get a clear response instead of a fabricated answer.
 */
@DefaultBean
@ApplicationScoped
public class StubTextGenerationClient implements TextGenerationClient {

    static final String SERVICE = "text-generation";

    @Override
    public SqlCandidate generateSql(SqlGenerationRequest request) {
        throw UpstreamException.notConfigured(SERVICE);
    }

    @Override
    public ResultNarrative summarize(SummaryRequest request) {
        throw UpstreamException.notConfigured(SERVICE);
    }
}

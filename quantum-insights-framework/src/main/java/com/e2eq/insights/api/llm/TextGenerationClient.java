package com.e2eq.insights.api.llm;

/**
 * Abstraction over the language model used to turn questions into SQL and results into prose.
 * Implementations throw {@link com.e2eq.insights.exceptions.UpstreamException} on provider
 * failures so the router can decide whether to retry.
 */
public interface TextGenerationClient {

    /**
     * Generates one read-only statement for the question. Only the caller's authorized resources
     * are described in the request.
     */
    SqlCandidate generateSql(SqlGenerationRequest request);

    /**
     * Describes a non-empty result in a few sentences and suggests charts.
     */
    ResultNarrative summarize(SummaryRequest request);
}

package com.e2eq.insights.api.engine;

import com.e2eq.insights.model.analytics.QueryResult;

/**
 * Executes read-only statements against the analytical warehouse.
 */
public interface AnalyticalEngineClient {

    /**
     * @param maxBytesBilled upper bound on bytes scanned; the engine refuses larger queries
     * @throws com.e2eq.insights.exceptions.UpstreamException on engine failures and timeouts
     * @throws com.e2eq.insights.exceptions.QueryValidationException when the statement is not read-only
     */
    QueryResult execute(String sql, long maxBytesBilled);
}

package com.e2eq.insights.api.engine;

import com.e2eq.insights.model.analytics.QueryResult;
import com.e2eq.insights.sql.SyntaxGuard;

/**
 * Base for engine clients. Every statement passes the {@link SyntaxGuard} again before it reaches
 * the engine, whatever the caller has already checked.
 */
public abstract class AbstractReadOnlyAnalyticalEngine implements AnalyticalEngineClient {

    private final SyntaxGuard syntaxGuard;

    protected AbstractReadOnlyAnalyticalEngine(SyntaxGuard syntaxGuard) {
        this.syntaxGuard = syntaxGuard;
    }

    @Override
    public final QueryResult execute(String sql, long maxBytesBilled) {
        String checked = syntaxGuard.check(sql);
        return doExecute(checked, maxBytesBilled);
    }

    protected abstract QueryResult doExecute(String sql, long maxBytesBilled);
}

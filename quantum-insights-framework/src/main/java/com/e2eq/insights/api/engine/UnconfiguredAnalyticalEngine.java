package com.e2eq.insights.api.engine;

import com.e2eq.insights.exceptions.UpstreamException;
import com.e2eq.insights.model.analytics.QueryResult;
import com.e2eq.insights.sql.SyntaxGuard;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Default engine when no warehouse connection is provided.
 */
@DefaultBean
@ApplicationScoped
public class UnconfiguredAnalyticalEngine extends AbstractReadOnlyAnalyticalEngine {

    static final String SERVICE = "analytical-engine";

    @Inject
    public UnconfiguredAnalyticalEngine(SyntaxGuard syntaxGuard) {
        super(syntaxGuard);
    }

    @Override
    protected QueryResult doExecute(String sql, long maxBytesBilled) {
        throw UpstreamException.notConfigured(SERVICE);
    }
}

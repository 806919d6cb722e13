package com.e2eq.insights.api.llm;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Statement produced by the generator, with the tokens it consumed.
 */
@RegisterForReflection
public class SqlCandidate {

    private String sql;
    private String explanation;
    private long tokensUsed;

    public SqlCandidate() {
    }

    public SqlCandidate(String sql, String explanation, long tokensUsed) {
        this.sql = sql;
        this.explanation = explanation;
        this.tokensUsed = tokensUsed;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public String getExplanation() {
        return explanation;
    }

    public void setExplanation(String explanation) {
        this.explanation = explanation;
    }

    public long getTokensUsed() {
        return tokensUsed;
    }

    public void setTokensUsed(long tokensUsed) {
        this.tokensUsed = tokensUsed;
    }
}

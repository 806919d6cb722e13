package com.e2eq.insights.testsupport;

import com.e2eq.insights.api.engine.AbstractReadOnlyAnalyticalEngine;
import com.e2eq.insights.model.analytics.QueryResult;
import com.e2eq.insights.sql.SyntaxGuard;

import java.util.ArrayList;
import java.util.List;

public class RecordingAnalyticalEngine extends AbstractReadOnlyAnalyticalEngine {

    private final List<String> executed = new ArrayList<>();
    private QueryResult result = QueryResult.builder().build();
    private long lastMaxBytesBilled;

    public RecordingAnalyticalEngine() {
        super(new SyntaxGuard());
    }

    public void setResult(QueryResult result) {
        this.result = result;
    }

    public List<String> getExecuted() {
        return executed;
    }

    public long getLastMaxBytesBilled() {
        return lastMaxBytesBilled;
    }

    @Override
    protected QueryResult doExecute(String sql, long maxBytesBilled) {
        executed.add(sql);
        lastMaxBytesBilled = maxBytesBilled;
        return result;
    }
}

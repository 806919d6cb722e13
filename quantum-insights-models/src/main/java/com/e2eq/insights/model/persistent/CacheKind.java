package com.e2eq.insights.model.persistent;

/** Kinds of cached artifacts. */
public enum CacheKind {
    /** Rows returned by the analytical engine for one SQL statement. */
    QUERY_RESULT,
    /** A complete answer to a question. */
    RESPONSE
}

package com.e2eq.insights.security;

/**
 * Permission tags checked by the insights pipeline.
 */
public final class Permissions {

    /** Required before any data question reaches a collaborator. */
    public static final String QUERY_EXECUTE = "query:execute";

    /** Invalidate cached entries of every identity for a table. */
    public static final String CACHE_ADMIN = "cache:admin";

    private Permissions() {
    }
}

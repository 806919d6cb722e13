package com.e2eq.insights.model.security;

/** Where a permission bundle came from. */
public enum PermissionSource {
    BACKEND,
    CACHE,
    /** Backend unreachable; a cached bundle within the grace window was served. */
    STALE_CACHE,
    /** Backend unreachable and nothing usable cached; the bundle grants nothing. */
    FAIL_CLOSED
}

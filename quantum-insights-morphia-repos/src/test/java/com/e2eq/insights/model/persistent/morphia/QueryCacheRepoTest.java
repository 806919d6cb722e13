package com.e2eq.insights.model.persistent.morphia;

import com.e2eq.insights.model.persistent.CacheEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Owner checks run before the datastore is touched, so no database is needed here.
 */
@DisplayName("QueryCacheRepo owner checks")
class QueryCacheRepoTest {

    private final QueryCacheRepo repo = new QueryCacheRepo();

    @Test
    @DisplayName("save without owner fails loudly")
    void save_requiresOwner() {
        CacheEntry entry = new CacheEntry();
        entry.setCacheKey("k");
        assertThrows(IllegalArgumentException.class, () -> repo.save(entry));
    }

    @Test
    @DisplayName("every owner-scoped operation rejects a blank owner")
    void ownerScopedOperations_requireOwner() {
        assertThrows(IllegalArgumentException.class, () -> repo.find(null, "k"));
        assertThrows(IllegalArgumentException.class, () -> repo.find(" ", "k"));
        assertThrows(IllegalArgumentException.class, () -> repo.findByOwner(""));
        assertThrows(IllegalArgumentException.class, () -> repo.recordHit(null, "k", Instant.now()));
        assertThrows(IllegalArgumentException.class, () -> repo.deleteByOwner(null));
    }

    @Test
    void deleteByTable_blankIsNoop() {
        assertEquals(0, repo.deleteByTable(" "));
    }
}

package com.e2eq.insights.model.persistent.store;

import com.e2eq.insights.model.persistent.CacheEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for identity-owned cache entries. Every lookup takes the owning identity; there is
 * no way to find an entry by key alone.
 */
public interface CacheEntryStore {

    Optional<CacheEntry> find(String ownerId, String cacheKey);

    List<CacheEntry> findByOwner(String ownerId);

    /**
     * Inserts or replaces the entry with the same owner and key.
     */
    CacheEntry save(CacheEntry entry);

    /**
     * Increments the hit count of the owner's entry and stamps its last access.
     */
    void recordHit(String ownerId, String cacheKey, Instant at);

    boolean delete(String ownerId, String cacheKey);

    long deleteByOwner(String ownerId);

    /**
     * Deletes entries of every owner that were computed from the given {@code dataset.table}.
     */
    long deleteByTable(String qualifiedTable);

    long deleteExpired(Instant now);
}

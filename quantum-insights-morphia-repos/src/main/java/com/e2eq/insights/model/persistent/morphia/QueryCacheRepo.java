package com.e2eq.insights.model.persistent.morphia;

import com.e2eq.insights.model.persistent.CacheEntry;
import com.e2eq.insights.model.persistent.store.CacheEntryStore;
import com.mongodb.client.model.ReturnDocument;
import dev.morphia.DeleteOptions;
import dev.morphia.ModifyOptions;
import dev.morphia.query.Query;
import dev.morphia.query.filters.Filters;
import dev.morphia.query.updates.UpdateOperators;
import io.quarkus.arc.properties.UnlessBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB storage for identity-owned cache entries. Each query filters on {@code ownerId};
 * only {@link #deleteByTable} and {@link #deleteExpired} span owners, and neither returns entries.
 */
@ApplicationScoped
@UnlessBuildProperty(name = "quantum.insights.cache.store", stringValue = "memory", enableIfMissing = true)
public class QueryCacheRepo implements CacheEntryStore {

    @Inject
    MorphiaDataStore morphiaDataStore;

    private static String requireOwner(String ownerId) {
        if (StringUtils.isBlank(ownerId)) {
            throw new IllegalArgumentException("ownerId is required");
        }
        return ownerId;
    }

    private Query<CacheEntry> ownedBy(String ownerId, String cacheKey) {
        String owner = requireOwner(ownerId);
        return morphiaDataStore.getDataStore()
            .find(CacheEntry.class)
            .filter(Filters.eq("ownerId", owner), Filters.eq("cacheKey", cacheKey));
    }

    @Override
    public Optional<CacheEntry> find(String ownerId, String cacheKey) {
        return Optional.ofNullable(ownedBy(ownerId, cacheKey).first());
    }

    @Override
    public List<CacheEntry> findByOwner(String ownerId) {
        String owner = requireOwner(ownerId);
        return morphiaDataStore.getDataStore()
            .find(CacheEntry.class)
            .filter(Filters.eq("ownerId", owner))
            .iterator()
            .toList();
    }

    @Override
    public CacheEntry save(CacheEntry entry) {
        requireOwner(entry.getOwnerId());
        if (entry.getId() == null) {
            find(entry.getOwnerId(), entry.getCacheKey()).ifPresent(existing -> entry.setId(existing.getId()));
        }
        return morphiaDataStore.getDataStore().save(entry);
    }

    @Override
    public void recordHit(String ownerId, String cacheKey, Instant at) {
        ownedBy(ownerId, cacheKey)
            .modify(new ModifyOptions().returnDocument(ReturnDocument.AFTER),
                UpdateOperators.inc("hitCount"),
                UpdateOperators.set("lastAccessedAt", at));
    }

    @Override
    public boolean delete(String ownerId, String cacheKey) {
        return ownedBy(ownerId, cacheKey).delete().getDeletedCount() > 0;
    }

    @Override
    public long deleteByOwner(String ownerId) {
        String owner = requireOwner(ownerId);
        return morphiaDataStore.getDataStore()
            .find(CacheEntry.class)
            .filter(Filters.eq("ownerId", owner))
            .delete(new DeleteOptions().multi(true))
            .getDeletedCount();
    }

    @Override
    public long deleteByTable(String qualifiedTable) {
        if (StringUtils.isBlank(qualifiedTable)) {
            return 0;
        }
        return morphiaDataStore.getDataStore()
            .find(CacheEntry.class)
            .filter(Filters.eq("tables", qualifiedTable))
            .delete(new DeleteOptions().multi(true))
            .getDeletedCount();
    }

    @Override
    public long deleteExpired(Instant now) {
        return morphiaDataStore.getDataStore()
            .find(CacheEntry.class)
            .filter(Filters.lte("expiresAt", now))
            .delete(new DeleteOptions().multi(true))
            .getDeletedCount();
    }
}

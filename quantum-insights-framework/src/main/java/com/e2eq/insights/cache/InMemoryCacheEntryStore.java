package com.e2eq.insights.cache;

import com.e2eq.insights.model.persistent.CacheEntry;
import com.e2eq.insights.model.persistent.store.CacheEntryStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Process-local cache store, selected with {@code quantum.insights.cache.store=memory}.
 * Entries are keyed by owner and cache key together.
 */
@ApplicationScoped
@IfBuildProperty(name = "quantum.insights.cache.store", stringValue = "memory")
public class InMemoryCacheEntryStore implements CacheEntryStore {

    private final Map<OwnedKey, CacheEntry> entries = new ConcurrentHashMap<>();

    private static OwnedKey key(String ownerId, String cacheKey) {
        if (StringUtils.isBlank(ownerId)) {
            throw new IllegalArgumentException("ownerId is required");
        }
        return new OwnedKey(ownerId, cacheKey);
    }

    @Override
    public Optional<CacheEntry> find(String ownerId, String cacheKey) {
        return Optional.ofNullable(entries.get(key(ownerId, cacheKey)));
    }

    @Override
    public List<CacheEntry> findByOwner(String ownerId) {
        key(ownerId, null);
        return entries.values().stream()
            .filter(e -> ownerId.equals(e.getOwnerId()))
            .collect(Collectors.toList());
    }

    @Override
    public CacheEntry save(CacheEntry entry) {
        entries.put(key(entry.getOwnerId(), entry.getCacheKey()), entry);
        return entry;
    }

    @Override
    public void recordHit(String ownerId, String cacheKey, Instant at) {
        entries.computeIfPresent(key(ownerId, cacheKey), (k, e) -> {
            e.setHitCount(e.getHitCount() + 1);
            e.setLastAccessedAt(at);
            return e;
        });
    }

    @Override
    public boolean delete(String ownerId, String cacheKey) {
        return entries.remove(key(ownerId, cacheKey)) != null;
    }

    @Override
    public long deleteByOwner(String ownerId) {
        key(ownerId, null);
        return removeIf(e -> ownerId.equals(e.getOwnerId()));
    }

    @Override
    public long deleteByTable(String qualifiedTable) {
        return removeIf(e -> e.getTables() != null && e.getTables().contains(qualifiedTable));
    }

    @Override
    public long deleteExpired(Instant now) {
        return removeIf(e -> e.isExpired(now));
    }

    private long removeIf(Predicate<CacheEntry> predicate) {
        long removed = 0;
        for (Map.Entry<OwnedKey, CacheEntry> e : entries.entrySet()) {
            if (predicate.test(e.getValue()) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    private static final class OwnedKey {
        private final String ownerId;
        private final String cacheKey;

        OwnedKey(String ownerId, String cacheKey) {
            this.ownerId = ownerId;
            this.cacheKey = cacheKey;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof OwnedKey)) return false;
            OwnedKey that = (OwnedKey) o;
            return ownerId.equals(that.ownerId) && Objects.equals(cacheKey, that.cacheKey);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ownerId, cacheKey);
        }
    }
}

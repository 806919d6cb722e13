package com.e2eq.insights.cache;

import com.e2eq.insights.model.persistent.CacheEntry;
import com.e2eq.insights.model.persistent.CacheKind;
import com.e2eq.insights.model.persistent.store.CacheEntryStore;
import com.e2eq.insights.util.ExceptionLoggingUtils;
import com.e2eq.insights.util.HashingUtils;
import com.e2eq.insights.util.IdentifierUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Identity-scoped access to cached query results and responses.
 * <p>
 * Every write records the owning identity and every read filters by it. There is no read path
 * without an identity, privileged or otherwise. Expired entries are misses and are evicted when
 * encountered.
 */
@ApplicationScoped
public class CacheGateway {

    @Inject
    CacheEntryStore cacheEntryStore;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Clock clock;

    /**
     * SHA-256 key over the kind and the normalized parts (trimmed, lower-cased, whitespace collapsed).
     */
    public String keyFor(CacheKind kind, String... parts) {
        String[] normalized = new String[parts.length];
        for (int i = 0; i < parts.length; i++) {
            normalized[i] = parts[i] == null ? "" : StringUtils.normalizeSpace(parts[i]).toLowerCase(Locale.ROOT);
        }
        return HashingUtils.sha256Hex(kind.name(), normalized);
    }

    /**
     * Stores a payload owned by {@code ownerId}.
     *
     * @param tables {@code dataset.table} names the payload was computed from, used by {@link #invalidateTable}
     * @throws IllegalArgumentException when the owner or key is missing, or the payload cannot be serialized
     */
    public CacheEntry write(String ownerId, String key, CacheKind kind, Object payload, Duration ttl,
                            Collection<String> tables) {
        requireOwner(ownerId);
        if (StringUtils.isBlank(key)) {
            throw new IllegalArgumentException("Cache writes require a key");
        }
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry();
        entry.setOwnerId(ownerId);
        entry.setCacheKey(key);
        entry.setKind(kind);
        entry.setPayload(serialize(payload));
        entry.setTables(normalizeTables(tables));
        entry.setCreatedAt(now);
        entry.setExpiresAt(now.plus(ttl));
        entry.setHitCount(0);
        return cacheEntryStore.save(entry);
    }

    /**
     * Reads the caller's own entry. Another identity's entry under the same key is never returned.
     */
    public <T> Optional<T> read(String ownerId, String key, Class<T> type) {
        requireOwner(ownerId);
        Optional<CacheEntry> found = cacheEntryStore.find(ownerId, key);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        CacheEntry entry = found.get();
        if (!ownerId.equals(entry.getOwnerId())) {
            Log.warnf("Cache store returned an entry owned by another identity for key %s; ignoring", key);
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (entry.isExpired(now)) {
            evictQuietly(ownerId, key);
            return Optional.empty();
        }
        T value;
        try {
            value = objectMapper.readValue(entry.getPayload(), type);
        } catch (JsonProcessingException e) {
            ExceptionLoggingUtils.logWarn(e, "Unreadable cache entry %s for %s; evicting", key, ownerId);
            evictQuietly(ownerId, key);
            return Optional.empty();
        }
        try {
            cacheEntryStore.recordHit(ownerId, key, now);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logDebug(e, "Failed to record cache hit for %s", key);
        }
        return Optional.of(value);
    }

    /**
     * Administrative write of a prepared entry. The owner is still mandatory.
     */
    public CacheEntry administrativeWrite(CacheEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry is required");
        }
        requireOwner(entry.getOwnerId());
        if (StringUtils.isBlank(entry.getCacheKey()) || entry.getKind() == null || entry.getExpiresAt() == null) {
            throw new IllegalArgumentException("Administrative cache writes require key, kind and expiry");
        }
        if (entry.getCreatedAt() == null) {
            entry.setCreatedAt(clock.instant());
        }
        entry.setTables(normalizeTables(entry.getTables()));
        Log.infof("Administrative cache write for owner %s key %s", entry.getOwnerId(), entry.getCacheKey());
        return cacheEntryStore.save(entry);
    }

    /**
     * Drops every identity's entries computed from the table, e.g. after the table is reloaded.
     */
    public long invalidateTable(String datasetId, String tableId) {
        String dataset = IdentifierUtils.normalize(datasetId);
        String table = IdentifierUtils.normalize(tableId);
        if (dataset == null || table == null) {
            throw new IllegalArgumentException("dataset and table are required");
        }
        long removed = cacheEntryStore.deleteByTable(dataset + "." + table);
        Log.infof("Invalidated %d cache entries for table %s.%s", removed, dataset, table);
        return removed;
    }

    public long evictExpired() {
        return cacheEntryStore.deleteExpired(clock.instant());
    }

    public long clear(String ownerId) {
        requireOwner(ownerId);
        return cacheEntryStore.deleteByOwner(ownerId);
    }

    public CacheStats stats(String ownerId) {
        requireOwner(ownerId);
        Instant now = clock.instant();
        List<CacheEntry> entries = cacheEntryStore.findByOwner(ownerId);
        Map<CacheKind, Long> byKind = new EnumMap<>(CacheKind.class);
        long expired = 0;
        long hits = 0;
        for (CacheEntry entry : entries) {
            if (entry.isExpired(now)) {
                expired++;
            }
            hits += entry.getHitCount();
            if (entry.getKind() != null) {
                byKind.merge(entry.getKind(), 1L, Long::sum);
            }
        }
        return new CacheStats(entries.size(), expired, hits, byKind);
    }

    private static void requireOwner(String ownerId) {
        if (StringUtils.isBlank(ownerId)) {
            throw new IllegalArgumentException("Cache access requires an owning identity");
        }
    }

    private String serialize(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache payload cannot be serialized", e);
        }
    }

    private static List<String> normalizeTables(Collection<String> tables) {
        List<String> normalized = new ArrayList<>();
        if (tables != null) {
            for (String table : tables) {
                if (StringUtils.isNotBlank(table)) {
                    String value = table.strip().toLowerCase(Locale.ROOT);
                    if (!normalized.contains(value)) {
                        normalized.add(value);
                    }
                }
            }
        }
        return normalized;
    }

    private void evictQuietly(String ownerId, String key) {
        try {
            cacheEntryStore.delete(ownerId, key);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logDebug(e, "Failed to evict cache entry %s", key);
        }
    }
}

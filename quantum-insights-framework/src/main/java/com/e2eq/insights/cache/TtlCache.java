package com.e2eq.insights.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Concurrent key-value store that remembers when each value was stored. Freshness is decided by
 * the reader, so the same entry can be fresh for one window and still usable for a longer one.
 * Writes for a key replace the previous value atomically; no lock is held by callers.
 */
public class TtlCache<K, V> {

    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public TtlCache(Clock clock) {
        this.clock = clock;
    }

    public Optional<Entry<V>> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void put(K key, V value) {
        entries.put(key, new Entry<>(value, clock.instant()));
    }

    public void invalidate(K key) {
        entries.remove(key);
    }

    public void invalidateAll() {
        entries.clear();
    }

    /**
     * Drops entries stored at least {@code maxAge} ago.
     *
     * @return number of entries removed
     */
    public int evictOlderThan(Duration maxAge) {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.isFresh(now, maxAge));
        return Math.max(0, before - entries.size());
    }

    public int size() {
        return entries.size();
    }

    public static final class Entry<V> {
        private final V value;
        private final Instant storedAt;

        Entry(V value, Instant storedAt) {
            this.value = value;
            this.storedAt = storedAt;
        }

        public V getValue() {
            return value;
        }

        public Instant getStoredAt() {
            return storedAt;
        }

        public boolean isFresh(Instant now, Duration ttl) {
            return now.isBefore(storedAt.plus(ttl));
        }
    }
}

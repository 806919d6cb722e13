package com.e2eq.insights.model.persistent;

import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Field;
import dev.morphia.annotations.Id;
import dev.morphia.annotations.Index;
import dev.morphia.annotations.IndexOptions;
import dev.morphia.annotations.Indexed;
import dev.morphia.annotations.Indexes;
import io.quarkus.runtime.annotations.RegisterForReflection;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A memoized query result or response. Always owned by exactly one identity and only ever
 * returned to that identity.
 */
@RegisterForReflection
@Entity(value = "insightCacheEntries", useDiscriminator = false)
@Indexes({
    @Index(fields = {@Field("ownerId"), @Field("cacheKey")}, options = @IndexOptions(unique = true))
})
public class CacheEntry {

    @Id
    private ObjectId id;

    /** Identity that produced the entry. Required. */
    private String ownerId;

    /** SHA-256 of the normalized lookup parts. */
    private String cacheKey;

    private CacheKind kind;

    /** JSON payload. */
    private String payload;

    /** Tables the payload was computed from, as {@code dataset.table}. */
    @Indexed
    private List<String> tables = new ArrayList<>();

    private Instant createdAt;

    @Indexed
    private Instant expiresAt;

    private long hitCount;

    private Instant lastAccessedAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public ObjectId getId() {
        return id;
    }

    public void setId(ObjectId id) {
        this.id = id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public void setCacheKey(String cacheKey) {
        this.cacheKey = cacheKey;
    }

    public CacheKind getKind() {
        return kind;
    }

    public void setKind(CacheKind kind) {
        this.kind = kind;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public List<String> getTables() {
        return tables;
    }

    public void setTables(List<String> tables) {
        this.tables = tables != null ? tables : new ArrayList<>();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public long getHitCount() {
        return hitCount;
    }

    public void setHitCount(long hitCount) {
        this.hitCount = hitCount;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public void setLastAccessedAt(Instant lastAccessedAt) {
        this.lastAccessedAt = lastAccessedAt;
    }
}

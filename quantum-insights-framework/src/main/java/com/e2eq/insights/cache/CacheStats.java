package com.e2eq.insights.cache;

import com.e2eq.insights.model.persistent.CacheKind;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Cache usage of one identity.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class CacheStats {

    private long entries;

    private long expiredEntries;

    private long totalHits;

    private Map<CacheKind, Long> entriesByKind;
}

package com.e2eq.insights.cache;

import com.e2eq.insights.model.persistent.store.CacheEntryStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;

public final class CacheFixtures {

    private CacheFixtures() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
            .findAndRegisterModules()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static CacheGateway gateway(CacheEntryStore store, Clock clock) {
        CacheGateway gateway = new CacheGateway();
        gateway.cacheEntryStore = store;
        gateway.objectMapper = objectMapper();
        gateway.clock = clock;
        return gateway;
    }
}

package com.e2eq.insights.rest.resources;

import com.e2eq.insights.auth.jwt.JwtFixtures;
import com.e2eq.insights.auth.jwt.TokenUtils;
import com.e2eq.insights.cache.CacheFixtures;
import com.e2eq.insights.cache.InMemoryCacheEntryStore;
import com.e2eq.insights.exceptions.AuthenticationException;
import com.e2eq.insights.exceptions.AuthorizationException;
import com.e2eq.insights.model.persistent.CacheKind;
import com.e2eq.insights.model.usage.QuotaPeriod;
import com.e2eq.insights.quota.QuotaFixtures;
import com.e2eq.insights.rest.models.AskRequest;
import com.e2eq.insights.rest.models.InsightResponse;
import com.e2eq.insights.rest.models.QuotaStatus;
import com.e2eq.insights.rest.models.ResponseStatus;
import com.e2eq.insights.router.QueryRouter;
import com.e2eq.insights.security.Permissions;
import com.e2eq.insights.security.SecurityFixtures;
import com.e2eq.insights.testsupport.FakePermissionStore;
import com.e2eq.insights.testsupport.FakeUsageStore;
import com.e2eq.insights.testsupport.MutableClock;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InsightsResource unit tests")
class InsightsResourceTest {

    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");

    private MutableClock clock;
    private FakeUsageStore usage;
    private InMemoryCacheEntryStore cacheStore;
    private InsightsResource resource;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        FakePermissionStore permissions = new FakePermissionStore()
            .assign("alice", "analyst")
            .permit("analyst", Permissions.QUERY_EXECUTE)
            .grant("analyst", "sales", null)
            .assign("root", "admin")
            .permit("admin", Permissions.CACHE_ADMIN);
        usage = new FakeUsageStore();
        cacheStore = new InMemoryCacheEntryStore();

        resource = new InsightsResource();
        resource.accessContextFactory = SecurityFixtures.accessContextFactory(JwtFixtures.validator(clock),
            SecurityFixtures.permissionResolver(permissions, clock));
        resource.accessEnforcer = SecurityFixtures.accessEnforcer(clock);
        resource.quotaGuard = QuotaFixtures.guard(usage, clock, 1_000L, 10_000L);
        resource.cacheGateway = CacheFixtures.gateway(cacheStore, clock);
        resource.queryRouter = new QueryRouter() {
            @Override
            public InsightResponse ask(String authorization, AskRequest request) {
                return InsightResponse.builder()
                    .status(ResponseStatus.QUOTA_EXCEEDED)
                    .message("You have exceeded your daily token quota.")
                    .build();
            }
        };
    }

    private String bearer(String userId) {
        return "Bearer " + TokenUtils.generateAccessToken(userId, null, NOW, Duration.ofHours(1), JwtFixtures.SECRET);
    }

    @Test
    @DisplayName("ask maps the response status to the HTTP status")
    void ask_httpStatus() {
        Response response = resource.ask(bearer("alice"), new AskRequest("How many orders?", null));

        assertEquals(429, response.getStatus());
        assertEquals(ResponseStatus.QUOTA_EXCEEDED, ((InsightResponse) response.getEntity()).getStatus());
    }

    @Test
    @DisplayName("quota reports every period for the caller")
    void quota_perPeriod() {
        usage.seed("alice", QuotaPeriod.DAILY, NOW, 250L, null);

        List<QuotaStatus> statuses = resource.quota(bearer("alice"));

        assertEquals(2, statuses.size());
        assertEquals("daily", statuses.get(0).getPeriod());
        assertEquals(250L, statuses.get(0).getConsumed());
        assertEquals(750L, statuses.get(0).getRemaining());
        assertEquals("monthly", statuses.get(1).getPeriod());
    }

    @Test
    @DisplayName("clearing the cache removes only the caller's entries")
    void clearCache_ownEntriesOnly() {
        resource.cacheGateway.write("alice", "k1", CacheKind.RESPONSE, "a", Duration.ofHours(1), List.of());
        resource.cacheGateway.write("root", "k1", CacheKind.RESPONSE, "b", Duration.ofHours(1), List.of());

        assertEquals(1L, resource.clearCache(bearer("alice")).get("removed"));
        assertTrue(cacheStore.find("root", "k1").isPresent());
        assertEquals(0L, resource.cacheStats(bearer("alice")).getEntries());
    }

    @Test
    @DisplayName("table invalidation requires the cache admin permission")
    void invalidateTable_requiresAdmin() {
        resource.cacheGateway.write("alice", "k1", CacheKind.QUERY_RESULT, "a", Duration.ofHours(1),
            List.of("sales.orders"));

        assertThrows(AuthorizationException.class,
            () -> resource.invalidateTable(bearer("alice"), "sales", "orders"));
        assertEquals(1L, resource.invalidateTable(bearer("root"), "sales", "orders").get("removed"));
    }

    @Test
    @DisplayName("missing credentials are rejected")
    void missingToken() {
        assertThrows(AuthenticationException.class, () -> resource.quota(null));
    }
}

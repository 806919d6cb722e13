package com.e2eq.insights.security;

import com.e2eq.insights.exceptions.AuthenticationException;
import com.e2eq.insights.model.security.AccessContext;
import com.e2eq.insights.model.security.PermissionSource;
import com.e2eq.insights.model.security.TokenClaims;
import com.e2eq.insights.testsupport.FakePermissionStore;
import com.e2eq.insights.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AccessContextFactory unit tests")
class AccessContextFactoryTest {

    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");

    private FakePermissionStore store;
    private AccessContextFactory factory;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        store = new FakePermissionStore()
            .assign("alice", "analyst")
            .permit("analyst", Permissions.QUERY_EXECUTE)
            .grant("analyst", "sales", null);
        factory = new AccessContextFactory();
        factory.permissionResolver = SecurityFixtures.permissionResolver(store, clock);
    }

    @Test
    @DisplayName("context carries the resolved grants and the token expiry")
    void create_fromClaims() {
        TokenClaims claims = new TokenClaims("alice", "alice@example.com", NOW, NOW.plusSeconds(3600), Map.of());

        AccessContext context = factory.create(claims);

        assertEquals("alice", context.getUserId());
        assertTrue(context.hasPermission(Permissions.QUERY_EXECUTE));
        assertTrue(context.canAccessTable("sales", "anything"));
        assertEquals(NOW.plusSeconds(3600), context.getExpiresAt());
        assertEquals(PermissionSource.BACKEND, context.getSource());
    }

    @Test
    @DisplayName("permission store outage yields a context that grants nothing")
    void storeOutage_grantsNothing() {
        store.setFailing(true);
        TokenClaims claims = new TokenClaims("alice", null, NOW, NOW.plusSeconds(3600), Map.of());

        AccessContext context = factory.create(claims);

        assertFalse(context.hasPermission(Permissions.QUERY_EXECUTE));
        assertFalse(context.canAccessDataset("sales"));
    }

    @Test
    @DisplayName("invalid email claim is an authentication failure")
    void invalidEmail_rejected() {
        TokenClaims claims = new TokenClaims("alice", "not-an-email", NOW, NOW.plusSeconds(3600), Map.of());

        AuthenticationException e = assertThrows(AuthenticationException.class, () -> factory.create(claims));
        assertEquals(AuthenticationException.Reason.MALFORMED, e.getReason());
    }
}

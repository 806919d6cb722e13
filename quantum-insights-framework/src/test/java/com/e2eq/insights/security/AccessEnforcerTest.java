package com.e2eq.insights.security;

import com.e2eq.insights.exceptions.AuthenticationException;
import com.e2eq.insights.exceptions.AuthorizationException;
import com.e2eq.insights.model.security.AccessContext;
import com.e2eq.insights.model.security.AccessDecision;
import com.e2eq.insights.model.security.TableReference;
import com.e2eq.insights.testsupport.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AccessEnforcer unit tests")
class AccessEnforcerTest {

    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final AccessEnforcer enforcer = SecurityFixtures.accessEnforcer(clock);

    private static AccessContext.Builder analyst() {
        return new AccessContext.Builder()
            .withUserId("alice")
            .withPermission(Permissions.QUERY_EXECUTE)
            .withAllowedDatasets(Set.of("sales"))
            .withAllowedTables("sales", Set.of("orders"))
            .withExpiresAt(NOW.plus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("all references authorized yields ALLOW")
    void allAuthorized_allows() {
        AccessDecision decision = enforcer.evaluate(analyst().build(), Permissions.QUERY_EXECUTE,
            List.of(TableReference.of("p", "sales", "orders")));

        assertTrue(decision.isAllowed());
    }

    @Test
    @DisplayName("one unauthorized reference denies the whole statement")
    void oneBadReference_deniesAll() {
        List<TableReference> refs = List.of(
            TableReference.of("p", "sales", "orders"),
            TableReference.of("p", "hr", "salaries"));

        AccessDecision decision = enforcer.evaluate(analyst().build(), Permissions.QUERY_EXECUTE, refs);

        assertEquals(AccessDecision.Outcome.DENY_RESOURCE, decision.getOutcome());
        assertEquals(TableReference.of("p", "hr", "salaries"), decision.getDeniedReference());
    }

    @Test
    @DisplayName("denial message lists only the caller's own resources")
    void denialMessage_onlyOwnResources() {
        AuthorizationException e = assertThrows(AuthorizationException.class, () -> enforcer.enforce(
            analyst().build(), Permissions.QUERY_EXECUTE, List.of(TableReference.of(null, "hr", "salaries"))));

        assertTrue(e.getMessage().contains("sales.orders"));
        assertFalse(e.getMessage().contains("hr"));
        assertFalse(e.getMessage().contains("salaries"));
        assertEquals(List.of("sales.orders"), e.getAuthorizedResources());
    }

    @Test
    @DisplayName("permission is checked before references")
    void permissionCheckedFirst() {
        AccessContext noPermission = new AccessContext.Builder()
            .withUserId("bob")
            .withAllowedDatasets(Set.of("sales"))
            .build();

        AccessDecision decision = enforcer.evaluate(noPermission, Permissions.QUERY_EXECUTE,
            List.of(TableReference.of(null, "hr", "salaries")));

        assertEquals(AccessDecision.Outcome.DENY_PERMISSION, decision.getOutcome());
        AuthorizationException e = assertThrows(AuthorizationException.class,
            () -> enforcer.requirePermission(noPermission, Permissions.QUERY_EXECUTE));
        assertEquals(Permissions.QUERY_EXECUTE, e.getRequiredPermission());
    }

    @Test
    @DisplayName("unqualified reference without dataset is denied even with wildcard grants")
    void unqualifiedReference_denied() {
        AccessContext everything = analyst().withAllowedDatasets(Set.of("*")).build();

        AccessDecision decision = enforcer.evaluate(everything, Permissions.QUERY_EXECUTE,
            List.of(TableReference.of(null, null, "orders")));

        assertEquals(AccessDecision.Outcome.DENY_RESOURCE, decision.getOutcome());
    }

    @Test
    @DisplayName("expired context is rejected as an authentication failure")
    void expiredContext_rejected() {
        AccessContext context = analyst().build();
        clock.advance(Duration.ofHours(1));

        assertEquals(AccessDecision.Outcome.DENY_EXPIRED,
            enforcer.evaluate(context, Permissions.QUERY_EXECUTE, List.of()).getOutcome());
        AuthenticationException e = assertThrows(AuthenticationException.class,
            () -> enforcer.enforce(context, Permissions.QUERY_EXECUTE, List.of()));
        assertEquals(AuthenticationException.Reason.CONTEXT_EXPIRED, e.getReason());
    }
}

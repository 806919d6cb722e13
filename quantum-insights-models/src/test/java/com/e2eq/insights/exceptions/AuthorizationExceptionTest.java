package com.e2eq.insights.exceptions;

import com.e2eq.insights.rest.models.ResponseStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizationExceptionTest {

    @Test
    void resourceDenied_listsOnlyAuthorizedResources() {
        AuthorizationException ex = AuthorizationException.resourceDenied(List.of("sales.orders"));

        assertTrue(ex.getMessage().contains("sales.orders"));
        assertEquals(List.of("sales.orders"), ex.getAuthorizedResources());
        assertEquals(ResponseStatus.AUTHORIZATION_ERROR, ex.getStatus());
        assertNotNull(ex.getNextStep());
    }

    @Test
    void resourceDenied_withoutGrants() {
        AuthorizationException ex = AuthorizationException.resourceDenied(List.of());

        assertTrue(ex.getMessage().contains("no authorized datasets"));
    }

    @Test
    void missingPermission_namesThePermission() {
        AuthorizationException ex = AuthorizationException.missingPermission("query:execute");

        assertTrue(ex.getMessage().contains("query:execute"));
        assertEquals("query:execute", ex.getRequiredPermission());
    }

    @Test
    void upstreamClientErrorsAreNotRetryable() {
        assertFalse(UpstreamException.clientError("engine", 400).isRetryable());
        assertTrue(UpstreamException.serverError("engine", 503).isRetryable());
        assertTrue(UpstreamException.timeout("engine", null).isRetryable());
        assertFalse(UpstreamException.notConfigured("engine").isRetryable());
    }
}

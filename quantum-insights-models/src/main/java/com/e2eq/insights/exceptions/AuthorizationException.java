package com.e2eq.insights.exceptions;

import com.e2eq.insights.rest.models.ResponseStatus;

import java.util.List;

/**
 * Raised when a request is denied. The message only ever names resources the caller is
 * authorized for; it never names the resource that was denied.
 */
public class AuthorizationException extends InsightsException {
    private static final long serialVersionUID = 1L;

    private final String requiredPermission;
    private final List<String> authorizedResources;

    public AuthorizationException(String message, String nextStep, String requiredPermission,
                                  List<String> authorizedResources) {
        super(message, nextStep);
        this.requiredPermission = requiredPermission;
        this.authorizedResources = authorizedResources == null ? List.of() : List.copyOf(authorizedResources);
    }

    public static AuthorizationException missingPermission(String permission) {
        return new AuthorizationException(
            String.format("You do not have the '%s' permission required for this request.", permission),
            "Ask an administrator to grant the permission to one of your roles.",
            permission, List.of());
    }

    /**
     * Denial text naming only the caller's own authorized resources.
     */
    public static String resourceDeniedMessage(List<String> authorizedResources) {
        return authorizedResources == null || authorizedResources.isEmpty()
            ? "The request references data you are not authorized to access. You currently have no authorized datasets."
            : "The request references data you are not authorized to access. You are authorized for: "
                + String.join(", ", authorizedResources) + ".";
    }

    public static AuthorizationException resourceDenied(List<String> authorizedResources) {
        return new AuthorizationException(resourceDeniedMessage(authorizedResources),
            "Rephrase the question using the datasets you are authorized for, or request access from an administrator.",
            null, authorizedResources);
    }

    public String getRequiredPermission() {
        return requiredPermission;
    }

    public List<String> getAuthorizedResources() {
        return authorizedResources;
    }

    @Override
    public ResponseStatus getStatus() {
        return ResponseStatus.AUTHORIZATION_ERROR;
    }
}

package com.e2eq.insights.model.security;

import java.util.List;

/**
 * Result of enforcing a request against an {@link AccessContext}. The denied reference is kept
 * for operator logs only; {@link #getMessage()} never names it.
 */
public final class AccessDecision {

    public enum Outcome { ALLOW, DENY_EXPIRED, DENY_PERMISSION, DENY_RESOURCE }

    private final Outcome outcome;
    private final String requiredPermission;
    private final List<TableReference> references;
    private final TableReference deniedReference;
    private final String message;

    private AccessDecision(Outcome outcome, String requiredPermission, List<TableReference> references,
                           TableReference deniedReference, String message) {
        this.outcome = outcome;
        this.requiredPermission = requiredPermission;
        this.references = references == null ? List.of() : List.copyOf(references);
        this.deniedReference = deniedReference;
        this.message = message;
    }

    public static AccessDecision allow(String permission, List<TableReference> references) {
        return new AccessDecision(Outcome.ALLOW, permission, references, null, "Authorized");
    }

    public static AccessDecision expired(String permission) {
        return new AccessDecision(Outcome.DENY_EXPIRED, permission, null, null, "Access context has expired");
    }

    public static AccessDecision missingPermission(String permission, String message) {
        return new AccessDecision(Outcome.DENY_PERMISSION, permission, null, null, message);
    }

    public static AccessDecision resourceDenied(String permission, List<TableReference> references,
                                                TableReference denied, String message) {
        return new AccessDecision(Outcome.DENY_RESOURCE, permission, references, denied, message);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOW;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getRequiredPermission() {
        return requiredPermission;
    }

    public List<TableReference> getReferences() {
        return references;
    }

    public TableReference getDeniedReference() {
        return deniedReference;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "AccessDecision{" + outcome + ", permission=" + requiredPermission + '}';
    }
}

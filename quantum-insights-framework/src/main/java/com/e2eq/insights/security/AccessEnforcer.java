package com.e2eq.insights.security;

import com.e2eq.insights.exceptions.AuthenticationException;
import com.e2eq.insights.exceptions.AuthorizationException;
import com.e2eq.insights.model.security.AccessContext;
import com.e2eq.insights.model.security.AccessDecision;
import com.e2eq.insights.model.security.TableReference;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.util.List;

/**
 * Checks a request against an {@link AccessContext}: the context must not be expired, the
 * required permission must be present, and every table reference must be authorized. A single
 * unauthorized reference denies the whole statement.
 */
@ApplicationScoped
public class AccessEnforcer {

    @Inject
    Clock clock;

    public AccessDecision evaluate(AccessContext context, String permission, List<TableReference> references) {
        if (context.isExpired(clock.instant())) {
            return AccessDecision.expired(permission);
        }
        if (!context.hasPermission(permission)) {
            return AccessDecision.missingPermission(permission,
                AuthorizationException.missingPermission(permission).getMessage());
        }
        List<TableReference> refs = references == null ? List.of() : references;
        for (TableReference reference : refs) {
            if (!context.canAccess(reference)) {
                return AccessDecision.resourceDenied(permission, refs, reference,
                    AuthorizationException.resourceDeniedMessage(context.authorizedResources()));
            }
        }
        return AccessDecision.allow(permission, refs);
    }

    /**
     * Same as {@link #evaluate} but throws on anything other than ALLOW.
     *
     * @throws AuthenticationException when the context has expired
     * @throws AuthorizationException  when the permission or a referenced table is not granted
     */
    public AccessDecision enforce(AccessContext context, String permission, List<TableReference> references) {
        AccessDecision decision = evaluate(context, permission, references);
        switch (decision.getOutcome()) {
            case ALLOW:
                return decision;
            case DENY_EXPIRED:
                Log.infof("Denied user %s: access context expired", context.getUserId());
                throw new AuthenticationException(AuthenticationException.Reason.CONTEXT_EXPIRED);
            case DENY_PERMISSION:
                Log.infof("Denied user %s: missing permission %s", context.getUserId(), permission);
                throw AuthorizationException.missingPermission(permission);
            default:
                Log.infof("Denied user %s: unauthorized reference %s", context.getUserId(), decision.getDeniedReference());
                throw AuthorizationException.resourceDenied(context.authorizedResources());
        }
    }

    public AccessDecision requirePermission(AccessContext context, String permission) {
        return enforce(context, permission, List.of());
    }
}

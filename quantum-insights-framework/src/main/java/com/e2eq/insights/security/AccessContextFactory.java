package com.e2eq.insights.security;

import com.e2eq.insights.auth.jwt.TokenValidator;
import com.e2eq.insights.exceptions.AuthenticationException;
import com.e2eq.insights.model.security.AccessContext;
import com.e2eq.insights.model.security.PermissionBundle;
import com.e2eq.insights.model.security.TokenClaims;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Builds the {@link AccessContext} of a request from its bearer token and resolved permissions.
 * The context inherits the token's expiry.
 */
@ApplicationScoped
public class AccessContextFactory {

    @Inject
    TokenValidator tokenValidator;

    @Inject
    PermissionResolver permissionResolver;

    public AccessContext fromAuthorization(String authorization) {
        return create(tokenValidator.validate(authorization));
    }

    public AccessContext create(TokenClaims claims) {
        PermissionBundle bundle = permissionResolver.resolve(claims.getSubject());
        try {
            return new AccessContext.Builder()
                .withUserId(claims.getSubject())
                .withEmail(claims.getEmail())
                .withBundle(bundle)
                .withExpiresAt(claims.getExpiresAt())
                .build();
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException(AuthenticationException.Reason.MALFORMED, "Token claims are invalid", e);
        }
    }
}

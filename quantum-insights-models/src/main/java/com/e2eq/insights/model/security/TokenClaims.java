package com.e2eq.insights.model.security;

import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Claims of a verified bearer token. Created on validation and discarded at the end of the request.
 */
public final class TokenClaims {

    private final String subject;
    private final String email;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final Map<String, Object> claims;

    public TokenClaims(String subject, String email, Instant issuedAt, Instant expiresAt, Map<String, Object> claims) {
        this.subject = Objects.requireNonNull(subject, "subject");
        this.email = email;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        ImmutableMap.Builder<String, Object> copy = ImmutableMap.builder();
        if (claims != null) {
            claims.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        this.claims = copy.build();
    }

    public String getSubject() {
        return subject;
    }

    public String getEmail() {
        return email;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Map<String, Object> getClaims() {
        return claims;
    }

    @Override
    public String toString() {
        return "TokenClaims{subject='" + subject + "', expiresAt=" + expiresAt + '}';
    }
}

package com.e2eq.insights.auth.jwt;

import io.smallrye.jwt.algorithm.SignatureAlgorithm;
import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtClaimsBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Mints HS256 access tokens accepted by {@link TokenValidator}. Used by administrative tooling.
 */
public class TokenUtils {

    private TokenUtils() {
    }

    public static String generateAccessToken(String userId, String email, Instant issuedAt, Duration lifetime, String secret) {
        Objects.requireNonNull(userId, "userId cannot be null");
        Objects.requireNonNull(issuedAt, "issuedAt cannot be null");
        Objects.requireNonNull(lifetime, "lifetime cannot be null");
        Objects.requireNonNull(secret, "secret cannot be null");

        JwtClaimsBuilder claimsBuilder = Jwt.claims();
        claimsBuilder.subject(userId);
        claimsBuilder.issuedAt(issuedAt.getEpochSecond());
        claimsBuilder.expiresAt(issuedAt.plus(lifetime).getEpochSecond());
        if (email != null) {
            claimsBuilder.claim(TokenValidator.EMAIL_CLAIM, email);
        }
        return claimsBuilder.jws().algorithm(SignatureAlgorithm.HS256).signWithSecret(secret);
    }

    public static String generateAccessToken(String userId, String email, Duration lifetime, String secret) {
        return generateAccessToken(userId, email, Instant.now(), lifetime, secret);
    }
}

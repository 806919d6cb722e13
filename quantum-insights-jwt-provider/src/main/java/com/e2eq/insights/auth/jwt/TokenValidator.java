package com.e2eq.insights.auth.jwt;

import com.e2eq.insights.exceptions.AuthenticationException;
import com.e2eq.insights.exceptions.AuthenticationException.Reason;
import com.e2eq.insights.model.security.TokenClaims;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

/**
 * Verifies HS256 bearer tokens and extracts their claims. Pure: no state beyond configuration.
 */
@ApplicationScoped
public class TokenValidator {

    public static final String BEARER_PREFIX = "Bearer ";
    public static final String EMAIL_CLAIM = "email";

    /** HS256 needs a key of at least 256 bits. */
    static final int MIN_SECRET_BYTES = 32;

    @ConfigProperty(name = "quantum.insights.auth.jwt-secret")
    String jwtSecret;

    @ConfigProperty(name = "quantum.insights.auth.clock-skew-seconds", defaultValue = "30")
    int clockSkewSeconds;

    @Inject
    Clock clock;

    /**
     * Validates a token, with or without the {@code Bearer } prefix.
     *
     * @throws AuthenticationException when the token is missing, malformed, expired, signed with another
     *                                 key or carries no subject
     */
    public TokenClaims validate(String authorization) {
        String token = stripBearer(authorization);
        if (StringUtils.isBlank(token)) {
            throw new AuthenticationException(Reason.MISSING);
        }

        JwtClaims claims;
        try {
            claims = consumer().processToClaims(token);
        } catch (InvalidJwtException e) {
            Reason reason = reasonFor(e);
            Log.debugf("Token rejected: %s", reason);
            throw new AuthenticationException(reason, reason.getDefaultMessage(), e);
        }

        try {
            String subject = claims.getSubject();
            if (StringUtils.isBlank(subject)) {
                throw new AuthenticationException(Reason.MISSING_SUBJECT);
            }
            String email = claims.getClaimValue(EMAIL_CLAIM, String.class);
            NumericDate iat = claims.getIssuedAt();
            NumericDate exp = claims.getExpirationTime();
            return new TokenClaims(subject, email,
                iat != null ? Instant.ofEpochSecond(iat.getValue()) : null,
                exp != null ? Instant.ofEpochSecond(exp.getValue()) : null,
                claims.getClaimsMap());
        } catch (MalformedClaimException e) {
            throw new AuthenticationException(Reason.MALFORMED, Reason.MALFORMED.getDefaultMessage(), e);
        }
    }

    static String stripBearer(String authorization) {
        if (authorization == null) {
            return null;
        }
        String value = authorization.strip();
        int scheme = BEARER_PREFIX.length() - 1;
        if (value.regionMatches(true, 0, BEARER_PREFIX, 0, scheme)
            && (value.length() == scheme || Character.isWhitespace(value.charAt(scheme)))) {
            value = value.substring(scheme).strip();
        }
        return value;
    }

    static Reason reasonFor(InvalidJwtException e) {
        if (e.hasExpired()) {
            return Reason.EXPIRED;
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return Reason.SIGNATURE_MISMATCH;
        }
        if (e.hasErrorCode(ErrorCodes.SUBJECT_MISSING)) {
            return Reason.MISSING_SUBJECT;
        }
        return Reason.MALFORMED;
    }

    private JwtConsumer consumer() {
        if (jwtSecret == null || jwtSecret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("quantum.insights.auth.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        Clock now = clock != null ? clock : Clock.systemUTC();
        return new JwtConsumerBuilder()
            .setRequireExpirationTime()
            .setRequireSubject()
            .setAllowedClockSkewInSeconds(clockSkewSeconds)
            .setEvaluationTime(NumericDate.fromMilliseconds(now.millis()))
            .setSkipDefaultAudienceValidation()
            .setVerificationKey(new HmacKey(jwtSecret.getBytes(StandardCharsets.UTF_8)))
            .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
            .build();
    }
}

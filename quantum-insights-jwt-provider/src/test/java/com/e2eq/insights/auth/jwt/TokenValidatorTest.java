package com.e2eq.insights.auth.jwt;

import com.e2eq.insights.exceptions.AuthenticationException;
import com.e2eq.insights.model.security.TokenClaims;
import com.e2eq.insights.rest.models.ResponseStatus;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.keys.HmacKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TokenValidator unit tests")
class TokenValidatorTest {

    private static final String SECRET = "unit-test-secret-0123456789-abcdefghijklmnop";
    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");

    private TokenValidator validator;

    @BeforeEach
    void setUp() {
        validator = new TokenValidator();
        validator.jwtSecret = SECRET;
        validator.clockSkewSeconds = 0;
        validator.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private static String sign(JwtClaims claims, String secret) throws Exception {
        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        jws.setKey(new HmacKey(secret.getBytes(StandardCharsets.UTF_8)));
        return jws.getCompactSerialization();
    }

    @Test
    @DisplayName("valid token yields subject, email and expiry")
    void validToken() {
        String token = TokenUtils.generateAccessToken("user-42", "analyst@example.com", NOW.minusSeconds(60),
            Duration.ofHours(1), SECRET);

        TokenClaims claims = validator.validate("Bearer " + token);

        assertEquals("user-42", claims.getSubject());
        assertEquals("analyst@example.com", claims.getEmail());
        assertEquals(NOW.minusSeconds(60).plus(Duration.ofHours(1)), claims.getExpiresAt());
        assertEquals(NOW.minusSeconds(60), claims.getIssuedAt());
    }

    @Test
    @DisplayName("bearer prefix is optional")
    void withoutPrefix() {
        String token = TokenUtils.generateAccessToken("user-42", null, NOW, Duration.ofMinutes(5), SECRET);

        assertEquals("user-42", validator.validate(token).getSubject());
        assertNull(validator.validate(token).getEmail());
    }

    @Test
    @DisplayName("expired token is rejected as EXPIRED")
    void expiredToken() {
        String token = TokenUtils.generateAccessToken("user-42", null, NOW.minus(Duration.ofHours(2)),
            Duration.ofHours(1), SECRET);

        AuthenticationException ex = assertThrows(AuthenticationException.class, () -> validator.validate(token));
        assertEquals(AuthenticationException.Reason.EXPIRED, ex.getReason());
        assertEquals("Token has expired", ex.getMessage());
        assertEquals(ResponseStatus.AUTHENTICATION_ERROR, ex.getStatus());
    }

    @Test
    @DisplayName("token signed with another key is a signature mismatch")
    void wrongKey() throws Exception {
        JwtClaims claims = new JwtClaims();
        claims.setSubject("user-42");
        claims.setExpirationTime(NumericDate.fromSeconds(NOW.plusSeconds(600).getEpochSecond()));
        String token = sign(claims, "another-secret-that-is-long-enough-0123456789");

        AuthenticationException ex = assertThrows(AuthenticationException.class, () -> validator.validate(token));
        assertEquals(AuthenticationException.Reason.SIGNATURE_MISMATCH, ex.getReason());
    }

    @Test
    @DisplayName("token without subject is rejected")
    void missingSubject() throws Exception {
        JwtClaims claims = new JwtClaims();
        claims.setExpirationTime(NumericDate.fromSeconds(NOW.plusSeconds(600).getEpochSecond()));
        claims.setClaim("email", "analyst@example.com");
        String token = sign(claims, SECRET);

        AuthenticationException ex = assertThrows(AuthenticationException.class, () -> validator.validate(token));
        assertEquals(AuthenticationException.Reason.MISSING_SUBJECT, ex.getReason());
    }

    @Test
    @DisplayName("missing and malformed tokens are rejected")
    void missingAndMalformed() {
        assertEquals(AuthenticationException.Reason.MISSING,
            assertThrows(AuthenticationException.class, () -> validator.validate(null)).getReason());
        assertEquals(AuthenticationException.Reason.MISSING,
            assertThrows(AuthenticationException.class, () -> validator.validate("Bearer   ")).getReason());
        assertEquals(AuthenticationException.Reason.MALFORMED,
            assertThrows(AuthenticationException.class, () -> validator.validate("not.a.jwt")).getReason());
    }

    @Test
    @DisplayName("short secret is a configuration error")
    void shortSecret() {
        validator.jwtSecret = "short";
        assertThrows(IllegalStateException.class, () -> validator.validate("abc.def.ghi"));
    }
}

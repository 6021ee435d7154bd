package com.example.storeauth.util;

import com.example.storeauth.config.JwtProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JwtUtilTest {

    private static final String ACCESS_KEY =
        "Kq7vZ3mW9xR2pL5nB8cF1hJ4tY6uE0sD3gA9wQ2zX7vN5mK8bH1jR4pL6nC9fT2yU5eI8oS1dG3hJ7kZ";
    private static final String REFRESH_KEY =
        "Wm4nQ8rT2yV6bN9cX3zL7kJ1hG5fD0sA4pO8iU2eR6tY9wM3qB7vC1xZ5nK8jH2gF6dS9aL4kP7oI3uE";
    private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");

    private JwtProperties properties;
    private JwtUtil jwtUtil;

    @BeforeEach
    void setUp() {
        properties = new JwtProperties();
        properties.setAccessToken(new JwtProperties.TokenSettings(ACCESS_KEY, Duration.ofMinutes(15)));
        properties.setRefreshToken(new JwtProperties.TokenSettings(REFRESH_KEY, Duration.ofDays(1)));
        jwtUtil = codecAt(NOW);
    }

    private JwtUtil codecAt(Instant instant) {
        JwtUtil codec = new JwtUtil(properties, Clock.fixed(instant, ZoneOffset.UTC));
        codec.init();
        return codec;
    }

    @Test
    void testAccessTokenRoundTrip() {
        // When
        String token = jwtUtil.generateAccessToken("42");
        Optional<TokenClaims> claims = jwtUtil.verifyAccessToken(token);

        // Then
        assertTrue(claims.isPresent());
        assertEquals("42", claims.get().getUserId());
        assertNotNull(claims.get().getTokenId());
        assertEquals(NOW, claims.get().getIssuedAt());
        assertEquals(NOW.plus(Duration.ofMinutes(15)), claims.get().getExpiresAt());
    }

    @Test
    void testRefreshTokenUsesItsOwnLifetime() {
        String token = jwtUtil.generateRefreshToken("42");

        Optional<TokenClaims> claims = jwtUtil.verifyRefreshToken(token);

        assertTrue(claims.isPresent());
        assertEquals(NOW.plus(Duration.ofDays(1)), claims.get().getExpiresAt());
    }

    @Test
    void testTokensAreNotInterchangeable() {
        String accessToken = jwtUtil.generateAccessToken("42");
        String refreshToken = jwtUtil.generateRefreshToken("42");

        assertTrue(jwtUtil.verifyRefreshToken(accessToken).isEmpty());
        assertTrue(jwtUtil.verifyAccessToken(refreshToken).isEmpty());
    }

    @Test
    void testTokensForSameUserAreDistinct() {
        String first = jwtUtil.generateAccessToken("42");
        String second = jwtUtil.generateAccessToken("42");

        assertNotEquals(first, second);
    }

    @Test
    void testExpiredAccessTokenIsRejected() {
        // Given
        String token = jwtUtil.generateAccessToken("42");

        // When
        JwtUtil later = codecAt(NOW.plus(Duration.ofMinutes(16)));

        // Then
        assertTrue(later.verifyAccessToken(token).isEmpty());
        assertTrue(codecAt(NOW.plus(Duration.ofMinutes(14))).verifyAccessToken(token).isPresent());
    }

    @Test
    void testTamperedTokenIsRejected() {
        String token = jwtUtil.generateAccessToken("42");
        String[] parts = token.split("\\.");
        String tampered = parts[0] + "." + parts[1] + "." + new StringBuilder(parts[2]).reverse();

        assertTrue(jwtUtil.verifyAccessToken(tampered).isEmpty());
    }

    @Test
    void testGarbageIsRejected() {
        assertTrue(jwtUtil.verifyAccessToken("invalid.jwt.token").isEmpty());
        assertTrue(jwtUtil.verifyAccessToken("").isEmpty());
        assertTrue(jwtUtil.verifyRefreshToken(null).isEmpty());
    }

    @Test
    void testTokenFromAnotherIssuerIsRejected() {
        String token = jwtUtil.generateAccessToken("42");

        properties.setIssuer("another-service");
        JwtUtil otherIssuer = codecAt(NOW);

        assertTrue(otherIssuer.verifyAccessToken(token).isEmpty());
    }

    @Test
    void testMissingSecretFailsInitialisation() {
        properties.setRefreshToken(new JwtProperties.TokenSettings(null, Duration.ofDays(1)));
        JwtUtil codec = new JwtUtil(properties, Clock.systemUTC());

        IllegalStateException e = assertThrows(IllegalStateException.class, codec::init);
        assertTrue(e.getMessage().contains("jwt.refresh-token.secret"));
    }
}

package com.example.storeauth.util;

import com.example.storeauth.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies the signed tokens of a session.
 *
 * <p>Access and refresh tokens are signed with distinct keys and carry a {@code tokenType}
 * claim, so one can never be accepted in place of the other. Verification fails closed:
 * a bad signature, a malformed token, a wrong type or an expired token all yield
 * {@link Optional#empty()}.
 */
@Slf4j
@Component
@DependsOn("secretValidator")
public class JwtUtil {

    private static final String TOKEN_TYPE_CLAIM = "tokenType";
    private static final String TOKEN_ID_CLAIM = "tokenId";
    private static final String ACCESS_TOKEN_TYPE = "ACCESS";
    private static final String REFRESH_TOKEN_TYPE = "REFRESH";

    private final JwtProperties properties;
    private final Clock clock;

    private SecretKey accessKey;
    private SecretKey refreshKey;

    public JwtUtil(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        this.accessKey = toKey(properties.getAccessToken().getSecret(), "jwt.access-token.secret");
        this.refreshKey = toKey(properties.getRefreshToken().getSecret(), "jwt.refresh-token.secret");
    }

    public String generateAccessToken(String userId) {
        return createToken(userId, ACCESS_TOKEN_TYPE, accessKey, properties.getAccessToken().getExpiration());
    }

    public String generateRefreshToken(String userId) {
        return createToken(userId, REFRESH_TOKEN_TYPE, refreshKey, properties.getRefreshToken().getExpiration());
    }

    public Optional<TokenClaims> verifyAccessToken(String token) {
        return verify(token, accessKey, ACCESS_TOKEN_TYPE);
    }

    public Optional<TokenClaims> verifyRefreshToken(String token) {
        return verify(token, refreshKey, REFRESH_TOKEN_TYPE);
    }

    public Duration getAccessTokenExpiration() {
        return properties.getAccessToken().getExpiration();
    }

    public Duration getRefreshTokenExpiration() {
        return properties.getRefreshToken().getExpiration();
    }

    private String createToken(String subject, String tokenType, SecretKey key, Duration expiration) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(TOKEN_TYPE_CLAIM, tokenType);
        claims.put(TOKEN_ID_CLAIM, UUID.randomUUID().toString());

        Instant now = clock.instant();
        return Jwts.builder()
            .claims(claims)
            .subject(subject)
            .issuer(properties.getIssuer())
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plus(expiration)))
            .signWith(key, Jwts.SIG.HS512)
            .compact();
    }

    private Optional<TokenClaims> verify(String token, SecretKey key, String expectedType) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(properties.getIssuer())
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();

            if (!expectedType.equals(claims.get(TOKEN_TYPE_CLAIM, String.class)) || claims.getSubject() == null) {
                log.debug("JWT rejected: unexpected token type or missing subject");
                return Optional.empty();
            }

            return Optional.of(new TokenClaims(
                claims.getSubject(),
                claims.get(TOKEN_ID_CLAIM, String.class),
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant()
            ));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("JWT validation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static SecretKey toKey(String secret, String propertyName) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException(propertyName + " is not set");
        }
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}

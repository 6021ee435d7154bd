package com.example.storeauth.util;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;

/**
 * Generates the email-verification and password-reset tokens.
 */
@Component
@RequiredArgsConstructor
public class OneTimeTokenGenerator {

    private static final int TOKEN_BYTES = 32;

    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public OneTimeToken generate(Duration ttl) {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        String rawToken = HexFormat.of().formatHex(bytes);
        return new OneTimeToken(rawToken, hash(rawToken), clock.instant().plus(ttl));
    }

    /**
     * SHA-256 of the raw token, hex encoded. Deterministic, so a presented token can be looked up.
     */
    public String hash(String rawToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(rawToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}

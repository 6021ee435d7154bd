package com.example.storeauth.util;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class OneTimeTokenGeneratorTest {

    private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");

    private final OneTimeTokenGenerator generator =
        new OneTimeTokenGenerator(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void testGenerateProducesHexTokenAndMatchingHash() {
        OneTimeToken token = generator.generate(Duration.ofHours(24));

        assertTrue(token.getRawToken().matches("[0-9a-f]{64}"));
        assertEquals(generator.hash(token.getRawToken()), token.getTokenHash());
        assertNotEquals(token.getRawToken(), token.getTokenHash());
        assertEquals(NOW.plus(Duration.ofHours(24)), token.getExpiresAt());
    }

    @Test
    void testGeneratedTokensAreUnique() {
        assertNotEquals(generator.generate(Duration.ofHours(1)).getRawToken(),
            generator.generate(Duration.ofHours(1)).getRawToken());
    }

    @Test
    void testHashIsSha256Hex() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", generator.hash("abc"));
    }

    @Test
    void testToStringDoesNotLeakRawToken() {
        OneTimeToken token = generator.generate(Duration.ofHours(1));

        assertFalse(token.toString().contains(token.getRawToken()));
        assertFalse(token.toString().contains(token.getTokenHash()));
    }
}

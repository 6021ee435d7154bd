package com.example.storeauth.util;

import lombok.Value;

import java.time.Instant;

/**
 * Verified content of an access or refresh token.
 */
@Value
public class TokenClaims {
    String userId;
    String tokenId;
    Instant issuedAt;
    Instant expiresAt;
}

package com.example.storeauth.util;

import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * A freshly issued single-use token. Only {@code tokenHash} and {@code expiresAt} are stored;
 * {@code rawToken} is handed to the user once and then forgotten.
 */
@Value
@ToString(onlyExplicitlyIncluded = true)
public class OneTimeToken {
    String rawToken;
    String tokenHash;
    @ToString.Include
    Instant expiresAt;
}

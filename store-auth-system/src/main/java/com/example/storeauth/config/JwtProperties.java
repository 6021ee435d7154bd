package com.example.storeauth.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Signing configuration for access and refresh tokens.
 *
 * Bound once at startup and read by {@link com.example.storeauth.util.JwtUtil} when it builds its keys.
 * The two secrets must differ; {@link SecretValidator} checks them before the codec is initialised.
 */
@Data
@ConfigurationProperties(prefix = "jwt")
public class JwtProperties {

    private String issuer = "store-auth-system";

    private TokenSettings accessToken = new TokenSettings(null, Duration.ofMinutes(15));

    private TokenSettings refreshToken = new TokenSettings(null, Duration.ofDays(1));

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TokenSettings {
        private String secret;
        private Duration expiration;
    }
}

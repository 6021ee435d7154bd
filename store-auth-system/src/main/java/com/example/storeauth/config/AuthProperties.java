package com.example.storeauth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Account and session policy.
 */
@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    /** Base URL used to build the links sent by email. */
    private String clientUrl = "http://localhost:3500";

    private Duration verificationTokenTtl = Duration.ofHours(24);

    private Duration passwordResetTokenTtl = Duration.ofHours(1);

    private Session session = new Session();

    private Cookie cookie = new Cookie();

    private LoginRateLimit loginRateLimit = new LoginRateLimit();

    @Data
    public static class Session {
        /** Clear the stored refresh token when a mismatching one is presented. */
        private boolean revokeOnReuse = false;
        /** Clear the stored refresh token when the password is reset. */
        private boolean revokeOnPasswordReset = false;
    }

    /**
     * Refresh-token cookie. {@code secure=true} also switches SameSite from Lax to None.
     * The max age follows {@code jwt.refresh-token.expiration}.
     */
    @Data
    public static class Cookie {
        private String name = "jwt";
        private boolean secure = false;
    }

    @Data
    public static class LoginRateLimit {
        private boolean enabled = true;
        private int maxAttempts = 5;
        private Duration window = Duration.ofMinutes(15);
    }
}

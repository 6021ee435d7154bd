package com.example.storeauth.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Validates critical secrets while the context starts.
 * Missing, weak or default signing secrets abort startup instead of surfacing on the first request.
 */
@Component("secretValidator")
public class SecretValidator {

    private static final Logger logger = LoggerFactory.getLogger(SecretValidator.class);

    private static final int MIN_SECRET_LENGTH = 64;
    private static final int MIN_DATABASE_PASSWORD_LENGTH = 12;

    // Insecure patterns that should not appear in secrets
    private static final List<String> INSECURE_PATTERNS = Arrays.asList(
            "CHANGE", "change",
            "SECRET", "secret",
            "PLEASE", "please",
            "PASSWORD", "password",
            "EXAMPLE", "example",
            "TEST", "test",
            "TEMP", "temp",
            "DEFAULT", "default",
            "123456", "qwerty",
            "admin", "ADMIN"
    );

    private static final List<String> WEAK_DATABASE_PASSWORDS = Arrays.asList(
            "postgres", "password", "admin", "root", "123456",
            "store123", "postgres123", "admin123"
    );

    private final JwtProperties jwtProperties;
    private final String databasePassword;

    public SecretValidator(JwtProperties jwtProperties,
                           @Value("${spring.datasource.password:}") String databasePassword) {
        this.jwtProperties = jwtProperties;
        this.databasePassword = databasePassword;
    }

    @PostConstruct
    public void validate() {
        logger.info("Validating critical secrets...");
        try {
            String accessSecret = jwtProperties.getAccessToken().getSecret();
            String refreshSecret = jwtProperties.getRefreshToken().getSecret();
            validateJwtSecret("JWT_ACCESS_SECRET", accessSecret);
            validateJwtSecret("JWT_REFRESH_SECRET", refreshSecret);
            if (accessSecret.equals(refreshSecret)) {
                throw new IllegalStateException(
                        "JWT_ACCESS_SECRET and JWT_REFRESH_SECRET must be different. " +
                                "Generate two secrets: openssl rand -base64 64"
                );
            }
            validateDatabasePassword();
            logger.info("All secrets validated successfully");
        } catch (IllegalStateException e) {
            logger.error("Secret validation failed: {}", e.getMessage());
            throw e;
        }
    }

    private void validateJwtSecret(String name, String secret) {
        if (secret == null || secret.trim().isEmpty()) {
            throw new IllegalStateException(
                    name + " is not set! " +
                            "Set it in application.yml or as an environment variable. " +
                            "Generate a secure secret: openssl rand -base64 64"
            );
        }

        // 64 characters for a 512-bit HS512 key
        if (secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(
                    String.format(
                            "%s is too short (%d characters). Minimum %d characters required. " +
                                    "Generate a secure secret: openssl rand -base64 64",
                            name, secret.length(), MIN_SECRET_LENGTH
                    )
            );
        }

        for (String pattern : INSECURE_PATTERNS) {
            if (secret.contains(pattern)) {
                throw new IllegalStateException(
                        String.format(
                                "%s contains insecure pattern '%s'. " +
                                        "This appears to be a default or placeholder value. " +
                                        "Generate a secure secret: openssl rand -base64 64",
                                name, pattern
                        )
                );
            }
        }

        logger.info("{} validated (length: {} characters)", name, secret.length());
    }

    private void validateDatabasePassword() {
        if (databasePassword == null || databasePassword.trim().isEmpty()) {
            logger.warn("DATABASE_PASSWORD is not set or empty");
            return; // May be using an embedded database without password
        }

        if (databasePassword.length() < MIN_DATABASE_PASSWORD_LENGTH) {
            throw new IllegalStateException(
                    String.format(
                            "DATABASE_PASSWORD is too short (%d characters). Minimum %d characters required. " +
                                    "Generate a secure password: openssl rand -base64 24",
                            databasePassword.length(), MIN_DATABASE_PASSWORD_LENGTH
                    )
            );
        }

        if (WEAK_DATABASE_PASSWORDS.contains(databasePassword.toLowerCase())) {
            throw new IllegalStateException(
                    "DATABASE_PASSWORD is a common weak password. " +
                            "Use a strong password. " +
                            "Generate: openssl rand -base64 24"
            );
        }

        logger.info("Database password validated (length: {} characters)", databasePassword.length());
    }
}

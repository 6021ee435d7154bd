package com.example.storeauth.notification;

/**
 * Out-of-band channel carrying one-time tokens to the account owner.
 *
 * Implementations throw {@link NotificationException} when delivery fails.
 */
public interface NotificationSink {

    void sendVerificationEmail(String email, String rawToken);

    void sendPasswordResetEmail(String email, String rawToken);
}

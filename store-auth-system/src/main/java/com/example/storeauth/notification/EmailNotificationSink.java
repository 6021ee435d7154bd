package com.example.storeauth.notification;

import com.example.storeauth.config.AuthProperties;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmailNotificationSink implements NotificationSink {

    private static final String VERIFY_PATH = "/api/v1/auth/verify-email?token=";
    private static final String RESET_PATH = "/api/v1/auth/reset-password?token=";

    private final JavaMailSender mailSender;
    private final AuthProperties authProperties;

    @Value("${mail.from:noreply@store.local}")
    private String from;

    @Override
    public void sendVerificationEmail(String email, String rawToken) {
        String link = authProperties.getClientUrl() + VERIFY_PATH + rawToken;
        send(email, "Verify Your Email",
            "<p>Click here to verify your email: <a href=\"" + link + "\">Verify Email</a></p>");
    }

    @Override
    public void sendPasswordResetEmail(String email, String rawToken) {
        String link = authProperties.getClientUrl() + RESET_PATH + rawToken;
        send(email, "Reset Your Password",
            "<p>Click here to reset your password: <a href=\"" + link + "\">Reset Password</a></p>"
                + "<p>The link expires in " + authProperties.getPasswordResetTokenTtl().toMinutes() + " minutes.</p>");
    }

    private void send(String to, String subject, String html) {
        try {
            log.debug("email.send to={} subject={}", to, subject);
            MimeMessage msg = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(msg, true, "UTF-8");
            helper.setFrom(from);
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(html, true);
            mailSender.send(msg);
            log.info("email.send.success to={} subject={}", to, subject);
        } catch (Exception e) {
            log.error("email.send.failed to={} subject={} error={}", to, subject, e.toString());
            throw new NotificationException("Failed to send email", e);
        }
    }
}

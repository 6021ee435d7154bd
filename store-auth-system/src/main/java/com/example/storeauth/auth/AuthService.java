package com.example.storeauth.auth;

import com.example.storeauth.config.AuthProperties;
import com.example.storeauth.dto.RegisterResponse;
import com.example.storeauth.dto.SafeUser;
import com.example.storeauth.exception.AccountDisabledException;
import com.example.storeauth.exception.AccountNotVerifiedException;
import com.example.storeauth.exception.ConflictException;
import com.example.storeauth.exception.InvalidCredentialsException;
import com.example.storeauth.exception.InvalidOrExpiredTokenException;
import com.example.storeauth.notification.NotificationException;
import com.example.storeauth.notification.NotificationSink;
import com.example.storeauth.service.SessionTokens;
import com.example.storeauth.service.TokenService;
import com.example.storeauth.user.Role;
import com.example.storeauth.user.User;
import com.example.storeauth.user.UserRepository;
import com.example.storeauth.util.OneTimeToken;
import com.example.storeauth.util.OneTimeTokenGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Account lifecycle: registration, email verification, login and password reset.
 * Session issue, refresh and logout are delegated to {@link TokenService}.
 */
@Slf4j
@Service
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final OneTimeTokenGenerator oneTimeTokenGenerator;
    private final NotificationSink notificationSink;
    private final AuthProperties authProperties;
    private final Clock clock;

    // Compared against when the identifier is unknown, so both failures cost one BCrypt round
    private final String dummyPasswordHash;

    public AuthService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder,
                       TokenService tokenService,
                       OneTimeTokenGenerator oneTimeTokenGenerator,
                       NotificationSink notificationSink,
                       AuthProperties authProperties,
                       Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.oneTimeTokenGenerator = oneTimeTokenGenerator;
        this.notificationSink = notificationSink;
        this.authProperties = authProperties;
        this.clock = clock;
        this.dummyPasswordHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    @Transactional
    public RegisterResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.getEmail());
        String username = request.getUsername().trim();

        if (userRepository.existsByEmailOrUsername(email, username)) {
            throw new ConflictException();
        }

        OneTimeToken verification = oneTimeTokenGenerator.generate(authProperties.getVerificationTokenTtl());

        User user = User.builder()
            .email(email)
            .username(username)
            .passwordHash(passwordEncoder.encode(request.getPassword()))
            .role(Role.USER)
            .verified(false)
            .active(true)
            .build();
        user.setEmailVerificationToken(verification.getTokenHash(), verification.getExpiresAt());

        User savedUser = userRepository.save(user);
        log.info("New user registered: {} (id={})", savedUser.getUsername(), savedUser.getId());

        notifySafely(() -> notificationSink.sendVerificationEmail(email, verification.getRawToken()),
            "verification", savedUser.getId());

        return RegisterResponse.builder()
            .id(savedUser.getId())
            .username(savedUser.getUsername())
            .email(savedUser.getEmail())
            .build();
    }

    /**
     * Issues a fresh verification token. Unknown and already verified addresses are ignored.
     */
    @Transactional
    public void resendVerification(String rawEmail) {
        String email = normalizeEmail(rawEmail);
        Optional<User> found = userRepository.findByEmail(email);
        if (found.isEmpty() || Boolean.TRUE.equals(found.get().getVerified())) {
            log.debug("Resend verification ignored for unknown or verified address");
            return;
        }

        User user = found.get();
        OneTimeToken verification = oneTimeTokenGenerator.generate(authProperties.getVerificationTokenTtl());
        user.setEmailVerificationToken(verification.getTokenHash(), verification.getExpiresAt());
        userRepository.save(user);

        notifySafely(() -> notificationSink.sendVerificationEmail(email, verification.getRawToken()),
            "verification", user.getId());
    }

    @Transactional
    public void verifyEmail(String rawToken) {
        User user = userRepository
            .findByEmailVerificationTokenHashAndEmailVerificationExpiresAtAfter(
                oneTimeTokenGenerator.hash(rawToken), clock.instant())
            .orElseThrow(InvalidOrExpiredTokenException::new);

        user.setVerified(true);
        user.clearEmailVerificationToken();
        userRepository.save(user);

        log.info("Email verified for user: {}", user.getId());
    }

    @Transactional
    public LoginResult login(LoginRequest request) {
        String identifier = request.getIdentifier().trim();
        Optional<User> found = userRepository.findByEmailOrUsername(identifier.toLowerCase(Locale.ROOT), identifier);

        if (found.isEmpty()) {
            passwordEncoder.matches(request.getPassword(), dummyPasswordHash);
            log.warn("Login failed: unknown identifier");
            throw new InvalidCredentialsException();
        }

        User user = found.get();
        if (!passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            log.warn("Login failed: wrong password for user: {}", user.getId());
            throw new InvalidCredentialsException();
        }
        if (!Boolean.TRUE.equals(user.getVerified())) {
            log.warn("Login refused: email not verified for user: {}", user.getId());
            throw new AccountNotVerifiedException();
        }
        if (!Boolean.TRUE.equals(user.getActive())) {
            log.warn("Login refused: account disabled for user: {}", user.getId());
            throw new AccountDisabledException();
        }

        SessionTokens tokens = tokenService.openSession(user);
        log.info("User logged in: {}", user.getId());

        return new LoginResult(SafeUser.from(user), tokens.getAccessToken(), tokens.getRefreshToken());
    }

    /**
     * Issues a password reset token. Unknown addresses are ignored.
     */
    @Transactional
    public void forgotPassword(String rawEmail) {
        String email = normalizeEmail(rawEmail);
        Optional<User> found = userRepository.findByEmail(email);
        if (found.isEmpty()) {
            log.debug("Password reset requested for unknown address");
            return;
        }

        User user = found.get();
        OneTimeToken reset = oneTimeTokenGenerator.generate(authProperties.getPasswordResetTokenTtl());
        user.setPasswordResetToken(reset.getTokenHash(), reset.getExpiresAt());
        userRepository.save(user);
        log.info("Password reset requested for user: {}", user.getId());

        notifySafely(() -> notificationSink.sendPasswordResetEmail(email, reset.getRawToken()),
            "password reset", user.getId());
    }

    @Transactional
    public void resetPassword(ResetPasswordRequest request) {
        User user = userRepository
            .findByPasswordResetTokenHashAndPasswordResetExpiresAtAfter(
                oneTimeTokenGenerator.hash(request.getToken()), clock.instant())
            .orElseThrow(InvalidOrExpiredTokenException::new);

        user.setPasswordHash(passwordEncoder.encode(request.getNewPassword()));
        user.clearPasswordResetToken();
        if (authProperties.getSession().isRevokeOnPasswordReset()) {
            user.setRefreshToken(null);
        }
        userRepository.save(user);

        log.info("Password reset for user: {}", user.getId());
    }

    public String refresh(String presentedRefreshToken) {
        return tokenService.refreshAccessToken(presentedRefreshToken);
    }

    public void logout(String presentedRefreshToken) {
        tokenService.closeSession(presentedRefreshToken);
    }

    private void notifySafely(Runnable dispatch, String kind, Long userId) {
        try {
            dispatch.run();
        } catch (NotificationException e) {
            // State stays committed; the user can ask for another email
            log.error("Failed to send {} email to user: {}", kind, userId, e);
        }
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}

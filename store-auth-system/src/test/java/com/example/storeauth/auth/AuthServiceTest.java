package com.example.storeauth.auth;

import com.example.storeauth.config.AuthProperties;
import com.example.storeauth.dto.RegisterResponse;
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
import com.example.storeauth.util.OneTimeTokenGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");
    private static final String PASSWORD = "Str0ng!Pass";

    private UserRepository userRepository;
    private PasswordEncoder passwordEncoder;
    private TokenService tokenService;
    private NotificationSink notificationSink;
    private AuthProperties authProperties;
    private OneTimeTokenGenerator oneTimeTokenGenerator;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        passwordEncoder = new BCryptPasswordEncoder(4);
        tokenService = mock(TokenService.class);
        notificationSink = mock(NotificationSink.class);
        authProperties = new AuthProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        oneTimeTokenGenerator = new OneTimeTokenGenerator(clock);

        authService = new AuthService(userRepository, passwordEncoder, tokenService,
            oneTimeTokenGenerator, notificationSink, authProperties, clock);

        when(userRepository.save(any(User.class))).thenAnswer(invocation -> {
            User saved = invocation.getArgument(0);
            if (saved.getId() == null) {
                saved.setId(1L);
            }
            return saved;
        });
    }

    private User verifiedUser() {
        return User.builder()
            .id(1L)
            .username("john_doe")
            .email("john@example.com")
            .passwordHash(passwordEncoder.encode(PASSWORD))
            .verified(true)
            .active(true)
            .build();
    }

    @Test
    void testRegisterCreatesUnverifiedUserAndSendsVerification() {
        // Given
        RegisterRequest request = new RegisterRequest("  John@Example.com ", "john_doe", PASSWORD);
        when(userRepository.existsByEmailOrUsername("john@example.com", "john_doe")).thenReturn(false);

        // When
        RegisterResponse response = authService.register(request);

        // Then
        ArgumentCaptor<User> userCaptor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(userCaptor.capture());
        User saved = userCaptor.getValue();
        assertEquals("john@example.com", saved.getEmail());
        assertEquals(Role.USER, saved.getRole());
        assertFalse(saved.getVerified());
        assertTrue(saved.getActive());
        assertNotEquals(PASSWORD, saved.getPasswordHash());
        assertTrue(passwordEncoder.matches(PASSWORD, saved.getPasswordHash()));
        assertEquals(NOW.plus(Duration.ofHours(24)), saved.getEmailVerificationExpiresAt());

        ArgumentCaptor<String> tokenCaptor = ArgumentCaptor.forClass(String.class);
        verify(notificationSink).sendVerificationEmail(eq("john@example.com"), tokenCaptor.capture());
        assertEquals(oneTimeTokenGenerator.hash(tokenCaptor.getValue()), saved.getEmailVerificationTokenHash());

        assertEquals(1L, response.getId());
        assertEquals("john_doe", response.getUsername());
        assertEquals("john@example.com", response.getEmail());
    }

    @Test
    void testRegisterWithTakenEmailOrUsernameConflicts() {
        when(userRepository.existsByEmailOrUsername("john@example.com", "john_doe")).thenReturn(true);

        ConflictException e = assertThrows(ConflictException.class,
            () -> authService.register(new RegisterRequest("john@example.com", "john_doe", PASSWORD)));

        assertEquals("User already exists", e.getMessage());
        verify(userRepository, never()).save(any(User.class));
        verifyNoInteractions(notificationSink);
    }

    @Test
    void testRegisterSurvivesNotificationFailure() {
        doThrow(new NotificationException("smtp down"))
            .when(notificationSink).sendVerificationEmail(anyString(), anyString());

        RegisterResponse response = authService.register(new RegisterRequest("john@example.com", "john_doe", PASSWORD));

        assertEquals(1L, response.getId());
        verify(userRepository).save(any(User.class));
    }

    @Test
    void testResendVerificationIgnoresUnknownAndVerifiedAddresses() {
        when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());
        when(userRepository.findByEmail("john@example.com")).thenReturn(Optional.of(verifiedUser()));

        authService.resendVerification("ghost@example.com");
        authService.resendVerification("john@example.com");

        verifyNoInteractions(notificationSink);
    }

    @Test
    void testResendVerificationReplacesToken() {
        User user = verifiedUser();
        user.setVerified(false);
        user.setEmailVerificationToken("old-hash", NOW.plusSeconds(10));
        when(userRepository.findByEmail("john@example.com")).thenReturn(Optional.of(user));

        authService.resendVerification("JOHN@example.com");

        ArgumentCaptor<String> tokenCaptor = ArgumentCaptor.forClass(String.class);
        verify(notificationSink).sendVerificationEmail(eq("john@example.com"), tokenCaptor.capture());
        assertEquals(oneTimeTokenGenerator.hash(tokenCaptor.getValue()), user.getEmailVerificationTokenHash());
        assertEquals(NOW.plus(Duration.ofHours(24)), user.getEmailVerificationExpiresAt());
    }

    @Test
    void testVerifyEmailMarksUserVerifiedAndClearsToken() {
        // Given
        User user = verifiedUser();
        user.setVerified(false);
        user.setEmailVerificationToken(oneTimeTokenGenerator.hash("raw"), NOW.plusSeconds(60));
        when(userRepository.findByEmailVerificationTokenHashAndEmailVerificationExpiresAtAfter(
            oneTimeTokenGenerator.hash("raw"), NOW)).thenReturn(Optional.of(user));

        // When
        authService.verifyEmail("raw");

        // Then
        assertTrue(user.getVerified());
        assertNull(user.getEmailVerificationTokenHash());
        assertNull(user.getEmailVerificationExpiresAt());
    }

    @Test
    void testVerifyEmailWithUnknownTokenFails() {
        when(userRepository.findByEmailVerificationTokenHashAndEmailVerificationExpiresAtAfter(anyString(), eq(NOW)))
            .thenReturn(Optional.empty());

        InvalidOrExpiredTokenException e = assertThrows(InvalidOrExpiredTokenException.class,
            () -> authService.verifyEmail("unknown"));
        assertEquals("Invalid or expired token", e.getMessage());
    }

    @Test
    void testLoginOpensSession() {
        User user = verifiedUser();
        when(userRepository.findByEmailOrUsername("john@example.com", "john@example.com")).thenReturn(Optional.of(user));
        when(tokenService.openSession(user)).thenReturn(new SessionTokens("access", "refresh"));

        LoginResult result = authService.login(new LoginRequest("john@example.com", PASSWORD));

        assertEquals("access", result.getAccessToken());
        assertEquals("refresh", result.getRefreshToken());
        assertEquals(1L, result.getUser().getId());
        assertEquals("john_doe", result.getUser().getUsername());
        assertEquals(Role.USER, result.getUser().getRole());
    }

    @Test
    void testLoginByUsername() {
        User user = verifiedUser();
        when(userRepository.findByEmailOrUsername("john_doe", "john_doe")).thenReturn(Optional.of(user));
        when(tokenService.openSession(user)).thenReturn(new SessionTokens("access", "refresh"));

        assertEquals("access", authService.login(new LoginRequest("john_doe", PASSWORD)).getAccessToken());
    }

    @Test
    void testUnknownIdentifierAndWrongPasswordLookTheSame() {
        // Given
        when(userRepository.findByEmailOrUsername("ghost@example.com", "ghost@example.com")).thenReturn(Optional.empty());
        when(userRepository.findByEmailOrUsername("john@example.com", "john@example.com"))
            .thenReturn(Optional.of(verifiedUser()));

        // When
        InvalidCredentialsException unknown = assertThrows(InvalidCredentialsException.class,
            () -> authService.login(new LoginRequest("ghost@example.com", PASSWORD)));
        InvalidCredentialsException wrongPassword = assertThrows(InvalidCredentialsException.class,
            () -> authService.login(new LoginRequest("john@example.com", "Wr0ng!Pass")));

        // Then
        assertEquals("Invalid credentials", unknown.getMessage());
        assertEquals(unknown.getMessage(), wrongPassword.getMessage());
        assertEquals(unknown.getStatus(), wrongPassword.getStatus());
        verifyNoInteractions(tokenService);
    }

    @Test
    void testLoginRequiresVerifiedEmail() {
        User user = verifiedUser();
        user.setVerified(false);
        when(userRepository.findByEmailOrUsername(anyString(), anyString())).thenReturn(Optional.of(user));

        AccountNotVerifiedException e = assertThrows(AccountNotVerifiedException.class,
            () -> authService.login(new LoginRequest("john@example.com", PASSWORD)));
        assertEquals("Please verify your email", e.getMessage());
        verifyNoInteractions(tokenService);
    }

    @Test
    void testLoginRejectsDisabledAccount() {
        User user = verifiedUser();
        user.setActive(false);
        when(userRepository.findByEmailOrUsername(anyString(), anyString())).thenReturn(Optional.of(user));

        AccountDisabledException e = assertThrows(AccountDisabledException.class,
            () -> authService.login(new LoginRequest("john@example.com", PASSWORD)));
        assertEquals("Account is disabled", e.getMessage());
    }

    @Test
    void testForgotPasswordIgnoresUnknownAddress() {
        when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        authService.forgotPassword("ghost@example.com");

        verifyNoInteractions(notificationSink);
    }

    @Test
    void testForgotPasswordIssuesResetToken() {
        User user = verifiedUser();
        when(userRepository.findByEmail("john@example.com")).thenReturn(Optional.of(user));

        authService.forgotPassword("john@example.com");

        ArgumentCaptor<String> tokenCaptor = ArgumentCaptor.forClass(String.class);
        verify(notificationSink).sendPasswordResetEmail(eq("john@example.com"), tokenCaptor.capture());
        assertEquals(oneTimeTokenGenerator.hash(tokenCaptor.getValue()), user.getPasswordResetTokenHash());
        assertEquals(NOW.plus(Duration.ofHours(1)), user.getPasswordResetExpiresAt());
    }

    @Test
    void testResetPasswordKeepsSessionByDefault() {
        // Given
        User user = verifiedUser();
        user.setRefreshToken("refresh");
        user.setPasswordResetToken(oneTimeTokenGenerator.hash("raw"), NOW.plusSeconds(60));
        when(userRepository.findByPasswordResetTokenHashAndPasswordResetExpiresAtAfter(
            oneTimeTokenGenerator.hash("raw"), NOW)).thenReturn(Optional.of(user));

        // When
        authService.resetPassword(new ResetPasswordRequest("raw", "N3w!Passw0rd"));

        // Then
        assertTrue(passwordEncoder.matches("N3w!Passw0rd", user.getPasswordHash()));
        assertNull(user.getPasswordResetTokenHash());
        assertNull(user.getPasswordResetExpiresAt());
        assertEquals("refresh", user.getRefreshToken());
    }

    @Test
    void testResetPasswordEndsSessionWhenConfigured() {
        authProperties.getSession().setRevokeOnPasswordReset(true);
        User user = verifiedUser();
        user.setRefreshToken("refresh");
        when(userRepository.findByPasswordResetTokenHashAndPasswordResetExpiresAtAfter(anyString(), eq(NOW)))
            .thenReturn(Optional.of(user));

        authService.resetPassword(new ResetPasswordRequest("raw", "N3w!Passw0rd"));

        assertNull(user.getRefreshToken());
    }

    @Test
    void testResetPasswordWithExpiredTokenFails() {
        when(userRepository.findByPasswordResetTokenHashAndPasswordResetExpiresAtAfter(anyString(), eq(NOW)))
            .thenReturn(Optional.empty());

        assertThrows(InvalidOrExpiredTokenException.class,
            () -> authService.resetPassword(new ResetPasswordRequest("raw", "N3w!Passw0rd")));
    }
}

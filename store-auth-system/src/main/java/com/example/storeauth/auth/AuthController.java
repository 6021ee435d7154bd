package com.example.storeauth.auth;

import com.example.storeauth.dto.RegisterResponse;
import com.example.storeauth.dto.TokenResponse;
import com.example.storeauth.exception.BadRequestException;
import com.example.storeauth.service.LoginRateLimiter;
import com.example.storeauth.util.JwtUtil;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Tag(name = "Auth", description = "Registration, login and session API")
public class AuthController {

    static final String VERIFICATION_SENT_MESSAGE =
        "If an unverified account exists for this email, a verification link has been sent.";
    static final String RESET_SENT_MESSAGE =
        "If an account exists for this email, a password reset link has been sent.";

    private static final String REFRESH_COOKIE = "${auth.cookie.name:jwt}";

    private final AuthService authService;
    private final LoginRateLimiter loginRateLimiter;
    private final RefreshTokenCookieFactory cookieFactory;
    private final JwtUtil jwtUtil;

    @Operation(summary = "Register", description = "Creates an unverified account and sends a verification email.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Account created",
            content = @Content(mediaType = "application/json",
                examples = @ExampleObject(value = "{\"success\":true,\"message\":\"User registered successfully. Please check your email to verify your account.\",\"data\":{\"id\":1,\"username\":\"john_doe\",\"email\":\"john@example.com\"}}"))),
        @ApiResponse(responseCode = "400", description = "Validation failed"),
        @ApiResponse(responseCode = "409", description = "Email or username already taken",
            content = @Content(mediaType = "application/json",
                examples = @ExampleObject(value = "{\"success\":false,\"error\":\"Conflict\",\"message\":\"User already exists\"}")))
    })
    @PostMapping("/register")
    public ResponseEntity<Map<String, Object>> register(
        @Parameter(description = "Registration data", required = true)
        @Valid @RequestBody RegisterRequest request) {
        RegisterResponse user = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(success("User registered successfully. Please check your email to verify your account.", user));
    }

    @Operation(summary = "Resend verification email")
    @ApiResponse(responseCode = "200", description = "Always answered, whether or not the account exists")
    @PostMapping("/resend-verification")
    public ResponseEntity<Map<String, Object>> resendVerification(@Valid @RequestBody EmailRequest request) {
        authService.resendVerification(request.getEmail());
        return ResponseEntity.ok(success(VERIFICATION_SENT_MESSAGE, null));
    }

    @Operation(summary = "Verify email", description = "Consumes the token sent by email.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Email verified"),
        @ApiResponse(responseCode = "400", description = "Token missing, unknown or expired")
    })
    @GetMapping("/verify-email")
    public ResponseEntity<Map<String, Object>> verifyEmail(
        @Parameter(description = "Verification token")
        @RequestParam(value = "token", required = false) String token) {
        if (token == null || token.isBlank()) {
            throw new BadRequestException("Token is required");
        }
        authService.verifyEmail(token);
        return ResponseEntity.ok(success("Email verified successfully. You can now log in.", null));
    }

    @Operation(summary = "Login", description = "Logs in with email or username. The refresh token is set as an HttpOnly cookie.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Logged in",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = TokenResponse.class))),
        @ApiResponse(responseCode = "401", description = "Invalid credentials"),
        @ApiResponse(responseCode = "403", description = "Email not verified or account disabled"),
        @ApiResponse(responseCode = "429", description = "Too many login attempts")
    })
    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(
        @Parameter(description = "Login data", required = true)
        @Valid @RequestBody LoginRequest request,
        HttpServletRequest httpRequest) {
        loginRateLimiter.checkAndRecord(httpRequest.getRemoteAddr());

        LoginResult result = authService.login(request);
        TokenResponse body = TokenResponse.builder()
            .user(result.getUser())
            .accessToken(result.getAccessToken())
            .tokenType("Bearer")
            .accessTokenExpiresIn(jwtUtil.getAccessTokenExpiration().toSeconds())
            .build();

        return ResponseEntity.ok()
            .header(HttpHeaders.SET_COOKIE, cookieFactory.create(result.getRefreshToken()).toString())
            .body(success("Login successful", body));
    }

    @Operation(summary = "Forgot password")
    @ApiResponse(responseCode = "200", description = "Always answered, whether or not the account exists")
    @PostMapping("/forgot-password")
    public ResponseEntity<Map<String, Object>> forgotPassword(@Valid @RequestBody EmailRequest request) {
        authService.forgotPassword(request.getEmail());
        return ResponseEntity.ok(success(RESET_SENT_MESSAGE, null));
    }

    @Operation(summary = "Reset password", description = "Sets a new password using the token sent by email.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Password reset"),
        @ApiResponse(responseCode = "400", description = "Token unknown or expired, or weak password")
    })
    @PostMapping("/reset-password")
    public ResponseEntity<Map<String, Object>> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        authService.resetPassword(request);
        return ResponseEntity.ok(success("Password reset successfully. You can now log in.", null));
    }

    @Operation(summary = "Refresh access token", description = "Issues a new access token from the refresh token cookie.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "New access token",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = TokenResponse.class))),
        @ApiResponse(responseCode = "401", description = "No refresh token"),
        @ApiResponse(responseCode = "403", description = "Refresh token invalid, expired or no longer current")
    })
    @SecurityRequirement(name = "refreshCookie")
    @PostMapping("/refresh")
    public ResponseEntity<Map<String, Object>> refresh(
        @CookieValue(value = REFRESH_COOKIE, required = false) String refreshToken) {
        String accessToken = authService.refresh(refreshToken);
        TokenResponse body = TokenResponse.builder()
            .accessToken(accessToken)
            .tokenType("Bearer")
            .accessTokenExpiresIn(jwtUtil.getAccessTokenExpiration().toSeconds())
            .build();
        return ResponseEntity.ok(success("Token refreshed", body));
    }

    @Operation(summary = "Logout", description = "Ends the session and clears the refresh token cookie.")
    @ApiResponse(responseCode = "200", description = "Logged out")
    @SecurityRequirement(name = "refreshCookie")
    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout(
        @CookieValue(value = REFRESH_COOKIE, required = false) String refreshToken) {
        authService.logout(refreshToken);
        return ResponseEntity.ok()
            .header(HttpHeaders.SET_COOKIE, cookieFactory.clear().toString())
            .body(success("Logged out successfully", null));
    }

    private static Map<String, Object> success(String message, Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", message);
        if (data != null) {
            body.put("data", data);
        }
        return body;
    }
}

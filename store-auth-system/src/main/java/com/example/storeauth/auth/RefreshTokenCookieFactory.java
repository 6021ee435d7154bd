package com.example.storeauth.auth;

import com.example.storeauth.config.AuthProperties;
import com.example.storeauth.util.JwtUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds the HttpOnly cookie that carries the refresh token.
 * The cookie lives exactly as long as the refresh token it carries.
 */
@Component
@RequiredArgsConstructor
public class RefreshTokenCookieFactory {

    private final AuthProperties authProperties;
    private final JwtUtil jwtUtil;

    public ResponseCookie create(String refreshToken) {
        return build(refreshToken, jwtUtil.getRefreshTokenExpiration());
    }

    public ResponseCookie clear() {
        return build("", Duration.ZERO);
    }

    private ResponseCookie build(String value, Duration maxAge) {
        AuthProperties.Cookie settings = authProperties.getCookie();
        return ResponseCookie.from(settings.getName(), value)
            .httpOnly(true)
            .secure(settings.isSecure())
            .sameSite(settings.isSecure() ? "None" : "Lax")
            .path("/")
            .maxAge(maxAge)
            .build();
    }
}

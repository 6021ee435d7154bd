package com.example.storeauth.auth;

import com.example.storeauth.config.AuthProperties;
import com.example.storeauth.util.JwtUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseCookie;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RefreshTokenCookieFactoryTest {

    private AuthProperties authProperties;
    private JwtUtil jwtUtil;
    private RefreshTokenCookieFactory factory;

    @BeforeEach
    void setUp() {
        authProperties = new AuthProperties();
        jwtUtil = mock(JwtUtil.class);
        when(jwtUtil.getRefreshTokenExpiration()).thenReturn(Duration.ofDays(1));
        factory = new RefreshTokenCookieFactory(authProperties, jwtUtil);
    }

    @Test
    void testLocalCookieIsLax() {
        ResponseCookie cookie = factory.create("refresh");

        assertEquals("jwt", cookie.getName());
        assertEquals("refresh", cookie.getValue());
        assertTrue(cookie.isHttpOnly());
        assertFalse(cookie.isSecure());
        assertEquals("Lax", cookie.getSameSite());
        assertEquals("/", cookie.getPath());
        assertEquals(Duration.ofHours(24), cookie.getMaxAge());
    }

    @Test
    void testCookieMaxAgeFollowsRefreshTokenExpiration() {
        // Given
        when(jwtUtil.getRefreshTokenExpiration()).thenReturn(Duration.ofDays(7));

        // When
        ResponseCookie cookie = factory.create("refresh");

        // Then
        assertEquals(Duration.ofDays(7), cookie.getMaxAge());
        verify(jwtUtil).getRefreshTokenExpiration();
    }

    @Test
    void testSecureCookieAllowsCrossSite() {
        authProperties.getCookie().setSecure(true);

        ResponseCookie cookie = factory.create("refresh");

        assertTrue(cookie.isSecure());
        assertEquals("None", cookie.getSameSite());
    }

    @Test
    void testClearExpiresCookie() {
        ResponseCookie cookie = factory.clear();

        assertEquals("", cookie.getValue());
        assertEquals(Duration.ZERO, cookie.getMaxAge());
        verify(jwtUtil, never()).getRefreshTokenExpiration();
    }
}

package com.example.storeauth.service;

import com.example.storeauth.config.AuthProperties;
import com.example.storeauth.exception.ForbiddenException;
import com.example.storeauth.exception.UnauthorizedException;
import com.example.storeauth.user.User;
import com.example.storeauth.user.UserRepository;
import com.example.storeauth.util.JwtUtil;
import com.example.storeauth.util.TokenClaims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Opens, refreshes and closes sessions.
 *
 * <p>A user has at most one session: the refresh token stored on the user record. Opening a
 * session overwrites the stored token, which silently ends any previous session. A refresh
 * request is honoured only for the stored token; any other validly signed refresh token is a
 * replay of a superseded or stolen session and is rejected.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenService {

    static final String INVALID_REFRESH_TOKEN_MESSAGE = "Forbidden: Expired or Invalid Refresh Token";
    static final String REUSED_REFRESH_TOKEN_MESSAGE = "Forbidden: Invalid Token";

    private final JwtUtil jwtUtil;
    private final UserRepository userRepository;
    private final AuthProperties authProperties;

    @Transactional
    public SessionTokens openSession(User user) {
        String userId = user.getId().toString();
        String accessToken = jwtUtil.generateAccessToken(userId);
        String refreshToken = jwtUtil.generateRefreshToken(userId);

        // Last writer wins: a concurrent login for the same user replaces this one
        user.setRefreshToken(refreshToken);
        userRepository.save(user);

        log.info("Opened session for user: {}", userId);
        return new SessionTokens(accessToken, refreshToken);
    }

    /**
     * Exchanges the current refresh token for a new access token. The refresh token itself is not rotated.
     */
    @Transactional(noRollbackFor = ForbiddenException.class)
    public String refreshAccessToken(String presentedRefreshToken) {
        if (presentedRefreshToken == null || presentedRefreshToken.isBlank()) {
            throw new UnauthorizedException();
        }

        TokenClaims claims = jwtUtil.verifyRefreshToken(presentedRefreshToken)
            .orElseThrow(() -> new ForbiddenException(INVALID_REFRESH_TOKEN_MESSAGE));

        User user = findUser(claims.getUserId())
            .filter(User::getActive)
            .orElseThrow(UnauthorizedException::new);

        if (!presentedRefreshToken.equals(user.getRefreshToken())) {
            log.warn("Refresh token does not match the current session. Possible token reuse for user: {}",
                user.getId());
            if (authProperties.getSession().isRevokeOnReuse() && user.getRefreshToken() != null) {
                userRepository.clearRefreshTokenIfCurrent(user.getId(), user.getRefreshToken());
                log.warn("Revoked current session of user: {} after token reuse", user.getId());
            }
            throw new ForbiddenException(REUSED_REFRESH_TOKEN_MESSAGE);
        }

        String accessToken = jwtUtil.generateAccessToken(user.getId().toString());
        log.info("Refreshed access token for user: {}", user.getId());
        return accessToken;
    }

    @Transactional
    public void closeSession(String presentedRefreshToken) {
        if (presentedRefreshToken == null || presentedRefreshToken.isBlank()) {
            return;
        }

        int closed = userRepository.clearRefreshToken(presentedRefreshToken);
        if (closed > 0) {
            log.info("Closed session");
        } else {
            log.debug("Logout with a refresh token that is not current, nothing to close");
        }
    }

    private Optional<User> findUser(String userId) {
        try {
            return userRepository.findById(Long.valueOf(userId));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}

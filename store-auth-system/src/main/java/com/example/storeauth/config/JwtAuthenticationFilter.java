package com.example.storeauth.config;

import com.example.storeauth.user.User;
import com.example.storeauth.user.UserRepository;
import com.example.storeauth.util.JwtUtil;
import com.example.storeauth.util.TokenClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Authenticates requests carrying an access token.
 *
 * <p>Requests without a bearer header pass through unauthenticated and are answered with 401 by
 * the entry point when the route is protected. A bearer token that fails verification, points to
 * a deleted user or to a disabled account ends the request with 403. The role is read from the
 * store on every request, so role changes and deactivation apply to tokens already issued.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final List<String> PUBLIC_PATH_PREFIXES = List.of(
        "/api/v1/auth/", "/swagger-ui", "/v3/api-docs", "/actuator/health"
    );

    static final String INVALID_TOKEN_MESSAGE = "Forbidden: Invalid or expired token";
    static final String ACCOUNT_DISABLED_MESSAGE = "Account is disabled";

    private final JwtUtil jwtUtil;
    private final UserRepository userRepository;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return PUBLIC_PATH_PREFIXES.stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String authorizationHeader = request.getHeader(AUTHORIZATION_HEADER);

        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        Optional<TokenClaims> claims = jwtUtil.verifyAccessToken(token);
        if (claims.isEmpty()) {
            reject(response, INVALID_TOKEN_MESSAGE);
            return;
        }

        String userId = claims.get().getUserId();
        Optional<User> user = findUser(userId);
        if (user.isEmpty()) {
            log.debug("Access token references a user that no longer exists: {}", userId);
            reject(response, INVALID_TOKEN_MESSAGE);
            return;
        }
        if (!user.get().getActive()) {
            log.debug("Access token presented for disabled user: {}", userId);
            reject(response, ACCOUNT_DISABLED_MESSAGE);
            return;
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
            userId, null, List.of(new SimpleGrantedAuthority(user.get().getRole().authority())));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        log.debug("Successfully authenticated user: {} with role: {}", userId, user.get().getRole());

        filterChain.doFilter(request, response);
    }

    private Optional<User> findUser(String userId) {
        try {
            return userRepository.findById(Long.valueOf(userId));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private void reject(HttpServletResponse response, String message) throws IOException {
        SecurityContextHolder.clearContext();
        errorWriter.write(response, HttpStatus.FORBIDDEN, message);
    }
}

package com.example.storeauth.service;

import com.example.storeauth.config.AuthProperties;
import com.example.storeauth.exception.TooManyRequestsException;
import com.example.storeauth.repository.LoginAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class LoginRateLimiter {

    static final String LIMIT_EXCEEDED_MESSAGE =
        "Too many login attempts from this IP, please try again after 15 minutes.";

    private final LoginAttemptRepository loginAttemptRepository;
    private final AuthProperties authProperties;

    /**
     * Records a login attempt from {@code clientIp}, successful or not.
     *
     * @throws TooManyRequestsException once the client exceeded the attempts allowed in the window
     */
    public void checkAndRecord(String clientIp) {
        AuthProperties.LoginRateLimit limit = authProperties.getLoginRateLimit();
        if (!limit.isEnabled()) {
            return;
        }

        long attempts = loginAttemptRepository.increment(clientIp, limit.getWindow());
        if (attempts > limit.getMaxAttempts()) {
            log.warn("Login rate limit exceeded for client: {} ({} attempts)", clientIp, attempts);
            throw new TooManyRequestsException(LIMIT_EXCEEDED_MESSAGE);
        }
    }
}

package com.example.storeauth.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window login attempt counters, one Redis key per client.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class LoginAttemptRepository {

    private final StringRedisTemplate redisTemplate;
    private static final String KEY_PREFIX = "login_attempts:";
    private static final long NO_EXPIRY = -1L;

    /**
     * Counts one attempt and returns the number of attempts in the current window.
     * The window starts with the first attempt and expires on its own.
     */
    public long increment(String clientKey, Duration window) {
        String key = KEY_PREFIX + clientKey;
        ValueOperations<String, String> ops = redisTemplate.opsForValue();

        // SET NX EX: the counter is created together with its TTL
        Boolean created = ops.setIfAbsent(key, "0", window);
        Long attempts = ops.increment(key);

        if (!Boolean.TRUE.equals(created)) {
            ensureExpiry(key, window);
        }

        log.debug("Login attempt {} for client: {}", attempts, clientKey);
        return attempts != null ? attempts : 0L;
    }

    /**
     * Restores the TTL on a counter that has none, e.g. one recreated by INCR
     * after expiring between the two commands above.
     */
    private void ensureExpiry(String key, Duration window) {
        Long ttl = redisTemplate.getExpire(key);
        if (ttl == null || ttl != NO_EXPIRY) {
            return;
        }

        Boolean applied = redisTemplate.expire(key, window.toMillis(), TimeUnit.MILLISECONDS);
        if (Boolean.TRUE.equals(applied)) {
            log.warn("Restored missing expiry on login attempt counter: {}", key);
        } else {
            log.error("Failed to set expiry on login attempt counter: {}", key);
            redisTemplate.delete(key);
        }
    }
}

package com.innstay.booking.ratelimit;

import com.innstay.booking.config.BookingProperties;
import com.innstay.common.exception.RateLimitExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window request counter in Redis, shared by all replicas. Fails open
 * when Redis is unavailable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestRateLimiter {

    // Lua script: atomic INCR + EXPIRE, returns current count
    private static final RedisScript<Long> RATE_LIMIT_SCRIPT = RedisScript.of(
            "local current = redis.call('INCR', KEYS[1]) " +
            "if current == 1 then redis.call('EXPIRE', KEYS[1], tonumber(ARGV[1])) end " +
            "return current",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final BookingProperties properties;

    public void checkOrThrow(RateLimitPolicy policy, String identifier) {
        if (!properties.getRateLimit().isEnabled()) {
            return;
        }
        BookingProperties.Limit limit = policy.limitFrom(properties.getRateLimit());
        String key = String.format("rl:%s:%s", policy.keyPrefix(),
                identifier == null || identifier.isBlank() ? "unknown" : identifier);

        Long count;
        try {
            count = redisTemplate.execute(RATE_LIMIT_SCRIPT, List.of(key),
                    String.valueOf(limit.getWindowSeconds()));
        } catch (DataAccessException e) {
            log.error("Redis rate limit check failed, allowing request: {}", e.getMessage());
            return;
        }

        if (count != null && count > limit.getMaxRequests()) {
            long retryAfter = retryAfterSeconds(key, limit);
            log.warn("Rate limit exceeded: policy={}, key={}, count={}", policy, key, count);
            throw new RateLimitExceededException(retryAfter);
        }
    }

    private long retryAfterSeconds(String key, BookingProperties.Limit limit) {
        try {
            Long ttl = redisTemplate.getExpire(key, TimeUnit.SECONDS);
            if (ttl != null && ttl > 0) {
                return ttl;
            }
        } catch (DataAccessException e) {
            log.warn("Could not read rate limit TTL for {}: {}", key, e.getMessage());
        }
        return limit.getWindowSeconds();
    }
}

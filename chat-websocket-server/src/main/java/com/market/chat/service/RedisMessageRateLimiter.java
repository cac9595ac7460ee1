package com.market.chat.service;

import com.market.chat.domain.RateLimitDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Limiter shared by all instances: INCR + EXPIRE on {@code chat:ratelimit:{userId}}.
 *
 * If Redis is unreachable the message is let through and the failure logged.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "chat.rate-limit.store", havingValue = "redis")
public class RedisMessageRateLimiter implements MessageRateLimiter {

    static final String KEY_PREFIX = "chat:ratelimit:";

    private final StringRedisTemplate redisTemplate;
    private final int maxMessages;
    private final Duration window;
    private final MetricsService metricsService;

    public RedisMessageRateLimiter(
            StringRedisTemplate redisTemplate,
            @Value("${chat.rate-limit.max-messages:30}") int maxMessages,
            @Value("${chat.rate-limit.window-seconds:60}") long windowSeconds,
            MetricsService metricsService) {
        this.redisTemplate = redisTemplate;
        this.maxMessages = maxMessages;
        this.window = Duration.ofSeconds(windowSeconds);
        this.metricsService = metricsService;
    }

    @Override
    public RateLimitDecision checkAndConsume(String userId) {
        String key = KEY_PREFIX + userId;
        try {
            Long count = redisTemplate.opsForValue().increment(key);
            if (count == null) {
                return RateLimitDecision.allowed();
            }
            if (count == 1L) {
                redisTemplate.expire(key, window);
            }
            if (count <= maxMessages) {
                return RateLimitDecision.allowed();
            }

            Long ttl = redisTemplate.getExpire(key, TimeUnit.SECONDS);
            if (ttl == null || ttl < 0) {
                // Key lost its expiry (crash between INCR and EXPIRE): start a fresh window
                redisTemplate.expire(key, window);
                ttl = window.getSeconds();
            }
            return RateLimitDecision.rejected(ttl);
        } catch (Exception e) {
            log.error("❌ Rate limit store unavailable, allowing message: userId={}", userId, e);
            metricsService.recordError("RATE_LIMIT_STORE", "RedisMessageRateLimiter");
            return RateLimitDecision.allowed();
        }
    }

    @Override
    public void discard(String userId) {
        try {
            redisTemplate.delete(KEY_PREFIX + userId);
        } catch (Exception e) {
            log.warn("Failed to discard rate limit window: userId={}", userId, e);
        }
    }

    @Override
    public boolean isRemote() {
        return true;
    }
}

package com.market.chat.service;

import com.market.chat.domain.RateLimitDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local limiter. Windows reset lazily on the next message after expiry.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "chat.rate-limit.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryMessageRateLimiter implements MessageRateLimiter {

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final int maxMessages;
    private final long windowMillis;
    private final Clock clock;

    @Autowired
    public InMemoryMessageRateLimiter(
            @Value("${chat.rate-limit.max-messages:30}") int maxMessages,
            @Value("${chat.rate-limit.window-seconds:60}") long windowSeconds) {
        this(maxMessages, Duration.ofSeconds(windowSeconds), Clock.systemUTC());
    }

    InMemoryMessageRateLimiter(int maxMessages, Duration window, Clock clock) {
        this.maxMessages = maxMessages;
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    @Override
    public RateLimitDecision checkAndConsume(String userId) {
        long now = clock.millis();
        // compute() runs atomically per key
        Window window = windows.compute(userId, (key, current) -> {
            if (current == null || now >= current.resetAt) {
                return new Window(1, now + windowMillis, true);
            }
            if (current.count < maxMessages) {
                return new Window(current.count + 1, current.resetAt, true);
            }
            return new Window(current.count, current.resetAt, false);
        });

        if (window.allowed) {
            return RateLimitDecision.allowed();
        }
        long retryAfterSeconds = (window.resetAt - now + 999) / 1000;
        log.debug("Rate limited: userId={}, retryAfter={}s", userId, retryAfterSeconds);
        return RateLimitDecision.rejected(retryAfterSeconds);
    }

    @Override
    public void discard(String userId) {
        windows.remove(userId);
    }

    int trackedUsers() {
        return windows.size();
    }

    private static final class Window {
        private final int count;
        private final long resetAt;
        private final boolean allowed;

        private Window(int count, long resetAt, boolean allowed) {
            this.count = count;
            this.resetAt = resetAt;
            this.allowed = allowed;
        }
    }
}

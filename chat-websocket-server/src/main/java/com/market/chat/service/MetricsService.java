package com.market.chat.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chat metrics on the Micrometer registry.
 *
 * Counters and timers are exported through actuator; every recording is also
 * logged at debug so a plain log is enough to follow traffic locally.
 */
@Service
@Slf4j
public class MetricsService {

    private final MeterRegistry registry;
    private final AtomicInteger activeConnections = new AtomicInteger();

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("chat.connections.active", activeConnections, AtomicInteger::get)
            .description("Open chat WebSocket connections")
            .register(registry);
        log.info("MetricsService initialized with {}", registry.getClass().getSimpleName());
    }

    // ===== Generic =====

    public void incrementCounter(String name, String... tags) {
        Counter.builder(name).tags(tags).register(registry).increment();
        log.debug("[METRIC] Counter: {} {}", name, tags);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, String name, String... tags) {
        long nanos = sample.stop(Timer.builder(name).tags(tags).register(registry));
        log.debug("[METRIC] Timer: {} = {}ms", name, nanos / 1_000_000);
    }

    // ===== Connections =====

    public void recordConnectionOpened(String userId) {
        int active = activeConnections.incrementAndGet();
        incrementCounter("chat.connections.opened");
        log.info("📥 Chat connection opened: userId={}, active={}", userId, active);
    }

    public void recordConnectionClosed(String userId) {
        int active = activeConnections.updateAndGet(v -> Math.max(0, v - 1));
        incrementCounter("chat.connections.closed");
        log.info("📤 Chat connection closed: userId={}, active={}", userId, active);
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    // ===== Messages =====

    public void recordMessageSent(String transport) {
        incrementCounter("chat.messages.sent", "transport", transport);
    }

    public void recordRateLimited(String userId) {
        incrementCounter("chat.messages.rate_limited");
        log.debug("Rate limit rejection: userId={}", userId);
    }

    public void recordDecryptFailure(String messageId) {
        incrementCounter("chat.messages.decrypt_failures");
        log.debug("Decrypt failure: messageId={}", messageId);
    }

    public void recordAuthenticationAttempt(boolean success) {
        incrementCounter("chat.authentication.attempts", "success", String.valueOf(success));
    }

    // ===== Maintenance =====

    public void recordArchiveRun(String status, long count) {
        incrementCounter("chat.archive.runs", "status", status);
        registry.counter("chat.archive.messages").increment(count);
        log.debug("[METRIC] Archive run: status={}, count={}", status, count);
    }

    public void recordError(String errorType, String component) {
        incrementCounter("chat.errors", "type", errorType, "component", component);
        log.debug("[METRIC] Error: type={}, component={}", errorType, component);
    }
}

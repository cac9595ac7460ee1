package com.market.chat.service;

import com.market.chat.domain.RateLimitDecision;

/**
 * Fixed-window per-user limit on sent messages.
 */
public interface MessageRateLimiter {

    /**
     * Count one message against the user's window.
     */
    RateLimitDecision checkAndConsume(String userId);

    /**
     * Forget the user's window (called when the user's last connection closes).
     */
    void discard(String userId);

    /**
     * Whether a call leaves the process and so has to be bounded by the store timeout.
     */
    default boolean isRemote() {
        return false;
    }
}

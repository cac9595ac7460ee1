package com.market.chat.domain;

import lombok.Value;

@Value
public class RateLimitDecision {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, 0);

    boolean allowed;
    long retryAfterSeconds;

    public static RateLimitDecision allowed() {
        return ALLOWED;
    }

    public static RateLimitDecision rejected(long retryAfterSeconds) {
        return new RateLimitDecision(false, Math.max(1, retryAfterSeconds));
    }
}

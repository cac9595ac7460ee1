package com.market.chat.exception;

import lombok.Getter;

@Getter
public class RateLimitedException extends ChatException {

    private final long retryAfterSeconds;

    public RateLimitedException(long retryAfterSeconds) {
        super("Rate limit exceeded. Please wait " + retryAfterSeconds
                + " seconds before sending more messages.", ChatErrorCode.RATE_LIMITED);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}

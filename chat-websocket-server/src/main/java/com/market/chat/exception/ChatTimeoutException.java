package com.market.chat.exception;

/**
 * An upstream call (store, codec or remote limiter) did not answer in time.
 */
public class ChatTimeoutException extends ChatException {

    public ChatTimeoutException() {
        super(ChatErrorCode.TIMEOUT);
    }

    public ChatTimeoutException(String message) {
        super(message, ChatErrorCode.TIMEOUT);
    }

    public ChatTimeoutException(String message, Throwable cause) {
        super(message, cause, ChatErrorCode.TIMEOUT);
    }
}

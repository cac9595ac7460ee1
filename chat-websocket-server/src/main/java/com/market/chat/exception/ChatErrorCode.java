package com.market.chat.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes surfaced to chat clients over both transports.
 */
public enum ChatErrorCode {

    VALIDATION_FAILED("CHAT-400", "Validation failed", HttpStatus.BAD_REQUEST),

    UNAUTHENTICATED("CHAT-401", "Authentication required", HttpStatus.UNAUTHORIZED),

    ACCESS_DENIED("CHAT-403", "Access denied", HttpStatus.FORBIDDEN),

    CONVERSATION_NOT_FOUND("CHAT-404", "Conversation not found", HttpStatus.NOT_FOUND),

    STORE_CONFLICT("CHAT-409", "Resource already exists", HttpStatus.CONFLICT),

    RATE_LIMITED("CHAT-429", "Too many requests. Please slow down and try again in a moment.",
            HttpStatus.TOO_MANY_REQUESTS),

    ENCODING_FAILED("CHAT-500-E", "Failed to process message encryption", HttpStatus.INTERNAL_SERVER_ERROR),

    STORE_FAILED("CHAT-500-S", "Database operation failed", HttpStatus.INTERNAL_SERVER_ERROR),

    INTERNAL_ERROR("CHAT-500", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR),

    TIMEOUT("CHAT-504", "Request timeout. Please try again.", HttpStatus.GATEWAY_TIMEOUT);

    private final String code;
    private final String message;
    private final HttpStatus status;

    ChatErrorCode(String code, String message, HttpStatus status) {
        this.code = code;
        this.message = message;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }

    public HttpStatus status() {
        return status;
    }
}

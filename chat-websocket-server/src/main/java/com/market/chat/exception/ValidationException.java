package com.market.chat.exception;

/**
 * Malformed identifiers or message content.
 */
public class ValidationException extends ChatException {

    public ValidationException() {
        super(ChatErrorCode.VALIDATION_FAILED);
    }

    public ValidationException(String message) {
        super(message, ChatErrorCode.VALIDATION_FAILED);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause, ChatErrorCode.VALIDATION_FAILED);
    }
}

package com.market.chat.exception;

/**
 * A unique-constraint race that could not be resolved by re-reading.
 */
public class StoreConflictException extends ChatException {

    public StoreConflictException() {
        super(ChatErrorCode.STORE_CONFLICT);
    }

    public StoreConflictException(String message) {
        super(message, ChatErrorCode.STORE_CONFLICT);
    }

    public StoreConflictException(String message, Throwable cause) {
        super(message, cause, ChatErrorCode.STORE_CONFLICT);
    }
}

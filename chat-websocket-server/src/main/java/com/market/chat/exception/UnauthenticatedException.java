package com.market.chat.exception;

/**
 * Missing, invalid or expired credential.
 */
public class UnauthenticatedException extends ChatException {

    public UnauthenticatedException() {
        super(ChatErrorCode.UNAUTHENTICATED);
    }

    public UnauthenticatedException(String message) {
        super(message, ChatErrorCode.UNAUTHENTICATED);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(message, cause, ChatErrorCode.UNAUTHENTICATED);
    }
}

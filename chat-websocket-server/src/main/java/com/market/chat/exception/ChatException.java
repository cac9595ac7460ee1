package com.market.chat.exception;

import lombok.Getter;

import java.util.Optional;

/**
 * Base class of every failure the chat pipeline reports to a caller.
 * Use {@link #getClientMessage()} for anything sent back to a caller.
 */
@Getter
public class ChatException extends RuntimeException {

    private final ChatErrorCode errorCode;

    public ChatException(ChatErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ChatException(String message, ChatErrorCode errorCode) {
        this(message, null, errorCode);
    }

    public ChatException(String message, Throwable cause, ChatErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), cause);
        this.errorCode = errorCode;
    }

    /**
     * Message safe to send to a client. Server-side failures never expose their details.
     */
    public String getClientMessage() {
        return errorCode.status().is5xxServerError() ? errorCode.message() : getMessage();
    }
}

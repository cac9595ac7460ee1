package com.market.chat.exception;

/**
 * The caller is authenticated but not a participant, or has the wrong role.
 */
public class ChatAccessDeniedException extends ChatException {

    public ChatAccessDeniedException() {
        super(ChatErrorCode.ACCESS_DENIED);
    }

    public ChatAccessDeniedException(String message) {
        super(message, ChatErrorCode.ACCESS_DENIED);
    }

    public ChatAccessDeniedException(String message, Throwable cause) {
        super(message, cause, ChatErrorCode.ACCESS_DENIED);
    }
}

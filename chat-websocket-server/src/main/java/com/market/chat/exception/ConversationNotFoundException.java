package com.market.chat.exception;

public class ConversationNotFoundException extends ChatException {

    public ConversationNotFoundException() {
        super(ChatErrorCode.CONVERSATION_NOT_FOUND);
    }

    public ConversationNotFoundException(String message) {
        super(message, ChatErrorCode.CONVERSATION_NOT_FOUND);
    }

    public ConversationNotFoundException(String message, Throwable cause) {
        super(message, cause, ChatErrorCode.CONVERSATION_NOT_FOUND);
    }
}

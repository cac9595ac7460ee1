package com.market.chat.domain;

import lombok.Value;

/**
 * Result of get-or-create: {@code created} is false when the pair already had a conversation.
 */
@Value
public class ConversationCreation {
    String conversationId;
    boolean created;
}

package com.market.chat.service;

import com.market.chat.domain.ChatRole;

/**
 * Outbound email for users who are offline when a message arrives.
 * The transport (SMTP or provider API) lives outside the chat service.
 */
public interface EmailNotifier {

    void notifyNewMessage(String recipientId, ChatRole recipientRole, String conversationId, String senderId);
}

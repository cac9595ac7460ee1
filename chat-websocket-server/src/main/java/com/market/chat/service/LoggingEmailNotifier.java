package com.market.chat.service;

import com.market.chat.domain.ChatRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default notifier when no mail transport is wired in: records the notification in the log.
 */
@Component
@Slf4j
public class LoggingEmailNotifier implements EmailNotifier {

    @Override
    public void notifyNewMessage(String recipientId, ChatRole recipientRole, String conversationId, String senderId) {
        log.info("📧 New message notification: recipientId={}, role={}, conversationId={}, senderId={}",
            recipientId, recipientRole, conversationId, senderId);
    }
}

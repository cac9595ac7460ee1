package com.market.chat.service;

import com.market.chat.domain.ChatRole;
import com.market.chat.domain.MessageEntity;
import com.market.chat.repository.ConversationRepository;
import com.market.chat.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Keeps the per-role unread counters in step with the messages table.
 *
 * Every method is one transaction; counters only ever move through in-database
 * arithmetic and never go below zero.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UnreadCoordinator {

    private final MessageRepository messageRepository;
    private final ConversationRepository conversationRepository;
    private final Clock clock;

    /**
     * Insert the message and bump the recipient's counter and the conversation timestamps.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException when a message with the same id exists
     */
    @Transactional
    public MessageEntity recordNewMessage(MessageEntity message) {
        Instant now = clock.instant();
        if (message.getCreatedAt() == null) {
            message.setCreatedAt(now);
        }
        MessageEntity saved = messageRepository.saveAndFlush(message);

        int updated = message.getSenderRole() == ChatRole.CUSTOMER
            ? conversationRepository.incrementVendorUnread(message.getConversationId(), now)
            : conversationRepository.incrementCustomerUnread(message.getConversationId(), now);
        if (updated == 0) {
            log.warn("Counter update matched no conversation: conversationId={}", message.getConversationId());
        }
        return saved;
    }

    /**
     * @return true when the message went from unread to read
     */
    @Transactional
    public boolean markMessageRead(String conversationId, String messageId, String readerId, ChatRole readerRole) {
        Instant now = clock.instant();
        int rows = messageRepository.markRead(conversationId, messageId, readerId, now);
        if (rows == 0) {
            return false;
        }
        decrement(conversationId, readerRole, rows, now);
        return true;
    }

    /**
     * Mark every unread message written by the other role.
     *
     * @return number of messages that transitioned
     */
    @Transactional
    public int markConversationRead(String conversationId, ChatRole readerRole) {
        Instant now = clock.instant();
        int rows = messageRepository.markAllReadFromRole(conversationId, readerRole.counterpart(), now);
        if (rows > 0) {
            decrement(conversationId, readerRole, rows, now);
        }
        return rows;
    }

    private void decrement(String conversationId, ChatRole readerRole, int amount, Instant now) {
        if (readerRole == ChatRole.CUSTOMER) {
            conversationRepository.decrementCustomerUnread(conversationId, amount, now);
        } else {
            conversationRepository.decrementVendorUnread(conversationId, amount, now);
        }
    }
}

package com.market.chat.service;

import com.market.chat.domain.ChatRole;
import com.market.chat.domain.ConversationEntity;
import com.market.chat.domain.MessageEntity;
import com.market.chat.repository.ConversationRepository;
import com.market.chat.repository.MessageRepository;
import com.market.chat.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(UnreadCoordinator.class)
class UnreadCoordinatorTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final String CUSTOMER_ID = "customer-1";
    private static final String VENDOR_ID = "vendor-1";

    @TestConfiguration
    static class Config {
        @Bean
        MutableClock clock() {
            return new MutableClock(START);
        }
    }

    @Autowired
    private UnreadCoordinator unreadCoordinator;

    @Autowired
    private ConversationRepository conversationRepository;

    @Autowired
    private MessageRepository messageRepository;

    @Autowired
    private Clock clock;

    private String conversationId;

    @BeforeEach
    void setUp() {
        conversationId = UUID.randomUUID().toString();
        conversationRepository.saveAndFlush(ConversationEntity.builder()
            .id(conversationId)
            .customerId(CUSTOMER_ID)
            .vendorId(VENDOR_ID)
            .build());
    }

    @Test
    void customerMessageBumpsVendorCounter() {
        MessageEntity saved = unreadCoordinator.recordNewMessage(message(CUSTOMER_ID, ChatRole.CUSTOMER));

        ConversationEntity conversation = conversationRepository.findById(conversationId).orElseThrow();
        assertThat(conversation.getVendorUnreadCount()).isEqualTo(1);
        assertThat(conversation.getCustomerUnreadCount()).isZero();
        assertThat(conversation.getLastMessageAt()).isEqualTo(START);
        assertThat(saved.getCreatedAt()).isEqualTo(START);
        assertThat(messageRepository.findById(saved.getId())).isPresent();
    }

    @Test
    void vendorMessageBumpsCustomerCounter() {
        unreadCoordinator.recordNewMessage(message(VENDOR_ID, ChatRole.VENDOR));
        unreadCoordinator.recordNewMessage(message(VENDOR_ID, ChatRole.VENDOR));

        ConversationEntity conversation = conversationRepository.findById(conversationId).orElseThrow();
        assertThat(conversation.getCustomerUnreadCount()).isEqualTo(2);
        assertThat(conversationRepository.sumCustomerUnread(CUSTOMER_ID)).isEqualTo(2);
        assertThat(conversationRepository.sumVendorUnread(VENDOR_ID)).isZero();
    }

    @Test
    void duplicateMessageIdIsRejected() {
        MessageEntity first = unreadCoordinator.recordNewMessage(message(CUSTOMER_ID, ChatRole.CUSTOMER));

        MessageEntity duplicate = message(CUSTOMER_ID, ChatRole.CUSTOMER);
        duplicate.setId(first.getId());

        assertThatThrownBy(() -> unreadCoordinator.recordNewMessage(duplicate))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void markingOwnMessageReadChangesNothing() {
        MessageEntity saved = unreadCoordinator.recordNewMessage(message(CUSTOMER_ID, ChatRole.CUSTOMER));

        boolean updated = unreadCoordinator.markMessageRead(conversationId, saved.getId(), CUSTOMER_ID, ChatRole.CUSTOMER);

        assertThat(updated).isFalse();
        assertThat(conversationRepository.findById(conversationId).orElseThrow().getVendorUnreadCount()).isEqualTo(1);
        assertThat(messageRepository.findById(saved.getId()).orElseThrow().isRead()).isFalse();
    }

    @Test
    void markingReadTwiceDecrementsOnce() {
        MessageEntity first = unreadCoordinator.recordNewMessage(message(CUSTOMER_ID, ChatRole.CUSTOMER));
        unreadCoordinator.recordNewMessage(message(CUSTOMER_ID, ChatRole.CUSTOMER));
        ((MutableClock) clock).advance(Duration.ofMinutes(5));

        assertThat(unreadCoordinator.markMessageRead(conversationId, first.getId(), VENDOR_ID, ChatRole.VENDOR)).isTrue();
        assertThat(unreadCoordinator.markMessageRead(conversationId, first.getId(), VENDOR_ID, ChatRole.VENDOR)).isFalse();

        MessageEntity read = messageRepository.findById(first.getId()).orElseThrow();
        assertThat(read.isRead()).isTrue();
        assertThat(read.getReadAt()).isEqualTo(START.plus(Duration.ofMinutes(5)));
        assertThat(conversationRepository.findById(conversationId).orElseThrow().getVendorUnreadCount()).isEqualTo(1);
    }

    @Test
    void markingMessageOfAnotherConversationIsNoOp() {
        MessageEntity saved = unreadCoordinator.recordNewMessage(message(CUSTOMER_ID, ChatRole.CUSTOMER));

        boolean updated = unreadCoordinator.markMessageRead(UUID.randomUUID().toString(), saved.getId(),
            VENDOR_ID, ChatRole.VENDOR);

        assertThat(updated).isFalse();
        assertThat(conversationRepository.findById(conversationId).orElseThrow().getVendorUnreadCount()).isEqualTo(1);
    }

    @Test
    void markConversationReadOnlyTouchesCounterpartMessages() {
        unreadCoordinator.recordNewMessage(message(CUSTOMER_ID, ChatRole.CUSTOMER));
        unreadCoordinator.recordNewMessage(message(CUSTOMER_ID, ChatRole.CUSTOMER));
        unreadCoordinator.recordNewMessage(message(VENDOR_ID, ChatRole.VENDOR));

        int rows = unreadCoordinator.markConversationRead(conversationId, ChatRole.VENDOR);

        assertThat(rows).isEqualTo(2);
        ConversationEntity conversation = conversationRepository.findById(conversationId).orElseThrow();
        assertThat(conversation.getVendorUnreadCount()).isZero();
        assertThat(conversation.getCustomerUnreadCount()).isEqualTo(1);
        assertThat(unreadCoordinator.markConversationRead(conversationId, ChatRole.VENDOR)).isZero();
    }

    @Test
    void counterNeverGoesBelowZero() {
        conversationRepository.decrementCustomerUnread(conversationId, 3, START);

        assertThat(conversationRepository.findById(conversationId).orElseThrow().getCustomerUnreadCount()).isZero();
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void concurrentSendsKeepEveryIncrement() throws Exception {
        int senders = 40;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<MessageEntity>> futures = new ArrayList<>();
            for (int i = 0; i < senders; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return unreadCoordinator.recordNewMessage(message(CUSTOMER_ID, ChatRole.CUSTOMER));
                }));
            }
            start.countDown();
            for (Future<MessageEntity> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }

            assertThat(conversationRepository.findById(conversationId).orElseThrow().getVendorUnreadCount())
                .isEqualTo(senders);
            assertThat(messageRepository.count()).isEqualTo(senders);
        } finally {
            pool.shutdownNow();
            messageRepository.deleteAll();
            conversationRepository.deleteAll();
        }
    }

    private MessageEntity message(String senderId, ChatRole senderRole) {
        return MessageEntity.builder()
            .id(UUID.randomUUID().toString())
            .conversationId(conversationId)
            .senderId(senderId)
            .senderRole(senderRole)
            .encryptedContent("Pciphertext")
            .contentHash("0".repeat(64))
            .build();
    }
}

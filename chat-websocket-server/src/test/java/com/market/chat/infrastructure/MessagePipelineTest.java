package com.market.chat.infrastructure;

import com.market.chat.domain.ArchivedMessageEntity;
import com.market.chat.domain.ChatIdentity;
import com.market.chat.domain.ChatRole;
import com.market.chat.domain.ConversationCreation;
import com.market.chat.domain.ConversationEntity;
import com.market.chat.domain.ConversationParticipants;
import com.market.chat.domain.MessageEntity;
import com.market.chat.domain.RateLimitDecision;
import com.market.chat.domain.WebSocketMessage;
import com.market.chat.domain.WebSocketMessage.EventType;
import com.market.chat.exception.ChatAccessDeniedException;
import com.market.chat.exception.RateLimitedException;
import com.market.chat.exception.StoreConflictException;
import com.market.chat.exception.ValidationException;
import com.market.chat.model.ChatMessageView;
import com.market.chat.model.ConversationSummary;
import com.market.chat.repository.ArchivedMessageRepository;
import com.market.chat.repository.ConversationRepository;
import com.market.chat.repository.MessageRepository;
import com.market.chat.service.ChatValidator;
import com.market.chat.service.ConversationAccessGate;
import com.market.chat.service.EmailNotifier;
import com.market.chat.service.EncryptionKeyProvider;
import com.market.chat.service.EventPublisher;
import com.market.chat.service.MessageCodec;
import com.market.chat.service.MessageRateLimiter;
import com.market.chat.service.MessageSanitizer;
import com.market.chat.service.MetricsService;
import com.market.chat.service.UnreadCoordinator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MessagePipelineTest {

    private static final String CONVERSATION_ID = UUID.randomUUID().toString();
    private static final String CUSTOMER_ID = UUID.randomUUID().toString();
    private static final String VENDOR_ID = UUID.randomUUID().toString();
    private static final ChatIdentity CUSTOMER = ChatIdentity.of(CUSTOMER_ID, ChatRole.CUSTOMER);
    private static final ChatIdentity VENDOR = ChatIdentity.of(VENDOR_ID, ChatRole.VENDOR);
    private static final ConversationParticipants PARTICIPANTS =
        new ConversationParticipants(CONVERSATION_ID, CUSTOMER_ID, VENDOR_ID);

    private static MessageCodec codec;

    private ExecutorService executor;
    private MessageRateLimiter rateLimiter;
    private ConversationAccessGate accessGate;
    private UnreadCoordinator unreadCoordinator;
    private ConversationRepository conversationRepository;
    private MessageRepository messageRepository;
    private ArchivedMessageRepository archivedMessageRepository;
    private ConnectionRegistry registry;
    private EmailNotifier emailNotifier;
    private EventPublisher eventPublisher;
    private MessagePipeline pipeline;

    @BeforeAll
    static void createCodec() {
        codec = new MessageCodec(new EncryptionKeyProvider("pipeline-test-secret", "salt", List.of(), false));
    }

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        rateLimiter = mock(MessageRateLimiter.class);
        accessGate = mock(ConversationAccessGate.class);
        unreadCoordinator = mock(UnreadCoordinator.class);
        conversationRepository = mock(ConversationRepository.class);
        messageRepository = mock(MessageRepository.class);
        archivedMessageRepository = mock(ArchivedMessageRepository.class);
        registry = mock(ConnectionRegistry.class);
        emailNotifier = mock(EmailNotifier.class);
        eventPublisher = mock(EventPublisher.class);

        pipeline = new MessagePipeline(new ChatValidator(), new MessageSanitizer(), codec, rateLimiter, accessGate,
            unreadCoordinator, conversationRepository, messageRepository, archivedMessageRepository, registry,
            new BoundedCallExecutor(executor, 2_000, 2_000), emailNotifier,
            new MetricsService(new SimpleMeterRegistry()), eventPublisher);

        when(accessGate.requireParticipant(eq(CONVERSATION_ID), any())).thenReturn(PARTICIPANTS);
        when(rateLimiter.checkAndConsume(anyString())).thenReturn(RateLimitDecision.allowed());
        when(unreadCoordinator.recordNewMessage(any())).thenAnswer(invocation -> {
            MessageEntity message = invocation.getArgument(0);
            message.setCreatedAt(Instant.parse("2024-05-01T10:00:00Z"));
            return message;
        });
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void sendStoresCiphertextAndDeliversPlaintext() {
        ChatMessageView view = pipeline.send(CUSTOMER, CONVERSATION_ID, "  Is this still available?  ", null, "rest");

        ArgumentCaptor<MessageEntity> stored = ArgumentCaptor.forClass(MessageEntity.class);
        verify(unreadCoordinator).recordNewMessage(stored.capture());
        assertThat(stored.getValue().getEncryptedContent()).doesNotContain("available");
        assertThat(stored.getValue().getContentHash()).isEqualTo(MessageCodec.digest("Is this still available?"));
        assertThat(stored.getValue().getSenderRole()).isEqualTo(ChatRole.CUSTOMER);
        assertThat(stored.getValue().isRead()).isFalse();

        assertThat(view.getContent()).isEqualTo("Is this still available?");
        assertThat(view.getSenderId()).isEqualTo(CUSTOMER_ID);
        assertThat(view.getId()).isEqualTo(stored.getValue().getId());
        assertThat(view.isDecryptionError()).isFalse();

        verify(registry).fanOut(eq(ConnectionRegistry.conversationRoom(CONVERSATION_ID)),
            argThat(message -> message.getType() == EventType.NEW_MESSAGE));
        verify(registry).notifyUser(eq(CUSTOMER_ID), argThat(message -> message.getType() == EventType.CONVERSATION_UPDATED));
        verify(registry).notifyUser(eq(VENDOR_ID), argThat(message -> message.getType() == EventType.CONVERSATION_UPDATED));
        verify(eventPublisher).publishMessageSent(CONVERSATION_ID, view.getId(), CUSTOMER_ID, "customer");
    }

    @Test
    void offlineRecipientGetsAnEmail() {
        when(registry.isOnline(VENDOR_ID)).thenReturn(false);

        pipeline.send(CUSTOMER, CONVERSATION_ID, "hello", null, "rest");

        verify(emailNotifier, timeout(2_000)).notifyNewMessage(VENDOR_ID, ChatRole.VENDOR, CONVERSATION_ID, CUSTOMER_ID);
    }

    @Test
    void onlineRecipientGetsNoEmail() {
        when(registry.isOnline(CUSTOMER_ID)).thenReturn(true);

        pipeline.send(VENDOR, CONVERSATION_ID, "hello", null, "websocket");

        verify(emailNotifier, after(300).never()).notifyNewMessage(any(), any(), any(), any());
    }

    @Test
    void invalidInputStopsBeforeAnyStoreAccess() {
        assertThatThrownBy(() -> pipeline.send(CUSTOMER, "not-a-uuid", "hello", null, "rest"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Invalid conversation ID format");
        assertThatThrownBy(() -> pipeline.send(CUSTOMER, CONVERSATION_ID, "   ", null, "rest"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Message content cannot be empty");

        verifyNoInteractions(accessGate, rateLimiter, unreadCoordinator);
    }

    @Test
    void nonParticipantDoesNotConsumeQuota() {
        when(accessGate.requireParticipant(eq(CONVERSATION_ID), any())).thenThrow(new ChatAccessDeniedException());

        assertThatThrownBy(() -> pipeline.send(CUSTOMER, CONVERSATION_ID, "hello", null, "rest"))
            .isInstanceOf(ChatAccessDeniedException.class);

        verifyNoInteractions(rateLimiter, unreadCoordinator);
    }

    @Test
    void rateLimitedSendIsNotStored() {
        when(rateLimiter.checkAndConsume(CUSTOMER_ID)).thenReturn(RateLimitDecision.rejected(42));

        assertThatThrownBy(() -> pipeline.send(CUSTOMER, CONVERSATION_ID, "hello", null, "rest"))
            .isInstanceOf(RateLimitedException.class)
            .extracting("retryAfterSeconds")
            .isEqualTo(42L);

        verifyNoInteractions(unreadCoordinator);
        verify(registry, never()).fanOut(anyString(), any());
    }

    @Test
    void contentThatSanitizesToNothingIsRejected() {
        assertThatThrownBy(() -> pipeline.send(CUSTOMER, CONVERSATION_ID, "\u007F\u007F", null, "rest"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Message content cannot be empty");

        verifyNoInteractions(unreadCoordinator);
    }

    @Test
    void retryWithSameClientIdReturnsStoredMessage() {
        String clientMessageId = UUID.randomUUID().toString();
        MessageEntity existing = storedMessage(clientMessageId, CUSTOMER_ID, "first attempt");
        when(messageRepository.findByIdAndConversationId(clientMessageId, CONVERSATION_ID)).thenReturn(Optional.of(existing));

        ChatMessageView view = pipeline.send(CUSTOMER, CONVERSATION_ID, "first attempt", clientMessageId, "websocket");

        assertThat(view.getId()).isEqualTo(clientMessageId);
        assertThat(view.getContent()).isEqualTo("first attempt");
        verifyNoInteractions(rateLimiter, unreadCoordinator);
    }

    @Test
    void clientIdOwnedByAnotherSenderConflicts() {
        String clientMessageId = UUID.randomUUID().toString();
        MessageEntity existing = storedMessage(clientMessageId, VENDOR_ID, "not yours");
        when(messageRepository.findByIdAndConversationId(clientMessageId, CONVERSATION_ID)).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> pipeline.send(CUSTOMER, CONVERSATION_ID, "hello", clientMessageId, "rest"))
            .isInstanceOf(StoreConflictException.class);
    }

    @Test
    void concurrentRetryLosingTheInsertReturnsTheWinner() {
        String clientMessageId = UUID.randomUUID().toString();
        MessageEntity winner = storedMessage(clientMessageId, CUSTOMER_ID, "hello");
        when(messageRepository.findByIdAndConversationId(clientMessageId, CONVERSATION_ID))
            .thenReturn(Optional.empty(), Optional.of(winner));
        doThrow(new DataIntegrityViolationException("duplicate key")).when(unreadCoordinator).recordNewMessage(any());

        ChatMessageView view = pipeline.send(CUSTOMER, CONVERSATION_ID, "hello", clientMessageId, "rest");

        assertThat(view.getId()).isEqualTo(clientMessageId);
        verify(registry, never()).fanOut(anyString(), any());
    }

    @Test
    void malformedClientIdIsRejected() {
        assertThatThrownBy(() -> pipeline.send(CUSTOMER, CONVERSATION_ID, "hello", "temp-1", "rest"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void undecryptableMessageBecomesPlaceholder() {
        MessageEntity broken = storedMessage(UUID.randomUUID().toString(), VENDOR_ID, "ignored");
        broken.setEncryptedContent("Pgarbage");

        ChatMessageView view = pipeline.toView(broken);

        assertThat(view.getContent()).isEqualTo(ChatMessageView.DECRYPTION_FAILED_PLACEHOLDER);
        assertThat(view.isDecryptionError()).isTrue();
    }

    @Test
    void missingContentBecomesPlaceholder() {
        MessageEntity empty = storedMessage(UUID.randomUUID().toString(), VENDOR_ID, "ignored");
        empty.setEncryptedContent("");

        ChatMessageView view = pipeline.toView(empty);

        assertThat(view.getContent()).isEqualTo(ChatMessageView.CONTENT_MISSING_PLACEHOLDER);
        assertThat(view.isContentMissing()).isTrue();
    }

    @Test
    void historyDecodesEachMessageIndependently() {
        MessageEntity good = storedMessage(UUID.randomUUID().toString(), CUSTOMER_ID, "readable");
        MessageEntity bad = storedMessage(UUID.randomUUID().toString(), VENDOR_ID, "ignored");
        bad.setEncryptedContent("Pgarbage");
        when(messageRepository.findByConversationIdOrderByCreatedAtAsc(eq(CONVERSATION_ID), any(Pageable.class)))
            .thenReturn(List.of(good, bad));

        List<ChatMessageView> history = pipeline.history(VENDOR, CONVERSATION_ID);

        assertThat(history).extracting(ChatMessageView::getContent)
            .containsExactly("readable", ChatMessageView.DECRYPTION_FAILED_PLACEHOLDER);
    }

    @Test
    void slowDecryptBecomesPlaceholderWithoutFailingHistory() {
        MessageEntity quick = storedMessage(UUID.randomUUID().toString(), CUSTOMER_ID, "quick");
        MessageEntity stuck = storedMessage(UUID.randomUUID().toString(), VENDOR_ID, "stuck");
        MessageCodec slowCodec = mock(MessageCodec.class);
        when(slowCodec.decode(quick.getEncryptedContent())).thenReturn("quick");
        when(slowCodec.decode(stuck.getEncryptedContent())).thenAnswer(invocation -> {
            Thread.sleep(1_000);
            return "too late";
        });
        when(messageRepository.findByConversationIdOrderByCreatedAtAsc(eq(CONVERSATION_ID), any(Pageable.class)))
            .thenReturn(List.of(quick, stuck));
        MessagePipeline impatient = new MessagePipeline(new ChatValidator(), new MessageSanitizer(), slowCodec,
            rateLimiter, accessGate, unreadCoordinator, conversationRepository, messageRepository,
            archivedMessageRepository, registry, new BoundedCallExecutor(executor, 2_000, 100), emailNotifier,
            new MetricsService(new SimpleMeterRegistry()), eventPublisher);

        List<ChatMessageView> history = impatient.history(VENDOR, CONVERSATION_ID);

        assertThat(history).extracting(ChatMessageView::getContent)
            .containsExactly("quick", ChatMessageView.DECRYPTION_FAILED_PLACEHOLDER);
        assertThat(history.get(1).isDecryptionError()).isTrue();
    }

    @Test
    void archivedHistoryValidatesPaging() {
        assertThatThrownBy(() -> pipeline.archivedHistory(CUSTOMER, CONVERSATION_ID, 201, 0))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> pipeline.archivedHistory(CUSTOMER, CONVERSATION_ID, 10, -1))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void archivedHistoryDefaultsToFiftyNewestFirst() {
        MessageEntity message = storedMessage(UUID.randomUUID().toString(), CUSTOMER_ID, "old news");
        when(archivedMessageRepository.findByConversationIdOrderByCreatedAtDesc(eq(CONVERSATION_ID), any(Pageable.class)))
            .thenReturn(List.of(ArchivedMessageEntity.fromMessage(message, Instant.now())));

        List<ChatMessageView> archived = pipeline.archivedHistory(CUSTOMER, CONVERSATION_ID, null, null);

        assertThat(archived).extracting(ChatMessageView::getContent).containsExactly("old news");
        verify(archivedMessageRepository).findByConversationIdOrderByCreatedAtDesc(eq(CONVERSATION_ID),
            argThat(page -> page.getPageSize() == 50 && page.getOffset() == 0));
    }

    @Test
    void placeholderMessageIdIsANoOp() {
        assertThat(pipeline.markMessageRead(CUSTOMER, CONVERSATION_ID, "temp-123")).isFalse();

        verifyNoInteractions(accessGate, unreadCoordinator);
    }

    @Test
    void markMessageReadNotifiesSenderOnTransition() {
        String messageId = UUID.randomUUID().toString();
        when(unreadCoordinator.markMessageRead(CONVERSATION_ID, messageId, CUSTOMER_ID, ChatRole.CUSTOMER)).thenReturn(true);

        assertThat(pipeline.markMessageRead(CUSTOMER, CONVERSATION_ID, messageId)).isTrue();

        verify(registry).notifyUser(eq(VENDOR_ID), argThat(message ->
            message.getType() == EventType.MESSAGES_READ && messageId.equals(message.stringField("messageId"))));
    }

    @Test
    void markMessageReadWithoutTransitionStaysQuiet() {
        String messageId = UUID.randomUUID().toString();

        assertThat(pipeline.markMessageRead(CUSTOMER, CONVERSATION_ID, messageId)).isFalse();

        verify(registry, never()).notifyUser(anyString(), any(WebSocketMessage.class));
    }

    @Test
    void markConversationReadAlwaysNotifiesTheOtherParty() {
        when(unreadCoordinator.markConversationRead(CONVERSATION_ID, ChatRole.VENDOR)).thenReturn(0);

        assertThat(pipeline.markConversationRead(VENDOR, CONVERSATION_ID)).isZero();

        verify(registry).notifyUser(eq(CUSTOMER_ID), argThat(message -> message.getType() == EventType.MESSAGES_READ));
        verify(eventPublisher, never()).publishMessagesRead(anyString(), anyString(), anyInt());
    }

    @Test
    void onlyCustomersStartConversations() {
        assertThatThrownBy(() -> pipeline.createConversation(VENDOR, UUID.randomUUID().toString()))
            .isInstanceOf(ChatAccessDeniedException.class);
        assertThatThrownBy(() -> pipeline.createConversation(CUSTOMER, "vendor-1"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Invalid vendor ID format");
    }

    @Test
    void newConversationIsAnnounced() {
        when(accessGate.getOrCreate(CUSTOMER_ID, VENDOR_ID)).thenReturn(new ConversationCreation(CONVERSATION_ID, true));

        ConversationCreation creation = pipeline.createConversation(CUSTOMER, VENDOR_ID);

        assertThat(creation.isCreated()).isTrue();
        verify(eventPublisher).publishConversationCreated(CONVERSATION_ID, CUSTOMER_ID, VENDOR_ID);
    }

    @Test
    void existingConversationIsNotAnnouncedAgain() {
        when(accessGate.getOrCreate(CUSTOMER_ID, VENDOR_ID)).thenReturn(new ConversationCreation(CONVERSATION_ID, false));

        pipeline.createConversation(CUSTOMER, VENDOR_ID);

        verify(eventPublisher, never()).publishConversationCreated(anyString(), anyString(), anyString());
    }

    @Test
    void listShowsTheOtherPartyAndOwnUnreadCount() {
        ConversationEntity conversation = ConversationEntity.builder()
            .id(CONVERSATION_ID)
            .customerId(CUSTOMER_ID)
            .vendorId(VENDOR_ID)
            .customerUnreadCount(3)
            .vendorUnreadCount(7)
            .createdAt(Instant.now())
            .updatedAt(Instant.now())
            .build();
        when(conversationRepository.findForVendor(VENDOR_ID)).thenReturn(List.of(conversation));

        List<ConversationSummary> summaries = pipeline.listConversations(VENDOR);

        assertThat(summaries).hasSize(1);
        assertThat(summaries.get(0).getOtherParty().getId()).isEqualTo(CUSTOMER_ID);
        assertThat(summaries.get(0).getOtherParty().getRole()).isEqualTo(ChatRole.CUSTOMER);
        assertThat(summaries.get(0).getUnreadCount()).isEqualTo(7);
    }

    @Test
    void adminsHaveNoInbox() {
        ChatIdentity admin = ChatIdentity.of(UUID.randomUUID().toString(), ChatRole.ADMIN);

        assertThatThrownBy(() -> pipeline.unreadCount(admin)).isInstanceOf(ChatAccessDeniedException.class);
        assertThatThrownBy(() -> pipeline.listConversations(admin)).isInstanceOf(ChatAccessDeniedException.class);
    }

    private static MessageEntity storedMessage(String id, String senderId, String text) {
        return MessageEntity.builder()
            .id(id)
            .conversationId(CONVERSATION_ID)
            .senderId(senderId)
            .senderRole(senderId.equals(CUSTOMER_ID) ? ChatRole.CUSTOMER : ChatRole.VENDOR)
            .encryptedContent(codec.encode(text).getCiphertext())
            .contentHash(MessageCodec.digest(text))
            .createdAt(Instant.parse("2024-05-01T09:00:00Z"))
            .build();
    }
}

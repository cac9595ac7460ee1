package com.market.chat.infrastructure;

import com.market.chat.domain.ChatIdentity;
import com.market.chat.domain.ChatRole;
import com.market.chat.domain.ConversationCreation;
import com.market.chat.domain.ConversationEntity;
import com.market.chat.domain.ConversationParticipants;
import com.market.chat.domain.EncodedMessage;
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
import com.market.chat.repository.OffsetPageRequest;
import com.market.chat.service.ChatValidator;
import com.market.chat.service.ConversationAccessGate;
import com.market.chat.service.EmailNotifier;
import com.market.chat.service.EventPublisher;
import com.market.chat.service.MessageCodec;
import com.market.chat.service.MessageRateLimiter;
import com.market.chat.service.MessageSanitizer;
import com.market.chat.service.MetricsService;
import com.market.chat.service.UnreadCoordinator;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The one place chat operations are implemented. The WebSocket handler and the
 * REST controller only translate between their transport and these calls.
 *
 * <p>Sending runs validate, authorize, rate-limit, sanitize, encode, persist,
 * fan-out, in that order; any step that fails stops the rest.
 */
@Service
@Slf4j
public class MessagePipeline {

    public static final int HISTORY_LIMIT = 1_000;
    public static final int ARCHIVE_DEFAULT_LIMIT = 50;
    public static final int ARCHIVE_MAX_LIMIT = 200;

    private final ChatValidator validator;
    private final MessageSanitizer sanitizer;
    private final MessageCodec codec;
    private final MessageRateLimiter rateLimiter;
    private final ConversationAccessGate accessGate;
    private final UnreadCoordinator unreadCoordinator;
    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final ArchivedMessageRepository archivedMessageRepository;
    private final ConnectionRegistry registry;
    private final BoundedCallExecutor bounded;
    private final EmailNotifier emailNotifier;
    private final MetricsService metricsService;

    // Optional: null when Kafka is disabled
    private final EventPublisher eventPublisher;

    @Value("${chat.notifications.email-enabled:true}")
    private boolean emailEnabled = true;

    public MessagePipeline(ChatValidator validator,
                           MessageSanitizer sanitizer,
                           MessageCodec codec,
                           MessageRateLimiter rateLimiter,
                           ConversationAccessGate accessGate,
                           UnreadCoordinator unreadCoordinator,
                           ConversationRepository conversationRepository,
                           MessageRepository messageRepository,
                           ArchivedMessageRepository archivedMessageRepository,
                           ConnectionRegistry registry,
                           BoundedCallExecutor bounded,
                           EmailNotifier emailNotifier,
                           MetricsService metricsService,
                           @Autowired(required = false) EventPublisher eventPublisher) {
        this.validator = validator;
        this.sanitizer = sanitizer;
        this.codec = codec;
        this.rateLimiter = rateLimiter;
        this.accessGate = accessGate;
        this.unreadCoordinator = unreadCoordinator;
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.archivedMessageRepository = archivedMessageRepository;
        this.registry = registry;
        this.bounded = bounded;
        this.emailNotifier = emailNotifier;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;

        if (eventPublisher != null) {
            log.info("Kafka EventPublisher enabled for chat events");
        } else {
            log.info("Kafka EventPublisher disabled");
        }
    }

    // ===== Sending =====

    /**
     * Send a message and deliver it to everyone in the conversation.
     *
     * @param clientMessageId optional client-generated UUID; a retry with the same id
     *                        returns the stored message instead of writing a second one
     * @param transport       {@code websocket} or {@code rest}, for metrics only
     */
    public ChatMessageView send(ChatIdentity identity, String conversationId, String content,
                                String clientMessageId, String transport) {
        Timer.Sample sample = metricsService.startTimer();

        // 1. validate
        validator.require(validator.validateConversationId(conversationId));
        validator.require(validator.validateContent(content));
        if (clientMessageId != null && !validator.isUuid(clientMessageId)) {
            throw new ValidationException("Invalid client message ID format");
        }

        // 2. resolve + authorize
        ConversationParticipants participants = bounded.store("resolve conversation",
            () -> accessGate.requireParticipant(conversationId, identity));

        if (clientMessageId != null) {
            Optional<ChatMessageView> replay = findReplay(identity, conversationId, clientMessageId);
            if (replay.isPresent()) {
                log.info("Idempotent send replayed: messageId={}, conversationId={}", clientMessageId, conversationId);
                return replay.get();
            }
        }

        // 3. rate limit
        RateLimitDecision decision = rateLimiter.isRemote()
            ? bounded.store("rate limit", () -> rateLimiter.checkAndConsume(identity.getUserId()))
            : rateLimiter.checkAndConsume(identity.getUserId());
        if (!decision.isAllowed()) {
            metricsService.recordRateLimited(identity.getUserId());
            throw new RateLimitedException(decision.getRetryAfterSeconds());
        }

        // 4. sanitize
        String sanitized = sanitizer.sanitize(content);
        if (sanitized.isEmpty()) {
            throw new ValidationException("Message content cannot be empty");
        }

        // 5. encode
        EncodedMessage encoded = bounded.codec("encrypt message", () -> codec.encode(sanitized));

        // 6. persist
        MessageEntity message = MessageEntity.builder()
            .id(clientMessageId != null ? clientMessageId : UUID.randomUUID().toString())
            .conversationId(conversationId)
            .senderId(identity.getUserId())
            .senderRole(identity.getRole())
            .encryptedContent(encoded.getCiphertext())
            .contentHash(encoded.getContentHash())
            .compressed(encoded.isCompressed())
            .read(false)
            .build();

        MessageEntity saved;
        try {
            saved = bounded.store("persist message", () -> unreadCoordinator.recordNewMessage(message));
        } catch (DataIntegrityViolationException e) {
            if (clientMessageId == null) {
                throw new StoreConflictException("Message could not be stored, please retry", e);
            }
            // A concurrent retry with the same client id won
            return findReplay(identity, conversationId, clientMessageId)
                .orElseThrow(() -> new StoreConflictException("Message ID already in use", e));
        }

        // 7. fan-out, decoded from what was actually stored
        ChatMessageView view = toView(saved);
        fanOutNewMessage(participants, view);
        notifyOfflineRecipient(participants, identity, conversationId);
        if (eventPublisher != null) {
            eventPublisher.publishMessageSent(conversationId, saved.getId(), identity.getUserId(),
                identity.getRole().wireName());
        }

        metricsService.recordMessageSent(transport);
        metricsService.stopTimer(sample, "chat.pipeline.send", "transport", transport);
        log.info("Message sent: messageId={}, conversationId={}, senderId={}, compressed={}",
            saved.getId(), conversationId, identity.getUserId(), saved.isCompressed());
        return view;
    }

    private Optional<ChatMessageView> findReplay(ChatIdentity identity, String conversationId, String messageId) {
        Optional<MessageEntity> existing = bounded.store("find message",
            () -> messageRepository.findByIdAndConversationId(messageId, conversationId));
        if (existing.isEmpty()) {
            if (bounded.store("check message id", () -> messageRepository.existsById(messageId))) {
                throw new StoreConflictException("Message ID already in use");
            }
            return Optional.empty();
        }
        if (!existing.get().getSenderId().equals(identity.getUserId())) {
            throw new StoreConflictException("Message ID already in use");
        }
        return Optional.of(toView(existing.get()));
    }

    private void fanOutNewMessage(ConversationParticipants participants, ChatMessageView view) {
        String conversationId = participants.getConversationId();
        Map<String, Object> newMessage = new HashMap<>();
        newMessage.put("conversationId", conversationId);
        newMessage.put("message", view);
        registry.fanOut(ConnectionRegistry.conversationRoom(conversationId),
            WebSocketMessage.of(EventType.NEW_MESSAGE, newMessage));

        WebSocketMessage updated = WebSocketMessage.of(EventType.CONVERSATION_UPDATED,
            Map.of("conversationId", conversationId));
        registry.notifyUser(participants.getCustomerId(), updated);
        registry.notifyUser(participants.getVendorId(), updated);
    }

    private void notifyOfflineRecipient(ConversationParticipants participants, ChatIdentity sender, String conversationId) {
        if (!emailEnabled) {
            return;
        }
        ChatRole recipientRole = sender.getRole().counterpart();
        String recipientId = participants.participantId(recipientRole);
        if (registry.isOnline(recipientId)) {
            return;
        }
        bounded.runAsync("email notification",
            () -> emailNotifier.notifyNewMessage(recipientId, recipientRole, conversationId, sender.getUserId()));
    }

    // ===== Conversations =====

    public ConversationParticipants joinConversation(ChatIdentity identity, String conversationId) {
        validator.require(validator.validateConversationId(conversationId));
        return bounded.store("resolve conversation", () -> accessGate.requireParticipant(conversationId, identity));
    }

    public List<ConversationSummary> listConversations(ChatIdentity identity) {
        ChatRole role = requireParticipantRole(identity);
        List<ConversationEntity> conversations = bounded.store("list conversations", () -> role == ChatRole.CUSTOMER
            ? conversationRepository.findForCustomer(identity.getUserId())
            : conversationRepository.findForVendor(identity.getUserId()));

        ChatRole otherRole = role.counterpart();
        return conversations.stream()
            .map(conversation -> ConversationSummary.builder()
                .id(conversation.getId())
                .otherParty(new ConversationSummary.OtherParty(conversation.participantId(otherRole), otherRole))
                .unreadCount(conversation.unreadCountFor(role))
                .lastMessageAt(conversation.getLastMessageAt())
                .createdAt(conversation.getCreatedAt())
                .updatedAt(conversation.getUpdatedAt())
                .build())
            .collect(Collectors.toList());
    }

    public ConversationCreation createConversation(ChatIdentity identity, String vendorId) {
        if (identity.getRole() != ChatRole.CUSTOMER) {
            throw new ChatAccessDeniedException("Only customers can start conversations");
        }
        validator.require(validator.validateVendorId(vendorId));

        ConversationCreation creation = bounded.store("create conversation",
            () -> accessGate.getOrCreate(identity.getUserId(), vendorId));
        if (creation.isCreated() && eventPublisher != null) {
            eventPublisher.publishConversationCreated(creation.getConversationId(), identity.getUserId(), vendorId);
        }
        return creation;
    }

    // ===== Reading =====

    public List<ChatMessageView> history(ChatIdentity identity, String conversationId) {
        validator.require(validator.validateConversationId(conversationId));
        bounded.store("resolve conversation", () -> accessGate.requireParticipant(conversationId, identity));

        List<MessageEntity> messages = bounded.store("load history",
            () -> messageRepository.findByConversationIdOrderByCreatedAtAsc(conversationId, PageRequest.of(0, HISTORY_LIMIT)));
        return messages.stream().map(this::toView).collect(Collectors.toList());
    }

    /**
     * Archived messages of one conversation, newest first.
     */
    public List<ChatMessageView> archivedHistory(ChatIdentity identity, String conversationId, Integer limit, Integer offset) {
        validator.require(validator.validateConversationId(conversationId));
        int pageSize = limit == null ? ARCHIVE_DEFAULT_LIMIT : limit;
        int start = offset == null ? 0 : offset;
        if (pageSize < 1 || pageSize > ARCHIVE_MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + ARCHIVE_MAX_LIMIT);
        }
        if (start < 0) {
            throw new ValidationException("offset must not be negative");
        }
        bounded.store("resolve conversation", () -> accessGate.requireParticipant(conversationId, identity));

        return bounded.store("load archived history",
                () -> archivedMessageRepository.findByConversationIdOrderByCreatedAtDesc(conversationId,
                    new OffsetPageRequest(start, pageSize)))
            .stream()
            .map(MessageEntity::fromArchive)
            .map(this::toView)
            .collect(Collectors.toList());
    }

    /**
     * Mark one message read by the caller. Placeholder ids, unknown ids and the
     * caller's own messages are silently ignored.
     *
     * @return true when the message transitioned to read
     */
    public boolean markMessageRead(ChatIdentity identity, String conversationId, String messageId) {
        validator.require(validator.validateConversationId(conversationId));
        validator.require(validator.validateMessageId(messageId));
        if (messageId.startsWith(ChatValidator.TEMP_MESSAGE_PREFIX)) {
            return false;
        }
        ConversationParticipants participants = bounded.store("resolve conversation",
            () -> accessGate.requireParticipant(conversationId, identity));

        boolean transitioned = bounded.store("mark message read",
            () -> unreadCoordinator.markMessageRead(conversationId, messageId, identity.getUserId(), identity.getRole()));
        if (transitioned) {
            Map<String, Object> data = new HashMap<>();
            data.put("conversationId", conversationId);
            data.put("messageId", messageId);
            notifyCounterpart(participants, identity, WebSocketMessage.of(EventType.MESSAGES_READ, data));
        }
        return transitioned;
    }

    /**
     * Mark every unread message from the other party as read.
     *
     * @return number of messages that transitioned
     */
    public int markConversationRead(ChatIdentity identity, String conversationId) {
        validator.require(validator.validateConversationId(conversationId));
        ConversationParticipants participants = bounded.store("resolve conversation",
            () -> accessGate.requireParticipant(conversationId, identity));

        int count = bounded.store("mark conversation read",
            () -> unreadCoordinator.markConversationRead(conversationId, identity.getRole()));

        notifyCounterpart(participants, identity,
            WebSocketMessage.of(EventType.MESSAGES_READ, Map.of("conversationId", conversationId)));
        if (count > 0 && eventPublisher != null) {
            eventPublisher.publishMessagesRead(conversationId, identity.getUserId(), count);
        }
        log.debug("Conversation read: conversationId={}, readerId={}, count={}", conversationId, identity.getUserId(), count);
        return count;
    }

    public long unreadCount(ChatIdentity identity) {
        ChatRole role = requireParticipantRole(identity);
        return bounded.store("unread count", () -> role == ChatRole.CUSTOMER
            ? conversationRepository.sumCustomerUnread(identity.getUserId())
            : conversationRepository.sumVendorUnread(identity.getUserId()));
    }

    // ===== Helpers =====

    /**
     * Decode one stored message within the codec timeout. Never throws: unreadable
     * or timed-out content becomes a placeholder.
     */
    ChatMessageView toView(MessageEntity message) {
        ChatMessageView.ChatMessageViewBuilder view = ChatMessageView.builder()
            .id(message.getId())
            .conversationId(message.getConversationId())
            .senderId(message.getSenderId())
            .senderRole(message.getSenderRole())
            .read(message.isRead())
            .readAt(message.getReadAt())
            .createdAt(message.getCreatedAt());

        String ciphertext = message.getEncryptedContent();
        if (ciphertext == null || ciphertext.isEmpty()) {
            return view.content(ChatMessageView.CONTENT_MISSING_PLACEHOLDER).contentMissing(true).build();
        }
        try {
            return view.content(bounded.codec("decrypt message", () -> codec.decode(ciphertext))).build();
        } catch (RuntimeException e) {
            log.warn("Failed to decrypt message {}: {}", message.getId(), e.getMessage());
            metricsService.recordDecryptFailure(message.getId());
            return view.content(ChatMessageView.DECRYPTION_FAILED_PLACEHOLDER).decryptionError(true).build();
        }
    }

    private void notifyCounterpart(ConversationParticipants participants, ChatIdentity identity, WebSocketMessage event) {
        try {
            registry.notifyUser(participants.participantId(identity.getRole().counterpart()), event);
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} for conversation {}: {}",
                event.getType(), participants.getConversationId(), e.getMessage());
        }
    }

    private ChatRole requireParticipantRole(ChatIdentity identity) {
        if (identity.getRole() == null || !identity.getRole().isParticipantRole()) {
            throw new ChatAccessDeniedException("Invalid role");
        }
        return identity.getRole();
    }
}

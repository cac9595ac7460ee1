package com.market.chat.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.market.chat.domain.ChatIdentity;
import com.market.chat.domain.ConversationCreation;
import com.market.chat.domain.ConversationEntity;
import com.market.chat.domain.ConversationParticipants;
import com.market.chat.exception.ChatAccessDeniedException;
import com.market.chat.exception.ConversationNotFoundException;
import com.market.chat.exception.StoreConflictException;
import com.market.chat.exception.ValidationException;
import com.market.chat.repository.ConversationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides who may touch a conversation, and creates conversations on demand.
 *
 * Participant pairs never change once written, so they are cached locally;
 * counters are always read from the store.
 */
@Service
@Slf4j
public class ConversationAccessGate {

    private final ConversationRepository conversationRepository;
    private final Cache<String, ConversationParticipants> participantsCache;

    public ConversationAccessGate(
            ConversationRepository conversationRepository,
            @Value("${chat.access.cache-size:50000}") long cacheSize) {
        this.conversationRepository = conversationRepository;
        this.participantsCache = Caffeine.newBuilder()
            .maximumSize(cacheSize)
            .expireAfterAccess(Duration.ofHours(1))
            .build();
    }

    /**
     * @throws ConversationNotFoundException when no conversation has this id
     */
    public ConversationEntity resolve(String conversationId) {
        ConversationEntity conversation = conversationRepository.findById(conversationId)
            .orElseThrow(ConversationNotFoundException::new);
        participantsCache.put(conversationId, ConversationParticipants.of(conversation));
        return conversation;
    }

    public boolean authorize(ConversationEntity conversation, ChatIdentity identity) {
        return conversation != null && conversation.isParticipant(identity);
    }

    /**
     * Resolve and authorize in one step. Only the participant pair is returned; it may
     * come from the cache.
     *
     * @throws ConversationNotFoundException when the conversation does not exist
     * @throws ChatAccessDeniedException     when the caller is not its customer or vendor
     */
    public ConversationParticipants requireParticipant(String conversationId, ChatIdentity identity) {
        ConversationParticipants participants = participantsCache.getIfPresent(conversationId);
        if (participants == null) {
            participants = ConversationParticipants.of(resolve(conversationId));
        }
        if (!participants.isParticipant(identity)) {
            log.warn("Access denied: userId={}, role={}, conversationId={}",
                identity.getUserId(), identity.getRole(), conversationId);
            throw new ChatAccessDeniedException();
        }
        return participants;
    }

    /**
     * Idempotent: concurrent callers for the same pair all end up with the same id.
     */
    public ConversationCreation getOrCreate(String customerId, String vendorId) {
        if (customerId.equals(vendorId)) {
            throw new ValidationException("Cannot start a conversation with yourself");
        }

        Optional<ConversationEntity> existing = conversationRepository.findByCustomerIdAndVendorId(customerId, vendorId);
        if (existing.isPresent()) {
            return new ConversationCreation(existing.get().getId(), false);
        }

        ConversationEntity conversation = ConversationEntity.builder()
            .id(UUID.randomUUID().toString())
            .customerId(customerId)
            .vendorId(vendorId)
            .build();
        try {
            conversationRepository.saveAndFlush(conversation);
            participantsCache.put(conversation.getId(), ConversationParticipants.of(conversation));
            log.info("Conversation created: conversationId={}, customerId={}, vendorId={}",
                conversation.getId(), customerId, vendorId);
            return new ConversationCreation(conversation.getId(), true);
        } catch (DataIntegrityViolationException e) {
            // Lost the race on uk_conversation_pair: the winner's row is there now
            log.debug("Concurrent conversation creation: customerId={}, vendorId={}", customerId, vendorId);
            return conversationRepository.findByCustomerIdAndVendorId(customerId, vendorId)
                .map(winner -> new ConversationCreation(winner.getId(), false))
                .orElseThrow(() -> new StoreConflictException("Conversation could not be created, please retry", e));
        }
    }
}

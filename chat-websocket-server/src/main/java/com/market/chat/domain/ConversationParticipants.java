package com.market.chat.domain;

import lombok.Value;

/**
 * The immutable part of a conversation: who is allowed in.
 */
@Value
public class ConversationParticipants {
    String conversationId;
    String customerId;
    String vendorId;

    public static ConversationParticipants of(ConversationEntity conversation) {
        return new ConversationParticipants(conversation.getId(), conversation.getCustomerId(), conversation.getVendorId());
    }

    public boolean isParticipant(ChatIdentity identity) {
        if (identity == null || identity.getUserId() == null || identity.getRole() == null) {
            return false;
        }
        switch (identity.getRole()) {
            case CUSTOMER:
                return identity.getUserId().equals(customerId);
            case VENDOR:
                return identity.getUserId().equals(vendorId);
            default:
                return false;
        }
    }

    public String participantId(ChatRole role) {
        return role == ChatRole.CUSTOMER ? customerId : vendorId;
    }
}

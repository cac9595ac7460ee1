package com.market.chat.model;

import com.market.chat.domain.ChatRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSummary {
    private String id;
    private OtherParty otherParty;
    private int unreadCount;
    private Instant lastMessageAt;
    private Instant createdAt;
    private Instant updatedAt;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class OtherParty {
        private String id;
        private ChatRole role;
    }
}

package com.market.chat.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.market.chat.domain.ChatRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Decrypted, request-scoped representation of a message as sent to clients.
 * Plaintext never leaves this object towards storage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageView {

    public static final String DECRYPTION_FAILED_PLACEHOLDER =
        "[This message was encrypted with an old key and cannot be decrypted]";
    public static final String CONTENT_MISSING_PLACEHOLDER = "[Message content missing]";

    private String id;
    private String conversationId;
    private String content;
    private String senderId;
    private ChatRole senderRole;

    @JsonProperty("isRead")
    private boolean read;

    private Instant readAt;
    private Instant createdAt;

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private boolean decryptionError;

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private boolean contentMissing;
}

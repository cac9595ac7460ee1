package com.market.chat.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Cold-storage copy of a message moved out of the hot table.
 */
@Entity
@Table(name = "messages_archive", indexes = {
    @Index(name = "idx_messages_archive_conversation_id", columnList = "conversation_id"),
    @Index(name = "idx_messages_archive_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchivedMessageEntity implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "conversation_id", nullable = false, length = 36)
    private String conversationId;

    @Column(name = "sender_id", nullable = false, length = 36)
    private String senderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "sender_role", nullable = false, length = 20)
    private ChatRole senderRole;

    @Column(name = "encrypted_content", nullable = false, columnDefinition = "TEXT")
    private String encryptedContent;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "read_at")
    private Instant readAt;

    @Column(name = "is_compressed", nullable = false)
    private boolean compressed;

    @Column(name = "content_size")
    private Integer contentSize;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "archived_at", nullable = false)
    private Instant archivedAt;

    public static ArchivedMessageEntity fromMessage(MessageEntity message, Instant archivedAt) {
        return ArchivedMessageEntity.builder()
            .id(message.getId())
            .conversationId(message.getConversationId())
            .senderId(message.getSenderId())
            .senderRole(message.getSenderRole())
            .encryptedContent(message.getEncryptedContent())
            .contentHash(message.getContentHash())
            .read(message.isRead())
            .readAt(message.getReadAt())
            .compressed(message.isCompressed())
            .contentSize(message.getEncryptedContent() != null ? message.getEncryptedContent().length() : 0)
            .createdAt(message.getCreatedAt())
            .archivedAt(archivedAt)
            .build();
    }
}

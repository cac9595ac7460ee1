package com.market.chat.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.io.Serializable;
import java.time.Instant;

/**
 * A stored message. Content is only ever held as ciphertext.
 */
@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_messages_conversation_id", columnList = "conversation_id"),
    @Index(name = "idx_messages_created_at", columnList = "created_at"),
    @Index(name = "idx_messages_sender_id", columnList = "sender_id"),
    @Index(name = "idx_messages_is_read", columnList = "is_read")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEntity implements Persistable<String>, Serializable {
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

    /**
     * Rows are inserted with assigned ids; a duplicate id must surface as a constraint
     * violation instead of being merged into the existing row.
     */
    @Transient
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private boolean newEntity = true;

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        newEntity = false;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        contentSize = encryptedContent != null ? encryptedContent.length() : 0;
    }

    public static MessageEntity fromArchive(ArchivedMessageEntity archived) {
        return MessageEntity.builder()
            .id(archived.getId())
            .conversationId(archived.getConversationId())
            .senderId(archived.getSenderId())
            .senderRole(archived.getSenderRole())
            .encryptedContent(archived.getEncryptedContent())
            .contentHash(archived.getContentHash())
            .read(archived.isRead())
            .readAt(archived.getReadAt())
            .compressed(archived.isCompressed())
            .contentSize(archived.getContentSize())
            .createdAt(archived.getCreatedAt())
            .build();
    }
}

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
 * The unique channel between one customer and one vendor.
 */
@Entity
@Table(name = "conversations",
    uniqueConstraints = @UniqueConstraint(name = "uk_conversation_pair", columnNames = {"customer_id", "vendor_id"}),
    indexes = {
        @Index(name = "idx_conversations_customer_id", columnList = "customer_id"),
        @Index(name = "idx_conversations_vendor_id", columnList = "vendor_id"),
        @Index(name = "idx_conversations_updated_at", columnList = "updated_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationEntity implements Persistable<String>, Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "customer_id", nullable = false, length = 36)
    private String customerId;

    @Column(name = "vendor_id", nullable = false, length = 36)
    private String vendorId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "customer_unread_count", nullable = false)
    private int customerUnreadCount;

    @Column(name = "vendor_unread_count", nullable = false)
    private int vendorUnreadCount;

    public boolean isParticipant(ChatIdentity identity) {
        return ConversationParticipants.of(this).isParticipant(identity);
    }

    public String participantId(ChatRole role) {
        return role == ChatRole.CUSTOMER ? customerId : vendorId;
    }

    public int unreadCountFor(ChatRole role) {
        int count = role == ChatRole.CUSTOMER ? customerUnreadCount : vendorUnreadCount;
        return Math.max(0, count);
    }

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
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
}

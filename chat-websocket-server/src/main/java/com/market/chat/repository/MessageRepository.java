package com.market.chat.repository;

import com.market.chat.domain.ChatRole;
import com.market.chat.domain.MessageEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for hot (active) messages.
 */
@Repository
public interface MessageRepository extends JpaRepository<MessageEntity, String> {

    List<MessageEntity> findByConversationIdOrderByCreatedAtAsc(String conversationId, Pageable pageable);

    Optional<MessageEntity> findByIdAndConversationId(String id, String conversationId);

    /**
     * Flip a single message to read. Only the recipient can do so, and only once.
     *
     * @return 1 on a transition, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE MessageEntity m SET m.read = true, m.readAt = :now " +
           "WHERE m.id = :messageId " +
           "AND m.conversationId = :conversationId " +
           "AND m.senderId <> :readerId " +
           "AND m.read = false")
    int markRead(@Param("conversationId") String conversationId,
                 @Param("messageId") String messageId,
                 @Param("readerId") String readerId,
                 @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE MessageEntity m SET m.read = true, m.readAt = :now " +
           "WHERE m.conversationId = :conversationId " +
           "AND m.senderRole = :senderRole " +
           "AND m.read = false")
    int markAllReadFromRole(@Param("conversationId") String conversationId,
                            @Param("senderRole") ChatRole senderRole,
                            @Param("now") Instant now);

    @Query("SELECT m.id FROM MessageEntity m " +
           "WHERE m.createdAt < :cutoff AND m.read = true " +
           "ORDER BY m.createdAt ASC")
    List<String> findArchivableIds(@Param("cutoff") Instant cutoff, Pageable pageable);

    @Query("SELECT COUNT(m) FROM MessageEntity m WHERE m.createdAt < :cutoff AND m.read = true")
    long countArchivable(@Param("cutoff") Instant cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM MessageEntity m WHERE m.id IN :ids")
    int deleteByIds(@Param("ids") Collection<String> ids);

    @Query("SELECT COALESCE(SUM(m.contentSize), 0) FROM MessageEntity m")
    long sumContentSize();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE MessageEntity m SET m.encryptedContent = :ciphertext, " +
           "m.compressed = :compressed, m.contentSize = :contentSize " +
           "WHERE m.id = :messageId")
    int replaceCiphertext(@Param("messageId") String messageId,
                          @Param("ciphertext") String ciphertext,
                          @Param("compressed") boolean compressed,
                          @Param("contentSize") int contentSize);
}

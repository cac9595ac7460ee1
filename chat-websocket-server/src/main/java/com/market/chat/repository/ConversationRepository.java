package com.market.chat.repository;

import com.market.chat.domain.ConversationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for conversations. Counter updates are single statements so that
 * concurrent senders never lose an increment.
 */
@Repository
public interface ConversationRepository extends JpaRepository<ConversationEntity, String> {

    Optional<ConversationEntity> findByCustomerIdAndVendorId(String customerId, String vendorId);

    @Query("SELECT c FROM ConversationEntity c " +
           "WHERE c.customerId = :customerId " +
           "ORDER BY c.lastMessageAt DESC NULLS LAST, c.createdAt DESC")
    List<ConversationEntity> findForCustomer(@Param("customerId") String customerId);

    @Query("SELECT c FROM ConversationEntity c " +
           "WHERE c.vendorId = :vendorId " +
           "ORDER BY c.lastMessageAt DESC NULLS LAST, c.createdAt DESC")
    List<ConversationEntity> findForVendor(@Param("vendorId") String vendorId);

    /**
     * A customer sent a message: the vendor has one more unread.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ConversationEntity c " +
           "SET c.vendorUnreadCount = c.vendorUnreadCount + 1, " +
           "c.lastMessageAt = :now, c.updatedAt = :now " +
           "WHERE c.id = :conversationId")
    int incrementVendorUnread(@Param("conversationId") String conversationId, @Param("now") Instant now);

    /**
     * A vendor sent a message: the customer has one more unread.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ConversationEntity c " +
           "SET c.customerUnreadCount = c.customerUnreadCount + 1, " +
           "c.lastMessageAt = :now, c.updatedAt = :now " +
           "WHERE c.id = :conversationId")
    int incrementCustomerUnread(@Param("conversationId") String conversationId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ConversationEntity c " +
           "SET c.customerUnreadCount = CASE WHEN c.customerUnreadCount > :amount " +
           "THEN c.customerUnreadCount - :amount ELSE 0 END, c.updatedAt = :now " +
           "WHERE c.id = :conversationId")
    int decrementCustomerUnread(@Param("conversationId") String conversationId,
                                @Param("amount") int amount,
                                @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ConversationEntity c " +
           "SET c.vendorUnreadCount = CASE WHEN c.vendorUnreadCount > :amount " +
           "THEN c.vendorUnreadCount - :amount ELSE 0 END, c.updatedAt = :now " +
           "WHERE c.id = :conversationId")
    int decrementVendorUnread(@Param("conversationId") String conversationId,
                              @Param("amount") int amount,
                              @Param("now") Instant now);

    @Query("SELECT COALESCE(SUM(CASE WHEN c.customerUnreadCount > 0 THEN c.customerUnreadCount ELSE 0 END), 0) " +
           "FROM ConversationEntity c WHERE c.customerId = :customerId")
    long sumCustomerUnread(@Param("customerId") String customerId);

    @Query("SELECT COALESCE(SUM(CASE WHEN c.vendorUnreadCount > 0 THEN c.vendorUnreadCount ELSE 0 END), 0) " +
           "FROM ConversationEntity c WHERE c.vendorId = :vendorId")
    long sumVendorUnread(@Param("vendorId") String vendorId);
}

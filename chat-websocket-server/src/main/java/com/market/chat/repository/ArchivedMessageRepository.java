package com.market.chat.repository;

import com.market.chat.domain.ArchivedMessageEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for cold (archived) messages.
 */
@Repository
public interface ArchivedMessageRepository extends JpaRepository<ArchivedMessageEntity, String> {

    List<ArchivedMessageEntity> findByConversationIdOrderByCreatedAtDesc(String conversationId, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ArchivedMessageEntity a WHERE a.id IN :ids")
    int deleteByIds(@Param("ids") Collection<String> ids);

    @Query("SELECT COALESCE(SUM(a.contentSize), 0) FROM ArchivedMessageEntity a")
    long sumContentSize();
}

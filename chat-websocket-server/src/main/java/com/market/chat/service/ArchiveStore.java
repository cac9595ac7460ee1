package com.market.chat.service;

import com.market.chat.domain.ArchivedMessageEntity;
import com.market.chat.domain.MessageEntity;
import com.market.chat.repository.ArchivedMessageRepository;
import com.market.chat.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The individual steps of a hot/cold move. Each public method is its own
 * transaction so that a failed delete never rolls back a completed copy.
 */
@Service
@RequiredArgsConstructor
class ArchiveStore {

    private final MessageRepository messageRepository;
    private final ArchivedMessageRepository archivedMessageRepository;

    /**
     * Copy hot rows into the archive. Re-copying an already archived id overwrites it.
     *
     * @return ids actually copied
     */
    @Transactional
    public List<String> copyToArchive(List<String> ids, Instant archivedAt) {
        List<ArchivedMessageEntity> copies = messageRepository.findAllById(ids).stream()
            .map(message -> ArchivedMessageEntity.fromMessage(message, archivedAt))
            .collect(Collectors.toList());
        archivedMessageRepository.saveAll(copies);
        return copies.stream().map(ArchivedMessageEntity::getId).collect(Collectors.toList());
    }

    @Transactional
    public int pruneHot(List<String> ids) {
        return messageRepository.deleteByIds(ids);
    }

    /**
     * Copy archived rows back into the hot table, skipping ids already there.
     *
     * @return ids present in the archive (copied now or earlier)
     */
    @Transactional
    public List<String> copyToHot(List<String> ids) {
        List<ArchivedMessageEntity> archived = archivedMessageRepository.findAllById(ids);
        Set<String> alreadyHot = new HashSet<>();
        messageRepository.findAllById(ids).forEach(message -> alreadyHot.add(message.getId()));

        List<MessageEntity> restored = archived.stream()
            .filter(message -> !alreadyHot.contains(message.getId()))
            .map(MessageEntity::fromArchive)
            .collect(Collectors.toList());
        messageRepository.saveAll(restored);
        return archived.stream().map(ArchivedMessageEntity::getId).collect(Collectors.toList());
    }

    @Transactional
    public int pruneArchive(List<String> ids) {
        return archivedMessageRepository.deleteByIds(ids);
    }
}

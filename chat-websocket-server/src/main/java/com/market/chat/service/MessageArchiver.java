package com.market.chat.service;

import com.market.chat.domain.ArchiveResult;
import com.market.chat.domain.RestoreResult;
import com.market.chat.domain.StorageStats;
import com.market.chat.exception.ValidationException;
import com.market.chat.repository.ArchivedMessageRepository;
import com.market.chat.repository.MessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Moves old messages between the hot table and {@code messages_archive}.
 *
 * <p>Only messages that are already read qualify, so moving them never changes
 * an unread counter. Every move copies first and deletes second; a failed delete
 * leaves a duplicate that the next run cleans up, never a lost message.
 */
@Service
@Slf4j
public class MessageArchiver {

    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB"};

    private final ArchiveStore archiveStore;
    private final MessageRepository messageRepository;
    private final ArchivedMessageRepository archivedMessageRepository;
    private final MetricsService metricsService;
    private final Clock clock;
    private final int batchSize;

    public MessageArchiver(
            ArchiveStore archiveStore,
            MessageRepository messageRepository,
            ArchivedMessageRepository archivedMessageRepository,
            MetricsService metricsService,
            Clock clock,
            @Value("${chat.archive.batch-size:1000}") int batchSize) {
        this.archiveStore = archiveStore;
        this.messageRepository = messageRepository;
        this.archivedMessageRepository = archivedMessageRepository;
        this.metricsService = metricsService;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    public ArchiveResult archive(int olderThanDays) {
        Instant cutoff = cutoff(olderThanDays);
        int archived = 0;

        while (true) {
            List<String> ids = messageRepository.findArchivableIds(cutoff, PageRequest.of(0, batchSize));
            if (ids.isEmpty()) {
                break;
            }

            List<String> copied;
            try {
                copied = archiveStore.copyToArchive(ids, clock.instant());
            } catch (RuntimeException e) {
                log.error("❌ Archive copy failed after {} messages: cutoff={}", archived, cutoff, e);
                return finish(ArchiveResult.Status.FAILED, archived, "Failed to copy messages to archive");
            }

            try {
                archiveStore.pruneHot(copied);
            } catch (RuntimeException e) {
                log.error("❌ Archived {} messages but failed to delete them from the main table", copied.size(), e);
                return finish(ArchiveResult.Status.ARCHIVED_NOT_PRUNED, archived + copied.size(),
                    "Archived but failed to delete from main table");
            }

            archived += copied.size();
            log.debug("Archived batch: size={}, total={}", copied.size(), archived);
            if (ids.size() < batchSize) {
                break;
            }
        }

        log.info("✅ Archived {} messages older than {} days", archived, olderThanDays);
        return finish(ArchiveResult.Status.COMPLETED, archived, "Archived " + archived + " messages");
    }

    /**
     * Dry run: how many messages {@link #archive(int)} would move right now.
     */
    public ArchiveResult preview(int olderThanDays) {
        long count = messageRepository.countArchivable(cutoff(olderThanDays));
        return ArchiveResult.builder()
            .status(ArchiveResult.Status.DRY_RUN)
            .archivedCount((int) Math.min(Integer.MAX_VALUE, count))
            .message(count + " messages would be archived")
            .build();
    }

    public RestoreResult restore(List<String> messageIds) {
        if (messageIds == null || messageIds.isEmpty()) {
            throw new ValidationException("messageIds must not be empty");
        }

        List<String> restored;
        try {
            restored = archiveStore.copyToHot(messageIds);
        } catch (RuntimeException e) {
            log.error("❌ Restore failed: requested={}", messageIds.size(), e);
            return RestoreResult.builder()
                .status(RestoreResult.Status.FAILED)
                .restoredCount(0)
                .message("Failed to restore messages")
                .build();
        }
        if (restored.isEmpty()) {
            return RestoreResult.builder()
                .status(RestoreResult.Status.COMPLETED)
                .restoredCount(0)
                .message("No archived messages found")
                .build();
        }

        try {
            archiveStore.pruneArchive(restored);
        } catch (RuntimeException e) {
            log.error("❌ Restored {} messages but failed to delete them from the archive", restored.size(), e);
            return RestoreResult.builder()
                .status(RestoreResult.Status.RESTORED_NOT_PRUNED)
                .restoredCount(restored.size())
                .message("Restored but failed to delete from archive")
                .build();
        }

        log.info("Restored {} archived messages", restored.size());
        return RestoreResult.builder()
            .status(RestoreResult.Status.COMPLETED)
            .restoredCount(restored.size())
            .message("Restored " + restored.size() + " messages")
            .build();
    }

    public StorageStats stats() {
        long activeBytes = messageRepository.sumContentSize();
        long archivedBytes = archivedMessageRepository.sumContentSize();
        return StorageStats.builder()
            .activeCount(messageRepository.count())
            .archivedCount(archivedMessageRepository.count())
            .activeBytes(activeBytes)
            .archivedBytes(archivedBytes)
            .activeSize(formatBytes(activeBytes))
            .archivedSize(formatBytes(archivedBytes))
            .build();
    }

    static String formatBytes(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        int unit = (int) Math.min(SIZE_UNITS.length - 1, Math.floor(Math.log(bytes) / Math.log(1024)));
        BigDecimal scaled = BigDecimal.valueOf(bytes)
            .divide(BigDecimal.valueOf(1024L).pow(unit))
            .setScale(2, RoundingMode.HALF_UP)
            .stripTrailingZeros();
        return scaled.toPlainString() + " " + SIZE_UNITS[unit];
    }

    private Instant cutoff(int olderThanDays) {
        if (olderThanDays < 1) {
            throw new ValidationException("olderThanDays must be at least 1");
        }
        return clock.instant().minus(Duration.ofDays(olderThanDays));
    }

    private ArchiveResult finish(ArchiveResult.Status status, int count, String message) {
        metricsService.recordArchiveRun(status.name(), count);
        return ArchiveResult.builder()
            .status(status)
            .archivedCount(count)
            .message(message)
            .build();
    }
}

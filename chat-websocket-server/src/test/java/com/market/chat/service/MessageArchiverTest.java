package com.market.chat.service;

import com.market.chat.domain.ArchiveResult;
import com.market.chat.domain.ArchivedMessageEntity;
import com.market.chat.domain.ChatRole;
import com.market.chat.domain.MessageEntity;
import com.market.chat.domain.RestoreResult;
import com.market.chat.domain.StorageStats;
import com.market.chat.exception.ValidationException;
import com.market.chat.repository.ArchivedMessageRepository;
import com.market.chat.repository.MessageRepository;
import com.market.chat.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({MessageArchiver.class, ArchiveStore.class})
@TestPropertySource(properties = "chat.archive.batch-size=2")
class MessageArchiverTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
    private static final String CONVERSATION_ID = "3b241101-e2bb-4255-8caf-4136c566a962";

    @TestConfiguration
    static class Config {
        @Bean
        MutableClock clock() {
            return new MutableClock(NOW);
        }

        @Bean
        MetricsService metricsService() {
            return new MetricsService(new SimpleMeterRegistry());
        }
    }

    @Autowired
    private MessageArchiver archiver;

    @Autowired
    private MessageRepository messageRepository;

    @Autowired
    private ArchivedMessageRepository archivedMessageRepository;

    @Test
    void onlyOldReadMessagesAreArchived() {
        MessageEntity oldRead1 = store(Duration.ofDays(120), true);
        MessageEntity oldRead2 = store(Duration.ofDays(100), true);
        MessageEntity oldRead3 = store(Duration.ofDays(95), true);
        MessageEntity oldUnread = store(Duration.ofDays(200), false);
        MessageEntity recentRead = store(Duration.ofDays(10), true);

        ArchiveResult result = archiver.archive(90);

        assertThat(result.getStatus()).isEqualTo(ArchiveResult.Status.COMPLETED);
        assertThat(result.getArchivedCount()).isEqualTo(3);
        assertThat(archivedMessageRepository.findAllById(List.of(oldRead1.getId(), oldRead2.getId(), oldRead3.getId())))
            .hasSize(3)
            .allSatisfy(archived -> assertThat(archived.getArchivedAt()).isEqualTo(NOW));
        assertThat(messageRepository.findAll())
            .extracting(MessageEntity::getId)
            .containsExactlyInAnyOrder(oldUnread.getId(), recentRead.getId());
    }

    @Test
    void archivedCopyKeepsTheStoredFields() {
        MessageEntity original = store(Duration.ofDays(120), true);

        archiver.archive(90);

        ArchivedMessageEntity archived = archivedMessageRepository.findById(original.getId()).orElseThrow();
        assertThat(archived.getEncryptedContent()).isEqualTo(original.getEncryptedContent());
        assertThat(archived.getConversationId()).isEqualTo(CONVERSATION_ID);
        assertThat(archived.getSenderRole()).isEqualTo(ChatRole.CUSTOMER);
        assertThat(archived.getCreatedAt()).isEqualTo(original.getCreatedAt());
        assertThat(archived.isRead()).isTrue();
    }

    @Test
    void dryRunMovesNothing() {
        store(Duration.ofDays(120), true);
        store(Duration.ofDays(100), true);

        ArchiveResult result = archiver.preview(90);

        assertThat(result.getStatus()).isEqualTo(ArchiveResult.Status.DRY_RUN);
        assertThat(result.getArchivedCount()).isEqualTo(2);
        assertThat(messageRepository.count()).isEqualTo(2);
        assertThat(archivedMessageRepository.count()).isZero();
    }

    @Test
    void nothingToArchive() {
        store(Duration.ofDays(1), true);

        ArchiveResult result = archiver.archive(90);

        assertThat(result.getStatus()).isEqualTo(ArchiveResult.Status.COMPLETED);
        assertThat(result.getArchivedCount()).isZero();
    }

    @Test
    void olderThanDaysMustBePositive() {
        assertThatThrownBy(() -> archiver.archive(0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> archiver.preview(-5)).isInstanceOf(ValidationException.class);
    }

    @Test
    void restoreMovesMessagesBack() {
        MessageEntity message = store(Duration.ofDays(120), true);
        archiver.archive(90);

        RestoreResult result = archiver.restore(List.of(message.getId(), "missing-id"));

        assertThat(result.getStatus()).isEqualTo(RestoreResult.Status.COMPLETED);
        assertThat(result.getRestoredCount()).isEqualTo(1);
        assertThat(archivedMessageRepository.count()).isZero();
        MessageEntity restored = messageRepository.findById(message.getId()).orElseThrow();
        assertThat(restored.getEncryptedContent()).isEqualTo(message.getEncryptedContent());
        assertThat(restored.getCreatedAt()).isEqualTo(message.getCreatedAt());
    }

    @Test
    void restoreOfUnknownIdsIsEmpty() {
        RestoreResult result = archiver.restore(List.of("missing-id"));

        assertThat(result.getStatus()).isEqualTo(RestoreResult.Status.COMPLETED);
        assertThat(result.getRestoredCount()).isZero();
    }

    @Test
    void restoreNeedsIds() {
        assertThatThrownBy(() -> archiver.restore(List.of())).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> archiver.restore(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void statsCountBothTables() {
        store(Duration.ofDays(120), true);
        store(Duration.ofDays(1), false);
        archiver.archive(90);

        StorageStats stats = archiver.stats();

        assertThat(stats.getActiveCount()).isEqualTo(1);
        assertThat(stats.getArchivedCount()).isEqualTo(1);
        assertThat(stats.getActiveBytes()).isEqualTo("P-ciphertext-0".length());
        assertThat(stats.getActiveSize()).endsWith(" B");
    }

    @Test
    void formatsByteSizes() {
        assertThat(MessageArchiver.formatBytes(0)).isEqualTo("0 B");
        assertThat(MessageArchiver.formatBytes(512)).isEqualTo("512 B");
        assertThat(MessageArchiver.formatBytes(1024)).isEqualTo("1 KB");
        assertThat(MessageArchiver.formatBytes(1536)).isEqualTo("1.5 KB");
        assertThat(MessageArchiver.formatBytes(5L * 1024 * 1024)).isEqualTo("5 MB");
    }

    private MessageEntity store(Duration age, boolean read) {
        MessageEntity message = MessageEntity.builder()
            .id(UUID.randomUUID().toString())
            .conversationId(CONVERSATION_ID)
            .senderId("customer-1")
            .senderRole(ChatRole.CUSTOMER)
            .encryptedContent("P-ciphertext-0")
            .contentHash("a".repeat(64))
            .read(read)
            .readAt(read ? NOW.minus(age).plusSeconds(60) : null)
            .createdAt(NOW.minus(age))
            .build();
        return messageRepository.saveAndFlush(message);
    }
}

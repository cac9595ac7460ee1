package com.market.chat.service;

import com.market.chat.domain.DecodedContent;
import com.market.chat.domain.EncodedMessage;
import com.market.chat.domain.MessageEntity;
import com.market.chat.domain.ReencryptionSummary;
import com.market.chat.exception.EncodingException;
import com.market.chat.repository.MessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

/**
 * Rewrites messages that only a legacy key can read under the current key,
 * so the legacy secret can eventually be retired.
 */
@Service
@Slf4j
public class MessageReencryptionService {

    private final MessageRepository messageRepository;
    private final MessageCodec codec;
    private final int pageSize;

    public MessageReencryptionService(
            MessageRepository messageRepository,
            MessageCodec codec,
            @Value("${chat.reencryption.page-size:500}") int pageSize) {
        this.messageRepository = messageRepository;
        this.codec = codec;
        this.pageSize = pageSize;
    }

    public ReencryptionSummary reencryptAll() {
        int reencrypted = 0;
        int skipped = 0;
        int failed = 0;

        PageRequest pageRequest = PageRequest.of(0, pageSize, Sort.by("createdAt", "id"));
        Page<MessageEntity> page;
        do {
            page = messageRepository.findAll(pageRequest);
            for (MessageEntity message : page.getContent()) {
                DecodedContent decoded;
                try {
                    decoded = codec.decodeWithKeyInfo(message.getEncryptedContent());
                } catch (EncodingException e) {
                    log.warn("⚠ Cannot decrypt message {} with any configured key: {}", message.getId(), e.getMessage());
                    failed++;
                    continue;
                }
                if (!decoded.isLegacyKey()) {
                    skipped++;
                    continue;
                }

                try {
                    EncodedMessage encoded = codec.encode(decoded.getPlaintext());
                    messageRepository.replaceCiphertext(message.getId(), encoded.getCiphertext(),
                        encoded.isCompressed(), encoded.getCiphertext().length());
                    reencrypted++;
                } catch (RuntimeException e) {
                    log.error("❌ Failed to re-encrypt message {}", message.getId(), e);
                    failed++;
                }
            }
            pageRequest = pageRequest.next();
        } while (page.hasNext());

        log.info("Re-encryption finished: reencrypted={}, skipped={}, failed={}", reencrypted, skipped, failed);
        return new ReencryptionSummary(reencrypted, skipped, failed);
    }
}

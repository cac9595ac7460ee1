package com.market.chat.service;

import com.market.chat.domain.ArchiveResult;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Periodic archive run. With Redisson configured only one instance runs it at a time.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "chat.archive.scheduled", havingValue = "true")
public class ArchiveScheduler {

    static final String LOCK_NAME = "chat:archive:lock";

    private final MessageArchiver archiver;
    private final ObjectProvider<RedissonClient> redissonClient;
    private final int olderThanDays;

    public ArchiveScheduler(
            MessageArchiver archiver,
            ObjectProvider<RedissonClient> redissonClient,
            @Value("${chat.archive.older-than-days:90}") int olderThanDays) {
        this.archiver = archiver;
        this.redissonClient = redissonClient;
        this.olderThanDays = olderThanDays;
    }

    @Scheduled(cron = "${chat.archive.cron:0 30 3 * * *}")
    public void runScheduledArchive() {
        RedissonClient redisson = redissonClient.getIfAvailable();
        if (redisson == null) {
            runArchive();
            return;
        }

        RLock lock = redisson.getLock(LOCK_NAME);
        boolean acquired;
        try {
            acquired = lock.tryLock(0, 30, TimeUnit.MINUTES);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while acquiring archive lock");
            return;
        }
        if (!acquired) {
            log.info("⏳ Archive already running on another instance, skipping");
            return;
        }
        try {
            runArchive();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    private void runArchive() {
        log.info("🗄️ Scheduled archive started: olderThanDays={}", olderThanDays);
        ArchiveResult result = archiver.archive(olderThanDays);
        log.info("Scheduled archive finished: status={}, archived={}", result.getStatus(), result.getArchivedCount());
    }
}

package com.market.chat.controller;

import com.market.chat.domain.ArchiveResult;
import com.market.chat.domain.ChatIdentity;
import com.market.chat.domain.ChatRole;
import com.market.chat.domain.ReencryptionSummary;
import com.market.chat.domain.RestoreResult;
import com.market.chat.domain.StorageStats;
import com.market.chat.exception.ChatAccessDeniedException;
import com.market.chat.exception.ChatErrorCode;
import com.market.chat.exception.ChatException;
import com.market.chat.model.ApiResponse;
import com.market.chat.model.RestoreRequest;
import com.market.chat.service.MessageArchiver;
import com.market.chat.service.MessageReencryptionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Storage maintenance for admins: archive, restore, statistics and re-encryption.
 */
@Slf4j
@RestController
@RequestMapping("/api/chat/admin")
public class ArchiveAdminController {

    private final MessageArchiver archiver;
    private final MessageReencryptionService reencryptionService;

    public ArchiveAdminController(MessageArchiver archiver, MessageReencryptionService reencryptionService) {
        this.archiver = archiver;
        this.reencryptionService = reencryptionService;
    }

    @GetMapping("/storage-stats")
    public ApiResponse<StorageStats> storageStats(@CurrentUser ChatIdentity identity) {
        requireAdmin(identity);
        return ApiResponse.ok(archiver.stats());
    }

    /**
     * POST /api/chat/admin/archive?olderThanDays=90&amp;dryRun=true
     */
    @PostMapping("/archive")
    public ApiResponse<ArchiveResult> archive(
            @CurrentUser ChatIdentity identity,
            @RequestParam(defaultValue = "90") int olderThanDays,
            @RequestParam(defaultValue = "false") boolean dryRun) {
        requireAdmin(identity);
        log.info("Archive requested by {}: olderThanDays={}, dryRun={}", identity.getUserId(), olderThanDays, dryRun);

        ArchiveResult result = dryRun ? archiver.preview(olderThanDays) : archiver.archive(olderThanDays);
        if (result.getStatus() == ArchiveResult.Status.FAILED) {
            throw new ChatException(result.getMessage(), ChatErrorCode.STORE_FAILED);
        }
        return ApiResponse.ok(result);
    }

    @PostMapping("/restore")
    public ApiResponse<RestoreResult> restore(
            @CurrentUser ChatIdentity identity,
            @RequestBody(required = false) RestoreRequest request) {
        requireAdmin(identity);
        RestoreResult result = archiver.restore(request != null ? request.getMessageIds() : null);
        if (result.getStatus() == RestoreResult.Status.FAILED) {
            throw new ChatException(result.getMessage(), ChatErrorCode.STORE_FAILED);
        }
        return ApiResponse.ok(result);
    }

    @PostMapping("/reencrypt")
    public ApiResponse<ReencryptionSummary> reencrypt(@CurrentUser ChatIdentity identity) {
        requireAdmin(identity);
        log.info("Re-encryption requested by {}", identity.getUserId());
        return ApiResponse.ok(reencryptionService.reencryptAll());
    }

    private static void requireAdmin(ChatIdentity identity) {
        if (identity.getRole() != ChatRole.ADMIN) {
            throw new ChatAccessDeniedException("Admin access required");
        }
    }
}

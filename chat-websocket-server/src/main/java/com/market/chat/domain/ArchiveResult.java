package com.market.chat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveResult {

    private Status status;
    private int archivedCount;
    private String message;

    public enum Status {
        COMPLETED,
        /** Copied to the archive but still present in the hot table. Safe to retry. */
        ARCHIVED_NOT_PRUNED,
        FAILED,
        DRY_RUN
    }
}

package com.market.chat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreResult {

    private Status status;
    private int restoredCount;
    private String message;

    public enum Status {
        COMPLETED,
        /** Back in the hot table but still present in the archive. Safe to retry. */
        RESTORED_NOT_PRUNED,
        FAILED
    }
}

package com.market.chat.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StorageStats {
    long activeCount;
    long archivedCount;
    long activeBytes;
    long archivedBytes;
    String activeSize;
    String archivedSize;
}

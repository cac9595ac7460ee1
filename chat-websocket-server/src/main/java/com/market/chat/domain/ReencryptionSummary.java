package com.market.chat.domain;

import lombok.Value;

@Value
public class ReencryptionSummary {
    int reencrypted;
    int skipped;
    int failed;
}

package com.market.chat.domain;

import lombok.Value;

@Value
public class DecodedContent {
    String plaintext;
    /** True when only a legacy key could authenticate the value. */
    boolean legacyKey;
}

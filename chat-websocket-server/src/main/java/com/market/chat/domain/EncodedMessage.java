package com.market.chat.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Output of the codec: opaque ciphertext plus the digest of the original plaintext.
 */
@Value
@Builder
public class EncodedMessage {
    String ciphertext;
    String contentHash;
    boolean compressed;
}

package com.market.chat.domain;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Authenticated caller, as issued by the external auth collaborator.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class ChatIdentity {
    String userId;
    ChatRole role;
}

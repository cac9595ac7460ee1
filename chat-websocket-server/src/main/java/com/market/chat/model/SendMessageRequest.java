package com.market.chat.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {
    private String content;
    /** Optional client-generated UUID that makes retries idempotent. */
    private String clientMessageId;
}

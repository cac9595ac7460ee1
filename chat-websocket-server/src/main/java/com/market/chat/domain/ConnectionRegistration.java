package com.market.chat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

/**
 * What the registry knows about one live connection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionRegistration {
    private String connectionId;
    private ChatIdentity identity;
    private Set<String> conversationIds;
    private Instant connectedAt;
    private volatile Instant lastHeartbeat;
}

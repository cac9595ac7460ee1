package com.market.chat.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * JSON envelope of every frame on the chat WebSocket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebSocketMessage {

    private EventType type;
    private Map<String, Object> data;
    private Instant timestamp;

    public enum EventType {
        // Client → Server
        JOIN_CONVERSATION,
        LEAVE_CONVERSATION,
        SEND_MESSAGE,
        MARK_READ,
        HEARTBEAT,
        PING,

        // Server → Client
        JOINED_CONVERSATION,
        LEFT_CONVERSATION,
        NEW_MESSAGE,
        CONVERSATION_UPDATED,
        MESSAGES_READ,
        ERROR,
        HEARTBEAT_ACK,
        PONG;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static EventType fromWireName(String value) {
            if (value == null) {
                return null;
            }
            for (EventType type : values()) {
                if (type.wireName().equals(value)) {
                    return type;
                }
            }
            return null;
        }
    }

    public String stringField(String name) {
        if (data == null) {
            return null;
        }
        Object value = data.get(name);
        return value instanceof String ? (String) value : null;
    }

    public static WebSocketMessage of(EventType type, Map<String, Object> data) {
        return WebSocketMessage.builder()
            .type(type)
            .data(data)
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage error(String errorMessage) {
        return of(EventType.ERROR, Map.of("message", errorMessage));
    }

    public static WebSocketMessage heartbeatAck() {
        return of(EventType.HEARTBEAT_ACK, null);
    }

    public static WebSocketMessage pong() {
        return of(EventType.PONG, null);
    }
}

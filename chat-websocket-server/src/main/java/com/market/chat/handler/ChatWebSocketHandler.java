package com.market.chat.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.chat.domain.ChatIdentity;
import com.market.chat.domain.WebSocketMessage;
import com.market.chat.domain.WebSocketMessage.EventType;
import com.market.chat.exception.ChatErrorCode;
import com.market.chat.exception.ChatException;
import com.market.chat.infrastructure.ChatConnection;
import com.market.chat.infrastructure.ConnectionRegistry;
import com.market.chat.infrastructure.MessagePipeline;
import com.market.chat.infrastructure.WebSocketChatConnection;
import com.market.chat.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket adapter over {@link MessagePipeline}. Routes client frames by type
 * and turns failures into {@code error} frames on the same connection.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String TRANSPORT = "websocket";

    private final ObjectMapper objectMapper;
    private final ConnectionRegistry registry;
    private final MessagePipeline pipeline;
    private final MetricsService metricsService;

    // WebSocket session id -> connection wrapper
    private final Map<String, ChatConnection> connections = new ConcurrentHashMap<>();

    public ChatWebSocketHandler(ObjectMapper objectMapper,
                                ConnectionRegistry registry,
                                MessagePipeline pipeline,
                                MetricsService metricsService) {
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.pipeline = pipeline;
        this.metricsService = metricsService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        ChatIdentity identity = identityOf(wsSession);
        if (identity == null) {
            log.warn("WebSocket without identity: wsId={}", wsSession.getId());
            wsSession.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        ChatConnection connection = new WebSocketChatConnection(wsSession);
        connections.put(wsSession.getId(), connection);
        registry.register(connection, identity);
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        ChatConnection connection = connections.get(wsSession.getId());
        ChatIdentity identity = identityOf(wsSession);
        if (connection == null || identity == null) {
            log.warn("Frame on unregistered session: wsId={}", wsSession.getId());
            return;
        }

        WebSocketMessage frame;
        try {
            frame = objectMapper.readValue(message.getPayload(), WebSocketMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable frame from {}: {}", wsSession.getId(), e.getOriginalMessage());
            registry.sendTo(connection, WebSocketMessage.error("Invalid message format"));
            return;
        }
        if (frame.getType() == null) {
            registry.sendTo(connection, WebSocketMessage.error("Unknown message type"));
            return;
        }

        switch (frame.getType()) {
            case JOIN_CONVERSATION:
                handleJoin(connection, identity, frame);
                break;
            case LEAVE_CONVERSATION:
                handleLeave(connection, frame);
                break;
            case SEND_MESSAGE:
                handleSend(connection, identity, frame);
                break;
            case MARK_READ:
                handleMarkRead(identity, frame);
                break;
            case HEARTBEAT:
                registry.heartbeat(connection);
                registry.sendTo(connection, WebSocketMessage.heartbeatAck());
                break;
            case PING:
                registry.heartbeat(connection);
                registry.sendTo(connection, WebSocketMessage.pong());
                break;
            default:
                registry.sendTo(connection, WebSocketMessage.error("Unknown message type"));
        }
    }

    private void handleJoin(ChatConnection connection, ChatIdentity identity, WebSocketMessage frame) {
        String conversationId = frame.stringField("conversationId");
        try {
            pipeline.joinConversation(identity, conversationId);
            registry.joinRoom(connection, conversationId);
            registry.sendTo(connection, WebSocketMessage.of(EventType.JOINED_CONVERSATION,
                Map.of("conversationId", conversationId)));
        } catch (Exception e) {
            replyWithError(connection, "join_conversation", e);
        }
    }

    private void handleLeave(ChatConnection connection, WebSocketMessage frame) {
        String conversationId = frame.stringField("conversationId");
        if (conversationId == null) {
            log.debug("leave_conversation without conversationId on {}", connection.getId());
            return;
        }
        try {
            registry.leaveRoom(connection, conversationId);
            registry.sendTo(connection, WebSocketMessage.of(EventType.LEFT_CONVERSATION,
                Map.of("conversationId", conversationId)));
        } catch (Exception e) {
            log.warn("leave_conversation failed: connectionId={}, conversationId={}", connection.getId(), conversationId, e);
        }
    }

    private void handleSend(ChatConnection connection, ChatIdentity identity, WebSocketMessage frame) {
        try {
            // The sender gets the message back through the conversation room
            pipeline.send(identity,
                frame.stringField("conversationId"),
                frame.stringField("content"),
                frame.stringField("clientMessageId"),
                TRANSPORT);
        } catch (Exception e) {
            replyWithError(connection, "send_message", e);
        }
    }

    private void handleMarkRead(ChatIdentity identity, WebSocketMessage frame) {
        String conversationId = frame.stringField("conversationId");
        try {
            pipeline.markConversationRead(identity, conversationId);
        } catch (Exception e) {
            log.warn("mark_read failed: userId={}, conversationId={}, error={}",
                identity.getUserId(), conversationId, e.getMessage());
        }
    }

    private void replyWithError(ChatConnection connection, String operation, Exception e) {
        String clientMessage;
        if (e instanceof ChatException) {
            ChatException chatException = (ChatException) e;
            clientMessage = chatException.getClientMessage();
            if (chatException.getErrorCode().status().is5xxServerError()) {
                log.error("{} failed: connectionId={}", operation, connection.getId(), e);
            } else {
                log.debug("{} rejected: connectionId={}, reason={}", operation, connection.getId(), e.getMessage());
            }
        } else {
            clientMessage = ChatErrorCode.INTERNAL_ERROR.message();
            log.error("{} failed unexpectedly: connectionId={}", operation, connection.getId(), e);
            metricsService.recordError(e.getClass().getSimpleName(), "ChatWebSocketHandler");
        }
        registry.sendTo(connection, WebSocketMessage.error(clientMessage));
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) throws IOException {
        log.error("Transport error: wsId={}", wsSession.getId(), exception);
        metricsService.recordError("TRANSPORT_ERROR", "ChatWebSocketHandler");
        if (wsSession.isOpen()) {
            wsSession.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        ChatConnection connection = connections.remove(wsSession.getId());
        if (connection != null) {
            registry.unregister(connection);
        }
        log.debug("WebSocket closed: wsId={}, status={}", wsSession.getId(), status);
    }

    private static ChatIdentity identityOf(WebSocketSession wsSession) {
        Object identity = wsSession.getAttributes().get(AuthHandshakeInterceptor.IDENTITY_ATTRIBUTE);
        return identity instanceof ChatIdentity ? (ChatIdentity) identity : null;
    }
}

package com.market.chat.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.chat.domain.ChatIdentity;
import com.market.chat.domain.ConnectionRegistration;
import com.market.chat.domain.WebSocketMessage;
import com.market.chat.service.MessageRateLimiter;
import com.market.chat.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-process presence: which connections belong to which user, and which rooms
 * each connection has joined.
 *
 * <p>Rooms are {@code user:{userId}} (joined on register) and
 * {@code conversation:{conversationId}} (joined once access is granted).
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private static final String USER_ROOM_PREFIX = "user:";
    private static final String CONVERSATION_ROOM_PREFIX = "conversation:";

    private final ConcurrentHashMap<String, ChatConnection> connections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConnectionRegistration> registrations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> userConnections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> rooms = new ConcurrentHashMap<>();

    private final MessageRateLimiter rateLimiter;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService sweepExecutor;

    public ConnectionRegistry(
            MessageRateLimiter rateLimiter,
            MetricsService metricsService,
            ObjectMapper objectMapper,
            @Value("${chat.websocket.sweep-interval-seconds:30}") long sweepIntervalSeconds) {
        this.rateLimiter = rateLimiter;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor();

        sweepExecutor.scheduleAtFixedRate(this::sweep, sweepIntervalSeconds, sweepIntervalSeconds, TimeUnit.SECONDS);
    }

    public static String userRoom(String userId) {
        return USER_ROOM_PREFIX + userId;
    }

    public static String conversationRoom(String conversationId) {
        return CONVERSATION_ROOM_PREFIX + conversationId;
    }

    public ConnectionRegistration register(ChatConnection connection, ChatIdentity identity) {
        Instant now = Instant.now();
        ConnectionRegistration registration = ConnectionRegistration.builder()
            .connectionId(connection.getId())
            .identity(identity)
            .conversationIds(ConcurrentHashMap.newKeySet())
            .connectedAt(now)
            .lastHeartbeat(now)
            .build();

        connections.put(connection.getId(), connection);
        registrations.put(connection.getId(), registration);
        userConnections.compute(identity.getUserId(), (key, ids) -> addMember(ids, connection.getId()));
        addToRoom(userRoom(identity.getUserId()), connection.getId());

        metricsService.recordConnectionOpened(identity.getUserId());
        log.info("Connection registered: connectionId={}, userId={}, role={}, total={}",
            connection.getId(), identity.getUserId(), identity.getRole(), connections.size());
        return registration;
    }

    /**
     * Remove the connection from every room. When it was the user's last connection
     * the user's rate-limit window is discarded too.
     */
    public Optional<ConnectionRegistration> unregister(ChatConnection connection) {
        return unregister(connection.getId());
    }

    private Optional<ConnectionRegistration> unregister(String connectionId) {
        connections.remove(connectionId);
        ConnectionRegistration registration = registrations.remove(connectionId);
        if (registration == null) {
            return Optional.empty();
        }

        String userId = registration.getIdentity().getUserId();
        removeFromRoom(userRoom(userId), connectionId);
        registration.getConversationIds()
            .forEach(conversationId -> removeFromRoom(conversationRoom(conversationId), connectionId));

        AtomicBoolean lastConnection = new AtomicBoolean(false);
        userConnections.computeIfPresent(userId, (key, ids) -> {
            ids.remove(connectionId);
            if (ids.isEmpty()) {
                lastConnection.set(true);
                return null;
            }
            return ids;
        });
        if (lastConnection.get()) {
            rateLimiter.discard(userId);
        }

        metricsService.recordConnectionClosed(userId);
        log.info("Connection unregistered: connectionId={}, userId={}, duration={}s, lastForUser={}",
            connectionId, userId,
            Duration.between(registration.getConnectedAt(), Instant.now()).getSeconds(),
            lastConnection.get());
        return Optional.of(registration);
    }

    public void joinRoom(ChatConnection connection, String conversationId) {
        ConnectionRegistration registration = registrations.get(connection.getId());
        if (registration == null) {
            log.warn("joinRoom for unknown connection {}", connection.getId());
            return;
        }
        registration.getConversationIds().add(conversationId);
        addToRoom(conversationRoom(conversationId), connection.getId());
        if (!registrations.containsKey(connection.getId())) {
            // unregister ran between the lookup and the add
            removeFromRoom(conversationRoom(conversationId), connection.getId());
            log.debug("Connection {} closed while joining {}", connection.getId(), conversationId);
            return;
        }
        log.debug("Joined room: connectionId={}, conversationId={}", connection.getId(), conversationId);
    }

    public void leaveRoom(ChatConnection connection, String conversationId) {
        ConnectionRegistration registration = registrations.get(connection.getId());
        if (registration != null) {
            registration.getConversationIds().remove(conversationId);
        }
        removeFromRoom(conversationRoom(conversationId), connection.getId());
        log.debug("Left room: connectionId={}, conversationId={}", connection.getId(), conversationId);
    }

    /**
     * Send to every connection in the room. A failed send is logged and skipped.
     *
     * @return number of connections the frame was delivered to
     */
    public int fanOut(String roomKey, WebSocketMessage message) {
        Set<String> members = rooms.getOrDefault(roomKey, Collections.emptySet());
        if (members.isEmpty()) {
            return 0;
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} frame for room {}", message.getType(), roomKey, e);
            return 0;
        }

        int delivered = 0;
        for (String connectionId : List.copyOf(members)) {
            if (send(connectionId, payload)) {
                delivered++;
            }
        }
        log.debug("Fan-out: room={}, type={}, delivered={}", roomKey, message.getType(), delivered);
        return delivered;
    }

    public int notifyUser(String userId, WebSocketMessage message) {
        return fanOut(userRoom(userId), message);
    }

    /**
     * Send to one connection only (replies such as errors and acks).
     */
    public boolean sendTo(ChatConnection connection, WebSocketMessage message) {
        try {
            connection.send(objectMapper.writeValueAsString(message));
            return true;
        } catch (Exception e) {
            log.warn("Failed to send {} to connection {}: {}", message.getType(), connection.getId(), e.getMessage());
            return false;
        }
    }

    public boolean isOnline(String userId) {
        Set<String> ids = userConnections.get(userId);
        return ids != null && !ids.isEmpty();
    }

    public Optional<ConnectionRegistration> getRegistration(ChatConnection connection) {
        return Optional.ofNullable(registrations.get(connection.getId()));
    }

    public void heartbeat(ChatConnection connection) {
        ConnectionRegistration registration = registrations.get(connection.getId());
        if (registration != null) {
            registration.setLastHeartbeat(Instant.now());
        }
    }

    public int getActiveConnectionCount() {
        return connections.size();
    }

    public Set<String> roomMembers(String roomKey) {
        return Set.copyOf(rooms.getOrDefault(roomKey, Collections.emptySet()));
    }

    /**
     * Drop registrations whose connection has closed without a close callback.
     */
    void sweep() {
        try {
            List<String> closed = connections.entrySet().stream()
                .filter(entry -> !entry.getValue().isOpen())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
            if (!closed.isEmpty()) {
                log.info("Sweeping {} closed connections", closed.size());
                closed.forEach(this::unregister);
            }
        } catch (Exception e) {
            log.error("Error during connection sweep", e);
        }
    }

    private boolean send(String connectionId, String payload) {
        ChatConnection connection = connections.get(connectionId);
        if (connection == null || !connection.isOpen()) {
            return false;
        }
        try {
            connection.send(payload);
            return true;
        } catch (Exception e) {
            log.warn("Send failed: connectionId={}, error={}", connectionId, e.getMessage());
            return false;
        }
    }

    private void addToRoom(String roomKey, String connectionId) {
        rooms.compute(roomKey, (key, members) -> addMember(members, connectionId));
    }

    // Membership changes happen inside compute() so an emptied set is never resurrected
    private static Set<String> addMember(Set<String> members, String connectionId) {
        Set<String> result = members != null ? members : ConcurrentHashMap.newKeySet();
        result.add(connectionId);
        return result;
    }

    private void removeFromRoom(String roomKey, String connectionId) {
        rooms.computeIfPresent(roomKey, (key, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ConnectionRegistry...");
        sweepExecutor.shutdown();
        try {
            if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sweepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

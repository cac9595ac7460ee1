package com.market.chat.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes chat domain events to Kafka (optional).
 *
 * Events never carry message content, only ids. Enable with {@code spring.kafka.enabled=true}.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class EventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MetricsService metricsService;

    @Value("${kafka.topics.chat-events:chat-events}")
    private String chatEventsTopic;

    public EventPublisher(KafkaTemplate<String, Object> kafkaTemplate, MetricsService metricsService) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
    }

    public void publishMessageSent(String conversationId, String messageId, String senderId, String senderRole) {
        Map<String, Object> event = baseEvent("MESSAGE_SENT", conversationId);
        event.put("messageId", messageId);
        event.put("senderId", senderId);
        event.put("senderRole", senderRole);
        publishEvent(chatEventsTopic, conversationId, event, "MESSAGE_SENT");
    }

    public void publishMessagesRead(String conversationId, String readerId, int count) {
        Map<String, Object> event = baseEvent("MESSAGES_READ", conversationId);
        event.put("readerId", readerId);
        event.put("count", count);
        publishEvent(chatEventsTopic, conversationId, event, "MESSAGES_READ");
    }

    public void publishConversationCreated(String conversationId, String customerId, String vendorId) {
        Map<String, Object> event = baseEvent("CONVERSATION_CREATED", conversationId);
        event.put("customerId", customerId);
        event.put("vendorId", vendorId);
        publishEvent(chatEventsTopic, conversationId, event, "CONVERSATION_CREATED");
    }

    private Map<String, Object> baseEvent(String eventType, String conversationId) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("conversationId", conversationId);
        return event;
    }

    private void publishEvent(String topic, String key, Object event, String eventType) {
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published: type={}, topic={}, partition={}, offset={}",
                        eventType, topic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, topic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
                }
            });
        } catch (Exception e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
        }
    }
}

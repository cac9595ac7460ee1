package com.market.chat.controller;

import com.market.chat.domain.ChatIdentity;
import com.market.chat.domain.ConversationCreation;
import com.market.chat.infrastructure.MessagePipeline;
import com.market.chat.model.ApiResponse;
import com.market.chat.model.ChatMessageView;
import com.market.chat.model.ConversationSummary;
import com.market.chat.model.CreateConversationRequest;
import com.market.chat.model.SendMessageRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST adapter over {@link MessagePipeline}.
 */
@Slf4j
@RestController
@RequestMapping("/api/chat")
public class ChatController {

    static final String TRANSPORT = "rest";

    private final MessagePipeline pipeline;

    public ChatController(MessagePipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * GET /api/chat/conversations
     */
    @GetMapping("/conversations")
    public ApiResponse<List<ConversationSummary>> listConversations(@CurrentUser ChatIdentity identity) {
        return ApiResponse.ok(pipeline.listConversations(identity));
    }

    /**
     * POST /api/chat/conversations: 201 when created, 200 when it already existed.
     */
    @PostMapping("/conversations")
    public ResponseEntity<ApiResponse<Map<String, String>>> createConversation(
            @CurrentUser ChatIdentity identity,
            @RequestBody(required = false) CreateConversationRequest request) {
        String vendorId = request != null ? request.getVendorId() : null;
        ConversationCreation creation = pipeline.createConversation(identity, vendorId);
        return ResponseEntity.status(creation.isCreated() ? HttpStatus.CREATED : HttpStatus.OK)
            .body(ApiResponse.ok(Map.of("conversationId", creation.getConversationId())));
    }

    @GetMapping("/conversations/{conversationId}/messages")
    public ApiResponse<List<ChatMessageView>> getMessages(
            @CurrentUser ChatIdentity identity,
            @PathVariable String conversationId) {
        return ApiResponse.ok(pipeline.history(identity, conversationId));
    }

    @GetMapping("/conversations/{conversationId}/messages/archived")
    public ApiResponse<List<ChatMessageView>> getArchivedMessages(
            @CurrentUser ChatIdentity identity,
            @PathVariable String conversationId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ApiResponse.ok(pipeline.archivedHistory(identity, conversationId, limit, offset));
    }

    @PostMapping("/conversations/{conversationId}/messages")
    public ResponseEntity<ApiResponse<ChatMessageView>> sendMessage(
            @CurrentUser ChatIdentity identity,
            @PathVariable String conversationId,
            @RequestBody(required = false) SendMessageRequest request) {
        String content = request != null ? request.getContent() : null;
        String clientMessageId = request != null ? request.getClientMessageId() : null;
        ChatMessageView message = pipeline.send(identity, conversationId, content, clientMessageId, TRANSPORT);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(message));
    }

    @PutMapping("/conversations/{conversationId}/messages/{messageId}/read")
    public ApiResponse<Map<String, Object>> markMessageRead(
            @CurrentUser ChatIdentity identity,
            @PathVariable String conversationId,
            @PathVariable String messageId) {
        boolean updated = pipeline.markMessageRead(identity, conversationId, messageId);
        return ApiResponse.ok(Map.of("updated", updated));
    }

    @PutMapping("/conversations/{conversationId}/read")
    public ApiResponse<Map<String, Object>> markConversationRead(
            @CurrentUser ChatIdentity identity,
            @PathVariable String conversationId) {
        int updated = pipeline.markConversationRead(identity, conversationId);
        return ApiResponse.ok(Map.of("updated", updated));
    }

    @GetMapping("/unread-count")
    public ApiResponse<Map<String, Object>> unreadCount(@CurrentUser ChatIdentity identity) {
        return ApiResponse.ok(Map.of("unreadCount", pipeline.unreadCount(identity)));
    }
}

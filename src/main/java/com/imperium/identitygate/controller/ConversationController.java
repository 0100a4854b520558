package com.imperium.identitygate.controller;

import com.imperium.identitygate.config.RequestIdSupport;
import com.imperium.identitygate.model.dto.response.ConversationListItemDto;
import com.imperium.identitygate.model.dto.response.ConversationListResponse;
import com.imperium.identitygate.model.dto.response.MessageItemDto;
import com.imperium.identitygate.model.dto.response.MessageListResponse;
import com.imperium.identitygate.model.entity.Conversation;
import com.imperium.identitygate.model.entity.Message;
import com.imperium.identitygate.service.ConversationService;
import com.imperium.identitygate.service.MessageService;
import com.imperium.identitygate.service.StoreReadiness;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 会话只读接口：列表（带 messageCount）与会话内消息。
 */
@RestController
@RequestMapping("/api/v0/conversations")
@Tag(name = "Conversations", description = "会话查询接口")
public class ConversationController {

    private static final int LIST_LIMIT_MAX = 200;
    private static final int MESSAGE_LIMIT_MAX = 1000;

    private final ConversationService conversationService;
    private final MessageService messageService;
    private final StoreReadiness readiness;

    public ConversationController(ConversationService conversationService, MessageService messageService,
            StoreReadiness readiness) {
        this.conversationService = conversationService;
        this.messageService = messageService;
        this.readiness = readiness;
    }

    /**
     * 时间过滤参数均为 epoch 毫秒；created 作用于 started_at，updated 作用于 last_message_at。
     */
    @GetMapping
    @Operation(summary = "会话列表", description = "按最后消息时间倒序，可按创建 / 更新时间过滤")
    public ResponseEntity<ConversationListResponse> list(
            @Parameter(description = "started_at 晚于该时间（epoch 毫秒）")
            @RequestParam(required = false) Long createdAfter,
            @Parameter(description = "started_at 早于该时间（epoch 毫秒）")
            @RequestParam(required = false) Long createdBefore,
            @Parameter(description = "last_message_at 晚于该时间（epoch 毫秒）")
            @RequestParam(required = false) Long updatedAfter,
            @Parameter(description = "last_message_at 早于该时间（epoch 毫秒）")
            @RequestParam(required = false) Long updatedBefore,
            @Parameter(description = "返回条数，默认 50，最大 200")
            @RequestParam(defaultValue = "50") int limit) {

        readiness.ensureReady();
        int size = Math.min(Math.max(1, limit), LIST_LIMIT_MAX);

        List<Conversation> list = conversationService.lambdaQuery()
                .gt(createdAfter != null, Conversation::getStartedAt, toTime(createdAfter))
                .lt(createdBefore != null, Conversation::getStartedAt, toTime(createdBefore))
                .gt(updatedAfter != null, Conversation::getLastMessageAt, toTime(updatedAfter))
                .lt(updatedBefore != null, Conversation::getLastMessageAt, toTime(updatedBefore))
                .orderByDesc(Conversation::getLastMessageAt)
                .orderByDesc(Conversation::getId)
                .last("LIMIT " + size)
                .list();

        List<ConversationListItemDto> items = list.stream()
                .map(c -> ConversationListItemDto.builder()
                        .id(c.getId())
                        .channel(c.getChannel())
                        .sessionKey(c.getSessionKey())
                        .messageCount(c.getMessageCount() != null ? c.getMessageCount() : 0)
                        .startedAt(c.getStartedAt())
                        .lastMessageAt(c.getLastMessageAt())
                        .build())
                .collect(Collectors.toList());
        return ResponseEntity.ok(ConversationListResponse.builder().items(items).build());
    }

    @GetMapping("/{conversationId}/messages")
    @Operation(summary = "会话消息", description = "按写入顺序返回会话内消息")
    public ResponseEntity<?> messages(
            @Parameter(description = "会话 ID", required = true)
            @PathVariable String conversationId,
            @Parameter(description = "返回条数，默认 200，最大 1000")
            @RequestParam(defaultValue = "200") int limit,
            HttpServletRequest request) {

        readiness.ensureReady();
        Conversation conversation = conversationService.getById(conversationId);
        if (conversation == null) {
            return error(HttpStatus.NOT_FOUND, "not_found", "Conversation not found", "conversationId",
                    conversationId, request);
        }
        int size = Math.min(Math.max(1, limit), MESSAGE_LIMIT_MAX);

        List<MessageItemDto> messages = messageService.lambdaQuery()
                .eq(Message::getConversationId, conversationId)
                .orderByAsc(Message::getCreatedAt)
                .orderByAsc(Message::getId)
                .last("LIMIT " + size)
                .list()
                .stream()
                .map(m -> MessageItemDto.builder()
                        .id(m.getId())
                        .role(m.getRole())
                        .content(m.getContent())
                        .metadata(m.getMetadata())
                        .createdAt(m.getCreatedAt())
                        .build())
                .collect(Collectors.toList());

        return ResponseEntity.ok(MessageListResponse.builder()
                .conversationId(conversationId)
                .messageCount(conversation.getMessageCount() != null ? conversation.getMessageCount() : 0)
                .messages(messages)
                .build());
    }

    private static LocalDateTime toTime(Long epochMillis) {
        return epochMillis != null ? LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC) : null;
    }

    private static ResponseEntity<Map<String, Object>> error(
            HttpStatus status, String code, String message, String detailsKey, Object detailsValue,
            HttpServletRequest request) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message);
        err.put("requestId", RequestIdSupport.resolve(request));
        if (detailsKey != null && detailsValue != null) {
            err.put("details", Map.of(detailsKey, detailsValue));
        }
        return ResponseEntity.status(status).body(Map.of("error", err));
    }
}

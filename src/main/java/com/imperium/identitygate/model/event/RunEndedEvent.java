package com.imperium.identitygate.model.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * agent 运行结束，messages 为本轮完整消息列表，取最后一条 assistant 消息落库。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunEndedEvent(String sessionKey, List<JsonNode> messages) implements HostEvent {

    private static final String ASSISTANT = "assistant";

    @Override
    public String conversationKey() {
        return sessionKey;
    }

    public MessageContent lastAssistantContent() {
        if (messages == null) {
            return MessageContent.empty();
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            JsonNode m = messages.get(i);
            if (m != null && m.isObject() && ASSISTANT.equals(m.path("role").asText(null))) {
                return MessageContent.of(m.get("content"));
            }
        }
        return MessageContent.empty();
    }
}

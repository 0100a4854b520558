package com.imperium.identitygate.model.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * agent 开始运行，prompt 为本轮用户输入。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunStartedEvent(String sessionKey, JsonNode prompt) implements HostEvent {

    @Override
    public String conversationKey() {
        return sessionKey;
    }
}

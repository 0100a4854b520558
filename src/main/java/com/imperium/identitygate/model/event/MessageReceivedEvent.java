package com.imperium.identitygate.model.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageReceivedEvent(String from, JsonNode content) implements HostEvent {

    @Override
    public String conversationKey() {
        return from;
    }
}

package com.imperium.identitygate.model.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class UnrecognizedEvent implements HostEvent {

    @Override
    public String conversationKey() {
        return null;
    }
}

package com.imperium.identitygate.model.event;

public enum MessageRole {

    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}

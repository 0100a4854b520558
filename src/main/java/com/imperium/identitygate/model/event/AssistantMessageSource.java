package com.imperium.identitygate.model.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * assistant 回复的唯一观测点。
 */
public enum AssistantMessageSource {

    RUN_ENDED("run-ended"),
    MESSAGE_SENT("message-sent");

    private final String configValue;

    AssistantMessageSource(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public static Optional<AssistantMessageSource> fromConfig(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim();
        return Arrays.stream(values()).filter(s -> s.configValue.equalsIgnoreCase(v)).findFirst();
    }
}

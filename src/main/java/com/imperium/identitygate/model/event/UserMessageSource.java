package com.imperium.identitygate.model.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * 用户消息的唯一观测点。
 */
public enum UserMessageSource {

    RUN_STARTED("run-started"),
    MESSAGE_RECEIVED("message-received");

    private final String configValue;

    UserMessageSource(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public static Optional<UserMessageSource> fromConfig(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim();
        return Arrays.stream(values()).filter(s -> s.configValue.equalsIgnoreCase(v)).findFirst();
    }
}

package com.imperium.identitygate.model.identity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 聊天渠道里可用的身份命令。
 */
public enum IdentityCommand {

    REGISTER("register", "Register your name (creates a channel-only identity)"),
    VERIFY("verify", "Verify your identity with an authorization token from the app"),
    WHOAMI("whoami", "Show your current identity and linked channels");

    private final String commandName;
    private final String description;

    IdentityCommand(String commandName, String description) {
        this.commandName = commandName;
        this.description = description;
    }

    public String commandName() {
        return commandName;
    }

    public String description() {
        return description;
    }

    /**
     * 接受 "verify" 或 "/verify"，大小写不敏感。
     */
    public static Optional<IdentityCommand> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        String bare = n.startsWith("/") ? n.substring(1) : n;
        return Arrays.stream(values()).filter(c -> c.commandName.equals(bare)).findFirst();
    }
}

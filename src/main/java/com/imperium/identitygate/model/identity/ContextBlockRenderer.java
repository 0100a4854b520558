package com.imperium.identitygate.model.identity;

import java.util.ArrayList;
import java.util.List;

/**
 * 将结构化的身份 / 作用域块渲染为行格式文本，供通过文本解析读取上下文的旧组件使用。
 * <p>
 * 标记串与字段顺序固定（版本 1）：
 * <pre>
 * [USER_IDENTITY]            [MEMORY_SCOPE]
 * user_id: ...               scope_key: ...
 * external_id: ...           user_id: ...
 * name: ...                  external_id: ...
 * channel: ...               verified: ...
 * channel_peer_id: ...       gated: false
 * verified: ...              [/MEMORY_SCOPE]
 * status: ...
 * [/USER_IDENTITY]
 * </pre>
 */
public final class ContextBlockRenderer {

    public static final String IDENTITY_OPEN = "[USER_IDENTITY]";
    public static final String IDENTITY_CLOSE = "[/USER_IDENTITY]";
    public static final String SCOPE_OPEN = "[MEMORY_SCOPE]";
    public static final String SCOPE_CLOSE = "[/MEMORY_SCOPE]";

    static final String NONE = "none";
    static final String DEFAULT_GATE_MESSAGE = "Memory retrieval is not available until identity is verified.\n"
            + "The user can verify by typing: /verify <token>";
    static final String UNREGISTERED_HINT = "This user is not registered. You may ask for their name.\n"
            + "If they have an authorization token from the app, they can type: /verify <token>\n"
            + "To register with just a name: /register <first_name> <last_name>";

    public static String render(UserIdentityBlock block) {
        List<String> lines = new ArrayList<>();
        lines.add(IDENTITY_OPEN);
        lines.add("user_id: " + orNone(block.userId()));
        lines.add("external_id: " + orNone(block.externalId()));
        lines.add("name: " + (block.name() != null ? block.name() : "unknown"));
        lines.add("channel: " + block.channel());
        lines.add("channel_peer_id: " + block.channelPeerId());
        lines.add("verified: " + block.verified());
        lines.add("status: " + block.status().wireValue());
        lines.add(IDENTITY_CLOSE);
        if (block.status() == IdentityStatus.UNREGISTERED) {
            lines.add("");
            lines.add(UNREGISTERED_HINT);
        }
        return String.join("\n", lines);
    }

    public static String render(MemoryScopeBlock block) {
        List<String> lines = new ArrayList<>();
        lines.add(SCOPE_OPEN);
        if (block.gated()) {
            lines.add("gated: true");
            lines.add(SCOPE_CLOSE);
            lines.add("");
            String custom = block.gateMessage() != null ? block.gateMessage().trim() : "";
            lines.add(custom.isEmpty() ? DEFAULT_GATE_MESSAGE : custom);
            return String.join("\n", lines);
        }
        lines.add("scope_key: " + block.scopeKey());
        lines.add("user_id: " + block.userId());
        lines.add("external_id: " + orNone(block.externalId()));
        lines.add("verified: " + Boolean.TRUE.equals(block.verified()));
        lines.add("gated: false");
        lines.add(SCOPE_CLOSE);
        return String.join("\n", lines);
    }

    private static String orNone(String value) {
        return value != null ? value : NONE;
    }

    private ContextBlockRenderer() {}
}

package com.imperium.identitygate.session;

import com.imperium.identitygate.model.identity.SessionPeer;

import java.util.Arrays;

/**
 * 宿主 session key 解析：得到 (channel, peerId)。
 * <p>
 * 支持的格式：
 * <pre>
 *   agent:{agentId}:main                       共享会话，无具体发送方
 *   agent:{agentId}:direct:{peerId}            channel = direct
 *   agent:{agentId}:{channel}:direct:{peerId}  peerId 取 direct 之后的部分
 *   agent:{agentId}:{channel}:{peerId...}      其余段用 ':' 重新拼接（号码里可能带冒号）
 * </pre>
 * 无法识别的 key（少于 3 段或首段不是 agent）返回 channel = unknown、peerId = 原串，不抛异常。
 */
public final class SessionKeyParser {

    public static final String UNKNOWN_CHANNEL = "unknown";

    private static final String AGENT_PREFIX = "agent";
    private static final String DIRECT_MARKER = "direct";

    public static SessionPeer parse(String sessionKey) {
        String key = sessionKey != null ? sessionKey : "";
        // limit = -1：保留空段，否则 "a::b" 这类 peerId 会被吞掉
        String[] parts = key.split(":", -1);
        if (parts.length < 3 || !AGENT_PREFIX.equals(parts[0])) {
            return new SessionPeer(UNKNOWN_CHANNEL, key);
        }
        return new SessionPeer(parts[2], derivePeerId(Arrays.copyOfRange(parts, 2, parts.length)));
    }

    public static String deriveChannel(String sessionKey) {
        return parse(sessionKey).channel();
    }

    public static String derivePeerId(String sessionKey) {
        return parse(sessionKey).peerId();
    }

    private static String derivePeerId(String[] rest) {
        int directIdx = Arrays.asList(rest).indexOf(DIRECT_MARKER);
        if (directIdx >= 0 && directIdx < rest.length - 1) {
            return String.join(":", Arrays.copyOfRange(rest, directIdx + 1, rest.length));
        }
        if (rest.length >= 2) {
            return String.join(":", Arrays.copyOfRange(rest, 1, rest.length));
        }
        return rest[0];
    }

    private SessionKeyParser() {}
}

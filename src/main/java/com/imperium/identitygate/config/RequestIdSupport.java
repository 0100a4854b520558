package com.imperium.identitygate.config;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * 请求 ID 与日志上下文（MDC）的公共约定。
 * 身份相关操作在执行期间额外写入 channel / peerId，便于按会话方排查。
 */
public final class RequestIdSupport {

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String ATTR_REQUEST_ID = "requestId";
    public static final String MDC_CHANNEL = "channel";
    public static final String MDC_PEER_ID = "peerId";

    private RequestIdSupport() {
    }

    public static String newRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static String resolve(HttpServletRequest request) {
        if (request == null) {
            return currentOrNew();
        }
        Object attr = request.getAttribute(ATTR_REQUEST_ID);
        if (attr instanceof String value && !value.isBlank()) {
            return value;
        }
        String headerValue = request.getHeader(HEADER_REQUEST_ID);
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue;
        }
        String generated = newRequestId();
        request.setAttribute(ATTR_REQUEST_ID, generated);
        return generated;
    }

    /** 非 HTTP 入口（如 Advisor）没有 request，优先沿用 MDC 中已有的 ID。 */
    public static String currentOrNew() {
        String current = MDC.get(ATTR_REQUEST_ID);
        return current != null && !current.isBlank() ? current : newRequestId();
    }

    /**
     * 在 try-with-resources 内为日志附加 channel / peerId。
     */
    public static PeerScope peer(String channel, String peerId) {
        return new PeerScope(channel, peerId);
    }

    public static final class PeerScope implements AutoCloseable {

        private final String previousChannel;
        private final String previousPeerId;

        private PeerScope(String channel, String peerId) {
            this.previousChannel = MDC.get(MDC_CHANNEL);
            this.previousPeerId = MDC.get(MDC_PEER_ID);
            put(MDC_CHANNEL, channel);
            put(MDC_PEER_ID, peerId);
        }

        @Override
        public void close() {
            put(MDC_CHANNEL, previousChannel);
            put(MDC_PEER_ID, previousPeerId);
        }

        private static void put(String key, String value) {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        }
    }
}

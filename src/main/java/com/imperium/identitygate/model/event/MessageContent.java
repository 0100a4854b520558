package com.imperium.identitygate.model.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 消息内容的几种已知形态：
 * <ul>
 *   <li>{@link Text}：纯字符串，或带 text 字段的对象</li>
 *   <li>{@link Parts}：数组，元素为字符串或 {"type":"text","text":"..."}，其余元素忽略</li>
 *   <li>{@link Unrecognized}：其它一切，提取结果为空串</li>
 * </ul>
 */
public interface MessageContent {

    String text();

    default boolean isEmpty() {
        return text().isEmpty();
    }

    static MessageContent empty() {
        return Unrecognized.INSTANCE;
    }

    static MessageContent of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Unrecognized.INSTANCE;
        }
        if (node.isTextual()) {
            return new Text(node.asText());
        }
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode part : node) {
                if (part.isTextual()) {
                    parts.add(part.asText());
                } else if (part.isObject() && "text".equals(part.path("type").asText(null))
                        && part.path("text").isTextual()) {
                    parts.add(part.get("text").asText());
                }
            }
            return new Parts(List.copyOf(parts));
        }
        if (node.isObject() && node.path("text").isTextual()) {
            return new Text(node.get("text").asText());
        }
        return Unrecognized.INSTANCE;
    }

    record Text(String value) implements MessageContent {

        @Override
        public String text() {
            return value;
        }
    }

    record Parts(List<String> parts) implements MessageContent {

        @Override
        public String text() {
            return String.join("\n", parts);
        }
    }

    final class Unrecognized implements MessageContent {

        static final Unrecognized INSTANCE = new Unrecognized();

        private Unrecognized() {
        }

        @Override
        public String text() {
            return "";
        }
    }
}

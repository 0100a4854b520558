package com.imperium.identitygate.model.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 宿主推送的生命周期事件，按 {@code type} 字段区分。
 * 无法识别的 type（或缺少 type）落到 {@link UnrecognizedEvent}，不报错。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = UnrecognizedEvent.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = RunStartedEvent.class, name = "run_started"),
        @JsonSubTypes.Type(value = RunEndedEvent.class, name = "run_ended"),
        @JsonSubTypes.Type(value = MessageReceivedEvent.class, name = "message_received"),
        @JsonSubTypes.Type(value = MessageSentEvent.class, name = "message_sent")
})
public interface HostEvent {

    /**
     * 事件对应的会话 key（run 事件为 sessionKey，渠道消息事件为 from / to）。
     */
    String conversationKey();
}

package com.imperium.identitygate.model.event;

/**
 * 一个宿主事件的处理结果。
 */
public record LedgerDisposition(Status status, MessageRole role, String conversationId, String messageId) {

    public enum Status {
        /** 已写入一条消息 */
        RECORDED,
        /** 会话已 touch，但内容为空，没有写消息 */
        EMPTY,
        /** 该事件不是当前配置的观测点 */
        SKIPPED,
        /** 无法识别的事件 */
        IGNORED
    }

    public static LedgerDisposition skipped(MessageRole role) {
        return new LedgerDisposition(Status.SKIPPED, role, null, null);
    }

    public static LedgerDisposition ignored() {
        return new LedgerDisposition(Status.IGNORED, null, null, null);
    }
}

package com.imperium.identitygate.service;

import com.imperium.identitygate.model.entity.Conversation;
import com.imperium.identitygate.model.entity.Message;
import com.imperium.identitygate.model.event.MessageRole;

import java.util.Map;

/**
 * 会话 / 消息落库。
 * <p>
 * 约束：lp_conversations.message_count 恒等于该会话的消息行数。计数只在插入消息的
 * 同一事务里递增；{@link #touchConversation} 只保证会话行存在，从不改计数。
 * <p>
 * 本组件不对重复调用去重：同一条逻辑消息只能由调用方在一个观测点上调用一次
 * {@link #recordMessage}（见 LedgerEventRouter 的来源配置）。
 */
public interface MessageLedger {

    /**
     * 确保 session key 对应的会话行存在（不存在则创建，message_count = 0）。
     */
    Conversation touchConversation(String sessionKey, String channel);

    /**
     * 确保会话存在，插入一条消息，并在同一事务中 message_count + 1、刷新 last_message_at。
     */
    Message recordMessage(String sessionKey, String channel, MessageRole role, String content,
            Map<String, Object> metadata);
}

package com.imperium.identitygate.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.identitygate.mapper.ConversationMapper;
import com.imperium.identitygate.mapper.MessageMapper;
import com.imperium.identitygate.model.entity.Conversation;
import com.imperium.identitygate.model.entity.Message;
import com.imperium.identitygate.model.event.MessageRole;
import com.imperium.identitygate.service.MessageLedger;
import com.imperium.identitygate.service.StoreReadiness;
import com.imperium.identitygate.service.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Service
public class MessageLedgerImpl implements MessageLedger {

    private static final Logger log = LoggerFactory.getLogger(MessageLedgerImpl.class);

    private final ConversationMapper conversationMapper;
    private final MessageMapper messageMapper;
    private final StoreReadiness readiness;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MessageLedgerImpl(ConversationMapper conversationMapper,
            MessageMapper messageMapper,
            StoreReadiness readiness,
            TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper,
            Clock clock) {
        this.conversationMapper = conversationMapper;
        this.messageMapper = messageMapper;
        this.readiness = readiness;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Conversation touchConversation(String sessionKey, String channel) {
        readiness.ensureReady();
        try {
            return findOrCreate(sessionKey, channel);
        } catch (DataAccessException e) {
            log.error("Conversation touch failed for session {}: {}", sessionKey, e.getMessage());
            throw new StoreUnavailableException("conversation touch failed", e);
        }
    }

    @Override
    public Message recordMessage(String sessionKey, String channel, MessageRole role, String content,
            Map<String, Object> metadata) {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        readiness.ensureReady();
        try {
            Conversation conversation = findOrCreate(sessionKey, channel);
            Message message = transactionTemplate.execute(status -> insertAndCount(conversation, role, content, metadata));
            log.info("Recorded {} message for session {}", role.value(), sessionKey);
            return message;
        } catch (DataAccessException e) {
            log.error("Recording {} message failed for session {}: {}", role.value(), sessionKey, e.getMessage());
            throw new StoreUnavailableException("message insert failed", e);
        }
    }

    private Message insertAndCount(Conversation conversation, MessageRole role, String content,
            Map<String, Object> metadata) {
        LocalDateTime now = LocalDateTime.now(clock);
        Message message = new Message();
        message.setId("msg_" + UUID.randomUUID().toString().replace("-", ""));
        message.setConversationId(conversation.getId());
        message.setRole(role.value());
        message.setContent(content);
        message.setCreatedAt(now);
        message.setMetadata(toJson(metadata));
        messageMapper.insert(message);
        conversationMapper.incrementMessageCount(conversation.getId(), now);
        return message;
    }

    /**
     * 会话行的查找 / 创建，不触碰 message_count。
     */
    private Conversation findOrCreate(String sessionKey, String channel) {
        Conversation existing = conversationMapper.selectBySessionKey(sessionKey);
        if (existing != null) {
            return existing;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Conversation conversation = new Conversation();
        conversation.setId("c_" + UUID.randomUUID().toString().replace("-", ""));
        conversation.setChannel(channel);
        conversation.setSessionKey(sessionKey);
        conversation.setStartedAt(now);
        conversation.setLastMessageAt(now);
        conversation.setMessageCount(0);
        try {
            conversationMapper.insert(conversation);
            return conversation;
        } catch (DuplicateKeyException e) {
            Conversation raced = conversationMapper.selectBySessionKey(sessionKey);
            if (raced == null) {
                throw e;
            }
            return raced;
        }
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("metadata is not serializable", e);
        }
    }
}

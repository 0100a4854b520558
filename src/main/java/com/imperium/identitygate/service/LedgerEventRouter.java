package com.imperium.identitygate.service;

import com.imperium.identitygate.model.entity.Conversation;
import com.imperium.identitygate.model.entity.Message;
import com.imperium.identitygate.model.event.AssistantMessageSource;
import com.imperium.identitygate.model.event.HostEvent;
import com.imperium.identitygate.model.event.LedgerDisposition;
import com.imperium.identitygate.model.event.LedgerDisposition.Status;
import com.imperium.identitygate.model.event.MessageContent;
import com.imperium.identitygate.model.event.MessageReceivedEvent;
import com.imperium.identitygate.model.event.MessageRole;
import com.imperium.identitygate.model.event.MessageSentEvent;
import com.imperium.identitygate.model.event.RunEndedEvent;
import com.imperium.identitygate.model.event.RunStartedEvent;
import com.imperium.identitygate.model.event.UserMessageSource;
import com.imperium.identitygate.session.SessionKeyParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 把宿主事件路由到 {@link MessageLedger}。
 * <p>
 * 每个方向只有一个观测点会落库（app.ledger.user-source / app.ledger.assistant-source），
 * 另一个事件只确认、不处理，避免同一条消息被写两次。
 */
@Service
public class LedgerEventRouter {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventRouter.class);

    static final String UNKNOWN_SESSION = "unknown";

    private final MessageLedger ledger;
    private final UserMessageSource userSource;
    private final AssistantMessageSource assistantSource;

    public LedgerEventRouter(MessageLedger ledger,
            @Value("${app.ledger.user-source:run-started}") String userSource,
            @Value("${app.ledger.assistant-source:run-ended}") String assistantSource) {
        this.ledger = ledger;
        this.userSource = UserMessageSource.fromConfig(userSource).orElseGet(() -> {
            log.warn("Unknown app.ledger.user-source '{}', using run-started", userSource);
            return UserMessageSource.RUN_STARTED;
        });
        this.assistantSource = AssistantMessageSource.fromConfig(assistantSource).orElseGet(() -> {
            log.warn("Unknown app.ledger.assistant-source '{}', using run-ended", assistantSource);
            return AssistantMessageSource.RUN_ENDED;
        });
    }

    public LedgerDisposition route(HostEvent event) {
        if (event instanceof RunStartedEvent e) {
            if (userSource != UserMessageSource.RUN_STARTED) {
                return LedgerDisposition.skipped(MessageRole.USER);
            }
            return record(e.conversationKey(), MessageRole.USER, MessageContent.of(e.prompt()), "run_started");
        }
        if (event instanceof RunEndedEvent e) {
            if (assistantSource != AssistantMessageSource.RUN_ENDED) {
                return LedgerDisposition.skipped(MessageRole.ASSISTANT);
            }
            return record(e.conversationKey(), MessageRole.ASSISTANT, e.lastAssistantContent(), "run_ended");
        }
        if (event instanceof MessageReceivedEvent e) {
            if (userSource != UserMessageSource.MESSAGE_RECEIVED) {
                return LedgerDisposition.skipped(MessageRole.USER);
            }
            return record(e.conversationKey(), MessageRole.USER, MessageContent.of(e.content()), "message_received");
        }
        if (event instanceof MessageSentEvent e) {
            if (assistantSource != AssistantMessageSource.MESSAGE_SENT) {
                return LedgerDisposition.skipped(MessageRole.ASSISTANT);
            }
            return record(e.conversationKey(), MessageRole.ASSISTANT, MessageContent.of(e.content()), "message_sent");
        }
        log.debug("Ignoring unrecognized host event {}", event == null ? null : event.getClass().getSimpleName());
        return LedgerDisposition.ignored();
    }

    public UserMessageSource userSource() {
        return userSource;
    }

    public AssistantMessageSource assistantSource() {
        return assistantSource;
    }

    private LedgerDisposition record(String conversationKey, MessageRole role, MessageContent content, String source) {
        String sessionKey = conversationKey == null || conversationKey.isBlank() ? UNKNOWN_SESSION : conversationKey;
        String channel = SessionKeyParser.deriveChannel(sessionKey);
        if (content.isEmpty()) {
            Conversation conversation = ledger.touchConversation(sessionKey, channel);
            return new LedgerDisposition(Status.EMPTY, role, conversation.getId(), null);
        }
        Message message = ledger.recordMessage(sessionKey, channel, role, content.text(), Map.of("source", source));
        return new LedgerDisposition(Status.RECORDED, role, message.getConversationId(), message.getId());
    }
}

package com.imperium.identitygate.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.identitygate.model.entity.Conversation;
import com.imperium.identitygate.model.entity.Message;
import com.imperium.identitygate.model.event.HostEvent;
import com.imperium.identitygate.model.event.LedgerDisposition;
import com.imperium.identitygate.model.event.LedgerDisposition.Status;
import com.imperium.identitygate.model.event.MessageRole;
import com.imperium.identitygate.model.event.UserMessageSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("LedgerEventRouter 测试")
class LedgerEventRouterTest {

    private static final String SESSION = "agent:main:whatsapp:+15551230000";

    private final ObjectMapper mapper = new ObjectMapper();
    private MessageLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = mock(MessageLedger.class);
        Message stored = new Message();
        stored.setId("msg_1");
        stored.setConversationId("c_1");
        when(ledger.recordMessage(anyString(), anyString(), any(), anyString(), anyMap())).thenReturn(stored);
        Conversation conversation = new Conversation();
        conversation.setId("c_1");
        when(ledger.touchConversation(anyString(), anyString())).thenReturn(conversation);
    }

    private HostEvent event(String json) throws Exception {
        return mapper.readValue(json, HostEvent.class);
    }

    @Nested
    @DisplayName("默认观测点：run_started / run_ended")
    class Defaults {

        private LedgerEventRouter router;

        @BeforeEach
        void setUp() {
            router = new LedgerEventRouter(ledger, "run-started", "run-ended");
        }

        @Test
        @DisplayName("run_started 记录用户消息，渠道取自 session key")
        void runStarted() throws Exception {
            LedgerDisposition d = router.route(event(
                    "{\"type\":\"run_started\",\"sessionKey\":\"" + SESSION + "\",\"prompt\":\"hi there\"}"));

            assertThat(d.status()).isEqualTo(Status.RECORDED);
            assertThat(d.messageId()).isEqualTo("msg_1");
            verify(ledger).recordMessage(SESSION, "whatsapp", MessageRole.USER, "hi there",
                    Map.of("source", "run_started"));
        }

        @Test
        @DisplayName("空 prompt 只 touch 会话，不写消息")
        void emptyPrompt() throws Exception {
            LedgerDisposition d = router.route(event(
                    "{\"type\":\"run_started\",\"sessionKey\":\"" + SESSION + "\",\"prompt\":\"\"}"));

            assertThat(d.status()).isEqualTo(Status.EMPTY);
            assertThat(d.conversationId()).isEqualTo("c_1");
            verify(ledger).touchConversation(SESSION, "whatsapp");
            verify(ledger, never()).recordMessage(anyString(), anyString(), any(), anyString(), anyMap());
        }

        @Test
        @DisplayName("run_ended 记录最后一条 assistant 回复")
        void runEnded() throws Exception {
            router.route(event("{\"type\":\"run_ended\",\"sessionKey\":\"" + SESSION + "\",\"messages\":["
                    + "{\"role\":\"assistant\",\"content\":\"old\"},{\"role\":\"assistant\",\"content\":\"new\"}]}"));

            verify(ledger).recordMessage(eq(SESSION), eq("whatsapp"), eq(MessageRole.ASSISTANT), eq("new"), anyMap());
        }

        @Test
        @DisplayName("message_received / message_sent 只确认，不落库")
        void channelEventsSkipped() throws Exception {
            assertThat(router.route(event("{\"type\":\"message_received\",\"from\":\"+1\",\"content\":\"hi\"}"))
                    .status()).isEqualTo(Status.SKIPPED);
            assertThat(router.route(event("{\"type\":\"message_sent\",\"to\":\"+1\",\"content\":\"yo\"}"))
                    .status()).isEqualTo(Status.SKIPPED);
            verifyNoInteractions(ledger);
        }

        @Test
        @DisplayName("缺少 sessionKey 时记到 unknown 会话")
        void missingSessionKey() throws Exception {
            router.route(event("{\"type\":\"run_started\",\"prompt\":\"hi\"}"));

            verify(ledger).recordMessage(eq("unknown"), eq("unknown"), eq(MessageRole.USER), eq("hi"), anyMap());
        }

        @Test
        @DisplayName("无法识别的事件被忽略")
        void unrecognized() throws Exception {
            assertThat(router.route(event("{\"type\":\"gateway_stop\"}")).status()).isEqualTo(Status.IGNORED);
            verifyNoInteractions(ledger);
        }
    }

    @Nested
    @DisplayName("渠道消息观测点：message_received / message_sent")
    class ChannelSources {

        private LedgerEventRouter router;

        @BeforeEach
        void setUp() {
            router = new LedgerEventRouter(ledger, "message-received", "message-sent");
        }

        @Test
        @DisplayName("run 事件只确认，不落库")
        void runEventsSkipped() throws Exception {
            assertThat(router.route(event("{\"type\":\"run_started\",\"sessionKey\":\"k\",\"prompt\":\"hi\"}"))
                    .status()).isEqualTo(Status.SKIPPED);
            assertThat(router.route(event("{\"type\":\"run_ended\",\"sessionKey\":\"k\",\"messages\":[]}"))
                    .status()).isEqualTo(Status.SKIPPED);
            verifyNoInteractions(ledger);
        }

        @Test
        @DisplayName("from / to 作为会话 key")
        void recordsChannelMessages() throws Exception {
            router.route(event("{\"type\":\"message_received\",\"from\":\"+1555\",\"content\":[\"a\",\"b\"]}"));
            router.route(event("{\"type\":\"message_sent\",\"to\":\"+1555\",\"content\":{\"text\":\"c\"}}"));

            verify(ledger).recordMessage("+1555", "unknown", MessageRole.USER, "a\nb",
                    Map.of("source", "message_received"));
            verify(ledger).recordMessage("+1555", "unknown", MessageRole.ASSISTANT, "c",
                    Map.of("source", "message_sent"));
        }
    }

    @Test
    @DisplayName("无法识别的来源配置回落到默认值")
    void unknownSourceConfig() {
        LedgerEventRouter router = new LedgerEventRouter(ledger, "both", "");
        assertThat(router.userSource()).isEqualTo(UserMessageSource.RUN_STARTED);
        assertThat(router.assistantSource().configValue()).isEqualTo("run-ended");
    }
}

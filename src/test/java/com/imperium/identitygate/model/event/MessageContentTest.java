package com.imperium.identitygate.model.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MessageContent / HostEvent 测试")
class MessageContentTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String s) throws Exception {
        return mapper.readTree(s);
    }

    @Nested
    @DisplayName("内容提取")
    class Extraction {

        @Test
        @DisplayName("字符串")
        void text() throws Exception {
            MessageContent content = MessageContent.of(json("\"hello\""));
            assertThat(content).isInstanceOf(MessageContent.Text.class);
            assertThat(content.text()).isEqualTo("hello");
        }

        @Test
        @DisplayName("parts 数组只取文本部分")
        void parts() throws Exception {
            MessageContent content = MessageContent.of(json("""
                    ["first", {"type":"text","text":"second"}, {"type":"image","url":"x.png"}, 42]"""));
            assertThat(content).isInstanceOf(MessageContent.Parts.class);
            assertThat(content.text()).isEqualTo("first\nsecond");
        }

        @Test
        @DisplayName("带 text 字段的对象")
        void objectWithText() throws Exception {
            assertThat(MessageContent.of(json("{\"text\":\"hi\",\"lang\":\"en\"}")).text()).isEqualTo("hi");
        }

        @Test
        @DisplayName("其它形态提取为空串")
        void unrecognized() throws Exception {
            assertThat(MessageContent.of(json("42")).isEmpty()).isTrue();
            assertThat(MessageContent.of(json("{\"body\":\"hi\"}")).isEmpty()).isTrue();
            assertThat(MessageContent.of(json("{\"text\":7}")).isEmpty()).isTrue();
            assertThat(MessageContent.of(json("null")).isEmpty()).isTrue();
            assertThat(MessageContent.of(null).isEmpty()).isTrue();
            assertThat(MessageContent.of(json("[{\"type\":\"image\"}]")).isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("事件反序列化")
    class Events {

        @Test
        @DisplayName("按 type 选择事件类型")
        void polymorphic() throws Exception {
            assertThat(mapper.readValue("{\"type\":\"run_started\",\"sessionKey\":\"k\",\"prompt\":\"hi\"}",
                    HostEvent.class)).isInstanceOf(RunStartedEvent.class);
            assertThat(mapper.readValue("{\"type\":\"message_received\",\"from\":\"+1\",\"content\":\"hi\"}",
                    HostEvent.class).conversationKey()).isEqualTo("+1");
            assertThat(mapper.readValue("{\"type\":\"message_sent\",\"to\":\"+2\",\"content\":\"yo\"}",
                    HostEvent.class).conversationKey()).isEqualTo("+2");
        }

        @Test
        @DisplayName("未知 type 或缺少 type 落到 UnrecognizedEvent")
        void unknownType() throws Exception {
            assertThat(mapper.readValue("{\"type\":\"gateway_stop\",\"reason\":\"x\"}", HostEvent.class))
                    .isInstanceOf(UnrecognizedEvent.class);
            assertThat(mapper.readValue("{\"sessionKey\":\"k\"}", HostEvent.class))
                    .isInstanceOf(UnrecognizedEvent.class);
        }

        @Test
        @DisplayName("run_ended 取最后一条 assistant 消息")
        void lastAssistant() throws Exception {
            RunEndedEvent event = (RunEndedEvent) mapper.readValue("""
                    {"type":"run_ended","sessionKey":"k","messages":[
                      {"role":"user","content":"q1"},
                      {"role":"assistant","content":"a1"},
                      {"role":"user","content":"q2"},
                      {"role":"assistant","content":[{"type":"text","text":"a2"}]},
                      {"role":"tool","content":"t"}
                    ]}""", HostEvent.class);

            assertThat(event.lastAssistantContent().text()).isEqualTo("a2");
        }

        @Test
        @DisplayName("run_ended 没有 assistant 消息时为空")
        void noAssistant() throws Exception {
            RunEndedEvent event = (RunEndedEvent) mapper.readValue(
                    "{\"type\":\"run_ended\",\"sessionKey\":\"k\",\"messages\":[{\"role\":\"user\",\"content\":\"q\"}]}",
                    HostEvent.class);
            assertThat(event.lastAssistantContent().isEmpty()).isTrue();
            assertThat(new RunEndedEvent("k", null).lastAssistantContent().isEmpty()).isTrue();
        }
    }
}

package com.imperium.identitygate.session;

import com.imperium.identitygate.model.identity.SessionPeer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SessionKeyParser 测试")
class SessionKeyParserTest {

    @Nested
    @DisplayName("可识别的 key")
    class Recognized {

        @Test
        @DisplayName("agent:{a}:{c}:{p} 取第三段为渠道")
        void channelAndPeer() {
            SessionPeer peer = SessionKeyParser.parse("agent:main:whatsapp:+15551230000");
            assertThat(peer.channel()).isEqualTo("whatsapp");
            assertThat(peer.peerId()).isEqualTo("+15551230000");
        }

        @Test
        @DisplayName("peerId 中的冒号被保留")
        void colonPreservingPeer() {
            SessionPeer peer = SessionKeyParser.parse("agent:bot:signal:group:42");
            assertThat(peer.channel()).isEqualTo("signal");
            assertThat(peer.peerId()).isEqualTo("group:42");
            assertThat(SessionKeyParser.deriveChannel("agent:bot:signal:group:42")).isEqualTo("signal");
            assertThat(SessionKeyParser.derivePeerId("agent:bot:signal:group:42")).isEqualTo("group:42");
        }

        @Test
        @DisplayName("direct 标记之后的部分是 peerId")
        void directMarker() {
            assertThat(SessionKeyParser.parse("agent:a:telegram:direct:u77").peerId()).isEqualTo("u77");
            SessionPeer bare = SessionKeyParser.parse("agent:a:direct:u77");
            assertThat(bare.channel()).isEqualTo("direct");
            assertThat(bare.peerId()).isEqualTo("u77");
        }

        @Test
        @DisplayName("共享会话 main 的 peerId 为 main，不可寻址")
        void sharedSession() {
            SessionPeer peer = SessionKeyParser.parse("agent:bot:main");
            assertThat(peer.channel()).isEqualTo("main");
            assertThat(peer.peerId()).isEqualTo("main");
            assertThat(peer.isAddressable()).isFalse();
        }

        @Test
        @DisplayName("空段被保留而不是吞掉")
        void emptySegmentsKept() {
            assertThat(SessionKeyParser.parse("agent:a:web:x::y").peerId()).isEqualTo("x::y");
        }
    }

    @Nested
    @DisplayName("无法识别的 key")
    class Unrecognized {

        @ParameterizedTest
        @ValueSource(strings = {"agent:only", "bot:main:whatsapp:+1", "+15551230000", "a:b:c"})
        @DisplayName("渠道为 unknown，peerId 为原串")
        void fallsBack(String key) {
            SessionPeer peer = SessionKeyParser.parse(key);
            assertThat(peer.channel()).isEqualTo(SessionKeyParser.UNKNOWN_CHANNEL);
            assertThat(peer.peerId()).isEqualTo(key);
        }

        @ParameterizedTest
        @NullAndEmptySource
        @DisplayName("null 与空串不抛异常")
        void nullOrEmpty(String key) {
            SessionPeer peer = SessionKeyParser.parse(key);
            assertThat(peer.channel()).isEqualTo("unknown");
            assertThat(peer.peerId()).isEmpty();
            assertThat(peer.isAddressable()).isFalse();
        }
    }

    @Test
    @DisplayName("messageProvider 覆盖解析出的渠道")
    void providerOverridesChannel() {
        SessionPeer peer = SessionKeyParser.parse("agent:a:direct:u1").withChannel("telegram");
        assertThat(peer.channel()).isEqualTo("telegram");
        assertThat(peer.peerId()).isEqualTo("u1");
        assertThat(peer.withChannel(" ").channel()).isEqualTo("telegram");
    }
}

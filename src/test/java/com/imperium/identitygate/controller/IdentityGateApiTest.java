package com.imperium.identitygate.controller;

import com.imperium.identitygate.support.JwtTestTokens;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("HTTP 接口测试")
class IdentityGateApiTest {

    @Autowired
    private MockMvc mockMvc;

    private static String unique(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    private static String command(String channel, String senderId, String args) {
        return "{\"channel\":\"" + channel + "\",\"senderId\":\"" + senderId + "\",\"args\":\"" + args + "\"}";
    }

    @Nested
    @DisplayName("命令")
    class Commands {

        @Test
        @DisplayName("register → whoami → verify → whoami")
        void lifecycle() throws Exception {
            String peer = unique("tg-");
            String externalId = unique("ext-");
            String token = JwtTestTokens.sign(Map.of("sub", externalId));

            mockMvc.perform(post("/api/v0/commands/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(command("telegram", peer, "Ana Lopez")))
                    .andExpect(status().isOk())
                    .andExpect(header().exists("X-Request-Id"))
                    .andExpect(jsonPath("$.text", startsWith("Registered as Ana Lopez.")));

            mockMvc.perform(post("/api/v0/commands/whoami")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(command("telegram", peer, "")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.text", containsString("Verified: no")));

            mockMvc.perform(post("/api/v0/commands/verify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(command("telegram", peer, token)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.text", startsWith("Identity verified! Welcome, Ana Lopez.")))
                    .andExpect(jsonPath("$.text", containsString("telegram:" + peer)));

            mockMvc.perform(post("/api/v0/commands/whoami")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(command("telegram", peer, "")))
                    .andExpect(jsonPath("$.text", containsString("Verified: yes")))
                    .andExpect(jsonPath("$.text", containsString("External ID: " + externalId)));

            mockMvc.perform(get("/api/v0/identities").param("channel", "telegram").param("peerId", peer))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.scopeKey").value(externalId))
                    .andExpect(jsonPath("$.verified").value(true));
        }

        @Test
        @DisplayName("/verify 无参数返回用法")
        void verifyUsage() throws Exception {
            mockMvc.perform(post("/api/v0/commands/verify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(command("web", "s1", " ")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.text").value("Usage: /verify <authorization_token>"));
        }

        @Test
        @DisplayName("未知命令返回 404 错误结构")
        void unknownCommand() throws Exception {
            mockMvc.perform(post("/api/v0/commands/forget")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(command("web", "s1", "")))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error.code").value("not_found"))
                    .andExpect(jsonPath("$.error.requestId").exists());
        }
    }

    @Nested
    @DisplayName("agent 上下文")
    class AgentTurns {

        @Test
        @DisplayName("未注册 peer 返回 unregistered 身份块")
        void unregistered() throws Exception {
            String peer = unique("web-");
            mockMvc.perform(post("/api/v0/agent-turns/context")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"sessionKey\":\"agent:bot:web:" + peer + "\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.identity.status").value("unregistered"))
                    .andExpect(jsonPath("$.peerId").value(peer))
                    .andExpect(jsonPath("$.prependContext", startsWith("[USER_IDENTITY]")));
        }

        @Test
        @DisplayName("sessionKey 缺失返回 400 invalid_argument")
        void missingSessionKey() throws Exception {
            mockMvc.perform(post("/api/v0/agent-turns/context")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"messageProvider\":\"web\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("invalid_argument"))
                    .andExpect(jsonPath("$.error.details.field").value("sessionKey"));
        }
    }

    @Nested
    @DisplayName("落库与会话查询")
    class Ledger {

        @Test
        @DisplayName("run_started / run_ended 各记一条，列表 messageCount 为 2")
        void recordAndList() throws Exception {
            String key = "agent:bot:whatsapp:" + unique("+1555");
            long since = System.currentTimeMillis() - 60_000;

            MvcResult first = mockMvc.perform(post("/api/v0/ledger/events")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"type\":\"run_started\",\"sessionKey\":\"" + key + "\",\"prompt\":\"hi\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("recorded"))
                    .andExpect(jsonPath("$.role").value("user"))
                    .andReturn();
            String conversationId = JsonPath.read(first.getResponse().getContentAsString(), "$.conversationId");

            mockMvc.perform(post("/api/v0/ledger/events")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"type\":\"run_ended\",\"sessionKey\":\"" + key + "\",\"messages\":["
                                    + "{\"role\":\"user\",\"content\":\"hi\"},"
                                    + "{\"role\":\"assistant\",\"content\":[{\"type\":\"text\",\"text\":\"hello!\"}]}]}"))
                    .andExpect(jsonPath("$.status").value("recorded"));

            mockMvc.perform(post("/api/v0/ledger/events")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"type\":\"message_received\",\"from\":\"+1555\",\"content\":\"hi\"}"))
                    .andExpect(jsonPath("$.status").value("skipped"));

            mockMvc.perform(get("/api/v0/conversations")
                            .param("updatedAfter", String.valueOf(since))
                            .param("limit", "200"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.items[?(@.sessionKey == '" + key + "')].messageCount").value(2))
                    .andExpect(jsonPath("$.items[?(@.sessionKey == '" + key + "')].channel").value("whatsapp"));

            mockMvc.perform(get("/api/v0/conversations/" + conversationId + "/messages"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.messageCount").value(2))
                    .andExpect(jsonPath("$.messages[0].role").value("user"))
                    .andExpect(jsonPath("$.messages[1].content").value("hello!"))
                    .andExpect(jsonPath("$.messages[1].metadata.source").value("run_ended"));
        }

        @Test
        @DisplayName("未知会话返回 404")
        void unknownConversation() throws Exception {
            mockMvc.perform(get("/api/v0/conversations/c_missing/messages"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error.code").value("not_found"));
        }
    }
}

package com.imperium.identitygate.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.identitygate.model.identity.VerifiedIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("EndpointTokenVerifier 测试")
class EndpointTokenVerifierTest {

    private static final String ENDPOINT = "http://auth.test/verify";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private EndpointTokenVerifier verifier;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        verifier = new EndpointTokenVerifier(ENDPOINT, restTemplate, new ObjectMapper());
    }

    @Test
    @DisplayName("2xx 且带 user_id 时通过，token 以 JSON 提交")
    void acceptsUserId() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"token\":\"abc\"}"))
                .andRespond(withSuccess("{\"user_id\":\"ext-42\",\"first_name\":\"Ana\",\"last_name\":\"Lopez\","
                        + "\"email\":\"ana@example.com\",\"plan\":\"pro\"}", MediaType.APPLICATION_JSON));

        VerifiedIdentity identity = verifier.verify(" abc ").orElseThrow();

        assertThat(identity.externalId()).isEqualTo("ext-42");
        assertThat(identity.firstName()).isEqualTo("Ana");
        assertThat(identity.lastName()).isEqualTo("Lopez");
        assertThat(identity.email()).isEqualTo("ana@example.com");
        assertThat(identity.claims()).containsEntry("plan", "pro");
        server.verify();
    }

    @Test
    @DisplayName("没有 user_id 时使用 sub，数字也按字符串处理")
    void fallsBackToSub() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"sub\":12345}", MediaType.APPLICATION_JSON));

        assertThat(verifier.verify("abc").map(VerifiedIdentity::externalId)).contains("12345");
    }

    @Test
    @DisplayName("非 2xx 不通过")
    void rejectsErrorStatus() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThat(verifier.verify("abc")).isEmpty();
    }

    @Test
    @DisplayName("响应体既无 user_id 也无 sub、或不是 JSON 对象时不通过")
    void rejectsIncompleteBody() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"first_name\":\"Ana\"}", MediaType.APPLICATION_JSON));
        assertThat(verifier.verify("abc")).isEmpty();

        server.reset();
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("[\"ext-42\"]", MediaType.APPLICATION_JSON));
        assertThat(verifier.verify("abc")).isEmpty();

        server.reset();
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));
        assertThat(verifier.verify("abc")).isEmpty();
    }

    @Test
    @DisplayName("超时按未通过处理，不重试")
    void timeoutIsNegative() {
        server.expect(requestTo(ENDPOINT)).andRespond(request -> {
            throw new SocketTimeoutException("Read timed out");
        });

        Optional<VerifiedIdentity> result = verifier.verify("abc");

        assertThat(result).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("空 token 不发请求")
    void blankTokenSkipsCall() {
        assertThat(verifier.verify("  ")).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("缺少 endpoint 时无法构造")
    void requiresEndpoint() {
        assertThatThrownBy(() -> new EndpointTokenVerifier(" ", restTemplate, new ObjectMapper()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

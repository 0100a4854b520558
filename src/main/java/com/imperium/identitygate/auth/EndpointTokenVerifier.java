package com.imperium.identitygate.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.identitygate.model.identity.VerifiedIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 远程端点验证：POST {"token": "..."}，2xx 响应体形如
 * {"user_id": "...", "first_name": "...", "last_name": "...", "email": "..."}（user_id 也可以叫 sub）。
 * <p>
 * 超时或任何传输错误都按"未通过"处理，不重试。超时由传入的 RestTemplate 的请求工厂决定。
 */
public class EndpointTokenVerifier implements TokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(EndpointTokenVerifier.class);

    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    private final URI endpoint;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public EndpointTokenVerifier(String endpoint, RestTemplate restTemplate, ObjectMapper objectMapper) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("verify-endpoint verification requires an endpoint URL");
        }
        this.endpoint = URI.create(endpoint.trim());
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public VerificationMode mode() {
        return VerificationMode.VERIFY_ENDPOINT;
    }

    @Override
    public Optional<VerifiedIdentity> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<Map<String, String>> entity = new HttpEntity<>(Map.of("token", token.trim()), headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(endpoint, HttpMethod.POST, entity, String.class);
        } catch (HttpStatusCodeException e) {
            log.debug("Verify endpoint rejected token: status={}", e.getStatusCode().value());
            return Optional.empty();
        } catch (RestClientException e) {
            log.warn("Verify endpoint unavailable ({}): {}", endpoint.getHost(), e.getMessage());
            return Optional.empty();
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            return Optional.empty();
        }
        return parse(response.getBody());
    }

    private Optional<VerifiedIdentity> parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Verify endpoint returned a non-JSON body");
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        String externalId = text(root, "user_id");
        if (externalId == null) {
            externalId = text(root, "sub");
        }
        if (externalId == null) {
            log.debug("Verify endpoint response has neither user_id nor sub");
            return Optional.empty();
        }

        Map<String, Object> raw = objectMapper.convertValue(root, BODY_TYPE);
        return Optional.of(new VerifiedIdentity(externalId,
                text(root, "first_name"),
                text(root, "last_name"),
                text(root, "email"),
                raw));
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isValueNode() || v.isNull()) {
            return null;
        }
        String s = v.asText();
        return s.isBlank() ? null : s;
    }
}

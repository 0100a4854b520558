package com.imperium.identitygate.controller;

import com.imperium.identitygate.config.RequestIdSupport;
import com.imperium.identitygate.model.dto.response.IdentityResponse;
import com.imperium.identitygate.model.identity.ResolvedIdentity;
import com.imperium.identitygate.service.IdentityResolver;
import com.imperium.identitygate.service.ScopeDeriver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 身份只读查询：按 (channel, peerId) 返回用户、scope key 与全部渠道绑定。
 */
@RestController
@RequestMapping("/api/v0/identities")
@Tag(name = "Identities", description = "身份查询接口")
public class IdentityController {

    private final IdentityResolver identityResolver;

    public IdentityController(IdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    @GetMapping
    @Operation(summary = "查询身份", description = "只读，不会创建任何数据；未注册返回 404")
    public ResponseEntity<?> lookup(
            @Parameter(description = "渠道", required = true)
            @RequestParam(required = false) String channel,
            @Parameter(description = "渠道内的发送方标识", required = true)
            @RequestParam(required = false) String peerId,
            HttpServletRequest request) {

        if (channel == null || channel.isBlank()) {
            return error(HttpStatus.BAD_REQUEST, "invalid_argument", "channel is required", "param", "channel", request);
        }
        if (peerId == null || peerId.isBlank()) {
            return error(HttpStatus.BAD_REQUEST, "invalid_argument", "peerId is required", "param", "peerId", request);
        }

        Optional<ResolvedIdentity> found = identityResolver.lookup(channel, peerId);
        if (found.isEmpty()) {
            return error(HttpStatus.NOT_FOUND, "not_found", "Identity not registered", null, null, request);
        }
        ResolvedIdentity identity = found.get();
        List<String> linked = identityResolver.linkedChannels(identity.getId()).stream()
                .map(c -> c.getChannel() + ":" + c.getChannelPeerId())
                .toList();

        return ResponseEntity.ok(IdentityResponse.builder()
                .userId(identity.getId())
                .externalId(identity.getExternalId())
                .firstName(identity.getFirstName())
                .lastName(identity.getLastName())
                .channel(identity.getChannel())
                .channelPeerId(identity.getChannelPeerId())
                .verified(identity.isVerified())
                .scopeKey(ScopeDeriver.resolveScope(identity, channel, peerId).scopeKey())
                .createdAt(identity.getCreatedAt())
                .linkedChannels(linked)
                .build());
    }

    private static ResponseEntity<Map<String, Object>> error(
            HttpStatus status, String code, String message, String detailsKey, Object detailsValue,
            HttpServletRequest request) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message);
        err.put("requestId", RequestIdSupport.resolve(request));
        if (detailsKey != null && detailsValue != null) {
            err.put("details", Map.of(detailsKey, detailsValue));
        }
        return ResponseEntity.status(status).body(Map.of("error", err));
    }
}

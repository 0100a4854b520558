package com.imperium.identitygate.controller;

import com.imperium.identitygate.model.dto.request.AgentTurnRequest;
import com.imperium.identitygate.model.dto.response.AgentTurnContextResponse;
import com.imperium.identitygate.model.identity.AgentTurnContext;
import com.imperium.identitygate.service.AgentTurnContextService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 宿主在每轮 agent 调用前请求身份上下文，把 prependContext 拼到 prompt 前面。
 */
@RestController
@RequestMapping("/api/v0/agent-turns")
@Tag(name = "AgentTurns", description = "agent 调用前的身份 / 记忆作用域上下文")
public class AgentTurnController {

    private final AgentTurnContextService contextService;

    public AgentTurnController(AgentTurnContextService contextService) {
        this.contextService = contextService;
    }

    @PostMapping("/context")
    @Operation(summary = "解析身份上下文", description = "只读；未注册返回注册提示，库不可用返回空上下文")
    public ResponseEntity<AgentTurnContextResponse> context(@Valid @RequestBody AgentTurnRequest body) {
        AgentTurnContext ctx = contextService.buildContext(body.getSessionKey(), body.getMessageProvider());
        return ResponseEntity.ok(AgentTurnContextResponse.builder()
                .channel(ctx.peer().channel())
                .peerId(ctx.peer().peerId())
                .prependContext(ctx.prependContext())
                .identity(ctx.identity())
                .scope(ctx.scope())
                .build());
    }
}

package com.imperium.identitygate.controller;

import com.imperium.identitygate.model.dto.response.LedgerEventResponse;
import com.imperium.identitygate.model.event.HostEvent;
import com.imperium.identitygate.model.event.LedgerDisposition;
import com.imperium.identitygate.service.LedgerEventRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * 宿主生命周期事件入口（run_started / run_ended / message_received / message_sent）。
 */
@RestController
@RequestMapping("/api/v0/ledger")
@Tag(name = "Ledger", description = "会话 / 消息落库")
public class LedgerEventController {

    private final LedgerEventRouter router;

    public LedgerEventController(LedgerEventRouter router) {
        this.router = router;
    }

    @PostMapping("/events")
    @Operation(summary = "提交宿主事件", description = "每个方向只有配置的观测点会落库，其余事件返回 skipped")
    public ResponseEntity<LedgerEventResponse> accept(@RequestBody HostEvent event) {
        LedgerDisposition d = router.route(event);
        return ResponseEntity.ok(LedgerEventResponse.builder()
                .status(d.status().name().toLowerCase(Locale.ROOT))
                .role(d.role() != null ? d.role().value() : null)
                .conversationId(d.conversationId())
                .messageId(d.messageId())
                .build());
    }
}

package com.imperium.identitygate.controller;

import com.imperium.identitygate.config.RequestIdSupport;
import com.imperium.identitygate.model.dto.request.CommandRequest;
import com.imperium.identitygate.model.dto.response.CommandResponse;
import com.imperium.identitygate.model.identity.IdentityCommand;
import com.imperium.identitygate.service.IdentityCommandService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 渠道命令入口：宿主把 /register、/verify、/whoami 原样转发过来，回复文本直接发回给发送方。
 */
@RestController
@RequestMapping("/api/v0/commands")
@Tag(name = "Commands", description = "身份命令：register / verify / whoami")
public class IdentityCommandController {

    private final IdentityCommandService commandService;

    public IdentityCommandController(IdentityCommandService commandService) {
        this.commandService = commandService;
    }

    @GetMapping
    @Operation(summary = "命令列表", description = "列出可用命令及说明")
    public ResponseEntity<List<Map<String, String>>> list() {
        List<Map<String, String>> commands = Arrays.stream(IdentityCommand.values())
                .map(c -> {
                    Map<String, String> item = new LinkedHashMap<>();
                    item.put("name", c.commandName());
                    item.put("description", c.description());
                    return item;
                })
                .toList();
        return ResponseEntity.ok(commands);
    }

    @PostMapping("/{name}")
    @Operation(summary = "执行命令", description = "执行身份命令，返回回复文本；库不可用时回复固定提示而非报错")
    public ResponseEntity<?> execute(
            @Parameter(description = "命令名：register | verify | whoami", required = true)
            @PathVariable String name,
            HttpServletRequest request,
            @Valid @RequestBody(required = false) CommandRequest body) {

        Optional<IdentityCommand> command = IdentityCommand.fromName(name);
        if (command.isEmpty()) {
            return error(HttpStatus.NOT_FOUND, "not_found", "Unknown command", "name", name, request);
        }
        CommandRequest req = body != null ? body : new CommandRequest();
        String text = commandService.execute(command.get(), req.getChannel(), req.getSenderId(), req.getArgs());
        return ResponseEntity.ok(CommandResponse.builder().text(text).build());
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

package com.imperium.identitygate.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * agent 调用前的身份上下文请求。
 */
@Data
public class AgentTurnRequest {

    @NotBlank(message = "sessionKey is required")
    private String sessionKey;

    /** 宿主给出的消息来源渠道；为空时取 session key 中的渠道 */
    private String messageProvider;
}

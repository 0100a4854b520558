package com.imperium.identitygate.model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.imperium.identitygate.model.identity.MemoryScopeBlock;
import com.imperium.identitygate.model.identity.UserIdentityBlock;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 身份上下文响应。prependContext 为空串表示本轮不注入任何内容。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentTurnContextResponse {

    private String channel;
    private String peerId;
    private String prependContext;
    private UserIdentityBlock identity;
    private MemoryScopeBlock scope;
}

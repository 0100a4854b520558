package com.imperium.identitygate.model.identity;

/**
 * 一次 agent 调用前注入的上下文。identity / scope 为 null 表示对应块不下发。
 */
public record AgentTurnContext(SessionPeer peer,
                               UserIdentityBlock identity,
                               MemoryScopeBlock scope,
                               String prependContext) {

    public static AgentTurnContext empty(SessionPeer peer) {
        return new AgentTurnContext(peer, null, null, "");
    }

    public boolean isEmpty() {
        return prependContext == null || prependContext.isEmpty();
    }
}

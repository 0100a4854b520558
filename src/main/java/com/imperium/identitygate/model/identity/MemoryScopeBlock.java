package com.imperium.identitygate.model.identity;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * [MEMORY_SCOPE] 块的结构化表示，下游记忆组件据此做按用户隔离。
 * <p>
 * gated = true 时 scopeKey / userId / externalId / verified 均不下发。
 * 字段集合与顺序属于对外契约，变更须提升 {@link #CURRENT_VERSION}。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemoryScopeBlock(int version,
                               boolean gated,
                               String scopeKey,
                               String userId,
                               String externalId,
                               Boolean verified,
                               String gateMessage) {

    public static final int CURRENT_VERSION = 1;

    public static MemoryScopeBlock scoped(ScopeResult scope) {
        return new MemoryScopeBlock(CURRENT_VERSION, false, scope.scopeKey(), scope.userId(),
                scope.externalId(), scope.verified(), null);
    }

    public static MemoryScopeBlock gated(String gateMessage) {
        return new MemoryScopeBlock(CURRENT_VERSION, true, null, null, null, null, gateMessage);
    }
}

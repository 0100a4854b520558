package com.imperium.identitygate.service;

import com.imperium.identitygate.model.identity.MemoryScopeBlock;
import com.imperium.identitygate.model.identity.ResolvedIdentity;
import com.imperium.identitygate.model.identity.ScopeResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 记忆作用域：scope_key = external_id（已验证，跨渠道一致），否则 = user_id（仅本用户）。
 * require-verified 打开时，未验证身份只得到 gated 块。
 */
@Component
public class ScopeDeriver {

    private final boolean requireVerified;
    private final String gateMessage;

    public ScopeDeriver(@Value("${app.identity.scope.require-verified:false}") boolean requireVerified,
            @Value("${app.identity.scope.gate-message:}") String gateMessage) {
        this.requireVerified = requireVerified;
        this.gateMessage = gateMessage == null || gateMessage.isBlank() ? null : gateMessage;
    }

    public static ScopeResult resolveScope(ResolvedIdentity identity, String channel, String peerId) {
        String scopeKey = identity.getExternalId() != null ? identity.getExternalId() : identity.getId();
        return new ScopeResult(identity.getId(), identity.getExternalId(), scopeKey,
                identity.isVerified(), channel, peerId);
    }

    public MemoryScopeBlock scopeBlock(ScopeResult scope) {
        return scopeBlock(scope, requireVerified, gateMessage);
    }

    public static MemoryScopeBlock scopeBlock(ScopeResult scope, boolean requireVerified, String gateMessage) {
        if (requireVerified && !scope.verified()) {
            return MemoryScopeBlock.gated(gateMessage);
        }
        return MemoryScopeBlock.scoped(scope);
    }

    public boolean isRequireVerified() {
        return requireVerified;
    }
}

package com.imperium.identitygate.service;

import com.imperium.identitygate.model.identity.AgentTurnContext;
import com.imperium.identitygate.model.identity.ContextBlockRenderer;
import com.imperium.identitygate.model.identity.IdentityStatus;
import com.imperium.identitygate.model.identity.MemoryScopeBlock;
import com.imperium.identitygate.model.identity.ResolvedIdentity;
import com.imperium.identitygate.model.identity.ScopeResult;
import com.imperium.identitygate.model.identity.SessionPeer;
import com.imperium.identitygate.model.identity.UserIdentityBlock;
import com.imperium.identitygate.session.SessionKeyParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 每轮 agent 调用前的身份解析：session key → peer → 身份块 + 作用域块。
 * 只读；库不可用时返回空上下文，不影响 agent 本身运行。
 */
@Service
public class AgentTurnContextService {

    private static final Logger log = LoggerFactory.getLogger(AgentTurnContextService.class);

    private final IdentityResolver identityResolver;
    private final ScopeDeriver scopeDeriver;

    public AgentTurnContextService(IdentityResolver identityResolver, ScopeDeriver scopeDeriver) {
        this.identityResolver = identityResolver;
        this.scopeDeriver = scopeDeriver;
    }

    public AgentTurnContext buildContext(String sessionKey, String messageProvider) {
        SessionPeer peer = SessionKeyParser.parse(sessionKey).withChannel(messageProvider);
        if (!peer.isAddressable()) {
            return AgentTurnContext.empty(peer);
        }

        Optional<ResolvedIdentity> identity;
        try {
            identity = identityResolver.lookup(peer.channel(), peer.peerId());
        } catch (StoreUnavailableException e) {
            log.warn("Agent turn context skipped for {}:{}: {}", peer.channel(), peer.peerId(), e.getMessage());
            return AgentTurnContext.empty(peer);
        }

        if (identity.isEmpty()) {
            UserIdentityBlock block = UserIdentityBlock.unregistered(peer);
            return new AgentTurnContext(peer, block, null, ContextBlockRenderer.render(block));
        }

        UserIdentityBlock identityBlock = UserIdentityBlock.of(identity.get(), IdentityStatus.NEW_SESSION);
        ScopeResult scope = ScopeDeriver.resolveScope(identity.get(), peer.channel(), peer.peerId());
        MemoryScopeBlock scopeBlock = scopeDeriver.scopeBlock(scope);
        log.info("Scope resolved for {}:{} -> key={} verified={} gated={}", peer.channel(), peer.peerId(),
                scope.scopeKey(), scope.verified(), scopeBlock.gated());

        String text = ContextBlockRenderer.render(identityBlock) + "\n\n" + ContextBlockRenderer.render(scopeBlock);
        return new AgentTurnContext(peer, identityBlock, scopeBlock, text);
    }
}

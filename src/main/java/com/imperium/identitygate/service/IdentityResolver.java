package com.imperium.identitygate.service;

import com.imperium.identitygate.auth.TokenVerifier;
import com.imperium.identitygate.config.RequestIdSupport;
import com.imperium.identitygate.model.entity.User;
import com.imperium.identitygate.model.entity.UserChannel;
import com.imperium.identitygate.model.identity.RegistrationResult;
import com.imperium.identitygate.model.identity.ResolvedIdentity;
import com.imperium.identitygate.model.identity.VerificationResult;
import com.imperium.identitygate.model.identity.VerificationResult.Outcome;
import com.imperium.identitygate.model.identity.VerifiedIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * "这个 peer 是谁"：按 (channel, peerId) 查询、注册、验证与跨渠道合并。
 * <p>
 * 状态机（按 peer）：unregistered --/register--> registered --/verify--> verified，
 * unregistered 也可直接 /verify。查询路径只读，从不创建数据。
 * <p>
 * 不使用事务：每条语句独立提交，external_id 与 (channel, peer) 的并发冲突交给唯一约束，
 * 冲突方重新读取后改为绑定已存在的用户。
 */
@Service
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final IdentityStore store;
    private final StoreReadiness readiness;
    private final TokenVerifier tokenVerifier;

    public IdentityResolver(IdentityStore store, StoreReadiness readiness, TokenVerifier tokenVerifier) {
        this.store = store;
        this.readiness = readiness;
        this.tokenVerifier = tokenVerifier;
    }

    public Optional<ResolvedIdentity> lookup(String channel, String peerId) {
        return guarded("lookup", channel, peerId, () -> store.findByPeer(channel, peerId));
    }

    public RegistrationResult register(String channel, String peerId, String firstName, String lastName) {
        String last = lastName == null || lastName.isBlank() ? null : lastName.trim();
        return guarded("register", channel, peerId, () -> {
            Optional<ResolvedIdentity> existing = store.findByPeer(channel, peerId);
            if (existing.isPresent()) {
                User updated = store.updateName(existing.get().getId(), firstName, last);
                return new RegistrationResult(RegistrationResult.Outcome.UPDATED, updated);
            }
            User user = store.createUser(firstName, last, null);
            store.linkChannel(user.getId(), channel, peerId);
            log.info("Registered {}:{} -> user {} (channel-only)", channel, peerId, user.getId());
            return new RegistrationResult(RegistrationResult.Outcome.REGISTERED, user);
        });
    }

    public VerificationResult verify(String channel, String peerId, String token) {
        if (!tokenVerifier.isConfigured()) {
            return VerificationResult.notConfigured();
        }
        return guarded("verify", channel, peerId, () -> {
            Optional<VerifiedIdentity> verified = tokenVerifier.verify(token);
            if (verified.isEmpty()) {
                return VerificationResult.rejected();
            }
            VerifiedIdentity identity = verified.get();
            String externalId = identity.externalId();

            ResolvedIdentity current = store.findByPeer(channel, peerId).orElse(null);
            if (current != null && externalId.equals(current.getExternalId())) {
                User user = store.findById(current.getId()).orElseThrow();
                return result(Outcome.ALREADY_VERIFIED, user, identity);
            }

            Optional<User> owner = store.findByExternalId(externalId);
            if (owner.isPresent()) {
                return relinkToOwner(owner.get(), channel, peerId, identity);
            }

            if (current != null && current.getExternalId() == null) {
                try {
                    if (store.upgradeExternalId(current.getId(), externalId)) {
                        User upgraded = store.findById(current.getId()).orElseThrow();
                        log.info("Verified {}:{} -> user {} upgraded in place", channel, peerId, upgraded.getId());
                        return result(Outcome.UPGRADED, upgraded, identity);
                    }
                } catch (DuplicateKeyException e) {
                    return relinkToExternalOwner(externalId, channel, peerId, identity, e);
                }
                // 同一用户被并发请求抢先写入了 external_id
                User raced = store.findById(current.getId()).orElseThrow();
                if (externalId.equals(raced.getExternalId())) {
                    return result(Outcome.ALREADY_VERIFIED, raced, identity);
                }
            }

            User created;
            try {
                created = store.createUser(identity.firstName(), identity.lastName(), externalId);
            } catch (DuplicateKeyException e) {
                return relinkToExternalOwner(externalId, channel, peerId, identity, e);
            }
            store.linkChannel(created.getId(), channel, peerId);
            log.info("Verified {}:{} -> new user {}", channel, peerId, created.getId());
            return result(Outcome.CREATED, created, identity);
        });
    }

    public List<UserChannel> linkedChannels(String userId) {
        return guarded("list-channels", null, null, () -> store.listChannels(userId));
    }

    private VerificationResult relinkToOwner(User owner, String channel, String peerId, VerifiedIdentity identity) {
        store.linkChannel(owner.getId(), channel, peerId);
        log.info("Verified {}:{} -> linked to existing user {}", channel, peerId, owner.getId());
        return result(Outcome.LINKED_EXISTING, owner, identity);
    }

    /**
     * 唯一约束冲突：另一请求已创建/升级出持有该 external_id 的用户，改为绑定到它。
     */
    private VerificationResult relinkToExternalOwner(String externalId, String channel, String peerId,
            VerifiedIdentity identity, DuplicateKeyException cause) {
        User owner = store.findByExternalId(externalId).orElseThrow(() -> cause);
        return relinkToOwner(owner, channel, peerId, identity);
    }

    private VerificationResult result(Outcome outcome, User user, VerifiedIdentity identity) {
        return new VerificationResult(outcome, user, identity, store.listChannels(user.getId()));
    }

    private <T> T guarded(String operation, String channel, String peerId, Supplier<T> action) {
        try (RequestIdSupport.PeerScope ignored = RequestIdSupport.peer(channel, peerId)) {
            readiness.ensureReady();
            try {
                return action.get();
            } catch (DataAccessException e) {
                log.error("Identity {} failed for {}:{}: {}", operation, Objects.toString(channel, "-"),
                        Objects.toString(peerId, "-"), e.getMessage());
                throw new StoreUnavailableException("identity " + operation + " failed", e);
            }
        }
    }
}

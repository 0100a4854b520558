package com.imperium.identitygate.model.identity;

import com.imperium.identitygate.model.entity.User;
import com.imperium.identitygate.model.entity.UserChannel;

import java.util.List;

/**
 * /verify 的结果。
 * <ul>
 *   <li>NOT_CONFIGURED / REJECTED：无状态变化，user 为 null</li>
 *   <li>ALREADY_VERIFIED：该 peer 已绑定到同一 external_id，无状态变化</li>
 *   <li>LINKED_EXISTING：external_id 已属于某用户，当前 peer 改为指向该用户（跨渠道合并）</li>
 *   <li>UPGRADED：当前 peer 的未验证用户原地写入 external_id</li>
 *   <li>CREATED：新建带 external_id 的用户并绑定当前 peer</li>
 * </ul>
 */
public record VerificationResult(Outcome outcome,
                                 User user,
                                 VerifiedIdentity identity,
                                 List<UserChannel> channels) {

    public enum Outcome {
        NOT_CONFIGURED,
        REJECTED,
        ALREADY_VERIFIED,
        LINKED_EXISTING,
        UPGRADED,
        CREATED
    }

    public VerificationResult {
        channels = channels != null ? List.copyOf(channels) : List.of();
    }

    public static VerificationResult notConfigured() {
        return new VerificationResult(Outcome.NOT_CONFIGURED, null, null, List.of());
    }

    public static VerificationResult rejected() {
        return new VerificationResult(Outcome.REJECTED, null, null, List.of());
    }

    public boolean isVerified() {
        return outcome != Outcome.NOT_CONFIGURED && outcome != Outcome.REJECTED;
    }
}

package com.imperium.identitygate.auth;

import com.imperium.identitygate.model.identity.VerifiedIdentity;

import java.util.Optional;

/**
 * 验证外部签发的凭证。
 * <p>
 * 无效凭证（签名错误、过期、issuer/audience 不符、缺少 subject、端点拒绝或超时）
 * 都是正常的"未通过"结果，返回 {@link Optional#empty()}，不抛异常。
 * 实现不修改任何状态。
 */
public interface TokenVerifier {

    Optional<VerifiedIdentity> verify(String token);

    /** 当前使用的验证方式；未配置时为 null。 */
    VerificationMode mode();

    default boolean isConfigured() {
        return mode() != null;
    }

    /**
     * 未配置任何验证方式时使用，所有凭证均不通过。
     */
    static TokenVerifier notConfigured() {
        return new TokenVerifier() {
            @Override
            public Optional<VerifiedIdentity> verify(String token) {
                return Optional.empty();
            }

            @Override
            public VerificationMode mode() {
                return null;
            }
        };
    }
}

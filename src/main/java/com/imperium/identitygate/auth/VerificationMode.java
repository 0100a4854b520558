package com.imperium.identitygate.auth;

import java.util.Arrays;
import java.util.Optional;

/**
 * 凭证验证方式，启动时由配置选定一次。
 */
public enum VerificationMode {

    /** 本地 HMAC-SHA256 签名校验 */
    JWT_HS256("jwt-hs256"),

    /** 调用外部验证端点 */
    VERIFY_ENDPOINT("verify-endpoint");

    private final String configValue;

    VerificationMode(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    /**
     * 空值表示未启用验证；无法识别的值同样视为未启用。
     */
    public static Optional<VerificationMode> fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim();
        return Arrays.stream(values())
                .filter(m -> m.configValue.equalsIgnoreCase(v) || m.name().equalsIgnoreCase(v))
                .findFirst();
    }
}

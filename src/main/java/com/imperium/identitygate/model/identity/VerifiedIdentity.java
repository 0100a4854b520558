package com.imperium.identitygate.model.identity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 凭证验证通过后的规范化身份，每次验证重新生成，不做缓存。
 *
 * @param externalId 外部身份标识（JWT sub 或验证端点返回的 user_id）
 * @param claims     原始 claim 集 / 端点响应
 */
public record VerifiedIdentity(String externalId,
                               String firstName,
                               String lastName,
                               String email,
                               Map<String, Object> claims) {

    public VerifiedIdentity {
        // claim 值可能为 JSON null，Map.copyOf 不接受 null
        claims = claims != null ? Collections.unmodifiableMap(new LinkedHashMap<>(claims)) : Map.of();
    }
}

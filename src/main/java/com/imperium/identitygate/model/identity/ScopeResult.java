package com.imperium.identitygate.model.identity;

/**
 * 单次请求的记忆作用域解析结果。
 */
public record ScopeResult(String userId,
                          String externalId,
                          String scopeKey,
                          boolean verified,
                          String channel,
                          String peerId) {
}

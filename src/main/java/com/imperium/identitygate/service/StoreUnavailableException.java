package com.imperium.identitygate.service;

/**
 * 关系库不可用（初始化失败、连接异常、语句超时）。调用方应降级而不是崩溃。
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

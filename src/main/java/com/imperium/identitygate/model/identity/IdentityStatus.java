package com.imperium.identitygate.model.identity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * [USER_IDENTITY] 块中 status 字段的取值。
 */
public enum IdentityStatus {

    VERIFIED("verified"),
    REGISTERED("registered"),
    NEW_SESSION("new_session"),
    UNREGISTERED("unregistered");

    private final String wireValue;

    IdentityStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}

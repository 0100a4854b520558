package com.imperium.identitygate.model.identity;

import com.imperium.identitygate.model.entity.User;

/**
 * /register 的结果：新建用户，或对已注册用户做幂等改名。
 */
public record RegistrationResult(Outcome outcome, User user) {

    public enum Outcome {
        REGISTERED,
        UPDATED
    }
}

package com.imperium.identitygate.service;

import com.imperium.identitygate.model.entity.User;
import com.imperium.identitygate.model.entity.UserChannel;
import com.imperium.identitygate.model.identity.ResolvedIdentity;

import java.util.List;
import java.util.Optional;

/**
 * lp_users / lp_user_channels 的读写。
 * <p>
 * 唯一约束冲突以 {@link org.springframework.dao.DuplicateKeyException} 抛出，由调用方决定如何合并；
 * 其它库错误以 {@link org.springframework.dao.DataAccessException} 原样抛出。
 */
public interface IdentityStore {

    /** 只读查询，未绑定时返回 empty。 */
    Optional<ResolvedIdentity> findByPeer(String channel, String peerId);

    Optional<User> findById(String userId);

    Optional<User> findByExternalId(String externalId);

    /**
     * @param externalId 可为 null（仅渠道注册的未验证用户）
     * @throws org.springframework.dao.DuplicateKeyException externalId 已被其他用户占用
     */
    User createUser(String firstName, String lastName, String externalId);

    /**
     * 绑定 (channel, peerId) 到指定用户；已绑定到其他用户时改为指向该用户（后写者胜），
     * 已绑定到同一用户时不做任何修改。
     */
    UserChannel linkChannel(String userId, String channel, String peerId);

    User updateName(String userId, String firstName, String lastName);

    /**
     * 为未验证用户写入 external_id。
     *
     * @return false 表示该用户已有 external_id（被并发请求抢先）
     * @throws org.springframework.dao.DuplicateKeyException externalId 已属于其他用户
     */
    boolean upgradeExternalId(String userId, String externalId);

    List<UserChannel> listChannels(String userId);
}

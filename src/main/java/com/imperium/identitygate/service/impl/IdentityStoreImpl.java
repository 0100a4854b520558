package com.imperium.identitygate.service.impl;

import com.imperium.identitygate.mapper.UserChannelMapper;
import com.imperium.identitygate.mapper.UserMapper;
import com.imperium.identitygate.model.entity.User;
import com.imperium.identitygate.model.entity.UserChannel;
import com.imperium.identitygate.model.identity.ResolvedIdentity;
import com.imperium.identitygate.service.IdentityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class IdentityStoreImpl implements IdentityStore {

    private static final Logger log = LoggerFactory.getLogger(IdentityStoreImpl.class);

    private final UserMapper userMapper;
    private final UserChannelMapper userChannelMapper;
    private final Clock clock;

    public IdentityStoreImpl(UserMapper userMapper, UserChannelMapper userChannelMapper, Clock clock) {
        this.userMapper = userMapper;
        this.userChannelMapper = userChannelMapper;
        this.clock = clock;
    }

    @Override
    public Optional<ResolvedIdentity> findByPeer(String channel, String peerId) {
        return Optional.ofNullable(userChannelMapper.selectIdentityByPeer(channel, peerId));
    }

    @Override
    public Optional<User> findById(String userId) {
        return Optional.ofNullable(userMapper.selectById(userId));
    }

    @Override
    public Optional<User> findByExternalId(String externalId) {
        return Optional.ofNullable(userMapper.selectByExternalId(externalId));
    }

    @Override
    public User createUser(String firstName, String lastName, String externalId) {
        LocalDateTime now = LocalDateTime.now(clock);
        User user = new User();
        user.setId(UUID.randomUUID().toString());
        user.setExternalId(externalId);
        user.setFirstName(firstName);
        user.setLastName(lastName);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        userMapper.insert(user);
        return user;
    }

    @Override
    public UserChannel linkChannel(String userId, String channel, String peerId) {
        LocalDateTime now = LocalDateTime.now(clock);
        UserChannel existing = userChannelMapper.selectByPeer(channel, peerId);
        if (existing == null) {
            UserChannel link = new UserChannel(
                    "uc_" + UUID.randomUUID().toString().replace("-", ""), userId, channel, peerId, now);
            try {
                userChannelMapper.insert(link);
                return link;
            } catch (DuplicateKeyException e) {
                // 并发绑定同一 peer：以已存在的行为准，按后写者胜改写
                existing = userChannelMapper.selectByPeer(channel, peerId);
                if (existing == null) {
                    throw e;
                }
            }
        }
        if (userId.equals(existing.getUserId())) {
            return existing;
        }
        log.info("Re-linking {}:{} from user {} to user {}", channel, peerId, existing.getUserId(), userId);
        userChannelMapper.reassign(existing.getId(), userId, now);
        existing.setUserId(userId);
        existing.setLinkedAt(now);
        return existing;
    }

    @Override
    public User updateName(String userId, String firstName, String lastName) {
        userMapper.updateName(userId, firstName, lastName, LocalDateTime.now(clock));
        return userMapper.selectById(userId);
    }

    @Override
    public boolean upgradeExternalId(String userId, String externalId) {
        return userMapper.upgradeExternalId(userId, externalId, LocalDateTime.now(clock)) > 0;
    }

    @Override
    public List<UserChannel> listChannels(String userId) {
        return userChannelMapper.selectByUserId(userId);
    }
}

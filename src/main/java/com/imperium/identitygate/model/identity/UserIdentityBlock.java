package com.imperium.identitygate.model.identity;

/**
 * [USER_IDENTITY] 块的结构化表示。userId 为 null 表示该发送方尚未注册。
 */
public record UserIdentityBlock(String userId,
                                String externalId,
                                String name,
                                String channel,
                                String channelPeerId,
                                boolean verified,
                                IdentityStatus status) {

    public static UserIdentityBlock of(ResolvedIdentity identity, IdentityStatus status) {
        return new UserIdentityBlock(identity.getId(), identity.getExternalId(), identity.displayName(),
                identity.getChannel(), identity.getChannelPeerId(), identity.isVerified(), status);
    }

    public static UserIdentityBlock unregistered(SessionPeer peer) {
        return new UserIdentityBlock(null, null, null, peer.channel(), peer.peerId(), false,
                IdentityStatus.UNREGISTERED);
    }
}

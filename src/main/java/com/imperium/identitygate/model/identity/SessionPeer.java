package com.imperium.identitygate.model.identity;

/**
 * 由 session key 得到的 (channel, peerId)。
 */
public record SessionPeer(String channel, String peerId) {

    private static final String SHARED_PEER = "main";
    private static final String UNKNOWN_PEER = "unknown";

    /**
     * 共享会话（main）、未知或空的发送方无法对应到具体用户。
     */
    public boolean isAddressable() {
        return peerId != null && !peerId.isBlank()
                && !SHARED_PEER.equals(peerId) && !UNKNOWN_PEER.equals(peerId);
    }

    /** 宿主显式给出的渠道（messageProvider）优先于解析结果。 */
    public SessionPeer withChannel(String provider) {
        if (provider == null || provider.isBlank()) {
            return this;
        }
        return new SessionPeer(provider, peerId);
    }
}

package com.imperium.identitygate.model.identity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * lp_users JOIN lp_user_channels 的查询结果：用户字段 + 命中的渠道绑定。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedIdentity {

    /** 用户ID */
    private String id;
    private String externalId;
    private String firstName;
    private String lastName;
    private String channel;
    private String channelPeerId;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isVerified() {
        return externalId != null;
    }

    /** "名 姓"，两者都为空时返回 null。 */
    public String displayName() {
        String name = ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
        return name.isEmpty() ? null : name;
    }
}

package com.imperium.identitygate.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 渠道绑定实体，对应 lp_user_channels 表。
 * (channel, channel_peer_id) 唯一；重新绑定时改写 user_id，不新增行。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("lp_user_channels")
public class UserChannel {

    @TableId
    private String id;

    /** 所属用户ID */
    @TableField("user_id")
    private String userId;

    /** 渠道：whatsapp | telegram | web | direct ... */
    private String channel;

    /** 渠道内的发送方标识（手机号、用户名、会话 token 等） */
    @TableField("channel_peer_id")
    private String channelPeerId;

    @TableField("linked_at")
    private LocalDateTime linkedAt;
}

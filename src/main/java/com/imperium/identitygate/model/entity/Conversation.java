package com.imperium.identitygate.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话表实体，对应 lp_conversations 表，每个 session key 一行。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("lp_conversations")
public class Conversation {

    /** 会话ID */
    @TableId
    private String id;

    /** 由 session key 解析出的渠道 */
    private String channel;

    /** 宿主的会话键，唯一 */
    @TableField("session_key")
    private String sessionKey;

    @TableField("started_at")
    private LocalDateTime startedAt;

    /** 最后一条消息写入时间 */
    @TableField("last_message_at")
    private LocalDateTime lastMessageAt;

    /** 已写入的消息条数，只随消息插入递增 */
    @TableField("message_count")
    private Integer messageCount;
}

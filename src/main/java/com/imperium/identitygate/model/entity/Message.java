package com.imperium.identitygate.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 消息表实体，对应 lp_messages 表。一条逻辑消息对应一行。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("lp_messages")
public class Message {

    /** 消息ID */
    @TableId
    private String id;

    /** 所属会话ID */
    @TableField("conversation_id")
    private String conversationId;

    /** 角色：user | assistant */
    private String role;

    /** 消息内容 */
    private String content;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;

    /** 附加信息，JSON 文本 */
    private String metadata;
}

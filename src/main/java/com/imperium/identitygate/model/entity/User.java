package com.imperium.identitygate.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 规范用户实体，对应 lp_users 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("lp_users")
public class User {

    /** 用户ID，生成后不再变化 */
    @TableId
    private String id;

    /** 外部凭证中的身份标识（如 JWT sub），仅在验证后写入，全局唯一 */
    @TableField("external_id")
    private String externalId;

    @TableField("first_name")
    private String firstName;

    @TableField("last_name")
    private String lastName;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;

    /** 最后更新时间（改名或写入 external_id 时刷新） */
    @TableField("updated_at")
    private LocalDateTime updatedAt;

    public boolean isVerified() {
        return externalId != null;
    }
}

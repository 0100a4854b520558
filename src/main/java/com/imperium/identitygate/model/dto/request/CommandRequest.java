package com.imperium.identitygate.model.dto.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 渠道命令请求：POST /api/v0/commands/{name}。
 */
@Data
public class CommandRequest {

    /** 渠道，缺省为 unknown */
    @Size(max = 50, message = "channel length must be at most 50")
    private String channel;

    /** 渠道内的发送方标识，缺省为 unknown */
    @Size(max = 512, message = "senderId length must be at most 512")
    private String senderId;

    /** 命令参数原文（命令名之后的部分） */
    @Size(max = 8192, message = "args length must be at most 8192")
    private String args;
}

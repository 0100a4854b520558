package com.imperium.identitygate.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.identitygate.model.entity.Message;

/**
 * 消息只读查询。
 */
public interface MessageService extends IService<Message> {
}

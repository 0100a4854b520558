package com.imperium.identitygate.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.identitygate.model.entity.Conversation;

/**
 * 会话只读查询（列表接口用）；写入统一走 {@link MessageLedger}。
 */
public interface ConversationService extends IService<Conversation> {
}

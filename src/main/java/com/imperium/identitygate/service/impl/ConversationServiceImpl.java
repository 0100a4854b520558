package com.imperium.identitygate.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.identitygate.mapper.ConversationMapper;
import com.imperium.identitygate.model.entity.Conversation;
import com.imperium.identitygate.service.ConversationService;
import org.springframework.stereotype.Service;

@Service
public class ConversationServiceImpl extends ServiceImpl<ConversationMapper, Conversation> implements ConversationService {

}

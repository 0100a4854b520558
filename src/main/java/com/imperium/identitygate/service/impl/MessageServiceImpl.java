package com.imperium.identitygate.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.identitygate.mapper.MessageMapper;
import com.imperium.identitygate.model.entity.Message;
import com.imperium.identitygate.service.MessageService;
import org.springframework.stereotype.Service;

@Service
public class MessageServiceImpl extends ServiceImpl<MessageMapper, Message> implements MessageService {

}

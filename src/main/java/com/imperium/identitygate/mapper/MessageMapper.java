package com.imperium.identitygate.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.identitygate.model.entity.Message;

public interface MessageMapper extends BaseMapper<Message> {
}

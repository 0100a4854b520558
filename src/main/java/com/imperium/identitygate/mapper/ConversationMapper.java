package com.imperium.identitygate.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.identitygate.model.entity.Conversation;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;

public interface ConversationMapper extends BaseMapper<Conversation> {

    @Select("SELECT * FROM lp_conversations WHERE session_key = #{sessionKey} LIMIT 1")
    Conversation selectBySessionKey(@Param("sessionKey") String sessionKey);

    /**
     * 计数器唯一的递增入口，只能在插入消息的同一事务中调用。
     */
    @Update("UPDATE lp_conversations SET message_count = message_count + 1, last_message_at = #{at} WHERE id = #{id}")
    int incrementMessageCount(@Param("id") String id, @Param("at") LocalDateTime at);
}

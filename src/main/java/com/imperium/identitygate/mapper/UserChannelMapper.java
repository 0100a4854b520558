package com.imperium.identitygate.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.identitygate.model.entity.UserChannel;
import com.imperium.identitygate.model.identity.ResolvedIdentity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

public interface UserChannelMapper extends BaseMapper<UserChannel> {

    @Select("""
            SELECT u.id, u.external_id, u.first_name, u.last_name, u.created_at, u.updated_at,
                   uc.channel, uc.channel_peer_id
            FROM lp_users u
            JOIN lp_user_channels uc ON uc.user_id = u.id
            WHERE uc.channel = #{channel}
              AND uc.channel_peer_id = #{peerId}
            LIMIT 1""")
    ResolvedIdentity selectIdentityByPeer(@Param("channel") String channel, @Param("peerId") String peerId);

    @Select("SELECT * FROM lp_user_channels WHERE channel = #{channel} AND channel_peer_id = #{peerId} LIMIT 1")
    UserChannel selectByPeer(@Param("channel") String channel, @Param("peerId") String peerId);

    @Update("UPDATE lp_user_channels SET user_id = #{userId}, linked_at = #{at} WHERE id = #{id}")
    int reassign(@Param("id") String id, @Param("userId") String userId, @Param("at") LocalDateTime at);

    @Select("SELECT * FROM lp_user_channels WHERE user_id = #{userId} ORDER BY linked_at, id")
    List<UserChannel> selectByUserId(@Param("userId") String userId);
}

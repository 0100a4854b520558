package com.imperium.identitygate.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.identitygate.model.entity.User;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;

public interface UserMapper extends BaseMapper<User> {

    @Select("SELECT * FROM lp_users WHERE external_id = #{externalId} LIMIT 1")
    User selectByExternalId(@Param("externalId") String externalId);

    @Update("UPDATE lp_users SET first_name = #{firstName}, last_name = #{lastName}, updated_at = #{at} WHERE id = #{id}")
    int updateName(@Param("id") String id,
                   @Param("firstName") String firstName,
                   @Param("lastName") String lastName,
                   @Param("at") LocalDateTime at);

    /**
     * 仅当该用户尚未绑定 external_id 时写入；返回 0 表示已被并发请求抢先写入。
     */
    @Update("UPDATE lp_users SET external_id = #{externalId}, updated_at = #{at} WHERE id = #{id} AND external_id IS NULL")
    int upgradeExternalId(@Param("id") String id,
                          @Param("externalId") String externalId,
                          @Param("at") LocalDateTime at);
}

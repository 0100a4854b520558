package com.imperium.identitygate.mapper;

import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

/**
 * 连通性探测与建表语句，均可重复执行（IF NOT EXISTS）。
 * 表前缀 lp_ 与宿主其它持久化插件共用。
 */
public interface SchemaMapper {

    @Select("SELECT 1")
    Integer ping();

    @Update("""
            CREATE TABLE IF NOT EXISTS lp_users (
              id VARCHAR(64) PRIMARY KEY,
              external_id VARCHAR(256) UNIQUE,
              first_name VARCHAR(128),
              last_name VARCHAR(128),
              created_at TIMESTAMP NOT NULL,
              updated_at TIMESTAMP NOT NULL
            )""")
    void createUsers();

    @Update("""
            CREATE TABLE IF NOT EXISTS lp_user_channels (
              id VARCHAR(64) PRIMARY KEY,
              user_id VARCHAR(64) NOT NULL REFERENCES lp_users(id) ON DELETE CASCADE,
              channel VARCHAR(128) NOT NULL,
              channel_peer_id VARCHAR(512) NOT NULL,
              linked_at TIMESTAMP NOT NULL,
              CONSTRAINT uq_lp_uc_peer UNIQUE (channel, channel_peer_id)
            )""")
    void createUserChannels();

    @Update("CREATE INDEX IF NOT EXISTS idx_lp_uc_user ON lp_user_channels (user_id)")
    void createUserChannelIndex();

    @Update("""
            CREATE TABLE IF NOT EXISTS lp_conversations (
              id VARCHAR(64) PRIMARY KEY,
              channel VARCHAR(128) NOT NULL,
              session_key VARCHAR(512) NOT NULL UNIQUE,
              started_at TIMESTAMP NOT NULL,
              last_message_at TIMESTAMP NOT NULL,
              message_count INTEGER NOT NULL DEFAULT 0
            )""")
    void createConversations();

    @Update("CREATE INDEX IF NOT EXISTS idx_lp_conv_last_msg ON lp_conversations (last_message_at)")
    void createConversationIndex();

    @Update("""
            CREATE TABLE IF NOT EXISTS lp_messages (
              id VARCHAR(64) PRIMARY KEY,
              conversation_id VARCHAR(64) NOT NULL REFERENCES lp_conversations(id) ON DELETE CASCADE,
              role VARCHAR(20) NOT NULL,
              content TEXT NOT NULL,
              created_at TIMESTAMP NOT NULL,
              metadata TEXT
            )""")
    void createMessages();

    @Update("CREATE INDEX IF NOT EXISTS idx_lp_msg_conv ON lp_messages (conversation_id, created_at)")
    void createMessageIndex();
}

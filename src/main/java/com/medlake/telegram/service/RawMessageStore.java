package com.medlake.telegram.service;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Insert-or-skip write path for {@code raw_telegram_messages}. The first payload stored for a
 * (message id, channel) key is never replaced.
 */
@Service
public class RawMessageStore {

    private final JdbcTemplate jdbcTemplate;
    private final RawStorageSchema schema;

    public RawMessageStore(JdbcTemplate jdbcTemplate, RawStorageSchema schema) {
        this.jdbcTemplate = jdbcTemplate;
        this.schema = schema;
    }

    /**
     * @return true when a row was inserted, false when the key was already stored
     */
    public boolean insertIfAbsent(long messageId, String channel, String messageJson) {
        String sql = "INSERT INTO " + schema.messagesTable()
                + " (message_id, channel_username, message_data) VALUES (?, ?, "
                + schema.dialect().jsonBindExpression() + ") ON CONFLICT DO NOTHING";
        return jdbcTemplate.update(sql, messageId, channel, messageJson) == 1;
    }
}

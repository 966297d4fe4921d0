package com.acme.pubsub.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * H2-specific implementation of MessageStore
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2MessageStore extends JdbcMessageStore {

    public H2MessageStore(DataSource dataSource, Clock clock) {
        super(dataSource, clock);
    }

    @Override
    protected String getInsertSql() {
        return "INSERT INTO topic_message (topic, payload, attributes, published_at) VALUES (?, ?, ?, ?)";
    }

    @Override
    protected String getSelectSql() {
        return """
                SELECT id, payload, attributes, published_at
                FROM topic_message
                WHERE topic = ? AND id = ?
                """;
    }

    @Override
    protected String getPurgeSql() {
        return "DELETE FROM topic_message WHERE topic = ? AND published_at <= ?";
    }

    @Override
    protected String getDeleteSql() {
        return "DELETE FROM topic_message WHERE topic = ? AND id = ?";
    }
}

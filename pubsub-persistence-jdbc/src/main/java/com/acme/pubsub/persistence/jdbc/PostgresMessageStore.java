package com.acme.pubsub.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * PostgreSQL implementation of MessageStore. Tables live in the {@code pubsub} schema.
 */
@Singleton
@Requires(property = "db.dialect", value = "POSTGRES")
public class PostgresMessageStore extends JdbcMessageStore {

    public PostgresMessageStore(DataSource dataSource, Clock clock) {
        super(dataSource, clock);
    }

    @Override
    protected String getInsertSql() {
        return "INSERT INTO pubsub.topic_message (topic, payload, attributes, published_at) VALUES (?, ?, ?, ?)";
    }

    @Override
    protected String getSelectSql() {
        return """
                SELECT id, payload, attributes, published_at
                FROM pubsub.topic_message
                WHERE topic = ? AND id = ?
                """;
    }

    @Override
    protected String getPurgeSql() {
        return "DELETE FROM pubsub.topic_message WHERE topic = ? AND published_at <= ?";
    }

    @Override
    protected String getDeleteSql() {
        return "DELETE FROM pubsub.topic_message WHERE topic = ? AND id = ?";
    }
}

package com.acme.pubsub.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * PostgreSQL implementation of the dead-letter repository. Tables live in the {@code pubsub} schema.
 */
@Singleton
@Requires(property = "db.dialect", value = "POSTGRES")
public class PostgresDeadLetterRepository extends JdbcDeadLetterRepository {

    public PostgresDeadLetterRepository(DataSource dataSource, Clock clock) {
        super(dataSource, clock);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO pubsub.dead_letter
                (id, subscription, topic, message_id, payload, attributes, attempts, published_at, dead_lettered_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected String getFindBySubscriptionSql() {
        return """
                SELECT id, subscription, topic, message_id, payload, attributes, attempts, published_at, dead_lettered_at
                FROM pubsub.dead_letter
                WHERE subscription = ?
                ORDER BY dead_lettered_at, message_id
                """;
    }

    @Override
    protected String getCountBySubscriptionSql() {
        return "SELECT COUNT(*) FROM pubsub.dead_letter WHERE subscription = ?";
    }
}

package com.acme.pubsub.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * H2-specific implementation of the dead-letter repository
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2DeadLetterRepository extends JdbcDeadLetterRepository {

    public H2DeadLetterRepository(DataSource dataSource, Clock clock) {
        super(dataSource, clock);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO dead_letter
                (id, subscription, topic, message_id, payload, attributes, attempts, published_at, dead_lettered_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected String getFindBySubscriptionSql() {
        return """
                SELECT id, subscription, topic, message_id, payload, attributes, attempts, published_at, dead_lettered_at
                FROM dead_letter
                WHERE subscription = ?
                ORDER BY dead_lettered_at, message_id
                """;
    }

    @Override
    protected String getCountBySubscriptionSql() {
        return "SELECT COUNT(*) FROM dead_letter WHERE subscription = ?";
    }
}

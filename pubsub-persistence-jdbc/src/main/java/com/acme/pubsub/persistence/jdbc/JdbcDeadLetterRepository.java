package com.acme.pubsub.persistence.jdbc;

import com.acme.pubsub.core.Jsons;
import com.acme.pubsub.domain.DeadLetter;
import com.acme.pubsub.domain.Message;
import com.acme.pubsub.spi.DeadLetterSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Abstract JDBC dead-letter destination using Template Method pattern.
 * Each forwarded message becomes one row of {@code dead_letter}; operators read them back per subscription.
 */
public abstract class JdbcDeadLetterRepository implements DeadLetterSink {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDeadLetterRepository.class);

    protected final DataSource dataSource;
    protected final Clock clock;

    protected JdbcDeadLetterRepository(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public void sendToDeadLetter(String subscription, Message message, int attemptCount) {
        DeadLetter entry = DeadLetter.of(subscription, message, attemptCount, clock.instant());

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertSql())) {

            ps.setObject(1, entry.getId());
            ps.setString(2, entry.getSubscription());
            ps.setString(3, entry.getTopic());
            ps.setLong(4, entry.getMessageId());
            ps.setBytes(5, entry.getPayload());
            ps.setString(6, Jsons.attributesToJson(entry.getAttributes()));
            ps.setInt(7, entry.getAttempts());
            ps.setTimestamp(8, Timestamp.from(entry.getPublishedAt()));
            ps.setTimestamp(9, Timestamp.from(entry.getDeadLetteredAt()));

            ps.executeUpdate();
            LOG.debug(
                    "Inserted dead letter: id={}, subscription={}, messageId={}, attempts={}",
                    entry.getId(),
                    subscription,
                    message.id(),
                    attemptCount);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert dead letter", LOG);
        }
    }

    /** Dead letters of one subscription, oldest first. */
    public List<DeadLetter> findBySubscription(String subscription) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindBySubscriptionSql())) {

            ps.setString(1, subscription);

            List<DeadLetter> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapResultSetToDeadLetter(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find dead letters of " + subscription, LOG);
        }
    }

    public long countBySubscription(String subscription) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getCountBySubscriptionSql())) {

            ps.setString(1, subscription);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count dead letters of " + subscription, LOG);
        }
    }

    private DeadLetter mapResultSetToDeadLetter(ResultSet rs) throws SQLException {
        return new DeadLetter(
                rs.getObject("id", UUID.class),
                rs.getString("subscription"),
                rs.getString("topic"),
                rs.getLong("message_id"),
                rs.getBytes("payload"),
                Jsons.attributesFromJson(rs.getString("attributes")),
                rs.getInt("attempts"),
                rs.getTimestamp("published_at").toInstant(),
                rs.getTimestamp("dead_lettered_at").toInstant());
    }

    // Template methods for database-specific SQL

    /**
     * Parameters: id, subscription, topic, message_id, payload, attributes, attempts,
     * published_at, dead_lettered_at.
     */
    protected abstract String getInsertSql();

    protected abstract String getFindBySubscriptionSql();

    protected abstract String getCountBySubscriptionSql();
}

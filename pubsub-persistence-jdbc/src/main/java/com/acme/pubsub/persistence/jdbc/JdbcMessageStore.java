package com.acme.pubsub.persistence.jdbc;

import com.acme.pubsub.core.Jsons;
import com.acme.pubsub.domain.Message;
import com.acme.pubsub.spi.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Abstract JDBC implementation of MessageStore using Template Method pattern.
 * Message ids come from the table's identity column, so they increase within every topic.
 * Subclasses supply the dialect-specific SQL.
 */
public abstract class JdbcMessageStore implements MessageStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcMessageStore.class);

    protected final DataSource dataSource;
    protected final Clock clock;

    protected JdbcMessageStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public long appendMessage(String topic, byte[] payload, Map<String, String> attributes, Instant publishedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertSql(), Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, topic);
            ps.setBytes(2, payload);
            ps.setString(3, Jsons.attributesToJson(attributes));
            ps.setTimestamp(4, Timestamp.from(publishedAt));
            ps.executeUpdate();

            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    long id = rs.getLong(1);
                    LOG.debug("Appended message {} to topic {}", id, topic);
                    return id;
                }
            }
            throw ExceptionTranslator.translateException(
                    new SQLException("No id generated for appended message"), "append message", LOG);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "append message to " + topic, LOG);
        }
    }

    @Override
    public Optional<Message> readMessage(String topic, long messageId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getSelectSql())) {

            ps.setString(1, topic);
            ps.setLong(2, messageId);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Message(
                            topic,
                            rs.getLong("id"),
                            rs.getBytes("payload"),
                            Jsons.attributesFromJson(rs.getString("attributes")),
                            rs.getTimestamp("published_at").toInstant()));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "read message " + messageId, LOG);
        }
    }

    @Override
    public int purgeExpired(String topic, Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getPurgeSql())) {

            ps.setString(1, topic);
            ps.setTimestamp(2, Timestamp.from(cutoff));
            int purged = ps.executeUpdate();
            if (purged > 0) {
                LOG.debug("Purged {} message(s) of topic {} published before {}", purged, topic, cutoff);
            }
            return purged;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "purge messages of " + topic, LOG);
        }
    }

    @Override
    public void deleteMessage(String topic, long messageId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getDeleteSql())) {

            ps.setString(1, topic);
            ps.setLong(2, messageId);
            ps.executeUpdate();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "delete message " + messageId, LOG);
        }
    }

    // Template methods for database-specific SQL

    /** Parameters: topic, payload, attributes, published_at. */
    protected abstract String getInsertSql();

    /** Parameters: topic, id. Columns: id, payload, attributes, published_at. */
    protected abstract String getSelectSql();

    /** Parameters: topic, cutoff (inclusive). */
    protected abstract String getPurgeSql();

    /** Parameters: topic, id. */
    protected abstract String getDeleteSql();
}

package com.acme.pubsub.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;

import com.acme.pubsub.core.PermanentException;
import com.acme.pubsub.core.StorageUnavailableException;
import com.acme.pubsub.core.TransientException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tests translation of SQLException into StorageUnavailableException or PermanentException.
 */
class ExceptionTranslatorTest {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionTranslatorTest.class);

  private static RuntimeException translate(SQLException cause) {
    return ExceptionTranslator.translateException(cause, "append message", logger);
  }

  @Nested
  @DisplayName("Transient Error Detection")
  class TransientErrorTests {

    @Test
    @DisplayName("should report unavailable storage for connection timeout")
    void testConnectionTimeout() {
      // Given
      SQLException cause = new SQLException("Connection timeout", "08001");

      // When
      RuntimeException result = translate(cause);

      // Then
      assertThat(result).isInstanceOf(StorageUnavailableException.class).hasCause(cause);
      assertThat(result.getMessage()).contains("append message").containsIgnoringCase("connection timeout");
    }

    @Test
    @DisplayName("should report unavailable storage for deadlock detected")
    void testDeadlock() {
      assertThat(translate(new SQLException("Deadlock detected", "40P01")))
          .isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    @DisplayName("should report unavailable storage for pool exhaustion without SQL state")
    void testPoolExhausted() {
      assertThat(translate(new SQLException("Connection pool exhausted")))
          .isInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("should report unavailable storage for serialization failure")
    void testSerializationFailure() {
      assertThat(translate(new SQLException("could not serialize access", "40001")))
          .isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    @DisplayName("should report unavailable storage for H2 lock timeout code")
    void testH2LockTimeout() {
      assertThat(translate(new SQLException("Concurrent update", "HYT00", 50200)))
          .isInstanceOf(StorageUnavailableException.class);
    }
  }

  @Nested
  @DisplayName("Permanent Error Detection")
  class PermanentErrorTests {

    @Test
    @DisplayName("should fail permanently for table not found")
    void testTableNotFound() {
      // Given
      SQLException cause = new SQLException("Table \"TOPIC_MESSAGE\" not found", "42S02", 42102);

      // When
      RuntimeException result = translate(cause);

      // Then
      assertThat(result).isInstanceOf(PermanentException.class).hasCause(cause);
      assertThat(result).isNotInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("should fail permanently for unique constraint violation")
    void testUniqueViolation() {
      assertThat(translate(new SQLException("duplicate key value", "23505")))
          .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("should fail permanently for data exceptions")
    void testDataException() {
      assertThat(translate(new SQLException("value too long for type", "22001")))
          .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("should fail permanently for invalid schema")
    void testInvalidSchema() {
      assertThat(translate(new SQLException("schema \"pubsub\" missing", "3F000")))
          .isInstanceOf(PermanentException.class);
    }
  }

  @Nested
  @DisplayName("Unclassified errors")
  class DefaultTests {

    @Test
    @DisplayName("should default to unavailable storage")
    void testUnknown() {
      assertThat(translate(new SQLException("something odd", "HY000")))
          .isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    @DisplayName("should handle a null message")
    void testNullMessage() {
      assertThat(translate(new SQLException((String) null))).isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    @DisplayName("transient classification should win when both apply")
    void testTransientWins() {
      assertThat(translate(new SQLException("lock timeout on unique constraint", "23505")))
          .isInstanceOf(StorageUnavailableException.class);
    }
  }
}

package com.acme.pubsub.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;

import com.acme.pubsub.domain.Message;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Integration tests for the H2 message store. */
class H2MessageStoreTest extends H2RepositoryTestBase {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private H2MessageStore store;

  @BeforeEach
  void setUp() throws Exception {
    store = storeAt(T0);
    truncate("topic_message");
  }

  private H2MessageStore storeAt(Instant now) {
    return new H2MessageStore(dataSource, Clock.fixed(now, ZoneOffset.UTC));
  }

  private long append(String topic, String body, Instant publishedAt) {
    return store.appendMessage(
        topic, body.getBytes(StandardCharsets.UTF_8), Map.of("source", "test"), publishedAt);
  }

  @Nested
  @DisplayName("append and read")
  class AppendReadTests {

    @Test
    @DisplayName("should read back payload, attributes and publish time")
    void testRoundTrip() {
      // Given
      byte[] payload = {0, 1, 2, (byte) 0xFF};
      Map<String, String> attributes = Map.of("region", "eu", "trace", "t-1");

      // When
      long id = store.appendMessage("orders", payload, attributes, T0);

      // Then
      Message message = store.readMessage("orders", id).orElseThrow();
      assertThat(message.id()).isEqualTo(id);
      assertThat(message.topic()).isEqualTo("orders");
      assertThat(message.payload()).containsExactly(payload);
      assertThat(message.attributes()).isEqualTo(attributes);
      assertThat(message.publishedAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("should store empty attributes as an empty map")
    void testEmptyAttributes() {
      long id = store.appendMessage("orders", new byte[] {1}, Map.of(), T0);

      assertThat(store.readMessage("orders", id).orElseThrow().attributes()).isEmpty();
    }

    @Test
    @DisplayName("ids should increase within a topic")
    void testMonotonicIds() {
      long first = append("orders", "a", T0);
      long second = append("orders", "b", T0);
      long third = append("orders", "c", T0);

      assertThat(first).isLessThan(second);
      assertThat(second).isLessThan(third);
    }

    @Test
    @DisplayName("should not find a message under another topic")
    void testTopicScoped() {
      long id = append("orders", "a", T0);

      assertThat(store.readMessage("payments", id)).isEmpty();
      assertThat(store.readMessage("orders", id + 1000)).isEmpty();
    }
  }

  @Nested
  @DisplayName("purge and delete")
  class RemovalTests {

    @Test
    @DisplayName("purgeExpired should remove messages at or before the cutoff of one topic")
    void testPurgeExpired() {
      // Given
      long old = append("orders", "old", T0);
      long boundary = append("orders", "boundary", T0.plusSeconds(60));
      long fresh = append("orders", "fresh", T0.plusSeconds(61));
      long otherTopic = append("payments", "old", T0);

      // When: now is T0+5min, retention 4min, cutoff T0+60s
      int purged = storeAt(T0.plus(Duration.ofMinutes(5))).purgeExpired("orders", Duration.ofMinutes(4));

      // Then
      assertThat(purged).isEqualTo(2);
      assertThat(store.readMessage("orders", old)).isEmpty();
      assertThat(store.readMessage("orders", boundary)).isEmpty();
      assertThat(store.readMessage("orders", fresh)).isPresent();
      assertThat(store.readMessage("payments", otherTopic)).isPresent();
    }

    @Test
    @DisplayName("deleteMessage should remove one message and tolerate repeats")
    void testDelete() {
      long id = append("orders", "a", T0);
      long kept = append("orders", "b", T0);

      store.deleteMessage("orders", id);
      store.deleteMessage("orders", id);

      assertThat(store.readMessage("orders", id)).isEmpty();
      assertThat(store.readMessage("orders", kept)).isPresent();
    }
  }
}

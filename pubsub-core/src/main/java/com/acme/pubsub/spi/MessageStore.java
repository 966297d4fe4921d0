package com.acme.pubsub.spi;

import com.acme.pubsub.domain.Message;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Durable per-topic message log. The broker keeps only the index of pending and in-flight message
 * ids; bodies live here for their retention lifetime.
 *
 * <p>Implementations signal an unreachable backend with {@link
 * com.acme.pubsub.core.StorageUnavailableException}.
 */
public interface MessageStore {

  /**
   * Append a message durably and return its id. The call returns only once the append is durable;
   * ids increase monotonically within a topic.
   */
  long appendMessage(
      String topic, byte[] payload, Map<String, String> attributes, Instant publishedAt);

  /** Read a message body, empty when it was purged or deleted. */
  Optional<Message> readMessage(String topic, long messageId);

  /** Drop messages of a topic published more than {@code retention} ago. */
  int purgeExpired(String topic, Duration retention);

  /** Drop a message that every subscription has settled. */
  void deleteMessage(String topic, long messageId);
}

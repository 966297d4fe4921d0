package com.acme.pubsub.memory;

import com.acme.pubsub.domain.Message;
import com.acme.pubsub.spi.MessageStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/** Message store kept in memory. Not durable; used when no database is configured and in tests. */
public class InMemoryMessageStore implements MessageStore {

  private final Clock clock;
  private final Map<String, TopicLog> topics = new ConcurrentHashMap<>();

  private static final class TopicLog {
    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentSkipListMap<Long, Message> messages = new ConcurrentSkipListMap<>();
  }

  public InMemoryMessageStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public long appendMessage(
      String topic, byte[] payload, Map<String, String> attributes, Instant publishedAt) {
    TopicLog log = topics.computeIfAbsent(topic, t -> new TopicLog());
    long id = log.sequence.incrementAndGet();
    log.messages.put(id, new Message(topic, id, payload, attributes, publishedAt));
    return id;
  }

  @Override
  public Optional<Message> readMessage(String topic, long messageId) {
    TopicLog log = topics.get(topic);
    return log == null ? Optional.empty() : Optional.ofNullable(log.messages.get(messageId));
  }

  @Override
  public int purgeExpired(String topic, Duration retention) {
    TopicLog log = topics.get(topic);
    if (log == null) {
      return 0;
    }
    Instant cutoff = clock.instant().minus(retention);
    int purged = 0;
    Iterator<Message> it = log.messages.values().iterator();
    while (it.hasNext()) {
      if (!it.next().publishedAt().isAfter(cutoff)) {
        it.remove();
        purged++;
      }
    }
    return purged;
  }

  @Override
  public void deleteMessage(String topic, long messageId) {
    TopicLog log = topics.get(topic);
    if (log != null) {
      log.messages.remove(messageId);
    }
  }

  public int size(String topic) {
    TopicLog log = topics.get(topic);
    return log == null ? 0 : log.messages.size();
  }
}

package com.acme.pubsub.memory;

import com.acme.pubsub.domain.DeadLetter;
import com.acme.pubsub.domain.Message;
import com.acme.pubsub.spi.DeadLetterSink;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Dead-letter destination kept in memory. */
public class InMemoryDeadLetterSink implements DeadLetterSink {

  private final Clock clock;
  private final List<DeadLetter> entries = new CopyOnWriteArrayList<>();

  public InMemoryDeadLetterSink(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void sendToDeadLetter(String subscription, Message message, int attemptCount) {
    entries.add(DeadLetter.of(subscription, message, attemptCount, clock.instant()));
  }

  public List<DeadLetter> findBySubscription(String subscription) {
    return entries.stream().filter(e -> e.getSubscription().equals(subscription)).toList();
  }

  public List<DeadLetter> all() {
    return List.copyOf(entries);
  }

  public int size() {
    return entries.size();
  }
}

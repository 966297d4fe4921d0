package com.acme.pubsub;

import com.acme.pubsub.broker.Broker;
import com.acme.pubsub.broker.SettledMessageReaper;
import com.acme.pubsub.config.RetryPolicy;
import com.acme.pubsub.config.SubscriptionConfig;
import com.acme.pubsub.config.TopicConfig;
import com.acme.pubsub.memory.InMemoryDeadLetterSink;
import com.acme.pubsub.memory.InMemoryMessageStore;
import com.acme.pubsub.redelivery.RedeliveryScheduler;
import com.acme.pubsub.registry.Subscription;
import com.acme.pubsub.registry.Topic;
import com.acme.pubsub.registry.TopicRegistry;
import com.acme.pubsub.retry.BackoffCalculator;
import com.acme.pubsub.spi.DeadLetterSink;
import com.acme.pubsub.spi.MessageStore;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;

/**
 * Wires a broker over in-memory collaborators and a manual clock. Subclasses may override the
 * collaborators before {@link #setUpBroker()} runs.
 */
public abstract class BrokerTestBase {

  protected static final Duration ACK_DEADLINE = Duration.ofSeconds(30);

  protected MutableClock clock;
  protected InMemoryMessageStore memoryStore;
  protected InMemoryDeadLetterSink memoryDeadLetters;
  protected TopicRegistry registry;
  protected RedeliveryScheduler scheduler;
  protected Broker broker;

  @BeforeEach
  protected void setUpBroker() {
    clock = new MutableClock();
    memoryStore = new InMemoryMessageStore(clock);
    memoryDeadLetters = new InMemoryDeadLetterSink(clock);
    MessageStore store = store();
    BackoffCalculator backoff = new BackoffCalculator();
    registry = new TopicRegistry(backoff, new SettledMessageReaper(store));
    scheduler = new RedeliveryScheduler(registry, store, deadLetters(), clock);
    broker = new Broker(registry, store, scheduler, clock);
  }

  protected MessageStore store() {
    return memoryStore;
  }

  protected DeadLetterSink deadLetters() {
    return memoryDeadLetters;
  }

  protected Topic topic(String name) {
    return broker.createTopic(name, TopicConfig.atLeastOnce());
  }

  protected Subscription subscription(Topic topic, String name, int maxRetries) {
    return broker.createSubscription(
        topic,
        name,
        SubscriptionConfig.of(ACK_DEADLINE)
            .withRetryPolicy(
                RetryPolicy.of(Duration.ofSeconds(10), Duration.ofMinutes(10), maxRetries)));
  }

  protected long publish(Topic topic, String body) {
    return broker.publish(topic, body.getBytes(StandardCharsets.UTF_8));
  }

  protected static String body(byte[] payload) {
    return new String(payload, StandardCharsets.UTF_8);
  }
}

package com.acme.pubsub.broker;

import com.acme.pubsub.config.SubscriptionConfig;
import com.acme.pubsub.config.TopicConfig;
import com.acme.pubsub.core.LeaseExpiredException;
import com.acme.pubsub.core.LeaseNotFoundException;
import com.acme.pubsub.core.StorageUnavailableException;
import com.acme.pubsub.domain.Delivery;
import com.acme.pubsub.domain.LeaseToken;
import com.acme.pubsub.redelivery.RedeliveryScheduler;
import com.acme.pubsub.registry.Subscription;
import com.acme.pubsub.registry.Topic;
import com.acme.pubsub.registry.TopicRegistry;
import com.acme.pubsub.spi.MessageStore;
import com.acme.pubsub.tracking.SubscriptionStats;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publish and deliver front door. Publishing appends to the message store and fans the message
 * out to the topic's current subscriptions; delivering leases the oldest eligible message of a
 * subscription to one consumer until it is acked, nacked or its ack deadline passes.
 *
 * <p>No call blocks waiting for messages: {@link #deliver} returns empty when nothing is eligible.
 */
public class Broker {
  private static final Logger LOG = LoggerFactory.getLogger(Broker.class);

  private final TopicRegistry registry;
  private final MessageStore store;
  private final RedeliveryScheduler scheduler;
  private final Clock clock;

  public Broker(
      TopicRegistry registry, MessageStore store, RedeliveryScheduler scheduler, Clock clock) {
    this.registry = registry;
    this.store = store;
    this.scheduler = scheduler;
    this.clock = clock;
  }

  public Topic createTopic(String name, TopicConfig config) {
    return registry.createTopic(name, config);
  }

  public Subscription createSubscription(Topic topic, String name, SubscriptionConfig config) {
    return registry.createSubscription(topic, name, config);
  }

  /**
   * Append a message and mark it pending on every subscription the topic has right now.
   *
   * @return the message id assigned by the store
   * @throws StorageUnavailableException if the append failed; the message was not published
   */
  public long publish(Topic topic, byte[] payload, Map<String, String> attributes) {
    Objects.requireNonNull(payload, "payload");
    ensureRegistered(topic);
    Instant now = clock.instant();
    List<Subscription> targets = topic.getSubscriptions();
    Map<String, String> attrs = attributes == null ? Map.of() : Map.copyOf(attributes);

    long messageId = store.appendMessage(topic.getName(), payload, attrs, now);

    topic.track(messageId, targets.size());
    for (Subscription subscription : targets) {
      subscription.getQueue().enqueue(messageId, now);
    }
    LOG.debug(
        "Published message {} to topic {} fan-out={}", messageId, topic.getName(), targets.size());
    return messageId;
  }

  public long publish(Topic topic, byte[] payload) {
    return publish(topic, payload, Map.of());
  }

  /**
   * Lease the oldest eligible message of a subscription.
   *
   * @return the delivery, or empty when no message is available
   * @throws StorageUnavailableException if the body could not be read; nothing was leased
   */
  public Optional<Delivery> deliver(Subscription subscription) {
    String topic = subscription.getTopic().getName();
    return subscription
        .getQueue()
        .lease(clock.instant(), messageId -> store.readMessage(topic, messageId));
  }

  /**
   * Acknowledge a delivery.
   *
   * @throws LeaseExpiredException if the ack deadline passed or the message was redelivered
   * @throws LeaseNotFoundException if the message was already acked or dead-lettered
   */
  public void ack(LeaseToken lease) {
    subscriptionFor(lease).getQueue().ack(lease, clock.instant());
  }

  /**
   * Reject a delivery. The lease expires at once and the message is scheduled for redelivery
   * after its backoff, or dead-lettered if its retry budget is spent.
   *
   * @throws LeaseExpiredException if the ack deadline passed or the message was redelivered
   * @throws LeaseNotFoundException if the message was already acked or dead-lettered
   */
  public void nack(LeaseToken lease) {
    Subscription subscription = subscriptionFor(lease);
    subscription
        .getQueue()
        .nack(lease, clock.instant())
        .ifPresent(claim -> scheduler.deadLetter(subscription, claim));
  }

  public SubscriptionStats stats(Subscription subscription) {
    return subscription.getQueue().stats();
  }

  public TopicRegistry getRegistry() {
    return registry;
  }

  private Subscription subscriptionFor(LeaseToken lease) {
    return registry
        .subscription(lease.subscription())
        .orElseThrow(() -> new LeaseNotFoundException(lease));
  }

  private void ensureRegistered(Topic topic) {
    if (topic == null || registry.topic(topic.getName()).orElse(null) != topic) {
      throw new IllegalArgumentException("Unknown topic " + topic);
    }
  }
}

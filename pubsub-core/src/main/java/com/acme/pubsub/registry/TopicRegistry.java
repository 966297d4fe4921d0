package com.acme.pubsub.registry;

import com.acme.pubsub.config.SubscriptionConfig;
import com.acme.pubsub.config.TopicConfig;
import com.acme.pubsub.core.InvalidConfigException;
import com.acme.pubsub.retry.BackoffCalculator;
import com.acme.pubsub.tracking.SubscriptionQueue;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the declared topics and subscriptions. Configuration is validated and frozen at creation;
 * there is no update operation, a changed policy needs a new subscription.
 */
public class TopicRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(TopicRegistry.class);

  private final BackoffCalculator backoff;
  private final MessageSettledListener listener;
  private final Map<String, Topic> topics = new ConcurrentHashMap<>();
  private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

  public TopicRegistry(BackoffCalculator backoff, MessageSettledListener listener) {
    this.backoff = backoff;
    this.listener = listener;
  }

  /**
   * @throws InvalidConfigException when the name is blank or taken, or the delivery guarantee is
   *     missing or unsupported
   */
  public Topic createTopic(String name, TopicConfig config) {
    TopicConfig validated = ConfigValidator.validateTopic(name, config);
    Topic topic = new Topic(name, validated, listener);
    if (topics.putIfAbsent(name, topic) != null) {
      throw new InvalidConfigException("Topic " + name + " already exists");
    }
    LOG.info("Created topic {} ({})", name, validated.deliveryGuarantee());
    return topic;
  }

  /**
   * @throws InvalidConfigException when the name is blank or taken, the topic is unknown to this
   *     registry, the ack deadline is not positive, the retention is negative or the retry delay
   *     bounds are inverted
   */
  public Subscription createSubscription(Topic topic, String name, SubscriptionConfig config) {
    if (topic == null || topics.get(topic.getName()) != topic) {
      throw new InvalidConfigException("Subscription " + name + ": unknown topic " + topic);
    }
    SubscriptionConfig resolved = ConfigValidator.resolveSubscription(name, config);
    SubscriptionQueue queue = new SubscriptionQueue(name, resolved, backoff, topic::release);
    Subscription subscription = new Subscription(name, topic, resolved, queue);
    if (subscriptions.putIfAbsent(name, subscription) != null) {
      throw new InvalidConfigException("Subscription " + name + " already exists");
    }
    topic.attach(subscription);
    LOG.info(
        "Created subscription {} on topic {} ackDeadline={} retention={} retry={}",
        name,
        topic.getName(),
        resolved.ackDeadline(),
        resolved.messageRetention(),
        resolved.retryPolicy());
    return subscription;
  }

  public Optional<Topic> topic(String name) {
    return Optional.ofNullable(topics.get(name));
  }

  public Optional<Subscription> subscription(String name) {
    return Optional.ofNullable(subscriptions.get(name));
  }

  public Collection<Topic> topics() {
    return List.copyOf(topics.values());
  }

  public List<Subscription> subscriptions() {
    return List.copyOf(subscriptions.values());
  }

  /** Subscriptions of a topic in creation order; empty for a topic this registry does not know. */
  public List<Subscription> subscriptionsOf(String topic) {
    return topic(topic).map(Topic::getSubscriptions).orElse(List.of());
  }
}

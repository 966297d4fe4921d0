package com.acme.pubsub.registry;

import com.acme.pubsub.config.TopicConfig;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle of a created topic. Tracks, per published message, how many subscriptions still have to
 * settle it.
 */
public final class Topic {

  private final String name;
  private final TopicConfig config;
  private final MessageSettledListener listener;
  private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
  private final Map<Long, AtomicInteger> outstanding = new ConcurrentHashMap<>();

  Topic(String name, TopicConfig config, MessageSettledListener listener) {
    this.name = name;
    this.config = config;
    this.listener = listener;
  }

  public String getName() {
    return name;
  }

  public TopicConfig getConfig() {
    return config;
  }

  /** Snapshot of the subscriptions attached right now. */
  public List<Subscription> getSubscriptions() {
    return List.copyOf(subscriptions);
  }

  void attach(Subscription subscription) {
    subscriptions.add(subscription);
  }

  /** Record that {@code fanOut} subscriptions received the message. */
  public void track(long messageId, int fanOut) {
    if (fanOut > 0) {
      outstanding.put(messageId, new AtomicInteger(fanOut));
    }
  }

  void release(long messageId) {
    AtomicInteger remaining = outstanding.get(messageId);
    if (remaining != null && remaining.decrementAndGet() == 0) {
      outstanding.remove(messageId);
      listener.settled(name, messageId);
    }
  }

  public int outstandingMessages() {
    return outstanding.size();
  }

  @Override
  public String toString() {
    return "Topic{" + name + ", " + config.deliveryGuarantee() + '}';
  }
}

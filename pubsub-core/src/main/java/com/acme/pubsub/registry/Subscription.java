package com.acme.pubsub.registry;

import com.acme.pubsub.config.SubscriptionConfig;
import com.acme.pubsub.tracking.SubscriptionQueue;

/** Handle of a created subscription. Its configuration is resolved and immutable. */
public final class Subscription {

  private final String name;
  private final Topic topic;
  private final SubscriptionConfig config;
  private final SubscriptionQueue queue;

  Subscription(String name, Topic topic, SubscriptionConfig config, SubscriptionQueue queue) {
    this.name = name;
    this.topic = topic;
    this.config = config;
    this.queue = queue;
  }

  public String getName() {
    return name;
  }

  public Topic getTopic() {
    return topic;
  }

  public SubscriptionConfig getConfig() {
    return config;
  }

  public SubscriptionQueue getQueue() {
    return queue;
  }

  @Override
  public String toString() {
    return "Subscription{" + name + " -> " + topic.getName() + '}';
  }
}

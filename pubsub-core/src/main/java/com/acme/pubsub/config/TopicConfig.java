package com.acme.pubsub.config;

/** Configuration of a topic, frozen when the topic is created. */
public record TopicConfig(DeliveryGuarantee deliveryGuarantee) {

  public static TopicConfig atLeastOnce() {
    return new TopicConfig(DeliveryGuarantee.AT_LEAST_ONCE);
  }
}

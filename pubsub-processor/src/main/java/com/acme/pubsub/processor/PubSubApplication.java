package com.acme.pubsub.processor;

import io.micronaut.runtime.Micronaut;

/**
 * Broker runtime. Starts the redelivery sweep and the subscriber dispatcher; topics, subscriptions
 * and subscribers are registered by the embedding application through the {@code Broker} and
 * {@link SubscriberDispatcher} beans.
 */
public class PubSubApplication {
  public static void main(String[] args) {
    Micronaut.run(PubSubApplication.class, args);
  }
}

package com.acme.pubsub.spi;

import com.acme.pubsub.consumer.SubscriberContext;

/**
 * Consumer callback for a subscription. Returning normally acknowledges the message; throwing
 * hands it to the retry or dead-letter decision.
 *
 * @param <T> decoded message type, or {@link com.acme.pubsub.codec.RawMessage} for raw bytes
 */
@FunctionalInterface
public interface Subscriber<T> {

  void handle(SubscriberContext context, T message) throws Exception;
}

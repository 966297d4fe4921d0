package com.acme.pubsub.consumer;

import com.acme.pubsub.broker.Broker;
import com.acme.pubsub.codec.MessageCodec;
import com.acme.pubsub.core.LeaseException;
import com.acme.pubsub.core.SubscriberException;
import com.acme.pubsub.domain.Delivery;
import com.acme.pubsub.registry.Subscription;
import com.acme.pubsub.spi.Subscriber;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls deliveries from one subscription and feeds them to a subscriber: ack on success, nack on
 * failure. Lease races on the final ack or nack are expected and only logged at debug.
 */
public class SubscriberRunner<T> {
  private static final Logger LOG = LoggerFactory.getLogger(SubscriberRunner.class);

  private final Broker broker;
  private final Subscription subscription;
  private final MessageCodec<T> codec;
  private final Subscriber<T> subscriber;
  private final Clock clock;

  public SubscriberRunner(
      Broker broker,
      Subscription subscription,
      MessageCodec<T> codec,
      Subscriber<T> subscriber,
      Clock clock) {
    this.broker = broker;
    this.subscription = subscription;
    this.codec = codec;
    this.subscriber = subscriber;
    this.clock = clock;
  }

  /**
   * Process at most one message.
   *
   * @return false when no message was available
   */
  public boolean runOnce() {
    Optional<Delivery> next = broker.deliver(subscription);
    if (next.isEmpty()) {
      return false;
    }
    process(next.get());
    return true;
  }

  /**
   * Process messages until none is available, {@code max} were handled or the calling thread is
   * interrupted.
   */
  public int drain(int max) {
    int handled = 0;
    while (handled < max && !Thread.currentThread().isInterrupted() && runOnce()) {
      handled++;
    }
    return handled;
  }

  void process(Delivery delivery) {
    SubscriberContext context = new SubscriberContext(subscription.getName(), delivery, clock);
    try {
      subscriber.handle(context, codec.decode(delivery.message()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn(
          "Subscriber on {} interrupted handling message {}",
          subscription.getName(),
          delivery.message().id());
      settle(delivery, false);
      return;
    } catch (Exception e) {
      SubscriberException failure =
          new SubscriberException(subscription.getName(), delivery.message().id(), e);
      LOG.warn("{} (attempt {})", failure.getMessage(), delivery.attempt());
      LOG.debug("Subscriber failure detail", failure);
      settle(delivery, false);
      return;
    }
    settle(delivery, true);
  }

  private void settle(Delivery delivery, boolean success) {
    try {
      if (success) {
        broker.ack(delivery.lease());
      } else {
        broker.nack(delivery.lease());
      }
    } catch (LeaseException e) {
      LOG.debug("Lease lost before settling: {}", e.getMessage());
    }
  }

  public Subscription getSubscription() {
    return subscription;
  }
}

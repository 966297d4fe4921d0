package com.acme.pubsub.consumer;

import com.acme.pubsub.domain.Delivery;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-delivery context handed to a subscriber. Cancelling it only tells the subscriber to stop;
 * the lease stays in place until acked, nacked or expired, so an abandoned message is still
 * redelivered.
 */
public class SubscriberContext {

  private final String subscription;
  private final long messageId;
  private final int attempt;
  private final Map<String, String> attributes;
  private final Instant deadline;
  private final Clock clock;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public SubscriberContext(String subscription, Delivery delivery, Clock clock) {
    this.subscription = subscription;
    this.messageId = delivery.message().id();
    this.attempt = delivery.attempt();
    this.attributes = delivery.message().attributes();
    this.deadline = delivery.deadline();
    this.clock = clock;
  }

  public String getSubscription() {
    return subscription;
  }

  public long getMessageId() {
    return messageId;
  }

  public int getAttempt() {
    return attempt;
  }

  public Map<String, String> getAttributes() {
    return attributes;
  }

  public Instant getDeadline() {
    return deadline;
  }

  /** Time left before the lease expires, zero once it has. */
  public Duration remaining() {
    Duration left = Duration.between(clock.instant(), deadline);
    return left.isNegative() ? Duration.ZERO : left;
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get() || remaining().isZero();
  }
}

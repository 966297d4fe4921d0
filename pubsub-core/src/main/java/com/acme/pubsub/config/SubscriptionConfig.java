package com.acme.pubsub.config;

import java.time.Duration;

/**
 * Configuration of a subscription, frozen when the subscription is created.
 *
 * @param ackDeadline time a consumer has to acknowledge a delivered message, must be positive
 * @param messageRetention how long an unacknowledged message is kept; zero keeps it until it is
 *     acknowledged or dead-lettered
 * @param retryPolicy retry and dead-letter behaviour, defaults when absent
 */
public record SubscriptionConfig(
    Duration ackDeadline, Duration messageRetention, RetryPolicy retryPolicy) {

  public static SubscriptionConfig of(Duration ackDeadline) {
    return new SubscriptionConfig(ackDeadline, Duration.ZERO, RetryPolicy.defaults());
  }

  public SubscriptionConfig withRetention(Duration retention) {
    return new SubscriptionConfig(ackDeadline, retention, retryPolicy);
  }

  public SubscriptionConfig withRetryPolicy(RetryPolicy policy) {
    return new SubscriptionConfig(ackDeadline, messageRetention, policy);
  }

  public boolean retainsUntilAcknowledged() {
    return messageRetention == null || messageRetention.isZero();
  }
}

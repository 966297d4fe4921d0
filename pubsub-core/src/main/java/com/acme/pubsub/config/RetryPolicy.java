package com.acme.pubsub.config;

import java.time.Duration;

/**
 * How a subscription retries a message after a failed or timed-out delivery. Absent fields take
 * their defaults through {@link #withDefaults()}.
 */
public record RetryPolicy(Duration minRetryDelay, Duration maxRetryDelay, MaxRetries maxRetries) {

  public static final Duration DEFAULT_MIN_RETRY_DELAY = Duration.ofSeconds(10);
  public static final Duration DEFAULT_MAX_RETRY_DELAY = Duration.ofMinutes(10);

  public static RetryPolicy defaults() {
    return new RetryPolicy(DEFAULT_MIN_RETRY_DELAY, DEFAULT_MAX_RETRY_DELAY, MaxRetries.useDefault());
  }

  public static RetryPolicy of(Duration minRetryDelay, Duration maxRetryDelay, int maxRetries) {
    return new RetryPolicy(minRetryDelay, maxRetryDelay, MaxRetries.fromLegacy(maxRetries));
  }

  public RetryPolicy withDefaults() {
    return new RetryPolicy(
        minRetryDelay != null ? minRetryDelay : DEFAULT_MIN_RETRY_DELAY,
        maxRetryDelay != null ? maxRetryDelay : DEFAULT_MAX_RETRY_DELAY,
        maxRetries != null ? maxRetries : MaxRetries.useDefault());
  }

  public RetryPolicy withMaxRetries(MaxRetries value) {
    return new RetryPolicy(minRetryDelay, maxRetryDelay, value);
  }
}

package com.acme.pubsub.retry;

import com.acme.pubsub.config.JitterMode;
import com.acme.pubsub.config.MaxRetries;
import com.acme.pubsub.config.RetryPolicy;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential retry delays and the dead-letter threshold check.
 *
 * <p>{@code delay = min(maxRetryDelay, minRetryDelay * 2^(attempt - 1))}. With {@link
 * JitterMode#FULL} the delay is replaced by a uniform value in {@code [0, delay]} drawn from the
 * supplied random source.
 */
public class BackoffCalculator {

  // 2^40 * any positive millisecond delay is far beyond any sane maxRetryDelay
  private static final int MAX_EXPONENT = 40;

  private final JitterMode jitter;
  private final Random random;

  public BackoffCalculator() {
    this(JitterMode.NONE, new Random());
  }

  public BackoffCalculator(JitterMode jitter, Random random) {
    this.jitter = Objects.requireNonNull(jitter, "jitter");
    this.random = Objects.requireNonNull(random, "random");
  }

  public Duration nextDelay(int attemptCount, RetryPolicy policy) {
    Duration base = exponentialDelay(attemptCount, policy);
    if (jitter == JitterMode.FULL) {
      long millis = base.toMillis();
      return Duration.ofMillis((long) Math.floor(random.nextDouble() * (millis + 1)));
    }
    return base;
  }

  /** Delay before jitter is applied. */
  public Duration exponentialDelay(int attemptCount, RetryPolicy policy) {
    long min = policy.minRetryDelay().toMillis();
    long max = policy.maxRetryDelay().toMillis();
    int exponent = Math.min(Math.max(attemptCount, 1) - 1, MAX_EXPONENT);
    long delay;
    try {
      delay = Math.multiplyExact(min, 1L << exponent);
    } catch (ArithmeticException overflow) {
      delay = max;
    }
    return Duration.ofMillis(Math.min(max, delay));
  }

  public boolean shouldDeadLetter(int attemptCount, RetryPolicy policy) {
    MaxRetries maxRetries = policy.maxRetries();
    return switch (maxRetries.kind()) {
      case INFINITE -> false;
      case IMMEDIATE -> attemptCount >= 1;
      case FINITE -> attemptCount >= maxRetries.limit();
      case USE_DEFAULT -> attemptCount >= MaxRetries.DEFAULT_LIMIT;
    };
  }

  public JitterMode getJitter() {
    return jitter;
  }
}

package com.acme.pubsub.tracking;

/**
 * Lifecycle of a (message, subscription) pair once it has been delivered at least once.
 *
 * <p>{@code DELIVERED -> EXPIRED -> PENDING_REDELIVERY -> DELIVERED} loops until the retry budget
 * is spent, then {@code EXPIRED -> DEAD_LETTERING -> DEAD_LETTERED}. Acknowledgement and retention
 * expiry are terminal as well; terminal states are reported but never stored.
 */
public enum DeliveryState {
  DELIVERED,
  EXPIRED,
  PENDING_REDELIVERY,
  DEAD_LETTERING,
  ACKED,
  DEAD_LETTERED,
  RETENTION_EXPIRED;

  public boolean isTerminal() {
    return this == ACKED || this == DEAD_LETTERED || this == RETENTION_EXPIRED;
  }
}

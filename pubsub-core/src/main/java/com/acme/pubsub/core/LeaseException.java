package com.acme.pubsub.core;

import com.acme.pubsub.domain.LeaseToken;

/**
 * An ack or nack lost the race for its delivery record. These are expected outcomes of
 * at-least-once delivery and are reported to the caller rather than treated as faults.
 */
public abstract class LeaseException extends PermanentException {
  private final transient LeaseToken lease;

  protected LeaseException(String message, LeaseToken lease) {
    super(message);
    this.lease = lease;
  }

  public LeaseToken getLease() {
    return lease;
  }
}

package com.acme.pubsub.core;

import com.acme.pubsub.domain.LeaseToken;

/** The lease deadline passed, or the message was already handed to another delivery attempt. */
public class LeaseExpiredException extends LeaseException {
  public LeaseExpiredException(LeaseToken lease) {
    super(
        "Lease expired for message "
            + lease.messageId()
            + " on subscription "
            + lease.subscription()
            + " (attempt "
            + lease.attempt()
            + ")",
        lease);
  }
}

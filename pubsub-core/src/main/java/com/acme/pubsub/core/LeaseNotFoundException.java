package com.acme.pubsub.core;

import com.acme.pubsub.domain.LeaseToken;

/** No delivery record exists for the lease: the message was already acked or dead-lettered. */
public class LeaseNotFoundException extends LeaseException {
  public LeaseNotFoundException(LeaseToken lease) {
    super(
        "No delivery record for message "
            + lease.messageId()
            + " on subscription "
            + lease.subscription(),
        lease);
  }
}

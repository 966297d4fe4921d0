package com.acme.pubsub.domain;

import java.time.Instant;

/** A message handed to a consumer together with its lease. */
public record Delivery(Message message, LeaseToken lease, Instant deadline) {

  public int attempt() {
    return lease.attempt();
  }
}

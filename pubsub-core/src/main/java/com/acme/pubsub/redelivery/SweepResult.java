package com.acme.pubsub.redelivery;

/** Counts of one redelivery sweep. */
public record SweepResult(
    int expired, int redeliveriesScheduled, int deadLettered, int retentionExpired, int purged) {

  public static final SweepResult EMPTY = new SweepResult(0, 0, 0, 0, 0);

  public SweepResult plus(SweepResult other) {
    return new SweepResult(
        expired + other.expired,
        redeliveriesScheduled + other.redeliveriesScheduled,
        deadLettered + other.deadLettered,
        retentionExpired + other.retentionExpired,
        purged + other.purged);
  }

  public boolean isEmpty() {
    return expired == 0 && deadLettered == 0 && retentionExpired == 0 && purged == 0;
  }
}

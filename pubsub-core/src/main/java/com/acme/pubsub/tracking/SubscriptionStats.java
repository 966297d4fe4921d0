package com.acme.pubsub.tracking;

/** Point-in-time counters of one subscription. */
public record SubscriptionStats(
    String subscription,
    int pending,
    int inFlight,
    int pendingRedelivery,
    int awaitingDeadLetter,
    long delivered,
    long acked,
    long redeliveriesScheduled,
    long deadLettered,
    long retentionExpired) {}

package com.acme.pubsub.tracking;

import java.util.UUID;

/**
 * Exclusive right to forward a message to the dead-letter destination. Obtained under the
 * subscription lock, completed or released after the forward.
 */
public record DeadLetterClaim(String subscription, long messageId, int attemptCount, UUID leaseId) {}

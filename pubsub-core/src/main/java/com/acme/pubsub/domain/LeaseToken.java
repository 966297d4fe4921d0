package com.acme.pubsub.domain;

import java.util.UUID;

/**
 * Binds a consumer to one delivery attempt of a message. A new lease id is issued on every
 * delivery, so a token from an earlier attempt can never settle a later one.
 */
public record LeaseToken(String subscription, long messageId, int attempt, UUID leaseId) {}

package com.acme.pubsub.tracking;

import com.acme.pubsub.domain.LeaseToken;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Delivery bookkeeping for one message on one subscription. Mutated only by {@link AckTracker}
 * under the owning subscription's lock.
 */
public final class DeliveryRecord {

  private final long messageId;
  private final Instant publishedAt;
  private int attemptCount;
  private UUID leaseId;
  private Instant deliveredAt;
  private Instant deadline;
  private Instant notBefore;
  private DeliveryState state;

  DeliveryRecord(long messageId, Instant publishedAt) {
    this.messageId = messageId;
    this.publishedAt = publishedAt;
  }

  void deliver(Instant now, Duration ackDeadline) {
    attemptCount++;
    leaseId = UUID.randomUUID();
    deliveredAt = now;
    deadline = now.plus(ackDeadline);
    notBefore = null;
    state = DeliveryState.DELIVERED;
  }

  void setDeadline(Instant deadline) {
    this.deadline = deadline;
  }

  void setNotBefore(Instant notBefore) {
    this.notBefore = notBefore;
  }

  void setState(DeliveryState state) {
    this.state = state;
  }

  public LeaseToken lease(String subscription) {
    return new LeaseToken(subscription, messageId, attemptCount, leaseId);
  }

  public boolean holds(LeaseToken token) {
    return leaseId.equals(token.leaseId());
  }

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(deadline);
  }

  public long getMessageId() {
    return messageId;
  }

  public Instant getPublishedAt() {
    return publishedAt;
  }

  public int getAttemptCount() {
    return attemptCount;
  }

  public UUID getLeaseId() {
    return leaseId;
  }

  public Instant getDeliveredAt() {
    return deliveredAt;
  }

  public Instant getDeadline() {
    return deadline;
  }

  public Instant getNotBefore() {
    return notBefore;
  }

  public DeliveryState getState() {
    return state;
  }

  @Override
  public String toString() {
    return "DeliveryRecord{messageId="
        + messageId
        + ", attempt="
        + attemptCount
        + ", state="
        + state
        + ", deadline="
        + deadline
        + '}';
  }
}

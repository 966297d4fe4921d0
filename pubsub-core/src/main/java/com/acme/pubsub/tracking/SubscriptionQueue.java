package com.acme.pubsub.tracking;

import com.acme.pubsub.config.RetryPolicy;
import com.acme.pubsub.config.SubscriptionConfig;
import com.acme.pubsub.core.LeaseExpiredException;
import com.acme.pubsub.core.LeaseNotFoundException;
import com.acme.pubsub.domain.Delivery;
import com.acme.pubsub.domain.LeaseToken;
import com.acme.pubsub.domain.Message;
import com.acme.pubsub.retry.BackoffCalculator;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongConsumer;
import java.util.function.LongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared mutable state of one subscription: the pending index and the ack tracker behind a single
 * lock. Every operation that moves a message between states is one critical section, so selection
 * and lease creation are atomic and an ack, a nack and the expiry sweep can never both settle the
 * same delivery. Subscriptions never share a lock.
 *
 * <p>{@code onSettled} is invoked, outside the lock, exactly once per message that leaves this
 * subscription for good (acked, dead-lettered or retention-expired).
 */
public class SubscriptionQueue {
  private static final Logger LOG = LoggerFactory.getLogger(SubscriptionQueue.class);

  private final String subscription;
  private final Duration ackDeadline;
  private final Duration retention;
  private final RetryPolicy policy;
  private final BackoffCalculator backoff;
  private final LongConsumer onSettled;

  private final ReentrantLock lock = new ReentrantLock();
  private final PendingIndex pending = new PendingIndex();
  private final AckTracker tracker = new AckTracker();

  private long delivered;
  private long acked;
  private long redeliveriesScheduled;
  private long deadLettered;
  private long retentionExpired;

  /** Outcome of one expiry scan. */
  public record ExpiryOutcome(int expired, int redeliveriesScheduled, List<DeadLetterClaim> claims) {}

  public SubscriptionQueue(
      String subscription,
      SubscriptionConfig config,
      BackoffCalculator backoff,
      LongConsumer onSettled) {
    this.subscription = subscription;
    this.ackDeadline = config.ackDeadline();
    this.retention = config.messageRetention() == null ? Duration.ZERO : config.messageRetention();
    this.policy = config.retryPolicy();
    this.backoff = backoff;
    this.onSettled = onSettled;
  }

  public void enqueue(long messageId, Instant publishedAt) {
    lock.lock();
    try {
      pending.add(messageId, publishedAt, null);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Lease the oldest eligible message. The body is loaded inside the critical section; if the
   * loader throws, nothing changes. A body the loader no longer finds is settled as
   * retention-expired and the next candidate is tried.
   */
  public Optional<Delivery> lease(Instant now, LongFunction<Optional<Message>> loader) {
    List<Long> settled = new ArrayList<>();
    lock.lock();
    try {
      while (true) {
        Optional<PendingIndex.Entry> candidate = pending.firstEligible(now);
        if (candidate.isEmpty()) {
          return Optional.empty();
        }
        long messageId = candidate.get().messageId();
        Optional<Message> message = loader.apply(messageId);
        if (message.isEmpty()) {
          LOG.debug("Message {} no longer stored, dropping from {}", messageId, subscription);
          pending.remove(messageId);
          tracker.remove(messageId);
          retentionExpired++;
          settled.add(messageId);
          continue;
        }
        pending.remove(messageId);
        DeliveryRecord record =
            tracker.get(messageId).isPresent()
                ? tracker.refresh(messageId, now, ackDeadline)
                : tracker.register(messageId, candidate.get().publishedAt(), now, ackDeadline);
        delivered++;
        LOG.debug(
            "Leased message {} on {} attempt={} deadline={}",
            messageId,
            subscription,
            record.getAttemptCount(),
            record.getDeadline());
        return Optional.of(
            new Delivery(message.get(), record.lease(subscription), record.getDeadline()));
      }
    } finally {
      lock.unlock();
      settled.forEach(onSettled::accept);
    }
  }

  public void ack(LeaseToken token, Instant now) {
    lock.lock();
    try {
      DeliveryRecord record = validLease(token, now);
      tracker.remove(record.getMessageId());
      acked++;
    } finally {
      lock.unlock();
    }
    LOG.debug("Acked message {} on {}", token.messageId(), subscription);
    onSettled.accept(token.messageId());
  }

  /**
   * Expire a lease immediately and apply the retry-or-dead-letter decision to it. Returns a claim
   * when the message must be forwarded to the dead-letter destination.
   */
  public Optional<DeadLetterClaim> nack(LeaseToken token, Instant now) {
    lock.lock();
    try {
      DeliveryRecord record = validLease(token, now);
      tracker.expireNow(record, now);
      LOG.debug("Nacked message {} on {}", token.messageId(), subscription);
      return decide(record, now);
    } finally {
      lock.unlock();
    }
  }

  /** Decide every expired delivery: schedule a redelivery or claim it for dead-lettering. */
  public ExpiryOutcome collectExpired(Instant now) {
    lock.lock();
    try {
      List<DeliveryRecord> expired = tracker.expired(now);
      List<DeadLetterClaim> claims = new ArrayList<>();
      int retried = 0;
      for (DeliveryRecord record : expired) {
        Optional<DeadLetterClaim> claim = decide(record, now);
        if (claim.isPresent()) {
          claims.add(claim.get());
        } else {
          retried++;
        }
      }
      return new ExpiryOutcome(expired.size(), retried, claims);
    } finally {
      lock.unlock();
    }
  }

  /** Finish a dead-letter forward. Returns false if the claim is no longer current. */
  public boolean completeDeadLetter(DeadLetterClaim claim) {
    lock.lock();
    try {
      Optional<DeliveryRecord> record = claimed(claim);
      if (record.isEmpty()) {
        LOG.warn("Dead-letter claim for message {} on {} is stale", claim.messageId(), subscription);
        return false;
      }
      tracker.remove(claim.messageId());
      deadLettered++;
    } finally {
      lock.unlock();
    }
    onSettled.accept(claim.messageId());
    return true;
  }

  /**
   * Settle a claim whose body disappeared from the store before it could be forwarded. Counted as
   * retention expiry, since that is what removed the body.
   */
  public boolean discardDeadLetter(DeadLetterClaim claim) {
    lock.lock();
    try {
      if (claimed(claim).isEmpty()) {
        return false;
      }
      tracker.remove(claim.messageId());
      retentionExpired++;
    } finally {
      lock.unlock();
    }
    onSettled.accept(claim.messageId());
    return true;
  }

  /** Give a claim back after a failed forward; the next expiry scan decides the message again. */
  public void releaseDeadLetter(DeadLetterClaim claim) {
    lock.lock();
    try {
      claimed(claim).ifPresent(record -> tracker.transition(record, DeliveryState.EXPIRED));
    } finally {
      lock.unlock();
    }
  }

  /** Drop waiting messages older than the retention. Returns how many were dropped. */
  public int expireRetention(Instant now) {
    if (retention.isZero()) {
      return 0;
    }
    List<Long> settled = new ArrayList<>();
    lock.lock();
    try {
      for (PendingIndex.Entry entry : pending.publishedAtOrBefore(now.minus(retention))) {
        pending.remove(entry.messageId());
        tracker.remove(entry.messageId());
        retentionExpired++;
        settled.add(entry.messageId());
      }
    } finally {
      lock.unlock();
    }
    if (!settled.isEmpty()) {
      LOG.debug("Retention expired {} message(s) on {}", settled.size(), subscription);
    }
    settled.forEach(onSettled::accept);
    return settled.size();
  }

  public SubscriptionStats stats() {
    lock.lock();
    try {
      return new SubscriptionStats(
          subscription,
          pending.size(),
          tracker.count(DeliveryState.DELIVERED),
          tracker.count(DeliveryState.PENDING_REDELIVERY),
          tracker.count(DeliveryState.EXPIRED) + tracker.count(DeliveryState.DEAD_LETTERING),
          delivered,
          acked,
          redeliveriesScheduled,
          deadLettered,
          retentionExpired);
    } finally {
      lock.unlock();
    }
  }

  public String getSubscription() {
    return subscription;
  }

  private DeliveryRecord validLease(LeaseToken token, Instant now) {
    DeliveryRecord record =
        tracker.get(token.messageId()).orElseThrow(() -> new LeaseNotFoundException(token));
    if (!record.holds(token)
        || record.getState() != DeliveryState.DELIVERED
        || record.isExpiredAt(now)) {
      throw new LeaseExpiredException(token);
    }
    return record;
  }

  private Optional<DeliveryRecord> claimed(DeadLetterClaim claim) {
    return tracker
        .get(claim.messageId())
        .filter(r -> r.getState() == DeliveryState.DEAD_LETTERING)
        .filter(r -> r.getLeaseId().equals(claim.leaseId()));
  }

  // caller holds the lock
  private Optional<DeadLetterClaim> decide(DeliveryRecord record, Instant now) {
    int attempt = record.getAttemptCount();
    if (backoff.shouldDeadLetter(attempt, policy)) {
      tracker.transition(record, DeliveryState.DEAD_LETTERING);
      return Optional.of(
          new DeadLetterClaim(subscription, record.getMessageId(), attempt, record.getLeaseId()));
    }
    Instant notBefore = now.plus(backoff.nextDelay(attempt, policy));
    tracker.scheduleRedelivery(record, notBefore);
    pending.add(record.getMessageId(), record.getPublishedAt(), notBefore);
    redeliveriesScheduled++;
    LOG.debug(
        "Message {} on {} will be redelivered after {} (attempt {})",
        record.getMessageId(),
        subscription,
        notBefore,
        attempt);
    return Optional.empty();
  }
}

package com.acme.pubsub.redelivery;

import com.acme.pubsub.config.SubscriptionConfig;
import com.acme.pubsub.domain.Message;
import com.acme.pubsub.registry.Subscription;
import com.acme.pubsub.registry.Topic;
import com.acme.pubsub.registry.TopicRegistry;
import com.acme.pubsub.spi.DeadLetterSink;
import com.acme.pubsub.spi.MessageStore;
import com.acme.pubsub.tracking.DeadLetterClaim;
import com.acme.pubsub.tracking.SubscriptionQueue;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recurring sweep over every subscription: drops messages whose retention elapsed, then decides
 * each expired delivery. A message under its retry budget becomes deliverable again once its
 * backoff has passed; one over it is forwarded to the dead-letter destination.
 *
 * <p>The sweep itself is not scheduled here. Whoever drives it should call {@link #sweep()} at an
 * interval no longer than {@link #maxSweepInterval()}.
 */
public class RedeliveryScheduler {
  private static final Logger LOG = LoggerFactory.getLogger(RedeliveryScheduler.class);

  private final TopicRegistry registry;
  private final MessageStore store;
  private final DeadLetterSink deadLetters;
  private final Clock clock;

  public RedeliveryScheduler(
      TopicRegistry registry, MessageStore store, DeadLetterSink deadLetters, Clock clock) {
    this.registry = registry;
    this.store = store;
    this.deadLetters = deadLetters;
    this.clock = clock;
  }

  public SweepResult sweep() {
    Instant now = clock.instant();
    SweepResult total = SweepResult.EMPTY;
    for (Subscription subscription : registry.subscriptions()) {
      try {
        total = total.plus(sweep(subscription, now));
      } catch (RuntimeException e) {
        LOG.error("Redelivery sweep failed for subscription {}", subscription.getName(), e);
      }
    }
    for (Topic topic : registry.topics()) {
      try {
        total = total.plus(new SweepResult(0, 0, 0, 0, purge(topic)));
      } catch (RuntimeException e) {
        LOG.error("Retention purge failed for topic {}", topic.getName(), e);
      }
    }
    if (!total.isEmpty()) {
      LOG.debug("Sweep finished: {}", total);
    }
    return total;
  }

  public SweepResult sweep(Subscription subscription, Instant now) {
    SubscriptionQueue queue = subscription.getQueue();
    int retentionExpired = queue.expireRetention(now);
    SubscriptionQueue.ExpiryOutcome outcome = queue.collectExpired(now);
    int deadLettered = 0;
    for (DeadLetterClaim claim : outcome.claims()) {
      if (deadLetter(subscription, claim)) {
        deadLettered++;
      }
    }
    return new SweepResult(
        outcome.expired(), outcome.redeliveriesScheduled(), deadLettered, retentionExpired, 0);
  }

  /**
   * Forward a claimed message to the dead-letter destination. On failure the claim is released and
   * a later sweep tries again.
   *
   * @return true if the message left the subscription as dead-lettered
   */
  public boolean deadLetter(Subscription subscription, DeadLetterClaim claim) {
    SubscriptionQueue queue = subscription.getQueue();
    String topic = subscription.getTopic().getName();
    try {
      Optional<Message> message = store.readMessage(topic, claim.messageId());
      if (message.isEmpty()) {
        LOG.warn(
            "Message {} of {} was purged before it could be dead-lettered",
            claim.messageId(),
            subscription.getName());
        queue.discardDeadLetter(claim);
        return false;
      }
      deadLetters.sendToDeadLetter(subscription.getName(), message.get(), claim.attemptCount());
    } catch (RuntimeException e) {
      LOG.warn(
          "Dead-letter forward of message {} from {} failed, retrying on next sweep: {}",
          claim.messageId(),
          subscription.getName(),
          e.getMessage());
      queue.releaseDeadLetter(claim);
      return false;
    }
    if (queue.completeDeadLetter(claim)) {
      LOG.info(
          "Dead-lettered message {} from {} after {} attempt(s)",
          claim.messageId(),
          subscription.getName(),
          claim.attemptCount());
      return true;
    }
    return false;
  }

  /** Smallest ack deadline across subscriptions, empty when there are none. */
  public Optional<Duration> maxSweepInterval() {
    return registry.subscriptions().stream()
        .map(Subscription::getConfig)
        .map(SubscriptionConfig::ackDeadline)
        .min(Duration::compareTo);
  }

  // Purge only when every subscription bounds its retention; the horizon is the longest of them.
  private int purge(Topic topic) {
    List<Subscription> subscriptions = topic.getSubscriptions();
    if (subscriptions.isEmpty()) {
      return 0;
    }
    Duration horizon = Duration.ZERO;
    for (Subscription subscription : subscriptions) {
      SubscriptionConfig config = subscription.getConfig();
      if (config.retainsUntilAcknowledged()) {
        return 0;
      }
      if (config.messageRetention().compareTo(horizon) > 0) {
        horizon = config.messageRetention();
      }
    }
    int purged = store.purgeExpired(topic.getName(), horizon);
    if (purged > 0) {
      LOG.debug("Purged {} expired message(s) from topic {}", purged, topic.getName());
    }
    return purged;
  }
}

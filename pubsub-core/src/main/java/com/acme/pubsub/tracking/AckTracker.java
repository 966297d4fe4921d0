package com.acme.pubsub.tracking;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Delivery records of one subscription, keyed by message id, with in-flight records additionally
 * ordered by ack deadline so expiry scans only touch what has actually expired.
 *
 * <p>Not thread-safe: every call happens under the lock of the owning {@link SubscriptionQueue},
 * which makes register, remove and the expiry scan mutually exclusive. Whichever caller removes a
 * record first owns its outcome.
 */
public class AckTracker {

  private static final Comparator<DeliveryRecord> BY_DEADLINE =
      Comparator.comparing(DeliveryRecord::getDeadline)
          .thenComparingLong(DeliveryRecord::getMessageId);

  private final Map<Long, DeliveryRecord> records = new HashMap<>();
  // invariant: contains exactly the records in state DELIVERED
  private final TreeSet<DeliveryRecord> inFlight = new TreeSet<>(BY_DEADLINE);
  // expired records whose dead-letter forward failed and must be decided again
  private final Set<Long> stranded = new LinkedHashSet<>();

  /** Start tracking a first delivery. */
  public DeliveryRecord register(
      long messageId, Instant publishedAt, Instant now, Duration ackDeadline) {
    if (records.containsKey(messageId)) {
      throw new IllegalStateException("Message " + messageId + " is already tracked");
    }
    DeliveryRecord record = new DeliveryRecord(messageId, publishedAt);
    record.deliver(now, ackDeadline);
    records.put(messageId, record);
    inFlight.add(record);
    return record;
  }

  /** Redeliver a tracked message: bumps the attempt count and issues a new lease. */
  public DeliveryRecord refresh(long messageId, Instant now, Duration ackDeadline) {
    DeliveryRecord record = records.get(messageId);
    if (record == null) {
      throw new IllegalStateException("Message " + messageId + " is not tracked");
    }
    detach(record);
    record.deliver(now, ackDeadline);
    inFlight.add(record);
    return record;
  }

  public Optional<DeliveryRecord> get(long messageId) {
    return Optional.ofNullable(records.get(messageId));
  }

  public Optional<DeliveryRecord> remove(long messageId) {
    DeliveryRecord record = records.remove(messageId);
    if (record != null) {
      detach(record);
    }
    return Optional.ofNullable(record);
  }

  /**
   * Records whose ack deadline has passed, earliest deadline first, followed by expired records
   * still waiting for a retry-or-dead-letter decision.
   */
  public List<DeliveryRecord> expired(Instant now) {
    List<DeliveryRecord> result = new ArrayList<>();
    for (DeliveryRecord record : inFlight) {
      if (!record.isExpiredAt(now)) {
        break;
      }
      result.add(record);
    }
    for (Long id : stranded) {
      result.add(records.get(id));
    }
    return result;
  }

  /** Force the deadline of an in-flight record to {@code now}. */
  public void expireNow(DeliveryRecord record, Instant now) {
    detach(record);
    record.setDeadline(now);
    record.setState(DeliveryState.DELIVERED);
    inFlight.add(record);
  }

  public void transition(DeliveryRecord record, DeliveryState state) {
    if (state.isTerminal()) {
      throw new IllegalArgumentException("Terminal states are not tracked: " + state);
    }
    detach(record);
    record.setState(state);
    if (state == DeliveryState.DELIVERED) {
      inFlight.add(record);
    } else if (state == DeliveryState.EXPIRED) {
      stranded.add(record.getMessageId());
    }
  }

  public void scheduleRedelivery(DeliveryRecord record, Instant notBefore) {
    transition(record, DeliveryState.PENDING_REDELIVERY);
    record.setNotBefore(notBefore);
  }

  public int size() {
    return records.size();
  }

  public int count(DeliveryState state) {
    if (state == DeliveryState.DELIVERED) {
      return inFlight.size();
    }
    int n = 0;
    for (DeliveryRecord record : records.values()) {
      if (record.getState() == state) {
        n++;
      }
    }
    return n;
  }

  private void detach(DeliveryRecord record) {
    if (record.getState() == DeliveryState.DELIVERED) {
      inFlight.remove(record);
    } else if (record.getState() == DeliveryState.EXPIRED) {
      stranded.remove(record.getMessageId());
    }
  }
}

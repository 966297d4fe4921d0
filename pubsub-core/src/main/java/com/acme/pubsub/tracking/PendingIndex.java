package com.acme.pubsub.tracking;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Messages of one subscription that are waiting for a delivery, ordered by message id. Entries
 * scheduled for redelivery carry a {@code notBefore} instant and are skipped until it passes.
 *
 * <p>Guarded by the owning {@link SubscriptionQueue}'s lock.
 */
public class PendingIndex {

  public record Entry(long messageId, Instant publishedAt, Instant notBefore) {

    public boolean isEligibleAt(Instant now) {
      return notBefore == null || !notBefore.isAfter(now);
    }
  }

  private final TreeMap<Long, Entry> entries = new TreeMap<>();

  public void add(long messageId, Instant publishedAt, Instant notBefore) {
    entries.put(messageId, new Entry(messageId, publishedAt, notBefore));
  }

  /** Oldest entry that may be delivered at {@code now}. */
  public Optional<Entry> firstEligible(Instant now) {
    for (Entry entry : entries.values()) {
      if (entry.isEligibleAt(now)) {
        return Optional.of(entry);
      }
    }
    return Optional.empty();
  }

  public boolean remove(long messageId) {
    return entries.remove(messageId) != null;
  }

  public boolean contains(long messageId) {
    return entries.containsKey(messageId);
  }

  /** Entries whose retention elapsed by {@code cutoff}, i.e. published at or before it. */
  public List<Entry> publishedAtOrBefore(Instant cutoff) {
    List<Entry> result = new ArrayList<>();
    for (Entry entry : entries.values()) {
      if (!entry.publishedAt().isAfter(cutoff)) {
        result.add(entry);
      }
    }
    return result;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}

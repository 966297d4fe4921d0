package com.acme.pubsub.domain;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A message routed to the dead-letter destination of a subscription. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetter {

  private UUID id;
  private String subscription;
  private String topic;
  private long messageId;
  private byte[] payload;
  private Map<String, String> attributes;
  private int attempts;
  private Instant publishedAt;
  private Instant deadLetteredAt;

  public static DeadLetter of(
      String subscription, Message message, int attempts, Instant deadLetteredAt) {
    return new DeadLetter(
        UUID.randomUUID(),
        subscription,
        message.topic(),
        message.id(),
        message.payload(),
        message.attributes(),
        attempts,
        message.publishedAt(),
        deadLetteredAt);
  }
}

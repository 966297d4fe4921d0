package com.acme.pubsub.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A published message. Ids are assigned by the message store at append time and increase
 * monotonically within a topic.
 */
public record Message(
    String topic, long id, byte[] payload, Map<String, String> attributes, Instant publishedAt) {

  public Message {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(publishedAt, "publishedAt");
    payload = payload.clone();
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  /** A copy of the body; the message itself never changes. */
  @Override
  public byte[] payload() {
    return payload.clone();
  }

  public String attribute(String key) {
    return attributes.get(key);
  }
}

package com.acme.pubsub.codec;

import com.acme.pubsub.domain.Message;

/** Converts between a typed value and a message payload. */
public interface MessageCodec<T> {

  byte[] encode(T value);

  /** Decode a delivered message. A failure here counts as a subscriber failure. */
  T decode(Message message);
}

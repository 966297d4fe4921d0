package com.acme.pubsub.codec;

import com.acme.pubsub.core.Jsons;
import com.acme.pubsub.domain.Message;

/** JSON payloads mapped with Jackson. */
public class JsonMessageCodec<T> implements MessageCodec<T> {

  private final Class<T> type;

  public JsonMessageCodec(Class<T> type) {
    this.type = type;
  }

  @Override
  public byte[] encode(T value) {
    return Jsons.toBytes(value);
  }

  @Override
  public T decode(Message message) {
    return Jsons.fromBytes(message.payload(), type);
  }

  public Class<T> getType() {
    return type;
  }
}

package com.acme.pubsub.codec;

import com.acme.pubsub.domain.Message;

public class RawMessageCodec implements MessageCodec<RawMessage> {

  @Override
  public byte[] encode(RawMessage value) {
    return value.data();
  }

  @Override
  public RawMessage decode(Message message) {
    return new RawMessage(message.id(), message.payload(), message.attributes());
  }
}

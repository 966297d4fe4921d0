package com.acme.pubsub.broker;

import com.acme.pubsub.codec.MessageCodec;
import com.acme.pubsub.registry.Topic;
import java.util.Map;

/** Publishes typed values to one topic through a codec. */
public class TopicPublisher<T> {

  private final Broker broker;
  private final Topic topic;
  private final MessageCodec<T> codec;

  public TopicPublisher(Broker broker, Topic topic, MessageCodec<T> codec) {
    this.broker = broker;
    this.topic = topic;
    this.codec = codec;
  }

  public long publish(T value) {
    return publish(value, Map.of());
  }

  public long publish(T value, Map<String, String> attributes) {
    return broker.publish(topic, codec.encode(value), attributes);
  }
}

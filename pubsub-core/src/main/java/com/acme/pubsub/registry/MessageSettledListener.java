package com.acme.pubsub.registry;

/** Notified once every subscription that received a message has settled it. */
@FunctionalInterface
public interface MessageSettledListener {

  void settled(String topic, long messageId);
}

package com.acme.pubsub.spi;

import com.acme.pubsub.domain.Message;

/** Terminal destination for messages that exhausted their retry budget. */
public interface DeadLetterSink {

  /**
   * Forward a message. Throwing leaves the message claimed by the subscription, and the redelivery
   * sweep retries the forward later.
   */
  void sendToDeadLetter(String subscription, Message message, int attemptCount);
}

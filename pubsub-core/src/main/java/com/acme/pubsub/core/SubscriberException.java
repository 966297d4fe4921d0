package com.acme.pubsub.core;

/**
 * Wraps a failure raised by a subscriber (or by decoding the message for it). Triggers the retry
 * or dead-letter decision for the delivery; never escapes the runner.
 */
public class SubscriberException extends RuntimeException {
  private final String subscription;
  private final long messageId;

  public SubscriberException(String subscription, long messageId, Throwable cause) {
    super(
        "Subscriber on " + subscription + " failed for message " + messageId + ": " + cause.getMessage(),
        cause);
    this.subscription = subscription;
    this.messageId = messageId;
  }

  public String getSubscription() {
    return subscription;
  }

  public long getMessageId() {
    return messageId;
  }
}

package com.acme.pubsub.core;

/** Failure of a collaborator that may succeed when the call is repeated later. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}

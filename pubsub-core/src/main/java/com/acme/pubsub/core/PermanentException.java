package com.acme.pubsub.core;

/** Failure that will not go away by retrying the same call. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}

package com.acme.pubsub.core;

/**
 * The storage or dead-letter collaborator could not complete an operation. A publish that fails
 * with this exception was not appended.
 */
public class StorageUnavailableException extends TransientException {
  public StorageUnavailableException(String message) {
    super(message);
  }

  public StorageUnavailableException(String message, Throwable e) {
    super(message, e);
  }
}

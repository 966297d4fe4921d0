package com.acme.pubsub.core;

/**
 * Raised by topic and subscription creation when the supplied configuration is rejected. Nothing
 * is registered when this is thrown.
 */
public class InvalidConfigException extends PermanentException {
  public InvalidConfigException(String message) {
    super(message);
  }
}

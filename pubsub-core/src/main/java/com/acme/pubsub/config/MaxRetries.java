package com.acme.pubsub.config;

import com.acme.pubsub.core.InvalidConfigException;
import java.util.Objects;

/**
 * Dead-letter threshold of a retry policy.
 *
 * <p>The declared configuration surface encodes this as an integer: {@code 0} selects the default
 * of {@value #DEFAULT_LIMIT} attempts, a positive {@code n} dead-letters after {@code n} failed
 * attempts, {@value #INFINITE_RETRIES} never dead-letters and {@value #NO_RETRIES} dead-letters on
 * the first failure. {@link #fromLegacy(int)} and {@link #toLegacy()} convert between the two.
 */
public record MaxRetries(Kind kind, int limit) {

  public static final int DEFAULT_LIMIT = 100;
  public static final int INFINITE_RETRIES = -1;
  public static final int NO_RETRIES = -2;

  public enum Kind {
    USE_DEFAULT,
    FINITE,
    INFINITE,
    IMMEDIATE
  }

  public MaxRetries {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.FINITE) {
      if (limit < 1) {
        throw new InvalidConfigException("Finite maxRetries must be positive, got " + limit);
      }
    } else {
      limit = 0;
    }
  }

  public static MaxRetries useDefault() {
    return new MaxRetries(Kind.USE_DEFAULT, 0);
  }

  public static MaxRetries finite(int n) {
    return new MaxRetries(Kind.FINITE, n);
  }

  public static MaxRetries infinite() {
    return new MaxRetries(Kind.INFINITE, 0);
  }

  public static MaxRetries immediate() {
    return new MaxRetries(Kind.IMMEDIATE, 0);
  }

  public static MaxRetries fromLegacy(int value) {
    if (value > 0) {
      return finite(value);
    }
    return switch (value) {
      case 0 -> useDefault();
      case INFINITE_RETRIES -> infinite();
      case NO_RETRIES -> immediate();
      default -> throw new InvalidConfigException("Unsupported maxRetries value: " + value);
    };
  }

  public int toLegacy() {
    return switch (kind) {
      case USE_DEFAULT -> 0;
      case FINITE -> limit;
      case INFINITE -> INFINITE_RETRIES;
      case IMMEDIATE -> NO_RETRIES;
    };
  }

  /** Number of failed attempts after which the message is dead-lettered, -1 for never. */
  public int effectiveLimit() {
    return switch (kind) {
      case USE_DEFAULT -> DEFAULT_LIMIT;
      case FINITE -> limit;
      case INFINITE -> -1;
      case IMMEDIATE -> 1;
    };
  }

  @Override
  public String toString() {
    return kind == Kind.FINITE ? "FINITE(" + limit + ")" : kind.name();
  }
}

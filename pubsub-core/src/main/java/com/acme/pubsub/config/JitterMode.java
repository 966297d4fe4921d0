package com.acme.pubsub.config;

/** Randomisation applied to computed retry delays. */
public enum JitterMode {
  /** Use the exponential delay as computed. */
  NONE,

  /** Replace the delay with a uniform random value in {@code [0, delay]}. */
  FULL
}

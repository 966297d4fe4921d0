package com.acme.pubsub.config;

/** Delivery contract of a topic. */
public enum DeliveryGuarantee {
  /** Every message is delivered to each subscription at least once. */
  AT_LEAST_ONCE(true),

  /** Reserved. Topics declaring it are rejected at creation. */
  EXACTLY_ONCE(false);

  private final boolean supported;

  DeliveryGuarantee(boolean supported) {
    this.supported = supported;
  }

  public boolean isSupported() {
    return supported;
  }
}

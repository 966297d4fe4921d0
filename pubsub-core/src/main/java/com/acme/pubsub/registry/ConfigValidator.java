package com.acme.pubsub.registry;

import com.acme.pubsub.config.RetryPolicy;
import com.acme.pubsub.config.SubscriptionConfig;
import com.acme.pubsub.config.TopicConfig;
import com.acme.pubsub.core.InvalidConfigException;
import java.time.Duration;

/** Creation-time validation. Returns resolved configuration with defaults applied. */
final class ConfigValidator {

  private ConfigValidator() {}

  static void validateName(String kind, String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidConfigException(kind + " name must not be blank");
    }
  }

  static TopicConfig validateTopic(String name, TopicConfig config) {
    validateName("Topic", name);
    if (config == null || config.deliveryGuarantee() == null) {
      throw new InvalidConfigException("Topic " + name + ": delivery guarantee is required");
    }
    if (!config.deliveryGuarantee().isSupported()) {
      throw new InvalidConfigException(
          "Topic " + name + ": delivery guarantee " + config.deliveryGuarantee() + " is not supported");
    }
    return config;
  }

  static SubscriptionConfig resolveSubscription(String name, SubscriptionConfig config) {
    validateName("Subscription", name);
    if (config == null) {
      throw new InvalidConfigException("Subscription " + name + ": configuration is required");
    }
    Duration ackDeadline = config.ackDeadline();
    if (ackDeadline == null || ackDeadline.isNegative() || ackDeadline.isZero()) {
      throw new InvalidConfigException(
          "Subscription " + name + ": ackDeadline must be positive, got " + ackDeadline);
    }
    Duration retention = config.messageRetention() == null ? Duration.ZERO : config.messageRetention();
    if (retention.isNegative()) {
      throw new InvalidConfigException(
          "Subscription " + name + ": messageRetention must not be negative, got " + retention);
    }
    RetryPolicy policy =
        config.retryPolicy() == null ? RetryPolicy.defaults() : config.retryPolicy().withDefaults();
    if (policy.minRetryDelay().isNegative()) {
      throw new InvalidConfigException(
          "Subscription " + name + ": minRetryDelay must not be negative");
    }
    if (policy.minRetryDelay().compareTo(policy.maxRetryDelay()) > 0) {
      throw new InvalidConfigException(
          "Subscription "
              + name
              + ": minRetryDelay "
              + policy.minRetryDelay()
              + " exceeds maxRetryDelay "
              + policy.maxRetryDelay());
    }
    return new SubscriptionConfig(ackDeadline, retention, policy);
  }
}

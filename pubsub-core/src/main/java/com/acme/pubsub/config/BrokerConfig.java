package com.acme.pubsub.config;

import java.time.Duration;

/**
 * Runtime settings for the redelivery sweep and subscriber dispatch. Pure POJO - no framework
 * dependencies.
 */
public class BrokerConfig {

  private Duration sweepInterval = Duration.ofSeconds(1);
  private Duration pollInterval = Duration.ofMillis(200);
  private int dispatchConcurrency = 4;
  private int dispatchBatchSize = 32;
  private JitterMode jitter = JitterMode.NONE;

  public Duration getSweepInterval() {
    return sweepInterval;
  }

  public void setSweepInterval(Duration sweepInterval) {
    this.sweepInterval = sweepInterval;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public int getDispatchConcurrency() {
    return dispatchConcurrency;
  }

  public void setDispatchConcurrency(int dispatchConcurrency) {
    this.dispatchConcurrency = dispatchConcurrency;
  }

  public int getDispatchBatchSize() {
    return dispatchBatchSize;
  }

  public void setDispatchBatchSize(int dispatchBatchSize) {
    this.dispatchBatchSize = dispatchBatchSize;
  }

  public JitterMode getJitter() {
    return jitter;
  }

  public void setJitter(JitterMode jitter) {
    this.jitter = jitter;
  }
}

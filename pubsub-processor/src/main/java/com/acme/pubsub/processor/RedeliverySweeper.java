package com.acme.pubsub.processor;

import com.acme.pubsub.config.BrokerConfig;
import com.acme.pubsub.redelivery.RedeliveryScheduler;
import com.acme.pubsub.redelivery.SweepResult;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Drives the redelivery sweep on a fixed delay. */
@Singleton
public class RedeliverySweeper {
  private static final Logger LOG = LoggerFactory.getLogger(RedeliverySweeper.class);

  private final RedeliveryScheduler scheduler;
  private final Duration sweepInterval;
  private volatile Duration warnedFor;

  public RedeliverySweeper(RedeliveryScheduler scheduler, BrokerConfig config) {
    this.scheduler = scheduler;
    this.sweepInterval = config.getSweepInterval();
  }

  @Scheduled(fixedDelay = "${pubsub.sweep-interval:1s}")
  public void tick() {
    try {
      checkInterval();
      SweepResult result = scheduler.sweep();
      if (result.deadLettered() > 0 || result.purged() > 0) {
        LOG.info(
            "Sweep dead-lettered {} and purged {} message(s)", result.deadLettered(), result.purged());
      } else if (!result.isEmpty()) {
        LOG.debug("Sweep: {}", result);
      }
    } catch (Exception e) {
      LOG.error("Error in RedeliverySweeper tick: {}", e.getMessage(), e);
    }
  }

  /** Warns once per ack deadline that expiries will be noticed late. */
  boolean checkInterval() {
    Optional<Duration> limit = scheduler.maxSweepInterval();
    if (limit.isEmpty() || sweepInterval.compareTo(limit.get()) <= 0) {
      return false;
    }
    if (!limit.get().equals(warnedFor)) {
      warnedFor = limit.get();
      LOG.warn(
          "Sweep interval {} exceeds the shortest ack deadline {}; expired leases will be redelivered late",
          sweepInterval,
          limit.get());
    }
    return true;
  }
}

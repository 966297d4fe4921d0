package com.acme.pubsub.processor.config;

import com.acme.pubsub.broker.Broker;
import com.acme.pubsub.broker.SettledMessageReaper;
import com.acme.pubsub.config.BrokerConfig;
import com.acme.pubsub.config.JitterMode;
import com.acme.pubsub.redelivery.RedeliveryScheduler;
import com.acme.pubsub.registry.TopicRegistry;
import com.acme.pubsub.retry.BackoffCalculator;
import com.acme.pubsub.spi.DeadLetterSink;
import com.acme.pubsub.spi.MessageStore;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;

/**
 * Factory for the engine beans.
 *
 * <p>The core module stays free of framework dependencies; this factory binds its POJOs to
 * Micronaut configuration and wires them together. Storage comes from whichever {@link
 * MessageStore} and {@link DeadLetterSink} beans the selected {@code db.dialect} provides.
 */
@Factory
public class CoreBeansFactory {

  /** Creates BrokerConfig populated from application.yml pubsub.* properties */
  @Singleton
  public BrokerConfig brokerConfig(
      @Value("${pubsub.sweep-interval:1s}") Duration sweepInterval,
      @Value("${pubsub.poll-interval:200ms}") Duration pollInterval,
      @Value("${pubsub.dispatch-concurrency:4}") int dispatchConcurrency,
      @Value("${pubsub.dispatch-batch-size:32}") int dispatchBatchSize,
      @Value("${pubsub.jitter:NONE}") JitterMode jitter) {
    BrokerConfig config = new BrokerConfig();
    config.setSweepInterval(sweepInterval);
    config.setPollInterval(pollInterval);
    config.setDispatchConcurrency(dispatchConcurrency);
    config.setDispatchBatchSize(dispatchBatchSize);
    config.setJitter(jitter);
    return config;
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Singleton
  public BackoffCalculator backoffCalculator(BrokerConfig config) {
    return new BackoffCalculator(config.getJitter(), new Random());
  }

  @Singleton
  public TopicRegistry topicRegistry(BackoffCalculator backoff, MessageStore store) {
    return new TopicRegistry(backoff, new SettledMessageReaper(store));
  }

  @Singleton
  public RedeliveryScheduler redeliveryScheduler(
      TopicRegistry registry, MessageStore store, DeadLetterSink deadLetters, Clock clock) {
    return new RedeliveryScheduler(registry, store, deadLetters, clock);
  }

  @Singleton
  public Broker broker(
      TopicRegistry registry, MessageStore store, RedeliveryScheduler scheduler, Clock clock) {
    return new Broker(registry, store, scheduler, clock);
  }
}

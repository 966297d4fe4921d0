package com.acme.pubsub.processor;

import com.acme.pubsub.broker.Broker;
import com.acme.pubsub.codec.MessageCodec;
import com.acme.pubsub.config.BrokerConfig;
import com.acme.pubsub.consumer.SubscriberRunner;
import com.acme.pubsub.registry.Subscription;
import com.acme.pubsub.spi.Subscriber;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls registered subscribers and drains their subscriptions on a worker pool. At most one drain
 * per subscriber runs at a time; concurrency across subscribers is bounded by the pool size.
 */
@Singleton
public class SubscriberDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(SubscriberDispatcher.class);

  private final Broker broker;
  private final Clock clock;
  private final int batchSize;
  private final ExecutorService workers;
  private final List<Registration> registrations = new CopyOnWriteArrayList<>();

  private static final class Registration {
    private final SubscriberRunner<?> runner;
    private final AtomicBoolean busy = new AtomicBoolean();

    private Registration(SubscriberRunner<?> runner) {
      this.runner = runner;
    }
  }

  public SubscriberDispatcher(Broker broker, BrokerConfig config, Clock clock) {
    this.broker = broker;
    this.clock = clock;
    this.batchSize = config.getDispatchBatchSize();
    AtomicInteger threads = new AtomicInteger();
    this.workers =
        Executors.newFixedThreadPool(
            config.getDispatchConcurrency(),
            r -> {
              Thread t = new Thread(r, "pubsub-dispatch-" + threads.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public <T> SubscriberRunner<T> register(
      Subscription subscription, MessageCodec<T> codec, Subscriber<T> subscriber) {
    SubscriberRunner<T> runner = new SubscriberRunner<>(broker, subscription, codec, subscriber, clock);
    registrations.add(new Registration(runner));
    LOG.info("Registered subscriber for {}", subscription.getName());
    return runner;
  }

  @Scheduled(fixedDelay = "${pubsub.poll-interval:200ms}")
  public void poll() {
    for (Registration registration : registrations) {
      if (!registration.busy.compareAndSet(false, true)) {
        continue;
      }
      try {
        workers.execute(() -> drain(registration));
      } catch (RejectedExecutionException e) {
        registration.busy.set(false);
        LOG.debug("Dispatcher is shut down, skipping {}", name(registration));
      }
    }
  }

  public int registeredCount() {
    return registrations.size();
  }

  @PreDestroy
  public void shutdown() throws InterruptedException {
    workers.shutdown();
    if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
      LOG.warn("Subscriber workers did not stop in time, interrupting");
      workers.shutdownNow();
    }
  }

  private void drain(Registration registration) {
    try {
      int handled = registration.runner.drain(batchSize);
      if (handled > 0) {
        LOG.debug("Dispatched {} message(s) on {}", handled, name(registration));
      }
    } catch (RuntimeException e) {
      LOG.warn("Dispatch on {} failed: {}", name(registration), e.getMessage());
    } finally {
      registration.busy.set(false);
    }
  }

  private static String name(Registration registration) {
    return registration.runner.getSubscription().getName();
  }
}

package com.acme.pubsub.redelivery;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.pubsub.BrokerTestBase;
import com.acme.pubsub.config.RetryPolicy;
import com.acme.pubsub.config.SubscriptionConfig;
import com.acme.pubsub.core.StorageUnavailableException;
import com.acme.pubsub.domain.DeadLetter;
import com.acme.pubsub.domain.Delivery;
import com.acme.pubsub.domain.Message;
import com.acme.pubsub.registry.Subscription;
import com.acme.pubsub.registry.Topic;
import com.acme.pubsub.spi.DeadLetterSink;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RedeliveryScheduler Tests")
class RedeliverySchedulerTest extends BrokerTestBase {

  @Nested
  @DisplayName("expired deliveries")
  class ExpiryTests {

    @Test
    @DisplayName("should redeliver with growing backoff and dead-letter after three attempts")
    void testRetryThenDeadLetter() {
      // Given
      Topic orders = topic("orders");
      Subscription billing = subscription(orders, "billing", 3);
      Instant t0 = clock.instant();
      long id = broker.publish(orders, "a".getBytes(), Map.of("k", "v"));

      // When: attempt 1 expires at t0+30s, backoff 10s
      assertThat(broker.deliver(billing).orElseThrow().attempt()).isEqualTo(1);
      clock.set(t0.plusSeconds(30));
      SweepResult first = scheduler.sweep();
      assertThat(first.expired()).isEqualTo(1);
      assertThat(first.redeliveriesScheduled()).isEqualTo(1);
      clock.set(t0.plusSeconds(39));
      assertThat(broker.deliver(billing)).isEmpty();

      // attempt 2 at t0+40s expires at t0+70s, backoff 20s
      clock.set(t0.plusSeconds(40));
      assertThat(broker.deliver(billing).orElseThrow().attempt()).isEqualTo(2);
      clock.set(t0.plusSeconds(70));
      scheduler.sweep();
      clock.set(t0.plusSeconds(89));
      assertThat(broker.deliver(billing)).isEmpty();

      // attempt 3 at t0+90s expires at t0+120s and exhausts the budget
      clock.set(t0.plusSeconds(90));
      assertThat(broker.deliver(billing).orElseThrow().attempt()).isEqualTo(3);
      clock.set(t0.plusSeconds(120));
      SweepResult last = scheduler.sweep();

      // Then
      assertThat(last.deadLettered()).isEqualTo(1);
      assertThat(memoryDeadLetters.findBySubscription("billing"))
          .singleElement()
          .satisfies(
              dl -> {
                assertThat(dl.getMessageId()).isEqualTo(id);
                assertThat(dl.getAttempts()).isEqualTo(3);
                assertThat(dl.getTopic()).isEqualTo("orders");
                assertThat(dl.getAttributes()).containsEntry("k", "v");
                assertThat(body(dl.getPayload())).isEqualTo("a");
              });
      clock.advance(Duration.ofHours(1));
      assertThat(broker.deliver(billing)).isEmpty();
      assertThat(broker.stats(billing).deadLettered()).isEqualTo(1);
      assertThat(memoryStore.readMessage("orders", id)).isEmpty();
    }

    @Test
    @DisplayName("should not touch deliveries whose deadline has not passed")
    void testNotYetExpired() {
      Topic orders = topic("orders");
      Subscription billing = subscription(orders, "billing", 3);
      publish(orders, "a");
      broker.deliver(billing).orElseThrow();

      clock.advance(ACK_DEADLINE.minusMillis(1));

      assertThat(scheduler.sweep().expired()).isZero();
      assertThat(broker.stats(billing).inFlight()).isEqualTo(1);
    }

    @Test
    @DisplayName("infinite retries should never dead-letter")
    void testInfiniteRetries() {
      Topic orders = topic("orders");
      Subscription billing = subscription(orders, "billing", -1);
      publish(orders, "a");

      for (int attempt = 1; attempt <= 120; attempt++) {
        Delivery delivery = broker.deliver(billing).orElseThrow();
        assertThat(delivery.attempt()).isEqualTo(attempt);
        broker.nack(delivery.lease());
        clock.advance(Duration.ofMinutes(10));
      }

      assertThat(memoryDeadLetters.size()).isZero();
      assertThat(broker.stats(billing).pendingRedelivery()).isEqualTo(1);
    }

    @Test
    @DisplayName("the default budget should dead-letter on the hundredth attempt")
    void testDefaultBudget() {
      Topic orders = topic("orders");
      Subscription billing = subscription(orders, "billing", 0);
      publish(orders, "a");

      for (int attempt = 1; attempt <= 100; attempt++) {
        broker.nack(broker.deliver(billing).orElseThrow().lease());
        clock.advance(Duration.ofMinutes(10));
      }

      assertThat(broker.deliver(billing)).isEmpty();
      assertThat(memoryDeadLetters.all()).extracting(DeadLetter::getAttempts).containsExactly(100);
    }

    @Test
    @DisplayName("no retries should dead-letter on the first nack")
    void testNoRetries() {
      Topic orders = topic("orders");
      Subscription billing = subscription(orders, "billing", -2);
      publish(orders, "a");

      broker.nack(broker.deliver(billing).orElseThrow().lease());

      assertThat(memoryDeadLetters.findBySubscription("billing"))
          .extracting(DeadLetter::getAttempts)
          .containsExactly(1);
      assertThat(broker.stats(billing).deadLettered()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("dead-letter forwarding")
  class DeadLetterTests {

    @Test
    @DisplayName("a failed forward should be retried on the next sweep")
    void testSinkFailureRetried() {
      // Given
      DeadLetterSink flaky = mock(DeadLetterSink.class);
      doThrow(new StorageUnavailableException("dlq down"))
          .doNothing()
          .when(flaky)
          .sendToDeadLetter(anyString(), any(Message.class), anyInt());
      RedeliveryScheduler flakyScheduler =
          new RedeliveryScheduler(registry, memoryStore, flaky, clock);
      Topic orders = topic("orders");
      Subscription billing = subscription(orders, "billing", -2);
      long id = publish(orders, "a");
      broker.deliver(billing).orElseThrow();
      clock.advance(ACK_DEADLINE);

      // When
      SweepResult failed = flakyScheduler.sweep();

      // Then
      assertThat(failed.deadLettered()).isZero();
      assertThat(broker.stats(billing).awaitingDeadLetter()).isEqualTo(1);
      assertThat(broker.deliver(billing)).isEmpty();
      assertThat(memoryStore.readMessage("orders", id)).isPresent();

      SweepResult retried = flakyScheduler.sweep();

      assertThat(retried.deadLettered()).isEqualTo(1);
      verify(flaky, times(2)).sendToDeadLetter(eq("billing"), any(Message.class), eq(1));
      assertThat(broker.stats(billing).awaitingDeadLetter()).isZero();
    }

    @Test
    @DisplayName("a body gone before forwarding should settle as retention expired")
    void testPurgedBeforeForward() {
      Topic orders = topic("orders");
      Subscription billing = subscription(orders, "billing", -2);
      long id = publish(orders, "a");
      broker.deliver(billing).orElseThrow();
      memoryStore.deleteMessage("orders", id);
      clock.advance(ACK_DEADLINE);

      SweepResult result = scheduler.sweep();

      assertThat(result.deadLettered()).isZero();
      assertThat(memoryDeadLetters.size()).isZero();
      assertThat(broker.stats(billing).retentionExpired()).isEqualTo(1);
      assertThat(orders.outstandingMessages()).isZero();
    }
  }

  @Nested
  @DisplayName("retention")
  class RetentionTests {

    private Subscription retained(Topic topic, String name, Duration retention) {
      return broker.createSubscription(
          topic, name, SubscriptionConfig.of(ACK_DEADLINE).withRetention(retention));
    }

    @Test
    @DisplayName("should drop pending messages older than the retention")
    void testRetentionExpiry() {
      Topic orders = topic("orders");
      Subscription billing = retained(orders, "billing", Duration.ofHours(1));
      long old = publish(orders, "old");
      clock.advance(Duration.ofMinutes(30));
      long fresh = publish(orders, "fresh");
      clock.advance(Duration.ofMinutes(30));

      SweepResult result = scheduler.sweep();

      assertThat(result.retentionExpired()).isEqualTo(1);
      assertThat(memoryStore.readMessage("orders", old)).isEmpty();
      assertThat(broker.deliver(billing)).map(d -> d.message().id()).contains(fresh);
    }

    @Test
    @DisplayName("zero retention keeps messages until they are acknowledged")
    void testZeroRetention() {
      Topic orders = topic("orders");
      Subscription billing = retained(orders, "billing", Duration.ZERO);
      publish(orders, "a");
      clock.advance(Duration.ofDays(30));

      SweepResult result = scheduler.sweep();

      assertThat(result.retentionExpired()).isZero();
      assertThat(result.purged()).isZero();
      assertThat(broker.deliver(billing)).isPresent();
    }

    @Test
    @DisplayName("should purge bodies past the longest retention of the topic")
    void testPurge() {
      // Given: audit holds the message in flight past its retention
      Topic orders = topic("orders");
      Subscription billing = retained(orders, "billing", Duration.ofMinutes(1));
      Subscription audit =
          broker.createSubscription(
              orders,
              "audit",
              SubscriptionConfig.of(Duration.ofMinutes(10)).withRetention(Duration.ofMinutes(5)));
      long id = publish(orders, "a");
      broker.deliver(billing).orElseThrow();
      broker.deliver(audit).orElseThrow();
      clock.advance(Duration.ofMinutes(1));
      assertThat(scheduler.sweep().purged()).isZero();

      // When
      clock.advance(Duration.ofMinutes(4));
      SweepResult result = scheduler.sweep();

      // Then
      assertThat(result.purged()).isEqualTo(1);
      assertThat(memoryStore.readMessage("orders", id)).isEmpty();
      assertThat(broker.stats(billing).retentionExpired()).isEqualTo(1);

      clock.advance(Duration.ofMinutes(6));
      scheduler.sweep();
      clock.advance(RetryPolicy.DEFAULT_MIN_RETRY_DELAY);
      assertThat(broker.deliver(audit)).isEmpty();
      assertThat(broker.stats(audit).retentionExpired()).isEqualTo(1);
    }

    @Test
    @DisplayName("should never purge while any subscription retains until acknowledged")
    void testNoPurgeWithUnboundedSubscription() {
      Topic orders = topic("orders");
      retained(orders, "billing", Duration.ofMinutes(1));
      Subscription audit = retained(orders, "audit", Duration.ZERO);
      long id = publish(orders, "a");
      clock.advance(Duration.ofDays(1));

      SweepResult result = scheduler.sweep();

      assertThat(result.purged()).isZero();
      assertThat(memoryStore.readMessage("orders", id)).isPresent();
      assertThat(broker.deliver(audit)).isPresent();
    }
  }

  @Test
  @DisplayName("a failing subscription should not stop the sweep of the others")
  void testSweepIsolatesFailures() {
    Topic orders = topic("orders");
    Subscription billing = subscription(orders, "billing", 3);
    publish(orders, "a");
    broker.deliver(billing).orElseThrow();
    clock.advance(ACK_DEADLINE);
    var broken = spy(scheduler);
    doThrow(new IllegalStateException("boom"))
        .when(broken)
        .sweep(any(Subscription.class), any(Instant.class));

    assertThatCode(broken::sweep).doesNotThrowAnyException();
  }

  @Nested
  @DisplayName("maxSweepInterval")
  class MaxSweepIntervalTests {

    @Test
    @DisplayName("should be empty without subscriptions")
    void testEmpty() {
      assertThat(scheduler.maxSweepInterval()).isEmpty();
    }

    @Test
    @DisplayName("should be the smallest ack deadline")
    void testSmallestDeadline() {
      Topic orders = topic("orders");
      subscription(orders, "billing", 3);
      broker.createSubscription(
          orders,
          "audit",
          SubscriptionConfig.of(Duration.ofSeconds(5)).withRetryPolicy(RetryPolicy.defaults()));

      assertThat(scheduler.maxSweepInterval()).contains(Duration.ofSeconds(5));
    }
  }
}

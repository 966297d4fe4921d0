package com.acme.pubsub.processor.config;

import com.acme.pubsub.memory.InMemoryDeadLetterSink;
import com.acme.pubsub.memory.InMemoryMessageStore;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;

/** Non-durable storage used when no {@code db.dialect} is configured. */
@Factory
@Requires(missingProperty = "db.dialect")
public class InMemoryStorageFactory {

  @Singleton
  public InMemoryMessageStore messageStore(Clock clock) {
    return new InMemoryMessageStore(clock);
  }

  @Singleton
  public InMemoryDeadLetterSink deadLetterSink(Clock clock) {
    return new InMemoryDeadLetterSink(clock);
  }
}

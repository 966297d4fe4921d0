package com.acme.pubsub.processor.config;

import com.acme.pubsub.config.BrokerConfig;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.env.Environment;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = Environment.TEST)
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final BrokerConfig config;
  private final String dialect;
  private final String datasourceUrl;

  public ConfigurationLogger(
      BrokerConfig config,
      @Value("${db.dialect:IN_MEMORY}") String dialect,
      @Value("${datasources.default.url:n/a}") String datasourceUrl) {
    this.config = config;
    this.dialect = dialect;
    this.datasourceUrl = datasourceUrl;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    LOG.info("━━━ Broker Configuration ━━━");
    LOG.info("  Sweep Interval:     {} (How often expired leases and retention are checked)", config.getSweepInterval());
    LOG.info("  Poll Interval:      {} (How often registered subscribers are polled)", config.getPollInterval());
    LOG.info("  Dispatch Threads:   {}", config.getDispatchConcurrency());
    LOG.info("  Dispatch Batch:     {} (Messages drained per subscriber per poll)", config.getDispatchBatchSize());
    LOG.info("  Backoff Jitter:     {}", config.getJitter());
    LOG.info("━━━ Storage ━━━");
    LOG.info("  Dialect:            {}", dialect);
    LOG.info("  JDBC URL:           {}", datasourceUrl);
  }
}

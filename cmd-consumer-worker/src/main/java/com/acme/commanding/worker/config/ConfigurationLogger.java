package com.acme.commanding.worker.config;

import com.acme.commanding.command.CommandTypeRegistry;
import com.acme.commanding.config.ConsumerConfig;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final ConsumerConfig config;
  private final CommandTypeRegistry types;

  public ConfigurationLogger(ConsumerConfig config, CommandTypeRegistry types) {
    this.config = config;
    this.types = types;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                         EFFECTIVE CONFIGURATION                                ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");

    LOG.info("━━━ Consumer ━━━");
    LOG.info("  Consumer Id:        {}", config.getConsumerId());
    LOG.info("  Group:              {} (Kafka consumer group)", config.getGroupName());
    LOG.info("  Topics:             {}", config.getTopics());
    LOG.info("  Result Topic:       {} (used when the envelope names none)", config.getDefaultResultTopic());
    LOG.info("  Poll Timeout:       {}", config.getPollTimeout());
    LOG.info(
        "  Kafka Servers:      {}",
        System.getenv().getOrDefault("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"));

    LOG.info("━━━ Execution ━━━");
    LOG.info("  Executor Threads:   {}", config.getExecutorThreads());
    LOG.info("  Max Retries:        {} (transient failures only)", config.getMaxRetries());
    LOG.info(
        "  In-Flight Timeout:  {}",
        config.isInFlightEvictionEnabled() ? config.getInFlightTimeout() : "DISABLED");
    LOG.info("  Sweep Interval:     {}", config.getInFlightSweepInterval());
    LOG.info("  Command Types:      {}", types.typeCodes());

    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
  }
}

package com.acme.commanding.worker.lifecycle;

import com.acme.commanding.config.ConsumerConfig;
import com.acme.commanding.consumer.CommandConsumer;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
@Requires(property = "commanding.consumer.enabled", notEquals = "false")
public class InFlightSweeper {
  private static final Logger LOG = LoggerFactory.getLogger(InFlightSweeper.class);

  private final CommandConsumer consumer;
  private final ConsumerConfig config;

  public InFlightSweeper(CommandConsumer consumer, ConsumerConfig config) {
    this.consumer = consumer;
    this.config = config;
  }

  @Scheduled(fixedDelay = "${commanding.in-flight-sweep-interval:5s}")
  public void tick() {
    if (!config.isInFlightEvictionEnabled()) {
      return;
    }
    try {
      int evicted = consumer.evictStale(config.getInFlightTimeout());
      if (evicted > 0) {
        LOG.warn(
            "Timed out {} in-flight command(s), {} still in flight",
            evicted,
            consumer.inFlightCount());
      }
    } catch (Exception e) {
      LOG.error("Error in InFlightSweeper tick: {}", e.getMessage(), e);
    }
  }
}

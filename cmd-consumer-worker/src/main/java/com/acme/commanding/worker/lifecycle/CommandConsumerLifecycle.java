package com.acme.commanding.worker.lifecycle;

import com.acme.commanding.config.ConsumerConfig;
import com.acme.commanding.consumer.CommandConsumer;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Subscribes and starts the command consumer on startup, shuts it down with the context. */
@Singleton
@Requires(property = "commanding.consumer.enabled", notEquals = "false")
public class CommandConsumerLifecycle implements ApplicationEventListener<StartupEvent> {
  private static final Logger LOG = LoggerFactory.getLogger(CommandConsumerLifecycle.class);

  private final CommandConsumer consumer;
  private final ConsumerConfig config;

  public CommandConsumerLifecycle(CommandConsumer consumer, ConsumerConfig config) {
    this.consumer = consumer;
    this.config = config;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    config.getTopics().forEach(consumer::subscribe);
    consumer.start();
    LOG.info("Command consumer listening on {}", config.getTopics());
  }

  @PreDestroy
  public void stop() {
    consumer.shutdown();
  }
}

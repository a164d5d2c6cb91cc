package com.acme.commanding.worker.config;

import com.acme.commanding.codec.JsonCommandMessageDecoder;
import com.acme.commanding.command.CommandExecutor;
import com.acme.commanding.command.CommandHandlerRegistry;
import com.acme.commanding.command.CommandTypeRegistry;
import com.acme.commanding.config.ConsumerConfig;
import com.acme.commanding.consumer.CommandConsumer;
import com.acme.commanding.domain.AggregateRepository;
import com.acme.commanding.domain.InMemoryAggregateRepository;
import com.acme.commanding.executor.DefaultCommandExecutor;
import com.acme.commanding.spi.CommandMessageDecoder;
import com.acme.commanding.spi.CommandResultPublisher;
import com.acme.commanding.spi.QueueConsumer;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.util.List;

/**
 * Factory for the framework-free consumer beans.
 *
 * <p>The core module has no dependency on Micronaut; this factory wires its POJOs together and
 * applies every {@link CommandModule} to the type and handler registries.
 */
@Factory
public class ConsumerBeansFactory {

  /** Creates ConsumerConfig bean populated from application.yml commanding.* properties */
  @Singleton
  @ConfigurationProperties("commanding")
  public ConsumerConfig consumerConfig() {
    return new ConsumerConfig();
  }

  @Singleton
  public CommandTypeRegistry commandTypeRegistry(
      List<CommandModule> modules, CommandHandlerRegistry handlers) {
    CommandTypeRegistry types = new CommandTypeRegistry();
    modules.forEach(module -> module.register(types, handlers));
    return types;
  }

  @Singleton
  public CommandHandlerRegistry commandHandlerRegistry() {
    return new CommandHandlerRegistry();
  }

  @Singleton
  public AggregateRepository aggregateRepository() {
    return new InMemoryAggregateRepository();
  }

  @Singleton
  public CommandMessageDecoder commandMessageDecoder(CommandTypeRegistry types) {
    return new JsonCommandMessageDecoder(types);
  }

  /** Creates the executor; the handler registry is complete once the type registry exists */
  @Singleton
  @Bean(preDestroy = "close")
  public DefaultCommandExecutor commandExecutor(
      CommandTypeRegistry types,
      CommandHandlerRegistry handlers,
      AggregateRepository repository,
      ConsumerConfig config) {
    return DefaultCommandExecutor.withThreads(
        handlers, repository, config.getExecutorThreads(), config.getMaxRetries());
  }

  @Singleton
  public CommandConsumer commandConsumer(
      QueueConsumer queueConsumer,
      CommandMessageDecoder decoder,
      CommandExecutor executor,
      AggregateRepository repository,
      CommandResultPublisher resultPublisher,
      ConsumerConfig config) {
    return new CommandConsumer(
        queueConsumer, decoder, executor, repository, resultPublisher, config);
  }
}

package com.acme.commanding.consumer;

import com.acme.commanding.command.Command;
import com.acme.commanding.command.CommandExecutedMessage;
import com.acme.commanding.command.CommandExecutor;
import com.acme.commanding.command.CommandResult;
import com.acme.commanding.config.ConsumerConfig;
import com.acme.commanding.domain.AggregateRepository;
import com.acme.commanding.spi.CommandMessageDecoder;
import com.acme.commanding.spi.CommandResultPublisher;
import com.acme.commanding.spi.DecodedCommand;
import com.acme.commanding.spi.MessageHandler;
import com.acme.commanding.spi.MessageReceipt;
import com.acme.commanding.spi.QueueConsumer;
import com.acme.commanding.spi.QueueMessage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Consumes command messages from the queue and runs them through the {@link CommandExecutor}.
 *
 * <p>A command id is accepted only while no other execution for it is outstanding; a duplicate
 * delivery is logged and dropped without being acknowledged. Every accepted command gets a fresh
 * {@link TrackingCommandContext}. When the executor completes the context, this consumer removes
 * the command from the in-flight index, acknowledges its delivery and publishes a {@link
 * CommandExecutedMessage}, for failures exactly as for successes.
 */
public class CommandConsumer implements MessageHandler {
  private static final Logger log = LoggerFactory.getLogger(CommandConsumer.class);

  public static final String DOMAIN_EVENT_HANDLED_MESSAGE_TOPIC = "DomainEventHandledMessageTopic";
  private static final String MDC_COMMAND_ID = "commandId";

  private final QueueConsumer queueConsumer;
  private final CommandMessageDecoder decoder;
  private final CommandExecutor executor;
  private final AggregateRepository repository;
  private final CommandResultPublisher resultPublisher;
  private final InFlightTracker inFlight;
  private final ConsumerConfig config;
  private final Clock clock;

  public CommandConsumer(
      QueueConsumer queueConsumer,
      CommandMessageDecoder decoder,
      CommandExecutor executor,
      AggregateRepository repository,
      CommandResultPublisher resultPublisher,
      ConsumerConfig config) {
    this(
        queueConsumer,
        decoder,
        executor,
        repository,
        resultPublisher,
        new InFlightTracker(),
        config,
        Clock.systemUTC());
  }

  public CommandConsumer(
      QueueConsumer queueConsumer,
      CommandMessageDecoder decoder,
      CommandExecutor executor,
      AggregateRepository repository,
      CommandResultPublisher resultPublisher,
      InFlightTracker inFlight,
      ConsumerConfig config,
      Clock clock) {
    this.queueConsumer = queueConsumer;
    this.decoder = decoder;
    this.executor = executor;
    this.repository = repository;
    this.resultPublisher = resultPublisher;
    this.inFlight = inFlight;
    this.config = config;
    this.clock = clock;
  }

  public CommandConsumer start() {
    queueConsumer.start(this);
    log.info("Command consumer {} started", config.getConsumerId());
    return this;
  }

  public CommandConsumer subscribe(String topic) {
    queueConsumer.subscribe(topic);
    log.info("Command consumer {} subscribed to {}", config.getConsumerId(), topic);
    return this;
  }

  public CommandConsumer shutdown() {
    queueConsumer.shutdown();
    log.info(
        "Command consumer {} shut down with {} command(s) still in flight",
        config.getConsumerId(),
        inFlight.size());
    return this;
  }

  /**
   * Entry point for each delivered message. Decode failures propagate to the queue client.
   *
   * @throws com.acme.commanding.core.CommandDecodeException if the body is not a valid command
   */
  @Override
  public void handle(QueueMessage message, MessageReceipt receipt) {
    DecodedCommand decoded = decoder.decode(message.body());
    Command command = decoded.command();

    try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_COMMAND_ID, command.id())) {
      CompletableFuture<CommandResult> completion = new CompletableFuture<>();
      PendingCommand pending = new PendingCommand(command.id(), receipt, clock.instant(), completion);
      if (!inFlight.tryBegin(command.id(), pending)) {
        log.error(
            "Duplicated command message. commandType={}, commandId={}",
            command.getClass().getSimpleName(),
            command.id());
        return;
      }

      Map<String, String> items = new HashMap<>();
      if (decoded.eventHandledTopic() != null) {
        items.put(DOMAIN_EVENT_HANDLED_MESSAGE_TOPIC, decoded.eventHandledTopic());
      }
      TrackingCommandContext context =
          new TrackingCommandContext(
              command,
              message,
              resolveResultTopic(decoded.resultTopic()),
              items,
              repository,
              completion,
              pending.startedAt());
      completion.thenAccept(result -> onCommandExecuted(command, result, context));

      log.debug(
          "Executing command: type={}, id={}", command.getClass().getSimpleName(), command.id());
      try {
        executor.execute(command, context);
      } catch (RuntimeException e) {
        log.error("Command executor rejected command {}", command.id(), e);
        context.onCommandExecuted(CommandResult.failed(null, e));
      }
    }
  }

  /**
   * Complete every in-flight command that started more than {@code timeout} ago with a TIMED_OUT
   * result. The delivery is acknowledged and the result published like any other completion; a
   * late completion from the executor is then ignored.
   *
   * @return number of commands evicted
   */
  public int evictStale(Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return 0;
    }
    Instant cutoff = clock.instant().minus(timeout);
    int evicted = 0;
    for (PendingCommand pending : inFlight.startedBefore(cutoff)) {
      CommandResult timedOut =
          CommandResult.timedOut("Command did not complete within " + timeout);
      if (pending.completion().complete(timedOut)) {
        log.warn(
            "Evicted stale in-flight command {} started at {}",
            pending.commandId(),
            pending.startedAt());
        evicted++;
      }
    }
    return evicted;
  }

  public int inFlightCount() {
    return inFlight.size();
  }

  private void onCommandExecuted(Command command, CommandResult result, TrackingCommandContext ctx) {
    long elapsedMillis = Duration.between(ctx.getStartedAt(), clock.instant()).toMillis();
    if (result.isFailure()) {
      log.warn(
          "Command {} finished with {} after {}ms: {}",
          command.id(),
          result.status(),
          elapsedMillis,
          result.errorMessage());
    } else {
      log.debug(
          "Command {} finished with {} after {}ms", command.id(), result.status(), elapsedMillis);
    }

    inFlight
        .endIfPresent(command.id())
        .ifPresent(pending -> acknowledge(command, pending.receipt()));

    CommandExecutedMessage executed = CommandExecutedMessage.of(command, result);
    try {
      resultPublisher.send(executed, ctx.getResultTopic());
      log.debug(
          "Published result for command {}: status={}, topic={}",
          command.id(),
          result.status(),
          ctx.getResultTopic());
    } catch (RuntimeException e) {
      log.error(
          "Failed to publish result for command {} to topic {}",
          command.id(),
          ctx.getResultTopic(),
          e);
    }
  }

  private void acknowledge(Command command, MessageReceipt receipt) {
    try {
      receipt.acknowledge();
    } catch (RuntimeException e) {
      log.error("Failed to acknowledge message for command {}", command.id(), e);
    }
  }

  private String resolveResultTopic(String resultTopic) {
    return resultTopic == null || resultTopic.isBlank()
        ? config.getDefaultResultTopic()
        : resultTopic;
  }
}

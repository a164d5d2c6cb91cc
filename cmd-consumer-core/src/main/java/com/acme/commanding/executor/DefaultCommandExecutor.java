package com.acme.commanding.executor;

import com.acme.commanding.command.Command;
import com.acme.commanding.command.CommandExecuteContext;
import com.acme.commanding.command.CommandExecutor;
import com.acme.commanding.command.CommandHandler;
import com.acme.commanding.command.CommandHandlerRegistry;
import com.acme.commanding.command.CommandResult;
import com.acme.commanding.core.TransientException;
import com.acme.commanding.domain.AggregateRepository;
import com.acme.commanding.domain.AggregateRoot;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs registered {@link CommandHandler}s on a worker pool and saves the aggregates they touched.
 * {@link TransientException}s are retried on a cleared context up to {@code maxRetries} times;
 * every other exception becomes a FAILED result. An {@link Error} also completes the context as
 * FAILED before it is rethrown to the worker thread.
 */
public class DefaultCommandExecutor implements CommandExecutor, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DefaultCommandExecutor.class);

  private final CommandHandlerRegistry handlers;
  private final AggregateRepository repository;
  private final Executor workers;
  private final int maxRetries;

  public DefaultCommandExecutor(
      CommandHandlerRegistry handlers,
      AggregateRepository repository,
      Executor workers,
      int maxRetries) {
    this.handlers = handlers;
    this.repository = repository;
    this.workers = workers;
    this.maxRetries = maxRetries;
  }

  public static DefaultCommandExecutor withThreads(
      CommandHandlerRegistry handlers, AggregateRepository repository, int threads, int maxRetries) {
    AtomicInteger counter = new AtomicInteger();
    ExecutorService pool =
        Executors.newFixedThreadPool(
            threads,
            r -> {
              Thread t = new Thread(r, "command-executor-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    return new DefaultCommandExecutor(handlers, repository, pool, maxRetries);
  }

  @Override
  public void execute(Command command, CommandExecuteContext context) {
    workers.execute(() -> process(command, context));
  }

  void process(Command command, CommandExecuteContext context) {
    try (MDC.MDCCloseable ignored = MDC.putCloseable("commandId", command.id())) {
      CommandResult result;
      try {
        result = run(command, context);
      } catch (Error e) {
        log.error(
            "Fatal error handling command: {} id={}",
            command.getClass().getSimpleName(),
            command.id(),
            e);
        context.onCommandExecuted(CommandResult.failed(null, e));
        throw e;
      }
      context.onCommandExecuted(result);
    }
  }

  private CommandResult run(Command command, CommandExecuteContext context) {
    Optional<CommandHandler<Command>> handler = handlers.find(command.getClass());
    if (handler.isEmpty()) {
      String error = "No handler registered for command type: " + command.getClass().getSimpleName();
      log.error(error);
      return CommandResult.failed(null, IllegalStateException.class.getSimpleName(), error);
    }

    int attempt = 0;
    while (true) {
      try {
        handler.get().handle(context, command);
        return commit(context);
      } catch (TransientException e) {
        if (attempt >= maxRetries) {
          log.error(
              "Command {} failed after {} retries: {}", command.id(), attempt, e.getMessage());
          return CommandResult.failed(null, e);
        }
        attempt++;
        log.warn(
            "Retrying command {} (attempt {}/{}): {}",
            command.id(),
            attempt,
            maxRetries,
            e.getMessage());
        context.clear();
      } catch (RuntimeException e) {
        log.error(
            "Error handling command: {} id={}",
            command.getClass().getSimpleName(),
            command.id(),
            e);
        return CommandResult.failed(null, e);
      }
    }
  }

  private CommandResult commit(CommandExecuteContext context) {
    Collection<AggregateRoot> tracked = context.getTrackedAggregateRoots();
    if (tracked.isEmpty()) {
      return CommandResult.nothingChanged();
    }
    tracked.forEach(repository::save);
    String aggregateRootId = tracked.size() == 1 ? tracked.iterator().next().uniqueId() : null;
    return CommandResult.success(aggregateRootId);
  }

  @Override
  public void close() {
    if (workers instanceof ExecutorService pool) {
      pool.shutdown();
      try {
        if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
          log.warn("Command executor did not terminate within 10s, forcing shutdown");
          pool.shutdownNow();
        }
      } catch (InterruptedException e) {
        pool.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }
}

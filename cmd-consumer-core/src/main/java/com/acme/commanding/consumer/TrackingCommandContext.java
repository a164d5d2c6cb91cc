package com.acme.commanding.consumer;

import com.acme.commanding.command.Command;
import com.acme.commanding.command.CommandExecuteContext;
import com.acme.commanding.command.CommandResult;
import com.acme.commanding.core.AggregateRootAlreadyExistsException;
import com.acme.commanding.core.AggregateRootNotFoundException;
import com.acme.commanding.domain.AggregateRepository;
import com.acme.commanding.domain.AggregateRoot;
import com.acme.commanding.spi.QueueMessage;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unit of work for a single command. Aggregates added or loaded here are cached for the rest of
 * the execution so repeated reads see the same instance. The cache never outlives the context.
 */
public class TrackingCommandContext implements CommandExecuteContext {
  private static final Logger log = LoggerFactory.getLogger(TrackingCommandContext.class);

  private final Command command;
  private final QueueMessage queueMessage;
  private final String resultTopic;
  private final Map<String, String> items;
  private final AggregateRepository repository;
  private final CompletableFuture<CommandResult> completion;
  private final Instant startedAt;
  private final ConcurrentMap<String, AggregateRoot> trackedAggregateRoots =
      new ConcurrentHashMap<>();

  public TrackingCommandContext(
      Command command,
      QueueMessage queueMessage,
      String resultTopic,
      Map<String, String> items,
      AggregateRepository repository,
      CompletableFuture<CommandResult> completion,
      Instant startedAt) {
    this.command = Objects.requireNonNull(command, "command");
    this.queueMessage = queueMessage;
    this.resultTopic = resultTopic;
    this.items = Map.copyOf(items);
    this.repository = Objects.requireNonNull(repository, "repository");
    this.completion = Objects.requireNonNull(completion, "completion");
    this.startedAt = startedAt;
  }

  @Override
  public void add(AggregateRoot aggregateRoot) {
    if (aggregateRoot == null) {
      throw new IllegalArgumentException("aggregateRoot must not be null");
    }
    if (trackedAggregateRoots.putIfAbsent(aggregateRoot.uniqueId(), aggregateRoot) != null) {
      throw new AggregateRootAlreadyExistsException(
          aggregateRoot.uniqueId(), aggregateRoot.getClass());
    }
  }

  @Override
  public <T extends AggregateRoot> T get(Class<T> type, String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Aggregate root id must not be empty");
    }

    AggregateRoot tracked = trackedAggregateRoots.get(id);
    if (tracked != null) {
      return cast(type, id, tracked);
    }

    T loaded =
        repository.get(type, id).orElseThrow(() -> new AggregateRootNotFoundException(id, type));
    // a concurrent get for the same id may have won; keep the first instance
    AggregateRoot existing = trackedAggregateRoots.putIfAbsent(id, loaded);
    return existing == null ? loaded : cast(type, id, existing);
  }

  private static <T extends AggregateRoot> T cast(Class<T> type, String id, AggregateRoot found) {
    if (!type.isInstance(found)) {
      throw new AggregateRootNotFoundException(id, type);
    }
    return type.cast(found);
  }

  @Override
  public Collection<AggregateRoot> getTrackedAggregateRoots() {
    return List.copyOf(trackedAggregateRoots.values());
  }

  @Override
  public void clear() {
    trackedAggregateRoots.clear();
  }

  @Override
  public boolean onCommandExecuted(CommandResult result) {
    Objects.requireNonNull(result, "result");
    boolean completed = completion.complete(result);
    if (!completed) {
      log.warn(
          "Ignoring repeated completion for command {}: status={}, already completed",
          command.id(),
          result.status());
    }
    return completed;
  }

  @Override
  public Command getCommand() {
    return command;
  }

  @Override
  public QueueMessage getQueueMessage() {
    return queueMessage;
  }

  @Override
  public Map<String, String> getItems() {
    return items;
  }

  public String getResultTopic() {
    return resultTopic;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public boolean isCompleted() {
    return completion.isDone();
  }
}

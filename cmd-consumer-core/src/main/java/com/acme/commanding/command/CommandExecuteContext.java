package com.acme.commanding.command;

import com.acme.commanding.domain.AggregateRoot;
import com.acme.commanding.spi.QueueMessage;
import java.util.Collection;
import java.util.Map;

/** Per-command unit of work handed to the {@link CommandExecutor}. */
public interface CommandExecuteContext extends CommandContext {

  Command getCommand();

  QueueMessage getQueueMessage();

  /** Routing items forwarded unchanged from the command envelope. */
  Map<String, String> getItems();

  /** Snapshot of every aggregate added or loaded during this execution. */
  Collection<AggregateRoot> getTrackedAggregateRoots();

  /** Forget all tracked aggregates, typically before retrying the handler. */
  void clear();

  /**
   * Report the outcome of this execution. Must be called exactly once; later calls are ignored.
   *
   * @return true if this call completed the context
   */
  boolean onCommandExecuted(CommandResult result);
}

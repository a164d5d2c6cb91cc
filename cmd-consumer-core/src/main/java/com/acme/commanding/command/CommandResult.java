package com.acme.commanding.command;

import java.util.Objects;

/**
 * Outcome of one command execution, handed by the executor to {@link
 * CommandExecuteContext#onCommandExecuted(CommandResult)}. Failures travel as data in this record,
 * never as exceptions thrown back into the consumer.
 */
public record CommandResult(
    CommandStatus status, String aggregateRootId, String exceptionTypeName, String errorMessage) {

  public CommandResult {
    Objects.requireNonNull(status, "status");
  }

  public static CommandResult success(String aggregateRootId) {
    return new CommandResult(CommandStatus.SUCCESS, aggregateRootId, null, null);
  }

  public static CommandResult nothingChanged() {
    return new CommandResult(CommandStatus.NOTHING_CHANGED, null, null, null);
  }

  public static CommandResult failed(String aggregateRootId, Throwable error) {
    return new CommandResult(
        CommandStatus.FAILED, aggregateRootId, error.getClass().getSimpleName(), error.getMessage());
  }

  public static CommandResult failed(
      String aggregateRootId, String exceptionTypeName, String errorMessage) {
    return new CommandResult(CommandStatus.FAILED, aggregateRootId, exceptionTypeName, errorMessage);
  }

  public static CommandResult timedOut(String errorMessage) {
    return new CommandResult(CommandStatus.TIMED_OUT, null, "CommandTimeout", errorMessage);
  }

  public boolean isFailure() {
    return status == CommandStatus.FAILED || status == CommandStatus.TIMED_OUT;
  }
}

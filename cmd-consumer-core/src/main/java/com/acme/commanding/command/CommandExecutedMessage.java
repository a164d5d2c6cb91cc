package com.acme.commanding.command;

import com.acme.commanding.core.Jsons;

/**
 * Result notification published once per executed command, whatever its outcome.
 *
 * @param processId set only when the command is a {@link ProcessCommand}
 * @param exceptionTypeName set only on failure
 * @param errorMessage set only on failure
 */
public record CommandExecutedMessage(
    String commandId,
    String aggregateRootId,
    String processId,
    CommandStatus commandStatus,
    String exceptionTypeName,
    String errorMessage) {

  public static CommandExecutedMessage of(Command command, CommandResult result) {
    String processId = command instanceof ProcessCommand pc ? pc.processId() : null;
    return new CommandExecutedMessage(
        command.id(),
        result.aggregateRootId(),
        processId,
        result.status(),
        result.exceptionTypeName(),
        result.errorMessage());
  }

  public String toJson() {
    return Jsons.toJson(this);
  }
}

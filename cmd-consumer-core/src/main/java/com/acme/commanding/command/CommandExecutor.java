package com.acme.commanding.command;

/**
 * Runs a command against its unit of work. Implementations may return before the command has run
 * but must eventually call {@link CommandExecuteContext#onCommandExecuted(CommandResult)} exactly
 * once.
 */
public interface CommandExecutor {

  void execute(Command command, CommandExecuteContext context);
}

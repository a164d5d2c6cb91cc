package com.acme.commanding.command;

/** Business logic for one command type. */
@FunctionalInterface
public interface CommandHandler<C extends Command> {

  void handle(CommandContext context, C command);
}

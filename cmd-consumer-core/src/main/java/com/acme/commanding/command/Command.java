package com.acme.commanding.command;

/**
 * A single instruction to change state. Implementations are usually records decoded from the
 * command envelope by {@link com.acme.commanding.spi.CommandMessageDecoder}.
 */
public interface Command {

  /** Globally unique identifier of this command. */
  String id();
}

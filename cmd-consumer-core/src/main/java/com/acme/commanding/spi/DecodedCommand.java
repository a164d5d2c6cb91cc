package com.acme.commanding.spi;

import com.acme.commanding.command.Command;
import java.util.Objects;

/**
 * A command together with the routing metadata of its envelope.
 *
 * @param resultTopic where the result notification goes; may be null
 * @param eventHandledTopic routing hint forwarded unchanged to the executor; may be null
 */
public record DecodedCommand(Command command, String resultTopic, String eventHandledTopic) {

  public DecodedCommand {
    Objects.requireNonNull(command, "command");
  }
}

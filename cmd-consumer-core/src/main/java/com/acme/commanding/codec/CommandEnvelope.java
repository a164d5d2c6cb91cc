package com.acme.commanding.codec;

import com.acme.commanding.command.Command;
import com.acme.commanding.core.Jsons;

/**
 * JSON wire form of a command message.
 *
 * @param commandType type code registered in {@link com.acme.commanding.command.CommandTypeRegistry}
 * @param commandData the command itself, serialized as a JSON string
 * @param commandExecutedMessageTopic topic for the result notification
 * @param domainEventHandledMessageTopic routing hint forwarded to the executor
 */
public record CommandEnvelope(
    String commandType,
    String commandData,
    String commandExecutedMessageTopic,
    String domainEventHandledMessageTopic) {

  public static CommandEnvelope wrap(
      String commandType,
      Command command,
      String commandExecutedMessageTopic,
      String domainEventHandledMessageTopic) {
    return new CommandEnvelope(
        commandType,
        Jsons.toJson(command),
        commandExecutedMessageTopic,
        domainEventHandledMessageTopic);
  }

  public byte[] toBytes() {
    return Jsons.toJsonBytes(this);
  }
}

package com.acme.commanding.codec;

import com.acme.commanding.command.Command;
import com.acme.commanding.command.CommandTypeRegistry;
import com.acme.commanding.core.CommandDecodeException;
import com.acme.commanding.core.Jsons;
import com.acme.commanding.spi.CommandMessageDecoder;
import com.acme.commanding.spi.DecodedCommand;

/** Decodes {@link CommandEnvelope} JSON and resolves the command class by type code. */
public class JsonCommandMessageDecoder implements CommandMessageDecoder {

  private final CommandTypeRegistry typeRegistry;

  public JsonCommandMessageDecoder(CommandTypeRegistry typeRegistry) {
    this.typeRegistry = typeRegistry;
  }

  @Override
  public DecodedCommand decode(byte[] body) {
    if (body == null || body.length == 0) {
      throw new CommandDecodeException("Command message body is empty");
    }

    CommandEnvelope envelope;
    try {
      envelope = Jsons.fromJson(body, CommandEnvelope.class);
    } catch (RuntimeException e) {
      throw new CommandDecodeException("Malformed command envelope", e);
    }
    if (envelope == null) {
      throw new CommandDecodeException("Malformed command envelope");
    }

    String typeCode = envelope.commandType();
    if (typeCode == null || typeCode.isBlank()) {
      throw new CommandDecodeException("Command envelope has no command type");
    }
    Class<? extends Command> type =
        typeRegistry
            .findType(typeCode)
            .orElseThrow(
                () -> new CommandDecodeException("Unknown command type code: " + typeCode));

    if (envelope.commandData() == null || envelope.commandData().isBlank()) {
      throw new CommandDecodeException("Command envelope has no command data, type=" + typeCode);
    }
    Command command;
    try {
      command = Jsons.fromJson(envelope.commandData(), type);
    } catch (RuntimeException e) {
      throw new CommandDecodeException("Malformed command data, type=" + typeCode, e);
    }
    if (command == null) {
      throw new CommandDecodeException("Malformed command data, type=" + typeCode);
    }
    if (command.id() == null || command.id().isBlank()) {
      throw new CommandDecodeException("Command has no id, type=" + typeCode);
    }

    return new DecodedCommand(
        command,
        envelope.commandExecutedMessageTopic(),
        envelope.domainEventHandledMessageTopic());
  }
}

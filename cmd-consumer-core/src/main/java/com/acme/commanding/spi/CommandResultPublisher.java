package com.acme.commanding.spi;

import com.acme.commanding.command.CommandExecutedMessage;

public interface CommandResultPublisher {
  void send(CommandExecutedMessage message, String topic);
}

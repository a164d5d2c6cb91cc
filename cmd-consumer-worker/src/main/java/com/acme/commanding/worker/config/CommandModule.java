package com.acme.commanding.worker.config;

import com.acme.commanding.command.CommandHandlerRegistry;
import com.acme.commanding.command.CommandTypeRegistry;

/**
 * A bounded context's contribution to the worker: its command type codes and handlers. Every
 * {@code CommandModule} bean is applied once at startup.
 */
public interface CommandModule {

  void register(CommandTypeRegistry types, CommandHandlerRegistry handlers);
}

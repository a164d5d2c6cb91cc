package com.acme.commanding.command;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry for command handlers - maps command classes to their handlers. Pure POJO - no
 * framework dependencies.
 */
public class CommandHandlerRegistry {
  private static final Logger log = LoggerFactory.getLogger(CommandHandlerRegistry.class);

  private final Map<Class<?>, CommandHandler<?>> handlers = new ConcurrentHashMap<>();

  /**
   * Register a handler for a specific command class
   *
   * @throws IllegalStateException if a handler is already registered for this command class
   */
  public <C extends Command> void registerHandler(
      Class<C> commandType, CommandHandler<? super C> handler) {
    if (handlers.putIfAbsent(commandType, handler) != null) {
      String error = "Handler already registered for command type: " + commandType.getSimpleName();
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.info("Registering handler for command type: {}", commandType.getSimpleName());
  }

  @SuppressWarnings("unchecked")
  public Optional<CommandHandler<Command>> find(Class<? extends Command> commandType) {
    return Optional.ofNullable((CommandHandler<Command>) handlers.get(commandType));
  }

  public boolean hasHandler(Class<? extends Command> commandType) {
    return handlers.containsKey(commandType);
  }
}

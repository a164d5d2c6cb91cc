package com.acme.commanding.command;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the type codes carried in command envelopes to concrete command classes. Populated once at
 * startup and read by the decoder for every message.
 */
public class CommandTypeRegistry {
  private static final Logger log = LoggerFactory.getLogger(CommandTypeRegistry.class);

  private final Map<String, Class<? extends Command>> typesByCode = new ConcurrentHashMap<>();
  private final Map<Class<? extends Command>, String> codesByType = new ConcurrentHashMap<>();

  /**
   * @throws IllegalStateException if either the code or the class is already registered
   */
  public synchronized CommandTypeRegistry register(
      String typeCode, Class<? extends Command> commandType) {
    if (typeCode == null || typeCode.isBlank()) {
      throw new IllegalArgumentException("Command type code must not be blank");
    }
    if (typesByCode.containsKey(typeCode)) {
      throw new IllegalStateException("Command type code already registered: " + typeCode);
    }
    if (codesByType.containsKey(commandType)) {
      throw new IllegalStateException(
          "Command type already registered: " + commandType.getName());
    }
    typesByCode.put(typeCode, commandType);
    codesByType.put(commandType, typeCode);
    log.info("Registered command type code {} -> {}", typeCode, commandType.getSimpleName());
    return this;
  }

  public Optional<Class<? extends Command>> findType(String typeCode) {
    return typeCode == null ? Optional.empty() : Optional.ofNullable(typesByCode.get(typeCode));
  }

  public Optional<String> findTypeCode(Class<? extends Command> commandType) {
    return Optional.ofNullable(codesByType.get(commandType));
  }

  public Set<String> typeCodes() {
    return Set.copyOf(typesByCode.keySet());
  }
}

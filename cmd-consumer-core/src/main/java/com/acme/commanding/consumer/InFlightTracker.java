package com.acme.commanding.consumer;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Command id to pending receipt index. An id is present while exactly one execution for it is
 * outstanding. Each operation is a single atomic map call; nothing is locked while a command runs.
 */
public class InFlightTracker {

  private final ConcurrentMap<String, PendingCommand> inFlight = new ConcurrentHashMap<>();

  /**
   * @return false if the command id is already in flight; the existing entry is left untouched
   */
  public boolean tryBegin(String commandId, PendingCommand pending) {
    return inFlight.putIfAbsent(commandId, pending) == null;
  }

  public Optional<PendingCommand> endIfPresent(String commandId) {
    return Optional.ofNullable(inFlight.remove(commandId));
  }

  public boolean isInFlight(String commandId) {
    return inFlight.containsKey(commandId);
  }

  public int size() {
    return inFlight.size();
  }

  public List<PendingCommand> startedBefore(Instant cutoff) {
    return inFlight.values().stream().filter(p -> p.startedAt().isBefore(cutoff)).toList();
  }
}

package com.acme.commanding.kafka;

import java.time.Instant;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.apache.kafka.common.TopicPartition;

/**
 * Offset bookkeeping for one assigned partition. Records are acknowledged out of order by executor
 * threads; the committable offset never moves past the lowest record still pending.
 *
 * <p>Pending records remember when they were handed out. Records pending for too long can be marked
 * for redelivery; after the poll thread seeks back, only those marked records are handed out again.
 */
final class PartitionOffsetTracker {

  private final TopicPartition partition;
  private final ConcurrentNavigableMap<Long, Instant> pending = new ConcurrentSkipListMap<>();
  private final Set<Long> redelivering = ConcurrentHashMap.newKeySet();
  private volatile long nextOffset = -1L;
  private volatile long lastCommitted = -1L;

  PartitionOffsetTracker(TopicPartition partition) {
    this.partition = partition;
  }

  TopicPartition partition() {
    return partition;
  }

  /**
   * Called on the poll thread before the record is handed out. The first fetched offset is the
   * group's current position and counts as committed.
   *
   * @return false if the record was fetched again after a seek but is not due for redelivery
   */
  boolean received(long offset, Instant receivedAt) {
    if (offset < nextOffset) {
      if (!redelivering.remove(offset)) {
        return false;
      }
      return pending.replace(offset, receivedAt) != null;
    }
    if (lastCommitted < 0) {
      lastCommitted = offset;
    }
    pending.put(offset, receivedAt);
    nextOffset = offset + 1;
    return true;
  }

  void acknowledge(long offset) {
    pending.remove(offset);
    redelivering.remove(offset);
  }

  /**
   * Marks every record handed out before {@code cutoff} and still unacknowledged for redelivery.
   *
   * @return the offset to seek back to, or empty if no record was newly marked
   */
  OptionalLong markForRedelivery(Instant cutoff) {
    boolean marked = false;
    for (Map.Entry<Long, Instant> entry : pending.entrySet()) {
      if (entry.getValue().isBefore(cutoff) && redelivering.add(entry.getKey())) {
        marked = true;
      }
    }
    if (!marked) {
      return OptionalLong.empty();
    }
    return redelivering.stream()
        .filter(pending::containsKey)
        .mapToLong(Long::longValue)
        .min();
  }

  /** Offset to commit, or empty if nothing new can be committed. */
  OptionalLong committableOffset() {
    if (nextOffset < 0) {
      return OptionalLong.empty();
    }
    Long lowestPending = pending.ceilingKey(Long.MIN_VALUE);
    long committable = lowestPending != null ? lowestPending : nextOffset;
    return committable > lastCommitted ? OptionalLong.of(committable) : OptionalLong.empty();
  }

  void markCommitted(long offset) {
    if (offset > lastCommitted) {
      lastCommitted = offset;
    }
  }

  int pendingCount() {
    return pending.size();
  }
}

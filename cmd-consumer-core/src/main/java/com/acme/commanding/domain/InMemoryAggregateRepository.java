package com.acme.commanding.domain;

import com.acme.commanding.core.Jsons;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map backed repository for local runs and tests. Aggregates are kept as JSON snapshots, so every
 * {@link #get} hands out a fresh instance and only {@link #save} changes what is stored. Aggregate
 * types must therefore round-trip through {@link Jsons}.
 */
public class InMemoryAggregateRepository implements AggregateRepository {

  private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();

  @Override
  public <T extends AggregateRoot> Optional<T> get(Class<T> type, String id) {
    Snapshot snapshot = snapshots.get(id);
    if (snapshot == null || !type.isAssignableFrom(snapshot.type())) {
      return Optional.empty();
    }
    return Optional.of(type.cast(Jsons.fromJson(snapshot.json(), snapshot.type())));
  }

  @Override
  public void save(AggregateRoot aggregateRoot) {
    snapshots.put(
        aggregateRoot.uniqueId(),
        new Snapshot(aggregateRoot.getClass(), Jsons.toJson(aggregateRoot)));
  }

  public int size() {
    return snapshots.size();
  }

  private record Snapshot(Class<? extends AggregateRoot> type, String json) {}
}

package com.acme.commanding.domain;

import java.util.Optional;

/** Repository interface for aggregate roots */
public interface AggregateRepository {

  <T extends AggregateRoot> Optional<T> get(Class<T> type, String id);

  void save(AggregateRoot aggregateRoot);
}

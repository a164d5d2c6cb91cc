package com.acme.commanding.command;

import com.acme.commanding.domain.AggregateRoot;

/** The view of the unit of work that command handlers work against. */
public interface CommandContext {

  /**
   * Track a newly created aggregate.
   *
   * @throws IllegalArgumentException if the aggregate is null
   * @throws com.acme.commanding.core.AggregateRootAlreadyExistsException if its id is already
   *     tracked in this context
   */
  void add(AggregateRoot aggregateRoot);

  /**
   * Return the aggregate with the given id, loading it from the repository on first access and
   * from this context afterwards.
   *
   * @throws IllegalArgumentException if the id is null or blank
   * @throws com.acme.commanding.core.AggregateRootNotFoundException if no aggregate of that type
   *     exists
   */
  <T extends AggregateRoot> T get(Class<T> type, String id);
}

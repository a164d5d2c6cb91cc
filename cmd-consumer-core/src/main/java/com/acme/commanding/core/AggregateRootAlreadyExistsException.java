package com.acme.commanding.core;

/**
 * Raised when a command handler adds an aggregate whose id is already tracked by the current unit
 * of work.
 */
public class AggregateRootAlreadyExistsException extends PermanentException {
  private final String aggregateRootId;
  private final Class<?> aggregateRootType;

  public AggregateRootAlreadyExistsException(String aggregateRootId, Class<?> aggregateRootType) {
    super(
        "Aggregate root [type="
            + aggregateRootType.getName()
            + ", id="
            + aggregateRootId
            + "] already exists in command context");
    this.aggregateRootId = aggregateRootId;
    this.aggregateRootType = aggregateRootType;
  }

  public String getAggregateRootId() {
    return aggregateRootId;
  }

  public Class<?> getAggregateRootType() {
    return aggregateRootType;
  }
}

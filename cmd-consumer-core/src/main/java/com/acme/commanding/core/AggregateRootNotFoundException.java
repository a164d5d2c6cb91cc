package com.acme.commanding.core;

/** Raised when the repository holds no aggregate of the requested type and id. */
public class AggregateRootNotFoundException extends PermanentException {
  private final String aggregateRootId;
  private final Class<?> aggregateRootType;

  public AggregateRootNotFoundException(String aggregateRootId, Class<?> aggregateRootType) {
    super(
        "Aggregate root [type="
            + aggregateRootType.getName()
            + ", id="
            + aggregateRootId
            + "] not found");
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

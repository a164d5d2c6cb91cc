package com.acme.commanding.domain;

/** Domain entity owning a consistency boundary; loaded and saved through the repository. */
public interface AggregateRoot {

  /** Stable identifier, unique per aggregate type. */
  String uniqueId();
}

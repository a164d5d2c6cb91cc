package com.acme.commanding.core;

/**
 * A failure that may go away on retry, such as a concurrent modification of an aggregate. The
 * default command executor clears the unit of work and runs the handler again.
 */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}

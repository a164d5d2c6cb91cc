package com.acme.commanding.core;

/**
 * A failure that will happen again if the same command is retried. Command executors report it as
 * a failed command instead of retrying.
 */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}

package com.acme.commanding.core;

/** Raised when a delivered queue message cannot be turned into a typed command. */
public class CommandDecodeException extends PermanentException {
  public CommandDecodeException(String message) {
    super(message);
  }

  public CommandDecodeException(String message, Throwable e) {
    super(message, e);
  }
}

package com.acme.commanding.command;

/** Final status of a command execution, reported in the result notification. */
public enum CommandStatus {
  /** Handler completed and at least one aggregate was touched */
  SUCCESS,

  /** Handler completed without touching any aggregate */
  NOTHING_CHANGED,

  /** Handler or executor failed */
  FAILED,

  /** Execution did not complete before the in-flight timeout */
  TIMED_OUT
}

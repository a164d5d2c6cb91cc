package com.acme.commanding.command;

/** A command sent on behalf of a long running process; its result carries the process id. */
public interface ProcessCommand extends Command {

  String processId();
}

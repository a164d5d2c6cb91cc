package com.acme.commanding.worker;

import io.micronaut.runtime.Micronaut;

/**
 * Worker Application - consumes command messages from Kafka, executes them through the registered
 * command modules and publishes one result per command. Instances in the same consumer group share
 * the partitions of the command topics.
 */
public class WorkerApplication {
  public static void main(String[] args) {
    Micronaut.run(WorkerApplication.class, args);
  }
}

package com.acme.commanding.spi;

/** Callback the queue client invokes for each delivered message. */
@FunctionalInterface
public interface MessageHandler {

  void handle(QueueMessage message, MessageReceipt receipt);
}

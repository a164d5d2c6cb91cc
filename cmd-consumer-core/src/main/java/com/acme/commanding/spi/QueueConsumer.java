package com.acme.commanding.spi;

/** Lifecycle of the underlying queue client. */
public interface QueueConsumer {

  void start(MessageHandler handler);

  void subscribe(String topic);

  void shutdown();
}

package com.acme.commanding.spi;

/**
 * Handle for one delivery that has not been acknowledged yet. The consumer calls {@link
 * #acknowledge()} at most once, when the command carried by the delivery has finished.
 */
@FunctionalInterface
public interface MessageReceipt {

  void acknowledge();
}

package com.acme.commanding.spi;

import java.time.Instant;
import java.util.Map;

/**
 * A message as delivered by the queue client.
 *
 * @param queueId partition or queue index within the topic
 * @param queueOffset position of the message within that queue
 */
public record QueueMessage(
    String topic,
    int queueId,
    long queueOffset,
    String key,
    byte[] body,
    Map<String, String> headers,
    Instant receivedAt) {

  public QueueMessage {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }
}

package com.acme.commanding.kafka;

import com.acme.commanding.spi.MessageReceipt;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.kafka.common.TopicPartition;

/** Acknowledgment handle for one Kafka record. Only the first call has an effect. */
final class KafkaMessageReceipt implements MessageReceipt {

  private final TopicPartition partition;
  private final long offset;
  private final PartitionOffsetTracker tracker;
  private final AtomicBoolean acknowledged = new AtomicBoolean();

  KafkaMessageReceipt(TopicPartition partition, long offset, PartitionOffsetTracker tracker) {
    this.partition = partition;
    this.offset = offset;
    this.tracker = tracker;
  }

  @Override
  public void acknowledge() {
    if (acknowledged.compareAndSet(false, true)) {
      tracker.acknowledge(offset);
    }
  }

  boolean isAcknowledged() {
    return acknowledged.get();
  }

  @Override
  public String toString() {
    return partition + "@" + offset;
  }
}

package com.acme.commanding.kafka;

import com.acme.commanding.spi.MessageHandler;
import com.acme.commanding.spi.QueueConsumer;
import com.acme.commanding.spi.QueueMessage;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QueueConsumer} over a Kafka consumer group.
 *
 * <p>A single poll thread owns the Kafka {@link Consumer}. Records are handed to the {@link
 * MessageHandler} in partition order and may be acknowledged later from any thread. Offsets are
 * committed per partition up to the lowest record that is still unacknowledged: asynchronously
 * after every poll, synchronously when partitions are revoked and on shutdown.
 *
 * <p>A record still unacknowledged after the redelivery timeout is handed out again: the poll
 * thread seeks back to it and skips the re-fetched records that were acknowledged or are still
 * within the timeout. A zero timeout disables redelivery.
 */
public class KafkaQueueConsumer implements QueueConsumer {
  private static final Logger log = LoggerFactory.getLogger(KafkaQueueConsumer.class);

  private static final long SHUTDOWN_JOIN_MILLIS = TimeUnit.SECONDS.toMillis(10);

  private final String name;
  private final Consumer<String, byte[]> consumer;
  private final Duration pollTimeout;
  private final Duration redeliveryTimeout;

  private final Set<String> topics = new CopyOnWriteArraySet<>();
  private final AtomicBoolean subscriptionChanged = new AtomicBoolean();
  private final AtomicBoolean running = new AtomicBoolean();
  private final Map<TopicPartition, PartitionOffsetTracker> trackers = new ConcurrentHashMap<>();

  private volatile MessageHandler handler;
  private volatile Thread pollThread;
  // poll thread only
  private boolean subscribed;

  public KafkaQueueConsumer(
      String name,
      Consumer<String, byte[]> consumer,
      Duration pollTimeout,
      Duration redeliveryTimeout) {
    this.name = name;
    this.consumer = consumer;
    this.pollTimeout = pollTimeout;
    this.redeliveryTimeout = redeliveryTimeout;
  }

  @Override
  public void subscribe(String topic) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("Topic must not be blank");
    }
    if (topics.add(topic)) {
      subscriptionChanged.set(true);
      log.info("Consumer {} will subscribe to topic {}", name, topic);
    }
  }

  @Override
  public synchronized void start(MessageHandler messageHandler) {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("Consumer " + name + " is already running");
    }
    this.handler = messageHandler;
    Thread thread = new Thread(this::pollLoop, name + "-poll");
    pollThread = thread;
    thread.start();
    log.info("Consumer {} started", name);
  }

  @Override
  public synchronized void shutdown() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    consumer.wakeup();
    Thread thread = pollThread;
    if (thread != null && thread != Thread.currentThread()) {
      try {
        thread.join(SHUTDOWN_JOIN_MILLIS);
        if (thread.isAlive()) {
          log.warn("Poll thread of {} did not stop within {}ms", name, SHUTDOWN_JOIN_MILLIS);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    log.info("Consumer {} stopped", name);
  }

  public boolean isRunning() {
    return running.get();
  }

  private void pollLoop() {
    try {
      while (running.get()) {
        applySubscription();
        if (!subscribed) {
          Thread.sleep(pollTimeout.toMillis());
          continue;
        }
        ConsumerRecords<String, byte[]> records = consumer.poll(pollTimeout);
        for (ConsumerRecord<String, byte[]> record : records) {
          dispatch(record);
        }
        commitAsync();
        redeliverStale();
      }
    } catch (WakeupException e) {
      if (running.get()) {
        log.error("Unexpected wakeup of consumer {}", name, e);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (RuntimeException e) {
      log.error("Poll loop of consumer {} terminated", name, e);
    } finally {
      running.set(false);
      try {
        commitSync(trackers.keySet());
      } catch (RuntimeException e) {
        log.error("Final offset commit of consumer {} failed", name, e);
      } finally {
        consumer.close();
      }
    }
  }

  private void applySubscription() {
    if (subscriptionChanged.compareAndSet(true, false)) {
      List<String> current = List.copyOf(topics);
      consumer.subscribe(current, new OffsetCommittingRebalanceListener());
      subscribed = true;
      log.info("Consumer {} subscribed to {}", name, current);
    }
  }

  private void dispatch(ConsumerRecord<String, byte[]> record) {
    TopicPartition partition = new TopicPartition(record.topic(), record.partition());
    PartitionOffsetTracker tracker =
        trackers.computeIfAbsent(partition, PartitionOffsetTracker::new);
    Instant receivedAt = Instant.now();
    if (!tracker.received(record.offset(), receivedAt)) {
      log.debug("Skipping re-fetched record {}@{}", partition, record.offset());
      return;
    }

    QueueMessage message =
        new QueueMessage(
            record.topic(),
            record.partition(),
            record.offset(),
            record.key(),
            record.value(),
            headers(record.headers()),
            receivedAt);
    try {
      handler.handle(message, new KafkaMessageReceipt(partition, record.offset(), tracker));
    } catch (RuntimeException e) {
      log.error(
          "Failed to handle record: topic={}, partition={}, offset={}",
          record.topic(),
          record.partition(),
          record.offset(),
          e);
    }
  }

  private void redeliverStale() {
    if (redeliveryTimeout == null || redeliveryTimeout.isZero() || redeliveryTimeout.isNegative()) {
      return;
    }
    Instant cutoff = Instant.now().minus(redeliveryTimeout);
    trackers.forEach(
        (partition, tracker) ->
            tracker
                .markForRedelivery(cutoff)
                .ifPresent(
                    offset -> {
                      log.warn(
                          "Records of {} unacknowledged for more than {}, redelivering from offset {}",
                          partition,
                          redeliveryTimeout,
                          offset);
                      consumer.seek(partition, offset);
                    }));
  }

  private void commitAsync() {
    Map<TopicPartition, OffsetAndMetadata> offsets = committableOffsets(trackers.keySet());
    if (offsets.isEmpty()) {
      return;
    }
    consumer.commitAsync(
        offsets,
        (committed, error) -> {
          if (error != null) {
            log.warn("Async offset commit of consumer {} failed: {}", name, error.getMessage());
          } else {
            markCommitted(committed);
          }
        });
  }

  private void commitSync(Collection<TopicPartition> partitions) {
    Map<TopicPartition, OffsetAndMetadata> offsets = committableOffsets(partitions);
    if (offsets.isEmpty()) {
      return;
    }
    consumer.commitSync(offsets);
    markCommitted(offsets);
    log.debug("Consumer {} committed offsets {}", name, offsets);
  }

  private Map<TopicPartition, OffsetAndMetadata> committableOffsets(
      Collection<TopicPartition> partitions) {
    Map<TopicPartition, OffsetAndMetadata> offsets = new LinkedHashMap<>();
    for (TopicPartition partition : partitions) {
      PartitionOffsetTracker tracker = trackers.get(partition);
      if (tracker == null) {
        continue;
      }
      OptionalLong committable = tracker.committableOffset();
      if (committable.isPresent()) {
        offsets.put(partition, new OffsetAndMetadata(committable.getAsLong()));
      }
    }
    return offsets;
  }

  private void markCommitted(Map<TopicPartition, OffsetAndMetadata> offsets) {
    offsets.forEach(
        (partition, offset) -> {
          PartitionOffsetTracker tracker = trackers.get(partition);
          if (tracker != null) {
            tracker.markCommitted(offset.offset());
          }
        });
  }

  private static Map<String, String> headers(Headers headers) {
    Map<String, String> result = new HashMap<>();
    for (Header header : headers) {
      if (header.value() != null) {
        result.put(header.key(), new String(header.value(), StandardCharsets.UTF_8));
      }
    }
    return result;
  }

  private class OffsetCommittingRebalanceListener implements ConsumerRebalanceListener {

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      try {
        commitSync(partitions);
      } catch (RuntimeException e) {
        log.error("Offset commit on revocation failed for {}", partitions, e);
      }
      partitions.forEach(
          partition -> {
            PartitionOffsetTracker tracker = trackers.remove(partition);
            if (tracker != null && tracker.pendingCount() > 0) {
              log.warn(
                  "Partition {} revoked with {} unacknowledged record(s); they will be redelivered",
                  partition,
                  tracker.pendingCount());
            }
          });
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      log.info("Consumer {} assigned partitions {}", name, partitions);
    }
  }
}

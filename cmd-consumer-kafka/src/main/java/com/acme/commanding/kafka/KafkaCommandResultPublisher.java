package com.acme.commanding.kafka;

import com.acme.commanding.command.CommandExecutedMessage;
import com.acme.commanding.spi.CommandResultPublisher;
import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Publishes command results to Kafka, keyed by command id. Fire-and-forget. */
public class KafkaCommandResultPublisher implements CommandResultPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaCommandResultPublisher.class);

  static final String MESSAGE_TYPE_HEADER = "messageType";
  static final String COMMAND_STATUS_HEADER = "commandStatus";
  static final String MESSAGE_TYPE = "CommandExecuted";

  private final Producer<String, String> producer;

  public KafkaCommandResultPublisher(Producer<String, String> producer) {
    this.producer = producer;
  }

  @Override
  public void send(CommandExecutedMessage message, String topic) {
    var record = new ProducerRecord<>(topic, message.commandId(), message.toJson());
    record.headers().add(MESSAGE_TYPE_HEADER, MESSAGE_TYPE.getBytes(StandardCharsets.UTF_8));
    record
        .headers()
        .add(
            COMMAND_STATUS_HEADER,
            message.commandStatus().name().getBytes(StandardCharsets.UTF_8));

    producer.send(
        record,
        (metadata, exception) -> {
          if (exception != null) {
            log.error(
                "Failed to publish result for command {} to {}", message.commandId(), topic);
            throw new RuntimeException("Failed to publish to Kafka topic: " + topic, exception);
          }
          log.debug(
              "Published result for command {} to {}-{}@{}",
              message.commandId(),
              metadata.topic(),
              metadata.partition(),
              metadata.offset());
        });
  }
}

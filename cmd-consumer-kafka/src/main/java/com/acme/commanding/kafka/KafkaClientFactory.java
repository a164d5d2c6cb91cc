package com.acme.commanding.kafka;

import com.acme.commanding.config.ConsumerConfig;
import com.acme.commanding.spi.CommandResultPublisher;
import com.acme.commanding.spi.QueueConsumer;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.util.Properties;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Creates the Kafka clients used by the command consumer. Connection settings come from the
 * environment, falling back to a local broker.
 */
@Requires(notEnv = "test")
@Factory
public class KafkaClientFactory {

  static final String BOOTSTRAP_SERVERS_ENV = "KAFKA_BOOTSTRAP_SERVERS";
  static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";

  @Singleton
  @Bean(preDestroy = "close")
  public Producer<String, String> resultProducer() {
    return new KafkaProducer<>(producerProperties());
  }

  @Singleton
  public QueueConsumer kafkaQueueConsumer(ConsumerConfig config) {
    KafkaConsumer<String, byte[]> consumer =
        new KafkaConsumer<>(consumerProperties(config.getGroupName(), config.getConsumerId()));
    return new KafkaQueueConsumer(
        config.getConsumerId(), consumer, config.getPollTimeout(), config.getInFlightTimeout());
  }

  @Singleton
  public CommandResultPublisher commandResultPublisher(Producer<String, String> resultProducer) {
    return new KafkaCommandResultPublisher(resultProducer);
  }

  static Properties producerProperties() {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, env("KAFKA_PRODUCER_ACKS", "all"));
    props.put(ProducerConfig.LINGER_MS_CONFIG, Integer.parseInt(env("KAFKA_LINGER_MS", "5")));
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    return props;
  }

  static Properties consumerProperties(String groupId, String clientId) {
    Properties props = new Properties();
    props.put(
        org.apache.kafka.clients.consumer.ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
        bootstrapServers());
    props.put(org.apache.kafka.clients.consumer.ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(org.apache.kafka.clients.consumer.ConsumerConfig.CLIENT_ID_CONFIG, clientId);
    props.put(
        org.apache.kafka.clients.consumer.ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(
        org.apache.kafka.clients.consumer.ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG,
        ByteArrayDeserializer.class.getName());
    // offsets are committed by KafkaQueueConsumer once records are acknowledged
    props.put(org.apache.kafka.clients.consumer.ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    props.put(
        org.apache.kafka.clients.consumer.ConsumerConfig.AUTO_OFFSET_RESET_CONFIG,
        env("KAFKA_AUTO_OFFSET_RESET", "earliest"));
    props.put(
        org.apache.kafka.clients.consumer.ConsumerConfig.MAX_POLL_RECORDS_CONFIG,
        Integer.parseInt(env("KAFKA_MAX_POLL_RECORDS", "100")));
    return props;
  }

  private static String bootstrapServers() {
    return env(BOOTSTRAP_SERVERS_ENV, DEFAULT_BOOTSTRAP_SERVERS);
  }

  private static String env(String name, String defaultValue) {
    return System.getenv().getOrDefault(name, defaultValue);
  }
}

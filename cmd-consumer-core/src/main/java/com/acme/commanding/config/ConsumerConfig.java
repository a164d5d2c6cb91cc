package com.acme.commanding.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the command consumer: queue identity, topics, in-flight eviction and the
 * default executor. Pure POJO - no framework dependencies.
 */
public class ConsumerConfig {

  private String consumerId = "CommandConsumer";
  private String groupName = "CommandConsumerGroup";
  private List<String> topics = new ArrayList<>(List.of("commands"));
  private String defaultResultTopic = "command-results";
  private Duration pollTimeout = Duration.ofMillis(500);
  private Duration inFlightTimeout = Duration.ofMinutes(5); // ZERO disables eviction
  private Duration inFlightSweepInterval = Duration.ofSeconds(5);
  private int executorThreads = 8;
  private int maxRetries = 3;

  public String getConsumerId() {
    return consumerId;
  }

  public void setConsumerId(String consumerId) {
    this.consumerId = consumerId;
  }

  public String getGroupName() {
    return groupName;
  }

  public void setGroupName(String groupName) {
    this.groupName = groupName;
  }

  public List<String> getTopics() {
    return topics;
  }

  public void setTopics(List<String> topics) {
    this.topics = topics;
  }

  public String getDefaultResultTopic() {
    return defaultResultTopic;
  }

  public void setDefaultResultTopic(String defaultResultTopic) {
    this.defaultResultTopic = defaultResultTopic;
  }

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  public void setPollTimeout(Duration pollTimeout) {
    this.pollTimeout = pollTimeout;
  }

  public Duration getInFlightTimeout() {
    return inFlightTimeout;
  }

  public void setInFlightTimeout(Duration inFlightTimeout) {
    this.inFlightTimeout = inFlightTimeout;
  }

  public boolean isInFlightEvictionEnabled() {
    return inFlightTimeout != null && !inFlightTimeout.isZero() && !inFlightTimeout.isNegative();
  }

  public Duration getInFlightSweepInterval() {
    return inFlightSweepInterval;
  }

  public void setInFlightSweepInterval(Duration inFlightSweepInterval) {
    this.inFlightSweepInterval = inFlightSweepInterval;
  }

  public int getExecutorThreads() {
    return executorThreads;
  }

  public void setExecutorThreads(int executorThreads) {
    this.executorThreads = executorThreads;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }
}

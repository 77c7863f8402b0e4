package dev.henneberger.vertx.cdc.core;

import java.time.Duration;
import java.util.Objects;

public class WorkerOptions {

  public static final String DEFAULT_NAME = "cdc-worker";
  public static final int DEFAULT_MAX_IN_FLIGHT_BATCHES = 16;
  public static final Duration DEFAULT_ACKNOWLEDGE_INTERVAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(100);

  private String name = DEFAULT_NAME;
  private RetryPolicy retryPolicy = RetryPolicy.exponentialBackoff()
    .setInitialDelay(Duration.ofMillis(500))
    .setMaxDelay(Duration.ofSeconds(30))
    .setMaxAttempts(10);
  private int maxInFlightBatches = DEFAULT_MAX_IN_FLIGHT_BATCHES;
  private Duration acknowledgeInterval = DEFAULT_ACKNOWLEDGE_INTERVAL;
  private Duration pollTimeout = DEFAULT_POLL_TIMEOUT;

  public WorkerOptions() {
  }

  public WorkerOptions(WorkerOptions other) {
    this.name = other.name;
    this.retryPolicy = other.retryPolicy.copy();
    this.maxInFlightBatches = other.maxInFlightBatches;
    this.acknowledgeInterval = other.acknowledgeInterval;
    this.pollTimeout = other.pollTimeout;
  }

  public String getName() {
    return name;
  }

  public WorkerOptions setName(String name) {
    this.name = name;
    return this;
  }

  /**
   * Reconnect policy. Attempts are counted from the last session that delivered data.
   */
  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  public WorkerOptions setRetryPolicy(RetryPolicy retryPolicy) {
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    return this;
  }

  public int getMaxInFlightBatches() {
    return maxInFlightBatches;
  }

  public WorkerOptions setMaxInFlightBatches(int maxInFlightBatches) {
    this.maxInFlightBatches = maxInFlightBatches;
    return this;
  }

  public Duration getAcknowledgeInterval() {
    return acknowledgeInterval;
  }

  public WorkerOptions setAcknowledgeInterval(Duration acknowledgeInterval) {
    this.acknowledgeInterval = acknowledgeInterval;
    return this;
  }

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  public WorkerOptions setPollTimeout(Duration pollTimeout) {
    this.pollTimeout = pollTimeout;
    return this;
  }

  public void validate() {
    OptionValidation.require("name", name);
    OptionValidation.requireMin("maxInFlightBatches", maxInFlightBatches, 1);
    OptionValidation.requireNonNegative("acknowledgeInterval", acknowledgeInterval);
    OptionValidation.requirePositive("pollTimeout", pollTimeout);
    retryPolicy.validate();
  }
}

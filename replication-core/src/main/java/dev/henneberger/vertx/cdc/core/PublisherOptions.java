package dev.henneberger.vertx.cdc.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Batching and retry settings of {@link BatchingChangePublisher}. The request limits default
 * to the PutRecords quotas of Kinesis Data Streams.
 */
public class PublisherOptions {

  public static final int DEFAULT_MAX_BATCH_RECORDS = 500;
  public static final long DEFAULT_MAX_BATCH_BYTES = 5L * 1024 * 1024;
  public static final Duration DEFAULT_MAX_BATCH_DELAY = Duration.ofMillis(200);
  public static final int DEFAULT_MAX_RECORDS_PER_REQUEST = 500;
  public static final long DEFAULT_MAX_REQUEST_BYTES = 5L * 1024 * 1024;
  public static final int DEFAULT_MAX_RECORD_BYTES = 1024 * 1024;

  private int maxBatchRecords = DEFAULT_MAX_BATCH_RECORDS;
  private long maxBatchBytes = DEFAULT_MAX_BATCH_BYTES;
  private Duration maxBatchDelay = DEFAULT_MAX_BATCH_DELAY;
  private int maxRecordsPerRequest = DEFAULT_MAX_RECORDS_PER_REQUEST;
  private long maxRequestBytes = DEFAULT_MAX_REQUEST_BYTES;
  private int maxRecordBytes = DEFAULT_MAX_RECORD_BYTES;
  private RetryPolicy retryPolicy = RetryPolicy.exponentialBackoff()
    .setInitialDelay(Duration.ofMillis(100))
    .setMaxDelay(Duration.ofSeconds(5))
    .setMaxAttempts(10);

  public PublisherOptions() {
  }

  public PublisherOptions(PublisherOptions other) {
    this.maxBatchRecords = other.maxBatchRecords;
    this.maxBatchBytes = other.maxBatchBytes;
    this.maxBatchDelay = other.maxBatchDelay;
    this.maxRecordsPerRequest = other.maxRecordsPerRequest;
    this.maxRequestBytes = other.maxRequestBytes;
    this.maxRecordBytes = other.maxRecordBytes;
    this.retryPolicy = other.retryPolicy.copy();
  }

  public int getMaxBatchRecords() {
    return maxBatchRecords;
  }

  public PublisherOptions setMaxBatchRecords(int maxBatchRecords) {
    this.maxBatchRecords = maxBatchRecords;
    return this;
  }

  public long getMaxBatchBytes() {
    return maxBatchBytes;
  }

  public PublisherOptions setMaxBatchBytes(long maxBatchBytes) {
    this.maxBatchBytes = maxBatchBytes;
    return this;
  }

  public Duration getMaxBatchDelay() {
    return maxBatchDelay;
  }

  public PublisherOptions setMaxBatchDelay(Duration maxBatchDelay) {
    this.maxBatchDelay = maxBatchDelay;
    return this;
  }

  public int getMaxRecordsPerRequest() {
    return maxRecordsPerRequest;
  }

  public PublisherOptions setMaxRecordsPerRequest(int maxRecordsPerRequest) {
    this.maxRecordsPerRequest = maxRecordsPerRequest;
    return this;
  }

  public long getMaxRequestBytes() {
    return maxRequestBytes;
  }

  public PublisherOptions setMaxRequestBytes(long maxRequestBytes) {
    this.maxRequestBytes = maxRequestBytes;
    return this;
  }

  public int getMaxRecordBytes() {
    return maxRecordBytes;
  }

  public PublisherOptions setMaxRecordBytes(int maxRecordBytes) {
    this.maxRecordBytes = maxRecordBytes;
    return this;
  }

  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  public PublisherOptions setRetryPolicy(RetryPolicy retryPolicy) {
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    return this;
  }

  public void validate() {
    OptionValidation.requireMin("maxBatchRecords", maxBatchRecords, 1);
    OptionValidation.requireMin("maxBatchBytes", maxBatchBytes, 1L);
    OptionValidation.requirePositive("maxBatchDelay", maxBatchDelay);
    OptionValidation.requireMin("maxRecordsPerRequest", maxRecordsPerRequest, 1);
    OptionValidation.requireMin("maxRecordBytes", maxRecordBytes, 1);
    if (maxRequestBytes < maxRecordBytes) {
      throw new IllegalArgumentException("maxRequestBytes must be >= maxRecordBytes");
    }
    retryPolicy.validate();
  }
}

package dev.henneberger.vertx.cdc.kinesis;

import dev.henneberger.vertx.cdc.core.RecordSink;
import dev.henneberger.vertx.cdc.core.SinkRecord;
import dev.henneberger.vertx.cdc.core.SinkWriteResult;
import io.vertx.core.Future;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kinesis.KinesisAsyncClient;
import software.amazon.awssdk.services.kinesis.KinesisAsyncClientBuilder;
import software.amazon.awssdk.services.kinesis.model.LimitExceededException;
import software.amazon.awssdk.services.kinesis.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequestEntry;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResultEntry;

/**
 * Writes records to a Kinesis data stream with {@code PutRecords}.
 *
 * <p>{@code PutRecords} is not atomic: the response lists a result per entry, in request
 * order, and entries with an error code were not written. Entries of one request are not
 * guaranteed to be stored in request order, which callers handle by never sending two records
 * with the same partition key together.
 */
public class KinesisRecordSink implements RecordSink {

  private static final Logger LOG = LoggerFactory.getLogger(KinesisRecordSink.class);

  static final String THROUGHPUT_EXCEEDED = "ProvisionedThroughputExceededException";
  static final String INTERNAL_FAILURE = "InternalFailure";

  private final KinesisAsyncClient client;
  private final String streamName;
  private final boolean ownsClient;

  public KinesisRecordSink(KinesisSinkOptions options) {
    this(buildClient(validated(options)), options.getStreamName(), true);
  }

  /**
   * Uses a caller managed client; {@link #close()} leaves it open.
   */
  public KinesisRecordSink(KinesisAsyncClient client, String streamName) {
    this(client, streamName, false);
  }

  private KinesisRecordSink(KinesisAsyncClient client, String streamName, boolean ownsClient) {
    this.client = Objects.requireNonNull(client, "client");
    this.streamName = Objects.requireNonNull(streamName, "streamName");
    this.ownsClient = ownsClient;
  }

  @Override
  public String name() {
    return "kinesis:" + streamName;
  }

  @Override
  public Future<SinkWriteResult> write(List<SinkRecord> records) {
    if (records.isEmpty()) {
      return Future.succeededFuture(SinkWriteResult.success());
    }
    List<PutRecordsRequestEntry> entries = new ArrayList<>(records.size());
    for (SinkRecord record : records) {
      entries.add(PutRecordsRequestEntry.builder()
        .partitionKey(record.partitionKey())
        .data(SdkBytes.fromByteArray(record.data()))
        .build());
    }
    PutRecordsRequest request = PutRecordsRequest.builder()
      .streamName(streamName)
      .records(entries)
      .build();

    try {
      return Future.fromCompletionStage(client.putRecords(request))
        .map(response -> toResult(response, records.size()));
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }
  }

  SinkWriteResult toResult(PutRecordsResponse response, int requested) {
    Integer failedCount = response.failedRecordCount();
    if (failedCount == null || failedCount == 0) {
      return SinkWriteResult.success();
    }
    List<PutRecordsResultEntry> results = response.records();
    if (results.size() != requested) {
      throw new IllegalStateException("PutRecords on " + streamName + " returned " + results.size()
        + " results for " + requested + " records");
    }
    List<SinkWriteResult.RecordFailure> failures = new ArrayList<>(failedCount);
    for (int i = 0; i < results.size(); i++) {
      PutRecordsResultEntry entry = results.get(i);
      if (entry.errorCode() == null) {
        continue;
      }
      failures.add(new SinkWriteResult.RecordFailure(i, entry.errorCode(), entry.errorMessage(),
        isRetryableRecordError(entry.errorCode())));
    }
    LOG.debug("PutRecords on {} rejected {} of {} records", streamName, failures.size(), requested);
    return SinkWriteResult.withFailures(failures);
  }

  static boolean isRetryableRecordError(String errorCode) {
    return THROUGHPUT_EXCEEDED.equals(errorCode) || INTERNAL_FAILURE.equals(errorCode);
  }

  @Override
  public boolean isRetryable(Throwable error) {
    Throwable cause = unwrap(error);
    if (cause instanceof ProvisionedThroughputExceededException
      || cause instanceof LimitExceededException
      || cause instanceof ApiCallTimeoutException
      || cause instanceof ApiCallAttemptTimeoutException) {
      return true;
    }
    if (cause instanceof SdkServiceException) {
      SdkServiceException service = (SdkServiceException) cause;
      return service.statusCode() >= 500 || service.isThrottlingException();
    }
    if (cause instanceof SdkClientException) {
      return true;
    }
    return cause instanceof SdkException && ((SdkException) cause).retryable();
  }

  @Override
  public void close() {
    if (ownsClient) {
      client.close();
    }
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
      && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static KinesisSinkOptions validated(KinesisSinkOptions options) {
    Objects.requireNonNull(options, "options").validate();
    return options;
  }

  private static KinesisAsyncClient buildClient(KinesisSinkOptions options) {
    KinesisAsyncClientBuilder builder = KinesisAsyncClient.builder()
      .overrideConfiguration(ClientOverrideConfiguration.builder()
        .apiCallTimeout(options.getApiCallTimeout())
        .build());
    if (options.getRegion() != null && !options.getRegion().isBlank()) {
      builder.region(Region.of(options.getRegion()));
    }
    if (options.getEndpointOverride() != null) {
      builder.endpointOverride(URI.create(options.getEndpointOverride()));
    }
    LOG.info("Writing to Kinesis stream {} in {}{}", options.getStreamName(),
      options.getRegion() == null ? "the default region" : options.getRegion(),
      options.getEndpointOverride() == null ? "" : " via " + options.getEndpointOverride());
    return builder.build();
  }
}

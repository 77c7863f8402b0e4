package dev.henneberger.vertx.cdc.core;

import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes committed transactions to a {@link RecordSink}.
 *
 * <p>Whole transactions are accumulated until one of the batching thresholds is reached,
 * then written as a sequence of sink requests. Flushes never overlap and requests are sent one
 * at a time. A sink may store the records of one request in any order, so a request never
 * carries two records with the same partition key; records sharing a key therefore reach the
 * sink in commit order. Rejected records are resent together with every later record of the
 * same partition key, which may produce duplicates but never reorders a key.
 *
 * <p>All mutable state is confined to the Vert.x context the publisher was created on;
 * {@link #publish} and {@link #flush} may be called from any thread.
 */
public class BatchingChangePublisher implements ChangePublisher {

  private static final Logger LOG = LoggerFactory.getLogger(BatchingChangePublisher.class);

  private final Vertx vertx;
  private final Context context;
  private final RecordSink sink;
  private final PublisherOptions options;
  private final ChangeEventSerializer serializer;

  private final List<PendingBatch> pending = new ArrayList<>();
  private int pendingRecords;
  private long pendingBytes;
  private long flushTimerId = -1;
  private Future<Void> lastFlush = Future.succeededFuture();
  private PublishException failure;
  private volatile boolean closed;

  public BatchingChangePublisher(Vertx vertx, RecordSink sink, PublisherOptions options) {
    this(vertx, sink, options, new ChangeEventSerializer());
  }

  public BatchingChangePublisher(Vertx vertx,
                                 RecordSink sink,
                                 PublisherOptions options,
                                 ChangeEventSerializer serializer) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.options = new PublisherOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.context = vertx.getOrCreateContext();
  }

  @Override
  public Future<Long> publish(TransactionBatch batch) {
    Objects.requireNonNull(batch, "batch");
    Promise<Long> promise = Promise.promise();
    context.runOnContext(v -> enqueue(batch, promise));
    return promise.future();
  }

  @Override
  public Future<Void> flush() {
    Promise<Void> promise = Promise.promise();
    context.runOnContext(v -> flushPending().onComplete(promise));
    return promise.future();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    context.runOnContext(v -> {
      cancelFlushTimer();
      PublishException closedError = new PublishException("publisher closed with unsent batches");
      for (PendingBatch batch : pending) {
        batch.promise.tryFail(closedError);
      }
      pending.clear();
      pendingRecords = 0;
      pendingBytes = 0;
      lastFlush.onComplete(ar -> sink.close());
    });
  }

  private void enqueue(TransactionBatch batch, Promise<Long> promise) {
    if (failure != null) {
      promise.fail(failure);
      return;
    }
    if (closed) {
      promise.fail(new PublishException("publisher is closed"));
      return;
    }
    if (batch.isEmpty()) {
      promise.complete(batch.commitPosition());
      return;
    }

    List<SinkRecord> records = serializer.toRecords(batch);
    long bytes = 0;
    for (SinkRecord record : records) {
      if (record.size() > options.getMaxRecordBytes()) {
        failure = new PublishException("record " + record.idempotencyKey() + " of " + batch
          + " is " + record.size() + " bytes, above the limit of " + options.getMaxRecordBytes());
        LOG.error("Refusing {}; no further batches will be accepted", batch, failure);
        promise.fail(failure);
        return;
      }
      bytes += record.size();
    }

    pending.add(new PendingBatch(batch, records, promise));
    pendingRecords += records.size();
    pendingBytes += bytes;

    if (pendingRecords >= options.getMaxBatchRecords() || pendingBytes >= options.getMaxBatchBytes()) {
      flushPending();
    } else if (flushTimerId < 0) {
      flushTimerId = vertx.setTimer(options.getMaxBatchDelay().toMillis(), id -> {
        flushTimerId = -1;
        flushPending();
      });
    }
  }

  private Future<Void> flushPending() {
    cancelFlushTimer();
    if (pending.isEmpty()) {
      return lastFlush;
    }
    List<PendingBatch> batches = new ArrayList<>(pending);
    pending.clear();
    pendingRecords = 0;
    pendingBytes = 0;
    lastFlush = lastFlush.transform(ignored -> send(batches));
    return lastFlush;
  }

  private void cancelFlushTimer() {
    if (flushTimerId >= 0) {
      vertx.cancelTimer(flushTimerId);
      flushTimerId = -1;
    }
  }

  private Future<Void> send(List<PendingBatch> batches) {
    if (failure != null) {
      for (PendingBatch batch : batches) {
        batch.promise.tryFail(failure);
      }
      return Future.failedFuture(failure);
    }

    Future<Void> chain = Future.succeededFuture();
    for (List<SinkRecord> request : split(batches)) {
      chain = chain.compose(v -> sendWithRetry(request));
    }

    return chain.transform(ar -> {
      if (ar.succeeded()) {
        for (PendingBatch batch : batches) {
          batch.promise.tryComplete(batch.batch.commitPosition());
        }
        return Future.succeededFuture();
      }
      Throwable cause = ar.cause();
      failure = cause instanceof PublishException
        ? (PublishException) cause
        : new PublishException("publishing to " + sink.name() + " failed", cause);
      LOG.error("Publishing {} batch(es) to {} failed; no further batches will be accepted",
        batches.size(), sink.name(), failure);
      for (PendingBatch batch : batches) {
        batch.promise.tryFail(failure);
      }
      return Future.failedFuture(failure);
    });
  }

  private List<List<SinkRecord>> split(List<PendingBatch> batches) {
    List<List<SinkRecord>> requests = new ArrayList<>();
    List<SinkRecord> current = new ArrayList<>();
    Set<String> currentKeys = new HashSet<>();
    long currentBytes = 0;
    for (PendingBatch batch : batches) {
      for (SinkRecord record : batch.records) {
        if (!current.isEmpty()
          && (current.size() >= options.getMaxRecordsPerRequest()
          || currentBytes + record.size() > options.getMaxRequestBytes()
          || currentKeys.contains(record.partitionKey()))) {
          requests.add(current);
          current = new ArrayList<>();
          currentKeys.clear();
          currentBytes = 0;
        }
        current.add(record);
        currentKeys.add(record.partitionKey());
        currentBytes += record.size();
      }
    }
    if (!current.isEmpty()) {
      requests.add(current);
    }
    return requests;
  }

  private Future<Void> sendWithRetry(List<SinkRecord> records) {
    Promise<Void> done = Promise.promise();
    tryWrite(records, 1, done);
    return done.future();
  }

  private void tryWrite(List<SinkRecord> records, long attempt, Promise<Void> done) {
    Future<SinkWriteResult> write;
    try {
      write = sink.write(records);
    } catch (RuntimeException e) {
      write = Future.failedFuture(e);
    }
    // sink callbacks may arrive on client threads
    write.onComplete(ar -> context.runOnContext(v -> handleWrite(records, attempt, ar, done)));
  }

  private void handleWrite(List<SinkRecord> records,
                           long attempt,
                           AsyncResult<SinkWriteResult> ar,
                           Promise<Void> done) {
    if (ar.failed()) {
      Throwable err = ar.cause();
      if (!sink.isRetryable(err)) {
        done.fail(new PublishException(sink.name() + " rejected a request of " + records.size()
          + " record(s): " + err.getMessage(), err));
        return;
      }
      retryLater(records, attempt, err, done);
      return;
    }

    SinkWriteResult result = ar.result();
    if (result.allSucceeded()) {
      done.complete();
      return;
    }
    for (SinkWriteResult.RecordFailure recordFailure : result.failures()) {
      if (!recordFailure.retryable()) {
        done.fail(new PublishException(sink.name() + " rejected record "
          + records.get(recordFailure.index()).idempotencyKey() + ": " + recordFailure));
        return;
      }
    }
    List<SinkRecord> remaining = remainingAfter(records, result);
    retryLater(remaining, attempt, new PublishException(result.failures().size() + " of " + records.size()
      + " record(s) rejected by " + sink.name() + ", first " + result.failures().get(0)), done);
  }

  private void retryLater(List<SinkRecord> records, long attempt, Throwable err, Promise<Void> done) {
    RetryPolicy retryPolicy = options.getRetryPolicy();
    if (closed || !retryPolicy.shouldRetry(err, attempt)) {
      done.fail(new PublishException("giving up on " + records.size() + " record(s) after "
        + attempt + " attempt(s)", err));
      return;
    }
    long delay = retryPolicy.computeDelayMillis(attempt);
    LOG.warn("Retrying {} record(s) to {} in {} ms (attempt {}): {}",
      records.size(), sink.name(), delay, attempt + 1, err.getMessage());
    vertx.setTimer(Math.max(1L, delay), id -> tryWrite(records, attempt + 1, done));
  }

  /**
   * Every rejected record plus all later records sharing its partition key.
   */
  static List<SinkRecord> remainingAfter(List<SinkRecord> records, SinkWriteResult result) {
    Set<Integer> rejected = new HashSet<>();
    for (SinkWriteResult.RecordFailure recordFailure : result.failures()) {
      rejected.add(recordFailure.index());
    }
    Set<String> blockedKeys = new HashSet<>();
    List<SinkRecord> remaining = new ArrayList<>();
    for (int i = 0; i < records.size(); i++) {
      SinkRecord record = records.get(i);
      if (rejected.contains(i)) {
        blockedKeys.add(record.partitionKey());
      }
      if (blockedKeys.contains(record.partitionKey())) {
        remaining.add(record);
      }
    }
    return remaining;
  }

  private static final class PendingBatch {
    private final TransactionBatch batch;
    private final List<SinkRecord> records;
    private final Promise<Long> promise;

    private PendingBatch(TransactionBatch batch, List<SinkRecord> records, Promise<Long> promise) {
      this.batch = batch;
      this.records = records;
      this.promise = promise;
    }
  }
}

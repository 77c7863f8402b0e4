package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory sink answering requests from a queue of scripted responses; unscripted requests
 * succeed.
 */
final class FakeRecordSink implements RecordSink {

  static final class ThrottledException extends RuntimeException {
    ThrottledException() {
      super("Rate exceeded for shard shardId-000000000000");
    }
  }

  final List<List<SinkRecord>> requests = new CopyOnWriteArrayList<>();
  final List<SinkRecord> accepted = new CopyOnWriteArrayList<>();
  private final Deque<Function<List<SinkRecord>, Future<SinkWriteResult>>> responses = new ConcurrentLinkedDeque<>();
  volatile boolean closed;

  FakeRecordSink respond(Function<List<SinkRecord>, Future<SinkWriteResult>> response) {
    responses.add(response);
    return this;
  }

  FakeRecordSink throttle(int times) {
    for (int i = 0; i < times; i++) {
      respond(records -> Future.failedFuture(new ThrottledException()));
    }
    return this;
  }

  FakeRecordSink rejectRecords(boolean retryable, int... indexes) {
    return respond(records -> {
      List<SinkWriteResult.RecordFailure> failures = new ArrayList<>();
      for (int index : indexes) {
        failures.add(new SinkWriteResult.RecordFailure(index,
          retryable ? "ProvisionedThroughputExceededException" : "ValidationException", "scripted", retryable));
      }
      return Future.succeededFuture(SinkWriteResult.withFailures(failures));
    });
  }

  @Override
  public String name() {
    return "fake";
  }

  @Override
  public Future<SinkWriteResult> write(List<SinkRecord> records) {
    requests.add(List.copyOf(records));
    Function<List<SinkRecord>, Future<SinkWriteResult>> response = responses.poll();
    Future<SinkWriteResult> result = response == null
      ? Future.succeededFuture(SinkWriteResult.success())
      : response.apply(records);
    if (result.succeeded()) {
      Set<Integer> rejected = new HashSet<>();
      for (SinkWriteResult.RecordFailure failure : result.result().failures()) {
        rejected.add(failure.index());
      }
      for (int i = 0; i < records.size(); i++) {
        if (!rejected.contains(i)) {
          accepted.add(records.get(i));
        }
      }
    }
    return result;
  }

  @Override
  public boolean isRetryable(Throwable error) {
    return error instanceof ThrottledException;
  }

  @Override
  public void close() {
    closed = true;
  }
}

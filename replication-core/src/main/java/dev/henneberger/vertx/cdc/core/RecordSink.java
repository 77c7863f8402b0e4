package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;
import java.util.List;

/**
 * An append-only, partition-keyed stream. Records sharing a partition key must be kept in
 * the order of the list.
 */
public interface RecordSink extends AutoCloseable {

  String name();

  /**
   * Writes {@code records} as one request. Per-record rejections are reported in the
   * result; a failed future means the whole request was rejected.
   */
  Future<SinkWriteResult> write(List<SinkRecord> records);

  /**
   * Whether a failed {@link #write} may be repeated, e.g. throttling or a timeout.
   */
  boolean isRetryable(Throwable error);

  @Override
  default void close() {
  }
}

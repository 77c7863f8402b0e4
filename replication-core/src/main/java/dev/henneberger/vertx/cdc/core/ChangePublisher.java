package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;

public interface ChangePublisher extends AutoCloseable {

  /**
   * Hands a committed transaction to the sink.
   *
   * @return the batch commit position once every event of the batch was durably accepted,
   *   or a failed future carrying a {@link PublishException}
   */
  Future<Long> publish(TransactionBatch batch);

  /**
   * Sends whatever is buffered without waiting for the batching thresholds.
   */
  Future<Void> flush();

  @Override
  void close();
}

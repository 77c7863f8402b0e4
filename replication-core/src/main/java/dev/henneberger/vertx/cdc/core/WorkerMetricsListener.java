package dev.henneberger.vertx.cdc.core;

public interface WorkerMetricsListener {
  default void onBatchPublished(TransactionBatch batch) {
  }

  default void onDecodeFailure(String payload, Throwable error) {
  }

  default void onStateChange(WorkerStateChange stateChange) {
  }

  default void onPositionAcknowledged(String slotName, long position) {
  }
}

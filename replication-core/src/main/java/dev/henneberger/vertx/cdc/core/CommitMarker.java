package dev.henneberger.vertx.cdc.core;

import java.time.Instant;

public final class CommitMarker {

  private final Long transactionId;
  private final long commitPosition;
  private final Instant commitTimestamp;

  public CommitMarker(Long transactionId, long commitPosition, Instant commitTimestamp) {
    this.transactionId = transactionId;
    this.commitPosition = commitPosition;
    this.commitTimestamp = commitTimestamp;
  }

  public Long transactionId() {
    return transactionId;
  }

  public long commitPosition() {
    return commitPosition;
  }

  public Instant commitTimestamp() {
    return commitTimestamp;
  }
}

package dev.henneberger.vertx.cdc.core;

import java.util.List;

/**
 * Outcome of one sink request. Indexes refer to the request's record list.
 */
public final class SinkWriteResult {

  private static final SinkWriteResult SUCCESS = new SinkWriteResult(List.of());

  private final List<RecordFailure> failures;

  private SinkWriteResult(List<RecordFailure> failures) {
    this.failures = List.copyOf(failures);
  }

  public static SinkWriteResult success() {
    return SUCCESS;
  }

  public static SinkWriteResult withFailures(List<RecordFailure> failures) {
    return failures == null || failures.isEmpty() ? SUCCESS : new SinkWriteResult(failures);
  }

  public boolean allSucceeded() {
    return failures.isEmpty();
  }

  public List<RecordFailure> failures() {
    return failures;
  }

  public static final class RecordFailure {
    private final int index;
    private final String errorCode;
    private final String errorMessage;
    private final boolean retryable;

    public RecordFailure(int index, String errorCode, String errorMessage, boolean retryable) {
      this.index = index;
      this.errorCode = errorCode;
      this.errorMessage = errorMessage;
      this.retryable = retryable;
    }

    public int index() {
      return index;
    }

    public String errorCode() {
      return errorCode;
    }

    public String errorMessage() {
      return errorMessage;
    }

    public boolean retryable() {
      return retryable;
    }

    @Override
    public String toString() {
      return "#" + index + ' ' + errorCode + (errorMessage == null ? "" : ": " + errorMessage);
    }
  }
}

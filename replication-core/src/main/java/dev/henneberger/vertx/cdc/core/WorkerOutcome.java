package dev.henneberger.vertx.cdc.core;

import java.util.Optional;

public final class WorkerOutcome {

  private final WorkerState state;
  private final long confirmedPosition;
  private final WorkerFailure failure;

  public WorkerOutcome(WorkerState state, long confirmedPosition, WorkerFailure failure) {
    this.state = state;
    this.confirmedPosition = confirmedPosition;
    this.failure = failure;
  }

  public WorkerState state() {
    return state;
  }

  public long confirmedPosition() {
    return confirmedPosition;
  }

  public Optional<WorkerFailure> failure() {
    return Optional.ofNullable(failure);
  }

  public boolean failed() {
    return state == WorkerState.FAILED;
  }

  public int exitCode() {
    return failed() ? 1 : 0;
  }
}

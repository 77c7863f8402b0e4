package dev.henneberger.vertx.cdc.core;

public final class WorkerStateChange {
  private final WorkerState previousState;
  private final WorkerState state;
  private final Throwable cause;
  private final long attempt;
  private final long confirmedPosition;

  public WorkerStateChange(WorkerState previousState,
                           WorkerState state,
                           Throwable cause,
                           long attempt,
                           long confirmedPosition) {
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
    this.attempt = attempt;
    this.confirmedPosition = confirmedPosition;
  }

  public WorkerState previousState() {
    return previousState;
  }

  public WorkerState state() {
    return state;
  }

  public Throwable cause() {
    return cause;
  }

  public long attempt() {
    return attempt;
  }

  public long confirmedPosition() {
    return confirmedPosition;
  }
}

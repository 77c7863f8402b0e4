package dev.henneberger.vertx.cdc.core;

public enum WorkerState {
  CREATED,
  STARTING,
  STREAMING,
  RECOVERING,
  STOPPED,
  FAILED;

  public boolean isTerminal() {
    return this == STOPPED || this == FAILED;
  }
}

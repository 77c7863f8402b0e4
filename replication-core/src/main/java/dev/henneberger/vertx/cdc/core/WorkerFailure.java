package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * What an operator needs to see when the worker halts: where it was, how far it got and why.
 */
public final class WorkerFailure {

  private final WorkerState failedIn;
  private final long lastConfirmedPosition;
  private final Throwable cause;

  public WorkerFailure(WorkerState failedIn, long lastConfirmedPosition, Throwable cause) {
    this.failedIn = Objects.requireNonNull(failedIn, "failedIn");
    this.lastConfirmedPosition = lastConfirmedPosition;
    this.cause = Objects.requireNonNull(cause, "cause");
  }

  public WorkerState failedIn() {
    return failedIn;
  }

  public long lastConfirmedPosition() {
    return lastConfirmedPosition;
  }

  public Throwable cause() {
    return cause;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("state", failedIn.name())
      .put("lastConfirmedPosition", LogPosition.format(lastConfirmedPosition))
      .put("error", cause.getClass().getSimpleName())
      .put("detail", String.valueOf(cause.getMessage()));
    if (cause instanceof DecodeException) {
      json.put("payload", ((DecodeException) cause).payload());
    }
    if (cause instanceof SlotInvalidException) {
      json.put("slot", ((SlotInvalidException) cause).slotName());
    }
    return json;
  }

  @Override
  public String toString() {
    return toJson().encode();
  }
}

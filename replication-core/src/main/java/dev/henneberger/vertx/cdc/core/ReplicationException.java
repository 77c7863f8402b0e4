package dev.henneberger.vertx.cdc.core;

/**
 * Base class of the failures the worker distinguishes. Transient failures are recovered by
 * reconnecting; everything else halts forward progress until an operator intervenes.
 */
public abstract class ReplicationException extends RuntimeException {

  protected ReplicationException(String message) {
    super(message);
  }

  protected ReplicationException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract boolean isTransient();
}

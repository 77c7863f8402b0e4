package dev.henneberger.vertx.cdc.core;

/**
 * The replication connection broke while streaming.
 */
public class StreamException extends ReplicationException {

  public StreamException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isTransient() {
    return true;
  }
}

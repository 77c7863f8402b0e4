package dev.henneberger.vertx.cdc.core;

/**
 * A batch could not be written to the sink within the retry budget, or was rejected
 * outright. The batch stays unconfirmed.
 */
public class PublishException extends ReplicationException {

  public PublishException(String message) {
    super(message);
  }

  public PublishException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isTransient() {
    return false;
  }
}

package dev.henneberger.vertx.cdc.core;

/**
 * A payload from the change stream could not be decoded. Carries the raw payload so the
 * operator can see exactly what the plugin emitted.
 */
public class DecodeException extends ReplicationException {

  private final String payload;
  private final long position;

  public DecodeException(String message, String payload, long position) {
    super(message + " at " + LogPosition.format(position));
    this.payload = payload;
    this.position = position;
  }

  public DecodeException(String message, String payload, long position, Throwable cause) {
    super(message + " at " + LogPosition.format(position), cause);
    this.payload = payload;
    this.position = position;
  }

  public String payload() {
    return payload;
  }

  public long position() {
    return position;
  }

  @Override
  public boolean isTransient() {
    return false;
  }
}

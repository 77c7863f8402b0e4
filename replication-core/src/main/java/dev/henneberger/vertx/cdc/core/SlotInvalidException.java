package dev.henneberger.vertx.cdc.core;

/**
 * The replication slot is gone, was invalidated, or does not match the configuration.
 * Resuming would silently skip changes, so this is never retried.
 */
public class SlotInvalidException extends ReplicationException {

  private final String slotName;

  public SlotInvalidException(String slotName, String message) {
    super(message);
    this.slotName = slotName;
  }

  public SlotInvalidException(String slotName, String message, Throwable cause) {
    super(message, cause);
    this.slotName = slotName;
  }

  public String slotName() {
    return slotName;
  }

  @Override
  public boolean isTransient() {
    return false;
  }
}

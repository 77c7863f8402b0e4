package dev.henneberger.vertx.cdc.core;

@FunctionalInterface
public interface ReplicationSessionFactory {

  /**
   * Attaches to the configured slot, creating it on first use.
   *
   * @throws ConnectionException if the source cannot be reached
   * @throws SlotInvalidException if the slot disappeared or was invalidated
   */
  ReplicationSession open();
}

package dev.henneberger.vertx.cdc.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One serialized change event as written to the streaming sink.
 */
public final class SinkRecord {

  private final String partitionKey;
  private final byte[] data;
  private final String idempotencyKey;

  public SinkRecord(String partitionKey, byte[] data, String idempotencyKey) {
    this.partitionKey = Objects.requireNonNull(partitionKey, "partitionKey");
    this.data = Objects.requireNonNull(data, "data");
    this.idempotencyKey = idempotencyKey;
  }

  public String partitionKey() {
    return partitionKey;
  }

  public byte[] data() {
    return data;
  }

  public String idempotencyKey() {
    return idempotencyKey;
  }

  /**
   * Bytes this record counts against sink request limits: payload plus partition key.
   */
  public int size() {
    return data.length + partitionKey.getBytes(StandardCharsets.UTF_8).length;
  }
}

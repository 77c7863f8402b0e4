package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One row-level mutation decoded from the change stream.
 *
 * <p>Events leave the decoder without transaction metadata when the plugin emits rows
 * ahead of their commit record; {@link TransactionAssembler} stamps the transaction id,
 * commit timestamp, commit position and sequence once the commit is seen.
 */
public final class ChangeEvent {

  /**
   * The row operation type.
   */
  public enum Operation {
    INSERT,
    UPDATE,
    DELETE;

    public String kind() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final String schema;
  private final String table;
  private final Operation operation;
  private final Map<String, Object> newValues;
  private final Map<String, Object> oldValues;
  private final long position;
  private final Long transactionId;
  private final Instant commitTimestamp;
  private final long commitPosition;
  private final int sequence;

  public ChangeEvent(String schema,
                     String table,
                     Operation operation,
                     Map<String, Object> newValues,
                     Map<String, Object> oldValues,
                     long position) {
    this(schema, table, operation, newValues, oldValues, position, null, null, LogPosition.INVALID, 0);
  }

  public ChangeEvent(String schema,
                     String table,
                     Operation operation,
                     Map<String, Object> newValues,
                     Map<String, Object> oldValues,
                     long position,
                     Long transactionId,
                     Instant commitTimestamp,
                     long commitPosition,
                     int sequence) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.table = Objects.requireNonNull(table, "table");
    this.operation = Objects.requireNonNull(operation, "operation");
    this.newValues = unmodifiableCopy(newValues);
    this.oldValues = unmodifiableCopy(oldValues);
    this.position = position;
    this.transactionId = transactionId;
    this.commitTimestamp = commitTimestamp;
    this.commitPosition = commitPosition;
    this.sequence = sequence;
  }

  /**
   * Returns a copy carrying the metadata of the transaction this event committed in.
   * Events without a row position of their own inherit the commit position.
   */
  public ChangeEvent stamp(Long transactionId, Instant commitTimestamp, long commitPosition, int sequence) {
    long rowPosition = position == LogPosition.INVALID ? commitPosition : position;
    return new ChangeEvent(schema, table, operation, newValues, oldValues, rowPosition,
      transactionId, commitTimestamp, commitPosition, sequence);
  }

  public String getSchema() {
    return schema;
  }

  public String getTable() {
    return table;
  }

  public String qualifiedTable() {
    return schema + "." + table;
  }

  public Operation getOperation() {
    return operation;
  }

  public Map<String, Object> getNewValues() {
    return newValues;
  }

  public Map<String, Object> getOldValues() {
    return oldValues;
  }

  public long getPosition() {
    return position;
  }

  public Long getTransactionId() {
    return transactionId;
  }

  public Instant getCommitTimestamp() {
    return commitTimestamp;
  }

  public long getCommitPosition() {
    return commitPosition;
  }

  public int getSequence() {
    return sequence;
  }

  /**
   * Key downstream consumers use to drop re-delivered events.
   */
  public String idempotencyKey() {
    return (transactionId == null ? "-" : String.valueOf(transactionId))
      + ':' + LogPosition.format(commitPosition)
      + ':' + sequence;
  }

  public Map<String, Object> rowOrKeys() {
    return !newValues.isEmpty() ? newValues : oldValues;
  }

  public String string(String column) {
    Object value = rowOrKeys().get(column);
    return value == null ? null : String.valueOf(value);
  }

  public Long longValue(String column) {
    Object value = rowOrKeys().get(column);
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    if (value instanceof String) {
      try {
        return Long.valueOf((String) value);
      } catch (NumberFormatException ignore) {
        return null;
      }
    }
    return null;
  }

  public BigDecimal decimal(String column) {
    Object value = rowOrKeys().get(column);
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof Number || value instanceof String) {
      try {
        return new BigDecimal(String.valueOf(value));
      } catch (NumberFormatException ignore) {
        return null;
      }
    }
    return null;
  }

  public JsonObject newValuesJson() {
    return new JsonObject(new LinkedHashMap<>(newValues));
  }

  public JsonObject oldValuesJson() {
    return new JsonObject(new LinkedHashMap<>(oldValues));
  }

  @Override
  public String toString() {
    return "ChangeEvent{" +
      "table='" + qualifiedTable() + '\'' +
      ", operation=" + operation +
      ", newValues=" + newValues +
      ", oldValues=" + oldValues +
      ", xid=" + transactionId +
      ", commitTimestamp=" + commitTimestamp +
      ", position=" + LogPosition.format(position) +
      ", sequence=" + sequence +
      '}';
  }

  private static Map<String, Object> unmodifiableCopy(Map<String, Object> data) {
    if (data == null || data.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}

package dev.henneberger.vertx.cdc.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The events of one committed transaction, in source statement order.
 */
public final class TransactionBatch {

  private final Long transactionId;
  private final Instant commitTimestamp;
  private final long commitPosition;
  private final List<ChangeEvent> events;

  public TransactionBatch(Long transactionId, Instant commitTimestamp, long commitPosition, List<ChangeEvent> events) {
    this.transactionId = transactionId;
    this.commitTimestamp = commitTimestamp;
    this.commitPosition = commitPosition;
    this.events = events == null ? Collections.emptyList() : List.copyOf(events);
  }

  public Long transactionId() {
    return transactionId;
  }

  public Instant commitTimestamp() {
    return commitTimestamp;
  }

  public long commitPosition() {
    return commitPosition;
  }

  public List<ChangeEvent> events() {
    return events;
  }

  public int size() {
    return events.size();
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }

  public Set<String> tables() {
    Set<String> tables = new LinkedHashSet<>();
    for (ChangeEvent event : events) {
      tables.add(event.qualifiedTable());
    }
    return tables;
  }

  @Override
  public String toString() {
    return "TransactionBatch{xid=" + transactionId
      + ", commitPosition=" + LogPosition.format(commitPosition)
      + ", events=" + events.size() + '}';
  }
}

package dev.henneberger.vertx.cdc.core;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of decoding a single {@link RawSegment}. Depending on the plugin output format a
 * segment holds a whole transaction (rows plus commit), a begin marker, a single row, a
 * commit marker alone, or nothing at all (keepalives and other control messages).
 */
public final class DecodedSegment {

  private final RawSegment source;
  private final Long beginTransactionId;
  private final List<ChangeEvent> events;
  private final CommitMarker commit;

  private DecodedSegment(RawSegment source, Long beginTransactionId, List<ChangeEvent> events, CommitMarker commit) {
    this.source = Objects.requireNonNull(source, "source");
    this.beginTransactionId = beginTransactionId;
    this.events = events == null ? Collections.emptyList() : List.copyOf(events);
    this.commit = commit;
  }

  public static DecodedSegment empty(RawSegment source) {
    return new DecodedSegment(source, null, null, null);
  }

  public static DecodedSegment begin(RawSegment source, Long transactionId) {
    return new DecodedSegment(source, transactionId == null ? Long.valueOf(-1L) : transactionId, null, null);
  }

  public static DecodedSegment rows(RawSegment source, List<ChangeEvent> events) {
    return new DecodedSegment(source, null, events, null);
  }

  public static DecodedSegment commit(RawSegment source, CommitMarker commit) {
    return new DecodedSegment(source, null, null, Objects.requireNonNull(commit, "commit"));
  }

  public static DecodedSegment transaction(RawSegment source, List<ChangeEvent> events, CommitMarker commit) {
    return new DecodedSegment(source, null, events, Objects.requireNonNull(commit, "commit"));
  }

  public RawSegment source() {
    return source;
  }

  public boolean isBegin() {
    return beginTransactionId != null;
  }

  /**
   * Transaction id announced by a begin marker, {@code -1} when the plugin omitted it.
   */
  public Long beginTransactionId() {
    return beginTransactionId;
  }

  public List<ChangeEvent> events() {
    return events;
  }

  public CommitMarker commitMarker() {
    return commit;
  }

  public boolean isEmpty() {
    return beginTransactionId == null && events.isEmpty() && commit == null;
  }
}

package dev.henneberger.vertx.cdc.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Groups decoded rows into committed transactions. A batch is only produced once its
 * commit marker is seen, so nothing of an open transaction ever reaches the sink.
 *
 * <p>Not thread-safe; owned by the worker thread.
 */
public final class TransactionAssembler {

  private final List<ChangeEvent> open = new ArrayList<>();
  private Long openTransactionId;
  private boolean inTransaction;

  public Optional<TransactionBatch> accept(DecodedSegment segment) {
    RawSegment source = segment.source();
    if (segment.isBegin()) {
      if (inTransaction) {
        throw new DecodeException("begin of transaction " + segment.beginTransactionId()
          + " while transaction " + openTransactionId + " is still open", source.payload(), source.position());
      }
      inTransaction = true;
      openTransactionId = segment.beginTransactionId() < 0 ? null : segment.beginTransactionId();
    }

    if (!segment.events().isEmpty()) {
      inTransaction = true;
      open.addAll(segment.events());
    }

    CommitMarker commit = segment.commitMarker();
    if (commit == null) {
      return Optional.empty();
    }

    Long xid = commit.transactionId() != null ? commit.transactionId() : openTransactionId;
    List<ChangeEvent> stamped = new ArrayList<>(open.size());
    for (int i = 0; i < open.size(); i++) {
      stamped.add(open.get(i).stamp(xid, commit.commitTimestamp(), commit.commitPosition(), i));
    }
    reset();
    return Optional.of(new TransactionBatch(xid, commit.commitTimestamp(), commit.commitPosition(), stamped));
  }

  public boolean hasOpenTransaction() {
    return inTransaction;
  }

  public int bufferedEvents() {
    return open.size();
  }

  /**
   * Drops a partially received transaction; the source re-sends it after reconnecting.
   */
  public void reset() {
    open.clear();
    openTransactionId = null;
    inTransaction = false;
  }
}

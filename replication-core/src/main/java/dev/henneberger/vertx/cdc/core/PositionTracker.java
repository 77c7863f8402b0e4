package dev.henneberger.vertx.cdc.core;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Owns the confirmed position: the highest commit position for which every earlier
 * transaction has been durably accepted by the sink. It never moves backwards, and it only
 * moves across a contiguous run of confirmed transactions, so a later batch that finishes
 * first waits for its predecessors.
 */
public final class PositionTracker {

  private final NavigableMap<Long, Boolean> pending = new TreeMap<>();
  private long confirmed = LogPosition.INVALID;

  /**
   * Resets pending work after (re)attaching; the confirmed position is raised to the slot's
   * confirmed flush position but never lowered.
   */
  public synchronized void initialize(long slotPosition) {
    pending.clear();
    confirmed = Math.max(confirmed, slotPosition);
  }

  public synchronized void record(long position) {
    if (position <= confirmed) {
      return;
    }
    pending.putIfAbsent(position, Boolean.FALSE);
  }

  /**
   * @return whether the confirmed position advanced
   */
  public synchronized boolean confirm(long position) {
    if (position <= confirmed) {
      return false;
    }
    pending.put(position, Boolean.TRUE);
    long before = confirmed;
    while (!pending.isEmpty()) {
      Map.Entry<Long, Boolean> head = pending.firstEntry();
      if (!head.getValue()) {
        break;
      }
      confirmed = head.getKey();
      pending.pollFirstEntry();
    }
    return confirmed != before;
  }

  public synchronized long current() {
    return confirmed;
  }

  public synchronized int pendingCount() {
    return pending.size();
  }
}

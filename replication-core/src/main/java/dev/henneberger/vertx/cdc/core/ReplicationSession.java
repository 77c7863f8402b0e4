package dev.henneberger.vertx.cdc.core;

import java.time.Duration;

/**
 * A live logical replication session attached to one slot. Only the worker thread that
 * opened it may read from it.
 */
public interface ReplicationSession extends AutoCloseable {

  String slotName();

  /**
   * The slot's confirmed flush position at attach time; the stream resumes right after it.
   */
  long startPosition();

  /**
   * Waits up to {@code timeout} for the next message.
   *
   * @return the next segment, {@code null} if none arrived in time, or
   *   {@link RawSegment#endOfStream()} once the session has been closed
   * @throws StreamException if the connection was lost
   */
  RawSegment nextSegment(Duration timeout);

  /**
   * Tells the source that everything up to {@code position} has been durably processed.
   * Only positions confirmed by the {@link PositionTracker} may be passed here.
   */
  void acknowledge(long position);

  @Override
  void close();
}

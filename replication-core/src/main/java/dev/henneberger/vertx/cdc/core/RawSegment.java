package dev.henneberger.vertx.cdc.core;

/**
 * One message read from the replication connection, or the end-of-stream marker.
 */
public final class RawSegment {

  private static final RawSegment END_OF_STREAM = new RawSegment(null, LogPosition.INVALID, true);

  private final String payload;
  private final long position;
  private final boolean endOfStream;

  private RawSegment(String payload, long position, boolean endOfStream) {
    this.payload = payload;
    this.position = position;
    this.endOfStream = endOfStream;
  }

  public static RawSegment of(String payload, long position) {
    return new RawSegment(payload == null ? "" : payload, position, false);
  }

  public static RawSegment endOfStream() {
    return END_OF_STREAM;
  }

  public String payload() {
    return payload;
  }

  public long position() {
    return position;
  }

  public boolean isEndOfStream() {
    return endOfStream;
  }

  @Override
  public String toString() {
    if (endOfStream) {
      return "RawSegment{endOfStream}";
    }
    return "RawSegment{position=" + LogPosition.format(position) + ", bytes=" + payload.length() + '}';
  }
}

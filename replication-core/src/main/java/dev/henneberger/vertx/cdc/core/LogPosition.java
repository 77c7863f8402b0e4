package dev.henneberger.vertx.cdc.core;

import java.util.Locale;

/**
 * Formatting helpers for write-ahead log positions. Positions are unsigned 64-bit offsets,
 * rendered the way PostgreSQL prints them: two hexadecimal halves separated by a slash.
 */
public final class LogPosition {

  public static final long INVALID = 0L;

  private LogPosition() {
  }

  public static String format(long position) {
    return String.format(Locale.ROOT, "%X/%X", position >>> 32, position & 0xFFFFFFFFL);
  }

  public static long parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("log position is empty");
    }
    int slash = value.indexOf('/');
    if (slash <= 0 || slash == value.length() - 1) {
      throw new IllegalArgumentException("log position '" + value + "' is not in X/Y form");
    }
    try {
      long high = Long.parseLong(value.substring(0, slash).trim(), 16);
      long low = Long.parseLong(value.substring(slash + 1).trim(), 16);
      if (high > 0xFFFFFFFFL || low > 0xFFFFFFFFL || high < 0 || low < 0) {
        throw new IllegalArgumentException("log position '" + value + "' is out of range");
      }
      return (high << 32) | low;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("log position '" + value + "' is not hexadecimal", e);
    }
  }
}

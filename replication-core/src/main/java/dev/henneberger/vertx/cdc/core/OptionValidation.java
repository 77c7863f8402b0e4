package dev.henneberger.vertx.cdc.core;

import java.time.Duration;

public final class OptionValidation {

  private OptionValidation() {
  }

  public static void require(String fieldName, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  public static void requirePort(int port) {
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
  }

  public static void requireMin(String fieldName, long value, long minInclusive) {
    if (value < minInclusive) {
      throw new IllegalArgumentException(fieldName + " must be >= " + minInclusive);
    }
  }

  public static void requireMin(String fieldName, int value, int minInclusive) {
    if (value < minInclusive) {
      throw new IllegalArgumentException(fieldName + " must be >= " + minInclusive);
    }
  }

  public static void requireNonNegative(String fieldName, Duration value) {
    if (value == null) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
    if (value.isNegative()) {
      throw new IllegalArgumentException(fieldName + " must be >= 0");
    }
  }

  public static void requirePositive(String fieldName, Duration value) {
    requireNonNegative(fieldName, value);
    if (value.isZero()) {
      throw new IllegalArgumentException(fieldName + " must be > 0");
    }
  }

  /**
   * Rejects identifiers PostgreSQL would not accept as a replication slot name.
   */
  public static void requireSlotName(String value) {
    require("slotName", value);
    if (value.length() > 63 || !value.matches("[a-z0-9_]+")) {
      throw new IllegalArgumentException(
        "slotName '" + value + "' may only contain lower case letters, digits and underscores (max 63)");
    }
  }
}

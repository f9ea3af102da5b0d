package dev.henneberger.vertx.cdc.core;

import java.util.regex.Pattern;

public final class OptionValidation {

  private static final Pattern SLOT_NAME = Pattern.compile("[a-z0-9_]{1,63}");

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

  /**
   * Replication slot names may contain lower case letters, digits and underscores only.
   */
  public static void requireSlotName(String slotName) {
    require("slotName", slotName);
    if (!SLOT_NAME.matcher(slotName).matches()) {
      throw new IllegalArgumentException(
        "slotName '" + slotName + "' must be 1-63 characters of lower case letters, digits or underscores");
    }
  }
}

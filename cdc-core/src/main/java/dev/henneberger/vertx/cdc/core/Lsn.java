package dev.henneberger.vertx.cdc.core;

import java.util.Locale;
import java.util.Objects;

/**
 * A PostgreSQL WAL position: an unsigned 64-bit value printed as {@code X/Y}
 * where both halves are upper-case hexadecimal.
 */
public final class Lsn implements Comparable<Lsn> {

  public static final Lsn INVALID = new Lsn(0L);

  private final long value;

  private Lsn(long value) {
    this.value = value;
  }

  public static Lsn of(long value) {
    return value == 0L ? INVALID : new Lsn(value);
  }

  /**
   * Parses the {@code X/Y} text form. Throws {@link IllegalArgumentException} on anything else.
   */
  public static Lsn valueOf(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    int slash = trimmed.indexOf('/');
    if (slash <= 0 || slash == trimmed.length() - 1 || trimmed.indexOf('/', slash + 1) >= 0) {
      throw new IllegalArgumentException("Invalid LSN '" + text + "'");
    }
    try {
      long high = Long.parseLong(trimmed.substring(0, slash), 16);
      long low = Long.parseLong(trimmed.substring(slash + 1), 16);
      if (high > 0xFFFFFFFFL || low > 0xFFFFFFFFL || high < 0 || low < 0) {
        throw new IllegalArgumentException("Invalid LSN '" + text + "'");
      }
      return of((high << 32) | low);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid LSN '" + text + "'", e);
    }
  }

  public static Lsn max(Lsn a, Lsn b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  public long asLong() {
    return value;
  }

  public String asString() {
    return Long.toHexString(value >>> 32).toUpperCase(Locale.ROOT) + '/' + Long.toHexString(value & 0xFFFFFFFFL).toUpperCase(Locale.ROOT);
  }

  public boolean isValid() {
    return value != 0L;
  }

  public boolean isAfter(Lsn other) {
    return compareTo(other) > 0;
  }

  public boolean isBefore(Lsn other) {
    return compareTo(other) < 0;
  }

  @Override
  public int compareTo(Lsn other) {
    return Long.compareUnsigned(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Lsn)) {
      return false;
    }
    return value == ((Lsn) o).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return asString();
  }
}

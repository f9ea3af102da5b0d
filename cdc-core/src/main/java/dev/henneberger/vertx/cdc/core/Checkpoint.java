package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * Durable resume position of one replication slot.
 */
public final class Checkpoint {

  private final String slotName;
  private final Lsn confirmedLsn;
  private final Instant updatedAt;

  public Checkpoint(String slotName, Lsn confirmedLsn, Instant updatedAt) {
    this.slotName = Objects.requireNonNull(slotName, "slotName");
    this.confirmedLsn = Objects.requireNonNull(confirmedLsn, "confirmedLsn");
    this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
  }

  public static Checkpoint fromJson(JsonObject json) {
    Objects.requireNonNull(json, "json");
    String slotName = json.getString("slot_name");
    Object rawLsn = json.getValue("confirmed_lsn");
    String updatedAt = json.getString("updated_at");
    if (slotName == null || rawLsn == null || updatedAt == null) {
      throw new IllegalArgumentException("Checkpoint requires slot_name, confirmed_lsn and updated_at: " + json.encode());
    }
    Lsn lsn = rawLsn instanceof Number
      ? Lsn.of(((Number) rawLsn).longValue())
      : Lsn.of(Long.parseUnsignedLong(String.valueOf(rawLsn)));
    return new Checkpoint(slotName, lsn, Instant.parse(updatedAt));
  }

  public String slotName() {
    return slotName;
  }

  public Lsn confirmedLsn() {
    return confirmedLsn;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  /**
   * {@code confirmed_lsn} is written as an unsigned 64-bit number.
   */
  public JsonObject toJson() {
    long raw = confirmedLsn.asLong();
    Number unsigned = raw >= 0 ? (Number) raw : new BigInteger(Long.toUnsignedString(raw));
    return new JsonObject()
      .put("slot_name", slotName)
      .put("confirmed_lsn", unsigned)
      .put("confirmed_lsn_text", confirmedLsn.asString())
      .put("updated_at", updatedAt.toString());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Checkpoint)) {
      return false;
    }
    Checkpoint other = (Checkpoint) o;
    return slotName.equals(other.slotName)
      && confirmedLsn.equals(other.confirmedLsn)
      && updatedAt.equals(other.updatedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(slotName, confirmedLsn, updatedAt);
  }

  @Override
  public String toString() {
    return "Checkpoint{slot='" + slotName + "', confirmedLsn=" + confirmedLsn + ", updatedAt=" + updatedAt + '}';
  }
}

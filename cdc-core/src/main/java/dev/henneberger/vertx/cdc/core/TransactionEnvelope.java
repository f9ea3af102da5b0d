package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The changes of one committed transaction, in WAL emission order.
 */
public final class TransactionEnvelope {

  private final long transactionId;
  private final Lsn commitLsn;
  private final Instant commitTimestamp;
  private final List<ChangeRecord> records;

  public TransactionEnvelope(long transactionId, Lsn commitLsn, Instant commitTimestamp, List<ChangeRecord> records) {
    this.transactionId = transactionId;
    this.commitLsn = Objects.requireNonNull(commitLsn, "commitLsn");
    this.commitTimestamp = commitTimestamp;
    this.records = records == null || records.isEmpty()
      ? Collections.emptyList()
      : Collections.unmodifiableList(new ArrayList<>(records));
  }

  public long transactionId() {
    return transactionId;
  }

  public Lsn commitLsn() {
    return commitLsn;
  }

  /**
   * Commit time reported by the server, or {@code null} when timestamps are not included in the stream.
   */
  public Instant commitTimestamp() {
    return commitTimestamp;
  }

  public List<ChangeRecord> records() {
    return records;
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  public int size() {
    return records.size();
  }

  public JsonObject toJson() {
    JsonArray changes = new JsonArray();
    for (ChangeRecord record : records) {
      changes.add(record.toJson());
    }
    return new JsonObject()
      .put("xid", transactionId)
      .put("commit_lsn", commitLsn.asString())
      .put("commit_timestamp", commitTimestamp == null ? null : commitTimestamp.toString())
      .put("changes", changes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransactionEnvelope)) {
      return false;
    }
    TransactionEnvelope other = (TransactionEnvelope) o;
    return transactionId == other.transactionId
      && commitLsn.equals(other.commitLsn)
      && Objects.equals(commitTimestamp, other.commitTimestamp)
      && records.equals(other.records);
  }

  @Override
  public int hashCode() {
    return Objects.hash(transactionId, commitLsn, commitTimestamp, records);
  }

  @Override
  public String toString() {
    return "TransactionEnvelope{" +
      "xid=" + transactionId +
      ", commitLsn=" + commitLsn +
      ", commitTimestamp=" + commitTimestamp +
      ", records=" + records.size() +
      '}';
  }
}

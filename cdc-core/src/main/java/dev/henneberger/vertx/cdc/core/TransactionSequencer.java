package dev.henneberger.vertx.cdc.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the decoded message sequence into committed transactions.
 *
 * <p>Row changes are buffered per transaction id until the matching commit arrives; a rollback
 * drops the buffer. Emitted envelopes have strictly increasing commit LSNs. Commits at or below the
 * resume position that arrive before anything was emitted are replays of transactions the consumer
 * already confirmed and are skipped.
 *
 * <p>Not thread-safe; owned by the thread reading the replication stream.
 */
public final class TransactionSequencer {

  private static final Logger LOG = LoggerFactory.getLogger(TransactionSequencer.class);

  private final Map<Long, OpenTransaction> open = new LinkedHashMap<>();
  private Lsn resumeLsn;
  private Lsn lastCommitLsn;
  private boolean emitted;

  public TransactionSequencer(Lsn resumeLsn) {
    reset(resumeLsn);
  }

  /**
   * Discards all partially received transactions and restarts sequencing after {@code resumeLsn}.
   */
  public void reset(Lsn resumeLsn) {
    if (!open.isEmpty()) {
      LOG.debug("Discarding {} partial transaction(s) on reset", open.size());
    }
    open.clear();
    this.resumeLsn = Objects.requireNonNull(resumeLsn, "resumeLsn");
    this.lastCommitLsn = resumeLsn;
    this.emitted = false;
  }

  public Optional<TransactionEnvelope> accept(WalMessage message) {
    Objects.requireNonNull(message, "message");
    switch (message.kind()) {
      case BEGIN:
        onBegin((WalMessage.Begin) message);
        return Optional.empty();
      case ROW_CHANGE:
        onRowChange((WalMessage.RowChange) message);
        return Optional.empty();
      case COMMIT:
        return onCommit((WalMessage.Commit) message);
      case ROLLBACK:
        onRollback((WalMessage.Rollback) message);
        return Optional.empty();
      case LOGICAL_MESSAGE:
        LOG.debug("Ignoring logical message {}", message);
        return Optional.empty();
      default:
        throw new ProtocolInvariantViolationException("Unhandled message kind " + message.kind());
    }
  }

  public int openTransactions() {
    return open.size();
  }

  public int bufferedRecords() {
    int count = 0;
    for (OpenTransaction tx : open.values()) {
      count += tx.records.size();
    }
    return count;
  }

  /**
   * Highest commit position emitted so far, or the resume position when nothing was emitted.
   */
  public Lsn lastCommitLsn() {
    return lastCommitLsn;
  }

  private void onBegin(WalMessage.Begin begin) {
    if (open.containsKey(begin.xid())) {
      throw new ProtocolInvariantViolationException(
        "BEGIN for transaction " + begin.xid() + " at " + begin.lsn() + " while it is already open");
    }
    open.put(begin.xid(), new OpenTransaction(begin.xid()));
  }

  private void onRowChange(WalMessage.RowChange row) {
    OpenTransaction tx = resolve(row.xid(), "row change", row.lsn());
    if (row.lsn().isBefore(tx.lastLsn)) {
      throw new ProtocolInvariantViolationException(
        "Row change at " + row.lsn() + " precedes " + tx.lastLsn + " in transaction " + tx.xid);
    }
    tx.lastLsn = row.lsn();
    tx.records.add(row.toRecord(tx.xid));
  }

  private Optional<TransactionEnvelope> onCommit(WalMessage.Commit commit) {
    OpenTransaction tx = open.remove(commit.xid());
    if (tx == null) {
      throw new ProtocolInvariantViolationException(
        "COMMIT for transaction " + commit.xid() + " at " + commit.lsn() + " without BEGIN");
    }

    Lsn commitLsn = commit.lsn();
    if (!commitLsn.isAfter(lastCommitLsn)) {
      if (!emitted && !commitLsn.isAfter(resumeLsn)) {
        LOG.debug("Skipping transaction {} committed at {}, already confirmed up to {}",
          tx.xid, commitLsn, resumeLsn);
        return Optional.empty();
      }
      throw new ProtocolInvariantViolationException(
        "Commit LSN " + commitLsn + " of transaction " + tx.xid
          + " does not advance past previous commit " + lastCommitLsn);
    }
    if (commitLsn.isBefore(tx.lastLsn)) {
      throw new ProtocolInvariantViolationException(
        "Commit LSN " + commitLsn + " precedes the last change " + tx.lastLsn + " of transaction " + tx.xid);
    }

    lastCommitLsn = commitLsn;
    emitted = true;
    return Optional.of(new TransactionEnvelope(tx.xid, commitLsn, commit.timestamp(), tx.records));
  }

  private void onRollback(WalMessage.Rollback rollback) {
    OpenTransaction tx = open.remove(rollback.xid());
    if (tx == null) {
      throw new ProtocolInvariantViolationException(
        "ROLLBACK for transaction " + rollback.xid() + " at " + rollback.lsn() + " without BEGIN");
    }
    LOG.debug("Discarding {} change(s) of aborted transaction {}", tx.records.size(), tx.xid);
  }

  private OpenTransaction resolve(Long xid, String what, Lsn lsn) {
    if (xid != null) {
      OpenTransaction tx = open.get(xid);
      if (tx == null) {
        throw new ProtocolInvariantViolationException(
          what + " at " + lsn + " for transaction " + xid + " which is not open");
      }
      return tx;
    }
    if (open.size() != 1) {
      throw new ProtocolInvariantViolationException(
        what + " at " + lsn + " without transaction id while " + open.size() + " transactions are open");
    }
    return open.values().iterator().next();
  }

  private static final class OpenTransaction {
    private final long xid;
    private final List<ChangeRecord> records = new ArrayList<>();
    private Lsn lastLsn = Lsn.INVALID;

    private OpenTransaction(long xid) {
      this.xid = xid;
    }
  }
}

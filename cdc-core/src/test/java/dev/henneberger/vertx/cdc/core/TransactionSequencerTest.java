package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TransactionSequencerTest {

  private static final Instant TS = Instant.parse("2026-03-01T10:15:30Z");

  @Test
  void groupsRowChangesOfOneTransaction() {
    TransactionSequencer sequencer = new TransactionSequencer(Lsn.INVALID);

    assertFalse(sequencer.accept(WalMessage.begin(5, Lsn.of(100), TS)).isPresent());
    assertFalse(sequencer.accept(row(5L, ChangeKind.INSERT, 30, 101)).isPresent());
    assertFalse(sequencer.accept(row(5L, ChangeKind.UPDATE, 31, 102)).isPresent());
    assertEquals(2, sequencer.bufferedRecords());

    Optional<TransactionEnvelope> envelope = sequencer.accept(WalMessage.commit(5, Lsn.of(103), TS));

    assertTrue(envelope.isPresent());
    TransactionEnvelope tx = envelope.get();
    assertEquals(5L, tx.transactionId());
    assertEquals(Lsn.of(103), tx.commitLsn());
    assertEquals(TS, tx.commitTimestamp());
    List<ChangeRecord> records = tx.records();
    assertEquals(2, records.size());
    assertEquals(ChangeKind.INSERT, records.get(0).kind());
    assertEquals(30L, records.get(0).longValue("age"));
    assertEquals(ChangeKind.UPDATE, records.get(1).kind());
    assertEquals(31L, records.get(1).longValue("age"));
    assertEquals(0, sequencer.openTransactions());
    assertEquals(Lsn.of(103), sequencer.lastCommitLsn());
  }

  @Test
  void dropsRolledBackTransaction() {
    TransactionSequencer sequencer = new TransactionSequencer(Lsn.INVALID);

    sequencer.accept(WalMessage.begin(7, Lsn.of(200), TS));
    sequencer.accept(row(7L, ChangeKind.INSERT, 1, 201));
    assertFalse(sequencer.accept(WalMessage.rollback(7, Lsn.of(202))).isPresent());

    assertEquals(0, sequencer.openTransactions());
    assertEquals(0, sequencer.bufferedRecords());
  }

  @Test
  void skipsTransactionsReplayedAfterResume() {
    TransactionSequencer sequencer = new TransactionSequencer(Lsn.of(103));

    sequencer.accept(WalMessage.begin(5, Lsn.of(100), TS));
    sequencer.accept(row(5L, ChangeKind.INSERT, 30, 101));
    assertFalse(sequencer.accept(WalMessage.commit(5, Lsn.of(103), TS)).isPresent());

    sequencer.accept(WalMessage.begin(6, Lsn.of(104), TS));
    sequencer.accept(row(6L, ChangeKind.INSERT, 40, 105));
    Optional<TransactionEnvelope> next = sequencer.accept(WalMessage.commit(6, Lsn.of(106), TS));

    assertTrue(next.isPresent());
    assertEquals(6L, next.get().transactionId());
    assertEquals(Lsn.of(106), next.get().commitLsn());
  }

  @Test
  void rejectsCommitThatDoesNotAdvance() {
    TransactionSequencer sequencer = new TransactionSequencer(Lsn.INVALID);
    sequencer.accept(WalMessage.begin(1, Lsn.of(10), TS));
    sequencer.accept(WalMessage.commit(1, Lsn.of(20), TS));

    sequencer.accept(WalMessage.begin(2, Lsn.of(15), TS));

    assertThrows(ProtocolInvariantViolationException.class,
      () -> sequencer.accept(WalMessage.commit(2, Lsn.of(20), TS)));
  }

  @Test
  void rejectsRowWithoutOpenTransaction() {
    TransactionSequencer sequencer = new TransactionSequencer(Lsn.INVALID);

    assertThrows(ProtocolInvariantViolationException.class,
      () -> sequencer.accept(row(9L, ChangeKind.INSERT, 1, 50)));
    assertThrows(ProtocolInvariantViolationException.class,
      () -> sequencer.accept(WalMessage.commit(9, Lsn.of(51), TS)));
  }

  @Test
  void rejectsDuplicateBegin() {
    TransactionSequencer sequencer = new TransactionSequencer(Lsn.INVALID);
    sequencer.accept(WalMessage.begin(3, Lsn.of(10), TS));

    assertThrows(ProtocolInvariantViolationException.class,
      () -> sequencer.accept(WalMessage.begin(3, Lsn.of(11), TS)));
  }

  @Test
  void attachesRowWithoutXidToTheSingleOpenTransaction() {
    TransactionSequencer sequencer = new TransactionSequencer(Lsn.INVALID);
    sequencer.accept(WalMessage.begin(11, Lsn.of(10), TS));
    sequencer.accept(row(null, ChangeKind.DELETE, 1, 11));

    TransactionEnvelope tx = sequencer.accept(WalMessage.commit(11, Lsn.of(12), TS)).orElseThrow();

    assertEquals(1, tx.size());
    assertEquals(11L, tx.records().get(0).transactionId());
  }

  @Test
  void resetDiscardsPartialTransactions() {
    TransactionSequencer sequencer = new TransactionSequencer(Lsn.INVALID);
    sequencer.accept(WalMessage.begin(1, Lsn.of(10), TS));
    sequencer.accept(row(1L, ChangeKind.INSERT, 1, 11));

    sequencer.reset(Lsn.of(9));

    assertEquals(0, sequencer.openTransactions());
    assertEquals(Lsn.of(9), sequencer.lastCommitLsn());
  }

  @Test
  void emitsEmptyTransactions() {
    TransactionSequencer sequencer = new TransactionSequencer(Lsn.INVALID);
    sequencer.accept(WalMessage.begin(4, Lsn.of(10), TS));

    TransactionEnvelope tx = sequencer.accept(WalMessage.commit(4, Lsn.of(11), TS)).orElseThrow();

    assertTrue(tx.isEmpty());
  }

  private static WalMessage row(Long xid, ChangeKind kind, long age, long lsn) {
    List<ColumnValue> columns = kind == ChangeKind.DELETE
      ? List.of()
      : List.of(new ColumnValue("age", "integer", ValueKind.INTEGER, age));
    return WalMessage.rowChange(xid, kind, "public", "users", columns, List.of(), Lsn.of(lsn));
  }
}

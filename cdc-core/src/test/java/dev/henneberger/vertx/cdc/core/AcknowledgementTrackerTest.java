package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class AcknowledgementTrackerTest {

  @Test
  void savesBeforeOfferingAcknowledgement() throws Exception {
    InMemoryCheckpointStore store = new InMemoryCheckpointStore();
    AcknowledgementTracker tracker = new AcknowledgementTracker("orders_slot", store, Lsn.INVALID);

    assertEquals(1, tracker.delivered(Lsn.of(103)));
    assertFalse(tracker.pendingAcknowledgement().isPresent());
    assertFalse(store.load("orders_slot").isPresent());

    Optional<Checkpoint> saved = tracker.persist();

    assertTrue(saved.isPresent());
    assertEquals(Lsn.of(103), store.load("orders_slot").orElseThrow().confirmedLsn());
    assertEquals(Optional.of(Lsn.of(103)), tracker.pendingAcknowledgement());

    tracker.markAcknowledged(Lsn.of(103));
    assertFalse(tracker.pendingAcknowledgement().isPresent());
    assertEquals(Lsn.of(103), tracker.acknowledgedLsn());
  }

  @Test
  void batchesSaves() throws Exception {
    InMemoryCheckpointStore store = new InMemoryCheckpointStore();
    AcknowledgementTracker tracker = new AcknowledgementTracker("orders_slot", store, Lsn.of(10));

    tracker.delivered(Lsn.of(11));
    tracker.delivered(Lsn.of(12));
    assertEquals(3, tracker.delivered(Lsn.of(13)));
    assertTrue(tracker.hasUnsaved());

    tracker.persist();

    assertFalse(tracker.hasUnsaved());
    assertEquals(Lsn.of(13), tracker.confirmedLsn());
    assertFalse(tracker.persist().isPresent());
  }

  @Test
  void skippedTransactionsAdvanceWithoutCountingTowardsBatch() throws Exception {
    InMemoryCheckpointStore store = new InMemoryCheckpointStore();
    AcknowledgementTracker tracker = new AcknowledgementTracker("orders_slot", store, Lsn.of(10));

    tracker.skipped(Lsn.of(11));
    assertFalse(tracker.hasUnsaved());
    assertTrue(tracker.hasUnsavedPosition());
    assertEquals(1, tracker.delivered(Lsn.of(12)));
    tracker.skipped(Lsn.of(13));

    assertEquals(Lsn.of(13), tracker.persist().orElseThrow().confirmedLsn());
    assertFalse(tracker.hasUnsavedPosition());
    assertThrows(ProtocolInvariantViolationException.class, () -> tracker.skipped(Lsn.of(13)));
  }

  @Test
  void rejectsAcknowledgementBeyondSavedPosition() {
    AcknowledgementTracker tracker = new AcknowledgementTracker("orders_slot", new InMemoryCheckpointStore(), Lsn.of(10));
    tracker.delivered(Lsn.of(20));

    assertThrows(ProtocolInvariantViolationException.class, () -> tracker.markAcknowledged(Lsn.of(20)));
  }

  @Test
  void rejectsDeliveryThatDoesNotAdvance() {
    AcknowledgementTracker tracker = new AcknowledgementTracker("orders_slot", new InMemoryCheckpointStore(), Lsn.of(10));

    assertThrows(ProtocolInvariantViolationException.class, () -> tracker.delivered(Lsn.of(10)));
  }

  @Test
  void keepsPositionWhenSaveFails() {
    CheckpointStore failing = new CheckpointStore() {
      @Override
      public Optional<Checkpoint> load(String slotName) {
        return Optional.empty();
      }

      @Override
      public Checkpoint save(String slotName, Lsn confirmedLsn) throws Exception {
        throw new java.io.IOException("disk full");
      }
    };
    AcknowledgementTracker tracker = new AcknowledgementTracker("orders_slot", failing, Lsn.of(10));
    tracker.delivered(Lsn.of(20));

    assertThrows(java.io.IOException.class, tracker::persist);
    assertEquals(Lsn.of(10), tracker.confirmedLsn());
    assertTrue(tracker.hasUnsaved());
    assertFalse(tracker.pendingAcknowledgement().isPresent());
  }
}

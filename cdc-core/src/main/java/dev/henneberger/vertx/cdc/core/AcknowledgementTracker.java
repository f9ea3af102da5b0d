package dev.henneberger.vertx.cdc.core;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-phase acknowledgement bookkeeping for one slot.
 *
 * <p>Phase one ({@link #persist()}) saves the highest consumer-acknowledged commit position to the
 * {@link CheckpointStore}. Phase two reads {@link #pendingAcknowledgement()} and, after the server
 * confirmation was sent, records it with {@link #markAcknowledged(Lsn)}. A position is never offered for
 * server confirmation before it has been saved.
 *
 * <p>{@link #delivered(Lsn)} and {@link #persist()} are called from the dispatching thread; the
 * acknowledgement side may be called from the reading thread.
 */
public final class AcknowledgementTracker {

  private static final Logger LOG = LoggerFactory.getLogger(AcknowledgementTracker.class);

  private final String slotName;
  private final CheckpointStore checkpointStore;
  private final AtomicReference<Lsn> saved;
  private final AtomicReference<Lsn> acknowledged;
  private Lsn delivered;
  private int unsaved;

  public AcknowledgementTracker(String slotName, CheckpointStore checkpointStore, Lsn confirmedLsn) {
    this.slotName = Objects.requireNonNull(slotName, "slotName");
    this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
    Objects.requireNonNull(confirmedLsn, "confirmedLsn");
    this.saved = new AtomicReference<>(confirmedLsn);
    this.acknowledged = new AtomicReference<>(confirmedLsn);
    this.delivered = confirmedLsn;
  }

  public String slotName() {
    return slotName;
  }

  /**
   * Records that every consumer acknowledged the envelope committed at {@code commitLsn}.
   *
   * @return the number of acknowledged envelopes not yet saved
   */
  public synchronized int delivered(Lsn commitLsn) {
    advance(commitLsn);
    return ++unsaved;
  }

  /**
   * Records a transaction without changes. Its position may be saved with the next checkpoint but does
   * not count towards a batch.
   */
  public synchronized void skipped(Lsn commitLsn) {
    advance(commitLsn);
  }

  /**
   * Whether acknowledged envelopes with changes are waiting to be saved.
   */
  public synchronized boolean hasUnsaved() {
    return unsaved > 0;
  }

  /**
   * Whether any position, including one reached only through empty transactions, is ahead of the save.
   */
  public synchronized boolean hasUnsavedPosition() {
    return delivered.isAfter(saved.get());
  }

  private void advance(Lsn commitLsn) {
    Objects.requireNonNull(commitLsn, "commitLsn");
    if (!commitLsn.isAfter(delivered)) {
      throw new ProtocolInvariantViolationException(
        "Acknowledged commit " + commitLsn + " does not advance past " + delivered + " on slot '" + slotName + "'");
    }
    delivered = commitLsn;
  }

  /**
   * Saves the highest acknowledged position when it is ahead of the last saved one.
   *
   * @return the newly saved checkpoint, or empty when there was nothing to save
   */
  public synchronized Optional<Checkpoint> persist() throws Exception {
    if (!delivered.isAfter(saved.get())) {
      unsaved = 0;
      return Optional.empty();
    }
    Lsn target = delivered;
    Checkpoint checkpoint = checkpointStore.save(slotName, target);
    saved.set(target);
    unsaved = 0;
    LOG.debug("Saved checkpoint {} for slot '{}'", target, slotName);
    return Optional.of(checkpoint);
  }

  /**
   * Saved position not yet confirmed to the server.
   */
  public Optional<Lsn> pendingAcknowledgement() {
    Lsn current = saved.get();
    return current.isAfter(acknowledged.get()) ? Optional.of(current) : Optional.empty();
  }

  public void markAcknowledged(Lsn lsn) {
    Objects.requireNonNull(lsn, "lsn");
    if (lsn.isAfter(saved.get())) {
      throw new ProtocolInvariantViolationException(
        "Cannot acknowledge " + lsn + " beyond the saved checkpoint " + saved.get() + " on slot '" + slotName + "'");
    }
    acknowledged.accumulateAndGet(lsn, Lsn::max);
  }

  /**
   * Last durably saved position. This is the only position ever reported to the server.
   */
  public Lsn confirmedLsn() {
    return saved.get();
  }

  public Lsn acknowledgedLsn() {
    return acknowledged.get();
  }
}

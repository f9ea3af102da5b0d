/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.henneberger.vertx.cdc.pg;

import dev.henneberger.vertx.cdc.core.AcknowledgementTracker;
import dev.henneberger.vertx.cdc.core.Checkpoint;
import dev.henneberger.vertx.cdc.core.CheckpointStore;
import dev.henneberger.vertx.cdc.core.EnvelopeDispatcher;
import dev.henneberger.vertx.cdc.core.Lsn;
import dev.henneberger.vertx.cdc.core.TransactionEnvelope;
import dev.henneberger.vertx.cdc.core.TransactionSequencer;
import dev.henneberger.vertx.cdc.core.WalDecodeException;
import dev.henneberger.vertx.cdc.core.WalMessage;
import io.vertx.core.Vertx;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.postgresql.replication.PGReplicationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One connection's worth of streaming: ensure the slot, stream from the checkpoint, decode and
 * sequence messages on the calling thread, and hand envelopes to an {@link EnvelopeDispatcher}.
 *
 * <p>{@link #run()} returns normally only once {@code shouldRun} turns false; any failure is thrown
 * after the session's resources have been released. A session is never reused.
 */
final class ReplicationSession {

  private static final Logger LOG = LoggerFactory.getLogger(ReplicationSession.class);
  private static final long IDLE_SLEEP_MS = 10L;
  private static final long OFFER_TIMEOUT_MS = 100L;

  interface Callbacks {
    void onCheckpointLoaded(Lsn confirmedLsn);
    void onStreaming(ReplicationSlot slot, Lsn startLsn);
    void onEnvelope(TransactionEnvelope envelope);
    void onDecodeFailure(String payload, Throwable error);
    void onCheckpointSaved(Checkpoint checkpoint);
    void onAcknowledged(Lsn lsn);
  }

  private final Vertx vertx;
  private final PostgresReplicationOptions options;
  private final PostgresConnector connector;
  private final ReplicationSlotManager slotManager;
  private final CheckpointStore checkpointStore;
  private final ChangeDecoder decoder;
  private final List<EnvelopeDispatcher.Subscriber> subscribers;
  private final Callbacks callbacks;
  private final BooleanSupplier shouldRun;

  private volatile boolean streaming;
  private AcknowledgementTracker tracker;
  private long lastStatusAt;

  ReplicationSession(Vertx vertx,
                     PostgresReplicationOptions options,
                     PostgresConnector connector,
                     ReplicationSlotManager slotManager,
                     List<EnvelopeDispatcher.Subscriber> subscribers,
                     Callbacks callbacks,
                     BooleanSupplier shouldRun) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = Objects.requireNonNull(options, "options");
    this.connector = Objects.requireNonNull(connector, "connector");
    this.slotManager = Objects.requireNonNull(slotManager, "slotManager");
    this.checkpointStore = options.getCheckpointStore();
    this.decoder = options.getChangeDecoder();
    this.subscribers = Objects.requireNonNull(subscribers, "subscribers");
    this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
    this.shouldRun = Objects.requireNonNull(shouldRun, "shouldRun");
  }

  /**
   * Whether this session got as far as streaming changes.
   */
  boolean reachedStreaming() {
    return streaming;
  }

  void run() throws Exception {
    String slotName = options.getSlotName();
    Lsn checkpointLsn = checkpointStore.load(slotName).map(Checkpoint::confirmedLsn).orElse(Lsn.INVALID);
    callbacks.onCheckpointLoaded(checkpointLsn);

    ReplicationSlot slot = slotManager.ensureSlot(slotName);
    if (slot.created() && checkpointLsn.isValid()) {
      LOG.warn("Slot '{}' was created although a checkpoint at {} exists", slotName, checkpointLsn);
    }
    Lsn startLsn = slotManager.resolveStartLsn(slot, checkpointLsn);

    try (Connection replicationConnection = connector.openReplicationConnection()) {
      PGReplicationStream stream = slotManager.startStreaming(replicationConnection, slot, checkpointLsn);
      try {
        stream(stream, slot, checkpointLsn, startLsn);
      } finally {
        closeQuietly(stream);
      }
    }
  }

  /**
   * Reads {@code stream} until {@code shouldRun} turns false or a failure ends the session.
   */
  void stream(PGReplicationStream stream, ReplicationSlot slot, Lsn checkpointLsn, Lsn startLsn) throws Exception {
    String slotName = slot.slotName();
    tracker = new AcknowledgementTracker(slotName, checkpointStore, startLsn);
    if (checkpointLsn.isValid() && checkpointLsn.isAfter(slot.confirmedFlushLsn())) {
      // Saved but never confirmed, e.g. after a crash between the two steps.
      slotManager.acknowledge(stream, checkpointLsn);
      tracker.markAcknowledged(checkpointLsn);
      callbacks.onAcknowledged(checkpointLsn);
    }

    TransactionSequencer sequencer = new TransactionSequencer(startLsn);
    EnvelopeDispatcher dispatcher = new EnvelopeDispatcher(
      vertx,
      slotName,
      tracker,
      subscribers,
      new EnvelopeDispatcher.Settings()
        .setMaxPendingTransactions(options.getMaxPendingTransactions())
        .setAckBatchSize(options.getAckBatchSize())
        .setMaxConcurrentDispatch(options.getMaxConcurrentDispatch())
        .setSkipEmptyTransactions(options.isSkipEmptyTransactions())
        .setEmptyTransactionFlushMs(options.getStatusIntervalMs()),
      callbacks::onEnvelope,
      callbacks::onCheckpointSaved);

    dispatcher.start();
    try {
      streaming = true;
      lastStatusAt = System.currentTimeMillis();
      callbacks.onStreaming(slot, startLsn);

      while (shouldRun.getAsBoolean()) {
        dispatcher.checkFailure();
        acknowledgeSaved(stream);

        ByteBuffer buffer = stream.readPending();
        if (buffer == null) {
          keepAlive(stream);
          sleep(IDLE_SLEEP_MS);
          continue;
        }

        String payload = toText(buffer);
        Lsn receiveLsn = ReplicationSlotManager.fromLogSequenceNumber(stream.getLastReceiveLSN());
        WalMessage message;
        try {
          message = decoder.decode(payload, receiveLsn);
        } catch (WalDecodeException e) {
          callbacks.onDecodeFailure(payload, e);
          throw e;
        }

        Optional<TransactionEnvelope> envelope = sequencer.accept(message);
        if (envelope.isPresent()) {
          enqueue(dispatcher, stream, envelope.get());
        }
      }
    } finally {
      if (sequencer.openTransactions() > 0) {
        LOG.debug("Dropping {} partial transaction(s) of slot '{}'", sequencer.openTransactions(), slotName);
      }
      dispatcher.close();
      try {
        acknowledgeSaved(stream);
      } catch (SQLException e) {
        LOG.debug("Could not confirm final position of slot '{}'", slotName, e);
      }
    }
  }

  private void enqueue(EnvelopeDispatcher dispatcher, PGReplicationStream stream, TransactionEnvelope envelope)
    throws Exception {
    while (!dispatcher.offer(envelope, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
      if (!shouldRun.getAsBoolean()) {
        return;
      }
      acknowledgeSaved(stream);
      keepAlive(stream);
    }
  }

  /**
   * Sends the server confirmation for the last saved checkpoint, if it has not been sent yet.
   */
  private void acknowledgeSaved(PGReplicationStream stream) throws SQLException {
    Optional<Lsn> pending = tracker.pendingAcknowledgement();
    if (pending.isEmpty()) {
      return;
    }
    Lsn lsn = pending.get();
    slotManager.acknowledge(stream, lsn);
    tracker.markAcknowledged(lsn);
    lastStatusAt = System.currentTimeMillis();
    callbacks.onAcknowledged(lsn);
  }

  /**
   * Status update carrying only the saved position, so the server does not time the connection out
   * while the reader is idle or blocked on a full queue.
   */
  private void keepAlive(PGReplicationStream stream) throws SQLException {
    long now = System.currentTimeMillis();
    if (now - lastStatusAt < options.getStatusIntervalMs()) {
      return;
    }
    Lsn confirmed = tracker.acknowledgedLsn();
    if (confirmed.isValid()) {
      stream.setAppliedLSN(ReplicationSlotManager.toLogSequenceNumber(confirmed));
      stream.setFlushedLSN(ReplicationSlotManager.toLogSequenceNumber(confirmed));
    }
    stream.forceUpdateStatus();
    lastStatusAt = now;
  }

  private static String toText(ByteBuffer buffer) {
    int length = buffer.remaining();
    if (buffer.hasArray()) {
      return new String(buffer.array(), buffer.arrayOffset() + buffer.position(), length, StandardCharsets.UTF_8);
    }
    byte[] bytes = new byte[length];
    buffer.get(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  private static void sleep(long millis) throws InterruptedException {
    Thread.sleep(millis);
  }

  private static void closeQuietly(PGReplicationStream stream) {
    try {
      if (!stream.isClosed()) {
        stream.close();
      }
    } catch (SQLException e) {
      LOG.debug("Failed to close replication stream", e);
    }
  }
}

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

import dev.henneberger.vertx.cdc.core.Lsn;
import dev.henneberger.vertx.cdc.core.LsnTooOldException;
import dev.henneberger.vertx.cdc.core.ReplicationConnectionException;
import dev.henneberger.vertx.cdc.core.SlotConflictException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.postgresql.PGConnection;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.postgresql.replication.fluent.logical.ChainedLogicalStreamBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the server side of a logical replication slot: makes sure it exists with the right plugin,
 * opens the change stream at the right position and confirms processed positions.
 *
 * <p>Slots are created once and reused; nothing here ever drops a slot.
 */
public class ReplicationSlotManager {

  private static final Logger LOG = LoggerFactory.getLogger(ReplicationSlotManager.class);

  private static final String SLOT_QUERY =
    "SELECT slot_name, plugin, slot_type, database, restart_lsn::text, confirmed_flush_lsn::text, "
      + "wal_status, active FROM pg_replication_slots WHERE slot_name = ?";
  private static final String LEGACY_SLOT_QUERY =
    "SELECT slot_name, plugin, slot_type, database, restart_lsn::text, confirmed_flush_lsn::text, "
      + "NULL::text AS wal_status, active FROM pg_replication_slots WHERE slot_name = ?";

  static final String FILTER_TABLES = "filter-tables";

  private final PostgresConnector connector;
  private final String plugin;
  private final String database;
  private final Map<String, Object> slotOptions;
  private final long statusIntervalMs;

  public ReplicationSlotManager(PostgresConnector connector, PostgresReplicationOptions options) {
    this.connector = Objects.requireNonNull(connector, "connector");
    Objects.requireNonNull(options, "options");
    this.plugin = options.getPlugin();
    this.database = options.getDatabase();
    this.statusIntervalMs = options.getStatusIntervalMs();
    Map<String, Object> merged = new LinkedHashMap<>(options.getChangeDecoder().defaultSlotOptions());
    merged.putAll(options.getPluginOptions());
    if (options.getCheckpointStore() instanceof PostgresCheckpointStore) {
      excludeTable(merged, ((PostgresCheckpointStore) options.getCheckpointStore()).replicationFilter());
    }
    this.slotOptions = Collections.unmodifiableMap(merged);
  }

  public Map<String, Object> slotOptions() {
    return slotOptions;
  }

  /**
   * Returns the slot, creating it when it does not exist. Repeated calls return the same slot.
   *
   * @throws SlotConflictException when a slot with this name exists but cannot be used
   */
  public ReplicationSlot ensureSlot(String slotName) throws SQLException {
    Objects.requireNonNull(slotName, "slotName");
    try (Connection conn = connector.openStandardConnection()) {
      Optional<ReplicationSlot> existing = readSlot(conn, slotName);
      if (existing.isPresent()) {
        ReplicationSlot slot = verify(existing.get());
        LOG.info("Reusing replication slot '{}' (confirmed {}, restart {})",
          slotName, slot.confirmedFlushLsn(), slot.restartLsn());
        return slot;
      }

      try (PreparedStatement statement = conn.prepareStatement(
        "SELECT lsn::text FROM pg_create_logical_replication_slot(?, ?)")) {
        statement.setString(1, slotName);
        statement.setString(2, plugin);
        statement.execute();
      } catch (SQLException createError) {
        if (!PostgresErrors.isSlotAlreadyExists(createError)) {
          throw createError;
        }
        LOG.debug("Replication slot '{}' was created concurrently", slotName);
        ReplicationSlot raced = readSlot(conn, slotName).orElseThrow(() -> new ReplicationConnectionException(
          "Replication slot '" + slotName + "' vanished after a concurrent creation", slotName, null, createError));
        return verify(raced);
      }

      ReplicationSlot created = readSlot(conn, slotName)
        .orElseThrow(() -> new ReplicationConnectionException(
          "Replication slot '" + slotName + "' not found right after creating it", slotName, null, null))
        .markCreated();
      LOG.info("Created replication slot '{}' with plugin {} at {}", slotName, plugin, created.confirmedFlushLsn());
      return created;
    }
  }

  public Optional<ReplicationSlot> readSlot(String slotName) throws SQLException {
    try (Connection conn = connector.openStandardConnection()) {
      return readSlot(conn, slotName);
    }
  }

  Optional<ReplicationSlot> readSlot(Connection conn, String slotName) throws SQLException {
    try {
      return querySlot(conn, SLOT_QUERY, slotName);
    } catch (SQLException e) {
      if (!PostgresErrors.isUndefinedColumn(e)) {
        throw e;
      }
      return querySlot(conn, LEGACY_SLOT_QUERY, slotName);
    }
  }

  /**
   * Position to stream from: the later of the checkpoint and the slot's confirmed position.
   *
   * @throws LsnTooOldException when the slot lost its WAL, or its confirmed position is ahead of a
   *   checkpoint, meaning changes in between were consumed by somebody else or never retained
   */
  public Lsn resolveStartLsn(ReplicationSlot slot, Lsn fromLsn) {
    Objects.requireNonNull(slot, "slot");
    Lsn requested = fromLsn == null ? Lsn.INVALID : fromLsn;
    if (slot.isWalLost()) {
      throw new LsnTooOldException(slot.slotName(), requested, slot.restartLsn(),
        "the slot's WAL has been removed (wal_status=lost)", null);
    }
    if (requested.isValid() && requested.isBefore(slot.confirmedFlushLsn())) {
      throw new LsnTooOldException(slot.slotName(), requested, slot.confirmedFlushLsn(),
        "the slot was confirmed up to " + slot.confirmedFlushLsn() + " which is past the checkpoint", null);
    }
    return Lsn.max(requested, slot.confirmedFlushLsn());
  }

  /**
   * Starts streaming changes of {@code slot} on a replication connection.
   */
  public PGReplicationStream startStreaming(Connection replicationConnection,
                                            ReplicationSlot slot,
                                            Lsn fromLsn) throws SQLException {
    Objects.requireNonNull(replicationConnection, "replicationConnection");
    Lsn start = resolveStartLsn(slot, fromLsn);
    PGConnection pgConnection = replicationConnection.unwrap(PGConnection.class);

    ChainedLogicalStreamBuilder builder = pgConnection.getReplicationAPI()
      .replicationStream()
      .logical()
      .withSlotName(slot.slotName())
      .withStartPosition(toLogSequenceNumber(start))
      .withStatusInterval((int) statusIntervalMs, TimeUnit.MILLISECONDS);
    for (Map.Entry<String, Object> entry : slotOptions.entrySet()) {
      applySlotOption(builder, entry.getKey(), entry.getValue());
    }

    PGReplicationStream stream;
    try {
      stream = builder.start();
    } catch (SQLException e) {
      if (PostgresErrors.isWalRemoved(e)) {
        throw new LsnTooOldException(slot.slotName(), start, slot.restartLsn(), e.getMessage(), e);
      }
      throw e;
    }
    LOG.info("Streaming slot '{}' from {}", slot.slotName(), start);
    return stream;
  }

  /**
   * Confirms {@code lsn} to the server, allowing it to release WAL up to that position. Only call this
   * with a position that has been durably checkpointed.
   */
  public void acknowledge(PGReplicationStream stream, Lsn lsn) throws SQLException {
    Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(lsn, "lsn");
    if (!lsn.isValid()) {
      return;
    }
    LogSequenceNumber position = toLogSequenceNumber(lsn);
    stream.setAppliedLSN(position);
    stream.setFlushedLSN(position);
    stream.forceUpdateStatus();
  }

  private static void excludeTable(Map<String, Object> slotOptions, String filter) {
    Object existing = slotOptions.get(FILTER_TABLES);
    if (existing == null || existing.toString().isBlank()) {
      slotOptions.put(FILTER_TABLES, filter);
    } else {
      slotOptions.put(FILTER_TABLES, existing + "," + filter);
    }
  }

  static LogSequenceNumber toLogSequenceNumber(Lsn lsn) {
    return lsn.isValid() ? LogSequenceNumber.valueOf(lsn.asLong()) : LogSequenceNumber.INVALID_LSN;
  }

  static Lsn fromLogSequenceNumber(LogSequenceNumber lsn) {
    return lsn == null ? Lsn.INVALID : Lsn.of(lsn.asLong());
  }

  private ReplicationSlot verify(ReplicationSlot slot) {
    if (!slot.isLogical()) {
      throw new SlotConflictException(slot.slotName(), plugin, slot.pluginName(),
        "it is a " + slot.slotType() + " slot");
    }
    if (!plugin.equalsIgnoreCase(slot.pluginName())) {
      throw new SlotConflictException(slot.slotName(), plugin, slot.pluginName());
    }
    if (database != null && slot.database() != null && !database.equals(slot.database())) {
      throw new SlotConflictException(slot.slotName(), plugin, slot.pluginName(),
        "it belongs to database '" + slot.database() + "', not '" + database + "'");
    }
    return slot;
  }

  private static Optional<ReplicationSlot> querySlot(Connection conn, String sql, String slotName) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(sql)) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new ReplicationSlot(
          rs.getString(1),
          rs.getString(2),
          rs.getString(3),
          rs.getString(4),
          parseLsn(rs.getString(5)),
          parseLsn(rs.getString(6)),
          rs.getString(7),
          rs.getBoolean(8),
          false));
      }
    }
  }

  private static Lsn parseLsn(String text) {
    return text == null ? Lsn.INVALID : Lsn.valueOf(text);
  }

  private static void applySlotOption(ChainedLogicalStreamBuilder builder, String key, Object value) {
    if (value instanceof Boolean) {
      builder.withSlotOption(key, (Boolean) value);
      return;
    }
    if (value instanceof Number) {
      builder.withSlotOption(key, ((Number) value).intValue());
      return;
    }
    builder.withSlotOption(key, String.valueOf(value));
  }
}

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

import dev.henneberger.vertx.cdc.core.Checkpoint;
import dev.henneberger.vertx.cdc.core.CheckpointStore;
import dev.henneberger.vertx.cdc.core.Lsn;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps checkpoints in a table of the replicated database, on a regular (non-replication)
 * connection. The table is created on first use.
 *
 * <p>The upsert only replaces a row whose stored position is behind the new one, so a backwards save
 * is rejected atomically and saving the stored position again writes nothing. Every write is a
 * transaction of the replicated database; {@link ReplicationSlotManager} excludes the table from the
 * slot's output with {@link #replicationFilter()}.
 */
public class PostgresCheckpointStore implements CheckpointStore {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresCheckpointStore.class);
  private static final Pattern TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_]{0,62}(\\.[a-z_][a-z0-9_]{0,62})?");

  public static final String DEFAULT_TABLE = "cdc_checkpoints";

  private final PostgresConnector connector;
  private final String table;
  private volatile boolean tableReady;

  public PostgresCheckpointStore(PostgresReplicationOptions options) {
    this(options, DEFAULT_TABLE);
  }

  public PostgresCheckpointStore(PostgresReplicationOptions options, String table) {
    this(new PostgresConnector(Objects.requireNonNull(options, "options").resolved()), table);
  }

  PostgresCheckpointStore(PostgresConnector connector, String table) {
    this.connector = Objects.requireNonNull(connector, "connector");
    this.table = Objects.requireNonNull(table, "table");
    if (!TABLE_NAME.matcher(table).matches()) {
      throw new IllegalArgumentException("Invalid checkpoint table name: " + table);
    }
  }

  public String table() {
    return table;
  }

  /**
   * The checkpoint table in wal2json {@code filter-tables} syntax. An unqualified table matches any schema.
   */
  public String replicationFilter() {
    return table.indexOf('.') >= 0 ? table : "*." + table;
  }

  @Override
  public Optional<Checkpoint> load(String slotName) throws SQLException {
    Objects.requireNonNull(slotName, "slotName");
    try (Connection conn = connector.openStandardConnection()) {
      ensureTable(conn);
      try (PreparedStatement stmt = conn.prepareStatement(
        "SELECT confirmed_lsn::text, updated_at FROM " + table + " WHERE slot_name = ?")) {
        stmt.setString(1, slotName);
        try (ResultSet rs = stmt.executeQuery()) {
          if (!rs.next()) {
            return Optional.empty();
          }
          return Optional.of(toCheckpoint(slotName, rs.getString(1), rs.getTimestamp(2)));
        }
      }
    }
  }

  @Override
  public Checkpoint save(String slotName, Lsn confirmedLsn) throws SQLException {
    Objects.requireNonNull(slotName, "slotName");
    Objects.requireNonNull(confirmedLsn, "confirmedLsn");
    try (Connection conn = connector.openStandardConnection()) {
      ensureTable(conn);
      String sql = "INSERT INTO " + table + " AS c (slot_name, confirmed_lsn, updated_at) "
        + "VALUES (?, ?::pg_lsn, now()) "
        + "ON CONFLICT (slot_name) DO UPDATE SET confirmed_lsn = EXCLUDED.confirmed_lsn, updated_at = EXCLUDED.updated_at "
        + "WHERE c.confirmed_lsn < EXCLUDED.confirmed_lsn "
        + "RETURNING confirmed_lsn::text, updated_at";
      try (PreparedStatement stmt = conn.prepareStatement(sql)) {
        stmt.setString(1, slotName);
        stmt.setString(2, confirmedLsn.asString());
        try (ResultSet rs = stmt.executeQuery()) {
          if (rs.next()) {
            return toCheckpoint(slotName, rs.getString(1), rs.getTimestamp(2));
          }
        }
      }
      Optional<Checkpoint> current = load(slotName);
      if (current.isPresent() && current.get().confirmedLsn().equals(confirmedLsn)) {
        return current.get();
      }
      throw new IllegalStateException("Checkpoint for slot '" + slotName + "' cannot move back from "
        + current.map(Checkpoint::confirmedLsn).orElse(null) + " to " + confirmedLsn);
    }
  }

  private void ensureTable(Connection conn) throws SQLException {
    if (tableReady) {
      return;
    }
    try (Statement stmt = conn.createStatement()) {
      stmt.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
        + "slot_name text PRIMARY KEY, "
        + "confirmed_lsn pg_lsn NOT NULL, "
        + "updated_at timestamptz NOT NULL)");
    }
    tableReady = true;
    LOG.debug("Checkpoint table {} is ready", table);
  }

  private static Checkpoint toCheckpoint(String slotName, String lsnText, Timestamp updatedAt) {
    return new Checkpoint(slotName, Lsn.valueOf(lsnText), updatedAt.toInstant());
  }
}

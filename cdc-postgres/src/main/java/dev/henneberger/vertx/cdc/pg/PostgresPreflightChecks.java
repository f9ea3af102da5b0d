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
import dev.henneberger.vertx.cdc.core.PreflightIssue;
import dev.henneberger.vertx.cdc.core.PreflightReport;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Server and slot checks run before streaming starts.
 */
final class PostgresPreflightChecks {

  static final long SLOT_LAG_WARNING_BYTES = 128L * 1024L * 1024L;

  private final PostgresReplicationOptions options;
  private final PostgresConnector connector;
  private final ReplicationSlotManager slotManager;

  PostgresPreflightChecks(PostgresReplicationOptions options,
                          PostgresConnector connector,
                          ReplicationSlotManager slotManager) {
    this.options = Objects.requireNonNull(options, "options");
    this.connector = Objects.requireNonNull(connector, "connector");
    this.slotManager = Objects.requireNonNull(slotManager, "slotManager");
  }

  PreflightReport run() {
    List<PreflightIssue> issues = new ArrayList<>();

    if (!options.getChangeDecoder().supportsPlugin(options.getPlugin())) {
      issues.add(PreflightIssue.error(
        "DECODER_PLUGIN_MISMATCH",
        "Decoder '" + options.getChangeDecoder().getClass().getSimpleName()
          + "' does not support plugin '" + options.getPlugin() + "'",
        "Use a compatible decoder for the configured plugin."));
    }

    try (Connection conn = connector.openStandardConnection()) {
      checkWalLevel(conn, issues);
      checkRolePrivileges(conn, issues);
      checkPositiveSetting(conn, "max_replication_slots", "MAX_REPLICATION_SLOTS_INVALID", issues);
      checkPositiveSetting(conn, "max_wal_senders", "MAX_WAL_SENDERS_INVALID", issues);
      Optional<ReplicationSlot> slot = slotManager.readSlot(conn, options.getSlotName());
      if (slot.isPresent()) {
        checkExistingSlot(slot.get(), issues);
        checkSlotLag(conn, issues);
      }
    } catch (SQLException e) {
      issues.add(PreflightIssue.error(
        "CONNECTION_FAILED",
        "Could not connect to PostgreSQL: " + e.getMessage(),
        "Verify host, port, database, user, password, and SSL settings."));
    }

    return new PreflightReport(issues);
  }

  private static void checkWalLevel(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW wal_level");
         ResultSet rs = statement.executeQuery()) {
      if (!rs.next()) {
        issues.add(PreflightIssue.error(
          "WAL_LEVEL_UNKNOWN",
          "Could not read wal_level",
          "Set wal_level=logical and restart PostgreSQL."));
        return;
      }

      String walLevel = rs.getString(1);
      if (!"logical".equalsIgnoreCase(walLevel)) {
        issues.add(PreflightIssue.error(
          "WAL_LEVEL_INVALID",
          "wal_level is '" + walLevel + "'",
          "Set wal_level=logical and restart PostgreSQL."));
      }
    }
  }

  private static void checkRolePrivileges(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT (rolreplication OR rolsuper) FROM pg_roles WHERE rolname = current_user");
         ResultSet rs = statement.executeQuery()) {
      if (rs.next() && !rs.getBoolean(1)) {
        issues.add(PreflightIssue.warning(
          "ROLE_NOT_REPLICATION",
          "Current user does not have replication privileges",
          "Grant REPLICATION privilege or use a superuser role."));
      }
    }
  }

  private static void checkPositiveSetting(Connection conn,
                                           String setting,
                                           String code,
                                           List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW " + setting);
         ResultSet rs = statement.executeQuery()) {
      if (rs.next()) {
        long value = rs.getLong(1);
        if (value < 1) {
          issues.add(PreflightIssue.error(
            code,
            setting + " is set to " + value,
            "Set " + setting + " to at least 1 and restart PostgreSQL."));
        }
      }
    }
  }

  private void checkExistingSlot(ReplicationSlot slot, List<PreflightIssue> issues) {
    if (!slot.isLogical() || !options.getPlugin().equalsIgnoreCase(slot.pluginName())) {
      issues.add(PreflightIssue.error(
        "SLOT_PLUGIN_MISMATCH",
        "Replication slot '" + slot.slotName() + "' is a " + slot.slotType() + " slot using plugin '"
          + slot.pluginName() + "' but configured plugin is '" + options.getPlugin() + "'",
        "Use a slot created with the configured plugin, or configure a different slot name."));
    }
    if (slot.isWalLost()) {
      issues.add(PreflightIssue.error(
        "SLOT_WAL_LOST",
        "Replication slot '" + slot.slotName() + "' has lost required WAL",
        "Drop and recreate the slot, then resynchronize consumers from a snapshot."));
    }

    Optional<Checkpoint> checkpoint;
    try {
      checkpoint = options.getCheckpointStore().load(slot.slotName());
    } catch (Exception e) {
      issues.add(PreflightIssue.error(
        "CHECKPOINT_UNREADABLE",
        "Could not read checkpoint for slot '" + slot.slotName() + "': " + e.getMessage(),
        "Check the checkpoint store location and permissions."));
      return;
    }
    if (checkpoint.isPresent() && checkpoint.get().confirmedLsn().isBefore(slot.confirmedFlushLsn())) {
      issues.add(PreflightIssue.error(
        "CHECKPOINT_BEHIND_SLOT",
        "Checkpoint " + checkpoint.get().confirmedLsn() + " is behind the slot's confirmed position "
          + slot.confirmedFlushLsn(),
        "Changes in between were confirmed elsewhere; resynchronize consumers before resetting the checkpoint."));
    }
  }

  private void checkSlotLag(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT pg_wal_lsn_diff(pg_current_wal_lsn(), restart_lsn) "
        + "FROM pg_replication_slots WHERE slot_name = ? AND restart_lsn IS NOT NULL")) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next()) {
          long lagBytes = rs.getLong(1);
          if (lagBytes > SLOT_LAG_WARNING_BYTES) {
            issues.add(PreflightIssue.warning(
              "SLOT_LAG_HIGH",
              "Replication slot lag is " + lagBytes + " bytes",
              "Ensure consumers are keeping up."));
          }
        }
      }
    }
  }
}

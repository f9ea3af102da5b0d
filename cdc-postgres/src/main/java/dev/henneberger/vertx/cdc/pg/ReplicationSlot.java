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
import java.util.Objects;

/**
 * Server side state of a replication slot as read from {@code pg_replication_slots}.
 */
public final class ReplicationSlot {

  public static final String WAL_STATUS_LOST = "lost";

  private final String slotName;
  private final String pluginName;
  private final String slotType;
  private final String database;
  private final Lsn restartLsn;
  private final Lsn confirmedFlushLsn;
  private final String walStatus;
  private final boolean active;
  private final boolean created;

  public ReplicationSlot(String slotName,
                         String pluginName,
                         String slotType,
                         String database,
                         Lsn restartLsn,
                         Lsn confirmedFlushLsn,
                         String walStatus,
                         boolean active,
                         boolean created) {
    this.slotName = Objects.requireNonNull(slotName, "slotName");
    this.pluginName = pluginName;
    this.slotType = slotType;
    this.database = database;
    this.restartLsn = restartLsn == null ? Lsn.INVALID : restartLsn;
    this.confirmedFlushLsn = confirmedFlushLsn == null ? Lsn.INVALID : confirmedFlushLsn;
    this.walStatus = walStatus;
    this.active = active;
    this.created = created;
  }

  public String slotName() {
    return slotName;
  }

  /**
   * Output plugin, {@code null} for physical slots.
   */
  public String pluginName() {
    return pluginName;
  }

  public String slotType() {
    return slotType;
  }

  public boolean isLogical() {
    return "logical".equals(slotType);
  }

  public String database() {
    return database;
  }

  public Lsn restartLsn() {
    return restartLsn;
  }

  public Lsn confirmedFlushLsn() {
    return confirmedFlushLsn;
  }

  /**
   * {@code reserved}, {@code extended}, {@code unreserved} or {@code lost}; {@code null} before PostgreSQL 13.
   */
  public String walStatus() {
    return walStatus;
  }

  public boolean isWalLost() {
    return WAL_STATUS_LOST.equals(walStatus);
  }

  public boolean active() {
    return active;
  }

  /**
   * Whether the slot was created by the call that returned it.
   */
  public boolean created() {
    return created;
  }

  ReplicationSlot markCreated() {
    return new ReplicationSlot(slotName, pluginName, slotType, database, restartLsn, confirmedFlushLsn,
      walStatus, active, true);
  }

  @Override
  public String toString() {
    return "ReplicationSlot{" +
      "name='" + slotName + '\'' +
      ", plugin='" + pluginName + '\'' +
      ", type=" + slotType +
      ", database='" + database + '\'' +
      ", restartLsn=" + restartLsn +
      ", confirmedFlushLsn=" + confirmedFlushLsn +
      ", walStatus=" + walStatus +
      ", active=" + active +
      ", created=" + created +
      '}';
  }
}

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.Lsn;
import dev.henneberger.vertx.cdc.core.LsnTooOldException;
import dev.henneberger.vertx.cdc.core.ReplicationConnectionException;
import dev.henneberger.vertx.cdc.core.ReplicationErrors;
import dev.henneberger.vertx.cdc.core.ReplicationException;
import dev.henneberger.vertx.cdc.core.SlotConflictException;
import java.io.EOFException;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class PostgresErrorsTest {

  @Test
  void removedWalIsTooOld() {
    SQLException removed = new SQLException(
      "ERROR: requested WAL segment 000000010000000000000001 has already been removed", "58P01");

    ReplicationException classified = PostgresErrors.classify(new RuntimeException(removed), "orders_slot", Lsn.of(103));

    assertTrue(classified instanceof LsnTooOldException);
    assertEquals(Lsn.of(103), ((LsnTooOldException) classified).requestedLsn());
    assertTrue(ReplicationErrors.isFatal(classified));
  }

  @Test
  void invalidatedSlotIsTooOld() {
    SQLException invalidated = new SQLException(
      "ERROR: can no longer get changes from replication slot \"orders_slot\" "
        + "DETAIL: This slot has been invalidated because it exceeded the maximum reserved size.", "55000");

    assertTrue(PostgresErrors.isWalRemoved(invalidated));
  }

  @Test
  void connectionFailuresAreRetryable() {
    ReplicationException refused = PostgresErrors.classify(
      new SQLException("Connection refused", "08001"), "orders_slot", null);
    ReplicationException busy = PostgresErrors.classify(
      new SQLException("replication slot \"orders_slot\" is active for PID 4242", "55006"), "orders_slot", null);
    ReplicationException eof = PostgresErrors.classify(new EOFException("stream closed"), "orders_slot", null);

    assertTrue(refused instanceof ReplicationConnectionException);
    assertTrue(refused.getMessage().startsWith("Connection failure [08001]"));
    assertTrue(busy.getMessage().startsWith("Replication slot busy"));
    assertTrue(eof instanceof ReplicationConnectionException);
    assertTrue(ReplicationErrors.isRetryable(busy));
  }

  @Test
  void keepsExistingClassification() {
    SlotConflictException conflict = new SlotConflictException("orders_slot", "wal2json", "pgoutput");

    assertSame(conflict, PostgresErrors.classify(conflict, "orders_slot", null));
    assertNull(PostgresErrors.classify(new IllegalStateException("bug"), "orders_slot", null));
  }

  @Test
  void recognisesDuplicateSlot() {
    assertTrue(PostgresErrors.isSlotAlreadyExists(
      new SQLException("replication slot \"orders_slot\" already exists", "42710")));
  }
}

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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.FileCheckpointStore;
import dev.henneberger.vertx.cdc.core.InMemoryCheckpointStore;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReplicationAppConfigTest {

  @Test
  void mapsEnvironmentAndBuildsOptions() {
    Map<String, String> env = new HashMap<>();
    env.put("PGHOST", "pg.internal");
    env.put("PGPORT", "15432");
    env.put("PGDATABASE", "app");
    env.put("PGUSER", "service");
    env.put("PG_PASSWORD_ENV", "APP_DB_PASSWORD");
    env.put("PGSSL", "true");
    env.put("RECONNECT_BACKOFF_MIN_MS", "250");
    env.put("RECONNECT_BACKOFF_MAX_MS", "8000");
    env.put("ACK_BATCH_SIZE", "25");
    env.put("CHECKPOINT_FILE", "/var/lib/cdc/checkpoints.json");

    ReplicationAppConfig cfg = ReplicationAppConfig.fromMap(env, "fraud_detection_slot");

    assertEquals("pg.internal", cfg.pgHost());
    assertEquals(15432, cfg.pgPort());
    assertEquals("app", cfg.pgDatabase());
    assertEquals("service", cfg.pgUser());
    assertEquals("APP_DB_PASSWORD", cfg.pgPasswordEnv());
    assertTrue(cfg.ssl());
    assertEquals(25, cfg.ackBatchSize());

    PostgresReplicationOptions options = cfg.toReplicationOptions();
    assertEquals("pg.internal", options.getHost());
    assertEquals(15432, options.getPort());
    assertEquals("fraud_detection_slot", options.getSlotName());
    assertEquals("APP_DB_PASSWORD", options.getPasswordEnv());
    assertEquals(25, options.getAckBatchSize());
    assertEquals(Duration.ofMillis(250), options.getRetryPolicy().getInitialDelay());
    assertEquals(Duration.ofMillis(8000), options.getRetryPolicy().getMaxDelay());
    assertTrue(options.getCheckpointStore() instanceof FileCheckpointStore);
    assertEquals(Paths.get("/var/lib/cdc/checkpoints.json"),
      ((FileCheckpointStore) options.getCheckpointStore()).file());
  }

  @Test
  void fallsBackToDefaults() {
    ReplicationAppConfig cfg = ReplicationAppConfig.fromMap(Map.of("PGPORT", "not-a-port"), "orders_slot");

    assertEquals("localhost", cfg.pgHost());
    assertEquals(5432, cfg.pgPort());
    assertEquals("PGPASSWORD", cfg.pgPasswordEnv());
    assertFalse(cfg.ssl());
    assertNull(cfg.databaseUrl());
    assertEquals(1000L, cfg.reconnectBackoffMinMs());
    assertEquals(60000L, cfg.reconnectBackoffMaxMs());
    assertTrue(cfg.toReplicationOptions().getCheckpointStore() instanceof InMemoryCheckpointStore);
  }

  @Test
  void slotAndUrlFromEnvironmentWin() {
    Map<String, String> env = new HashMap<>();
    env.put("CDC_SLOT_NAME", "billing_slot");
    env.put("DATABASE_URL", "postgres://svc@db.example.com:6543/billing");
    env.put("PGHOST", "ignored");

    PostgresReplicationOptions resolved = ReplicationAppConfig.fromMap(env, "orders_slot")
      .toReplicationOptions()
      .resolved();

    assertEquals("billing_slot", resolved.getSlotName());
    assertEquals("db.example.com", resolved.getHost());
    assertEquals(6543, resolved.getPort());
    assertEquals("billing", resolved.getDatabase());
    assertEquals("svc", resolved.getUser());
  }
}

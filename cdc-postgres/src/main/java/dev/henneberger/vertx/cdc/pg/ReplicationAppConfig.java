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

import dev.henneberger.vertx.cdc.core.FileCheckpointStore;
import dev.henneberger.vertx.cdc.core.RetryPolicy;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Stream settings read from environment variables.
 *
 * <p>{@code CDC_SLOT_NAME} overrides the slot name passed by the caller. When {@code DATABASE_URL}
 * is set it takes precedence over the discrete {@code PG*} variables.
 */
public final class ReplicationAppConfig {

  private final String pgHost;
  private final int pgPort;
  private final String pgDatabase;
  private final String pgUser;
  private final String pgPasswordEnv;
  private final boolean ssl;
  private final String databaseUrl;
  private final String slotName;
  private final long reconnectBackoffMinMs;
  private final long reconnectBackoffMaxMs;
  private final int ackBatchSize;
  private final String checkpointFile;

  private ReplicationAppConfig(String pgHost,
                               int pgPort,
                               String pgDatabase,
                               String pgUser,
                               String pgPasswordEnv,
                               boolean ssl,
                               String databaseUrl,
                               String slotName,
                               long reconnectBackoffMinMs,
                               long reconnectBackoffMaxMs,
                               int ackBatchSize,
                               String checkpointFile) {
    this.pgHost = pgHost;
    this.pgPort = pgPort;
    this.pgDatabase = pgDatabase;
    this.pgUser = pgUser;
    this.pgPasswordEnv = pgPasswordEnv;
    this.ssl = ssl;
    this.databaseUrl = databaseUrl;
    this.slotName = slotName;
    this.reconnectBackoffMinMs = reconnectBackoffMinMs;
    this.reconnectBackoffMaxMs = reconnectBackoffMaxMs;
    this.ackBatchSize = ackBatchSize;
    this.checkpointFile = checkpointFile;
  }

  public static ReplicationAppConfig fromEnv(String slotName) {
    return fromMap(System.getenv(), slotName);
  }

  static ReplicationAppConfig fromMap(Map<String, String> env, String slotName) {
    Objects.requireNonNull(env, "env");
    Objects.requireNonNull(slotName, "slotName");

    String host = envOrDefault(env, "PGHOST", PostgresReplicationOptions.DEFAULT_HOST);
    int port = intEnvOrDefault(env, "PGPORT", PostgresReplicationOptions.DEFAULT_PORT);
    String database = envOrDefault(env, "PGDATABASE", "postgres");
    String user = envOrDefault(env, "PGUSER", "postgres");
    String passwordEnv = envOrDefault(env, "PG_PASSWORD_ENV", "PGPASSWORD");
    boolean ssl = boolEnvOrDefault(env, "PGSSL", false);
    String databaseUrl = envOrDefault(env, "DATABASE_URL", null);
    String slot = envOrDefault(env, "CDC_SLOT_NAME", slotName);
    long backoffMin = longEnvOrDefault(env, "RECONNECT_BACKOFF_MIN_MS", RetryPolicy.DEFAULT_INITIAL_DELAY_MS);
    long backoffMax = longEnvOrDefault(env, "RECONNECT_BACKOFF_MAX_MS", RetryPolicy.DEFAULT_MAX_DELAY_MS);
    int ackBatch = intEnvOrDefault(env, "ACK_BATCH_SIZE", PostgresReplicationOptions.DEFAULT_ACK_BATCH_SIZE);
    String checkpointFile = envOrDefault(env, "CHECKPOINT_FILE", null);

    return new ReplicationAppConfig(host, port, database, user, passwordEnv, ssl, databaseUrl, slot,
      backoffMin, backoffMax, ackBatch, checkpointFile);
  }

  public String pgHost() {
    return pgHost;
  }

  public int pgPort() {
    return pgPort;
  }

  public String pgDatabase() {
    return pgDatabase;
  }

  public String pgUser() {
    return pgUser;
  }

  public String pgPasswordEnv() {
    return pgPasswordEnv;
  }

  public boolean ssl() {
    return ssl;
  }

  public String databaseUrl() {
    return databaseUrl;
  }

  public String slotName() {
    return slotName;
  }

  public long reconnectBackoffMinMs() {
    return reconnectBackoffMinMs;
  }

  public long reconnectBackoffMaxMs() {
    return reconnectBackoffMaxMs;
  }

  public int ackBatchSize() {
    return ackBatchSize;
  }

  public String checkpointFile() {
    return checkpointFile;
  }

  public PostgresReplicationOptions toReplicationOptions() {
    PostgresReplicationOptions options = new PostgresReplicationOptions()
      .setHost(pgHost)
      .setPort(pgPort)
      .setDatabase(pgDatabase)
      .setUser(pgUser)
      .setPasswordEnv(pgPasswordEnv)
      .setSsl(ssl)
      .setConnectionString(databaseUrl)
      .setSlotName(slotName)
      .setAckBatchSize(ackBatchSize)
      .setRetryPolicy(
        RetryPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofMillis(reconnectBackoffMinMs))
          .setMaxDelay(Duration.ofMillis(reconnectBackoffMaxMs))
      );
    if (checkpointFile != null) {
      Path path = Paths.get(checkpointFile);
      options.setCheckpointStore(new FileCheckpointStore(path));
    }
    return options;
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static long longEnvOrDefault(Map<String, String> env, String key, long defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }
}

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

import dev.henneberger.vertx.cdc.core.CheckpointStore;
import dev.henneberger.vertx.cdc.core.InMemoryCheckpointStore;
import dev.henneberger.vertx.cdc.core.OptionValidation;
import dev.henneberger.vertx.cdc.core.RetryPolicy;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Connection, slot and delivery configuration of a change stream.
 */
@DataObject
@JsonGen(publicConverter = false)
public class PostgresReplicationOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_PLUGIN = Wal2JsonChangeDecoder.PLUGIN;
  public static final int DEFAULT_ACK_BATCH_SIZE = 1;
  public static final int DEFAULT_MAX_PENDING_TRANSACTIONS = 1024;
  public static final long DEFAULT_STATUS_INTERVAL_MS = 10000L;
  public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;

  private String host;
  private int port;
  private String database;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String connectionString;
  private String slotName;

  private String plugin = DEFAULT_PLUGIN;
  private Map<String, Object> pluginOptions = new LinkedHashMap<>();
  private RetryPolicy retryPolicy = RetryPolicy.exponentialBackoff();
  private boolean preflightEnabled;
  private boolean autoStart = true;
  private CheckpointStore checkpointStore = new InMemoryCheckpointStore();
  private ChangeDecoder changeDecoder = new Wal2JsonChangeDecoder();
  private int maxConcurrentDispatch = 1;
  private int ackBatchSize = DEFAULT_ACK_BATCH_SIZE;
  private int maxPendingTransactions = DEFAULT_MAX_PENDING_TRANSACTIONS;
  private long statusIntervalMs = DEFAULT_STATUS_INTERVAL_MS;
  private int connectTimeoutSeconds = DEFAULT_CONNECT_TIMEOUT_SECONDS;
  private boolean skipEmptyTransactions = true;

  public PostgresReplicationOptions() {
    init();
  }

  public PostgresReplicationOptions(JsonObject json) {
    init();
    PostgresReplicationOptionsConverter.fromJson(json, this);
  }

  public PostgresReplicationOptions(PostgresReplicationOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.connectionString = other.connectionString;
    this.slotName = other.slotName;
    this.plugin = other.plugin;
    this.pluginOptions = new LinkedHashMap<>(other.pluginOptions);
    this.retryPolicy = other.retryPolicy.copy();
    this.preflightEnabled = other.preflightEnabled;
    this.autoStart = other.autoStart;
    this.checkpointStore = other.checkpointStore;
    this.changeDecoder = other.changeDecoder;
    this.maxConcurrentDispatch = other.maxConcurrentDispatch;
    this.ackBatchSize = other.ackBatchSize;
    this.maxPendingTransactions = other.maxPendingTransactions;
    this.statusIntervalMs = other.statusIntervalMs;
    this.connectTimeoutSeconds = other.connectTimeoutSeconds;
    this.skipEmptyTransactions = other.skipEmptyTransactions;
  }

  public String getHost() {
    return host;
  }

  public PostgresReplicationOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public PostgresReplicationOptions setPort(Integer port) {
    this.port = port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public PostgresReplicationOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public PostgresReplicationOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public PostgresReplicationOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  /**
   * Name of an environment variable holding the password, used when no password is set.
   */
  public PostgresReplicationOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public PostgresReplicationOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getConnectionString() {
    return connectionString;
  }

  /**
   * A {@code postgresql://} URI. Parts it specifies take precedence over host, port, database, user,
   * password and ssl.
   */
  public PostgresReplicationOptions setConnectionString(String connectionString) {
    this.connectionString = connectionString;
    return this;
  }

  public String getSlotName() {
    return slotName;
  }

  public PostgresReplicationOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public String getPlugin() {
    return plugin;
  }

  public PostgresReplicationOptions setPlugin(String plugin) {
    this.plugin = plugin;
    return this;
  }

  public Map<String, Object> getPluginOptions() {
    return Collections.unmodifiableMap(pluginOptions);
  }

  /**
   * Extra output plugin options, e.g. {@code add-tables}. Applied on top of the decoder's defaults.
   */
  public PostgresReplicationOptions setPluginOptions(Map<String, Object> options) {
    this.pluginOptions = options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options);
    return this;
  }

  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  @GenIgnore
  public PostgresReplicationOptions setRetryPolicy(RetryPolicy retryPolicy) {
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    return this;
  }

  public boolean isPreflightEnabled() {
    return preflightEnabled;
  }

  public PostgresReplicationOptions setPreflightEnabled(boolean preflightEnabled) {
    this.preflightEnabled = preflightEnabled;
    return this;
  }

  public boolean isAutoStart() {
    return autoStart;
  }

  public PostgresReplicationOptions setAutoStart(boolean autoStart) {
    this.autoStart = autoStart;
    return this;
  }

  public int getMaxConcurrentDispatch() {
    return maxConcurrentDispatch;
  }

  public PostgresReplicationOptions setMaxConcurrentDispatch(int maxConcurrentDispatch) {
    this.maxConcurrentDispatch = maxConcurrentDispatch;
    return this;
  }

  public int getAckBatchSize() {
    return ackBatchSize;
  }

  /**
   * Number of acknowledged transactions after which the checkpoint is saved and confirmed, even when
   * more transactions are waiting.
   */
  public PostgresReplicationOptions setAckBatchSize(int ackBatchSize) {
    this.ackBatchSize = ackBatchSize;
    return this;
  }

  public int getMaxPendingTransactions() {
    return maxPendingTransactions;
  }

  public PostgresReplicationOptions setMaxPendingTransactions(int maxPendingTransactions) {
    this.maxPendingTransactions = maxPendingTransactions;
    return this;
  }

  public long getStatusIntervalMs() {
    return statusIntervalMs;
  }

  public PostgresReplicationOptions setStatusIntervalMs(long statusIntervalMs) {
    this.statusIntervalMs = statusIntervalMs;
    return this;
  }

  public int getConnectTimeoutSeconds() {
    return connectTimeoutSeconds;
  }

  public PostgresReplicationOptions setConnectTimeoutSeconds(int connectTimeoutSeconds) {
    this.connectTimeoutSeconds = connectTimeoutSeconds;
    return this;
  }

  public boolean isSkipEmptyTransactions() {
    return skipEmptyTransactions;
  }

  /**
   * Whether transactions without row changes are confirmed without being handed to subscribers.
   */
  public PostgresReplicationOptions setSkipEmptyTransactions(boolean skipEmptyTransactions) {
    this.skipEmptyTransactions = skipEmptyTransactions;
    return this;
  }

  @GenIgnore
  public CheckpointStore getCheckpointStore() {
    return checkpointStore;
  }

  @GenIgnore
  public PostgresReplicationOptions setCheckpointStore(CheckpointStore checkpointStore) {
    this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
    return this;
  }

  @GenIgnore
  public ChangeDecoder getChangeDecoder() {
    return changeDecoder;
  }

  @GenIgnore
  public PostgresReplicationOptions setChangeDecoder(ChangeDecoder changeDecoder) {
    this.changeDecoder = Objects.requireNonNull(changeDecoder, "changeDecoder");
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresReplicationOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresReplicationOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new PostgresReplicationOptions(json)
      .setCheckpointStore(checkpointStore)
      .setChangeDecoder(changeDecoder);
  }

  /**
   * Copy with the connection string, if any, applied to the individual connection fields.
   */
  PostgresReplicationOptions resolved() {
    PostgresReplicationOptions copy = new PostgresReplicationOptions(this);
    if (connectionString != null && !connectionString.isBlank()) {
      ConnectionStrings.applyTo(connectionString, copy);
    }
    return copy;
  }

  void validate() {
    OptionValidation.require("host", host);
    OptionValidation.requirePort(port);
    OptionValidation.require("database", database);
    OptionValidation.require("user", user);
    OptionValidation.requireSlotName(slotName);
    OptionValidation.require("plugin", plugin);
    Objects.requireNonNull(pluginOptions, "pluginOptions");
    Object formatVersion = pluginOptions.get("format-version");
    if (formatVersion != null && !"2".equals(String.valueOf(formatVersion))) {
      throw new IllegalArgumentException("only wal2json format-version 2 is supported");
    }
    Objects.requireNonNull(retryPolicy, "retryPolicy").validate();
    Objects.requireNonNull(checkpointStore, "checkpointStore");
    ChangeDecoder decoder = Objects.requireNonNull(changeDecoder, "changeDecoder");
    if (!decoder.supportsPlugin(plugin)) {
      throw new IllegalArgumentException(
        "changeDecoder " + decoder.getClass().getSimpleName() + " does not support plugin " + plugin);
    }
    OptionValidation.requireMin("maxConcurrentDispatch", maxConcurrentDispatch, 1);
    OptionValidation.requireMin("ackBatchSize", ackBatchSize, 1);
    OptionValidation.requireMin("maxPendingTransactions", maxPendingTransactions, 1);
    OptionValidation.requireMin("statusIntervalMs", statusIntervalMs, 100L);
    OptionValidation.requireMin("connectTimeoutSeconds", connectTimeoutSeconds, 0);
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    plugin = DEFAULT_PLUGIN;
    pluginOptions = new LinkedHashMap<>();
    retryPolicy = RetryPolicy.exponentialBackoff();
    preflightEnabled = false;
    autoStart = true;
    checkpointStore = new InMemoryCheckpointStore();
    changeDecoder = new Wal2JsonChangeDecoder();
    maxConcurrentDispatch = 1;
    ackBatchSize = DEFAULT_ACK_BATCH_SIZE;
    maxPendingTransactions = DEFAULT_MAX_PENDING_TRANSACTIONS;
    statusIntervalMs = DEFAULT_STATUS_INTERVAL_MS;
    connectTimeoutSeconds = DEFAULT_CONNECT_TIMEOUT_SECONDS;
    skipEmptyTransactions = true;
  }
}

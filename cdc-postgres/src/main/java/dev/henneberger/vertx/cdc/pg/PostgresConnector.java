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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import org.postgresql.PGProperty;

/**
 * Opens regular and replication JDBC connections for one set of options.
 */
public class PostgresConnector {

  static final String APPLICATION_NAME = "vertx-wal2json-cdc";

  private final PostgresReplicationOptions options;

  public PostgresConnector(PostgresReplicationOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * A walsender connection in database mode, able to run the streaming replication protocol.
   */
  public Connection openReplicationConnection() throws SQLException {
    Properties props = connectionProperties();
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "9.4");
    return DriverManager.getConnection(jdbcUrl(), props);
  }

  public Connection openStandardConnection() throws SQLException {
    return DriverManager.getConnection(jdbcUrl(), connectionProperties());
  }

  public String jdbcUrl() {
    return "jdbc:postgresql://" + options.getHost() + ':' + options.getPort() + '/' + options.getDatabase();
  }

  Properties connectionProperties() {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());

    String password = resolvePassword();
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }

    if (Boolean.TRUE.equals(options.getSsl())) {
      PGProperty.SSL.set(props, "true");
      PGProperty.SSL_MODE.set(props, "require");
    }
    PGProperty.APPLICATION_NAME.set(props, APPLICATION_NAME);
    PGProperty.CONNECT_TIMEOUT.set(props, Integer.toString(options.getConnectTimeoutSeconds()));
    PGProperty.TCP_KEEP_ALIVE.set(props, "true");
    return props;
  }

  String resolvePassword() {
    String password = options.getPassword();
    if (password == null || password.isBlank()) {
      String envName = options.getPasswordEnv();
      if (envName != null && !envName.isBlank()) {
        password = System.getenv(envName);
      }
    }
    return password;
  }
}

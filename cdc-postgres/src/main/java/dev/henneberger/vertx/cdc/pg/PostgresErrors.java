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
import dev.henneberger.vertx.cdc.core.ReplicationException;
import java.io.IOException;
import java.sql.SQLException;

/**
 * Maps JDBC and I/O failures onto the replication error taxonomy by SQLSTATE.
 */
public final class PostgresErrors {

  public static final String DUPLICATE_OBJECT = "42710";
  public static final String UNDEFINED_OBJECT = "42704";
  public static final String OBJECT_IN_USE = "55006";
  public static final String OBJECT_NOT_IN_PREREQUISITE_STATE = "55000";
  public static final String UNDEFINED_FILE = "58P01";
  public static final String UNDEFINED_COLUMN = "42703";

  private PostgresErrors() {
  }

  public static ReplicationException classify(Throwable error, String slotName, Lsn lastConfirmedLsn) {
    if (error instanceof ReplicationException) {
      return (ReplicationException) error;
    }
    SQLException sqlError = findSqlException(error);
    if (sqlError != null && isWalRemoved(sqlError)) {
      return new LsnTooOldException(slotName, lastConfirmedLsn, null, sqlError.getMessage(), error);
    }
    if (sqlError != null) {
      return new ReplicationConnectionException(
        describe(sqlError), slotName, lastConfirmedLsn, error);
    }
    if (error instanceof IOException) {
      return new ReplicationConnectionException("I/O failure: " + error.getMessage(), slotName, lastConfirmedLsn, error);
    }
    return null;
  }

  public static boolean isSlotAlreadyExists(SQLException error) {
    if (DUPLICATE_OBJECT.equals(error.getSQLState())) {
      return true;
    }
    String message = error.getMessage();
    return message != null && message.contains("already exists");
  }

  public static boolean isUndefinedObject(SQLException error) {
    return UNDEFINED_OBJECT.equals(error.getSQLState());
  }

  public static boolean isObjectInUse(SQLException error) {
    return OBJECT_IN_USE.equals(error.getSQLState());
  }

  public static boolean isUndefinedColumn(SQLException error) {
    return UNDEFINED_COLUMN.equals(error.getSQLState());
  }

  /**
   * The WAL needed by the slot is gone: either a segment was removed or the slot was invalidated.
   */
  public static boolean isWalRemoved(SQLException error) {
    String state = error.getSQLState();
    String message = error.getMessage();
    if (UNDEFINED_FILE.equals(state)) {
      return true;
    }
    if (message == null) {
      return false;
    }
    if (message.contains("requested WAL segment") && message.contains("has already been removed")) {
      return true;
    }
    return OBJECT_NOT_IN_PREREQUISITE_STATE.equals(state) && message.contains("invalidated");
  }

  public static boolean isConnectionFailure(SQLException error) {
    String state = error.getSQLState();
    return state != null && (state.startsWith("08") || state.startsWith("57P") || "53300".equals(state));
  }

  static SQLException findSqlException(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth++ < 16) {
      if (current instanceof SQLException) {
        return (SQLException) current;
      }
      current = current.getCause();
    }
    return null;
  }

  private static String describe(SQLException error) {
    String state = error.getSQLState();
    String kind;
    if (isConnectionFailure(error)) {
      kind = "Connection failure";
    } else if (isUndefinedObject(error)) {
      kind = "Replication slot missing";
    } else if (isObjectInUse(error)) {
      kind = "Replication slot busy";
    } else {
      kind = "Database error";
    }
    return kind + (state == null ? "" : " [" + state + "]") + ": " + error.getMessage();
  }
}

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

import dev.henneberger.vertx.cdc.core.ChangeKind;
import dev.henneberger.vertx.cdc.core.ColumnValue;
import dev.henneberger.vertx.cdc.core.Lsn;
import dev.henneberger.vertx.cdc.core.WalDecodeException;
import dev.henneberger.vertx.cdc.core.WalMessage;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoder for wal2json {@code format-version} 2, where every message is a single JSON object with an
 * {@code action}: {@code B}/{@code C} transaction boundaries, {@code I}/{@code U}/{@code D} row changes
 * and {@code M} logical messages. {@code A} is read as an aborted transaction.
 */
public class Wal2JsonChangeDecoder implements ChangeDecoder {

  public static final String PLUGIN = "wal2json";

  private static final Map<String, Object> DEFAULT_SLOT_OPTIONS;

  static {
    Map<String, Object> options = new LinkedHashMap<>();
    options.put("format-version", 2);
    options.put("include-xids", true);
    options.put("include-timestamp", true);
    options.put("include-lsn", true);
    options.put("include-types", true);
    options.put("include-typmod", false);
    options.put("numeric-data-types-as-string", true);
    options.put("actions", "insert,update,delete");
    DEFAULT_SLOT_OPTIONS = Collections.unmodifiableMap(options);
  }

  @Override
  public WalMessage decode(String payload, Lsn receiveLsn) {
    if (payload == null || payload.isBlank()) {
      throw new WalDecodeException("Empty wal2json message", payload);
    }

    JsonObject json;
    try {
      json = new JsonObject(payload);
    } catch (DecodeException e) {
      throw new WalDecodeException("Message is not a JSON object", payload, e);
    }

    try {
      return decode(json, payload, receiveLsn);
    } catch (WalDecodeException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new WalDecodeException("Malformed wal2json message: " + e.getMessage(), payload, e);
    }
  }

  @Override
  public boolean supportsPlugin(String plugin) {
    return PLUGIN.equalsIgnoreCase(plugin);
  }

  @Override
  public Map<String, Object> defaultSlotOptions() {
    return DEFAULT_SLOT_OPTIONS;
  }

  private WalMessage decode(JsonObject json, String payload, Lsn receiveLsn) {
    String action = json.getString("action");
    if (action == null) {
      throw new WalDecodeException("Missing 'action'", payload);
    }
    switch (action) {
      case "B":
        return WalMessage.begin(requireXid(json, payload), lsn(json, payload, receiveLsn), timestamp(json));
      case "C":
        return WalMessage.commit(requireXid(json, payload), lsn(json, payload, receiveLsn), timestamp(json));
      case "A":
        return WalMessage.rollback(requireXid(json, payload), lsn(json, payload, receiveLsn));
      case "I":
        return rowChange(ChangeKind.INSERT, json, payload, receiveLsn);
      case "U":
        return rowChange(ChangeKind.UPDATE, json, payload, receiveLsn);
      case "D":
        return rowChange(ChangeKind.DELETE, json, payload, receiveLsn);
      case "M":
        return WalMessage.logicalMessage(
          json.getBoolean("transactional", false),
          json.getString("prefix"),
          json.getString("content"),
          lsn(json, payload, receiveLsn));
      default:
        throw new WalDecodeException("Unknown action '" + action + "'", payload);
    }
  }

  private WalMessage rowChange(ChangeKind kind, JsonObject json, String payload, Lsn receiveLsn) {
    String schema = requireText(json, "schema", payload);
    String table = requireText(json, "table", payload);
    List<ColumnValue> columns = kind == ChangeKind.DELETE
      ? Collections.emptyList()
      : columns(json.getJsonArray("columns"), "columns", payload);
    List<ColumnValue> identity = columns(json.getJsonArray("identity"), "identity", payload);
    if (kind == ChangeKind.INSERT && columns.isEmpty()) {
      throw new WalDecodeException("Insert into " + schema + '.' + table + " without columns", payload);
    }
    Long xid = json.containsKey("xid") ? json.getLong("xid") : null;
    return WalMessage.rowChange(xid, kind, schema, table, columns, identity, lsn(json, payload, receiveLsn));
  }

  private static List<ColumnValue> columns(JsonArray array, String field, String payload) {
    if (array == null || array.isEmpty()) {
      return Collections.emptyList();
    }
    List<ColumnValue> values = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      Object raw = array.getValue(i);
      if (!(raw instanceof JsonObject)) {
        throw new WalDecodeException("Entry " + i + " of '" + field + "' is not an object", payload);
      }
      JsonObject column = (JsonObject) raw;
      String name = column.getString("name");
      if (name == null || name.isEmpty()) {
        throw new WalDecodeException("Entry " + i + " of '" + field + "' has no name", payload);
      }
      try {
        values.add(Wal2JsonTypeMapping.toColumnValue(name, column.getString("type"), column.getValue("value")));
      } catch (IllegalArgumentException e) {
        throw new WalDecodeException(e.getMessage(), payload, e);
      }
    }
    return values;
  }

  private static long requireXid(JsonObject json, String payload) {
    Long xid = json.getLong("xid");
    if (xid == null) {
      throw new WalDecodeException("Missing 'xid'", payload);
    }
    return xid;
  }

  private static String requireText(JsonObject json, String field, String payload) {
    String value = json.getString(field);
    if (value == null || value.isEmpty()) {
      throw new WalDecodeException("Missing '" + field + "'", payload);
    }
    return value;
  }

  private static Lsn lsn(JsonObject json, String payload, Lsn receiveLsn) {
    String text = json.getString("lsn");
    if (text == null) {
      if (receiveLsn == null || !receiveLsn.isValid()) {
        throw new WalDecodeException("Missing 'lsn'", payload);
      }
      return receiveLsn;
    }
    try {
      return Lsn.valueOf(text);
    } catch (IllegalArgumentException e) {
      throw new WalDecodeException("Invalid 'lsn' " + text, payload, e);
    }
  }

  private static Instant timestamp(JsonObject json) {
    String text = json.getString("timestamp");
    if (text == null || text.isBlank()) {
      return null;
    }
    return Wal2JsonTypeMapping.parseTimestampTz(text).toInstant();
  }
}

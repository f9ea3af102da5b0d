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

import dev.henneberger.vertx.cdc.core.ColumnValue;
import dev.henneberger.vertx.cdc.core.ValueKind;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps PostgreSQL type names, as reported by wal2json with {@code include-types}, to {@link ValueKind}s
 * and converts the JSON encoded column values accordingly.
 *
 * <p>Types without an entry (enums, arrays, domains, geometric and network types, ...) are kept as
 * text. When the type name is missing the kind is inferred from the JSON value.
 */
public final class Wal2JsonTypeMapping {

  private static final Map<String, ValueKind> KINDS = new HashMap<>();

  static {
    for (String name : new String[] {"smallint", "integer", "bigint", "int", "int2", "int4", "int8",
      "smallserial", "serial", "bigserial", "serial2", "serial4", "serial8", "oid", "xid", "cid"}) {
      KINDS.put(name, ValueKind.INTEGER);
    }
    KINDS.put("numeric", ValueKind.DECIMAL);
    KINDS.put("decimal", ValueKind.DECIMAL);
    KINDS.put("real", ValueKind.FLOAT);
    KINDS.put("float4", ValueKind.FLOAT);
    KINDS.put("double precision", ValueKind.FLOAT);
    KINDS.put("float8", ValueKind.FLOAT);
    KINDS.put("boolean", ValueKind.BOOLEAN);
    KINDS.put("bool", ValueKind.BOOLEAN);
    KINDS.put("timestamp", ValueKind.TIMESTAMP);
    KINDS.put("timestamp without time zone", ValueKind.TIMESTAMP);
    KINDS.put("timestamptz", ValueKind.TIMESTAMPTZ);
    KINDS.put("timestamp with time zone", ValueKind.TIMESTAMPTZ);
    KINDS.put("date", ValueKind.DATE);
    KINDS.put("time", ValueKind.TIME);
    KINDS.put("time without time zone", ValueKind.TIME);
    KINDS.put("json", ValueKind.JSON);
    KINDS.put("jsonb", ValueKind.JSON);
    KINDS.put("bytea", ValueKind.BINARY);
  }

  private static final DateTimeFormatter LOCAL_DATE = new DateTimeFormatterBuilder()
    .appendValue(ChronoField.YEAR_OF_ERA, 4, 10, SignStyle.NORMAL)
    .appendLiteral('-')
    .appendValue(ChronoField.MONTH_OF_YEAR, 2)
    .appendLiteral('-')
    .appendValue(ChronoField.DAY_OF_MONTH, 2)
    .toFormatter(Locale.ROOT);

  private static final DateTimeFormatter LOCAL_TIME = new DateTimeFormatterBuilder()
    .appendValue(ChronoField.HOUR_OF_DAY, 2)
    .appendLiteral(':')
    .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
    .appendLiteral(':')
    .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
    .optionalStart()
    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
    .optionalEnd()
    .toFormatter(Locale.ROOT);

  private static final DateTimeFormatter LOCAL_TIMESTAMP = new DateTimeFormatterBuilder()
    .append(LOCAL_DATE)
    .appendLiteral(' ')
    .append(LOCAL_TIME)
    .toFormatter(Locale.ROOT);

  private static final DateTimeFormatter OFFSET_TIMESTAMP = new DateTimeFormatterBuilder()
    .append(LOCAL_TIMESTAMP)
    .appendOffset("+HH:mm:ss", "+00")
    .toFormatter(Locale.ROOT);

  private Wal2JsonTypeMapping() {
  }

  /**
   * Kind for a declared type name, or {@code null} when no type name is given.
   */
  public static ValueKind kindOf(String typeName) {
    if (typeName == null || typeName.isBlank()) {
      return null;
    }
    String normalized = normalizeTypeName(typeName);
    if (normalized.endsWith("[]") || normalized.startsWith("_")) {
      return ValueKind.TEXT;
    }
    ValueKind kind = KINDS.get(normalized);
    return kind == null ? ValueKind.TEXT : kind;
  }

  /**
   * Converts a raw wal2json column value.
   *
   * @throws IllegalArgumentException when the value cannot be read as its declared type
   */
  public static ColumnValue toColumnValue(String name, String typeName, Object raw) {
    if (raw == null) {
      return ColumnValue.nullValue(name, typeName);
    }
    ValueKind kind = kindOf(typeName);
    if (kind == null) {
      kind = inferKind(raw);
    }
    try {
      return convert(name, typeName, kind, raw);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException(
        "Column '" + name + "' value '" + raw + "' is not a valid " + (typeName == null ? kind : typeName), e);
    }
  }

  static String normalizeTypeName(String typeName) {
    String normalized = typeName.trim().toLowerCase(Locale.ROOT).replace("\"", "");
    int paren = normalized.indexOf('(');
    if (paren >= 0) {
      int close = normalized.indexOf(')', paren);
      normalized = (normalized.substring(0, paren) + (close >= 0 ? normalized.substring(close + 1) : "")).trim();
    }
    int dot = normalized.lastIndexOf('.');
    if (dot >= 0 && normalized.startsWith("pg_catalog.")) {
      normalized = normalized.substring(dot + 1);
    }
    return normalized.replaceAll("\\s+", " ");
  }

  private static ValueKind inferKind(Object raw) {
    if (raw instanceof Boolean) {
      return ValueKind.BOOLEAN;
    }
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
      return ValueKind.INTEGER;
    }
    if (raw instanceof BigInteger || raw instanceof BigDecimal) {
      return ValueKind.DECIMAL;
    }
    if (raw instanceof Number) {
      return ValueKind.FLOAT;
    }
    if (raw instanceof JsonObject || raw instanceof JsonArray || raw instanceof Map || raw instanceof java.util.List) {
      return ValueKind.JSON;
    }
    return ValueKind.TEXT;
  }

  private static ColumnValue convert(String name, String typeName, ValueKind kind, Object raw) {
    switch (kind) {
      case NULL:
        return ColumnValue.nullValue(name, typeName);
      case BOOLEAN:
        return new ColumnValue(name, typeName, kind, toBoolean(raw));
      case INTEGER:
        return new ColumnValue(name, typeName, kind, toLong(raw));
      case DECIMAL:
        return toDecimal(name, typeName, raw);
      case FLOAT:
        return new ColumnValue(name, typeName, kind, toDouble(raw));
      case TEXT:
        return new ColumnValue(name, typeName, kind, raw instanceof String ? raw : Json.encode(raw));
      case TIMESTAMP:
        return new ColumnValue(name, typeName, kind, parseTimestamp(text(raw)));
      case TIMESTAMPTZ:
        return new ColumnValue(name, typeName, kind, parseTimestampTz(text(raw)));
      case DATE:
        return new ColumnValue(name, typeName, kind, parseDate(text(raw)));
      case TIME:
        return new ColumnValue(name, typeName, kind, parseTime(text(raw)));
      case JSON:
        Object json = toJson(raw);
        return json == null ? ColumnValue.nullValue(name, typeName) : new ColumnValue(name, typeName, kind, json);
      case BINARY:
        return new ColumnValue(name, typeName, kind, parseBytea(text(raw)));
      default:
        throw new IllegalStateException("Unhandled value kind " + kind);
    }
  }

  private static String text(Object raw) {
    if (raw instanceof String) {
      return (String) raw;
    }
    throw new IllegalArgumentException("expected a string but got " + raw.getClass().getSimpleName());
  }

  private static Boolean toBoolean(Object raw) {
    if (raw instanceof Boolean) {
      return (Boolean) raw;
    }
    switch (text(raw).trim().toLowerCase(Locale.ROOT)) {
      case "t":
      case "true":
        return Boolean.TRUE;
      case "f":
      case "false":
        return Boolean.FALSE;
      default:
        throw new IllegalArgumentException("not a boolean");
    }
  }

  private static Long toLong(Object raw) {
    if (raw instanceof BigInteger) {
      return ((BigInteger) raw).longValueExact();
    }
    if (raw instanceof BigDecimal) {
      return ((BigDecimal) raw).longValueExact();
    }
    if (raw instanceof Double || raw instanceof Float) {
      return BigDecimal.valueOf(((Number) raw).doubleValue()).longValueExact();
    }
    if (raw instanceof Number) {
      return ((Number) raw).longValue();
    }
    return Long.parseLong(text(raw).trim());
  }

  private static ColumnValue toDecimal(String name, String typeName, Object raw) {
    if (raw instanceof String) {
      String value = ((String) raw).trim();
      if (isNonFinite(value)) {
        return new ColumnValue(name, typeName, ValueKind.FLOAT, Double.parseDouble(value));
      }
      return new ColumnValue(name, typeName, ValueKind.DECIMAL, new BigDecimal(value));
    }
    if (raw instanceof Double && !Double.isFinite((Double) raw)) {
      return new ColumnValue(name, typeName, ValueKind.FLOAT, raw);
    }
    if (raw instanceof Number) {
      return new ColumnValue(name, typeName, ValueKind.DECIMAL, new BigDecimal(raw.toString()));
    }
    throw new IllegalArgumentException("not a number");
  }

  private static Double toDouble(Object raw) {
    if (raw instanceof Number) {
      return ((Number) raw).doubleValue();
    }
    return Double.parseDouble(text(raw).trim());
  }

  private static boolean isNonFinite(String value) {
    return "NaN".equals(value) || "Infinity".equals(value) || "-Infinity".equals(value);
  }

  private static Object toJson(Object raw) {
    if (raw instanceof JsonObject || raw instanceof JsonArray) {
      return raw;
    }
    if (raw instanceof Map) {
      @SuppressWarnings("unchecked")
      Map<String, Object> map = (Map<String, Object>) raw;
      return new JsonObject(map);
    }
    if (raw instanceof java.util.List) {
      return new JsonArray((java.util.List<?>) raw);
    }
    if (!(raw instanceof String)) {
      return raw;
    }
    String value = ((String) raw).trim();
    if (value.startsWith("{")) {
      return new JsonObject(value);
    }
    if (value.startsWith("[")) {
      return new JsonArray(value);
    }
    return Json.decodeValue(value);
  }

  static LocalDateTime parseTimestamp(String value) {
    String trimmed = value.trim();
    if ("infinity".equals(trimmed)) {
      return LocalDateTime.MAX;
    }
    if ("-infinity".equals(trimmed)) {
      return LocalDateTime.MIN;
    }
    boolean bc = trimmed.endsWith(" BC");
    LocalDateTime parsed = LocalDateTime.parse(bc ? stripEra(trimmed) : trimmed, LOCAL_TIMESTAMP);
    return bc ? parsed.withYear(1 - parsed.getYear()) : parsed;
  }

  static OffsetDateTime parseTimestampTz(String value) {
    String trimmed = value.trim();
    if ("infinity".equals(trimmed)) {
      return OffsetDateTime.MAX;
    }
    if ("-infinity".equals(trimmed)) {
      return OffsetDateTime.MIN;
    }
    boolean bc = trimmed.endsWith(" BC");
    OffsetDateTime parsed = OffsetDateTime.parse(bc ? stripEra(trimmed) : trimmed, OFFSET_TIMESTAMP);
    return bc ? parsed.withYear(1 - parsed.getYear()) : parsed;
  }

  static LocalDate parseDate(String value) {
    String trimmed = value.trim();
    if ("infinity".equals(trimmed)) {
      return LocalDate.MAX;
    }
    if ("-infinity".equals(trimmed)) {
      return LocalDate.MIN;
    }
    boolean bc = trimmed.endsWith(" BC");
    LocalDate parsed = LocalDate.parse(bc ? stripEra(trimmed) : trimmed, LOCAL_DATE);
    return bc ? parsed.withYear(1 - parsed.getYear()) : parsed;
  }

  static LocalTime parseTime(String value) {
    String trimmed = value.trim();
    // PostgreSQL accepts 24:00:00 as end of day.
    if (trimmed.startsWith("24:00:00")) {
      return LocalTime.MAX;
    }
    return LocalTime.parse(trimmed, LOCAL_TIME);
  }

  static byte[] parseBytea(String value) {
    if (!value.startsWith("\\x")) {
      throw new IllegalArgumentException("bytea value is not in hex format");
    }
    String hex = value.substring(2);
    if (hex.length() % 2 != 0) {
      throw new IllegalArgumentException("odd number of hex digits");
    }
    byte[] bytes = new byte[hex.length() / 2];
    for (int i = 0; i < bytes.length; i++) {
      int high = Character.digit(hex.charAt(2 * i), 16);
      int low = Character.digit(hex.charAt(2 * i + 1), 16);
      if (high < 0 || low < 0) {
        throw new IllegalArgumentException("invalid hex digit");
      }
      bytes[i] = (byte) ((high << 4) | low);
    }
    return bytes;
  }

  private static String stripEra(String value) {
    return value.substring(0, value.length() - 3);
  }
}

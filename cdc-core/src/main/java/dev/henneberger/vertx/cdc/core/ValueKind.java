package dev.henneberger.vertx.cdc.core;

/**
 * Semantic kinds a decoded column value can take. The Java type carried by
 * {@link ColumnValue#value()} is fixed per kind.
 */
public enum ValueKind {
  /** SQL NULL; value is {@code null}. */
  NULL,
  /** {@link Boolean}. */
  BOOLEAN,
  /** {@link Long}. */
  INTEGER,
  /** {@link java.math.BigDecimal}. */
  DECIMAL,
  /** {@link Double}. */
  FLOAT,
  /** {@link String}. */
  TEXT,
  /** {@link java.time.LocalDateTime}. */
  TIMESTAMP,
  /** {@link java.time.OffsetDateTime}. */
  TIMESTAMPTZ,
  /** {@link java.time.LocalDate}. */
  DATE,
  /** {@link java.time.LocalTime}. */
  TIME,
  /** {@link io.vertx.core.json.JsonObject}, {@link io.vertx.core.json.JsonArray} or a JSON scalar. */
  JSON,
  /** {@code byte[]}. */
  BINARY
}

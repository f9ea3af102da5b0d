package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * One decoded column: its name, the declared PostgreSQL type and a value typed per {@link ValueKind}.
 */
public final class ColumnValue {

  private final String name;
  private final String type;
  private final ValueKind kind;
  private final Object value;

  public ColumnValue(String name, String type, ValueKind kind, Object value) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = type;
    this.kind = Objects.requireNonNull(kind, "kind");
    if (kind == ValueKind.NULL && value != null) {
      throw new IllegalArgumentException("NULL column '" + name + "' cannot carry a value");
    }
    if (kind != ValueKind.NULL && value == null) {
      throw new IllegalArgumentException("column '" + name + "' of kind " + kind + " requires a value");
    }
    this.value = value instanceof byte[] ? ((byte[]) value).clone() : value;
  }

  public static ColumnValue nullValue(String name, String type) {
    return new ColumnValue(name, type, ValueKind.NULL, null);
  }

  public String name() {
    return name;
  }

  public String type() {
    return type;
  }

  public ValueKind kind() {
    return kind;
  }

  public Object value() {
    return value instanceof byte[] ? ((byte[]) value).clone() : value;
  }

  public boolean isNull() {
    return kind == ValueKind.NULL;
  }

  public String asString() {
    if (value == null) {
      return null;
    }
    if (kind == ValueKind.BINARY) {
      return Base64.getEncoder().encodeToString((byte[]) value);
    }
    return String.valueOf(value);
  }

  public Long asLong() {
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    if (value instanceof String) {
      try {
        return Long.valueOf((String) value);
      } catch (NumberFormatException ignore) {
        return null;
      }
    }
    return null;
  }

  public BigDecimal asDecimal() {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof Long) {
      return BigDecimal.valueOf((Long) value);
    }
    if (value instanceof Double && Double.isFinite((Double) value)) {
      return BigDecimal.valueOf((Double) value);
    }
    return null;
  }

  public Boolean asBoolean() {
    return value instanceof Boolean ? (Boolean) value : null;
  }

  /**
   * Renders the value as something {@link JsonObject} can encode: temporal kinds become
   * ISO-8601 strings, binary becomes base64.
   */
  public Object toJsonValue() {
    switch (kind) {
      case NULL:
        return null;
      case BOOLEAN:
      case INTEGER:
      case FLOAT:
      case TEXT:
        return value;
      case DECIMAL:
        return ((BigDecimal) value).toPlainString();
      case TIMESTAMP:
        return ((LocalDateTime) value).toString();
      case TIMESTAMPTZ:
        return ((OffsetDateTime) value).toString();
      case DATE:
        return ((LocalDate) value).toString();
      case TIME:
        return ((LocalTime) value).toString();
      case JSON:
        if (value instanceof JsonObject) {
          return ((JsonObject) value).copy();
        }
        if (value instanceof JsonArray) {
          return ((JsonArray) value).copy();
        }
        return value;
      case BINARY:
        return Base64.getEncoder().encodeToString((byte[]) value);
      default:
        throw new IllegalStateException("Unhandled value kind " + kind);
    }
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("name", name)
      .put("type", type)
      .put("kind", kind.name())
      .put("value", toJsonValue());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnValue)) {
      return false;
    }
    ColumnValue other = (ColumnValue) o;
    if (!name.equals(other.name) || !Objects.equals(type, other.type) || kind != other.kind) {
      return false;
    }
    if (value instanceof byte[] && other.value instanceof byte[]) {
      return Arrays.equals((byte[]) value, (byte[]) other.value);
    }
    return Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(name, type, kind);
    return 31 * result + (value instanceof byte[] ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value));
  }

  @Override
  public String toString() {
    return name + '(' + kind + ")=" + asString();
  }
}

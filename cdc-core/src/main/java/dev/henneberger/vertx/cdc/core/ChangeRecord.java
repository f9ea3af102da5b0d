package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single row-level mutation decoded from the WAL.
 */
public final class ChangeRecord {

  private final ChangeKind kind;
  private final String schema;
  private final String table;
  private final List<ColumnValue> columns;
  private final List<ColumnValue> oldColumns;
  private final Lsn lsn;
  private final long transactionId;

  public ChangeRecord(ChangeKind kind,
                      String schema,
                      String table,
                      List<ColumnValue> columns,
                      List<ColumnValue> oldColumns,
                      Lsn lsn,
                      long transactionId) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.table = Objects.requireNonNull(table, "table");
    this.columns = unmodifiableCopy(columns);
    this.oldColumns = unmodifiableCopy(oldColumns);
    this.lsn = Objects.requireNonNull(lsn, "lsn");
    this.transactionId = transactionId;
  }

  public ChangeKind kind() {
    return kind;
  }

  public String schema() {
    return schema;
  }

  public String table() {
    return table;
  }

  public String qualifiedTable() {
    return schema + '.' + table;
  }

  /**
   * New row state in column order. Empty for deletes.
   */
  public List<ColumnValue> columns() {
    return columns;
  }

  /**
   * Replica identity columns of the previous row state, when the table's replica identity provides them.
   */
  public List<ColumnValue> oldColumns() {
    return oldColumns;
  }

  public Lsn lsn() {
    return lsn;
  }

  public long transactionId() {
    return transactionId;
  }

  public Optional<ColumnValue> column(String name) {
    return find(columns, name);
  }

  public Optional<ColumnValue> oldColumn(String name) {
    return find(oldColumns, name);
  }

  /**
   * Looks the column up in the new row state first, then in the old identity.
   */
  public Optional<ColumnValue> columnOrKey(String name) {
    Optional<ColumnValue> current = column(name);
    return current.isPresent() ? current : oldColumn(name);
  }

  public Map<String, Object> values() {
    return toMap(columns);
  }

  public Map<String, Object> oldValues() {
    return toMap(oldColumns);
  }

  public String string(String name) {
    return columnOrKey(name).map(ColumnValue::asString).orElse(null);
  }

  public Long longValue(String name) {
    return columnOrKey(name).map(ColumnValue::asLong).orElse(null);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("kind", kind.name())
      .put("schema", schema)
      .put("table", table)
      .put("lsn", lsn.asString())
      .put("xid", transactionId)
      .put("columns", toJsonArray(columns))
      .put("old_columns", toJsonArray(oldColumns));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChangeRecord)) {
      return false;
    }
    ChangeRecord other = (ChangeRecord) o;
    return transactionId == other.transactionId
      && kind == other.kind
      && schema.equals(other.schema)
      && table.equals(other.table)
      && columns.equals(other.columns)
      && oldColumns.equals(other.oldColumns)
      && lsn.equals(other.lsn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, schema, table, columns, oldColumns, lsn, transactionId);
  }

  @Override
  public String toString() {
    return "ChangeRecord{" +
      "kind=" + kind +
      ", table='" + qualifiedTable() + '\'' +
      ", columns=" + columns +
      ", oldColumns=" + oldColumns +
      ", lsn=" + lsn +
      ", xid=" + transactionId +
      '}';
  }

  private static Optional<ColumnValue> find(List<ColumnValue> values, String name) {
    for (ColumnValue value : values) {
      if (value.name().equals(name)) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }

  private static Map<String, Object> toMap(List<ColumnValue> values) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (ColumnValue value : values) {
      map.put(value.name(), value.value());
    }
    return Collections.unmodifiableMap(map);
  }

  private static JsonArray toJsonArray(List<ColumnValue> values) {
    JsonArray array = new JsonArray();
    for (ColumnValue value : values) {
      array.add(value.toJson());
    }
    return array;
  }

  private static List<ColumnValue> unmodifiableCopy(List<ColumnValue> values) {
    if (values == null || values.isEmpty()) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(values));
  }
}

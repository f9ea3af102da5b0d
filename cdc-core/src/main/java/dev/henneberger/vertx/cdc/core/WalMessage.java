package dev.henneberger.vertx.cdc.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A decoded output plugin message. The set of variants is closed: every subclass is nested here and
 * identified by {@link #kind()}, so consumers can switch over {@link Kind} exhaustively.
 */
public abstract class WalMessage {

  public enum Kind {
    BEGIN,
    COMMIT,
    ROLLBACK,
    ROW_CHANGE,
    LOGICAL_MESSAGE
  }

  private final Lsn lsn;

  private WalMessage(Lsn lsn) {
    this.lsn = Objects.requireNonNull(lsn, "lsn");
  }

  public abstract Kind kind();

  public Lsn lsn() {
    return lsn;
  }

  public static Begin begin(long xid, Lsn lsn, Instant timestamp) {
    return new Begin(xid, lsn, timestamp);
  }

  public static Commit commit(long xid, Lsn lsn, Instant timestamp) {
    return new Commit(xid, lsn, timestamp);
  }

  public static Rollback rollback(long xid, Lsn lsn) {
    return new Rollback(xid, lsn);
  }

  public static RowChange rowChange(Long xid,
                                    ChangeKind changeKind,
                                    String schema,
                                    String table,
                                    List<ColumnValue> columns,
                                    List<ColumnValue> oldColumns,
                                    Lsn lsn) {
    return new RowChange(xid, changeKind, schema, table, columns, oldColumns, lsn);
  }

  public static LogicalMessage logicalMessage(boolean transactional, String prefix, String content, Lsn lsn) {
    return new LogicalMessage(transactional, prefix, content, lsn);
  }

  public static final class Begin extends WalMessage {
    private final long xid;
    private final Instant timestamp;

    private Begin(long xid, Lsn lsn, Instant timestamp) {
      super(lsn);
      this.xid = xid;
      this.timestamp = timestamp;
    }

    @Override
    public Kind kind() {
      return Kind.BEGIN;
    }

    public long xid() {
      return xid;
    }

    public Instant timestamp() {
      return timestamp;
    }

    @Override
    public String toString() {
      return "Begin{xid=" + xid + ", lsn=" + lsn() + '}';
    }
  }

  public static final class Commit extends WalMessage {
    private final long xid;
    private final Instant timestamp;

    private Commit(long xid, Lsn lsn, Instant timestamp) {
      super(lsn);
      this.xid = xid;
      this.timestamp = timestamp;
    }

    @Override
    public Kind kind() {
      return Kind.COMMIT;
    }

    public long xid() {
      return xid;
    }

    public Instant timestamp() {
      return timestamp;
    }

    @Override
    public String toString() {
      return "Commit{xid=" + xid + ", lsn=" + lsn() + '}';
    }
  }

  public static final class Rollback extends WalMessage {
    private final long xid;

    private Rollback(long xid, Lsn lsn) {
      super(lsn);
      this.xid = xid;
    }

    @Override
    public Kind kind() {
      return Kind.ROLLBACK;
    }

    public long xid() {
      return xid;
    }

    @Override
    public String toString() {
      return "Rollback{xid=" + xid + ", lsn=" + lsn() + '}';
    }
  }

  public static final class RowChange extends WalMessage {
    private final Long xid;
    private final ChangeKind changeKind;
    private final String schema;
    private final String table;
    private final List<ColumnValue> columns;
    private final List<ColumnValue> oldColumns;

    private RowChange(Long xid,
                      ChangeKind changeKind,
                      String schema,
                      String table,
                      List<ColumnValue> columns,
                      List<ColumnValue> oldColumns,
                      Lsn lsn) {
      super(lsn);
      this.xid = xid;
      this.changeKind = Objects.requireNonNull(changeKind, "changeKind");
      this.schema = Objects.requireNonNull(schema, "schema");
      this.table = Objects.requireNonNull(table, "table");
      this.columns = columns == null ? List.of() : List.copyOf(columns);
      this.oldColumns = oldColumns == null ? List.of() : List.copyOf(oldColumns);
    }

    @Override
    public Kind kind() {
      return Kind.ROW_CHANGE;
    }

    /**
     * Transaction id carried by the message, or {@code null} when the plugin omitted it.
     */
    public Long xid() {
      return xid;
    }

    public ChangeKind changeKind() {
      return changeKind;
    }

    public String schema() {
      return schema;
    }

    public String table() {
      return table;
    }

    public List<ColumnValue> columns() {
      return columns;
    }

    public List<ColumnValue> oldColumns() {
      return oldColumns;
    }

    public ChangeRecord toRecord(long transactionId) {
      return new ChangeRecord(changeKind, schema, table, columns, oldColumns, lsn(), transactionId);
    }

    @Override
    public String toString() {
      return "RowChange{" + changeKind + ' ' + schema + '.' + table + ", xid=" + xid + ", lsn=" + lsn() + '}';
    }
  }

  /**
   * A message written with {@code pg_logical_emit_message}. Not part of any row change.
   */
  public static final class LogicalMessage extends WalMessage {
    private final boolean transactional;
    private final String prefix;
    private final String content;

    private LogicalMessage(boolean transactional, String prefix, String content, Lsn lsn) {
      super(lsn);
      this.transactional = transactional;
      this.prefix = prefix;
      this.content = content;
    }

    @Override
    public Kind kind() {
      return Kind.LOGICAL_MESSAGE;
    }

    public boolean transactional() {
      return transactional;
    }

    public String prefix() {
      return prefix;
    }

    public String content() {
      return content;
    }

    @Override
    public String toString() {
      return "LogicalMessage{prefix='" + prefix + "', transactional=" + transactional + ", lsn=" + lsn() + '}';
    }
  }
}

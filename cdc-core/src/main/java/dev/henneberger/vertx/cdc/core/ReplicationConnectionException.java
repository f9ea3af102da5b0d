package dev.henneberger.vertx.cdc.core;

/**
 * Transient failure of the database connection or of the replication protocol transport.
 */
public class ReplicationConnectionException extends ReplicationException {

  public ReplicationConnectionException(String message, Throwable cause) {
    this(message, null, null, cause);
  }

  public ReplicationConnectionException(String message, String slotName, Lsn lastConfirmedLsn, Throwable cause) {
    super(message, slotName, lastConfirmedLsn, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}

package dev.henneberger.vertx.cdc.core;

/**
 * The server no longer retains WAL for the requested position. Changes between the checkpoint and the
 * slot's position are lost and the consumer has to resynchronize from a full snapshot.
 */
public class LsnTooOldException extends ReplicationException {

  private final Lsn requestedLsn;
  private final Lsn availableLsn;

  public LsnTooOldException(String slotName, Lsn requestedLsn, Lsn availableLsn, String reason, Throwable cause) {
    super("Requested LSN " + requestedLsn + " is no longer available for slot '" + slotName + "'"
      + (availableLsn == null ? "" : " (earliest available " + availableLsn + ")")
      + (reason == null ? "" : ": " + reason), slotName, requestedLsn, cause);
    this.requestedLsn = requestedLsn;
    this.availableLsn = availableLsn;
  }

  public Lsn requestedLsn() {
    return requestedLsn;
  }

  public Lsn availableLsn() {
    return availableLsn;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}

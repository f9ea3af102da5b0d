package dev.henneberger.vertx.cdc.core;

/**
 * Base type for failures of a replication stream. Carries the slot and the last confirmed
 * position when they are known at the point of failure, so an operator can resynchronize.
 */
public abstract class ReplicationException extends RuntimeException {

  private final String slotName;
  private final Lsn lastConfirmedLsn;

  protected ReplicationException(String message, String slotName, Lsn lastConfirmedLsn, Throwable cause) {
    super(message, cause);
    this.slotName = slotName;
    this.lastConfirmedLsn = lastConfirmedLsn;
  }

  /**
   * Whether the connection supervisor may reconnect and try again.
   */
  public abstract boolean isRetryable();

  public String slotName() {
    return slotName;
  }

  public Lsn lastConfirmedLsn() {
    return lastConfirmedLsn;
  }
}

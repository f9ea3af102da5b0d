package dev.henneberger.vertx.cdc.core;

/**
 * A subscriber failed to process a transaction. The transaction is redelivered from the last checkpoint.
 */
public class ConsumerFailedException extends ReplicationException {

  private final Lsn commitLsn;

  public ConsumerFailedException(String slotName, Lsn lastConfirmedLsn, Lsn commitLsn, Throwable cause) {
    super("Consumer failed to process transaction committed at " + commitLsn, slotName, lastConfirmedLsn, cause);
    this.commitLsn = commitLsn;
  }

  public Lsn commitLsn() {
    return commitLsn;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}

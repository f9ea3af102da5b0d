package dev.henneberger.vertx.cdc.core;

/**
 * The message sequence broke an ordering or grouping invariant. Indicates a decoder or server bug.
 */
public class ProtocolInvariantViolationException extends ReplicationException {

  public ProtocolInvariantViolationException(String message) {
    super(message, null, null, null);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}

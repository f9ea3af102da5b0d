package dev.henneberger.vertx.cdc.core;

public final class ReplicationErrors {

  private ReplicationErrors() {
  }

  /**
   * Default retry classification: the first {@link ReplicationException} in the cause chain decides;
   * anything else is treated as transient.
   */
  public static boolean isRetryable(Throwable error) {
    ReplicationException replicationError = find(error);
    return replicationError == null || replicationError.isRetryable();
  }

  public static boolean isFatal(Throwable error) {
    return !isRetryable(error);
  }

  public static ReplicationException find(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth++ < 16) {
      if (current instanceof ReplicationException) {
        return (ReplicationException) current;
      }
      current = current.getCause();
    }
    return null;
  }

  /**
   * One-line operator description including the slot and the last confirmed position.
   */
  public static String describe(Throwable error, String slotName, Lsn lastConfirmedLsn) {
    ReplicationException replicationError = find(error);
    String type = replicationError == null ? error.getClass().getSimpleName() : replicationError.getClass().getSimpleName();
    String message = replicationError == null ? error.getMessage() : replicationError.getMessage();
    StringBuilder sb = new StringBuilder();
    sb.append(type)
      .append(" slot=").append(slotName)
      .append(" lastConfirmedLsn=").append(lastConfirmedLsn == null ? "none" : lastConfirmedLsn.asString());
    if (message != null) {
      sb.append(": ").append(message);
    }
    return sb.toString();
  }
}

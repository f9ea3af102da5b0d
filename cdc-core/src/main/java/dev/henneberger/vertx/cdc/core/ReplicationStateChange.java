package dev.henneberger.vertx.cdc.core;

public final class ReplicationStateChange {
  private final ReplicationStreamState previousState;
  private final ReplicationStreamState state;
  private final Throwable cause;
  private final long attempt;
  private final Lsn confirmedLsn;

  public ReplicationStateChange(ReplicationStreamState previousState,
                                ReplicationStreamState state,
                                Throwable cause,
                                long attempt,
                                Lsn confirmedLsn) {
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
    this.attempt = attempt;
    this.confirmedLsn = confirmedLsn;
  }

  public ReplicationStreamState previousState() {
    return previousState;
  }

  public ReplicationStreamState state() {
    return state;
  }

  public Throwable cause() {
    return cause;
  }

  public long attempt() {
    return attempt;
  }

  /**
   * Last saved checkpoint at the time of the transition, or {@code null} before one was loaded.
   */
  public Lsn confirmedLsn() {
    return confirmedLsn;
  }

  @Override
  public String toString() {
    return "ReplicationStateChange{" + previousState + " -> " + state
      + ", attempt=" + attempt
      + ", confirmedLsn=" + confirmedLsn
      + (cause == null ? "" : ", cause=" + cause)
      + '}';
  }
}

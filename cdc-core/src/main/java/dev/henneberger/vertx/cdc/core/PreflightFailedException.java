package dev.henneberger.vertx.cdc.core;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Raised by {@code start()} when the database cannot serve the slot. Never retried: each error issue
 * needs a configuration change on the server.
 */
public final class PreflightFailedException extends ReplicationException {

  private final PreflightReport report;
  private final ReplicationStreamState state;

  public PreflightFailedException(String slotName, PreflightReport report, ReplicationStreamState state) {
    super(PreflightReports.describeFailure(slotName, Objects.requireNonNull(report, "report")), slotName, null, null);
    this.report = report;
    this.state = state == null ? ReplicationStreamState.CONNECTING : state;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }

  public PreflightReport report() {
    return report;
  }

  /**
   * State the stream was in when the check ran.
   */
  public ReplicationStreamState state() {
    return state;
  }

  public List<String> errorCodes() {
    return report.issues().stream()
      .filter(issue -> issue.severity() == PreflightIssue.Severity.ERROR)
      .map(PreflightIssue::code)
      .collect(Collectors.toList());
  }
}

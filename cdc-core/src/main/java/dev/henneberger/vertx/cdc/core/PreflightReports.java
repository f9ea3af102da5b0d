package dev.henneberger.vertx.cdc.core;

import java.util.Objects;
import java.util.stream.Collectors;

public final class PreflightReports {

  private PreflightReports() {
  }

  /**
   * One line naming the slot and every error issue with its remediation. Warnings are left out.
   */
  public static String describeFailure(String slotName, PreflightReport report) {
    Objects.requireNonNull(report, "report");
    String subject = slotName == null ? "Preflight" : "Preflight for slot '" + slotName + "'";
    if (report.ok()) {
      return subject + " passed";
    }
    return subject + " failed: " + report.issues().stream()
      .filter(issue -> issue.severity() == PreflightIssue.Severity.ERROR)
      .map(PreflightReports::formatIssue)
      .collect(Collectors.joining("; "));
  }

  public static String formatIssue(PreflightIssue issue) {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(issue.code()).append("] ").append(issue.message());
    if (issue.remediation() != null && !issue.remediation().isBlank()) {
      sb.append(" Remediation: ").append(issue.remediation());
    }
    return sb.toString();
  }
}

package dev.henneberger.vertx.cdc.core;

import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;

public final class PreflightReports {

  private PreflightReports() {
  }

  public static String describeFailure(PreflightReport report) {
    Objects.requireNonNull(report, "report");
    return "Preflight failed: " + report.errors().stream()
      .map(PreflightReports::formatIssue)
      .collect(Collectors.joining("; "));
  }

  /**
   * Logs every non-error finding; errors surface through {@link PreflightFailedException}.
   */
  public static void logFindings(PreflightReport report, Logger logger) {
    for (PreflightIssue issue : report.issues()) {
      if (issue.severity() == PreflightIssue.Severity.WARNING) {
        logger.warn("preflight {}", formatIssue(issue));
      } else if (issue.severity() == PreflightIssue.Severity.INFO) {
        logger.info("preflight {}", formatIssue(issue));
      }
    }
  }

  static String formatIssue(PreflightIssue issue) {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(issue.code()).append("] ").append(issue.message());
    if (issue.remediation() != null && !issue.remediation().isBlank()) {
      sb.append(" Remediation: ").append(issue.remediation());
    }
    return sb.toString();
  }
}

package dev.henneberger.vertx.cdc.core;

import java.util.List;
import java.util.stream.Collectors;

public final class PreflightReport {

  private final List<PreflightIssue> issues;

  public PreflightReport(List<PreflightIssue> issues) {
    this.issues = issues == null ? List.of() : List.copyOf(issues);
  }

  public boolean ok() {
    return errors().isEmpty();
  }

  public List<PreflightIssue> issues() {
    return issues;
  }

  public List<PreflightIssue> errors() {
    return withSeverity(PreflightIssue.Severity.ERROR);
  }

  public List<PreflightIssue> warnings() {
    return withSeverity(PreflightIssue.Severity.WARNING);
  }

  public boolean hasIssue(String code) {
    return issues.stream().anyMatch(issue -> issue.code().equals(code));
  }

  private List<PreflightIssue> withSeverity(PreflightIssue.Severity severity) {
    return issues.stream()
      .filter(issue -> issue.severity() == severity)
      .collect(Collectors.toList());
  }
}

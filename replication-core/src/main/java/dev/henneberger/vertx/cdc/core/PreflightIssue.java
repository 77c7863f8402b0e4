package dev.henneberger.vertx.cdc.core;

import java.util.Objects;

/**
 * A single finding of the startup checks run against the source database.
 */
public final class PreflightIssue {

  public enum Severity {
    INFO,
    WARNING,
    ERROR
  }

  private final Severity severity;
  private final String code;
  private final String message;
  private final String remediation;

  public PreflightIssue(Severity severity, String code, String message, String remediation) {
    this.severity = Objects.requireNonNull(severity, "severity");
    this.code = Objects.requireNonNull(code, "code");
    this.message = Objects.requireNonNull(message, "message");
    this.remediation = remediation;
  }

  public static PreflightIssue error(String code, String message, String remediation) {
    return new PreflightIssue(Severity.ERROR, code, message, remediation);
  }

  public static PreflightIssue warning(String code, String message, String remediation) {
    return new PreflightIssue(Severity.WARNING, code, message, remediation);
  }

  public static PreflightIssue info(String code, String message) {
    return new PreflightIssue(Severity.INFO, code, message, null);
  }

  public Severity severity() {
    return severity;
  }

  public String code() {
    return code;
  }

  public String message() {
    return message;
  }

  public String remediation() {
    return remediation;
  }

  @Override
  public String toString() {
    return severity + " [" + code + "] " + message;
  }
}

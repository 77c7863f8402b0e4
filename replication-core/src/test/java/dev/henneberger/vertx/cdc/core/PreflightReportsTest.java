package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PreflightReportsTest {

  @Test
  void formatsDetailedFailureMessage() {
    PreflightReport report = new PreflightReport(List.of(
      PreflightIssue.error(
        "WAL_LEVEL_NOT_LOGICAL",
        "wal_level is 'replica'",
        "Set wal_level=logical and restart PostgreSQL."),
      PreflightIssue.warning(
        "WAL_SENDER_TIMEOUT",
        "wal_sender_timeout is 60s",
        "Idle streams are disconnected and resumed.")));

    assertFalse(report.ok());
    assertTrue(report.hasIssue("WAL_SENDER_TIMEOUT"));
    assertEquals(
      "Preflight failed: [WAL_LEVEL_NOT_LOGICAL] wal_level is 'replica' "
        + "Remediation: Set wal_level=logical and restart PostgreSQL.",
      PreflightReports.describeFailure(report)
    );
  }

  @Test
  void warningsAloneDoNotFail() {
    PreflightReport report = new PreflightReport(List.of(
      PreflightIssue.info("SLOT_EXISTS", "slot wal2json will be reused")));
    assertTrue(report.ok());
    assertEquals(0, report.errors().size());
  }

  @Test
  void failedExceptionCarriesReport() {
    PreflightReport report = new PreflightReport(List.of(
      PreflightIssue.error(
        "SLOT_LOST",
        "replication slot wal2json was invalidated",
        "Drop the slot and restart from a fresh snapshot.")));
    PreflightFailedException error = new PreflightFailedException(report);

    assertSame(report, error.report());
    assertTrue(error.getMessage().contains("SLOT_LOST"));
  }
}

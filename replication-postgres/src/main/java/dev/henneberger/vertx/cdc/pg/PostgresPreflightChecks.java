/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.cdc.pg;

import dev.henneberger.vertx.cdc.core.PreflightIssue;
import dev.henneberger.vertx.cdc.core.PreflightReport;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup checks that catch server misconfiguration before the worker attaches.
 */
final class PostgresPreflightChecks {

  static final long SLOT_LAG_WARNING_BYTES = 128L * 1024L * 1024L;

  private final PostgresReplicationOptions options;
  private final PostgresConnections connections;

  PostgresPreflightChecks(PostgresReplicationOptions options, PostgresConnections connections) {
    this.options = options;
    this.connections = connections;
  }

  PreflightReport run() {
    List<PreflightIssue> issues = new ArrayList<>();

    if (!options.getChangeDecoder().supportsPlugin(options.getPlugin())) {
      issues.add(PreflightIssue.error(
        "DECODER_PLUGIN_MISMATCH",
        "Decoder '" + options.getChangeDecoder().getClass().getSimpleName()
          + "' does not support plugin '" + options.getPlugin() + "'",
        "Use a compatible decoder for the configured plugin."));
    }

    try (Connection conn = connections.openStandardConnection()) {
      checkWalLevel(conn, issues);
      checkRolePrivileges(conn, issues);
      checkPositiveSetting(conn, "max_replication_slots", "MAX_REPLICATION_SLOTS_INVALID", issues);
      checkPositiveSetting(conn, "max_wal_senders", "MAX_WAL_SENDERS_INVALID", issues);
      checkWalSenderTimeout(conn, issues);
      checkExistingSlot(conn, issues);
      checkSlotLag(conn, issues);
    } catch (SQLException e) {
      issues.add(PreflightIssue.error(
        "CONNECTION_FAILED",
        "Could not connect to PostgreSQL at " + connections.describeTarget() + ": " + e.getMessage(),
        "Verify host, port, database, user, password and SSL settings."));
    }

    return new PreflightReport(issues);
  }

  private void checkWalLevel(Connection conn, List<PreflightIssue> issues) throws SQLException {
    String walLevel = showSetting(conn, "wal_level");
    if (walLevel == null) {
      issues.add(PreflightIssue.error("WAL_LEVEL_UNKNOWN", "Could not read wal_level",
        "Set wal_level=logical and restart PostgreSQL."));
    } else if (!"logical".equalsIgnoreCase(walLevel)) {
      issues.add(PreflightIssue.error("WAL_LEVEL_INVALID", "wal_level is '" + walLevel + "'",
        "Set wal_level=logical (rds.logical_replication=1 on RDS) and restart PostgreSQL."));
    }
  }

  private void checkRolePrivileges(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT (rolreplication OR rolsuper) FROM pg_roles WHERE rolname = current_user");
         ResultSet rs = statement.executeQuery()) {
      if (rs.next() && !rs.getBoolean(1)) {
        issues.add(PreflightIssue.warning(
          "ROLE_NOT_REPLICATION",
          "Current user does not have replication privileges",
          "Grant REPLICATION (rds_replication on RDS) or use a superuser role."));
      }
    }
  }

  private void checkPositiveSetting(Connection conn,
                                    String setting,
                                    String code,
                                    List<PreflightIssue> issues) throws SQLException {
    String value = showSetting(conn, setting);
    if (value != null && parseLong(value) < 1) {
      issues.add(PreflightIssue.error(code, setting + " is set to " + value,
        "Set " + setting + " to at least 1 and restart PostgreSQL."));
    }
  }

  private void checkWalSenderTimeout(Connection conn, List<PreflightIssue> issues) throws SQLException {
    String value = showSetting(conn, "wal_sender_timeout");
    if (value != null && !"0".equals(value.trim())) {
      issues.add(PreflightIssue.info("WAL_SENDER_TIMEOUT",
        "wal_sender_timeout is " + value + "; idle or slow sessions are disconnected and resumed from the slot"));
    }
  }

  private void checkExistingSlot(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(PostgresSessionManager.SLOT_QUERY)) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          if (!options.isCreateSlot()) {
            issues.add(PreflightIssue.error("SLOT_MISSING",
              "Replication slot '" + options.getSlotName() + "' does not exist",
              "Create the slot with the configured plugin or enable slot creation."));
          }
          return;
        }
        String slotPlugin = rs.getString(1);
        if (!options.getPlugin().equalsIgnoreCase(slotPlugin)) {
          issues.add(PreflightIssue.error(
            "SLOT_PLUGIN_MISMATCH",
            "Replication slot uses plugin '" + slotPlugin + "' but configured plugin is '" + options.getPlugin() + "'",
            "Use a slot created with the configured plugin, or configure the matching plugin name."));
        }
        if ("lost".equalsIgnoreCase(rs.getString(3))) {
          issues.add(PreflightIssue.error(
            "SLOT_LOST",
            "Replication slot '" + options.getSlotName() + "' has been invalidated",
            "Drop the slot with SELECT pg_drop_replication_slot('" + options.getSlotName()
              + "') and re-seed the stream from a snapshot."));
        }
      }
    }
  }

  private void checkSlotLag(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT pg_wal_lsn_diff(pg_current_wal_lsn(), restart_lsn) "
        + "FROM pg_replication_slots WHERE slot_name = ? AND restart_lsn IS NOT NULL")) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next()) {
          long lagBytes = rs.getLong(1);
          if (lagBytes > SLOT_LAG_WARNING_BYTES) {
            issues.add(PreflightIssue.warning(
              "SLOT_LAG_HIGH",
              "Replication slot lag is " + lagBytes + " bytes",
              "Retained WAL grows until the worker catches up; check disk headroom on the server."));
          }
        }
      }
    }
  }

  private static String showSetting(Connection conn, String setting) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW " + setting);
         ResultSet rs = statement.executeQuery()) {
      return rs.next() ? rs.getString(1) : null;
    }
  }

  private static long parseLong(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return -1L;
    }
  }
}

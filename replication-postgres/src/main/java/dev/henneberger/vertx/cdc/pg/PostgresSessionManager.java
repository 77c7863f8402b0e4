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

import dev.henneberger.vertx.cdc.core.LogPosition;
import dev.henneberger.vertx.cdc.core.PreflightFailedException;
import dev.henneberger.vertx.cdc.core.PreflightReport;
import dev.henneberger.vertx.cdc.core.ReplicationSession;
import dev.henneberger.vertx.cdc.core.ReplicationSessionFactory;
import dev.henneberger.vertx.cdc.core.SlotInvalidException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.postgresql.PGConnection;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.postgresql.replication.fluent.logical.ChainedLogicalStreamBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches to a PostgreSQL logical replication slot and starts streaming from the slot's
 * confirmed flush position.
 *
 * <p>The slot is created on the first attach if it does not exist; once this manager has
 * attached successfully, a missing slot means it was dropped behind the worker's back and the
 * retained position is gone, which is reported as {@link SlotInvalidException}.
 */
public class PostgresSessionManager implements ReplicationSessionFactory {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresSessionManager.class);

  static final String SLOT_QUERY =
    "SELECT plugin, confirmed_flush_lsn::text, to_jsonb(s) ->> 'wal_status' "
      + "FROM pg_replication_slots s WHERE slot_name = ? AND slot_type = 'logical'";

  private final Vertx vertx;
  private final PostgresReplicationOptions options;
  private final PostgresConnections connections;

  private volatile boolean attachedOnce;

  public PostgresSessionManager(Vertx vertx, PostgresReplicationOptions options) {
    this(vertx, options, PostgresConnections::new);
  }

  PostgresSessionManager(Vertx vertx,
                         PostgresReplicationOptions options,
                         Function<PostgresReplicationOptions, PostgresConnections> connections) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new PostgresReplicationOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.connections = connections.apply(this.options);
  }

  public PostgresReplicationOptions options() {
    return new PostgresReplicationOptions(options);
  }

  public Future<PreflightReport> preflight() {
    return vertx.executeBlocking(() -> new PostgresPreflightChecks(options, connections).run());
  }

  /**
   * Like {@link #preflight()}, but fails with {@link PreflightFailedException} when the report
   * has errors.
   */
  public Future<PreflightReport> verifyPreflight() {
    return preflight().compose(report -> report.ok()
      ? Future.succeededFuture(report)
      : Future.failedFuture(new PreflightFailedException(report)));
  }

  @Override
  public ReplicationSession open() {
    String slotName = options.getSlotName();
    long startPosition;
    try (Connection conn = connections.openStandardConnection()) {
      startPosition = prepareSlot(conn);
    } catch (SQLException e) {
      throw logged(PostgresErrors.openFailure(slotName, e), e);
    }

    ReplicationSession session;
    try {
      session = startStreaming(startPosition);
    } catch (SQLException e) {
      throw logged(PostgresErrors.openFailure(slotName, e), e);
    }
    attachedOnce = true;
    LOG.info("Attached to slot {} on {} at {}", slotName, connections.describeTarget(), LogPosition.format(startPosition));
    return session;
  }

  ReplicationSession startStreaming(long startPosition) throws SQLException {
    Connection replConn = connections.openReplicationConnection();
    try {
      PGReplicationStream stream = openReplicationStream(replConn.unwrap(PGConnection.class), startPosition);
      return new PostgresReplicationSession(options.getSlotName(), replConn, stream, startPosition);
    } catch (SQLException | RuntimeException e) {
      closeQuietly(replConn);
      throw e;
    }
  }

  private long prepareSlot(Connection conn) throws SQLException {
    String slotName = options.getSlotName();
    Optional<SlotState> slot = readSlot(conn);
    if (slot.isEmpty()) {
      if (attachedOnce) {
        throw new SlotInvalidException(slotName,
          "replication slot '" + slotName + "' disappeared after it was in use; changes since the last "
            + "acknowledged position are no longer retained");
      }
      if (!options.isCreateSlot()) {
        throw new SlotInvalidException(slotName, "replication slot '" + slotName + "' does not exist");
      }
      createSlot(conn);
      slot = readSlot(conn);
      if (slot.isEmpty()) {
        throw new SlotInvalidException(slotName, "replication slot '" + slotName + "' was not created");
      }
    }

    SlotState state = slot.get();
    if (!options.getPlugin().equalsIgnoreCase(state.plugin)) {
      throw new SlotInvalidException(slotName, "replication slot '" + slotName + "' uses plugin '"
        + state.plugin + "' but '" + options.getPlugin() + "' is configured");
    }
    if ("lost".equalsIgnoreCase(state.walStatus)) {
      throw new SlotInvalidException(slotName, "replication slot '" + slotName
        + "' was invalidated because required WAL was removed");
    }
    return state.confirmedFlush == null ? LogPosition.INVALID : LogSequenceNumber.valueOf(state.confirmedFlush).asLong();
  }

  private Optional<SlotState> readSlot(Connection conn) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(SLOT_QUERY)) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new SlotState(rs.getString(1), rs.getString(2), rs.getString(3)));
      }
    }
  }

  private void createSlot(Connection conn) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT pg_create_logical_replication_slot(?, ?)")) {
      statement.setString(1, options.getSlotName());
      statement.setString(2, options.getPlugin());
      try {
        statement.execute();
        LOG.info("Created replication slot {} with plugin {}", options.getSlotName(), options.getPlugin());
      } catch (SQLException createError) {
        if (!PostgresErrors.isSlotAlreadyExists(createError)) {
          throw createError;
        }
        LOG.debug("Replication slot {} was created concurrently", options.getSlotName());
      }
    }
  }

  private PGReplicationStream openReplicationStream(PGConnection pgConnection, long startPosition) throws SQLException {
    ChainedLogicalStreamBuilder builder = pgConnection.getReplicationAPI()
      .replicationStream()
      .logical()
      .withSlotName(options.getSlotName())
      .withStartPosition(LogSequenceNumber.valueOf(startPosition))
      .withStatusInterval((int) options.getStatusInterval().toMillis(), TimeUnit.MILLISECONDS);

    if (options.getPluginOptions().isEmpty() && Wal2JsonDecoder.PLUGIN.equalsIgnoreCase(options.getPlugin())) {
      builder.withSlotOption("include-xids", true)
        .withSlotOption("include-timestamp", true)
        .withSlotOption("include-lsn", true)
        .withSlotOption("format-version", 1);
    } else {
      for (Map.Entry<String, Object> entry : options.getPluginOptions().entrySet()) {
        applySlotOption(builder, entry.getKey(), entry.getValue());
      }
    }

    return builder.start();
  }

  private static void applySlotOption(ChainedLogicalStreamBuilder builder, String key, Object value) {
    if (value instanceof Boolean) {
      builder.withSlotOption(key, (Boolean) value);
      return;
    }
    if (value instanceof Number) {
      builder.withSlotOption(key, ((Number) value).intValue());
      return;
    }
    builder.withSlotOption(key, String.valueOf(value));
  }

  private static <T extends RuntimeException> T logged(T error, SQLException cause) {
    if (PostgresErrors.isTransient(cause)) {
      LOG.warn("{}", error.getMessage());
    } else {
      LOG.error("{}", error.getMessage());
    }
    return error;
  }

  private static void closeQuietly(Connection conn) {
    if (conn == null) {
      return;
    }
    try {
      conn.close();
    } catch (SQLException e) {
      LOG.debug("Ignoring failure closing connection", e);
    }
  }

  private static final class SlotState {
    private final String plugin;
    private final String confirmedFlush;
    private final String walStatus;

    private SlotState(String plugin, String confirmedFlush, String walStatus) {
      this.plugin = plugin;
      this.confirmedFlush = confirmedFlush;
      this.walStatus = walStatus;
    }
  }
}

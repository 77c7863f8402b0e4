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
import dev.henneberger.vertx.cdc.core.RawSegment;
import dev.henneberger.vertx.cdc.core.ReplicationSession;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A started logical replication stream on its own replication-mode connection.
 */
final class PostgresReplicationSession implements ReplicationSession {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresReplicationSession.class);
  private static final long IDLE_SLEEP_MILLIS = 10;

  private final String slotName;
  private final Connection connection;
  private final PGReplicationStream stream;
  private final long startPosition;

  private volatile boolean closed;
  private long lastAcknowledged;

  PostgresReplicationSession(String slotName, Connection connection, PGReplicationStream stream, long startPosition) {
    this.slotName = slotName;
    this.connection = connection;
    this.stream = stream;
    this.startPosition = startPosition;
    this.lastAcknowledged = startPosition;
  }

  @Override
  public String slotName() {
    return slotName;
  }

  @Override
  public long startPosition() {
    return startPosition;
  }

  @Override
  public RawSegment nextSegment(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      if (closed) {
        return RawSegment.endOfStream();
      }
      ByteBuffer buffer;
      try {
        buffer = stream.readPending();
      } catch (SQLException e) {
        if (closed) {
          return RawSegment.endOfStream();
        }
        throw PostgresErrors.streamFailure(slotName, e);
      }
      if (buffer != null) {
        LogSequenceNumber received = stream.getLastReceiveLSN();
        long position = received == null ? LogPosition.INVALID : received.asLong();
        return RawSegment.of(decodeWalMessage(buffer), position);
      }

      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return null;
      }
      try {
        Thread.sleep(Math.min(IDLE_SLEEP_MILLIS, TimeUnit.NANOSECONDS.toMillis(remaining) + 1));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return null;
      }
    }
  }

  @Override
  public void acknowledge(long position) {
    if (position <= lastAcknowledged || closed) {
      return;
    }
    LogSequenceNumber lsn = LogSequenceNumber.valueOf(position);
    try {
      stream.setAppliedLSN(lsn);
      stream.setFlushedLSN(lsn);
      stream.forceUpdateStatus();
    } catch (SQLException e) {
      throw PostgresErrors.streamFailure(slotName, e);
    }
    lastAcknowledged = position;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      stream.close();
    } catch (SQLException e) {
      LOG.debug("Ignoring failure closing replication stream on slot {}", slotName, e);
    }
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.debug("Ignoring failure closing replication connection for slot {}", slotName, e);
    }
  }

  private static String decodeWalMessage(ByteBuffer buffer) {
    int offset = buffer.arrayOffset() + buffer.position();
    int length = buffer.remaining();
    return new String(buffer.array(), offset, length, StandardCharsets.UTF_8);
  }
}

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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.ConnectionException;
import dev.henneberger.vertx.cdc.core.ReplicationException;
import dev.henneberger.vertx.cdc.core.SlotInvalidException;
import dev.henneberger.vertx.cdc.core.StreamException;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class PostgresErrorsTest {

  @Test
  void connectionLossIsTransient() {
    SQLException refused = new SQLException("Connection refused", "08001");
    ReplicationException mapped = PostgresErrors.openFailure("orders_slot", refused);

    assertTrue(mapped instanceof ConnectionException);
    assertTrue(mapped.isTransient());
    assertSame(refused, mapped.getCause());
    assertTrue(PostgresErrors.isTransient(refused));
  }

  @Test
  void adminShutdownAndSlotInUseAreTransient() {
    assertTrue(PostgresErrors.isTransient(new SQLException("terminating connection", "57P01")));
    assertTrue(PostgresErrors.isTransient(new SQLException("slot is active", "55006")));
    assertTrue(PostgresErrors.isTransient(new SQLException("too many clients", "53300")));
    assertFalse(PostgresErrors.isTransient(new SQLException("permission denied", "42501")));
  }

  @Test
  void droppedSlotIsNotRetried() {
    SQLException missing = new SQLException("replication slot \"orders_slot\" does not exist", "42704");
    ReplicationException mapped = PostgresErrors.streamFailure("orders_slot", missing);

    assertTrue(mapped instanceof SlotInvalidException);
    assertFalse(mapped.isTransient());
  }

  @Test
  void invalidatedSlotIsDetectedByMessage() {
    SQLException invalidated = new SQLException(
      "can no longer get changes from replication slot \"orders_slot\"", "55000");

    assertTrue(PostgresErrors.isSlotInvalid(invalidated));
    assertTrue(PostgresErrors.openFailure("orders_slot", invalidated) instanceof SlotInvalidException);
  }

  @Test
  void brokenStreamIsTransient() {
    ReplicationException mapped = PostgresErrors.streamFailure("orders_slot",
      new SQLException("An I/O error occurred while sending to the backend.", "08006"));

    assertTrue(mapped instanceof StreamException);
    assertTrue(mapped.isTransient());
  }

  @Test
  void recognizesExistingSlot() {
    assertTrue(PostgresErrors.isSlotAlreadyExists(
      new SQLException("replication slot \"orders_slot\" already exists", "42710")));
    assertFalse(PostgresErrors.isSlotAlreadyExists(new SQLException("syntax error", "42601")));
  }
}

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

import dev.henneberger.vertx.cdc.core.ConnectionException;
import dev.henneberger.vertx.cdc.core.ReplicationException;
import dev.henneberger.vertx.cdc.core.SlotInvalidException;
import dev.henneberger.vertx.cdc.core.StreamException;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Maps PostgreSQL errors onto the worker's failure classes by SQLSTATE.
 */
final class PostgresErrors {

  static final String DUPLICATE_OBJECT = "42710";
  static final String UNDEFINED_OBJECT = "42704";
  static final String OBJECT_IN_USE = "55006";
  static final String TOO_MANY_CONNECTIONS = "53300";

  private PostgresErrors() {
  }

  /**
   * Failure while opening a session. Anything that is not a broken slot is worth another
   * connection attempt.
   */
  static ReplicationException openFailure(String slotName, SQLException error) {
    if (isSlotInvalid(error)) {
      return new SlotInvalidException(slotName, "replication slot '" + slotName + "' is unusable: "
        + error.getMessage(), error);
    }
    return new ConnectionException("could not attach to replication slot '" + slotName + "' ["
      + error.getSQLState() + "]: " + error.getMessage(), error);
  }

  /**
   * Failure on an established stream.
   */
  static ReplicationException streamFailure(String slotName, SQLException error) {
    if (isSlotInvalid(error)) {
      return new SlotInvalidException(slotName, "replication slot '" + slotName + "' was invalidated: "
        + error.getMessage(), error);
    }
    return new StreamException("replication stream on slot '" + slotName + "' failed ["
      + error.getSQLState() + "]: " + error.getMessage(), error);
  }

  static boolean isTransient(SQLException error) {
    String state = error.getSQLState();
    if (state == null) {
      return !isSlotInvalid(error);
    }
    return state.startsWith("08")
      || state.startsWith("57P0")
      || TOO_MANY_CONNECTIONS.equals(state)
      || OBJECT_IN_USE.equals(state);
  }

  static boolean isSlotInvalid(SQLException error) {
    if (UNDEFINED_OBJECT.equals(error.getSQLState())) {
      return true;
    }
    String message = error.getMessage();
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    return lower.contains("can no longer get changes from replication slot")
      || lower.contains("this slot has been invalidated");
  }

  static boolean isSlotAlreadyExists(SQLException error) {
    if (DUPLICATE_OBJECT.equals(error.getSQLState())) {
      return true;
    }
    String message = error.getMessage();
    return message != null && message.contains("already exists");
  }
}

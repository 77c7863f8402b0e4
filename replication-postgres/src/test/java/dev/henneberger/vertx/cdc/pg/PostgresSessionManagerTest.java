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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.LogPosition;
import dev.henneberger.vertx.cdc.core.RawSegment;
import dev.henneberger.vertx.cdc.core.ReplicationSession;
import dev.henneberger.vertx.cdc.core.SlotInvalidException;
import io.vertx.core.Vertx;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PostgresSessionManagerTest {

  private Vertx vertx;
  private final Map<String, String[]> slots = new ConcurrentHashMap<>();
  private final List<String> executed = new CopyOnWriteArrayList<>();
  private final List<Long> streamStarts = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
  }

  @AfterEach
  void tearDown() throws Exception {
    vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
  }

  @Test
  void reattachingReusesConfirmedPositionOfExistingSlot() {
    slots.put("orders_slot", new String[] {"wal2json", "0/16B3780", "reserved"});
    PostgresSessionManager manager = manager(new PostgresReplicationOptions().setSlotName("orders_slot"));

    ReplicationSession first = manager.open();
    first.close();
    ReplicationSession second = manager.open();

    long confirmed = LogPosition.parse("0/16B3780");
    assertEquals(confirmed, first.startPosition());
    assertEquals(confirmed, second.startPosition());
    assertEquals(List.of(confirmed, confirmed), streamStarts);
    assertTrue(executed.stream().noneMatch(sql -> sql.contains("pg_create_logical_replication_slot")));
  }

  @Test
  void reattachStartsFromPositionTheSlotAdvancedTo() {
    slots.put("orders_slot", new String[] {"wal2json", "0/100", "reserved"});
    PostgresSessionManager manager = manager(new PostgresReplicationOptions().setSlotName("orders_slot"));

    manager.open().close();
    slots.put("orders_slot", new String[] {"wal2json", "0/200", "reserved"});

    assertEquals(0x200, manager.open().startPosition());
  }

  @Test
  void createsMissingSlotOnFirstAttachOnly() {
    PostgresSessionManager manager = manager(new PostgresReplicationOptions().setSlotName("orders_slot"));

    assertEquals(0x1000000, manager.open().startPosition());
    assertEquals(1, executed.stream().filter(sql -> sql.contains("pg_create_logical_replication_slot")).count());

    slots.clear();
    assertThrows(SlotInvalidException.class, manager::open);
    assertEquals(List.of(0x1000000L), streamStarts);
  }

  @Test
  void rejectsLostOrForeignSlot() {
    slots.put("lost_slot", new String[] {"wal2json", "0/100", "lost"});
    slots.put("pgoutput_slot", new String[] {"pgoutput", "0/100", "reserved"});

    assertThrows(SlotInvalidException.class,
      () -> manager(new PostgresReplicationOptions().setSlotName("lost_slot")).open());
    assertThrows(SlotInvalidException.class,
      () -> manager(new PostgresReplicationOptions().setSlotName("pgoutput_slot")).open());
    assertTrue(streamStarts.isEmpty());
  }

  private PostgresSessionManager manager(PostgresReplicationOptions options) {
    return new PostgresSessionManager(vertx, options.setHost("db.internal").setDatabase("app").setUser("service"),
      CatalogConnections::new) {
      @Override
      ReplicationSession startStreaming(long startPosition) {
        streamStarts.add(startPosition);
        return new IdleSession(startPosition);
      }
    };
  }

  /**
   * Answers the slot catalog query and slot creation from {@link #slots}.
   */
  private final class CatalogConnections extends PostgresConnections {

    CatalogConnections(PostgresReplicationOptions options) {
      super(options);
    }

    @Override
    Connection openStandardConnection() {
      return (Connection) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[] {Connection.class},
        (proxy, method, args) -> {
          switch (method.getName()) {
            case "prepareStatement":
              return statement((String) args[0]);
            case "close":
              return null;
            default:
              throw new UnsupportedOperationException(method.getName());
          }
        });
    }

    private PreparedStatement statement(String sql) {
      String[] params = new String[2];
      return (PreparedStatement) Proxy.newProxyInstance(getClass().getClassLoader(),
        new Class<?>[] {PreparedStatement.class},
        (proxy, method, args) -> {
          switch (method.getName()) {
            case "setString":
              params[(Integer) args[0] - 1] = (String) args[1];
              return null;
            case "executeQuery":
              executed.add(sql);
              return slotRow(slots.get(params[0]));
            case "execute":
              executed.add(sql);
              slots.put(params[0], new String[] {params[1], "0/1000000", "reserved"});
              return true;
            case "close":
              return null;
            default:
              throw new UnsupportedOperationException(method.getName());
          }
        });
    }

    private ResultSet slotRow(String[] row) {
      boolean[] consumed = {row == null};
      return (ResultSet) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[] {ResultSet.class},
        (proxy, method, args) -> {
          switch (method.getName()) {
            case "next":
              boolean hasRow = !consumed[0];
              consumed[0] = true;
              return hasRow;
            case "getString":
              return row[(Integer) args[0] - 1];
            case "close":
              return null;
            default:
              throw new UnsupportedOperationException(method.getName());
          }
        });
    }
  }

  private static final class IdleSession implements ReplicationSession {
    private final long startPosition;

    private IdleSession(long startPosition) {
      this.startPosition = startPosition;
    }

    @Override
    public String slotName() {
      return "orders_slot";
    }

    @Override
    public long startPosition() {
      return startPosition;
    }

    @Override
    public RawSegment nextSegment(Duration timeout) {
      return null;
    }

    @Override
    public void acknowledge(long position) {
    }

    @Override
    public void close() {
    }
  }
}

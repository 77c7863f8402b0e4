package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChangeEventSerializerTest {

  private final ChangeEventSerializer serializer = new ChangeEventSerializer();

  @Test
  void writesTableMetadataAtTopLevel() {
    ChangeEvent event = new ChangeEvent("public", "orders", ChangeEvent.Operation.UPDATE,
      Map.of("id", 7, "status", "shipped"), Map.of("id", 7), LogPosition.INVALID)
      .stamp(731L, Instant.parse("2024-05-01T10:00:00Z"), 0x16B3780L, 2);

    SinkRecord record = serializer.toRecord(event);
    JsonObject json = Buffer.buffer(record.data()).toJsonObject();

    assertEquals("public.orders", record.partitionKey());
    assertEquals("731:0/16B3780:2", record.idempotencyKey());
    assertEquals("public", json.getString("schema"));
    assertEquals("orders", json.getString("table"));
    assertEquals("update", json.getString("kind"));
    assertEquals(731L, json.getLong("xid"));
    assertEquals("0/16B3780", json.getString("lsn"));
    assertEquals("0/16B3780", json.getString("commitLsn"));
    assertEquals(2, json.getInteger("seq"));
    assertEquals("731:0/16B3780:2", json.getString("idempotencyKey"));
    assertEquals("2024-05-01T10:00:00Z", json.getString("timestamp"));
    assertEquals("shipped", json.getJsonObject("columns").getString("status"));
    assertEquals(7, json.getJsonObject("oldkeys").getInteger("id"));
  }

  @Test
  void omitsEmptySections() {
    ChangeEvent delete = new ChangeEvent("public", "orders", ChangeEvent.Operation.DELETE,
      Map.of(), Map.of("id", 7), 0x200L)
      .stamp(null, null, 0x280L, 0);

    JsonObject json = serializer.toJson(delete);

    assertFalse(json.containsKey("columns"));
    assertFalse(json.containsKey("timestamp"));
    assertTrue(json.containsKey("oldkeys"));
    assertNull(json.getLong("xid"));
    assertEquals("0/200", json.getString("lsn"));
    assertEquals("-:0/280:0", json.getString("idempotencyKey"));
  }

  @Test
  void keepsTransactionOrder() {
    TransactionBatch batch = new TransactionBatch(9L, null, 0x300L, List.of(
      new ChangeEvent("public", "orders", ChangeEvent.Operation.INSERT, Map.of("id", 1), Map.of(), 0x100L)
        .stamp(9L, null, 0x300L, 0),
      new ChangeEvent("public", "items", ChangeEvent.Operation.INSERT, Map.of("id", 2), Map.of(), 0x200L)
        .stamp(9L, null, 0x300L, 1)));

    List<SinkRecord> records = serializer.toRecords(batch);

    assertEquals(2, records.size());
    assertEquals("public.orders", records.get(0).partitionKey());
    assertEquals("9:0/300:1", records.get(1).idempotencyKey());
  }
}

package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders change events as the JSON records written to the sink. {@code schema} and
 * {@code table} stay top level so the delivery pipeline behind the stream can partition on
 * them.
 */
public class ChangeEventSerializer {

  public JsonObject toJson(ChangeEvent event) {
    JsonObject json = new JsonObject()
      .put("schema", event.getSchema())
      .put("table", event.getTable())
      .put("kind", event.getOperation().kind())
      .put("xid", event.getTransactionId())
      .put("lsn", LogPosition.format(event.getPosition()))
      .put("commitLsn", LogPosition.format(event.getCommitPosition()))
      .put("seq", event.getSequence())
      .put("idempotencyKey", event.idempotencyKey());
    if (event.getCommitTimestamp() != null) {
      json.put("timestamp", event.getCommitTimestamp());
    }
    if (!event.getNewValues().isEmpty()) {
      json.put("columns", event.newValuesJson());
    }
    if (!event.getOldValues().isEmpty()) {
      json.put("oldkeys", event.oldValuesJson());
    }
    return json;
  }

  public SinkRecord toRecord(ChangeEvent event) {
    return new SinkRecord(event.qualifiedTable(), toJson(event).toBuffer().getBytes(), event.idempotencyKey());
  }

  public List<SinkRecord> toRecords(TransactionBatch batch) {
    List<SinkRecord> records = new ArrayList<>(batch.size());
    for (ChangeEvent event : batch.events()) {
      records.add(toRecord(event));
    }
    return records;
  }
}

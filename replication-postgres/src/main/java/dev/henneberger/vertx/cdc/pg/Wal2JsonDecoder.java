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

import dev.henneberger.vertx.cdc.core.ChangeDecoder;
import dev.henneberger.vertx.cdc.core.ChangeEvent;
import dev.henneberger.vertx.cdc.core.CommitMarker;
import dev.henneberger.vertx.cdc.core.DecodeException;
import dev.henneberger.vertx.cdc.core.DecodedSegment;
import dev.henneberger.vertx.cdc.core.LogPosition;
import dev.henneberger.vertx.cdc.core.RawSegment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decoder for the wal2json output plugin.
 *
 * <p>Format version 1 emits one document per transaction ({@code xid}, {@code nextlsn},
 * {@code timestamp}, {@code change[]}); version 2 emits one document per begin, row and commit
 * ({@code action} B/I/U/D/C, plus T and M which carry no row data). Every payload that does
 * not match either shape is rejected.
 */
public class Wal2JsonDecoder implements ChangeDecoder {

  public static final String PLUGIN = "wal2json";

  private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT = new TypeReference<>() { };

  // numeric columns must survive with their full precision and scale
  private static final ObjectMapper MAPPER = new ObjectMapper()
    .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

  private static final DateTimeFormatter WAL2JSON_TIMESTAMP = new DateTimeFormatterBuilder()
    .parseCaseInsensitive()
    .append(DateTimeFormatter.ISO_LOCAL_DATE)
    .appendLiteral(' ')
    .append(DateTimeFormatter.ISO_LOCAL_TIME)
    .appendOffset("+HH:mm", "Z")
    .toFormatter(Locale.ROOT);

  @Override
  public boolean supportsPlugin(String plugin) {
    return PLUGIN.equalsIgnoreCase(plugin);
  }

  @Override
  public DecodedSegment decode(RawSegment segment) {
    if (segment.isEndOfStream() || segment.payload().isBlank()) {
      return DecodedSegment.empty(segment);
    }

    JsonObject payload;
    try {
      payload = new JsonObject(MAPPER.readValue(segment.payload(), DOCUMENT));
    } catch (JsonProcessingException | RuntimeException e) {
      throw failure(segment, "payload is not a JSON object", e);
    }

    if (payload.containsKey("action")) {
      return decodeRowMessage(segment, payload);
    }
    if (payload.containsKey("change")) {
      return decodeTransaction(segment, payload);
    }
    throw failure(segment, "payload has neither 'change' nor 'action'", null);
  }

  private DecodedSegment decodeTransaction(RawSegment segment, JsonObject payload) {
    Long xid = longField(segment, payload, "xid");
    long commitPosition = positionField(segment, payload, "nextlsn", segment.position());
    Instant commitTimestamp = parseTimestamp(segment, payload.getValue("timestamp"));

    JsonArray changes = arrayField(segment, payload, "change");
    List<ChangeEvent> events = new ArrayList<>(changes.size());
    for (int i = 0; i < changes.size(); i++) {
      Object raw = changes.getValue(i);
      if (!(raw instanceof JsonObject)) {
        throw failure(segment, "change[" + i + "] is not an object", null);
      }
      JsonObject change = (JsonObject) raw;
      String kind = change.getValue("kind") instanceof String ? change.getString("kind") : null;
      if ("message".equalsIgnoreCase(kind)) {
        continue;
      }
      ChangeEvent.Operation operation = mapKind(kind);
      if (operation == null) {
        throw failure(segment, "change[" + i + "] has unknown kind '" + kind + "'", null);
      }
      events.add(new ChangeEvent(
        requireText(segment, change, "schema"),
        requireText(segment, change, "table"),
        operation,
        zip(segment, arrayField(segment, change, "columnnames"), arrayField(segment, change, "columntypes"),
          arrayField(segment, change, "columnvalues"), "column"),
        parseOldKeys(segment, change),
        LogPosition.INVALID));
    }
    return DecodedSegment.transaction(segment, events, new CommitMarker(xid, commitPosition, commitTimestamp));
  }

  private DecodedSegment decodeRowMessage(RawSegment segment, JsonObject payload) {
    Object rawAction = payload.getValue("action");
    String action = rawAction instanceof String ? ((String) rawAction).toUpperCase(Locale.ROOT) : String.valueOf(rawAction);
    switch (action) {
      case "B":
        return DecodedSegment.begin(segment, longField(segment, payload, "xid"));
      case "C": {
        long position = positionField(segment, payload, "nextlsn",
          positionField(segment, payload, "lsn", segment.position()));
        return DecodedSegment.commit(segment, new CommitMarker(longField(segment, payload, "xid"), position,
          parseTimestamp(segment, payload.getValue("timestamp"))));
      }
      case "I":
      case "U":
      case "D":
        return DecodedSegment.rows(segment, Collections.singletonList(parseRow(segment, payload, action)));
      case "T":
      case "M":
        return DecodedSegment.empty(segment);
      default:
        throw failure(segment, "unknown action '" + rawAction + "'", null);
    }
  }

  private ChangeEvent parseRow(RawSegment segment, JsonObject payload, String action) {
    ChangeEvent.Operation operation;
    if ("I".equals(action)) {
      operation = ChangeEvent.Operation.INSERT;
    } else if ("U".equals(action)) {
      operation = ChangeEvent.Operation.UPDATE;
    } else {
      operation = ChangeEvent.Operation.DELETE;
    }
    Map<String, Object> columns = namedValues(segment, arrayField(segment, payload, "columns"), "columns");
    Map<String, Object> identity = namedValues(segment, arrayField(segment, payload, "identity"), "identity");
    return new ChangeEvent(
      requireText(segment, payload, "schema"),
      requireText(segment, payload, "table"),
      operation,
      operation == ChangeEvent.Operation.DELETE ? Collections.emptyMap() : columns,
      identity,
      positionField(segment, payload, "lsn", segment.position()));
  }

  private static Map<String, Object> parseOldKeys(RawSegment segment, JsonObject change) {
    Object raw = change.getValue("oldkeys");
    if (raw == null) {
      return Collections.emptyMap();
    }
    if (!(raw instanceof JsonObject)) {
      throw failure(segment, "'oldkeys' is not an object", null);
    }
    JsonObject oldKeys = (JsonObject) raw;
    return zip(segment, arrayField(segment, oldKeys, "keynames"), arrayField(segment, oldKeys, "keytypes"),
      arrayField(segment, oldKeys, "keyvalues"), "key");
  }

  private static Map<String, Object> zip(RawSegment segment, JsonArray names, JsonArray types, JsonArray values,
                                         String what) {
    if (names == null && values == null) {
      return Collections.emptyMap();
    }
    if (names == null || values == null || names.size() != values.size()) {
      throw failure(segment, what + " names and values do not line up", null);
    }
    if (types != null && types.size() != names.size()) {
      throw failure(segment, what + " names and types do not line up", null);
    }
    Map<String, Object> data = new LinkedHashMap<>();
    for (int i = 0; i < names.size(); i++) {
      Object name = names.getValue(i);
      if (!(name instanceof String)) {
        throw failure(segment, what + " name #" + i + " is not a string", null);
      }
      Object type = types == null ? null : types.getValue(i);
      data.put((String) name, normalizeValue(segment, (String) name, values.getValue(i), type));
    }
    return data;
  }

  private static Map<String, Object> namedValues(RawSegment segment, JsonArray entries, String field) {
    if (entries == null) {
      return Collections.emptyMap();
    }
    Map<String, Object> data = new LinkedHashMap<>();
    for (int i = 0; i < entries.size(); i++) {
      Object raw = entries.getValue(i);
      if (!(raw instanceof JsonObject) || !(((JsonObject) raw).getValue("name") instanceof String)) {
        throw failure(segment, field + "[" + i + "] has no name", null);
      }
      JsonObject column = (JsonObject) raw;
      String name = column.getString("name");
      data.put(name, normalizeValue(segment, name, column.getValue("value"), column.getValue("type")));
    }
    return data;
  }

  private static JsonArray arrayField(RawSegment segment, JsonObject json, String field) {
    Object value = json.getValue(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof JsonArray)) {
      throw failure(segment, "'" + field + "' is not an array", null);
    }
    return (JsonArray) value;
  }

  private static String requireText(RawSegment segment, JsonObject json, String field) {
    Object value = json.getValue(field);
    if (!(value instanceof String) || ((String) value).isBlank()) {
      throw failure(segment, "'" + field + "' is missing", null);
    }
    return (String) value;
  }

  private static Long longField(RawSegment segment, JsonObject json, String field) {
    Object value = json.getValue(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Number)) {
      throw failure(segment, "'" + field + "' is not a number", null);
    }
    return ((Number) value).longValue();
  }

  private static long positionField(RawSegment segment, JsonObject json, String field, long fallback) {
    Object value = json.getValue(field);
    if (value == null) {
      return fallback;
    }
    try {
      return LogPosition.parse(String.valueOf(value));
    } catch (IllegalArgumentException e) {
      throw failure(segment, "'" + field + "' is not a log position: " + value, e);
    }
  }

  static Instant parseTimestamp(RawSegment segment, Object value) {
    if (value == null) {
      return null;
    }
    String text = String.valueOf(value).trim();
    try {
      return OffsetDateTime.parse(text, WAL2JSON_TIMESTAMP).toInstant();
    } catch (DateTimeParseException notWal2Json) {
      try {
        return OffsetDateTime.parse(text).toInstant();
      } catch (DateTimeParseException e) {
        throw failure(segment, "unparseable timestamp '" + text + "'", e);
      }
    }
  }

  private static ChangeEvent.Operation mapKind(String kind) {
    if (kind == null) {
      return null;
    }
    switch (kind.toLowerCase(Locale.ROOT)) {
      case "insert":
        return ChangeEvent.Operation.INSERT;
      case "update":
        return ChangeEvent.Operation.UPDATE;
      case "delete":
        return ChangeEvent.Operation.DELETE;
      default:
        return null;
    }
  }

  /**
   * json and jsonb columns arrive as text; expose them as maps and lists. Text in any other
   * column stays text, even when it happens to look like JSON.
   */
  private static Object normalizeValue(RawSegment segment, String column, Object value, Object type) {
    if (value instanceof JsonObject) {
      return ((JsonObject) value).getMap();
    }
    if (value instanceof JsonArray) {
      return ((JsonArray) value).getList();
    }
    if (!(value instanceof String) || !isJsonType(type)) {
      return value;
    }

    try {
      return MAPPER.readValue((String) value, Object.class);
    } catch (JsonProcessingException e) {
      throw failure(segment, "column '" + column + "' of type " + type + " does not hold JSON", e);
    }
  }

  private static boolean isJsonType(Object type) {
    if (!(type instanceof String)) {
      return false;
    }
    String name = ((String) type).trim().toLowerCase(Locale.ROOT);
    return "json".equals(name) || "jsonb".equals(name);
  }

  private static DecodeException failure(RawSegment segment, String message, Throwable cause) {
    return cause == null
      ? new DecodeException("wal2json " + message, segment.payload(), segment.position())
      : new DecodeException("wal2json " + message, segment.payload(), segment.position(), cause);
  }
}

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

import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

final class PostgresReplicationOptionsConverter {

  private PostgresReplicationOptionsConverter() {
  }

  static void fromJson(JsonObject json, PostgresReplicationOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("host")) {
      options.setHost(json.getString("host"));
    }
    if (json.containsKey("port")) {
      options.setPort(json.getInteger("port"));
    }
    if (json.containsKey("database")) {
      options.setDatabase(json.getString("database"));
    }
    if (json.containsKey("user")) {
      options.setUser(json.getString("user"));
    }
    if (json.containsKey("password")) {
      options.setPassword(json.getString("password"));
    }
    if (json.containsKey("passwordEnv")) {
      options.setPasswordEnv(json.getString("passwordEnv"));
    }
    if (json.containsKey("ssl")) {
      options.setSsl(json.getBoolean("ssl", false));
    }
    if (json.containsKey("slotName")) {
      options.setSlotName(json.getString("slotName"));
    }
    if (json.containsKey("plugin")) {
      options.setPlugin(json.getString("plugin"));
    }

    JsonObject pluginOptionsJson = json.getJsonObject("pluginOptions");
    if (pluginOptionsJson != null) {
      options.setPluginOptions(pluginOptionsJson.getMap());
    }

    if (json.containsKey("statusIntervalMs")) {
      options.setStatusInterval(Duration.ofMillis(json.getLong("statusIntervalMs")));
    }
    if (json.containsKey("createSlot")) {
      options.setCreateSlot(json.getBoolean("createSlot", true));
    }
    if (json.containsKey("preflightEnabled")) {
      options.setPreflightEnabled(json.getBoolean("preflightEnabled", false));
    }
  }

  static void toJson(PostgresReplicationOptions options, JsonObject json) {
    json.put("host", options.getHost());
    json.put("port", options.getPort());
    json.put("database", options.getDatabase());
    json.put("user", options.getUser());
    if (options.getPassword() != null) {
      json.put("password", options.getPassword());
    }
    json.put("passwordEnv", options.getPasswordEnv());
    json.put("ssl", options.isSsl());
    json.put("slotName", options.getSlotName());
    json.put("plugin", options.getPlugin());

    Map<String, Object> pluginOptions = options.getPluginOptions();
    json.put("pluginOptions", pluginOptions == null ? new JsonObject() : new JsonObject(new LinkedHashMap<>(pluginOptions)));

    json.put("statusIntervalMs", options.getStatusInterval().toMillis());
    json.put("createSlot", options.isCreateSlot());
    json.put("preflightEnabled", options.isPreflightEnabled());
  }
}

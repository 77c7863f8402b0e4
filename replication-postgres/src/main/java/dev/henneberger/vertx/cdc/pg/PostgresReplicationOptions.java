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
import dev.henneberger.vertx.cdc.core.OptionValidation;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Connection and replication slot configuration.
 */
public class PostgresReplicationOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_PLUGIN = "wal2json";
  public static final String DEFAULT_SLOT_NAME = "wal2json";
  public static final String DEFAULT_PASSWORD_ENV = "POSTGRES_PASSWORD";
  public static final Duration DEFAULT_STATUS_INTERVAL = Duration.ofSeconds(10);

  private String host;
  private int port;
  private String database;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String slotName;
  private String plugin;
  private Map<String, Object> pluginOptions;
  private Duration statusInterval;
  private boolean createSlot;
  private boolean preflightEnabled;
  private ChangeDecoder changeDecoder;

  public PostgresReplicationOptions() {
    init();
  }

  public PostgresReplicationOptions(JsonObject json) {
    init();
    PostgresReplicationOptionsConverter.fromJson(json, this);
  }

  public PostgresReplicationOptions(PostgresReplicationOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.slotName = other.slotName;
    this.plugin = other.plugin;
    this.pluginOptions = new LinkedHashMap<>(other.pluginOptions);
    this.statusInterval = other.statusInterval;
    this.createSlot = other.createSlot;
    this.preflightEnabled = other.preflightEnabled;
    this.changeDecoder = other.changeDecoder;
  }

  public String getHost() {
    return host;
  }

  public PostgresReplicationOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public int getPort() {
    return port;
  }

  public PostgresReplicationOptions setPort(int port) {
    this.port = port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public PostgresReplicationOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public PostgresReplicationOptions setUser(String user) {
    this.user = user;
    return this;
  }

  /**
   * Literal password; meant for tests. Deployments inject it through {@link #getPasswordEnv()}.
   */
  public String getPassword() {
    return password;
  }

  public PostgresReplicationOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  /**
   * Name of the environment variable holding the password.
   */
  public String getPasswordEnv() {
    return passwordEnv;
  }

  public PostgresReplicationOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public boolean isSsl() {
    return ssl;
  }

  public PostgresReplicationOptions setSsl(boolean ssl) {
    this.ssl = ssl;
    return this;
  }

  public String getSlotName() {
    return slotName;
  }

  public PostgresReplicationOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public String getPlugin() {
    return plugin;
  }

  public PostgresReplicationOptions setPlugin(String plugin) {
    this.plugin = plugin;
    return this;
  }

  /**
   * Options passed to the output plugin when the stream starts. When empty, wal2json is
   * started with format-version 1 and xids, timestamps and LSNs included.
   */
  public Map<String, Object> getPluginOptions() {
    return Collections.unmodifiableMap(pluginOptions);
  }

  public PostgresReplicationOptions setPluginOptions(Map<String, Object> options) {
    this.pluginOptions = options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options);
    return this;
  }

  public Duration getStatusInterval() {
    return statusInterval;
  }

  public PostgresReplicationOptions setStatusInterval(Duration statusInterval) {
    this.statusInterval = statusInterval;
    return this;
  }

  /**
   * Whether a missing slot is created on the first attach.
   */
  public boolean isCreateSlot() {
    return createSlot;
  }

  public PostgresReplicationOptions setCreateSlot(boolean createSlot) {
    this.createSlot = createSlot;
    return this;
  }

  public boolean isPreflightEnabled() {
    return preflightEnabled;
  }

  public PostgresReplicationOptions setPreflightEnabled(boolean preflightEnabled) {
    this.preflightEnabled = preflightEnabled;
    return this;
  }

  public ChangeDecoder getChangeDecoder() {
    return changeDecoder;
  }

  public PostgresReplicationOptions setChangeDecoder(ChangeDecoder changeDecoder) {
    this.changeDecoder = Objects.requireNonNull(changeDecoder, "changeDecoder");
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresReplicationOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresReplicationOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new PostgresReplicationOptions(json).setChangeDecoder(changeDecoder);
  }

  void validate() {
    OptionValidation.require("host", host);
    OptionValidation.requirePort(port);
    OptionValidation.require("database", database);
    OptionValidation.require("user", user);
    OptionValidation.requireSlotName(slotName);
    OptionValidation.require("plugin", plugin);
    OptionValidation.requirePositive("statusInterval", statusInterval);
    Objects.requireNonNull(pluginOptions, "pluginOptions");
    ChangeDecoder decoder = Objects.requireNonNull(changeDecoder, "changeDecoder");
    if (!decoder.supportsPlugin(plugin)) {
      throw new IllegalArgumentException(
        "changeDecoder " + decoder.getClass().getSimpleName() + " does not support plugin " + plugin);
    }
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    passwordEnv = DEFAULT_PASSWORD_ENV;
    slotName = DEFAULT_SLOT_NAME;
    plugin = DEFAULT_PLUGIN;
    pluginOptions = new LinkedHashMap<>();
    statusInterval = DEFAULT_STATUS_INTERVAL;
    createSlot = true;
    preflightEnabled = false;
    changeDecoder = new Wal2JsonDecoder();
  }
}

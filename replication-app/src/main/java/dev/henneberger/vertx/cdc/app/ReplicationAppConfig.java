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

package dev.henneberger.vertx.cdc.app;

import dev.henneberger.vertx.cdc.kinesis.KinesisSinkOptions;
import dev.henneberger.vertx.cdc.pg.PostgresReplicationOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Process configuration read from the environment the worker's container is started with.
 */
public final class ReplicationAppConfig {

  public enum Profile {
    PRODUCTION,
    LOCAL
  }

  static final String POSTGRES_HOST = "POSTGRES_HOST";
  static final String POSTGRES_PORT = "POSTGRES_PORT";
  static final String POSTGRES_DB = "POSTGRES_DB";
  static final String POSTGRES_USER = "POSTGRES_USER";
  static final String POSTGRES_PASSWORD_ENV = "POSTGRES_PASSWORD_ENV";
  static final String POSTGRES_SSL = "POSTGRES_SSL";
  static final String STREAM_NAME = "REPLICATION_KINESIS_STREAM_NAME";
  static final String SLOT_NAME = "REPLICATION_SLOT_NAME";
  static final String DECODER_PLUGIN = "REPLICATION_DECODER_PLUGIN";
  static final String AWS_REGION = "AWS_REGION";
  static final String KINESIS_ENDPOINT = "REPLICATION_KINESIS_ENDPOINT";
  static final String PREFLIGHT = "REPLICATION_PREFLIGHT";
  static final String PROFILE = "REPLICATION_PROFILE";

  private final String pgHost;
  private final int pgPort;
  private final String pgDatabase;
  private final String pgUser;
  private final String pgPasswordEnv;
  private final boolean ssl;
  private final String streamName;
  private final String slotName;
  private final String decoderPlugin;
  private final String awsRegion;
  private final String kinesisEndpoint;
  private final Boolean preflight;
  private final Profile profile;

  private ReplicationAppConfig(Map<String, String> env) {
    List<String> missing = new ArrayList<>();
    this.pgHost = required(env, POSTGRES_HOST, missing);
    this.pgDatabase = required(env, POSTGRES_DB, missing);
    this.pgUser = required(env, POSTGRES_USER, missing);
    this.streamName = required(env, STREAM_NAME, missing);
    if (!missing.isEmpty()) {
      throw new IllegalArgumentException("Missing required environment variables: " + String.join(", ", missing));
    }
    this.pgPort = intEnvOrDefault(env, POSTGRES_PORT, PostgresReplicationOptions.DEFAULT_PORT);
    this.pgPasswordEnv = envOrDefault(env, POSTGRES_PASSWORD_ENV, PostgresReplicationOptions.DEFAULT_PASSWORD_ENV);
    this.ssl = boolEnvOrDefault(env, POSTGRES_SSL, false);
    this.slotName = envOrDefault(env, SLOT_NAME, PostgresReplicationOptions.DEFAULT_SLOT_NAME);
    this.decoderPlugin = envOrDefault(env, DECODER_PLUGIN, PostgresReplicationOptions.DEFAULT_PLUGIN);
    this.awsRegion = envOrDefault(env, AWS_REGION, null);
    this.kinesisEndpoint = envOrDefault(env, KINESIS_ENDPOINT, null);
    String preflightValue = envOrDefault(env, PREFLIGHT, null);
    this.preflight = preflightValue == null ? null : parseBool(PREFLIGHT, preflightValue);
    this.profile = parseProfile(envOrDefault(env, PROFILE, "production"));
  }

  public static ReplicationAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static ReplicationAppConfig fromMap(Map<String, String> env) {
    return new ReplicationAppConfig(Objects.requireNonNull(env, "env"));
  }

  public String pgHost() {
    return pgHost;
  }

  public int pgPort() {
    return pgPort;
  }

  public String pgDatabase() {
    return pgDatabase;
  }

  public String pgUser() {
    return pgUser;
  }

  public String pgPasswordEnv() {
    return pgPasswordEnv;
  }

  public boolean ssl() {
    return ssl;
  }

  public String streamName() {
    return streamName;
  }

  public String slotName() {
    return slotName;
  }

  public String decoderPlugin() {
    return decoderPlugin;
  }

  public String awsRegion() {
    return awsRegion;
  }

  public String kinesisEndpoint() {
    return kinesisEndpoint;
  }

  public Profile profile() {
    return profile;
  }

  /**
   * Whether startup checks run; the production profile enables them unless overridden.
   */
  public boolean preflightEnabled() {
    return preflight != null ? preflight : profile == Profile.PRODUCTION;
  }

  public PostgresReplicationOptions toReplicationOptions() {
    return new PostgresReplicationOptions()
      .setHost(pgHost)
      .setPort(pgPort)
      .setDatabase(pgDatabase)
      .setUser(pgUser)
      .setPasswordEnv(pgPasswordEnv)
      .setSsl(ssl)
      .setSlotName(slotName)
      .setPlugin(decoderPlugin)
      .setPreflightEnabled(preflightEnabled());
  }

  public KinesisSinkOptions toKinesisOptions() {
    return new KinesisSinkOptions()
      .setStreamName(streamName)
      .setRegion(awsRegion)
      .setEndpointOverride(kinesisEndpoint);
  }

  private static String required(Map<String, String> env, String key, List<String> missing) {
    String value = envOrDefault(env, key, null);
    if (value == null) {
      missing.add(key);
    }
    return value;
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    String value = envOrDefault(env, key, null);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be a number, got '" + value + "'", e);
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = envOrDefault(env, key, null);
    return value == null ? defaultValue : parseBool(key, value);
  }

  private static boolean parseBool(String key, String value) {
    if ("true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value) || "0".equals(value) || "no".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
  }

  private static Profile parseProfile(String value) {
    try {
      return Profile.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(PROFILE + " must be production or local, got '" + value + "'", e);
    }
  }
}

/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.tidelake;

import com.tidelake.log.LogManager;
import com.tidelake.serializer.json.JSONObject;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and,
 * when missing, environment variables with the same key.
 */
public enum GlobalConfiguration {
  // METADATA
  METADATA_JDBC_URL("tidelake.metadata.jdbcUrl", "JDBC URL of the relational metadata store", String.class,
      "jdbc:h2:mem:tidelake;DB_CLOSE_DELAY=-1"),

  METADATA_JDBC_USER("tidelake.metadata.jdbcUser", "User of the relational metadata store", String.class, "sa"),

  METADATA_JDBC_PASSWORD("tidelake.metadata.jdbcPassword", "Password of the relational metadata store", String.class, "", null, true),

  METADATA_POOL_SIZE("tidelake.metadata.poolSize", "Maximum number of pooled connections to the metadata store", Integer.class, 8,
      value -> {
        if (((Number) value).intValue() < 1)
          throw new IllegalArgumentException("Pool size must be at least 1");
        return value;
      }),

  // STORAGE
  STORAGE_PATH("tidelake.storage.path", "Root directory of the object storage. Empty means in memory", String.class, "./lake"),

  STORAGE_RETRY_ATTEMPTS("tidelake.storage.retryAttempts", "Attempts for an object storage write before the bucket is left for the next tick",
      Integer.class, 3),

  STORAGE_RETRY_BACKOFF("tidelake.storage.retryBackoff", "Initial backoff in ms between object storage retries, doubled at every attempt",
      Long.class, 100),

  STORAGE_RETRY_MAX_BACKOFF("tidelake.storage.retryMaxBackoff", "Maximum backoff in ms between object storage retries", Long.class, 2_000),

  // CACHES
  CACHE_PARTITION_METADATA_ENTRIES("tidelake.cache.partitionMetadataEntries",
      "Maximum number of (view, key, time-bucket) entries in the partition metadata cache", Long.class, 10_000),

  CACHE_CONTENT_BYTES("tidelake.cache.contentBytes", "Byte budget of the partition file content cache", Long.class, 200L * 1024 * 1024),

  CACHE_CONTENT_MAX_FILE_BYTES("tidelake.cache.contentMaxFileBytes", "Files bigger than this are read without being cached", Long.class,
      10L * 1024 * 1024),

  // MATERIALIZER
  MATERIALIZER_SECOND_TICK("tidelake.materializer.secondTick", "Tick interval in ms of the seconds task. 0 disables it", Long.class, 1_000),

  MATERIALIZER_MINUTE_TICK("tidelake.materializer.minuteTick", "Tick interval in ms of the minutes task. 0 disables it", Long.class, 60_000),

  MATERIALIZER_HOUR_TICK("tidelake.materializer.hourTick", "Tick interval in ms of the hours task. 0 disables it", Long.class, 3_600_000),

  MATERIALIZER_DAY_TICK("tidelake.materializer.dayTick", "Tick interval in ms of the days task. 0 disables it", Long.class, 86_400_000),

  MATERIALIZER_SECOND_MAX_DELAY("tidelake.materializer.secondMaxDelay",
      "A seconds tick starting later than this (ms) after its scheduled time is skipped", Long.class, 10_000),

  MATERIALIZER_LOOKBACK_BUCKETS("tidelake.materializer.lookbackBuckets",
      "Number of completed buckets re-checked at every tick to pick up late blocks", Integer.class, 2),

  MATERIALIZER_MAX_CATCHUP_BUCKETS("tidelake.materializer.maxCatchUpBuckets",
      "Maximum number of buckets processed in one tick when catching up from the task watermark", Integer.class, 60),

  MATERIALIZER_PARALLELISM("tidelake.materializer.parallelism", "Views materialized concurrently by one task", Integer.class, 4),

  // JIT
  JIT_LEASE_TIMEOUT("tidelake.jit.leaseTimeout", "Time in ms a caller waits for an in-flight materialization", Long.class, 60_000),

  JIT_BUCKET("tidelake.jit.bucket", "Insert-time width in ms of a just-in-time partition", Long.class, 3_600_000),

  JIT_MAX_OBJECTS("tidelake.jit.maxObjects", "Maximum number of telemetry objects in one just-in-time partition", Long.class, 20_000_000),

  JIT_THREADS("tidelake.jit.threads", "Threads running just-in-time materializations", Integer.class, 4),

  // MAINTENANCE
  MAINTENANCE_SWEEP_INTERVAL("tidelake.maintenance.sweepInterval", "Interval in ms between maintenance passes. 0 disables them", Long.class,
      3_600_000),

  MAINTENANCE_RETIRED_GRACE_PERIOD("tidelake.maintenance.retiredGracePeriod",
      "Time in ms a retired partition is kept before its file is deleted", Long.class, 3_600_000),

  MAINTENANCE_DEDUP_LOOKBACK("tidelake.maintenance.dedupLookback", "Insert-time window in ms scanned for duplicate records", Long.class,
      86_400_000),

  MAINTENANCE_RETENTION("tidelake.maintenance.retention", "Raw data and partitions older than this (ms) are deleted. 0 keeps everything",
      Long.class, 0);

  public static final String PREFIX = "tidelake.";

  private final    String                key;
  private final    Object                defValue;
  private final    Class<?>              type;
  private final    UnaryOperator<Object> callback;
  private final    String                description;
  private final    boolean               hidden;
  private volatile Object                value;

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue) {
    this(key, description, type, defValue, null, false);
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue,
      final UnaryOperator<Object> callback) {
    this(key, description, type, defValue, callback, false);
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue,
      final UnaryOperator<Object> callback, final boolean hidden) {
    this.key = key;
    this.description = description;
    this.type = type;
    this.defValue = defValue;
    this.callback = callback;
    this.hidden = hidden;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (final GlobalConfiguration v : values())
      v.reset();
  }

  public void reset() {
    value = null;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.println("TIDELAKE configuration:");

    String lastSection = "";
    for (final GlobalConfiguration v : values()) {
      final String section = v.key.substring(PREFIX.length(), v.key.indexOf('.', PREFIX.length()));

      if (!lastSection.equals(section)) {
        out.print("- ");
        out.println(section.toUpperCase(Locale.ENGLISH));
        lastSection = section;
      }
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(v.isHidden() ? "<hidden>" : String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject cfg = new JSONObject(input).getJSONObject("configuration");
    for (final String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = findByKey(PREFIX + k);
      if (cfgEntry != null)
        cfgEntry.setValue(cfg.get(k));
    }
  }

  public static String toJSON() {
    final JSONObject cfg = new JSONObject();
    for (final GlobalConfiguration k : values())
      if (!k.hidden)
        cfg.put(k.key.substring(PREFIX.length()), (Object) k.getValue());

    return new JSONObject().put("configuration", cfg).toString();
  }

  /**
   * Finds the entry by the key, case insensitive. Returns null if not found.
   */
  public static GlobalConfiguration findByKey(final String key) {
    for (final GlobalConfiguration v : values())
      if (v.getKey().equalsIgnoreCase(key))
        return v;
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the string
   * representation of configuration values.
   */
  public static void setConfiguration(final Map<String, Object> config) {
    for (final Map.Entry<String, Object> entry : config.entrySet()) {
      for (final GlobalConfiguration v : values()) {
        if (v.getKey().equals(entry.getKey()) || v.name().equals(entry.getKey())) {
          v.setValue(entry.getValue());
          break;
        }
      }
    }
  }

  private static void readConfiguration() {
    for (final GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null)
        config.setValue(prop);
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != null ? value : defValue);
  }

  public boolean isChanged() {
    return value != null;
  }

  public void setValue(final Object newValue) {
    final Object converted = convert(newValue);
    if (callback != null && converted != null)
      try {
        value = callback.apply(converted);
        return;
      } catch (final IllegalArgumentException e) {
        LogManager.instance().log(this, Level.SEVERE, "Invalid value for setting %s=%s", e, key, newValue);
        throw e;
      }
    value = converted;
  }

  /**
   * Converts a raw value (usually a string read from properties) into this setting's type.
   */
  Object convert(final Object raw) {
    if (raw == null)
      return null;
    if (type == Boolean.class)
      return raw instanceof Boolean ? raw : Boolean.parseBoolean(raw.toString());
    else if (type == Integer.class)
      return raw instanceof Number ? ((Number) raw).intValue() : Integer.parseInt(raw.toString().trim());
    else if (type == Long.class)
      return raw instanceof Number ? ((Number) raw).longValue() : Long.parseLong(raw.toString().trim());
    else if (type == String.class)
      return raw.toString();
    return raw;
  }

  public boolean getValueAsBoolean() {
    return (Boolean) convert(getValue());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger() {
    return ((Number) convert(getValue())).intValue();
  }

  public long getValueAsLong() {
    return ((Number) convert(getValue())).longValue();
  }

  public String getKey() {
    return key;
  }

  public boolean isHidden() {
    return hidden;
  }

  public Object getDefValue() {
    return defValue;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }
}

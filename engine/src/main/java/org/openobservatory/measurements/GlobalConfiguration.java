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
package org.openobservatory.measurements;

import org.openobservatory.measurements.log.LogManager;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and
 * environment variables. Per-engine overrides go through {@link ContextConfiguration}.
 * <p>
 * Durations accept ISO-8601 ({@code PT30S}, {@code P2D}) or a number of milliseconds. Sizes accept a number of bytes or a
 * {@code KB}/{@code MB}/{@code GB} suffix.
 */
public enum GlobalConfiguration {
  // STORAGE TIERS
  CUTOVER("measurements.cutover",
      "Start time from which measurements are stored in the relational tier. Older ones live in the archive", String.class,
      "2020-10-20T00:00:00Z"),

  CUTOVER_BOUNDARY_WINDOW("measurements.cutoverBoundaryWindow",
      "Measurements started within this window before the cutover are probed in the relational tier before falling back to the archive",
      Duration.class, "P2D"),

  // QUERY PLANNING
  MAX_TIME_RANGE("measurements.query.maxTimeRange", "Maximum span of an aggregation time range", Duration.class, "P400D"),

  MAX_DIMENSIONS("measurements.query.maxDimensions", "Maximum number of grouping dimensions in one aggregation", Integer.class, 4),

  MAX_ESTIMATED_ROWS("measurements.query.maxEstimatedRows",
      "Ceiling on the estimated number of result rows of an aggregation. It also bounds the rows an aggregation may return",
      Long.class, 100_000L),

  INDEXED_DIMENSIONS("measurements.query.indexedDimensions",
      "Comma separated dimensions whose columns are indexed in the relational store", String.class,
      "country,asn,test_name,category_code"),

  DIMENSION_CARDINALITY("measurements.query.dimensionCardinality",
      "Estimated distinct values per dimension, as comma separated name=count pairs", String.class,
      "country=250,asn=70000,test_name=40,category_code=35,input=2000000,domain=500000"),

  DEFAULT_PAGE_SIZE("measurements.query.defaultPageSize", "Rows returned per aggregation page when the request does not say",
      Integer.class, 1_000),

  MAX_PAGE_SIZE("measurements.query.maxPageSize", "Largest page size a request may ask for", Integer.class, 10_000),

  // AGGREGATION
  AGGREGATION_FETCH_SIZE("measurements.aggregation.fetchSize", "Grouped rows read from the relational store per statement",
      Integer.class, 500),

  // RELATIONAL STORE
  RELATIONAL_TABLE("measurements.relational.table", "Name of the measurements table", String.class, "measurements"),

  RELATIONAL_DIALECT("measurements.relational.dialect", "SQL dialect of the relational store", String.class, "postgresql"),

  STATEMENT_TIMEOUT("measurements.relational.statementTimeout", "Server-side timeout applied to every statement",
      Duration.class, "PT30S"),

  MAX_CONNECTIONS("measurements.relational.maxConnections", "Maximum relational connections leased at the same time",
      Integer.class, 8),

  POOL_WAIT_TIMEOUT("measurements.relational.poolWaitTimeout",
      "How long a request waits for a relational connection before failing", Duration.class, "PT5S"),

  // ARCHIVE
  ARCHIVE_BUFFER_THRESHOLD("measurements.archive.bufferThreshold",
      "Containers up to this size are read in one go, bigger ones are only streamed", Long.class, "4MB"),

  ARCHIVE_MAX_RECORD_SIZE("measurements.archive.maxRecordSize", "Largest accepted decompressed archive record", Long.class,
      "32MB"),

  // FRESHNESS
  SETTLEMENT_DELAY("measurements.freshness.settlementDelay",
      "Time after the end of a range past which no more measurements are expected for it", Duration.class, "P3D"),

  SHORT_TTL("measurements.freshness.shortTtl", "Validity of responses covering data that can still change", Duration.class,
      "PT60S"),

  SEALED_TTL("measurements.freshness.sealedTtl", "Validity of responses covering sealed data", Duration.class, "P365D"),

  // ENGINE
  WORKER_THREADS("measurements.engine.workerThreads", "Threads used to read both tiers concurrently within one request",
      Integer.class, 4),

  REQUEST_TIMEOUT("measurements.engine.requestTimeout", "Deadline of a request when the caller does not give one",
      Duration.class, "PT60S");

  public static final String PREFIX = "measurements.";

  private final Object nullValue = new Object();

  private final String   key;
  private final Object   defValue;
  private final Class<?> type;
  private final String   description;
  private volatile Object value = nullValue;

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue) {
    this.key = key;
    this.description = description;
    this.defValue = defValue;
    this.type = type;
  }

  /**
   * Finds the GlobalConfiguration instance by the key. Key is case insensitive.
   *
   * @return the setting if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String key) {
    for (final GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(key) || v.name().equalsIgnoreCase(key))
        return v;
    }
    return null;
  }

  /**
   * Assign configuration values by reading system properties.
   */
  private static void readConfiguration() {
    for (final GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null) {
        try {
          config.setValue(prop);
        } catch (final IllegalArgumentException e) {
          LogManager.instance().log(GlobalConfiguration.class, Level.SEVERE, "Ignoring invalid setting %s=%s", e, config.key, prop);
        }
      }
    }
  }

  public Object getValue() {
    return value != nullValue && value != null ? value : convert(defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != nullValue;
  }

  public void setValue(final Object newValue) {
    value = newValue != null ? convert(newValue) : nullValue;
  }

  public void reset() {
    value = nullValue;
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger() {
    return ((Number) getValue()).intValue();
  }

  public long getValueAsLong() {
    return ((Number) getValue()).longValue();
  }

  public Duration getValueAsDuration() {
    return (Duration) getValue();
  }

  public Instant getValueAsInstant() {
    return toInstant(getValue());
  }

  Object convert(final Object raw) {
    if (raw == null)
      return null;
    try {
      if (type == Integer.class)
        return raw instanceof Number n ? n.intValue() : Integer.parseInt(raw.toString().trim());
      else if (type == Long.class)
        return raw instanceof Number n ? n.longValue() : toSize(raw.toString());
      else if (type == Duration.class)
        return toDuration(raw);
      else if (type == String.class)
        return raw.toString();
    } catch (final NumberFormatException | DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid value '" + raw + "' for setting '" + key + "'", e);
    }
    return raw;
  }

  static Duration toDuration(final Object raw) {
    if (raw instanceof Duration d)
      return d;
    if (raw instanceof Number n)
      return Duration.ofMillis(n.longValue());

    final String s = raw.toString().trim();
    if (!s.isEmpty() && Character.isDigit(s.charAt(0)))
      return Duration.ofMillis(Long.parseLong(s));
    return Duration.parse(s);
  }

  static Instant toInstant(final Object raw) {
    if (raw instanceof Instant i)
      return i;
    final String s = raw.toString().trim();
    if (s.length() == 10)
      // PLAIN DATE, MIDNIGHT UTC
      return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
    return Instant.parse(s);
  }

  static long toSize(final String raw) {
    final String size = raw.trim().toUpperCase(Locale.ENGLISH);
    if (size.endsWith("KB"))
      return Long.parseLong(size.substring(0, size.length() - 2).trim()) * 1024L;
    if (size.endsWith("MB"))
      return Long.parseLong(size.substring(0, size.length() - 2).trim()) * 1024L * 1024L;
    if (size.endsWith("GB"))
      return Long.parseLong(size.substring(0, size.length() - 2).trim()) * 1024L * 1024L * 1024L;
    return Long.parseLong(size);
  }

  public String getKey() {
    return key;
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

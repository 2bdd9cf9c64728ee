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
package org.openobservatory.measurements.exception;

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for engine exceptions.
 * Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - Request errors (rejected before any I/O)</li>
 *   <li>2xxx - Lookup errors (no data for the reference)</li>
 *   <li>3xxx - Resource errors (timeouts, pool exhaustion, cancellation)</li>
 *   <li>4xxx - Integrity errors (corrupt archives, inconsistent aggregates)</li>
 *   <li>5xxx - Storage errors (unexpected I/O or SQL failures)</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see MeasurementsException
 */
public enum ErrorCode {

  // ========== Request Errors (1xxx) ==========
  /** Malformed or self-contradicting request */
  INVALID_REQUEST(1001, "Invalid request"),

  /** Time range span is over the configured maximum */
  RANGE_TOO_WIDE(1002, "Time range too wide"),

  /** More grouping dimensions than the cardinality budget allows */
  TOO_MANY_DIMENSIONS(1003, "Too many dimensions"),

  /** Estimated output rows are over the ceiling even at the coarsest granularity */
  ESTIMATE_TOO_LARGE(1004, "Estimated result too large"),

  // ========== Lookup Errors (2xxx) ==========
  MEASUREMENT_NOT_FOUND(2001, "Measurement not found"),

  CONTAINER_NOT_FOUND(2002, "Archive container not found"),

  // ========== Resource Errors (3xxx) ==========
  /** Statement exceeded its server-side timeout or the request deadline */
  QUERY_TIMEOUT(3001, "Query timeout"),

  /** No relational connection became available within the wait timeout */
  POOL_EXHAUSTED(3002, "Connection pool exhausted"),

  QUERY_CANCELLED(3003, "Query cancelled"),

  // ========== Integrity Errors (4xxx) ==========
  CORRUPT_ARCHIVE(4001, "Corrupt archive container"),

  /** Aggregate counters contradict each other */
  INCONSISTENT_DATA(4002, "Inconsistent data"),

  // ========== Storage Errors (5xxx) ==========
  IO_ERROR(5001, "I/O error"),

  SQL_ERROR(5002, "SQL error"),

  // ========== General Errors (99xxx) ==========
  CONFIGURATION_ERROR(99001, "Configuration error"),

  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   */
  public ErrorCategory getCategory() {
    return switch (code / 1000) {
      case 1 -> ErrorCategory.REQUEST;
      case 2 -> ErrorCategory.LOOKUP;
      case 3 -> ErrorCategory.RESOURCE;
      case 4 -> ErrorCategory.INTEGRITY;
      case 5 -> ErrorCategory.STORAGE;
      default -> ErrorCategory.INTERNAL;
    };
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}

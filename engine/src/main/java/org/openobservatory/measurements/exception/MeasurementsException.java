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

import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception class for every failure crossing the engine boundary.
 * Carries a standardized error code plus a diagnostic context (which dimension, which range, which tier) the caller uses to
 * decide whether to retry, narrow the request or surface the error.
 */
public class MeasurementsException extends RuntimeException {
  private final ErrorCode           errorCode;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public MeasurementsException(final ErrorCode errorCode, final String message) {
    super(message);
    this.errorCode = errorCode != null ? errorCode : ErrorCode.INTERNAL_ERROR;
  }

  public MeasurementsException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode != null ? errorCode : ErrorCode.INTERNAL_ERROR;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public ErrorCategory getCategory() {
    return errorCode.getCategory();
  }

  /**
   * Gets the diagnostic context for this exception.
   *
   * @return unmodifiable map of context information, in insertion order
   */
  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  public Object getContext(final String key) {
    return context.get(key);
  }

  /**
   * Adds a context entry to this exception.
   *
   * @return this exception for method chaining
   */
  public MeasurementsException addContext(final String key, final Object value) {
    if (key != null)
      this.context.put(key, value);
    return this;
  }

  /**
   * Returns the HTTP status the caller should map this error to.
   */
  public int getHttpStatus() {
    return 500;
  }

  /**
   * Tells if the same request may succeed later without being changed. The engine itself never retries.
   */
  public boolean isRetryable() {
    return false;
  }

  public String toJSON() {
    final JSONObject json = new JSONObject();
    json.put("errorCode", errorCode.getCode());
    json.put("errorName", errorCode.name());
    json.put("category", errorCode.getCategory().getDisplayName());
    json.put("message", getMessage() != null ? getMessage() : errorCode.getDefaultMessage());
    json.put("retryable", isRetryable());

    if (!context.isEmpty()) {
      final JSONObject ctx = new JSONObject();
      for (final Map.Entry<String, Object> entry : context.entrySet()) {
        final Object value = entry.getValue();
        ctx.put(entry.getKey(), value instanceof Number || value instanceof Boolean ? value : String.valueOf(value));
      }
      json.put("context", ctx);
    }

    if (getCause() != null && getCause().getMessage() != null)
      json.put("cause", getCause().getMessage());

    return json.toString();
  }

  @Override
  public String toString() {
    return String.format("%s [%s-%d]: %s", getClass().getSimpleName(), errorCode.getCategory(), errorCode.getCode(), getMessage());
  }
}

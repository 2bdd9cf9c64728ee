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
package org.openobservatory.measurements.model;

import java.time.Instant;

/**
 * Identifies one measurement. {@code input} is null for tests without input, {@code measurementStartTime} is null when the
 * caller does not know it.
 */
public record MeasurementRef(String reportId, String input, Instant measurementStartTime) {

  public MeasurementRef {
    if (reportId == null || reportId.isBlank())
      throw new IllegalArgumentException("reportId is mandatory");
    if (input != null && input.isEmpty())
      input = null;
  }

  public static MeasurementRef of(final String reportId, final String input) {
    return new MeasurementRef(reportId, input, null);
  }

  public boolean hasStartTime() {
    return measurementStartTime != null;
  }

  @Override
  public String toString() {
    return reportId + (input != null ? " [" + input + "]" : "") + (measurementStartTime != null ? " @" + measurementStartTime : "");
  }
}

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

/**
 * One group of an aggregation result. Every partial count lies in {@code [0, measurementCount]}.
 */
public record AggregationRow(DimensionTuple dimensionValues, long measurementCount, long anomalyCount, long confirmedCount,
                             long failureCount) {

  public AggregationRow {
    if (dimensionValues == null)
      throw new IllegalArgumentException("dimensionValues is mandatory");
    if (measurementCount < 0)
      throw new IllegalArgumentException("Negative measurement count " + measurementCount);
    check("anomaly", anomalyCount, measurementCount);
    check("confirmed", confirmedCount, measurementCount);
    check("failure", failureCount, measurementCount);
  }

  private static void check(final String name, final long value, final long total) {
    if (value < 0 || value > total)
      throw new IllegalArgumentException(name + " count " + value + " outside [0, " + total + "]");
  }
}

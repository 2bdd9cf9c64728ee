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
package org.openobservatory.measurements.query;

import org.openobservatory.measurements.model.Dimension;
import org.openobservatory.measurements.model.DimensionFilter;
import org.openobservatory.measurements.model.TimeGranularity;
import org.openobservatory.measurements.model.TimeRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, bounded form of an aggregation request. Immutable.
 */
public final class QueryPlan {
  private final List<Dimension>                 dimensions;
  private final Map<Dimension, DimensionFilter> filters;
  private final TimeRange                       timeRange;
  private final TimeGranularity                 granularity;
  private final AccessPath                      accessPath;
  private final long                            estimatedRows;
  private final long                            rowCeiling;
  private final long                            offset;
  private final int                             pageSize;
  private final String                          fingerprint;

  public QueryPlan(final List<Dimension> dimensions, final Map<Dimension, DimensionFilter> filters, final TimeRange timeRange,
      final TimeGranularity granularity, final AccessPath accessPath, final long estimatedRows, final long rowCeiling,
      final long offset, final int pageSize, final String fingerprint) {
    if (dimensions.contains(Dimension.TIME_BUCKET) != (granularity != null))
      throw new IllegalArgumentException("Granularity must be set exactly when time_bucket is a dimension");
    if (offset < 0 || pageSize < 1 || rowCeiling < 0)
      throw new IllegalArgumentException("Invalid bounds offset=" + offset + " pageSize=" + pageSize + " ceiling=" + rowCeiling);
    this.dimensions = Collections.unmodifiableList(new ArrayList<>(dimensions));
    final EnumMap<Dimension, DimensionFilter> f = new EnumMap<>(Dimension.class);
    f.putAll(filters);
    this.filters = Collections.unmodifiableMap(f);
    this.timeRange = timeRange;
    this.granularity = granularity;
    this.accessPath = accessPath;
    this.estimatedRows = estimatedRows;
    this.rowCeiling = rowCeiling;
    this.offset = offset;
    this.pageSize = pageSize;
    this.fingerprint = fingerprint;
  }

  public List<Dimension> getDimensions() {
    return dimensions;
  }

  public Map<Dimension, DimensionFilter> getFilters() {
    return filters;
  }

  public TimeRange getTimeRange() {
    return timeRange;
  }

  /**
   * Bucket width, null when the plan does not group by time.
   */
  public TimeGranularity getGranularity() {
    return granularity;
  }

  public AccessPath getAccessPath() {
    return accessPath;
  }

  public long getEstimatedRows() {
    return estimatedRows;
  }

  /**
   * Maximum number of rows all the pages of this request may return together.
   */
  public long getRowCeiling() {
    return rowCeiling;
  }

  /**
   * Position of the first row of this page among all the result rows.
   */
  public long getOffset() {
    return offset;
  }

  public int getPageSize() {
    return pageSize;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  @Override
  public String toString() {
    return "QueryPlan{dimensions=" + dimensions + ", filters=" + filters + ", range=" + timeRange + ", granularity=" + granularity
        + ", access=" + accessPath + ", estimate=" + estimatedRows + ", ceiling=" + rowCeiling + ", offset=" + offset + ", page="
        + pageSize + "}";
  }
}

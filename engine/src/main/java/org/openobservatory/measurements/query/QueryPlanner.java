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

import org.openobservatory.measurements.ContextConfiguration;
import org.openobservatory.measurements.GlobalConfiguration;
import org.openobservatory.measurements.exception.EstimateTooLargeException;
import org.openobservatory.measurements.exception.InvalidRequestException;
import org.openobservatory.measurements.exception.RangeTooWideException;
import org.openobservatory.measurements.exception.TooManyDimensionsException;
import org.openobservatory.measurements.log.LogManager;
import org.openobservatory.measurements.model.AggregationRequest;
import org.openobservatory.measurements.model.Dimension;
import org.openobservatory.measurements.model.DimensionFilter;
import org.openobservatory.measurements.model.TimeGranularity;
import org.openobservatory.measurements.model.TimeRange;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;

/**
 * Turns an aggregation request into a bounded {@link QueryPlan}, or rejects it. Checks run in this order: time range span,
 * number of dimensions, estimated result size (picking the finest time granularity that fits), then the cursor. Planning
 * never touches the stores.
 */
public class QueryPlanner {
  private final CardinalityEstimator estimator;
  private final Duration             maxTimeRange;
  private final int                  maxDimensions;
  private final long                 maxEstimatedRows;
  private final int                  defaultPageSize;
  private final int                  maxPageSize;
  private final Set<Dimension>       indexedDimensions = EnumSet.noneOf(Dimension.class);

  public QueryPlanner(final ContextConfiguration configuration, final CardinalityEstimator estimator) {
    this.estimator = estimator;
    this.maxTimeRange = configuration.getValueAsDuration(GlobalConfiguration.MAX_TIME_RANGE);
    this.maxDimensions = configuration.getValueAsInteger(GlobalConfiguration.MAX_DIMENSIONS);
    this.maxEstimatedRows = configuration.getValueAsLong(GlobalConfiguration.MAX_ESTIMATED_ROWS);
    this.defaultPageSize = configuration.getValueAsInteger(GlobalConfiguration.DEFAULT_PAGE_SIZE);
    this.maxPageSize = configuration.getValueAsInteger(GlobalConfiguration.MAX_PAGE_SIZE);

    final String indexed = configuration.getValueAsString(GlobalConfiguration.INDEXED_DIMENSIONS);
    if (indexed != null)
      for (final String label : indexed.split(","))
        if (!label.isBlank())
          indexedDimensions.add(Dimension.fromLabel(label));
  }

  public QueryPlan plan(final AggregationRequest request) {
    final TimeRange range = request.getTimeRange();

    if (range.span().compareTo(maxTimeRange) > 0) {
      LogManager.instance().log(this, Level.FINE, "Rejected aggregation over %s: range wider than %s", range, maxTimeRange);
      throw (RangeTooWideException) new RangeTooWideException(range.span(), maxTimeRange).addContext("timeRange", range);
    }

    if (request.getDimensions().size() > maxDimensions) {
      LogManager.instance().log(this, Level.FINE, "Rejected aggregation with %d dimensions, maximum is %d",
          request.getDimensions().size(), maxDimensions);
      throw (TooManyDimensionsException) new TooManyDimensionsException(request.getDimensions().size(), maxDimensions).addContext(
          "dimensions", request.getDimensions());
    }

    final int pageSize = request.getPageSize() != null ? request.getPageSize() : defaultPageSize;
    if (pageSize > maxPageSize)
      throw new InvalidRequestException("Page size " + pageSize + " exceeds the maximum of " + maxPageSize,
          "Ask for at most " + maxPageSize + " rows per page");

    // ESTIMATE WITHOUT TIME FIRST, THEN WIDEN THE BUCKETS UNTIL THE RESULT FITS
    long baseEstimate = 1;
    for (final Dimension d : request.getDimensions())
      if (d != Dimension.TIME_BUCKET)
        baseEstimate = saturatedMultiply(baseEstimate, estimator.estimateDistinct(d, request.getFilters().get(d)));

    TimeGranularity granularity = null;
    long estimate = baseEstimate;
    if (request.getDimensions().contains(Dimension.TIME_BUCKET)) {
      TimeGranularity candidate = request.getMinimumGranularity() != null ? request.getMinimumGranularity() : TimeGranularity.HOUR;
      TimeGranularity last = candidate;
      for (; candidate != null; candidate = candidate.coarser()) {
        last = candidate;
        estimate = saturatedMultiply(baseEstimate, candidate.countBuckets(range));
        if (estimate <= maxEstimatedRows) {
          granularity = candidate;
          break;
        }
      }
      if (granularity == null)
        throw reject(estimate, last.getUnit(), request);
    } else if (estimate > maxEstimatedRows)
      throw reject(estimate, "none", request);

    AccessPath accessPath = AccessPath.INDEX;
    for (final Map.Entry<Dimension, DimensionFilter> entry : request.getFilters().entrySet())
      if (!indexedDimensions.contains(entry.getKey())) {
        accessPath = AccessPath.FULL_SCAN;
        break;
      }

    final String fingerprint = request.fingerprint();
    long offset = 0;
    if (request.getCursor() != null) {
      offset = PaginationCursor.decode(request.getCursor(), fingerprint).getOffset();
      if (offset > maxEstimatedRows)
        throw new InvalidRequestException("Cursor points past the row ceiling of " + maxEstimatedRows);
    }

    final QueryPlan plan = new QueryPlan(request.getDimensions(), request.getFilters(), range, granularity, accessPath, estimate,
        maxEstimatedRows, offset, pageSize, fingerprint);
    LogManager.instance().log(this, Level.FINE, "Planned %s", plan);
    return plan;
  }

  private EstimateTooLargeException reject(final long estimate, final String granularity, final AggregationRequest request) {
    LogManager.instance().log(this, Level.FINE, "Rejected aggregation estimated at %d rows (ceiling %d)", estimate, maxEstimatedRows);
    return (EstimateTooLargeException) new EstimateTooLargeException(estimate, maxEstimatedRows, granularity).addContext("timeRange",
        request.getTimeRange());
  }

  static long saturatedMultiply(final long a, final long b) {
    final long r = a * b;
    if (Math.multiplyHigh(a, b) != 0 || r < 0)
      return Long.MAX_VALUE;
    return r;
  }
}

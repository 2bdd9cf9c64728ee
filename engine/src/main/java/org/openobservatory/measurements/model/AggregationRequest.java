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

import org.openobservatory.measurements.exception.InvalidRequestException;

import java.util.*;

/**
 * Immutable aggregation request. Build it with {@link #builder()}.
 */
public final class AggregationRequest {
  private final List<Dimension>                  dimensions;
  private final Map<Dimension, DimensionFilter>  filters;
  private final TimeRange                        timeRange;
  private final String                           cursor;
  private final Integer                          pageSize;
  private final TimeGranularity                  minimumGranularity;

  private AggregationRequest(final Builder builder) {
    this.dimensions = Collections.unmodifiableList(new ArrayList<>(builder.dimensions));
    this.filters = Collections.unmodifiableMap(new EnumMap<>(builder.filters));
    this.timeRange = builder.timeRange;
    this.cursor = builder.cursor;
    this.pageSize = builder.pageSize;
    this.minimumGranularity = builder.minimumGranularity;
  }

  public static Builder builder() {
    return new Builder();
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

  public String getCursor() {
    return cursor;
  }

  public Integer getPageSize() {
    return pageSize;
  }

  public TimeGranularity getMinimumGranularity() {
    return minimumGranularity;
  }

  /**
   * Canonical description of what this request selects. Page size and cursor are not part of it, so a cursor stays valid
   * when only those change.
   */
  public String fingerprint() {
    final StringBuilder buffer = new StringBuilder();
    buffer.append("d=");
    for (final Dimension d : dimensions)
      buffer.append(d.getLabel()).append(',');
    buffer.append(";f=");
    for (final Map.Entry<Dimension, DimensionFilter> e : filters.entrySet())
      buffer.append(e.getKey().getLabel()).append(e.getValue()).append(',');
    buffer.append(";t=").append(timeRange);
    buffer.append(";g=").append(minimumGranularity != null ? minimumGranularity.getUnit() : "");
    return buffer.toString();
  }

  @Override
  public String toString() {
    return "AggregationRequest{" + fingerprint() + (pageSize != null ? ";p=" + pageSize : "") + (cursor != null ? ";c=" + cursor : "")
        + "}";
  }

  public static final class Builder {
    private final LinkedHashSet<Dimension>        dimensions = new LinkedHashSet<>();
    private final Map<Dimension, DimensionFilter> filters    = new EnumMap<>(Dimension.class);
    private       TimeRange                       timeRange;
    private       String                          cursor;
    private       Integer                         pageSize;
    private       TimeGranularity                 minimumGranularity;

    private Builder() {
    }

    public Builder dimension(final Dimension dimension) {
      if (dimension == null)
        throw new InvalidRequestException("Null dimension");
      if (!dimensions.add(dimension))
        throw new InvalidRequestException("Dimension '" + dimension.getLabel() + "' requested more than once",
            "List every dimension once");
      return this;
    }

    public Builder dimensions(final Dimension... dimensions) {
      for (final Dimension d : dimensions)
        dimension(d);
      return this;
    }

    public Builder dimensions(final String... labels) {
      for (final String label : labels)
        try {
          dimension(Dimension.fromLabel(label));
        } catch (final IllegalArgumentException e) {
          throw new InvalidRequestException(e.getMessage(), "Valid dimensions are " + Arrays.toString(Dimension.values()));
        }
      return this;
    }

    public Builder filter(final Dimension dimension, final DimensionFilter filter) {
      if (dimension == null || filter == null)
        throw new InvalidRequestException("Filter needs a dimension and a predicate");
      if (dimension == Dimension.TIME_BUCKET)
        throw new InvalidRequestException("Filter time through the time range, not the time_bucket dimension");
      if (filters.containsKey(dimension))
        throw new InvalidRequestException("More than one filter on dimension '" + dimension.getLabel() + "'");
      try {
        filters.put(dimension, filter.normalizeFor(dimension));
      } catch (final IllegalArgumentException e) {
        throw new InvalidRequestException(e.getMessage());
      }
      return this;
    }

    public Builder timeRange(final TimeRange timeRange) {
      this.timeRange = timeRange;
      return this;
    }

    public Builder cursor(final String cursor) {
      this.cursor = cursor != null && !cursor.isEmpty() ? cursor : null;
      return this;
    }

    public Builder pageSize(final int pageSize) {
      if (pageSize < 1)
        throw new InvalidRequestException("Page size must be positive, got " + pageSize);
      this.pageSize = pageSize;
      return this;
    }

    public Builder minimumGranularity(final TimeGranularity granularity) {
      this.minimumGranularity = granularity;
      return this;
    }

    public AggregationRequest build() {
      if (timeRange == null)
        throw new InvalidRequestException("A time range is mandatory", "Add a start and end time");
      return new AggregationRequest(this);
    }
  }
}

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

import org.openobservatory.measurements.exception.MeasurementsException;
import org.openobservatory.measurements.model.AggregationRow;
import org.openobservatory.measurements.model.FreshnessWindow;
import org.openobservatory.measurements.query.QueryPlan;

import java.util.Collections;
import java.util.List;

/**
 * One page of an aggregation.
 */
public class AggregationResult {
  private final List<AggregationRow>        rows;
  private final QueryPlan                   plan;
  private final String                      nextCursor;
  private final FreshnessWindow             freshness;
  private final List<MeasurementsException> warnings;
  private final boolean                     truncated;

  public AggregationResult(final List<AggregationRow> rows, final QueryPlan plan, final String nextCursor,
      final FreshnessWindow freshness, final List<MeasurementsException> warnings, final boolean truncated) {
    this.rows = Collections.unmodifiableList(rows);
    this.plan = plan;
    this.nextCursor = nextCursor;
    this.freshness = freshness;
    this.warnings = Collections.unmodifiableList(warnings);
    this.truncated = truncated;
  }

  public List<AggregationRow> getRows() {
    return rows;
  }

  public QueryPlan getPlan() {
    return plan;
  }

  /**
   * Cursor of the next page, null on the last page.
   */
  public String getNextCursor() {
    return nextCursor;
  }

  public boolean hasMore() {
    return nextCursor != null;
  }

  public FreshnessWindow getFreshness() {
    return freshness;
  }

  public List<MeasurementsException> getWarnings() {
    return warnings;
  }

  /**
   * True when some counts were corrected because the store returned inconsistent data.
   */
  public boolean isDegraded() {
    return !warnings.isEmpty();
  }

  /**
   * True when the result was cut at the row ceiling.
   */
  public boolean isTruncated() {
    return truncated;
  }

  @Override
  public String toString() {
    return "AggregationResult{" + rows.size() + " rows, next=" + nextCursor + ", freshness=" + freshness + ", warnings="
        + warnings.size() + (truncated ? ", truncated" : "") + "}";
  }
}

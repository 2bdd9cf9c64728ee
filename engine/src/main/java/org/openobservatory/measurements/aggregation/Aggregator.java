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
package org.openobservatory.measurements.aggregation;

import org.openobservatory.measurements.ContextConfiguration;
import org.openobservatory.measurements.GlobalConfiguration;
import org.openobservatory.measurements.QueryContext;
import org.openobservatory.measurements.exception.InconsistentDataException;
import org.openobservatory.measurements.exception.MeasurementsException;
import org.openobservatory.measurements.log.LogManager;
import org.openobservatory.measurements.model.AggregationRow;
import org.openobservatory.measurements.model.DimensionTuple;
import org.openobservatory.measurements.query.QueryPlan;
import org.openobservatory.measurements.relational.GroupedCounts;
import org.openobservatory.measurements.relational.RelationalReader;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.logging.Level;

/**
 * Executes a plan against the relational tier. Grouped counts are read in chunks, merged by dimension tuple and emitted
 * in tuple order, up to the page size and never past the row ceiling of the plan.
 * <p>
 * Partial counts larger than the measurement count of their group are capped and reported as warnings.
 */
public class Aggregator {
  private final RelationalReader store;
  private final int              fetchSize;

  public Aggregator(final ContextConfiguration configuration, final RelationalReader store) {
    this.store = store;
    this.fetchSize = configuration.getValueAsInteger(GlobalConfiguration.AGGREGATION_FETCH_SIZE);
    if (fetchSize < 1)
      throw new IllegalArgumentException("Fetch size must be positive, got " + fetchSize);
  }

  public AggregationPage run(final QueryPlan plan, final QueryContext context) {
    final long want = Math.min(plan.getPageSize(), plan.getRowCeiling() - plan.getOffset());
    if (want <= 0)
      return new AggregationPage(List.of(), OptionalLong.empty(), plan.getOffset() >= plan.getRowCeiling(), List.of());

    final TreeMap<DimensionTuple, long[]> merged = new TreeMap<>();
    long storeOffset = plan.getOffset();
    boolean exhausted = false;

    while (merged.size() < want) {
      context.checkActive();
      final int limit = (int) Math.min(fetchSize, want - merged.size());
      final List<GroupedCounts> chunk = store.fetchAggregateRows(plan, storeOffset, limit, context);

      for (final GroupedCounts row : chunk) {
        final long[] counts = merged.computeIfAbsent(row.tuple(), k -> new long[4]);
        counts[0] += row.measurementCount();
        counts[1] += row.anomalyCount();
        counts[2] += row.confirmedCount();
        counts[3] += row.failureCount();
      }
      storeOffset += chunk.size();

      if (chunk.size() < limit) {
        exhausted = true;
        break;
      }
    }

    final List<MeasurementsException> warnings = new ArrayList<>();
    final List<AggregationRow> rows = new ArrayList<>(merged.size());
    for (final Map.Entry<DimensionTuple, long[]> entry : merged.entrySet())
      rows.add(toRow(entry.getKey(), entry.getValue(), warnings));

    OptionalLong next = OptionalLong.empty();
    boolean truncated = false;
    if (!exhausted) {
      if (storeOffset < plan.getRowCeiling())
        next = OptionalLong.of(storeOffset);
      else {
        truncated = true;
        LogManager.instance().log(this, Level.FINE, "Aggregation stopped at the row ceiling of %d rows", plan.getRowCeiling());
      }
    }

    return new AggregationPage(rows, next, truncated, warnings);
  }

  private AggregationRow toRow(final DimensionTuple tuple, final long[] counts, final List<MeasurementsException> warnings) {
    final long total = Math.max(0, counts[0]);
    final long anomalies = cap("anomaly", tuple, counts[1], total, warnings);
    final long confirmed = cap("confirmed", tuple, counts[2], total, warnings);
    final long failures = cap("failure", tuple, counts[3], total, warnings);
    return new AggregationRow(tuple, total, anomalies, confirmed, failures);
  }

  private long cap(final String name, final DimensionTuple tuple, final long value, final long total,
      final List<MeasurementsException> warnings) {
    if (value >= 0 && value <= total)
      return value;

    final long capped = value < 0 ? 0 : total;
    LogManager.instance().log(this, Level.SEVERE, "Inconsistent %s count %d for %d measurements in group %s, using %d", name, value,
        total, tuple, capped);
    warnings.add(new InconsistentDataException(
        "Group " + tuple + " reports " + value + " " + name + " for " + total + " measurements").addContext("dimensionValues",
        tuple).addContext("count", name));
    return capped;
  }
}

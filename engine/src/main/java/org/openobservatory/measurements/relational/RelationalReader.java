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
package org.openobservatory.measurements.relational;

import org.openobservatory.measurements.QueryContext;
import org.openobservatory.measurements.locator.MeasurementReader;
import org.openobservatory.measurements.model.MeasurementRef;
import org.openobservatory.measurements.query.QueryPlan;

import java.util.List;

/**
 * Read access to the relational tier. Every call runs under a statement timeout bounded by the request deadline and is
 * never retried.
 */
public interface RelationalReader extends MeasurementReader {
  /**
   * Existence probe used by the locator.
   */
  boolean exists(MeasurementRef ref, QueryContext context);

  /**
   * Tells if any measurement of the report is stored.
   */
  boolean reportExists(String reportId, QueryContext context);

  /**
   * Returns at most {@code limit} groups starting at {@code offset}, ordered by dimension tuple with nulls first.
   */
  List<GroupedCounts> fetchAggregateRows(QueryPlan plan, long offset, int limit, QueryContext context);
}

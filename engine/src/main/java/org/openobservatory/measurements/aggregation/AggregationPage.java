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

import org.openobservatory.measurements.exception.MeasurementsException;
import org.openobservatory.measurements.model.AggregationRow;

import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

/**
 * Rows of one page, ordered by dimension tuple.
 *
 * @param nextOffset position of the next page, empty on the last page
 * @param truncated  true if rows were left out because the result hit the row ceiling
 * @param warnings   data problems found while building the page
 */
public record AggregationPage(List<AggregationRow> rows, OptionalLong nextOffset, boolean truncated,
                              List<MeasurementsException> warnings) {

  public AggregationPage {
    rows = Collections.unmodifiableList(rows);
    warnings = Collections.unmodifiableList(warnings);
  }
}

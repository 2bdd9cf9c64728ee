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

/**
 * Estimates how many distinct values a dimension takes within a request.
 */
public interface CardinalityEstimator {
  /**
   * @param filter filter on the dimension, null if the request does not filter it
   */
  long estimateDistinct(Dimension dimension, DimensionFilter filter);
}

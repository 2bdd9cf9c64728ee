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
import org.openobservatory.measurements.exception.ErrorCode;
import org.openobservatory.measurements.exception.MeasurementsException;
import org.openobservatory.measurements.model.Dimension;
import org.openobservatory.measurements.model.DimensionFilter;

import java.util.EnumMap;
import java.util.Map;

/**
 * Estimates from static per-dimension counts, narrowed by filters: an equality keeps one value, a range on the ASN keeps at
 * most the width of the range.
 */
public class ConfiguredCardinalityEstimator implements CardinalityEstimator {
  static final long DEFAULT_ESTIMATE = 1_000_000L;

  private final Map<Dimension, Long> estimates = new EnumMap<>(Dimension.class);

  public ConfiguredCardinalityEstimator(final ContextConfiguration configuration) {
    this(configuration.getValueAsString(GlobalConfiguration.DIMENSION_CARDINALITY));
  }

  public ConfiguredCardinalityEstimator(final String estimates) {
    if (estimates == null || estimates.isBlank())
      return;
    for (final String pair : estimates.split(",")) {
      final String[] kv = pair.split("=");
      try {
        if (kv.length != 2)
          throw new IllegalArgumentException("Expected name=count, found '" + pair.trim() + "'");
        final long value = Long.parseLong(kv[1].trim());
        if (value < 1)
          throw new IllegalArgumentException("Estimate of '" + kv[0].trim() + "' must be positive");
        this.estimates.put(Dimension.fromLabel(kv[0]), value);
      } catch (final IllegalArgumentException e) {
        throw new MeasurementsException(ErrorCode.CONFIGURATION_ERROR,
            "Invalid setting " + GlobalConfiguration.DIMENSION_CARDINALITY.getKey() + ": " + e.getMessage(), e);
      }
    }
  }

  @Override
  public long estimateDistinct(final Dimension dimension, final DimensionFilter filter) {
    final long base = estimates.getOrDefault(dimension, DEFAULT_ESTIMATE);
    if (filter == null)
      return base;
    if (filter.getKind() == DimensionFilter.Kind.EQUALS)
      return 1;
    if (dimension == Dimension.ASN)
      return Math.max(1, Math.min(base, (Long) filter.getUpper() - (Long) filter.getLower()));
    return base;
  }
}

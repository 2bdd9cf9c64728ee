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

import org.openobservatory.measurements.model.TimeGranularity;

import java.util.Locale;

/**
 * SQL differences between the supported relational stores.
 */
public enum SqlDialect {
  POSTGRESQL {
    @Override
    public String truncateTime(final String column, final TimeGranularity granularity) {
      return "date_trunc('" + granularity.getUnit() + "', " + column + ")";
    }

    @Override
    public String binaryOrder(final String expression, final Class<?> type) {
      return type == String.class ? expression + " COLLATE \"C\"" : expression;
    }
  },

  H2 {
    @Override
    public String truncateTime(final String column, final TimeGranularity granularity) {
      return "DATE_TRUNC(" + granularity.getUnit().toUpperCase(Locale.ENGLISH) + ", " + column + ")";
    }
  };

  /**
   * Expression truncating a timestamp column to the start of its bucket.
   */
  public abstract String truncateTime(String column, TimeGranularity granularity);

  /**
   * Expression that compares text by code point, the order {@link org.openobservatory.measurements.model.DimensionTuple} sorts in.
   * H2 already compares strings that way.
   */
  public String binaryOrder(final String expression, final Class<?> type) {
    return expression;
  }

  public String limitOffset() {
    return " LIMIT ? OFFSET ?";
  }

  public static SqlDialect fromName(final String name) {
    for (final SqlDialect d : values())
      if (d.name().equalsIgnoreCase(name.trim()))
        return d;
    throw new IllegalArgumentException("Unsupported SQL dialect '" + name + "'");
  }
}

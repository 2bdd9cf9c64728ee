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

import java.time.Instant;
import java.util.Locale;

/**
 * Grouping dimensions of an aggregation, with the column each one reads.
 */
public enum Dimension {
  COUNTRY("country", "probe_cc", String.class),
  ASN("asn", "probe_asn", Long.class),
  TEST_NAME("test_name", "test_name", String.class),
  CATEGORY_CODE("category_code", "category_code", String.class),
  TIME_BUCKET("time_bucket", "measurement_start_time", Instant.class),
  INPUT("input", "input", String.class),
  DOMAIN("domain", "domain", String.class);

  private final String   label;
  private final String   column;
  private final Class<?> valueType;

  Dimension(final String label, final String column, final Class<?> valueType) {
    this.label = label;
    this.column = column;
    this.valueType = valueType;
  }

  public String getLabel() {
    return label;
  }

  public String getColumn() {
    return column;
  }

  public Class<?> getValueType() {
    return valueType;
  }

  /**
   * Resolves a dimension by label ({@code test_name}) or enum name ({@code TEST_NAME}), case insensitive.
   */
  public static Dimension fromLabel(final String label) {
    if (label != null) {
      final String l = label.trim();
      for (final Dimension d : values())
        if (d.label.equalsIgnoreCase(l) || d.name().equalsIgnoreCase(l))
          return d;
    }
    throw new IllegalArgumentException("Unknown dimension '" + label + "'");
  }

  /**
   * Converts a caller supplied value to the dimension's value type. ASNs are accepted as numbers or as {@code AS1234};
   * country codes are upper-cased.
   */
  public Object normalize(final Object value) {
    if (value == null)
      throw new IllegalArgumentException("Null value for dimension " + label);

    switch (this) {
    case ASN:
      if (value instanceof Number n)
        return n.longValue();
      String asn = value.toString().trim();
      if (asn.regionMatches(true, 0, "AS", 0, 2))
        asn = asn.substring(2);
      try {
        return Long.parseLong(asn);
      } catch (final NumberFormatException e) {
        throw new IllegalArgumentException("Invalid ASN '" + value + "'", e);
      }
    case TIME_BUCKET:
      if (value instanceof Instant)
        return value;
      return Instant.parse(value.toString().trim());
    case COUNTRY:
      final String cc = value.toString().trim().toUpperCase(Locale.ENGLISH);
      if (cc.length() != 2)
        throw new IllegalArgumentException("Invalid country code '" + value + "'");
      return cc;
    default:
      return value.toString();
    }
  }
}

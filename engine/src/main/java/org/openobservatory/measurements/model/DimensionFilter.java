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

import java.util.Objects;

/**
 * Predicate on one dimension: either an equality or a half-open range {@code [lower, upper)}.
 */
public final class DimensionFilter {
  public enum Kind {EQUALS, RANGE}

  private final Kind   kind;
  private final Object value;
  private final Object lower;
  private final Object upper;

  private DimensionFilter(final Kind kind, final Object value, final Object lower, final Object upper) {
    this.kind = kind;
    this.value = value;
    this.lower = lower;
    this.upper = upper;
  }

  public static DimensionFilter eq(final Object value) {
    if (value == null)
      throw new IllegalArgumentException("Equality filter needs a value");
    return new DimensionFilter(Kind.EQUALS, value, null, null);
  }

  public static DimensionFilter range(final Object lower, final Object upper) {
    if (lower == null || upper == null)
      throw new IllegalArgumentException("Range filter needs both bounds");
    return new DimensionFilter(Kind.RANGE, null, lower, upper);
  }

  /**
   * Returns a copy whose values are converted to the type of {@code dimension}. Ranges must be non-empty.
   */
  @SuppressWarnings({ "unchecked", "rawtypes" })
  public DimensionFilter normalizeFor(final Dimension dimension) {
    if (kind == Kind.EQUALS)
      return new DimensionFilter(kind, dimension.normalize(value), null, null);

    final Object lo = dimension.normalize(lower);
    final Object hi = dimension.normalize(upper);
    if (((Comparable) lo).compareTo(hi) >= 0)
      throw new IllegalArgumentException("Empty range [" + lo + ", " + hi + ") on dimension " + dimension.getLabel());
    return new DimensionFilter(kind, null, lo, hi);
  }

  public Kind getKind() {
    return kind;
  }

  public Object getValue() {
    return value;
  }

  public Object getLower() {
    return lower;
  }

  public Object getUpper() {
    return upper;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof DimensionFilter))
      return false;
    final DimensionFilter that = (DimensionFilter) o;
    return kind == that.kind && Objects.equals(value, that.value) && Objects.equals(lower, that.lower)
        && Objects.equals(upper, that.upper);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value, lower, upper);
  }

  @Override
  public String toString() {
    return kind == Kind.EQUALS ? "=" + value : "[" + lower + ", " + upper + ")";
  }
}

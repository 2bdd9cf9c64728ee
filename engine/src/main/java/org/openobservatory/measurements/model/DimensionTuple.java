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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Values of the requested dimensions for one aggregation group, in request order. Ordered lexicographically, element by
 * element, with nulls first.
 */
public final class DimensionTuple implements Comparable<DimensionTuple> {
  private final List<Object> values;

  public DimensionTuple(final List<?> values) {
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  public static DimensionTuple of(final Object... values) {
    final List<Object> list = new ArrayList<>(values.length);
    Collections.addAll(list, values);
    return new DimensionTuple(list);
  }

  public Object get(final int index) {
    return values.get(index);
  }

  public int size() {
    return values.size();
  }

  public List<Object> values() {
    return values;
  }

  @Override
  @SuppressWarnings({ "unchecked", "rawtypes" })
  public int compareTo(final DimensionTuple other) {
    final int n = Math.min(values.size(), other.values.size());
    for (int i = 0; i < n; i++) {
      final Object a = values.get(i);
      final Object b = other.values.get(i);
      if (a == b)
        continue;
      if (a == null)
        return -1;
      if (b == null)
        return 1;
      final int cmp = ((Comparable) a).compareTo(b);
      if (cmp != 0)
        return cmp;
    }
    return Integer.compare(values.size(), other.values.size());
  }

  @Override
  public boolean equals(final Object o) {
    return this == o || (o instanceof DimensionTuple && values.equals(((DimensionTuple) o).values));
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}

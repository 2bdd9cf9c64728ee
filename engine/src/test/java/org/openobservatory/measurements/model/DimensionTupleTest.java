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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DimensionTupleTest {

  @Test
  void testOrderingPutsNullsFirst() {
    final List<DimensionTuple> tuples = new ArrayList<>(List.of(//
        DimensionTuple.of("IT", 30722L),//
        DimensionTuple.of(null, 1L),//
        DimensionTuple.of("IT", null),//
        DimensionTuple.of("BR", 28573L)));

    Collections.sort(tuples);

    assertThat(tuples).containsExactly(//
        DimensionTuple.of(null, 1L),//
        DimensionTuple.of("BR", 28573L),//
        DimensionTuple.of("IT", null),//
        DimensionTuple.of("IT", 30722L));
  }

  @Test
  void testEquality() {
    assertThat(DimensionTuple.of("IT", 3269L)).isEqualTo(DimensionTuple.of("IT", 3269L))
        .hasSameHashCodeAs(DimensionTuple.of("IT", 3269L));
    assertThat(DimensionTuple.of("IT")).isNotEqualTo(DimensionTuple.of("IT", 3269L));
    assertThat(DimensionTuple.of().compareTo(DimensionTuple.of())).isZero();
  }
}

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

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeGranularityTest {
  private static final TimeRange JAN_2021 = new TimeRange(Instant.parse("2021-01-01T00:00:00Z"),
      Instant.parse("2021-02-01T00:00:00Z"));

  @Test
  void testTruncate() {
    final Instant t = Instant.parse("2021-01-14T17:42:11Z");
    assertThat(TimeGranularity.HOUR.truncate(t)).isEqualTo(Instant.parse("2021-01-14T17:00:00Z"));
    assertThat(TimeGranularity.DAY.truncate(t)).isEqualTo(Instant.parse("2021-01-14T00:00:00Z"));
    // THURSDAY -> MONDAY
    assertThat(TimeGranularity.WEEK.truncate(t)).isEqualTo(Instant.parse("2021-01-11T00:00:00Z"));
    assertThat(TimeGranularity.MONTH.truncate(t)).isEqualTo(Instant.parse("2021-01-01T00:00:00Z"));
  }

  @Test
  void testCountBuckets() {
    assertThat(TimeGranularity.HOUR.countBuckets(JAN_2021)).isEqualTo(744);
    assertThat(TimeGranularity.DAY.countBuckets(JAN_2021)).isEqualTo(31);
    assertThat(TimeGranularity.WEEK.countBuckets(JAN_2021)).isEqualTo(5);
    assertThat(TimeGranularity.MONTH.countBuckets(JAN_2021)).isEqualTo(1);

    final TimeRange straddling = new TimeRange(Instant.parse("2021-01-31T23:00:00Z"), Instant.parse("2021-02-01T01:00:00Z"));
    assertThat(TimeGranularity.MONTH.countBuckets(straddling)).isEqualTo(2);
    assertThat(TimeGranularity.HOUR.countBuckets(straddling)).isEqualTo(2);
  }

  @Test
  void testCoarserAndUnit() {
    assertThat(TimeGranularity.HOUR.coarser()).isEqualTo(TimeGranularity.DAY);
    assertThat(TimeGranularity.MONTH.coarser()).isNull();
    assertThat(TimeGranularity.fromUnit("week")).isEqualTo(TimeGranularity.WEEK);
    assertThatThrownBy(() -> TimeGranularity.fromUnit("year")).isInstanceOf(IllegalArgumentException.class);
  }
}

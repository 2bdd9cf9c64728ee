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

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Width of a time bucket, finest first. Buckets are aligned in UTC; weeks start on Monday.
 */
public enum TimeGranularity {
  HOUR("hour"),
  DAY("day"),
  WEEK("week"),
  MONTH("month");

  private final String unit;

  TimeGranularity(final String unit) {
    this.unit = unit;
  }

  /**
   * Unit name as understood by {@code date_trunc}.
   */
  public String getUnit() {
    return unit;
  }

  /**
   * Next coarser granularity, or null for the coarsest.
   */
  public TimeGranularity coarser() {
    final int next = ordinal() + 1;
    return next < values().length ? values()[next] : null;
  }

  public Instant truncate(final Instant instant) {
    final ZonedDateTime t = instant.atZone(ZoneOffset.UTC);
    return switch (this) {
      case HOUR -> t.truncatedTo(ChronoUnit.HOURS).toInstant();
      case DAY -> t.truncatedTo(ChronoUnit.DAYS).toInstant();
      case WEEK -> t.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toInstant();
      case MONTH -> t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).toInstant();
    };
  }

  /**
   * Number of buckets intersecting {@code range}.
   */
  public long countBuckets(final TimeRange range) {
    final Instant first = truncate(range.start());
    final Instant last = truncate(range.end().minusNanos(1));
    return switch (this) {
      case HOUR -> Duration.between(first, last).toHours() + 1;
      case DAY -> Duration.between(first, last).toDays() + 1;
      case WEEK -> Duration.between(first, last).toDays() / 7 + 1;
      case MONTH -> ChronoUnit.MONTHS.between(first.atZone(ZoneOffset.UTC), last.atZone(ZoneOffset.UTC)) + 1;
    };
  }

  public static TimeGranularity fromUnit(final String unit) {
    for (final TimeGranularity g : values())
      if (g.unit.equalsIgnoreCase(unit.trim()) || g.name().equalsIgnoreCase(unit.trim()))
        return g;
    throw new IllegalArgumentException("Unknown time granularity '" + unit + "'");
  }
}

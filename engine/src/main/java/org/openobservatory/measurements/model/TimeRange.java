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

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time interval {@code [start, end)}.
 */
public record TimeRange(Instant start, Instant end) {

  public TimeRange {
    if (start == null || end == null)
      throw new IllegalArgumentException("start and end are mandatory");
    if (!start.isBefore(end))
      throw new IllegalArgumentException("start (" + start + ") must be before end (" + end + ")");
  }

  /**
   * Range covering a single instant.
   */
  public static TimeRange at(final Instant instant) {
    return new TimeRange(instant, instant.plusMillis(1));
  }

  public Duration span() {
    return Duration.between(start, end);
  }

  public boolean contains(final Instant instant) {
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}

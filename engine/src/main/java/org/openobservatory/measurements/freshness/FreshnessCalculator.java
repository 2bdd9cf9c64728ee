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
package org.openobservatory.measurements.freshness;

import org.openobservatory.measurements.ContextConfiguration;
import org.openobservatory.measurements.GlobalConfiguration;
import org.openobservatory.measurements.model.FreshnessWindow;
import org.openobservatory.measurements.model.StorageTier;
import org.openobservatory.measurements.model.TimeRange;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Computes how long a response stays valid. Archived data never changes. Relational data is sealed once the end of its
 * time range is older than the settlement delay, and short-lived before that.
 */
public class FreshnessCalculator {
  private final Clock    clock;
  private final Duration settlementDelay;
  private final Duration shortTtl;
  private final Duration sealedTtl;

  public FreshnessCalculator(final ContextConfiguration configuration, final Clock clock) {
    this.clock = clock;
    this.settlementDelay = configuration.getValueAsDuration(GlobalConfiguration.SETTLEMENT_DELAY);
    this.shortTtl = configuration.getValueAsDuration(GlobalConfiguration.SHORT_TTL);
    this.sealedTtl = configuration.getValueAsDuration(GlobalConfiguration.SEALED_TTL);
  }

  public FreshnessWindow compute(final TimeRange range, final StorageTier tier) {
    return compute(range, tier, clock.instant());
  }

  public FreshnessWindow compute(final TimeRange range, final StorageTier tier, final Instant now) {
    return computeUntil(range.end(), tier, now);
  }

  /**
   * Window of a single measurement. An unknown start time counts as still changing unless the measurement is archived.
   */
  public FreshnessWindow computeForMeasurement(final Instant startTime, final StorageTier tier) {
    return computeUntil(startTime, tier, clock.instant());
  }

  private FreshnessWindow computeUntil(final Instant end, final StorageTier tier, final Instant now) {
    if (tier == StorageTier.ARCHIVE || (end != null && end.plus(settlementDelay).isBefore(now)))
      return new FreshnessWindow(now.plus(sealedTtl), true);
    return new FreshnessWindow(now.plus(shortTtl), false);
  }

  public Clock getClock() {
    return clock;
  }
}

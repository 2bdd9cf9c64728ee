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
 * Cache validity of one response. Computed per response, never stored.
 *
 * @param validUntil instant after which the response must be recomputed
 * @param sealed     true when the data behind the response cannot change anymore
 */
public record FreshnessWindow(Instant validUntil, boolean sealed) {

  public FreshnessWindow {
    if (validUntil == null)
      throw new IllegalArgumentException("validUntil is mandatory");
  }

  /**
   * Remaining validity at {@code now}, never negative. Maps to {@code Cache-Control: max-age}.
   */
  public Duration maxAge(final Instant now) {
    final Duration d = Duration.between(now, validUntil);
    return d.isNegative() ? Duration.ZERO : d;
  }

  /**
   * Window of a response built from both parts: the earliest expiry, sealed only if both are.
   */
  public FreshnessWindow combine(final FreshnessWindow other) {
    final Instant until = validUntil.isBefore(other.validUntil) ? validUntil : other.validUntil;
    return new FreshnessWindow(until, sealed && other.sealed);
  }
}

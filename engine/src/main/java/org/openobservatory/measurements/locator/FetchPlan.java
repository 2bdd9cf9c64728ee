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
package org.openobservatory.measurements.locator;

import org.openobservatory.measurements.model.ArchiveLocator;
import org.openobservatory.measurements.model.MeasurementRef;
import org.openobservatory.measurements.model.StorageTier;

/**
 * Where to read a measurement from.
 *
 * @param archiveLocator set only for {@link StorageTier#ARCHIVE}
 * @param probed         true if the relational tier was probed to take the decision
 */
public record FetchPlan(StorageTier tier, MeasurementRef ref, ArchiveLocator archiveLocator, boolean probed) {

  public FetchPlan {
    if (tier == null || ref == null)
      throw new IllegalArgumentException("tier and ref are mandatory");
    if (tier == StorageTier.ARCHIVE && archiveLocator == null)
      throw new IllegalArgumentException("Archive plans need a locator");
  }

  public static FetchPlan relational(final MeasurementRef ref, final boolean probed) {
    return new FetchPlan(StorageTier.RELATIONAL, ref, null, probed);
  }

  public static FetchPlan archive(final MeasurementRef ref, final ArchiveLocator locator, final boolean probed) {
    return new FetchPlan(StorageTier.ARCHIVE, ref, locator, probed);
  }
}

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

import org.openobservatory.measurements.ContextConfiguration;
import org.openobservatory.measurements.GlobalConfiguration;
import org.openobservatory.measurements.QueryContext;
import org.openobservatory.measurements.log.LogManager;
import org.openobservatory.measurements.model.MeasurementRef;
import org.openobservatory.measurements.relational.RelationalReader;

import java.time.Duration;
import java.time.Instant;
import java.util.logging.Level;

/**
 * Decides which tier holds a measurement. Measurements started at or after the cutover are relational, those started well
 * before it are archived. Around the cutover, and when the start time is unknown, the relational tier is probed once and
 * the archive is used on a miss.
 */
public class StorageLocator {
  private final RelationalReader relational;
  private final ArchiveLayout    layout;
  private final Instant          cutover;
  private final Instant          boundaryStart;

  public StorageLocator(final ContextConfiguration configuration, final RelationalReader relational, final ArchiveLayout layout) {
    this.relational = relational;
    this.layout = layout;
    this.cutover = configuration.getValueAsInstant(GlobalConfiguration.CUTOVER);
    final Duration window = configuration.getValueAsDuration(GlobalConfiguration.CUTOVER_BOUNDARY_WINDOW);
    this.boundaryStart = cutover.minus(window);
  }

  public FetchPlan locate(final MeasurementRef ref, final QueryContext context) {
    final Instant start = ref.measurementStartTime();

    if (start != null && !start.isBefore(cutover)) {
      LogManager.instance().log(this, Level.FINE, "%s started after cutover, reading relational tier", ref);
      return FetchPlan.relational(ref, false);
    }

    if (start == null || !start.isBefore(boundaryStart)) {
      context.checkActive();
      if (relational.exists(ref, context)) {
        LogManager.instance().log(this, Level.FINE, "%s found by relational probe", ref);
        return FetchPlan.relational(ref, true);
      }
      LogManager.instance().log(this, Level.FINE, "%s missed by relational probe, reading archive", ref);
      return FetchPlan.archive(ref, layout.locate(ref), true);
    }

    LogManager.instance().log(this, Level.FINE, "%s started before cutover, reading archive", ref);
    return FetchPlan.archive(ref, layout.locate(ref), false);
  }

  public Instant getCutover() {
    return cutover;
  }

  public ArchiveLayout getLayout() {
    return layout;
  }
}

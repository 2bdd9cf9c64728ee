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

import org.openobservatory.measurements.exception.ErrorCode;
import org.openobservatory.measurements.exception.NotFoundException;
import org.openobservatory.measurements.model.ArchiveLocator;
import org.openobservatory.measurements.model.MeasurementRef;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Maps measurements to archive containers. A container holds the measurements of one UTC day, country and ASN, stored at
 * {@code yyyy-MM-dd/<CC>-AS<asn>.lz4}. The day is the one of the report creation time, so every measurement of a report
 * lands in the same container.
 */
public class ArchiveLayout {
  public static final String            CONTAINER_EXTENSION = ".lz4";
  public static final String            INDEX_EXTENSION     = ".idx";
  private static final DateTimeFormatter DAY                 = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

  public ArchiveLocator locate(final MeasurementRef ref) {
    return new ArchiveLocator(containerPath(ref.reportId()), indexKey(ref.reportId(), ref.input()));
  }

  /**
   * @throws NotFoundException if the report identifier cannot be mapped to a container
   */
  public String containerPath(final String reportId) {
    final ReportIdInfo info;
    try {
      info = ReportIdParser.parse(reportId);
    } catch (final IllegalArgumentException e) {
      throw (NotFoundException) new NotFoundException(ErrorCode.MEASUREMENT_NOT_FOUND,
          "No archive container for report id '" + reportId + "'", e).addContext("reportId", reportId);
    }
    return containerPath(info.startTime(), info.countryCode(), info.asn());
  }

  public String containerPath(final Instant day, final String countryCode, final long asn) {
    return DAY.format(day) + "/" + countryCode + "-AS" + asn + CONTAINER_EXTENSION;
  }

  public static String indexPath(final String containerPath) {
    return containerPath + INDEX_EXTENSION;
  }

  /**
   * Sort key of a record: the report id and the input separated by a space. Records without input end with the space.
   */
  public static String indexKey(final String reportId, final String input) {
    return reportId + ' ' + (input != null ? input : "");
  }

  /**
   * First key any record of {@code reportId} can have.
   */
  public static String reportPrefix(final String reportId) {
    return reportId + ' ';
  }
}

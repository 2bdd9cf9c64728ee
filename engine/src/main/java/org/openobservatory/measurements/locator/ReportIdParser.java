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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Parses report identifiers. Two forms are in use:
 * <ul>
 * <li>{@code 20210101T000000Z_webconnectivity_IT_30722_n1_AbCd} (timestamp, test name, country, ASN, collector, random)</li>
 * <li>{@code 20170221T080226Z_AS12345_AbCd} (legacy: timestamp, ASN, random)</li>
 * </ul>
 */
public final class ReportIdParser {
  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'", Locale.ENGLISH);

  private ReportIdParser() {
  }

  /**
   * @throws IllegalArgumentException if the identifier matches neither form
   */
  public static ReportIdInfo parse(final String reportId) {
    if (reportId == null)
      throw new IllegalArgumentException("Null report id");

    final String[] parts = reportId.split("_", -1);
    if (parts.length == 6) {
      final String testName = parts[1];
      final String cc = parts[2];
      if (cc.length() != 2 || testName.length() < 2 || testName.length() >= 30 || !isAlphanumeric(testName))
        throw new IllegalArgumentException("Malformed report id '" + abbreviate(reportId) + "'");
      return new ReportIdInfo(parseTimestamp(reportId, parts[0]), testName, cc.toUpperCase(Locale.ENGLISH), parseAsn(reportId, parts[3]),
          false);
    }

    if (parts.length == 3 && parts[1].startsWith("AS"))
      return new ReportIdInfo(parseTimestamp(reportId, parts[0]), null, ReportIdInfo.UNKNOWN_COUNTRY,
          parseAsn(reportId, parts[1].substring(2)), true);

    throw new IllegalArgumentException("Malformed report id '" + abbreviate(reportId) + "'");
  }

  public static boolean isValid(final String reportId) {
    try {
      parse(reportId);
      return true;
    } catch (final IllegalArgumentException e) {
      return false;
    }
  }

  private static Instant parseTimestamp(final String reportId, final String value) {
    try {
      return LocalDateTime.parse(value, TIMESTAMP).toInstant(ZoneOffset.UTC);
    } catch (final DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid timestamp in report id '" + abbreviate(reportId) + "'", e);
    }
  }

  private static long parseAsn(final String reportId, final String value) {
    try {
      final long asn = Long.parseLong(value);
      if (asn < 0)
        throw new IllegalArgumentException("Negative ASN in report id '" + abbreviate(reportId) + "'");
      return asn;
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid ASN in report id '" + abbreviate(reportId) + "'", e);
    }
  }

  private static boolean isAlphanumeric(final String s) {
    for (int i = 0; i < s.length(); i++)
      if (!Character.isLetterOrDigit(s.charAt(i)))
        return false;
    return true;
  }

  private static String abbreviate(final String s) {
    return s.length() > 200 ? s.substring(0, 200) + "..." : s;
  }
}

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

/**
 * Fields embedded in a report identifier.
 *
 * @param startTime   report creation time, second precision, UTC
 * @param testName    test name, null for legacy identifiers
 * @param countryCode probe country, {@code ZZ} when the identifier does not carry one
 * @param asn         probe autonomous system number
 * @param legacy      true for the {@code <timestamp>_AS<asn>_<random>} form
 */
public record ReportIdInfo(Instant startTime, String testName, String countryCode, long asn, boolean legacy) {
  public static final String UNKNOWN_COUNTRY = "ZZ";
}

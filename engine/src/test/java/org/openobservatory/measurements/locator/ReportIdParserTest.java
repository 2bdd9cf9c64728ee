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

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportIdParserTest {

  @Test
  void testParseCurrentFormat() {
    final ReportIdInfo info = ReportIdParser.parse("20210101T123456Z_webconnectivity_IT_30722_n1_AbCdEfGh");
    assertThat(info.startTime()).isEqualTo(Instant.parse("2021-01-01T12:34:56Z"));
    assertThat(info.testName()).isEqualTo("webconnectivity");
    assertThat(info.countryCode()).isEqualTo("IT");
    assertThat(info.asn()).isEqualTo(30722L);
    assertThat(info.legacy()).isFalse();
  }

  @Test
  void testParseLegacyFormat() {
    final ReportIdInfo info = ReportIdParser.parse("20170221T080226Z_AS12345_xyzXYZ");
    assertThat(info.startTime()).isEqualTo(Instant.parse("2017-02-21T08:02:26Z"));
    assertThat(info.testName()).isNull();
    assertThat(info.countryCode()).isEqualTo(ReportIdInfo.UNKNOWN_COUNTRY);
    assertThat(info.asn()).isEqualTo(12345L);
    assertThat(info.legacy()).isTrue();
  }

  @Test
  void testLowerCaseCountryIsNormalized() {
    assertThat(ReportIdParser.parse("20210101T000000Z_ndt_de_3320_n1_abc").countryCode()).isEqualTo("DE");
  }

  @Test
  void testMalformedIdentifiers() {
    assertThat(ReportIdParser.isValid("not-a-report-id")).isFalse();
    assertThat(ReportIdParser.isValid("20210101T000000Z_webconnectivity_ITA_30722_n1_abc")).isFalse();
    assertThat(ReportIdParser.isValid("20210101T000000Z_web-connectivity_IT_30722_n1_abc")).isFalse();
    assertThat(ReportIdParser.isValid("20211301T000000Z_webconnectivity_IT_30722_n1_abc")).isFalse();
    assertThat(ReportIdParser.isValid("20210101T000000Z_webconnectivity_IT_AS30722_n1_abc")).isFalse();
    assertThat(ReportIdParser.isValid("20170221T080226Z_12345_xyz")).isFalse();

    assertThatThrownBy(() -> ReportIdParser.parse(null)).isInstanceOf(IllegalArgumentException.class);
  }
}

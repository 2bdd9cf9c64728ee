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
package org.openobservatory.measurements;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openobservatory.measurements.archive.FileSystemObjectStorage;
import org.openobservatory.measurements.archive.ObjectStorage;
import org.openobservatory.measurements.exception.MeasurementsException;
import org.openobservatory.measurements.exception.NotFoundException;
import org.openobservatory.measurements.exception.RangeTooWideException;
import org.openobservatory.measurements.exception.TooManyDimensionsException;
import org.openobservatory.measurements.model.AggregationRequest;
import org.openobservatory.measurements.model.AggregationRow;
import org.openobservatory.measurements.model.Dimension;
import org.openobservatory.measurements.model.DimensionFilter;
import org.openobservatory.measurements.model.DimensionTuple;
import org.openobservatory.measurements.model.MeasurementRef;
import org.openobservatory.measurements.model.StorageTier;
import org.openobservatory.measurements.model.TimeRange;
import org.openobservatory.measurements.relational.RelationalReader;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class MeasurementEngineTest {
  private static final Instant   NOW          = Instant.parse("2024-03-10T12:00:00Z");
  private static final TimeRange JAN_2021     = new TimeRange(Instant.parse("2021-01-01T00:00:00Z"),
      Instant.parse("2021-02-01T00:00:00Z"));
  private static final String    RECENT       = "20210101T000000Z_webconnectivity_IT_30722_n1_recent";
  private static final String    ARCHIVED     = "20180101T000000Z_webconnectivity_IT_30722_n1_archived";
  private static final String    CONTAINER    = "2018-01-01/IT-AS30722.lz4";
  private static final String[]  COUNTRIES    = { "IT", "DE", "BR" };
  private static final String[]  TEST_NAMES   = { "web_connectivity", "telegram", "whatsapp", "signal" };

  @TempDir
  Path tempDir;

  private RelationalFixture database;
  private ArchiveFixture    archive;
  private MeasurementEngine engine;

  @BeforeEach
  void setUp() throws Exception {
    database = new RelationalFixture();
    archive = new ArchiveFixture(tempDir);

    for (int i = 0; i < 100; i++)
      database.measurement(RECENT)//
          .input("https://site-" + i + ".example/")//
          .start(JAN_2021.start().plus(Duration.ofHours(i)))//
          .country(COUNTRIES[i % COUNTRIES.length])//
          .testName(TEST_NAMES[i % TEST_NAMES.length])//
          .anomaly(i % 5 == 0)//
          .confirmed(i % 25 == 0)//
          .failure(i % 10 == 3)//
          .insert();

    final ArchiveFixture.ContainerBuilder container = archive.container(CONTAINER).recordsPerFrame(4).withIndex();
    for (int i = 0; i < 20; i++)
      container.add(ARCHIVED, "https://old-" + i + ".example/", "archived-payload-" + i);
    container.write();

    engine = MeasurementEngine.builder()//
        .configuration(RelationalFixture.configuration())//
        .dataSource(database.getDataSource())//
        .objectStorage(new FileSystemObjectStorage(tempDir))//
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))//
        .build();
  }

  @AfterEach
  void tearDown() throws SQLException {
    engine.close();
    database.close();
  }

  @Test
  void testAggregateByCountry() {
    final AggregationResult result = engine.planAndAggregate(
        AggregationRequest.builder().dimensions(Dimension.COUNTRY).timeRange(JAN_2021).build());

    assertThat(result.getRows()).extracting(r -> r.dimensionValues().get(0)).containsExactly("BR", "DE", "IT");
    assertThat(result.getRows().stream().mapToLong(AggregationRow::measurementCount).sum()).isEqualTo(100);
    assertThat(result.getRows().stream().mapToLong(AggregationRow::anomalyCount).sum()).isEqualTo(20);
    assertThat(result.getRows()).allSatisfy(r -> {
      assertThat(r.anomalyCount()).isLessThanOrEqualTo(r.measurementCount());
      assertThat(r.confirmedCount()).isLessThanOrEqualTo(r.anomalyCount());
    });
    assertThat(result.hasMore()).isFalse();
    assertThat(result.isDegraded()).isFalse();
    assertThat(result.getFreshness().sealed()).isTrue();
  }

  @Test
  void testPagesAddUpToTheWholeResult() {
    final List<AggregationRow> whole = engine.planAndAggregate(request(null, 100)).getRows();
    assertThat(whole).hasSize(12);

    final List<AggregationRow> paged = new ArrayList<>();
    String cursor = null;
    int pages = 0;
    do {
      final AggregationResult page = engine.planAndAggregate(request(cursor, 5));
      assertThat(page.getRows().size()).isLessThanOrEqualTo(5);
      paged.addAll(page.getRows());
      cursor = page.getNextCursor();
      pages++;
    } while (cursor != null);

    assertThat(pages).isEqualTo(3);
    assertThat(paged).containsExactlyElementsOf(whole);

    final Set<DimensionTuple> tuples = new HashSet<>();
    for (final AggregationRow row : paged)
      assertThat(tuples.add(row.dimensionValues())).isTrue();
  }

  @Test
  void testFilteredHourlyBuckets() {
    final AggregationResult result = engine.planAndAggregate(AggregationRequest.builder()//
        .dimensions(Dimension.TIME_BUCKET)//
        .filter(Dimension.COUNTRY, DimensionFilter.eq("it"))//
        .timeRange(JAN_2021)//
        .build());

    // ONE COUNTRY OVER 744 HOURS FITS THE CEILING
    assertThat(result.getPlan().getGranularity().getUnit()).isEqualTo("hour");
    assertThat(result.getRows()).hasSize(34);
    assertThat(result.getRows().stream().mapToLong(AggregationRow::measurementCount).sum()).isEqualTo(34);
  }

  @Test
  void testRejectionsDoNoIO() {
    final RelationalReader reader = mock(RelationalReader.class);
    final ObjectStorage storage = mock(ObjectStorage.class);
    try (final MeasurementEngine isolated = MeasurementEngine.builder()//
        .configuration(new ContextConfiguration().setValue(GlobalConfiguration.MAX_DIMENSIONS, 4))//
        .relationalReader(reader)//
        .objectStorage(storage)//
        .build()) {

      assertThatThrownBy(() -> isolated.planAndAggregate(AggregationRequest.builder()//
          .dimensions(Dimension.COUNTRY, Dimension.ASN, Dimension.TEST_NAME, Dimension.CATEGORY_CODE, Dimension.DOMAIN,
              Dimension.TIME_BUCKET)//
          .timeRange(JAN_2021)//
          .build())).isInstanceOf(TooManyDimensionsException.class);

      assertThatThrownBy(() -> isolated.planAndAggregate(AggregationRequest.builder()//
          .dimensions(Dimension.COUNTRY)//
          .timeRange(new TimeRange(Instant.parse("2019-01-01T00:00:00Z"), Instant.parse("2021-01-01T00:00:00Z")))//
          .build())).isInstanceOf(RangeTooWideException.class);

      assertThat(isolated.checkReportId("not a report id")).isFalse();
    }
    verifyNoInteractions(reader, storage);
  }

  @Test
  void testFetchRecentMeasurement() {
    final FetchResult result = engine.locateAndFetch(
        new MeasurementRef(RECENT, "https://site-42.example/", Instant.parse("2021-01-02T18:00:00Z")));

    assertThat(result.tier()).isEqualTo(StorageTier.RELATIONAL);
    assertThat(result.body().asString()).contains("https://site-42.example/");
    assertThat(result.freshness().sealed()).isTrue();
  }

  @Test
  void testFetchArchivedMeasurement() {
    final MeasurementRef ref = MeasurementRef.of(ARCHIVED, "https://old-13.example/");

    final FetchResult first = engine.locateAndFetch(ref);
    final FetchResult second = engine.locateAndFetch(ref);

    assertThat(first.tier()).isEqualTo(StorageTier.ARCHIVE);
    assertThat(first.body().asString()).contains("archived-payload-13");
    assertThat(first.freshness().sealed()).isTrue();
    assertThat(second.body()).isEqualTo(first.body());
  }

  @Test
  void testFetchManyAcrossTiers() {
    final List<FetchResult> results = engine.locateAndFetchAll(List.of(//
        MeasurementRef.of(RECENT, "https://site-1.example/"),//
        new MeasurementRef(ARCHIVED, "https://old-2.example/", Instant.parse("2018-01-01T00:00:00Z")),//
        MeasurementRef.of(RECENT, "https://site-99.example/"),//
        MeasurementRef.of(ARCHIVED, "https://old-19.example/")));

    assertThat(results).extracting(FetchResult::tier)
        .containsExactly(StorageTier.RELATIONAL, StorageTier.ARCHIVE, StorageTier.RELATIONAL, StorageTier.ARCHIVE);
    assertThat(results.get(1).body().asString()).contains("archived-payload-2");
    assertThat(results.get(2).body().asString()).contains("https://site-99.example/");
  }

  @Test
  void testFetchManyFailsAsAWhole() {
    assertThatThrownBy(() -> engine.locateAndFetchAll(List.of(//
        MeasurementRef.of(RECENT, "https://site-1.example/"),//
        new MeasurementRef(ARCHIVED, "https://missing.example/", Instant.parse("2018-01-01T00:00:00Z")))))//
        .isInstanceOf(NotFoundException.class)//
        .satisfies(e -> assertThat(((MeasurementsException) e).getContext("tier")).isEqualTo(StorageTier.ARCHIVE));
  }

  @Test
  void testMissingMeasurement() {
    assertThatThrownBy(() -> engine.locateAndFetch(
        new MeasurementRef(RECENT, "https://nowhere.example/", Instant.parse("2021-01-02T00:00:00Z")))).isInstanceOf(
        NotFoundException.class);
  }

  @Test
  void testCheckReportId() {
    assertThat(engine.checkReportId(RECENT)).isTrue();
    assertThat(engine.checkReportId(ARCHIVED)).isTrue();
    assertThat(engine.checkReportId("20180101T000000Z_webconnectivity_IT_30722_n1_unknown")).isFalse();
    assertThat(engine.checkReportId("20190505T000000Z_telegram_BR_28573_n1_nocontainer")).isFalse();
    assertThat(engine.checkReportId("garbage")).isFalse();
  }

  @Test
  void testBuilderNeedsStores() {
    assertThatThrownBy(() -> MeasurementEngine.builder().objectStorage(mock(ObjectStorage.class)).build()).isInstanceOf(
        MeasurementsException.class);
    assertThatThrownBy(() -> MeasurementEngine.builder().dataSource(database.getDataSource()).build()).isInstanceOf(
        MeasurementsException.class);
  }

  private static AggregationRequest request(final String cursor, final int pageSize) {
    return AggregationRequest.builder()//
        .dimensions(Dimension.COUNTRY, Dimension.TEST_NAME)//
        .timeRange(JAN_2021)//
        .pageSize(pageSize)//
        .cursor(cursor)//
        .build();
  }
}

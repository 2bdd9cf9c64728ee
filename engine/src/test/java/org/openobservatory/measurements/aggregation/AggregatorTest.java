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
package org.openobservatory.measurements.aggregation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.openobservatory.measurements.ContextConfiguration;
import org.openobservatory.measurements.GlobalConfiguration;
import org.openobservatory.measurements.QueryContext;
import org.openobservatory.measurements.exception.ErrorCode;
import org.openobservatory.measurements.exception.QueryCancelledException;
import org.openobservatory.measurements.model.AggregationRow;
import org.openobservatory.measurements.model.Dimension;
import org.openobservatory.measurements.model.DimensionTuple;
import org.openobservatory.measurements.model.TimeRange;
import org.openobservatory.measurements.query.AccessPath;
import org.openobservatory.measurements.query.QueryPlan;
import org.openobservatory.measurements.relational.GroupedCounts;
import org.openobservatory.measurements.relational.RelationalReader;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AggregatorTest {
  private static final TimeRange RANGE = new TimeRange(Instant.parse("2021-01-01T00:00:00Z"), Instant.parse("2021-01-08T00:00:00Z"));

  @Mock
  private RelationalReader store;

  private Aggregator   aggregator;
  private QueryContext context;

  @BeforeEach
  void setUp() {
    aggregator = new Aggregator(new ContextConfiguration().setValue(GlobalConfiguration.AGGREGATION_FETCH_SIZE, 2), store);
    context = QueryContext.withTimeout(Duration.ofMinutes(1));
  }

  @Test
  void testMergesChunksInTupleOrder() {
    final QueryPlan plan = plan(0, 10, 100);
    when(store.fetchAggregateRows(plan, 0L, 2, context)).thenReturn(List.of(counts("BR", 4, 1), counts("IT", 10, 2)));
    when(store.fetchAggregateRows(plan, 2L, 2, context)).thenReturn(List.of(counts("US", 7, 0)));

    final AggregationPage page = aggregator.run(plan, context);

    assertThat(page.rows()).extracting(r -> r.dimensionValues().get(0)).containsExactly("BR", "IT", "US");
    assertThat(page.rows()).extracting(AggregationRow::measurementCount).containsExactly(4L, 10L, 7L);
    assertThat(page.nextOffset()).isEmpty();
    assertThat(page.truncated()).isFalse();
    assertThat(page.warnings()).isEmpty();
  }

  @Test
  void testSameTupleInTwoChunksIsSummed() {
    final QueryPlan plan = plan(0, 10, 100);
    when(store.fetchAggregateRows(plan, 0L, 2, context)).thenReturn(List.of(counts("BR", 4, 1), counts("IT", 10, 2)));
    when(store.fetchAggregateRows(plan, 2L, 2, context)).thenReturn(List.of(counts("IT", 5, 3)));

    final AggregationPage page = aggregator.run(plan, context);

    assertThat(page.rows()).hasSize(2);
    assertThat(page.rows().get(1).measurementCount()).isEqualTo(15);
    assertThat(page.rows().get(1).anomalyCount()).isEqualTo(5);
  }

  @Test
  void testFullPageReturnsNextOffset() {
    final QueryPlan plan = plan(0, 3, 100);
    when(store.fetchAggregateRows(plan, 0L, 2, context)).thenReturn(List.of(counts("AR", 1, 0), counts("BR", 1, 0)));
    when(store.fetchAggregateRows(plan, 2L, 1, context)).thenReturn(List.of(counts("CL", 1, 0)));

    final AggregationPage page = aggregator.run(plan, context);

    assertThat(page.rows()).hasSize(3);
    assertThat(page.nextOffset()).hasValue(3);
    assertThat(page.truncated()).isFalse();
    verify(store, times(2)).fetchAggregateRows(eq(plan), anyLong(), anyInt(), any());
  }

  @Test
  void testStopsAtTheRowCeiling() {
    final QueryPlan plan = plan(2, 10, 4);
    when(store.fetchAggregateRows(plan, 2L, 2, context)).thenReturn(List.of(counts("CL", 1, 0), counts("DE", 1, 0)));

    final AggregationPage page = aggregator.run(plan, context);

    assertThat(page.rows()).hasSize(2);
    assertThat(page.nextOffset()).isEmpty();
    assertThat(page.truncated()).isTrue();
  }

  @Test
  void testOffsetAtTheCeilingReadsNothing() {
    final AggregationPage page = aggregator.run(plan(4, 10, 4), context);

    assertThat(page.rows()).isEmpty();
    assertThat(page.truncated()).isTrue();
    verifyNoInteractions(store);
  }

  @Test
  void testInconsistentCountsAreCapped() {
    final QueryPlan plan = plan(0, 10, 100);
    when(store.fetchAggregateRows(plan, 0L, 2, context)).thenReturn(
        List.of(new GroupedCounts(DimensionTuple.of("IT"), 5, 7, 0, -1)));

    final AggregationPage page = aggregator.run(plan, context);

    final AggregationRow row = page.rows().get(0);
    assertThat(row.anomalyCount()).isEqualTo(5);
    assertThat(row.failureCount()).isZero();
    assertThat(page.warnings()).hasSize(2)
        .allSatisfy(w -> assertThat(w.getErrorCode()).isEqualTo(ErrorCode.INCONSISTENT_DATA))
        .allSatisfy(w -> assertThat(w.getContext("dimensionValues")).isEqualTo(DimensionTuple.of("IT")));
  }

  @Test
  void testCancelledContextStopsBeforeReading() {
    context.cancel();

    assertThatThrownBy(() -> aggregator.run(plan(0, 10, 100), context)).isInstanceOf(QueryCancelledException.class);
    verify(store, never()).fetchAggregateRows(any(), anyLong(), anyInt(), any());
  }

  private static QueryPlan plan(final long offset, final int pageSize, final long ceiling) {
    return new QueryPlan(List.of(Dimension.COUNTRY), Map.of(), RANGE, null, AccessPath.INDEX, 250, ceiling, offset, pageSize,
        "d=country,;f=;t=" + RANGE);
  }

  private static GroupedCounts counts(final String country, final long count, final long anomalies) {
    return new GroupedCounts(DimensionTuple.of(country), count, anomalies, 0, 0);
  }
}

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
package org.openobservatory.measurements.relational;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openobservatory.measurements.QueryContext;
import org.openobservatory.measurements.exception.PoolExhaustedException;
import org.openobservatory.measurements.exception.StorageAccessException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConnectionPoolTest {
  private final QueryContext   context = QueryContext.withTimeout(Duration.ofSeconds(30));
  private       JdbcDataSource database;
  private       DataSource     target;
  private       ConnectionPool pool;

  @BeforeEach
  void setUp() throws SQLException {
    database = new JdbcDataSource();
    database.setURL("jdbc:h2:mem:connection-pool-" + System.nanoTime());
    target = mock(DataSource.class);
    when(target.getConnection()).then(invocation -> database.getConnection());
  }

  @AfterEach
  void tearDown() {
    if (pool != null)
      pool.close();
  }

  @Test
  void testConnectionsAreReused() throws SQLException {
    pool = new ConnectionPool(target, 2, Duration.ofSeconds(1));

    for (int i = 0; i < 3; i++)
      try (final Connection connection = pool.acquire(context)) {
        assertThat(connection.isValid(1)).isTrue();
        assertThat(pool.getActive()).isEqualTo(1);
      }

    verify(target, times(1)).getConnection();
    assertThat(pool.getActive()).isZero();
    assertThat(pool.getIdle()).isEqualTo(1);
  }

  @Test
  void testExhaustedPoolFailsAfterWaiting() throws SQLException {
    pool = new ConnectionPool(target, 1, Duration.ofMillis(100));

    try (final Connection held = pool.acquire(context)) {
      assertThat(pool.getActive()).isEqualTo(1);

      assertThatThrownBy(() -> pool.acquire(context))//
          .isInstanceOf(PoolExhaustedException.class)//
          .satisfies(e -> assertThat(((PoolExhaustedException) e).isRetryable()).isTrue())//
          .satisfies(e -> assertThat(((PoolExhaustedException) e).getHttpStatus()).isEqualTo(503));
    }

    try (final Connection again = pool.acquire(context)) {
      assertThat(again.isValid(1)).isTrue();
    }
    verify(target, times(1)).getConnection();
  }

  @Test
  void testConnectionFailureReleasesTheSlot() throws SQLException {
    when(target.getConnection())//
        .thenThrow(new SQLException("connection refused", "08001"))//
        .then(invocation -> database.getConnection());
    pool = new ConnectionPool(target, 1, Duration.ofMillis(100));

    assertThatThrownBy(() -> pool.acquire(context)).isInstanceOf(StorageAccessException.class);
    assertThat(pool.getActive()).isZero();

    try (final Connection connection = pool.acquire(context)) {
      assertThat(connection.isValid(1)).isTrue();
    }
  }

  @Test
  void testRejectsEmptyPool() {
    assertThatThrownBy(() -> new ConnectionPool(target, 0, Duration.ofSeconds(1))).isInstanceOf(IllegalArgumentException.class);
  }
}

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

import org.apache.tomcat.jdbc.pool.DataSource;
import org.apache.tomcat.jdbc.pool.PoolProperties;
import org.openobservatory.measurements.QueryContext;
import org.openobservatory.measurements.exception.ErrorCode;
import org.openobservatory.measurements.exception.PoolExhaustedException;
import org.openobservatory.measurements.exception.QueryCancelledException;
import org.openobservatory.measurements.exception.QueryTimeoutException;
import org.openobservatory.measurements.exception.StorageAccessException;
import org.openobservatory.measurements.log.LogManager;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.logging.Level;

/**
 * Bounded pool of relational connections on top of the store's {@link javax.sql.DataSource}. At most {@code maxConnections}
 * are borrowed at the same time; a borrower waits up to {@code waitTimeout} before failing. Closing a borrowed connection
 * returns it to the pool.
 */
public class ConnectionPool implements AutoCloseable {
  private final DataSource pool;
  private final int        maxConnections;
  private final Duration   waitTimeout;

  public ConnectionPool(final javax.sql.DataSource target, final int maxConnections, final Duration waitTimeout) {
    if (maxConnections <= 0)
      throw new IllegalArgumentException("maxConnections must be > 0");
    this.maxConnections = maxConnections;
    this.waitTimeout = waitTimeout;

    final PoolProperties p = new PoolProperties();
    p.setDataSource(target);
    p.setMaxActive(maxConnections);
    p.setMaxIdle(maxConnections);
    p.setMinIdle(0);
    p.setInitialSize(0);
    p.setMaxWait((int) Math.min(Integer.MAX_VALUE, Math.max(1, waitTimeout.toMillis())));
    p.setTestOnBorrow(false);
    p.setTestOnReturn(false);
    p.setTestWhileIdle(false);
    p.setFairQueue(true);
    p.setPropagateInterruptState(true);
    p.setJmxEnabled(false);
    p.setJdbcInterceptors(
        "org.apache.tomcat.jdbc.pool.interceptor.ConnectionState;" + "org.apache.tomcat.jdbc.pool.interceptor.StatementFinalizer");

    this.pool = new DataSource();
    this.pool.setPoolProperties(p);
  }

  /**
   * Borrows a connection. Close it to give it back.
   *
   * @throws PoolExhaustedException  if no connection frees up within the wait timeout
   * @throws QueryCancelledException if the thread is interrupted while waiting
   * @throws QueryTimeoutException   if the request deadline passed while waiting
   */
  public Connection acquire(final QueryContext context) {
    final Connection connection;
    try {
      connection = pool.getConnection();
    } catch (final org.apache.tomcat.jdbc.pool.PoolExhaustedException e) {
      LogManager.instance().log(this, Level.WARNING, "No relational connection free after %dms (%d in use)", waitTimeout.toMillis(),
          pool.getActive());
      throw new PoolExhaustedException(maxConnections, waitTimeout.toMillis());
    } catch (final SQLException e) {
      if (e.getCause() instanceof InterruptedException)
        throw new QueryCancelledException("Interrupted while waiting for a relational connection", e);
      throw (StorageAccessException) new StorageAccessException(ErrorCode.SQL_ERROR, "Cannot open a relational connection", e)
          .addContext("sqlState", e.getSQLState());
    }

    if (context.isExpired()) {
      release(connection);
      throw new QueryTimeoutException("Request " + context.getRequestId() + " ran past its deadline waiting for a connection");
    }
    return connection;
  }

  public int getMaxConnections() {
    return maxConnections;
  }

  /**
   * Connections currently borrowed.
   */
  public int getActive() {
    return pool.getActive();
  }

  /**
   * Open connections waiting in the pool.
   */
  public int getIdle() {
    return pool.getIdle();
  }

  @Override
  public void close() {
    pool.close(true);
  }

  private void release(final Connection connection) {
    try {
      connection.close();
    } catch (final SQLException e) {
      LogManager.instance().log(this, Level.WARNING, "Error returning relational connection to the pool", e);
    }
  }
}

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

import org.openobservatory.measurements.exception.QueryCancelledException;
import org.openobservatory.measurements.exception.QueryTimeoutException;
import org.openobservatory.measurements.log.LogManager;

import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;

/**
 * Deadline and cancellation handle of one request. Shared by every task working on the request: cancelling it cancels the
 * JDBC statements those tasks are running.
 */
public class QueryContext {
  private final String         requestId;
  private final Instant        deadline;
  private final Clock          clock;
  private final Set<Statement> running   = ConcurrentHashMap.newKeySet();
  private volatile boolean     cancelled = false;
  private volatile String      cancelReason;

  public QueryContext(final String requestId, final Instant deadline, final Clock clock) {
    this.requestId = requestId != null ? requestId : UUID.randomUUID().toString();
    this.deadline = deadline;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  public static QueryContext withTimeout(final Duration timeout) {
    final Clock clock = Clock.systemUTC();
    return new QueryContext(null, clock.instant().plus(timeout), clock);
  }

  public static QueryContext withTimeout(final String requestId, final Duration timeout, final Clock clock) {
    return new QueryContext(requestId, clock.instant().plus(timeout), clock);
  }

  public String getRequestId() {
    return requestId;
  }

  public Instant getDeadline() {
    return deadline;
  }

  /**
   * Time left before the deadline, never negative.
   */
  public Duration remaining() {
    if (deadline == null)
      return Duration.ofMillis(Long.MAX_VALUE);
    final Duration left = Duration.between(clock.instant(), deadline);
    return left.isNegative() ? Duration.ZERO : left;
  }

  public boolean isExpired() {
    return deadline != null && !clock.instant().isBefore(deadline);
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Throws if the request was cancelled or ran past its deadline. Called between units of work.
   */
  public void checkActive() {
    if (cancelled)
      throw new QueryCancelledException("Request " + requestId + " was cancelled" + (cancelReason != null ? ": " + cancelReason : ""));
    if (isExpired())
      throw new QueryTimeoutException("Request " + requestId + " ran past its deadline " + deadline);
  }

  /**
   * Marks the request as cancelled and cancels every statement currently attached.
   */
  public void cancel(final String reason) {
    if (cancelled)
      return;
    cancelReason = reason;
    cancelled = true;
    for (final Statement statement : running)
      cancel(statement);
  }

  public void cancel() {
    cancel((String) null);
  }

  /**
   * Registers a running statement. If the request is already cancelled the statement is cancelled right away.
   */
  public void attach(final Statement statement) {
    running.add(statement);
    if (cancelled)
      cancel(statement);
  }

  public void detach(final Statement statement) {
    running.remove(statement);
  }

  private void cancel(final Statement statement) {
    try {
      statement.cancel();
    } catch (final SQLException e) {
      LogManager.instance().log(this, Level.FINE, "Error cancelling statement of request %s", e, requestId);
    }
  }

  @Override
  public String toString() {
    return "QueryContext{" + requestId + ", deadline=" + deadline + (cancelled ? ", cancelled" : "") + "}";
  }
}

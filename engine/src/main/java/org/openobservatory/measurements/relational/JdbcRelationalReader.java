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

import org.openobservatory.measurements.ContextConfiguration;
import org.openobservatory.measurements.GlobalConfiguration;
import org.openobservatory.measurements.QueryContext;
import org.openobservatory.measurements.exception.ErrorCode;
import org.openobservatory.measurements.exception.NotFoundException;
import org.openobservatory.measurements.exception.QueryCancelledException;
import org.openobservatory.measurements.exception.QueryTimeoutException;
import org.openobservatory.measurements.exception.StorageAccessException;
import org.openobservatory.measurements.locator.FetchPlan;
import org.openobservatory.measurements.log.LogManager;
import org.openobservatory.measurements.model.*;
import org.openobservatory.measurements.query.QueryPlan;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

/**
 * Relational tier over JDBC. Expects a table with the columns {@code report_id, input, measurement_start_time, probe_cc,
 * probe_asn, test_name, category_code, domain, anomaly, confirmed, msm_failure, data_format_version, body}. Timestamps are
 * stored without time zone, in UTC.
 */
public class JdbcRelationalReader implements RelationalReader {
  private final ConnectionPool pool;
  private final SqlDialect     dialect;
  private final String         table;
  private final Duration       statementTimeout;

  public JdbcRelationalReader(final ContextConfiguration configuration, final ConnectionPool pool) {
    this.pool = pool;
    this.dialect = SqlDialect.fromName(configuration.getValueAsString(GlobalConfiguration.RELATIONAL_DIALECT));
    this.table = configuration.getValueAsString(GlobalConfiguration.RELATIONAL_TABLE);
    this.statementTimeout = configuration.getValueAsDuration(GlobalConfiguration.STATEMENT_TIMEOUT);
    if (!table.matches("[A-Za-z_][A-Za-z0-9_.]*"))
      throw new IllegalArgumentException("Invalid table name '" + table + "'");
  }

  @FunctionalInterface
  private interface Binder {
    void bind(PreparedStatement statement) throws SQLException;
  }

  @FunctionalInterface
  private interface Mapper<T> {
    T map(ResultSet resultSet) throws SQLException;
  }

  @Override
  public StorageTier getTier() {
    return StorageTier.RELATIONAL;
  }

  @Override
  public MeasurementBody fetch(final FetchPlan plan, final QueryContext context) {
    return fetch(plan.ref(), context);
  }

  public MeasurementBody fetch(final MeasurementRef ref, final QueryContext context) {
    final String sql = "SELECT body, data_format_version FROM " + table + " WHERE report_id = ? AND " + inputCondition(ref)
        + " ORDER BY measurement_start_time LIMIT 2";

    final MeasurementBody body = execute(sql, context, s -> bindRef(s, ref), rs -> {
      if (!rs.next())
        return null;
      final byte[] raw = rs.getBytes(1);
      final FormatVersion version = FormatVersion.fromLabel(rs.getString(2));
      if (rs.next())
        LogManager.instance().log(this, Level.WARNING, "Duplicate measurement rows for %s, returning the first one", ref);
      return raw != null ? new MeasurementBody(ref, raw, version) : null;
    });

    if (body == null)
      throw (NotFoundException) new NotFoundException("Measurement " + ref + " not found in relational tier").addContext("tier",
          StorageTier.RELATIONAL);
    return body;
  }

  @Override
  public boolean exists(final MeasurementRef ref, final QueryContext context) {
    final String sql = "SELECT 1 FROM " + table + " WHERE report_id = ? AND " + inputCondition(ref) + " LIMIT 1";
    return execute(sql, context, s -> bindRef(s, ref), ResultSet::next);
  }

  @Override
  public boolean reportExists(final String reportId, final QueryContext context) {
    final String sql = "SELECT 1 FROM " + table + " WHERE report_id = ? LIMIT 1";
    return execute(sql, context, s -> s.setString(1, reportId), ResultSet::next);
  }

  @Override
  public List<GroupedCounts> fetchAggregateRows(final QueryPlan plan, final long offset, final int limit, final QueryContext context) {
    final List<Dimension> dimensions = plan.getDimensions();
    final List<Object> params = new ArrayList<>();
    final String sql = aggregateSql(plan, params);

    return execute(sql, context, s -> {
      int i = 1;
      for (final Object p : params)
        bind(s, i++, p);
      s.setLong(i++, limit);
      s.setLong(i, offset);
    }, rs -> {
      final List<GroupedCounts> rows = new ArrayList<>();
      while (rs.next()) {
        final List<Object> values = new ArrayList<>(dimensions.size());
        for (int d = 0; d < dimensions.size(); d++)
          values.add(read(rs, d + 1, dimensions.get(d)));
        final int c = dimensions.size() + 1;
        rows.add(new GroupedCounts(new DimensionTuple(values), rs.getLong(c), rs.getLong(c + 1), rs.getLong(c + 2), rs.getLong(c + 3)));
      }
      return rows;
    });
  }

  String aggregateSql(final QueryPlan plan, final List<Object> params) {
    final List<String> expressions = new ArrayList<>();
    for (final Dimension d : plan.getDimensions())
      expressions.add(d == Dimension.TIME_BUCKET ? dialect.truncateTime(d.getColumn(), plan.getGranularity()) : d.getColumn());

    final StringBuilder sql = new StringBuilder("SELECT ");
    for (int i = 0; i < expressions.size(); i++)
      sql.append(expressions.get(i)).append(" AS d").append(i).append(", ");
    sql.append("COUNT(*), ");
    sql.append("SUM(CASE WHEN anomaly THEN 1 ELSE 0 END), ");
    sql.append("SUM(CASE WHEN confirmed THEN 1 ELSE 0 END), ");
    sql.append("SUM(CASE WHEN msm_failure THEN 1 ELSE 0 END)");
    sql.append(" FROM ").append(table);
    sql.append(" WHERE measurement_start_time >= ? AND measurement_start_time < ?");
    params.add(plan.getTimeRange().start());
    params.add(plan.getTimeRange().end());

    for (final Map.Entry<Dimension, DimensionFilter> entry : plan.getFilters().entrySet()) {
      final DimensionFilter filter = entry.getValue();
      if (filter.getKind() == DimensionFilter.Kind.EQUALS) {
        sql.append(" AND ").append(entry.getKey().getColumn()).append(" = ?");
        params.add(filter.getValue());
      } else {
        final String column = dialect.binaryOrder(entry.getKey().getColumn(), entry.getKey().getValueType());
        sql.append(" AND ").append(column).append(" >= ? AND ").append(column).append(" < ?");
        params.add(filter.getLower());
        params.add(filter.getUpper());
      }
    }

    if (!expressions.isEmpty()) {
      sql.append(" GROUP BY ").append(String.join(", ", expressions));
      sql.append(" ORDER BY ");
      for (int i = 0; i < expressions.size(); i++) {
        if (i > 0)
          sql.append(", ");
        sql.append(dialect.binaryOrder(expressions.get(i), plan.getDimensions().get(i).getValueType())).append(" ASC NULLS FIRST");
      }
    }
    sql.append(dialect.limitOffset());
    return sql.toString();
  }

  private <T> T execute(final String sql, final QueryContext context, final Binder binder, final Mapper<T> mapper) {
    context.checkActive();

    try (final Connection connection = pool.acquire(context);
        final PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setQueryTimeout(timeoutSeconds(context));
      binder.bind(statement);

      context.attach(statement);
      try (final ResultSet rs = statement.executeQuery()) {
        return mapper.map(rs);
      } finally {
        context.detach(statement);
      }

    } catch (final SQLException e) {
      if (context.isCancelled())
        throw new QueryCancelledException("Request " + context.getRequestId() + " was cancelled while querying the relational tier", e);
      if (e instanceof SQLTimeoutException || context.isExpired()) {
        LogManager.instance().log(this, Level.WARNING, "Relational statement timed out for request %s", context.getRequestId());
        throw (QueryTimeoutException) new QueryTimeoutException("Relational statement timed out", e).addContext("tier",
            StorageTier.RELATIONAL);
      }
      throw (StorageAccessException) new StorageAccessException(ErrorCode.SQL_ERROR, "Error querying the relational tier", e)
          .addContext("sqlState", e.getSQLState());
    }
  }

  private int timeoutSeconds(final QueryContext context) {
    final Duration remaining = context.remaining();
    final Duration timeout = remaining.compareTo(statementTimeout) < 0 ? remaining : statementTimeout;
    final long seconds = (timeout.toMillis() + 999) / 1000;
    return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
  }

  private static String inputCondition(final MeasurementRef ref) {
    return ref.input() != null ? "input = ?" : "(input IS NULL OR input = '')";
  }

  private static void bindRef(final PreparedStatement statement, final MeasurementRef ref) throws SQLException {
    statement.setString(1, ref.reportId());
    if (ref.input() != null)
      statement.setString(2, ref.input());
  }

  private static void bind(final PreparedStatement statement, final int index, final Object value) throws SQLException {
    if (value instanceof Instant i)
      statement.setObject(index, LocalDateTime.ofInstant(i, ZoneOffset.UTC));
    else if (value instanceof Long l)
      statement.setLong(index, l);
    else
      statement.setString(index, value.toString());
  }

  private static Object read(final ResultSet rs, final int column, final Dimension dimension) throws SQLException {
    if (dimension == Dimension.TIME_BUCKET) {
      final LocalDateTime t = rs.getObject(column, LocalDateTime.class);
      return t != null ? t.toInstant(ZoneOffset.UTC) : null;
    }
    if (dimension == Dimension.ASN) {
      final long asn = rs.getLong(column);
      return rs.wasNull() ? null : asn;
    }
    return rs.getString(column);
  }
}

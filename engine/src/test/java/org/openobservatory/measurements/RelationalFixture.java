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

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * In-memory H2 database, in PostgreSQL mode, holding the measurements table.
 */
public class RelationalFixture implements AutoCloseable {
  private final JdbcDataSource dataSource;
  private final Connection     keepAlive;

  public RelationalFixture() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:msm-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
    dataSource.setUser("sa");
    dataSource.setPassword("");
    keepAlive = dataSource.getConnection();

    try (final Statement st = keepAlive.createStatement()) {
      st.execute("CREATE TABLE measurements (" + //
          "report_id VARCHAR(200) NOT NULL, " + //
          "input VARCHAR(2000), " + //
          "measurement_start_time TIMESTAMP NOT NULL, " + //
          "probe_cc VARCHAR(2), " + //
          "probe_asn BIGINT, " + //
          "test_name VARCHAR(64), " + //
          "category_code VARCHAR(16), " + //
          "domain VARCHAR(255), " + //
          "anomaly BOOLEAN, " + //
          "confirmed BOOLEAN, " + //
          "msm_failure BOOLEAN, " + //
          "data_format_version VARCHAR(16), " + //
          "body VARBINARY)");
      st.execute("CREATE INDEX measurements_report ON measurements (report_id, input)");
    }
  }

  /**
   * Configuration pointing the engine at this database.
   */
  public static ContextConfiguration configuration() {
    return new ContextConfiguration().setValue(GlobalConfiguration.RELATIONAL_DIALECT, "h2");
  }

  public DataSource getDataSource() {
    return dataSource;
  }

  public Row measurement(final String reportId) {
    return new Row(reportId);
  }

  @Override
  public void close() throws SQLException {
    try (final Statement st = keepAlive.createStatement()) {
      st.execute("DROP ALL OBJECTS");
    } finally {
      keepAlive.close();
    }
  }

  public final class Row {
    private final String  reportId;
    private       String  input;
    private       Instant start         = Instant.parse("2021-01-01T00:00:00Z");
    private       String  country       = "IT";
    private       Long    asn           = 30722L;
    private       String  testName      = "web_connectivity";
    private       String  categoryCode;
    private       String  domain;
    private       boolean anomaly;
    private       boolean confirmed;
    private       boolean failure;
    private       String  formatVersion = "0.2.0";
    private       String  body;

    private Row(final String reportId) {
      this.reportId = reportId;
    }

    public Row input(final String input) {
      this.input = input;
      return this;
    }

    public Row start(final Instant start) {
      this.start = start;
      return this;
    }

    public Row country(final String country) {
      this.country = country;
      return this;
    }

    public Row asn(final Long asn) {
      this.asn = asn;
      return this;
    }

    public Row testName(final String testName) {
      this.testName = testName;
      return this;
    }

    public Row category(final String categoryCode) {
      this.categoryCode = categoryCode;
      return this;
    }

    public Row domain(final String domain) {
      this.domain = domain;
      return this;
    }

    public Row anomaly(final boolean anomaly) {
      this.anomaly = anomaly;
      return this;
    }

    public Row confirmed(final boolean confirmed) {
      this.confirmed = confirmed;
      return this;
    }

    public Row failure(final boolean failure) {
      this.failure = failure;
      return this;
    }

    public Row formatVersion(final String formatVersion) {
      this.formatVersion = formatVersion;
      return this;
    }

    public Row body(final String body) {
      this.body = body;
      return this;
    }

    public void insert() throws SQLException {
      try (final PreparedStatement ps = keepAlive.prepareStatement(
          "INSERT INTO measurements (report_id, input, measurement_start_time, probe_cc, probe_asn, test_name, category_code, domain, "
              + "anomaly, confirmed, msm_failure, data_format_version, body) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
        ps.setString(1, reportId);
        ps.setString(2, input);
        ps.setObject(3, LocalDateTime.ofInstant(start, ZoneOffset.UTC));
        ps.setString(4, country);
        if (asn != null)
          ps.setLong(5, asn);
        else
          ps.setNull(5, Types.BIGINT);
        ps.setString(6, testName);
        ps.setString(7, categoryCode);
        ps.setString(8, domain);
        ps.setBoolean(9, anomaly);
        ps.setBoolean(10, confirmed);
        ps.setBoolean(11, failure);
        ps.setString(12, formatVersion);
        final String content = body != null ? body : ArchiveFixture.document(reportId, input, formatVersion, "relational");
        ps.setBytes(13, content.getBytes(StandardCharsets.UTF_8));
        ps.executeUpdate();
      }
    }
  }
}

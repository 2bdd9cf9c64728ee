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

import org.openobservatory.measurements.aggregation.AggregationPage;
import org.openobservatory.measurements.aggregation.Aggregator;
import org.openobservatory.measurements.archive.ArchiveIndex;
import org.openobservatory.measurements.archive.ArchiveReader;
import org.openobservatory.measurements.archive.ObjectStorage;
import org.openobservatory.measurements.archive.SidecarArchiveIndex;
import org.openobservatory.measurements.exception.ErrorCode;
import org.openobservatory.measurements.exception.MeasurementsException;
import org.openobservatory.measurements.exception.QueryCancelledException;
import org.openobservatory.measurements.exception.QueryTimeoutException;
import org.openobservatory.measurements.freshness.FreshnessCalculator;
import org.openobservatory.measurements.locator.ArchiveLayout;
import org.openobservatory.measurements.locator.FetchPlan;
import org.openobservatory.measurements.locator.ReportIdParser;
import org.openobservatory.measurements.locator.StorageLocator;
import org.openobservatory.measurements.log.LogManager;
import org.openobservatory.measurements.model.AggregationRequest;
import org.openobservatory.measurements.model.MeasurementBody;
import org.openobservatory.measurements.model.MeasurementRef;
import org.openobservatory.measurements.model.StorageTier;
import org.openobservatory.measurements.query.CardinalityEstimator;
import org.openobservatory.measurements.query.ConfiguredCardinalityEstimator;
import org.openobservatory.measurements.query.PaginationCursor;
import org.openobservatory.measurements.query.QueryPlan;
import org.openobservatory.measurements.query.QueryPlanner;
import org.openobservatory.measurements.relational.ConnectionPool;
import org.openobservatory.measurements.relational.JdbcRelationalReader;
import org.openobservatory.measurements.relational.RelationalReader;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.logging.Level;

/**
 * Entry point of the engine: retrieval of single measurements from either tier, bounded aggregations over the relational
 * tier and report id checks. The engine keeps no state between requests besides its configuration, the connection pool
 * and a worker pool used to read both tiers at the same time.
 */
public class MeasurementEngine implements AutoCloseable {
  private final ContextConfiguration configuration;
  private final StorageLocator       locator;
  private final RelationalReader     relational;
  private final ArchiveReader        archive;
  private final QueryPlanner         planner;
  private final Aggregator           aggregator;
  private final FreshnessCalculator  freshness;
  private final ExecutorService      executor;
  private final ConnectionPool       connectionPool;
  private final Clock                clock;
  private final Duration             requestTimeout;

  private MeasurementEngine(final Builder builder) {
    this.configuration = builder.configuration;
    this.clock = builder.clock;
    this.relational = builder.relationalReader;
    this.connectionPool = builder.connectionPool;
    this.archive = new ArchiveReader(configuration, builder.objectStorage, builder.archiveIndex, builder.layout);
    this.locator = new StorageLocator(configuration, relational, builder.layout);
    this.planner = new QueryPlanner(configuration, builder.estimator);
    this.aggregator = new Aggregator(configuration, relational);
    this.freshness = new FreshnessCalculator(configuration, clock);
    this.requestTimeout = configuration.getValueAsDuration(GlobalConfiguration.REQUEST_TIMEOUT);

    final AtomicInteger threadCounter = new AtomicInteger(0);
    this.executor = Executors.newFixedThreadPool(configuration.getValueAsInteger(GlobalConfiguration.WORKER_THREADS), r -> {
      final Thread t = new Thread(r, "measurements-worker-" + threadCounter.getAndIncrement());
      t.setDaemon(true);
      return t;
    });
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a context with the configured request timeout.
   */
  public QueryContext newContext() {
    return QueryContext.withTimeout(null, requestTimeout, clock);
  }

  public FetchResult locateAndFetch(final MeasurementRef ref) {
    return locateAndFetch(ref, newContext());
  }

  /**
   * Finds the tier holding {@code ref} and reads it from there.
   *
   * @throws org.openobservatory.measurements.exception.NotFoundException if the chosen tier has no such measurement
   */
  public FetchResult locateAndFetch(final MeasurementRef ref, final QueryContext context) {
    return inContext(context, () -> fetch(locator.locate(ref, context), context));
  }

  public List<FetchResult> locateAndFetchAll(final List<MeasurementRef> refs) {
    return locateAndFetchAll(refs, newContext());
  }

  /**
   * Fetches many measurements. Relational and archived ones are read at the same time; results keep the order of
   * {@code refs}. The first failure cancels the remaining work and fails the whole call.
   */
  public List<FetchResult> locateAndFetchAll(final List<MeasurementRef> refs, final QueryContext context) {
    return inContext(context, () -> {
      final List<FetchPlan> relationalPlans = new ArrayList<>();
      final List<FetchPlan> archivePlans = new ArrayList<>();
      final List<Integer> relationalSlots = new ArrayList<>();
      final List<Integer> archiveSlots = new ArrayList<>();

      for (int i = 0; i < refs.size(); i++) {
        final FetchPlan plan = locator.locate(refs.get(i), context);
        if (plan.tier() == StorageTier.RELATIONAL) {
          relationalPlans.add(plan);
          relationalSlots.add(i);
        } else {
          archivePlans.add(plan);
          archiveSlots.add(i);
        }
      }

      final FetchResult[] results = new FetchResult[refs.size()];
      final CompletionService<Void> completion = new ExecutorCompletionService<>(executor);
      final List<Future<Void>> futures = new ArrayList<>(2);
      if (!relationalPlans.isEmpty())
        futures.add(completion.submit(fetchTask(relationalPlans, relationalSlots, results, context)));
      if (!archivePlans.isEmpty())
        futures.add(completion.submit(fetchTask(archivePlans, archiveSlots, results, context)));

      try {
        for (int i = 0; i < futures.size(); i++) {
          final Future<Void> done = completion.poll(context.remaining().toMillis(), TimeUnit.MILLISECONDS);
          if (done == null)
            throw new QueryTimeoutException("Request " + context.getRequestId() + " ran past its deadline " + context.getDeadline());
          done.get();
        }
      } catch (final ExecutionException e) {
        abort(context, futures, e.getCause().getMessage());
        throw unwrap(e.getCause());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        abort(context, futures, "interrupted");
        throw new QueryCancelledException("Interrupted while fetching measurements", e);
      } catch (final MeasurementsException e) {
        abort(context, futures, e.getMessage());
        throw e;
      }

      return Arrays.asList(results);
    });
  }

  public AggregationResult planAndAggregate(final AggregationRequest request) {
    return planAndAggregate(request, newContext());
  }

  /**
   * Plans the request and returns one page of grouped counts. Rejections happen before the relational tier is touched.
   */
  public AggregationResult planAndAggregate(final AggregationRequest request, final QueryContext context) {
    return inContext(context, () -> {
      final QueryPlan plan = planner.plan(request);
      final AggregationPage page = aggregator.run(plan, context);

      final String nextCursor = page.nextOffset().isPresent() ?
          PaginationCursor.of(page.nextOffset().getAsLong(), plan.getFingerprint()).encode() :
          null;

      if (!page.warnings().isEmpty())
        LogManager.instance().log(this, Level.WARNING, "Aggregation %s returned %d inconsistent groups", plan.getFingerprint(),
            page.warnings().size());

      return new AggregationResult(page.rows(), plan, nextCursor, freshness.compute(plan.getTimeRange(), StorageTier.RELATIONAL),
          page.warnings(), page.truncated());
    });
  }

  public boolean checkReportId(final String reportId) {
    return checkReportId(reportId, newContext());
  }

  /**
   * Tells if any measurement of the report is stored in either tier. Malformed identifiers are reported as unknown
   * without reading any store.
   */
  public boolean checkReportId(final String reportId, final QueryContext context) {
    if (!ReportIdParser.isValid(reportId))
      return false;
    return inContext(context, () -> relational.reportExists(reportId, context) || archive.containsReport(reportId, context));
  }

  public ContextConfiguration getConfiguration() {
    return configuration;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS))
        executor.shutdownNow();
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      if (connectionPool != null)
        connectionPool.close();
    }
  }

  private FetchResult fetch(final FetchPlan plan, final QueryContext context) {
    final MeasurementBody body = plan.tier() == StorageTier.RELATIONAL ? relational.fetch(plan, context) : archive.fetch(plan, context);
    return new FetchResult(body, plan.tier(), freshness.computeForMeasurement(plan.ref().measurementStartTime(), plan.tier()));
  }

  private Callable<Void> fetchTask(final List<FetchPlan> plans, final List<Integer> slots, final FetchResult[] results,
      final QueryContext context) {
    return () -> {
      LogManager.instance().setContext(context.getRequestId());
      try {
        for (int i = 0; i < plans.size(); i++) {
          context.checkActive();
          results[slots.get(i)] = fetch(plans.get(i), context);
        }
        return null;
      } finally {
        LogManager.instance().setContext(null);
      }
    };
  }

  private void abort(final QueryContext context, final List<Future<Void>> futures, final String reason) {
    context.cancel(reason);
    for (final Future<Void> f : futures)
      f.cancel(true);
  }

  private static RuntimeException unwrap(final Throwable cause) {
    if (cause instanceof RuntimeException e)
      return e;
    if (cause instanceof Error e)
      throw e;
    return new MeasurementsException(ErrorCode.INTERNAL_ERROR, "Unexpected failure fetching measurements", cause);
  }

  private <T> T inContext(final QueryContext context, final Supplier<T> work) {
    final String previous = LogManager.instance().getContext();
    LogManager.instance().setContext(context.getRequestId());
    final long begin = System.nanoTime();
    try {
      return work.get();
    } catch (final MeasurementsException e) {
      LogManager.instance().log(this, Level.FINE, "Request failed: %s", e);
      throw e;
    } finally {
      LogManager.instance().log(this, Level.FINE, "Request finished in %dms", (System.nanoTime() - begin) / 1_000_000);
      LogManager.instance().setContext(previous);
    }
  }

  public static final class Builder {
    private ContextConfiguration configuration = new ContextConfiguration();
    private RelationalReader     relationalReader;
    private DataSource           dataSource;
    private ObjectStorage        objectStorage;
    private ArchiveIndex         archiveIndex;
    private ArchiveLayout        layout        = new ArchiveLayout();
    private CardinalityEstimator estimator;
    private Clock                clock         = Clock.systemUTC();
    private ConnectionPool       connectionPool;

    private Builder() {
    }

    public Builder configuration(final ContextConfiguration configuration) {
      this.configuration = configuration;
      return this;
    }

    /**
     * Relational store reached through JDBC. The engine pools its connections and closes the pool on {@link #close()}. Ignored
     * when a reader is set with {@link #relationalReader}.
     */
    public Builder dataSource(final DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    public Builder relationalReader(final RelationalReader relationalReader) {
      this.relationalReader = relationalReader;
      return this;
    }

    public Builder objectStorage(final ObjectStorage objectStorage) {
      this.objectStorage = objectStorage;
      return this;
    }

    /**
     * Source of offset hints. Defaults to the sidecar index files stored next to the containers.
     */
    public Builder archiveIndex(final ArchiveIndex archiveIndex) {
      this.archiveIndex = archiveIndex;
      return this;
    }

    public Builder layout(final ArchiveLayout layout) {
      this.layout = layout;
      return this;
    }

    public Builder cardinalityEstimator(final CardinalityEstimator estimator) {
      this.estimator = estimator;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    public MeasurementEngine build() {
      if (objectStorage == null)
        throw new MeasurementsException(ErrorCode.CONFIGURATION_ERROR, "An object storage for the archive is mandatory");
      if (relationalReader == null) {
        if (dataSource == null)
          throw new MeasurementsException(ErrorCode.CONFIGURATION_ERROR, "A data source or a relational reader is mandatory");
        connectionPool = new ConnectionPool(dataSource, configuration.getValueAsInteger(GlobalConfiguration.MAX_CONNECTIONS),
            configuration.getValueAsDuration(GlobalConfiguration.POOL_WAIT_TIMEOUT));
        relationalReader = new JdbcRelationalReader(configuration, connectionPool);
      }
      if (archiveIndex == null)
        archiveIndex = new SidecarArchiveIndex(objectStorage);
      if (estimator == null)
        estimator = new ConfiguredCardinalityEstimator(configuration);
      return new MeasurementEngine(this);
    }
  }
}

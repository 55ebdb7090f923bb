// This file is part of pgprom.
// Copyright (C) 2026  The pgprom Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pgprom.storage.postgresql;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.List;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import net.pgprom.data.Sample;
import net.pgprom.exceptions.ConnectionException;
import net.pgprom.exceptions.DecodeException;
import net.pgprom.exceptions.ScanException;
import net.pgprom.exceptions.WriteException;
import net.pgprom.query.ReadRequest;
import net.pgprom.query.ReadResponse;
import net.pgprom.storage.TsdbStore;

/**
 * A {@link TsdbStore} backed by a PostgreSQL database with the 
 * pg_prometheus extension. Every call takes its own connection from the 
 * data source and closes it before returning.
 * <p>
 * Writes go through {@link BulkWriter}, reads compile every query with 
 * {@link QueryCompiler} before running any of them and fold all rows 
 * into one {@link SeriesAggregator}.
 * 
 * @since 1.0
 */
public class PostgresStore extends TsdbStore {
  private static final Logger LOG = LoggerFactory.getLogger(PostgresStore.class);
  
  public static final String TYPE = "PostgreSQL";
  
  public static final String WRITE_TIMER = "pgprom.postgresql.write";
  public static final String READ_TIMER = "pgprom.postgresql.read";
  public static final String SAMPLES_WRITTEN = "pgprom.postgresql.samples.written";
  public static final String SERIES_READ = "pgprom.postgresql.series.read";
  public static final String WRITE_FAILURES = "pgprom.postgresql.write.failures";
  
  private final DataSource data_source;
  private final PostgresConfig config;
  private final QueryCompiler compiler;
  private final BulkWriter writer;
  
  private final Timer write_timer;
  private final Timer read_timer;
  private final Meter samples_written;
  private final Meter series_read;
  private final Counter write_failures;
  
  /**
   * Default ctor.
   * @param data_source The non-null source of connections.
   * @param config The non-null config.
   * @param metrics The non-null registry to report to.
   */
  public PostgresStore(final DataSource data_source, 
                       final PostgresConfig config, 
                       final MetricRegistry metrics) {
    this.data_source = Preconditions.checkNotNull(data_source, 
        "Data source cannot be null.");
    this.config = Preconditions.checkNotNull(config, "Config cannot be null.");
    Preconditions.checkNotNull(metrics, "Metrics cannot be null.");
    compiler = new QueryCompiler(config.table());
    writer = new BulkWriter(config.table());
    
    write_timer = metrics.timer(WRITE_TIMER);
    read_timer = metrics.timer(READ_TIMER);
    samples_written = metrics.meter(SAMPLES_WRITTEN);
    series_read = metrics.meter(SERIES_READ);
    write_failures = metrics.counter(WRITE_FAILURES);
  }
  
  @Override
  public String name() {
    return TYPE;
  }
  
  @Override
  public void write(final List<Sample> samples) {
    Preconditions.checkNotNull(samples, "Samples cannot be null.");
    if (samples.isEmpty()) {
      return;
    }
    
    final Timer.Context timer = write_timer.time();
    try (final Connection connection = data_source.getConnection()) {
      writer.write(connection, samples);
      samples_written.mark(samples.size());
    } catch (SQLException e) {
      write_failures.inc();
      throw new WriteException("Failed to obtain or release a connection "
          + "for writing " + samples.size() + " samples", e);
    } catch (WriteException e) {
      write_failures.inc();
      throw e;
    } finally {
      timer.stop();
    }
  }
  
  @Override
  public ReadResponse read(final ReadRequest request) {
    Preconditions.checkNotNull(request, "Request cannot be null.");
    // compile everything first so a bad matcher doesn't leave us with 
    // half the queries executed.
    final List<CompiledQuery> queries = compiler.compile(request);
    final SeriesAggregator aggregator = new SeriesAggregator();
    
    final Timer.Context timer = read_timer.time();
    try (final Connection connection = data_source.getConnection()) {
      // the driver only streams with a cursor inside a transaction. Closing
      // the connection ends it.
      connection.setAutoCommit(false);
      connection.setReadOnly(true);
      for (final CompiledQuery query : queries) {
        execute(connection, query, aggregator);
      }
    } catch (SQLException e) {
      throw new ScanException("Failed to read " + queries.size() 
          + " queries from " + config.table(), e);
    } finally {
      timer.stop();
    }
    
    series_read.mark(aggregator.seriesCount());
    if (LOG.isDebugEnabled()) {
      LOG.debug("Returned response with " + aggregator.seriesCount() 
          + " timeseries from " + aggregator.rowCount() + " rows");
    }
    return aggregator.toResponse();
  }
  
  @Override
  public void healthCheck() {
    try (final Connection connection = data_source.getConnection();
         final Statement statement = connection.createStatement();
         final ResultSet results = statement.executeQuery(
             PgPrometheus.HEALTH_CHECK)) {
      results.next();
    } catch (SQLException e) {
      LOG.debug("Health check error", e);
      throw new ConnectionException("Health check against " 
          + config.host() + ":" + config.port() + " failed", e);
    }
  }
  
  /** @return The config the store was created with. */
  public PostgresConfig config() {
    return config;
  }
  
  /**
   * Runs one query and feeds its rows to the aggregator.
   * @throws SQLException if the query or a row fetch failed.
   * @throws DecodeException if a row could not be decoded.
   */
  void execute(final Connection connection, 
               final CompiledQuery query, 
               final SeriesAggregator aggregator) throws SQLException {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Query '" + query.sql() + "'");
    }
    try (final Statement statement = connection.createStatement()) {
      statement.setFetchSize(config.fetchSize());
      if (config.statementTimeout() > 0) {
        statement.setQueryTimeout(config.statementTimeout());
      }
      try (final ResultSet results = statement.executeQuery(query.sql())) {
        while (results.next()) {
          final Timestamp time = results.getTimestamp(1);
          if (time == null) {
            throw new DecodeException("Null sample time in a row of " 
                + config.table());
          }
          final String metric = Strings.nullToEmpty(results.getString(2));
          final double value = results.getDouble(3);
          final SampleLabels labels = SampleLabels.read(results, 4);
          aggregator.add(metric, labels, time.getTime(), value);
        }
      }
    }
  }
}

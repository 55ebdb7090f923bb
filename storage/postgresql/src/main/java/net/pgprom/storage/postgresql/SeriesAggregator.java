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

import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import net.pgprom.data.TimeSeries;
import net.pgprom.query.QueryResult;
import net.pgprom.query.ReadResponse;

/**
 * Folds sample rows into series keyed on the canonical key of the metric
 * name and labels (see {@link SampleLabels#key(String)}). Rows of every 
 * query of a read land in the same aggregator so the response carries a 
 * single result with the union of all series.
 * <p>
 * Data points are appended in the order the rows arrive, they are neither
 * sorted nor de-duplicated. Ordering within a series is whatever the 
 * store returned. Series are emitted in the order they were first seen.
 * <p>
 * One instance per read call. Not thread safe: when rows come from 
 * several threads, give each its own aggregator and {@link #merge} them.
 * 
 * @since 1.0
 */
public class SeriesAggregator {
  
  /** Series by canonical key, in first-seen order. */
  private final Map<String, TimeSeries> series;
  
  /** How many rows were added. */
  private long rows;
  
  public SeriesAggregator() {
    series = Maps.newLinkedHashMap();
  }
  
  /**
   * Adds one row.
   * @param metric The non-null metric name of the row.
   * @param labels The non-null labels of the row.
   * @param timestamp The Unix epoch timestamp in milliseconds.
   * @param value The value.
   */
  public void add(final String metric, 
                  final SampleLabels labels, 
                  final long timestamp, 
                  final double value) {
    final String key = labels.key(metric);
    TimeSeries ts = series.get(key);
    if (ts == null) {
      ts = new TimeSeries(labels.toLabelPairs(metric));
      series.put(key, ts);
    }
    ts.addDataPoint(timestamp, value);
    rows++;
  }
  
  /**
   * Moves the series of another aggregator into this one. Points of 
   * series both have in common are appended after the ones already here.
   * @param other A non-null aggregator that must not be used afterwards.
   */
  public void merge(final SeriesAggregator other) {
    for (final Entry<String, TimeSeries> entry : other.series.entrySet()) {
      final TimeSeries existing = series.get(entry.getKey());
      if (existing == null) {
        series.put(entry.getKey(), entry.getValue());
      } else {
        existing.addAll(entry.getValue());
      }
    }
    rows += other.rows;
  }
  
  /** @return The number of distinct series seen. */
  public int seriesCount() {
    return series.size();
  }
  
  /** @return The number of rows added. */
  public long rowCount() {
    return rows;
  }
  
  /** @return A response with one result holding all series. */
  public ReadResponse toResponse() {
    return new ReadResponse(Collections.singletonList(
        new QueryResult(ImmutableList.copyOf(series.values()))));
  }
}

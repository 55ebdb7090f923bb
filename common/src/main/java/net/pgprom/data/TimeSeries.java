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
package net.pgprom.data;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * A series as exchanged over the remote protocol: an ordered list of 
 * label pairs and the data points belonging to it. The label list is 
 * fixed at construction, data points are appended in the order they 
 * arrive. No sorting or de-duplication is performed on the points.
 * <p>
 * Not thread safe.
 * 
 * @since 1.0
 */
public class TimeSeries {
  /** The labels in the order given. */
  private final List<LabelPair> labels;
  
  /** The data points in append order. */
  private final List<DataPoint> data_points;
  
  /**
   * Ctor with an empty data point list.
   * @param labels A non-null list of labels.
   */
  public TimeSeries(final List<LabelPair> labels) {
    this(labels, Collections.<DataPoint>emptyList());
  }
  
  /**
   * Ctor with initial points.
   * @param labels A non-null list of labels.
   * @param data_points A non-null list of data points to copy.
   */
  public TimeSeries(final List<LabelPair> labels, 
                    final List<DataPoint> data_points) {
    Preconditions.checkNotNull(labels, "Labels cannot be null.");
    Preconditions.checkNotNull(data_points, "Data points cannot be null.");
    this.labels = ImmutableList.copyOf(labels);
    this.data_points = Lists.newArrayList(data_points);
  }
  
  /** @return The immutable list of labels. */
  public List<LabelPair> labels() {
    return labels;
  }
  
  /** @return An unmodifiable view of the data points in append order. */
  public List<DataPoint> dataPoints() {
    return Collections.unmodifiableList(data_points);
  }
  
  /**
   * Appends a data point to the end of the series.
   * @param timestamp A Unix epoch timestamp in milliseconds.
   * @param value The value.
   * @return The series for chaining.
   */
  public TimeSeries addDataPoint(final long timestamp, final double value) {
    data_points.add(new DataPoint(timestamp, value));
    return this;
  }
  
  /**
   * Appends all data points of the given series to this one. Labels are 
   * not compared.
   * @param other A non-null series.
   * @return The series for chaining.
   */
  public TimeSeries addAll(final TimeSeries other) {
    data_points.addAll(other.data_points);
    return this;
  }
  
  /**
   * Looks up a label value by name.
   * @param name A non-null label name.
   * @return The value or null if the series does not carry the label.
   */
  public String labelValue(final String name) {
    for (final LabelPair pair : labels) {
      if (pair.getName().equals(name)) {
        return pair.getValue();
      }
    }
    return null;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{labels=")
        .append(labels)
        .append(", dataPoints=")
        .append(data_points.size())
        .append("}")
        .toString();
  }
}

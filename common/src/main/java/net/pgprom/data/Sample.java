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

import java.util.List;
import java.util.Map;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.pgprom.core.Const;

/**
 * A single value to be written: metric name, labels, a millisecond 
 * timestamp and a double value. The metric name is kept apart from the 
 * labels, i.e. the label map never contains {@link Const#METRIC_NAME_LABEL}.
 * 
 * @since 1.0
 */
public final class Sample {
  /** Unix epoch timestamp in milliseconds. */
  private final long timestamp;
  
  /** The metric name, may be empty. */
  private final String metric;
  
  /** The labels without the metric name. */
  private final ImmutableMap<String, String> labels;
  
  /** The value. */
  private final double value;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected Sample(final Builder builder) {
    if (builder.labels.containsKey(Const.METRIC_NAME_LABEL)) {
      throw new IllegalArgumentException("Labels cannot contain the "
          + "reserved label " + Const.METRIC_NAME_LABEL 
          + ". Use the metric field instead.");
    }
    timestamp = builder.timestamp;
    metric = Strings.nullToEmpty(builder.metric);
    labels = ImmutableMap.copyOf(builder.labels);
    value = builder.value;
  }
  
  /** @return The Unix epoch timestamp in milliseconds. */
  public long timestamp() {
    return timestamp;
  }
  
  /** @return The metric name, possibly empty but never null. */
  public String metric() {
    return metric;
  }
  
  /** @return The immutable label map without the metric name. */
  public Map<String, String> labels() {
    return labels;
  }
  
  /** @return The value. */
  public double value() {
    return value;
  }
  
  /**
   * Flattens a remote protocol series into one sample per data point. 
   * The {@link Const#METRIC_NAME_LABEL} label becomes the metric name 
   * (empty if missing), every other pair becomes a label.
   * @param series A non-null series.
   * @return A list of samples in data point order, empty if the series 
   * has no points.
   * @throws IllegalArgumentException if a label name repeats.
   */
  public static List<Sample> fromTimeSeries(final TimeSeries series) {
    Preconditions.checkNotNull(series, "Series cannot be null.");
    String metric = null;
    final Map<String, String> labels = 
        Maps.newHashMapWithExpectedSize(series.labels().size());
    for (final LabelPair pair : series.labels()) {
      if (pair.getName().equals(Const.METRIC_NAME_LABEL)) {
        if (metric != null) {
          throw new IllegalArgumentException("Duplicate metric name label in " 
              + series);
        }
        metric = pair.getValue();
        continue;
      }
      if (labels.put(pair.getName(), pair.getValue()) != null) {
        throw new IllegalArgumentException("Duplicate label " + pair.getName() 
            + " in " + series);
      }
    }
    
    final ImmutableList.Builder<Sample> samples = ImmutableList.builder();
    for (final DataPoint dp : series.dataPoints()) {
      samples.add(newBuilder()
          .setMetric(metric)
          .setLabels(labels)
          .setTimestamp(dp.timestamp())
          .setValue(dp.value())
          .build());
    }
    return samples.build();
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Sample other = (Sample) o;
    return timestamp == other.timestamp
        && Double.compare(value, other.value) == 0
        && metric.equals(other.metric)
        && labels.equals(other.labels);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(timestamp, metric, labels, value);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{metric=")
        .append(metric)
        .append(", labels=")
        .append(labels)
        .append(", timestamp=")
        .append(timestamp)
        .append(", value=")
        .append(value)
        .append("}")
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private long timestamp;
    private String metric;
    private Map<String, String> labels = Maps.newHashMap();
    private double value;
    
    public Builder setTimestamp(final long timestamp) {
      this.timestamp = timestamp;
      return this;
    }
    
    public Builder setMetric(final String metric) {
      this.metric = metric;
      return this;
    }
    
    public Builder setLabels(final Map<String, String> labels) {
      this.labels = Maps.newHashMap(labels);
      return this;
    }
    
    public Builder addLabel(final String name, final String value) {
      labels.put(name, value);
      return this;
    }
    
    public Builder setValue(final double value) {
      this.value = value;
      return this;
    }
    
    public Sample build() {
      return new Sample(this);
    }
  }
}

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
import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;

import net.pgprom.data.Sample;

/**
 * Formats samples as the text lines {@code COPY} into a pg_prometheus 
 * samples table expects: {@code <series> <value> <timestamp ms>}. The 
 * series is the metric name optionally followed by the labels in 
 * Prometheus exposition syntax, sorted by label name, e.g. 
 * {@code cpu{host="web01",dc="lga"}} becomes 
 * {@code cpu{dc="lga",host="web01"}}. A metric without labels is written
 * bare.
 * 
 * @since 1.0
 */
public final class SeriesFormat {
  
  private SeriesFormat() {
    // Static only
  }
  
  /**
   * @param sample A non-null sample.
   * @return The newline terminated COPY line for the sample.
   */
  public static String line(final Sample sample) {
    return new StringBuilder()
        .append(series(sample.metric(), sample.labels()))
        .append(' ')
        .append(formatValue(sample.value()))
        .append(' ')
        .append(sample.timestamp())
        .append('\n')
        .toString();
  }
  
  /**
   * @param metric The non-null, possibly empty metric name.
   * @param labels The non-null labels without the metric name.
   * @return The series text.
   */
  public static String series(final String metric, 
                              final Map<String, String> labels) {
    if (labels.isEmpty()) {
      return metric.isEmpty() ? "{}" : metric;
    }
    final List<String> keys = Lists.newArrayList(labels.keySet());
    Collections.sort(keys);
    
    final StringBuilder buf = new StringBuilder(metric).append('{');
    for (int i = 0; i < keys.size(); i++) {
      if (i > 0) {
        buf.append(',');
      }
      buf.append(keys.get(i))
         .append("=\"");
      escapeLabelValue(labels.get(keys.get(i)), buf);
      buf.append('"');
    }
    return buf.append('}').toString();
  }
  
  /**
   * Formats the value with the fewest digits that parse back to the same 
   * double. Integral values lose the trailing {@code .0}.
   * @param value The value.
   * @return The formatted value.
   */
  public static String formatValue(final double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    final String formatted = Double.toString(value);
    if (formatted.endsWith(".0")) {
      return formatted.substring(0, formatted.length() - 2);
    }
    return formatted;
  }
  
  /** Escapes backslash, double quote and line feed. */
  static void escapeLabelValue(final String value, final StringBuilder buf) {
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      switch (c) {
      case '\\':
        buf.append("\\\\");
        break;
      case '"':
        buf.append("\\\"");
        break;
      case '\n':
        buf.append("\\n");
        break;
      default:
        buf.append(c);
      }
    }
  }
}

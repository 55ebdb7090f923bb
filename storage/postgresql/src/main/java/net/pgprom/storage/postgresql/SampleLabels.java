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

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import javax.annotation.Nullable;

import org.postgresql.util.PGobject;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.pgprom.core.Const;
import net.pgprom.data.LabelPair;
import net.pgprom.exceptions.DecodeException;
import net.pgprom.utils.JSON;

/**
 * The labels of a stored sample as read from the {@code prom_labels} 
 * column, with the keys in lexicographic order so that a canonical 
 * series key can be computed independent of the document's member order.
 * <p>
 * The column may arrive in one of these shapes, anything else is a 
 * {@link DecodeException}:
 * <ul>
 * <li>SQL NULL: no labels.</li>
 * <li>{@link String}: JSON text.</li>
 * <li>{@code byte[]}: UTF-8 encoded JSON text.</li>
 * <li>{@link PGobject} ({@code json} or {@code jsonb}): JSON text.</li>
 * </ul>
 * The JSON must be an object of string members.
 * 
 * @since 1.0
 */
public final class SampleLabels {
  /** Ends the length prefix of each key part. */
  static final char LENGTH_DELIMITER = ':';
  
  private static final SampleLabels EMPTY = new SampleLabels(
      ImmutableMap.<String, String>of());
  
  /** The labels. */
  private final Map<String, String> labels;
  
  /** The label names sorted lexicographically. */
  private final List<String> ordered_keys;
  
  private SampleLabels(final Map<String, String> labels) {
    this.labels = labels;
    final List<String> keys = Lists.newArrayList(labels.keySet());
    Collections.sort(keys);
    ordered_keys = ImmutableList.copyOf(keys);
  }
  
  /**
   * Builds the labels from a map, e.g. when the labels didn't come from 
   * the store.
   * @param labels A non-null map.
   * @return The labels.
   */
  public static SampleLabels fromMap(final Map<String, String> labels) {
    Preconditions.checkNotNull(labels, "Labels cannot be null.");
    return labels.isEmpty() ? EMPTY : 
      new SampleLabels(ImmutableMap.copyOf(labels));
  }
  
  /**
   * Decodes a label column value.
   * @param column The value as returned by the JDBC driver, may be null.
   * @return The labels.
   * @throws DecodeException if the value has an unexpected type or is not
   * a JSON object of strings.
   */
  public static SampleLabels decode(@Nullable final Object column) {
    if (column == null) {
      return EMPTY;
    }
    if (column instanceof String) {
      return parse((String) column);
    }
    if (column instanceof byte[]) {
      return parse(new String((byte[]) column, Const.UTF8_CHARSET));
    }
    if (column instanceof PGobject) {
      final String value = ((PGobject) column).getValue();
      if (value == null) {
        return EMPTY;
      }
      return parse(value);
    }
    throw new DecodeException("Invalid labels value of type " 
        + column.getClass().getName());
  }
  
  /**
   * Reads the label column of the current row.
   * @param row The result set positioned on a row.
   * @param column The 1 based column index.
   * @return The labels.
   * @throws SQLException if the driver failed to read the column.
   * @throws DecodeException if the value can't be decoded.
   */
  static SampleLabels read(final ResultSet row, final int column) 
      throws SQLException {
    return decode(row.getObject(column));
  }
  
  private static SampleLabels parse(final String json) {
    final JsonNode root;
    try {
      root = JSON.getMapper().readTree(json);
    } catch (IOException e) {
      throw new DecodeException("Failed to parse labels: " + json, e);
    }
    if (root == null || !root.isObject()) {
      throw new DecodeException("Labels must be a JSON object: " + json);
    }
    if (root.size() == 0) {
      return EMPTY;
    }
    final Map<String, String> labels = 
        Maps.newHashMapWithExpectedSize(root.size());
    final Iterator<Entry<String, JsonNode>> iterator = root.fields();
    while (iterator.hasNext()) {
      final Entry<String, JsonNode> entry = iterator.next();
      if (!entry.getValue().isTextual()) {
        throw new DecodeException("Value of label " + entry.getKey() 
            + " is not a string: " + json);
      }
      labels.put(entry.getKey(), entry.getValue().asText());
    }
    return new SampleLabels(ImmutableMap.copyOf(labels));
  }
  
  /** @return The immutable label map. */
  public Map<String, String> labels() {
    return labels;
  }
  
  /** @return The label names in lexicographic order. */
  public List<String> orderedKeys() {
    return ordered_keys;
  }
  
  /** @return The number of labels. */
  public int size() {
    return ordered_keys.size();
  }
  
  /**
   * Computes the canonical key of the series made of the metric and these
   * labels. Two rows belong to the same series if and only if their keys 
   * are equal. Each part is written as its length, a {@code :} and the 
   * part itself: first the metric, then for each label in key order the 
   * name and the value. The prefixes keep part boundaries unambiguous 
   * whatever characters the labels contain.
   * @param metric The non-null metric name.
   * @return The key.
   */
  public String key(final String metric) {
    final StringBuilder buf = new StringBuilder(metric.length() + 4 
        + (ordered_keys.size() * 24));
    appendPart(buf, metric);
    for (final String key : ordered_keys) {
      appendPart(buf, key);
      appendPart(buf, labels.get(key));
    }
    return buf.toString();
  }
  
  private static void appendPart(final StringBuilder buf, final String part) {
    buf.append(part.length())
       .append(LENGTH_DELIMITER)
       .append(part);
  }
  
  /**
   * @param metric The non-null metric name.
   * @return The label pairs of a series, metric name first and then the 
   * labels in key order.
   */
  public List<LabelPair> toLabelPairs(final String metric) {
    final ImmutableList.Builder<LabelPair> pairs = ImmutableList.builder();
    pairs.add(new LabelPair(Const.METRIC_NAME_LABEL, metric));
    for (final String key : ordered_keys) {
      pairs.add(new LabelPair(key, labels.get(key)));
    }
    return pairs.build();
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return labels.equals(((SampleLabels) o).labels);
  }
  
  @Override
  public int hashCode() {
    return labels.hashCode();
  }
  
  @Override
  public String toString() {
    return JSON.serializeToString(labels);
  }
}

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

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.pgprom.core.Const;
import net.pgprom.exceptions.UnsupportedMatchTypeException;
import net.pgprom.query.Matcher;
import net.pgprom.query.Query;
import net.pgprom.query.ReadRequest;
import net.pgprom.utils.JSON;

/**
 * Compiles remote read queries into SQL against a pg_prometheus samples 
 * table.
 * <p>
 * The metric name matcher is applied to {@code prom_name()}, all other 
 * matchers to {@code prom_labels()}. Equality matchers on labels are 
 * folded into a single JSONB containment predicate so that an index on 
 * the labels can answer all of them at once. Regular expressions are 
 * wrapped in a group anchored at both ends as the remote protocol expects
 * full matches, alternations included.
 * <p>
 * Literals are escaped by doubling single quotes. Either a complete 
 * statement is returned or an exception thrown.
 * 
 * @since 1.0
 */
public class QueryCompiler {
  private static final Joiner AND = Joiner.on(" AND ");
  
  /** Millisecond precision so both bounds include the exact millisecond. */
  private static final DateTimeFormatter TIMESTAMP_FORMAT = 
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'")
        .withZone(ZoneOffset.UTC);
  
  /** The table to select from. */
  private final String table;
  
  /** The SELECT and FROM clause, same for every query. */
  private final String select;
  
  /**
   * Default ctor.
   * @param table The non-null, non-empty samples table name.
   */
  public QueryCompiler(final String table) {
    if (Strings.isNullOrEmpty(table)) {
      throw new IllegalArgumentException("Table cannot be null or empty.");
    }
    this.table = table;
    select = new StringBuilder()
        .append("SELECT ")
        .append(PgPrometheus.TIME)
        .append(", ")
        .append(PgPrometheus.NAME)
        .append(", ")
        .append(PgPrometheus.VALUE)
        .append(", ")
        .append(PgPrometheus.LABELS)
        .append(" FROM ")
        .append(SqlStrings.quoteIdentifier(table))
        .append(" WHERE ")
        .toString();
  }
  
  /** @return The table queries are compiled against. */
  public String table() {
    return table;
  }
  
  /**
   * Compiles every query of the request. Nothing is returned unless all 
   * of them compile.
   * @param request A non-null request.
   * @return The compiled queries in request order.
   * @throws UnsupportedMatchTypeException if any matcher has an unknown 
   * type.
   */
  public List<CompiledQuery> compile(final ReadRequest request) {
    Preconditions.checkNotNull(request, "Request cannot be null.");
    final ImmutableList.Builder<CompiledQuery> compiled = 
        ImmutableList.builder();
    for (final Query query : request.getQueries()) {
      compiled.add(compile(query));
    }
    return compiled.build();
  }
  
  /**
   * Compiles a single query.
   * @param query A non-null query.
   * @return The compiled query.
   * @throws UnsupportedMatchTypeException if any matcher has an unknown 
   * type.
   */
  public CompiledQuery compile(final Query query) {
    Preconditions.checkNotNull(query, "Query cannot be null.");
    final List<String> predicates = 
        Lists.newArrayListWithCapacity(query.getMatchers().size() + 3);
    final Map<String, String> label_equals = Maps.newLinkedHashMap();
    
    for (final Matcher matcher : query.getMatchers()) {
      if (matcher.getName().equals(Const.METRIC_NAME_LABEL)) {
        predicates.add(metricPredicate(matcher));
        continue;
      }
      
      switch (matcher.getType()) {
      case EQUAL:
        label_equals.put(matcher.getName(), matcher.getValue());
        break;
      case NOT_EQUAL:
        predicates.add(labelAccessor(matcher) + " != " 
            + SqlStrings.quoteLiteral(matcher.getValue()));
        break;
      case REGEX_MATCH:
        predicates.add(labelAccessor(matcher) + " ~ " 
            + anchoredPattern(matcher));
        break;
      case REGEX_NO_MATCH:
        predicates.add(labelAccessor(matcher) + " !~ " 
            + anchoredPattern(matcher));
        break;
      default:
        throw new UnsupportedMatchTypeException("Unknown match type " 
            + matcher.getType() + " for label " + matcher.getName(), matcher);
      }
    }
    
    predicates.add(PgPrometheus.TIME + " >= " + SqlStrings.quoteLiteral(
        formatTimestamp(query.getStartTimestampMs())));
    predicates.add(PgPrometheus.TIME + " <= " + SqlStrings.quoteLiteral(
        formatTimestamp(query.getEndTimestampMs())));
    
    if (!label_equals.isEmpty()) {
      predicates.add(PgPrometheus.LABELS + " @> " 
          + SqlStrings.quoteLiteral(JSON.serializeToString(label_equals)));
    }
    
    return new CompiledQuery(query, predicates, select + AND.join(predicates));
  }
  
  /**
   * Formats a timestamp the way we hand it to {@code prom_time()} 
   * comparisons.
   * @param timestamp A Unix epoch timestamp in milliseconds.
   * @return An ISO 8601 UTC timestamp with milliseconds.
   */
  public static String formatTimestamp(final long timestamp) {
    return TIMESTAMP_FORMAT.format(Instant.ofEpochMilli(timestamp));
  }
  
  static String metricPredicate(final Matcher matcher) {
    switch (matcher.getType()) {
    case EQUAL:
      return PgPrometheus.NAME + " = " 
          + SqlStrings.quoteLiteral(matcher.getValue());
    case NOT_EQUAL:
      return PgPrometheus.NAME + " != " 
          + SqlStrings.quoteLiteral(matcher.getValue());
    case REGEX_MATCH:
      return PgPrometheus.NAME + " ~ " + anchoredPattern(matcher);
    case REGEX_NO_MATCH:
      return PgPrometheus.NAME + " !~ " + anchoredPattern(matcher);
    default:
      throw new UnsupportedMatchTypeException("Unknown metric name match type " 
          + matcher.getType(), matcher);
    }
  }
  
  static String labelAccessor(final Matcher matcher) {
    return PgPrometheus.LABELS + "->>" 
        + SqlStrings.quoteLiteral(matcher.getName());
  }
  
  static String anchoredPattern(final Matcher matcher) {
    return SqlStrings.quoteLiteral("^(?:" + matcher.getValue() + ")$");
  }
}

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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.core.type.TypeReference;

import net.pgprom.core.Const;
import net.pgprom.exceptions.UnsupportedMatchTypeException;
import net.pgprom.query.MatchType;
import net.pgprom.query.Matcher;
import net.pgprom.query.Query;
import net.pgprom.query.ReadRequest;
import net.pgprom.utils.JSON;

public class TestQueryCompiler {
  private static final long START = 1514764800000L;
  private static final long END = 1514768400000L;
  private static final String START_TS = "'2018-01-01T00:00:00.000Z'";
  private static final String END_TS = "'2018-01-01T01:00:00.000Z'";
  
  private QueryCompiler compiler;
  
  @Before
  public void before() throws Exception {
    compiler = new QueryCompiler("samples");
  }
  
  @Test
  public void ctor() throws Exception {
    assertEquals("samples", compiler.table());
    try {
      new QueryCompiler(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new QueryCompiler("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void timeRangeOnly() throws Exception {
    final CompiledQuery compiled = compiler.compile(range().build());
    assertEquals("SELECT prom_time(sample), prom_name(sample), "
        + "prom_value(sample), prom_labels(sample) FROM \"samples\" WHERE "
        + "prom_time(sample) >= " + START_TS 
        + " AND prom_time(sample) <= " + END_TS, compiled.sql());
    assertEquals(2, compiled.predicates().size());
  }
  
  @Test
  public void metricName() throws Exception {
    assertEquals("prom_name(sample) = 'up'", 
        first(matcher(Const.METRIC_NAME_LABEL, MatchType.EQUAL, "up")));
    assertEquals("prom_name(sample) != 'up'", 
        first(matcher(Const.METRIC_NAME_LABEL, MatchType.NOT_EQUAL, "up")));
    assertEquals("prom_name(sample) ~ '^(?:node_.*)$'", 
        first(matcher(Const.METRIC_NAME_LABEL, MatchType.REGEX_MATCH, "node_.*")));
    assertEquals("prom_name(sample) !~ '^(?:node_.*)$'", 
        first(matcher(Const.METRIC_NAME_LABEL, MatchType.REGEX_NO_MATCH, "node_.*")));
  }
  
  @Test
  public void labelMatchers() throws Exception {
    assertEquals("prom_labels(sample)->>'job' != 'node'", 
        first(matcher("job", MatchType.NOT_EQUAL, "node")));
    assertEquals("prom_labels(sample)->>'job' ~ '^(?:no.*)$'", 
        first(matcher("job", MatchType.REGEX_MATCH, "no.*")));
    assertEquals("prom_labels(sample)->>'job' !~ '^(?:no.*)$'", 
        first(matcher("job", MatchType.REGEX_NO_MATCH, "no.*")));
  }
  
  @Test
  public void alternationFullyAnchored() throws Exception {
    final String label = first(matcher("job", MatchType.REGEX_MATCH, "api|web"));
    assertEquals("prom_labels(sample)->>'job' ~ '^(?:api|web)$'", label);
    assertEquals("prom_name(sample) !~ '^(?:up|down)$'", 
        first(matcher(Const.METRIC_NAME_LABEL, MatchType.REGEX_NO_MATCH, "up|down")));
    
    final Pattern pattern = Pattern.compile(
        literal(label, "prom_labels(sample)->>'job' ~ "));
    assertTrue(pattern.matcher("api").find());
    assertTrue(pattern.matcher("web").find());
    assertFalse(pattern.matcher("xweb").find());
    assertFalse(pattern.matcher("apix").find());
  }
  
  @Test
  public void singleEqualIsContainment() throws Exception {
    final CompiledQuery compiled = compiler.compile(range()
        .addMatcher(matcher("job", MatchType.EQUAL, "node"))
        .build());
    assertEquals(3, compiled.predicates().size());
    assertEquals("prom_labels(sample) @> '{\"job\":\"node\"}'", 
        compiled.predicates().get(2));
  }
  
  @Test
  public void equalsCombinedIntoOnePredicate() throws Exception {
    final CompiledQuery compiled = compiler.compile(range()
        .addMatcher(matcher(Const.METRIC_NAME_LABEL, MatchType.EQUAL, "up"))
        .addMatcher(matcher("job", MatchType.EQUAL, "node"))
        .addMatcher(matcher("env", MatchType.NOT_EQUAL, "dev"))
        .addMatcher(matcher("instance", MatchType.EQUAL, "web01:9100"))
        .addMatcher(matcher("dc", MatchType.EQUAL, "lga"))
        .build());
    
    final List<String> predicates = compiled.predicates();
    assertEquals(5, predicates.size());
    assertEquals("prom_name(sample) = 'up'", predicates.get(0));
    assertEquals("prom_labels(sample)->>'env' != 'dev'", predicates.get(1));
    assertEquals("prom_time(sample) >= " + START_TS, predicates.get(2));
    assertEquals("prom_time(sample) <= " + END_TS, predicates.get(3));
    assertEquals("prom_labels(sample) @> "
        + "'{\"job\":\"node\",\"instance\":\"web01:9100\",\"dc\":\"lga\"}'", 
        predicates.get(4));
    
    int containment = 0;
    for (final String predicate : predicates) {
      if (predicate.contains("@>")) {
        containment++;
      }
      assertFalse(predicate.contains("->>'job'"));
      assertFalse(predicate.contains("->>'instance'"));
      assertFalse(predicate.contains("->>'dc'"));
    }
    assertEquals(1, containment);
    assertTrue(compiled.sql().endsWith(" AND " + predicates.get(4)));
  }
  
  @Test
  public void equalOnSameLabelKeepsLast() throws Exception {
    final CompiledQuery compiled = compiler.compile(range()
        .addMatcher(matcher("job", MatchType.EQUAL, "node"))
        .addMatcher(matcher("job", MatchType.EQUAL, "api"))
        .build());
    assertEquals("prom_labels(sample) @> '{\"job\":\"api\"}'", 
        compiled.predicates().get(2));
  }
  
  @Test
  public void singleQuotesEscaped() throws Exception {
    final String[] values = new String[] { 
        "o'clock", "'", "''", "a'; DROP TABLE samples; --", "\\'", "it's 'quoted'" };
    for (final String value : values) {
      // literal comparisons
      String predicate = first(matcher(Const.METRIC_NAME_LABEL, 
          MatchType.EQUAL, value));
      assertEquals(value, literal(predicate, "prom_name(sample) = "));
      
      predicate = first(matcher("job", MatchType.NOT_EQUAL, value));
      assertEquals(value, literal(predicate, "prom_labels(sample)->>'job' != "));
      
      predicate = first(matcher("job", MatchType.REGEX_MATCH, value));
      assertEquals("^(?:" + value + ")$", 
          literal(predicate, "prom_labels(sample)->>'job' ~ "));
      
      // label names too
      predicate = first(matcher(value, MatchType.NOT_EQUAL, "x"));
      assertEquals("prom_labels(sample)->>" + SqlStrings.quoteLiteral(value) 
          + " != 'x'", predicate);
      
      // containment json
      final CompiledQuery compiled = compiler.compile(range()
          .addMatcher(matcher("job", MatchType.EQUAL, value))
          .addMatcher(matcher(value, MatchType.EQUAL, "y"))
          .build());
      final String json = literal(compiled.predicates().get(2), 
          "prom_labels(sample) @> ");
      final Map<String, String> parsed = JSON.getMapper().readValue(json, 
          new TypeReference<Map<String, String>>() { });
      assertEquals(value, parsed.get("job"));
      assertEquals("y", parsed.get(value));
    }
  }
  
  @Test
  public void unsupportedMatchType() throws Exception {
    final Matcher bad = matcher("job", MatchType.UNRECOGNIZED, "node");
    try {
      compiler.compile(range()
          .addMatcher(matcher("env", MatchType.NOT_EQUAL, "dev"))
          .addMatcher(bad)
          .build());
      fail("Expected UnsupportedMatchTypeException");
    } catch (UnsupportedMatchTypeException e) {
      assertSame(bad, e.getMatcher());
    }
    
    try {
      compiler.compile(range()
          .addMatcher(matcher(Const.METRIC_NAME_LABEL, 
              MatchType.forNumber(42), "up"))
          .build());
      fail("Expected UnsupportedMatchTypeException");
    } catch (UnsupportedMatchTypeException e) { }
  }
  
  @Test
  public void compileRequest() throws Exception {
    final ReadRequest request = ReadRequest.newBuilder()
        .addQuery(range()
            .addMatcher(matcher(Const.METRIC_NAME_LABEL, MatchType.EQUAL, "up"))
            .build())
        .addQuery(range()
            .addMatcher(matcher(Const.METRIC_NAME_LABEL, MatchType.EQUAL, "down"))
            .build())
        .build();
    final List<CompiledQuery> compiled = compiler.compile(request);
    assertEquals(2, compiled.size());
    assertSame(request.getQueries().get(0), compiled.get(0).query());
    assertTrue(compiled.get(0).sql().contains("'up'"));
    assertTrue(compiled.get(1).sql().contains("'down'"));
  }
  
  @Test
  public void compileRequestAllOrNothing() throws Exception {
    final ReadRequest request = ReadRequest.newBuilder()
        .addQuery(range()
            .addMatcher(matcher(Const.METRIC_NAME_LABEL, MatchType.EQUAL, "up"))
            .build())
        .addQuery(range()
            .addMatcher(matcher("job", MatchType.UNRECOGNIZED, "node"))
            .build())
        .build();
    List<CompiledQuery> compiled = null;
    try {
      compiled = compiler.compile(request);
      fail("Expected UnsupportedMatchTypeException");
    } catch (UnsupportedMatchTypeException e) { }
    assertNull(compiled);
  }
  
  @Test
  public void formatTimestamp() throws Exception {
    assertEquals("1970-01-01T00:00:00.000Z", QueryCompiler.formatTimestamp(0));
    assertEquals("1970-01-01T00:00:01.500Z", QueryCompiler.formatTimestamp(1500));
    assertEquals("2018-01-01T00:00:00.001Z", 
        QueryCompiler.formatTimestamp(1514764800001L));
    assertEquals("1969-12-31T23:59:59.999Z", QueryCompiler.formatTimestamp(-1));
  }
  
  @Test
  public void boundsInclusiveOfExactMillisecond() throws Exception {
    final CompiledQuery compiled = compiler.compile(Query.newBuilder()
        .setStartTimestampMs(1500)
        .setEndTimestampMs(1500)
        .build());
    assertEquals("prom_time(sample) >= '1970-01-01T00:00:01.500Z'", 
        compiled.predicates().get(0));
    assertEquals("prom_time(sample) <= '1970-01-01T00:00:01.500Z'", 
        compiled.predicates().get(1));
    
    // the bound must parse back to the exact instant
    final String bound = literal(compiled.predicates().get(0), 
        "prom_time(sample) >= ");
    assertEquals(1500, Instant.parse(bound).toEpochMilli());
  }
  
  private Query.Builder range() {
    return Query.newBuilder()
        .setStartTimestampMs(START)
        .setEndTimestampMs(END);
  }
  
  private String first(final Matcher matcher) {
    return compiler.compile(range().addMatcher(matcher).build())
        .predicates().get(0);
  }
  
  private static Matcher matcher(final String name, 
                                 final MatchType type, 
                                 final String value) {
    return Matcher.newBuilder()
        .setName(name)
        .setType(type)
        .setValue(value)
        .build();
  }
  
  /** Strips the prefix and quotes and un-escapes the literal. */
  private static String literal(final String predicate, final String prefix) {
    assertTrue(predicate, predicate.startsWith(prefix + "'"));
    assertTrue(predicate, predicate.endsWith("'"));
    final String body = predicate.substring(prefix.length() + 1, 
        predicate.length() - 1);
    // every quote inside the literal must be doubled
    assertFalse(body, body.replace("''", "").contains("'"));
    return SqlStrings.unescapeSingleQuotes(body);
  }
}

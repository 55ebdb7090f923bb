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
package net.pgprom.query;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * One remote read query: a list of matchers that must all apply and an 
 * inclusive time range in Unix epoch milliseconds.
 * 
 * @since 1.0
 */
@JsonDeserialize(builder = Query.Builder.class)
public class Query {
  
  /** The matchers, AND'd. */
  protected final List<Matcher> matchers;
  
  /** Inclusive start in milliseconds. */
  protected final long start_timestamp_ms;
  
  /** Inclusive end in milliseconds. */
  protected final long end_timestamp_ms;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected Query(final Builder builder) {
    matchers = builder.matchers == null ? ImmutableList.<Matcher>of() 
        : ImmutableList.copyOf(builder.matchers);
    start_timestamp_ms = builder.startTimestampMs;
    end_timestamp_ms = builder.endTimestampMs;
  }
  
  /** @return The immutable list of matchers, possibly empty. */
  public List<Matcher> getMatchers() {
    return matchers;
  }
  
  /** @return The inclusive start timestamp in milliseconds. */
  public long getStartTimestampMs() {
    return start_timestamp_ms;
  }
  
  /** @return The inclusive end timestamp in milliseconds. */
  public long getEndTimestampMs() {
    return end_timestamp_ms;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{matchers=")
        .append(matchers)
        .append(", startTimestampMs=")
        .append(start_timestamp_ms)
        .append(", endTimestampMs=")
        .append(end_timestamp_ms)
        .append("}")
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private List<Matcher> matchers;
    @JsonProperty
    private long startTimestampMs;
    @JsonProperty
    private long endTimestampMs;
    
    public Builder setMatchers(final List<Matcher> matchers) {
      this.matchers = matchers;
      return this;
    }
    
    public Builder addMatcher(final Matcher matcher) {
      if (matchers == null) {
        matchers = Lists.newArrayList();
      }
      matchers.add(matcher);
      return this;
    }
    
    public Builder setStartTimestampMs(final long start_timestamp_ms) {
      startTimestampMs = start_timestamp_ms;
      return this;
    }
    
    public Builder setEndTimestampMs(final long end_timestamp_ms) {
      endTimestampMs = end_timestamp_ms;
      return this;
    }
    
    public Query build() {
      return new Query(this);
    }
  }
}

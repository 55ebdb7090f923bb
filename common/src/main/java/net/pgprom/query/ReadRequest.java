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
 * A remote read request holding one or more queries.
 * 
 * @since 1.0
 */
@JsonDeserialize(builder = ReadRequest.Builder.class)
public class ReadRequest {
  
  /** The queries in request order. */
  protected final List<Query> queries;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected ReadRequest(final Builder builder) {
    queries = builder.queries == null ? ImmutableList.<Query>of() 
        : ImmutableList.copyOf(builder.queries);
  }
  
  /** @return The immutable list of queries, possibly empty. */
  public List<Query> getQueries() {
    return queries;
  }
  
  @Override
  public String toString() {
    return "{queries=" + queries + "}";
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private List<Query> queries;
    
    public Builder setQueries(final List<Query> queries) {
      this.queries = queries;
      return this;
    }
    
    public Builder addQuery(final Query query) {
      if (queries == null) {
        queries = Lists.newArrayList();
      }
      queries.add(query);
      return this;
    }
    
    public ReadRequest build() {
      return new ReadRequest(this);
    }
  }
}

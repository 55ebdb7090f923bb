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

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.pgprom.query.Query;

/**
 * The SQL a {@link Query} compiled to along with its individual 
 * predicates.
 * 
 * @since 1.0
 */
public class CompiledQuery {
  private final Query query;
  private final List<String> predicates;
  private final String sql;
  
  CompiledQuery(final Query query, 
                final List<String> predicates, 
                final String sql) {
    this.query = query;
    this.predicates = ImmutableList.copyOf(predicates);
    this.sql = sql;
  }
  
  /** @return The query this was compiled from. */
  public Query query() {
    return query;
  }
  
  /** @return The predicates AND'd in the WHERE clause, in order. */
  public List<String> predicates() {
    return predicates;
  }
  
  /** @return The full statement. */
  public String sql() {
    return sql;
  }
  
  @Override
  public String toString() {
    return sql;
  }
}

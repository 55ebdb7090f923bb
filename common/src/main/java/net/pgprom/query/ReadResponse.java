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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Response to a {@link ReadRequest}.
 * <p>
 * <b>Note:</b> The PostgreSQL store answers every request with a single 
 * result holding the series of all queries combined, regardless of how 
 * many queries were sent.
 * 
 * @since 1.0
 */
public class ReadResponse {
  private final List<QueryResult> results;
  
  /**
   * Default ctor.
   * @param results A non-null list of results to copy.
   */
  public ReadResponse(final List<QueryResult> results) {
    Preconditions.checkNotNull(results, "Results cannot be null.");
    this.results = ImmutableList.copyOf(results);
  }
  
  /** @return The immutable list of results. */
  public List<QueryResult> getResults() {
    return results;
  }
}

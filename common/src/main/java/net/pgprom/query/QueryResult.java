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

import net.pgprom.data.TimeSeries;

/**
 * The series matched by a read.
 * 
 * @since 1.0
 */
public class QueryResult {
  private final List<TimeSeries> timeseries;
  
  /**
   * Default ctor.
   * @param timeseries A non-null list of series to copy.
   */
  public QueryResult(final List<TimeSeries> timeseries) {
    Preconditions.checkNotNull(timeseries, "Time series cannot be null.");
    this.timeseries = ImmutableList.copyOf(timeseries);
  }
  
  /** @return The immutable list of series. */
  public List<TimeSeries> getTimeseries() {
    return timeseries;
  }
}

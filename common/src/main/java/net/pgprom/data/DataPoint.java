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

/**
 * A timestamp and value belonging to a {@link TimeSeries}.
 * 
 * @since 1.0
 */
public final class DataPoint {
  /** Unix epoch timestamp in milliseconds. */
  private final long timestamp;
  
  private final double value;
  
  /**
   * Default ctor.
   * @param timestamp A Unix epoch timestamp in milliseconds.
   * @param value The value, may be NaN or infinite.
   */
  public DataPoint(final long timestamp, final double value) {
    this.timestamp = timestamp;
    this.value = value;
  }
  
  /** @return The Unix epoch timestamp in milliseconds. */
  public long timestamp() {
    return timestamp;
  }
  
  /** @return The value. */
  public double value() {
    return value;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final DataPoint other = (DataPoint) o;
    return timestamp == other.timestamp 
        && Double.compare(value, other.value) == 0;
  }
  
  @Override
  public int hashCode() {
    return 31 * Long.hashCode(timestamp) + Double.hashCode(value);
  }
  
  @Override
  public String toString() {
    return "{timestamp=" + timestamp + ", value=" + value + "}";
  }
}

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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A single name/value label of a time series.
 * 
 * @since 1.0
 */
public final class LabelPair {
  private final String name;
  private final String value;
  
  /**
   * Default ctor.
   * @param name A non-null label name.
   * @param value A non-null label value, may be empty.
   */
  public LabelPair(final String name, final String value) {
    this.name = Preconditions.checkNotNull(name, "Name cannot be null.");
    this.value = Preconditions.checkNotNull(value, "Value cannot be null.");
  }
  
  /** @return The label name. */
  public String getName() {
    return name;
  }
  
  /** @return The label value. */
  public String getValue() {
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
    final LabelPair other = (LabelPair) o;
    return name.equals(other.name) && value.equals(other.value);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(name, value);
  }
  
  @Override
  public String toString() {
    return name + "=" + value;
  }
}

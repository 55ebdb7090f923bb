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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

/**
 * A single label filter of a remote read query: the label name, how to 
 * match and the literal or pattern to match against.
 * 
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = Matcher.Builder.class)
public class Matcher {
  
  /** The label name. */
  protected final String name;
  
  /** How to match. */
  protected final MatchType type;
  
  /** The literal or regular expression. */
  protected final String value;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected Matcher(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    if (builder.type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    name = builder.name;
    type = builder.type;
    value = Strings.nullToEmpty(builder.value);
  }
  
  /** @return The label name. */
  public String getName() {
    return name;
  }
  
  /** @return The match type. */
  public MatchType getType() {
    return type;
  }
  
  /** @return The literal or pattern, never null. */
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
    final Matcher other = (Matcher) o;
    return name.equals(other.name) 
        && type == other.type 
        && value.equals(other.value);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(name, type, value);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{name=")
        .append(name)
        .append(", type=")
        .append(type)
        .append(", value=")
        .append(value)
        .append("}")
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private String name;
    @JsonProperty
    private MatchType type;
    @JsonProperty
    private String value;
    
    public Builder setName(final String name) {
      this.name = name;
      return this;
    }
    
    public Builder setType(final MatchType type) {
      this.type = type;
      return this;
    }
    
    public Builder setValue(final String value) {
      this.value = value;
      return this;
    }
    
    public Matcher build() {
      return new Matcher(this);
    }
  }
}

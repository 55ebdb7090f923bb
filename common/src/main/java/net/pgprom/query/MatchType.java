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

/**
 * The kinds of label matching the remote read protocol supports. The 
 * numbers are the ones used on the wire. Unknown wire numbers map to 
 * {@link #UNRECOGNIZED} so they can be rejected at compile time instead 
 * of failing while decoding.
 * 
 * @since 1.0
 */
public enum MatchType {
  EQUAL(0),
  NOT_EQUAL(1),
  REGEX_MATCH(2),
  REGEX_NO_MATCH(3),
  UNRECOGNIZED(-1);
  
  private final int number;
  
  private MatchType(final int number) {
    this.number = number;
  }
  
  /**
   * @return The wire number.
   * @throws IllegalArgumentException if this is {@link #UNRECOGNIZED}.
   */
  public int getNumber() {
    if (this == UNRECOGNIZED) {
      throw new IllegalArgumentException(
          "Can't get the number of an unknown enum value.");
    }
    return number;
  }
  
  /**
   * Maps a wire number to the type.
   * @param number The wire number.
   * @return The type, {@link #UNRECOGNIZED} for unknown numbers.
   */
  public static MatchType forNumber(final int number) {
    switch (number) {
    case 0:
      return EQUAL;
    case 1:
      return NOT_EQUAL;
    case 2:
      return REGEX_MATCH;
    case 3:
      return REGEX_NO_MATCH;
    default:
      return UNRECOGNIZED;
    }
  }
}

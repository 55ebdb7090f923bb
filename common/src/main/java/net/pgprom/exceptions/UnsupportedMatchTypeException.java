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
package net.pgprom.exceptions;

import net.pgprom.query.Matcher;

/**
 * Thrown when a query holds a matcher whose type can't be compiled. No 
 * part of the query is executed.
 * 
 * @since 1.0
 */
public class UnsupportedMatchTypeException extends StoreException {
  private static final long serialVersionUID = 2068425529951306118L;

  /** The offending matcher. */
  protected final Matcher matcher;
  
  /**
   * Default ctor.
   * @param msg A descriptive message about the exception.
   * @param matcher The matcher that failed to compile.
   */
  public UnsupportedMatchTypeException(final String msg, 
                                       final Matcher matcher) {
    super(msg);
    this.matcher = matcher;
  }
  
  /** @return The matcher that failed to compile. */
  public Matcher getMatcher() {
    return matcher;
  }
}

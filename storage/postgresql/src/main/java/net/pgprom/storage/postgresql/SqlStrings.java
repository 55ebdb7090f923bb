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

/**
 * Helpers for putting values into SQL text.
 * 
 * @since 1.0
 */
public final class SqlStrings {

  private SqlStrings() {
    // Static only
  }
  
  /**
   * Escapes a value for use between single quotes by doubling every 
   * single quote. Requires {@code standard_conforming_strings}, the 
   * PostgreSQL default, so backslashes are taken literally.
   * @param value A non-null value.
   * @return The escaped value without surrounding quotes.
   */
  public static String escapeSingleQuotes(final String value) {
    return value.replace("'", "''");
  }
  
  /**
   * Reverses {@link #escapeSingleQuotes(String)}.
   * @param escaped A non-null escaped value.
   * @return The unescaped value.
   */
  static String unescapeSingleQuotes(final String escaped) {
    return escaped.replace("''", "'");
  }
  
  /**
   * @param value A non-null value.
   * @return The value escaped and wrapped in single quotes.
   */
  public static String quoteLiteral(final String value) {
    return "'" + escapeSingleQuotes(value) + "'";
  }
  
  /**
   * @param identifier A non-null table or column name.
   * @return The name wrapped in double quotes with embedded double quotes 
   * doubled.
   */
  public static String quoteIdentifier(final String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }
}

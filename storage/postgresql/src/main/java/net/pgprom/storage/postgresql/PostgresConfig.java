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

import java.util.regex.Pattern;

import com.google.common.base.Strings;
import com.typesafe.config.Config;

import net.pgprom.utils.InvalidConfigException;

/**
 * Typed view of the {@code pgprom.storage.postgresql} configuration. 
 * Values are read and validated once at construction.
 * 
 * @since 1.0
 */
public class PostgresConfig {
  public static final String PREFIX = "pgprom.storage.postgresql.";
  public static final String HOST_KEY = PREFIX + "host";
  public static final String PORT_KEY = PREFIX + "port";
  public static final String USER_KEY = PREFIX + "user";
  public static final String PASSWORD_KEY = PREFIX + "password";
  public static final String DATABASE_KEY = PREFIX + "database";
  public static final String SCHEMA_KEY = PREFIX + "schema";
  public static final String TABLE_KEY = PREFIX + "table";
  public static final String NORMALIZED_KEY = PREFIX + "normalized";
  public static final String NORMALIZED_TABLE_KEY = PREFIX + "normalized_table";
  public static final String KEEP_SAMPLES_KEY = PREFIX + "keep_samples";
  public static final String CONNECT_TIMEOUT_KEY = PREFIX + "connect_timeout";
  public static final String STATEMENT_TIMEOUT_KEY = PREFIX + "statement_timeout";
  public static final String FETCH_SIZE_KEY = PREFIX + "fetch_size";

  /** Unquoted PostgreSQL identifiers we accept for table names. */
  private static final Pattern IDENTIFIER = 
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");
  
  private final String host;
  private final int port;
  private final String user;
  private final String password;
  private final String database;
  private final String schema;
  private final String table;
  private final boolean normalized;
  private final String normalized_table;
  private final boolean keep_samples;
  private final int connect_timeout;
  private final int statement_timeout;
  private final int fetch_size;
  
  /**
   * Reads the values from the config.
   * @param config A non-null config with the reference defaults loaded.
   * @throws com.typesafe.config.ConfigException if a key is missing or 
   * has the wrong type.
   * @throws InvalidConfigException if a value is out of range.
   */
  public PostgresConfig(final Config config) {
    host = config.getString(HOST_KEY);
    if (Strings.isNullOrEmpty(host)) {
      throw new InvalidConfigException(config.getValue(HOST_KEY), 
          "The host cannot be empty.");
    }
    port = config.getInt(PORT_KEY);
    if (port < 1 || port > 65535) {
      throw new InvalidConfigException(config.getValue(PORT_KEY), 
          "Invalid port: " + port);
    }
    user = config.getString(USER_KEY);
    password = config.getString(PASSWORD_KEY);
    database = config.getString(DATABASE_KEY);
    schema = config.getString(SCHEMA_KEY);
    table = validateIdentifier(config, TABLE_KEY);
    normalized = config.getBoolean(NORMALIZED_KEY);
    normalized_table = validateIdentifier(config, NORMALIZED_TABLE_KEY);
    keep_samples = config.getBoolean(KEEP_SAMPLES_KEY);
    connect_timeout = nonNegative(config, CONNECT_TIMEOUT_KEY);
    statement_timeout = nonNegative(config, STATEMENT_TIMEOUT_KEY);
    fetch_size = nonNegative(config, FETCH_SIZE_KEY);
  }
  
  public String host() {
    return host;
  }
  
  public int port() {
    return port;
  }
  
  public String user() {
    return user;
  }
  
  public String password() {
    return password;
  }
  
  public String database() {
    return database;
  }
  
  /** @return The schema to use, empty for the server's search path. */
  public String schema() {
    return schema;
  }
  
  /** @return The samples table name. */
  public String table() {
    return table;
  }
  
  public boolean normalized() {
    return normalized;
  }
  
  public String normalizedTable() {
    return normalized_table;
  }
  
  public boolean keepSamples() {
    return keep_samples;
  }
  
  /** @return The connect timeout in seconds. */
  public int connectTimeout() {
    return connect_timeout;
  }
  
  /** @return The statement timeout in seconds, 0 for none. */
  public int statementTimeout() {
    return statement_timeout;
  }
  
  /** @return How many rows to fetch per round trip, 0 for all at once. */
  public int fetchSize() {
    return fetch_size;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{host=")
        .append(host)
        .append(", port=")
        .append(port)
        .append(", user=")
        .append(user)
        .append(", database=")
        .append(database)
        .append(", schema=")
        .append(schema)
        .append(", table=")
        .append(table)
        .append(", normalized=")
        .append(normalized)
        .append(", normalizedTable=")
        .append(normalized_table)
        .append(", keepSamples=")
        .append(keep_samples)
        .append("}")
        .toString();
  }
  
  private static String validateIdentifier(final Config config, 
                                           final String key) {
    final String value = config.getString(key);
    if (!IDENTIFIER.matcher(value).matches()) {
      throw new InvalidConfigException(config.getValue(key), 
          "Not a valid table name: '" + value + "'");
    }
    return value;
  }
  
  private static int nonNegative(final Config config, final String key) {
    final int value = config.getInt(key);
    if (value < 0) {
      throw new InvalidConfigException(config.getValue(key), 
          "Must be zero or greater: " + value);
    }
    return value;
  }
}

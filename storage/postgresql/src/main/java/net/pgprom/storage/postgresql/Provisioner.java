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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import net.pgprom.exceptions.ProvisioningException;

/**
 * Installs the pg_prometheus extension and creates the samples table the 
 * first time the adapter runs against a database. Running it again is 
 * harmless: an "already exists" failure counts as success.
 * 
 * @since 1.0
 */
public class Provisioner {
  private static final Logger LOG = LoggerFactory.getLogger(Provisioner.class);
  
  /** SQL state for duplicate_table. */
  static final String DUPLICATE_TABLE = "42P07";
  
  /** SQL state for duplicate_object. */
  static final String DUPLICATE_OBJECT = "42710";
  
  private final PostgresConfig config;
  
  /**
   * Default ctor.
   * @param config The non-null config naming the tables.
   */
  public Provisioner(final PostgresConfig config) {
    this.config = Preconditions.checkNotNull(config, "Config cannot be null.");
  }
  
  /**
   * Creates the extension and tables in one transaction.
   * @param connection A non-null open connection.
   * @return True if the tables were created, false if they already 
   * existed.
   * @throws ProvisioningException if creation failed for any other reason.
   */
  public boolean provision(final Connection connection) {
    Preconditions.checkNotNull(connection, "Connection cannot be null.");
    try {
      connection.setAutoCommit(false);
      try (final Statement statement = connection.createStatement()) {
        statement.execute(PgPrometheus.CREATE_EXTENSION);
      }
      try (final PreparedStatement statement = 
          connection.prepareStatement(PgPrometheus.CREATE_TABLE)) {
        statement.setString(1, config.table());
        statement.setString(2, config.normalizedTable());
        statement.setBoolean(3, config.normalized());
        statement.setBoolean(4, config.keepSamples());
        statement.execute();
      }
      connection.commit();
      LOG.info("Initialized pg_prometheus extension");
      return true;
    } catch (SQLException e) {
      try {
        connection.rollback();
      } catch (SQLException ex) {
        e.addSuppressed(ex);
      }
      if (alreadyExists(e)) {
        LOG.info("pg_prometheus table '" + config.table() 
            + "' already exists");
        return false;
      }
      throw new ProvisioningException("Failed to set up the pg_prometheus " 
          + "extension and table '" + config.table() + "'", e);
    }
  }
  
  /**
   * @param e A non-null exception.
   * @return Whether the exception says the object we tried to create is 
   * already there.
   */
  static boolean alreadyExists(final SQLException e) {
    if (DUPLICATE_TABLE.equals(e.getSQLState()) || 
        DUPLICATE_OBJECT.equals(e.getSQLState())) {
      return true;
    }
    return Strings.nullToEmpty(e.getMessage()).contains("already exists");
  }
}

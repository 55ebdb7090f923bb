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
import java.sql.SQLException;

import javax.sql.DataSource;

import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.typesafe.config.Config;

import net.pgprom.exceptions.ConnectionException;
import net.pgprom.storage.StoreDescriptor;

/**
 * Creates a {@link PostgresStore}: connects with the configured 
 * credentials, provisions pg_prometheus and hands the data source to the 
 * store. Registered with the {@link java.util.ServiceLoader}.
 */
public class PostgresStoreDescriptor extends StoreDescriptor {
  private static final Logger LOG = 
      LoggerFactory.getLogger(PostgresStoreDescriptor.class);
  
  /** Reported to the server as the application name. */
  static final String APPLICATION_NAME = "pgprom";

  /**
   * @throws com.typesafe.config.ConfigException if a key is missing or malformed
   * @throws net.pgprom.utils.InvalidConfigException if a value is out of range
   * @throws ConnectionException if the database can't be reached
   * @throws net.pgprom.exceptions.ProvisioningException if the tables could 
   * not be created
   */
  @Override
  public PostgresStore createStore(final Config config,
                                   final MetricRegistry metrics) {
    final PostgresConfig pg_config = new PostgresConfig(config);
    final DataSource data_source = createDataSource(pg_config);
    
    try (final Connection connection = connect(data_source, pg_config)) {
      new Provisioner(pg_config).provision(connection);
    } catch (SQLException e) {
      throw new ConnectionException("Failed to close the provisioning "
          + "connection to " + pg_config.host(), e);
    }
    
    LOG.info("Created PostgreSQL store with " + pg_config);
    return new PostgresStore(data_source, pg_config, metrics);
  }

  /**
   * Create a data source that hands out connections as described by the
   * config.
   */
  @VisibleForTesting
  DataSource createDataSource(final PostgresConfig config) {
    final PGSimpleDataSource data_source = new PGSimpleDataSource();
    data_source.setServerNames(new String[] { config.host() });
    data_source.setPortNumbers(new int[] { config.port() });
    data_source.setUser(config.user());
    data_source.setPassword(config.password());
    data_source.setDatabaseName(config.database());
    if (!Strings.isNullOrEmpty(config.schema())) {
      data_source.setCurrentSchema(config.schema());
    }
    data_source.setSslMode("disable");
    data_source.setConnectTimeout(config.connectTimeout());
    data_source.setApplicationName(APPLICATION_NAME);
    return data_source;
  }

  @VisibleForTesting
  Connection connect(final DataSource data_source, 
                     final PostgresConfig config) {
    try {
      return data_source.getConnection();
    } catch (SQLException e) {
      throw new ConnectionException("Failed to connect to " + config.host() 
          + ":" + config.port() + "/" + config.database(), e);
    }
  }
}

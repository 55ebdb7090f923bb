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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;
import java.util.ServiceLoader;

import javax.sql.DataSource;

import org.junit.Before;
import org.junit.Test;
import org.postgresql.ds.PGSimpleDataSource;

import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;

import net.pgprom.core.ConfigLoader;
import net.pgprom.exceptions.ConnectionException;
import net.pgprom.exceptions.ProvisioningException;
import net.pgprom.storage.StoreDescriptor;
import net.pgprom.storage.StoreLoader;
import net.pgprom.utils.InvalidConfigException;

public class TestPostgresStoreDescriptor {
  private Connection connection;
  private Statement statement;
  private PreparedStatement prepared;
  private PostgresStoreDescriptor descriptor;
  
  @Before
  public void before() throws Exception {
    connection = mock(Connection.class);
    statement = mock(Statement.class);
    prepared = mock(PreparedStatement.class);
    when(connection.createStatement()).thenReturn(statement);
    when(connection.prepareStatement(anyString())).thenReturn(prepared);
    
    descriptor = spy(new PostgresStoreDescriptor());
  }
  
  @Test
  public void createDataSource() throws Exception {
    final PostgresConfig config = TestPostgresConfig.config(
        ImmutableMap.<String, Object>builder()
          .put(PostgresConfig.HOST_KEY, "db.example.com")
          .put(PostgresConfig.PORT_KEY, 6432)
          .put(PostgresConfig.USER_KEY, "prom")
          .put(PostgresConfig.PASSWORD_KEY, "s3cret")
          .put(PostgresConfig.DATABASE_KEY, "tsdb")
          .put(PostgresConfig.SCHEMA_KEY, "monitoring")
          .put(PostgresConfig.CONNECT_TIMEOUT_KEY, 3)
          .build());
    final PGSimpleDataSource data_source = 
        (PGSimpleDataSource) descriptor.createDataSource(config);
    assertArrayEquals(new String[] { "db.example.com" }, 
        data_source.getServerNames());
    assertArrayEquals(new int[] { 6432 }, data_source.getPortNumbers());
    assertEquals("prom", data_source.getUser());
    assertEquals("s3cret", data_source.getPassword());
    assertEquals("tsdb", data_source.getDatabaseName());
    assertEquals("monitoring", data_source.getCurrentSchema());
    assertEquals("disable", data_source.getSslMode());
    assertEquals(3, data_source.getConnectTimeout());
    assertEquals(PostgresStoreDescriptor.APPLICATION_NAME, 
        data_source.getApplicationName());
  }
  
  @Test
  public void createDataSourceNoSchema() throws Exception {
    final PGSimpleDataSource data_source = 
        (PGSimpleDataSource) descriptor.createDataSource(
            TestPostgresConfig.config(Collections.<String, Object>emptyMap()));
    assertNull(data_source.getCurrentSchema());
    assertEquals("postgres", data_source.getDatabaseName());
  }
  
  @Test
  public void createStore() throws Exception {
    doReturn(connection).when(descriptor).connect(
        any(DataSource.class), any(PostgresConfig.class));
    final MetricRegistry metrics = new MetricRegistry();
    
    final PostgresStore store = descriptor.createStore(config(), metrics);
    assertEquals("prom_samples", store.config().table());
    verify(statement).execute(PgPrometheus.CREATE_EXTENSION);
    verify(prepared).setString(1, "prom_samples");
    verify(connection).commit();
    verify(connection).close();
    assertTrue(metrics.getTimers().containsKey(PostgresStore.READ_TIMER));
  }
  
  @Test
  public void createStoreExistingTables() throws Exception {
    doReturn(connection).when(descriptor).connect(
        any(DataSource.class), any(PostgresConfig.class));
    when(prepared.execute()).thenThrow(
        new SQLException("exists", Provisioner.DUPLICATE_TABLE));
    
    final PostgresStore store = descriptor.createStore(config(), 
        new MetricRegistry());
    assertEquals(PostgresStore.TYPE, store.name());
    verify(connection).rollback();
    verify(connection).close();
  }
  
  @Test
  public void createStoreProvisioningFailure() throws Exception {
    doReturn(connection).when(descriptor).connect(
        any(DataSource.class), any(PostgresConfig.class));
    when(statement.execute(anyString())).thenThrow(
        new SQLException("permission denied", "42501"));
    try {
      descriptor.createStore(config(), new MetricRegistry());
      fail("Expected ProvisioningException");
    } catch (ProvisioningException e) { }
    verify(connection).close();
  }
  
  @Test
  public void createStoreConnectFailure() throws Exception {
    final DataSource data_source = mock(DataSource.class);
    final SQLException ex = new SQLException("Connection refused", "08001");
    when(data_source.getConnection()).thenThrow(ex);
    doReturn(data_source).when(descriptor).createDataSource(
        any(PostgresConfig.class));
    try {
      descriptor.createStore(config(), new MetricRegistry());
      fail("Expected ConnectionException");
    } catch (ConnectionException e) {
      assertSame(ex, e.getCause());
    }
  }
  
  @Test
  public void createStoreCloseFailure() throws Exception {
    doReturn(connection).when(descriptor).connect(
        any(DataSource.class), any(PostgresConfig.class));
    doThrow(new SQLException("Boo!")).when(connection).close();
    try {
      descriptor.createStore(config(), new MetricRegistry());
      fail("Expected ConnectionException");
    } catch (ConnectionException e) { }
  }
  
  @Test
  public void createStoreBadConfig() throws Exception {
    try {
      descriptor.createStore(ConfigLoader.referenceWithOverrides(
          ImmutableMap.of(PostgresConfig.TABLE_KEY, "bad table")).config(), 
          new MetricRegistry());
      fail("Expected InvalidConfigException");
    } catch (InvalidConfigException e) { }
    verify(descriptor, never()).connect(
        any(DataSource.class), any(PostgresConfig.class));
  }
  
  @Test
  public void serviceLoader() throws Exception {
    boolean found = false;
    for (final StoreDescriptor store : 
        ServiceLoader.load(StoreDescriptor.class)) {
      if (store instanceof PostgresStoreDescriptor) {
        found = true;
      }
    }
    assertTrue(found);
  }
  
  @Test
  public void referenceAdapter() throws Exception {
    assertEquals(PostgresStoreDescriptor.class.getCanonicalName(), 
        ConfigLoader.referenceWithOverrides(Collections.<String, Object>emptyMap())
          .config().getString(StoreLoader.ADAPTER_KEY));
  }
  
  private static Config config() {
    return ConfigLoader.referenceWithOverrides(ImmutableMap.of(
        PostgresConfig.TABLE_KEY, "prom_samples")).config();
  }
}

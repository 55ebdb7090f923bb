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
package net.pgprom.storage;

import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;
import net.pgprom.core.ConfigLoader;
import net.pgprom.utils.InvalidConfigException;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;
import static org.mockito.Mockito.mock;

public class TestStoreLoader {
  /**
   * A constant that describes the number of stores that the core project comes
   * with and thus how many store descriptors that the {@link java.util
   * .ServiceLoader} should be able to find. The core project does not provide
   * any store implementations on its own.
   */
  private static final int NUM_STORES = 0;

  private Config config;
  private Iterable<StoreDescriptor> storeDescriptors;
  private StoreLoader loader;

  @Before
  public void setUp() throws Exception {
    config = ConfigLoader.referenceWithOverrides(
        ImmutableMap.<String, Object>of()).config();
    storeDescriptors = ImmutableSet.<StoreDescriptor>of(new TestStoreDescriptor());
    loader = new StoreLoader();
  }

  @Test(expected = InvalidConfigException.class)
  public void testGetEmptyConfig() throws Exception {
    config = config.withValue(StoreLoader.ADAPTER_KEY,
            ConfigValueFactory.fromAnyRef(""));
    loader.provideStoreDescriptor(config, storeDescriptors);
  }

  @Test
  public void testGetMatchingStore() throws Exception {
    config = config.withValue(StoreLoader.ADAPTER_KEY,
            ConfigValueFactory.fromAnyRef(
                "net.pgprom.storage.TestStoreLoader.TestStoreDescriptor"));
    StoreDescriptor storeDescriptor =
            loader.provideStoreDescriptor(config, storeDescriptors);
    assertTrue(storeDescriptor instanceof TestStoreDescriptor);
  }

  @Test
  public void testCreateStore() throws Exception {
    config = config.withValue(StoreLoader.ADAPTER_KEY,
            ConfigValueFactory.fromAnyRef(
                "net.pgprom.storage.TestStoreLoader.TestStoreDescriptor"));
    TsdbStore store = loader.createStore(config, new MetricRegistry(), 
        storeDescriptors);
    assertNotNull(store);
  }

  @Test (expected = InvalidConfigException.class)
  public void testGetNoMatchingStore() throws Exception {
    config = config.withValue(StoreLoader.ADAPTER_KEY,
            ConfigValueFactory.fromAnyRef("FooBar4711"));
    loader.provideStoreDescriptor(config, storeDescriptors);
  }

  @Test
  public void testNumberOfFoundStoreDescriptors() {
    Iterable<StoreDescriptor> storeDescriptors = loader.provideStoreDescriptors();
    assertEquals(NUM_STORES, Iterables.size(storeDescriptors));
  }

  private static class TestStoreDescriptor extends StoreDescriptor {
    @Override
    public TsdbStore createStore(final Config config, final MetricRegistry metrics) {
      return mock(TsdbStore.class);
    }
  }
}

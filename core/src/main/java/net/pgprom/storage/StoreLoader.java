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
import com.typesafe.config.Config;
import net.pgprom.utils.InvalidConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;

/**
 * Use this class to create a TsdbStore instance. Given a config and an
 * iterable with store plugins this class will set up an instance of the
 * configured store.
 */
public class StoreLoader {
  private static final Logger LOG = LoggerFactory.getLogger(StoreLoader.class);

  /** The key naming the descriptor class to use. */
  public static final String ADAPTER_KEY = "pgprom.storage.adapter";

  /**
   * Create the store the configuration asks for using the descriptors
   * registered as services.
   *
   * @param config The non-null configuration.
   * @param metrics The registry the store should report to.
   * @return A ready to use store.
   */
  public TsdbStore createStore(final Config config,
                               final MetricRegistry metrics) {
    return createStore(config, metrics, provideStoreDescriptors());
  }

  /**
   * Create the store the configuration asks for using the given descriptors.
   *
   * @param config The non-null configuration.
   * @param metrics The registry the store should report to.
   * @param storePlugins The candidate descriptors.
   * @return A ready to use store.
   */
  public TsdbStore createStore(final Config config,
                               final MetricRegistry metrics,
                               final Iterable<StoreDescriptor> storePlugins) {
    final StoreDescriptor storeDescriptor = 
        provideStoreDescriptor(config, storePlugins);
    LOG.info("Creating store with {}", 
        storeDescriptor.getClass().getCanonicalName());
    return storeDescriptor.createStore(config, metrics);
  }

  /**
   * Get the {@link StoreDescriptor} that the configuration specifies.
   *
   * @return The descriptor whose canonical class name matches the
   * configured adapter.
   * @throws InvalidConfigException if no descriptor matches.
   */
  StoreDescriptor provideStoreDescriptor(final Config config,
                                         final Iterable<StoreDescriptor> storePlugins) {
    String adapter_type = config.getString(ADAPTER_KEY);

    for (final StoreDescriptor storeDescriptor : storePlugins) {
      String pluginName = storeDescriptor.getClass().getCanonicalName();

      if (pluginName.equals(adapter_type))
        return storeDescriptor;
    }

    throw new InvalidConfigException(config.getValue(ADAPTER_KEY),
            "Found no storage adapter that matches '" + adapter_type + "'");
  }

  /**
   * Provides an iterable with all {@link StoreDescriptor}s that are
   * registered as services and thus are found by the {@link
   * java.util.ServiceLoader}
   */
  Iterable<StoreDescriptor> provideStoreDescriptors() {
    return ServiceLoader.load(StoreDescriptor.class);
  }
}

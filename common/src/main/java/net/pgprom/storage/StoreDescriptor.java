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

/**
 * Creates a {@link TsdbStore}. Implementations are found through the 
 * {@link java.util.ServiceLoader} and picked by their canonical class 
 * name.
 */
public abstract class StoreDescriptor {
  
  /**
   * Creates a ready to use store.
   * @param config The non-null configuration.
   * @param metrics The non-null registry to report to.
   * @return A non-null store.
   */
  public abstract TsdbStore createStore(Config config, MetricRegistry metrics);
}

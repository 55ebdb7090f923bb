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
package net.pgprom.core;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Loads the adapter configuration from the indicated file or with optional overrides. Whatever
 * the source, values missing from it fall back to the "reference" files shipped in the jars of
 * the store implementations.
 */
public class ConfigLoader {
  private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
  private static final ConfigParseOptions DEFAULT_PARSE_OPTIONS = ConfigParseOptions.defaults()
      .setAllowMissing(false);

  private final Config config;

  /**
   * Create a new loader that will provide a configuration loaded from the default (application)
   * file as dictated by the config library.
   *
   * @throws com.typesafe.config.ConfigException.IO if the default config is missing
   */
  public ConfigLoader() {
    this(ConfigFactory.load(DEFAULT_PARSE_OPTIONS));
  }

  /**
   * Create a new loader that will provide the given config instance.
   *
   * @param config The config object that will be provided
   */
  protected ConfigLoader(final Config config) {
    this.config = config.withFallback(
        ConfigFactory.parseResourcesAnySyntax("reference", DEFAULT_PARSE_OPTIONS))
        .resolve();
    LOG.info("Loaded config from {}", config.origin().description());
  }

  private ConfigLoader(final Config config, final Config overrides) {
    this(overrides.withFallback(config));
  }

  /**
   * Create a new loader that will provide a configuration loaded from the default (application)
   * file as dictated by the config library with the provided configuration values overridden.
   *
   * @param overrides The configuration values that should override the default ones
   * @return A newly instantiated loader
   * @throws com.typesafe.config.ConfigException.IO if the default config is missing
   */
  @Nonnull
  public static ConfigLoader defaultWithOverrides(final Map<String, ?> overrides) {
    final Config configOverrides = ConfigFactory.parseMap(overrides, "overrides");
    return new ConfigLoader(ConfigFactory.load(DEFAULT_PARSE_OPTIONS), configOverrides);
  }

  /**
   * Create a new loader that only uses the reference defaults with the provided configuration
   * values overridden. No application file is required.
   *
   * @param overrides The configuration values that should override the default ones
   * @return A newly instantiated loader
   */
  @Nonnull
  public static ConfigLoader referenceWithOverrides(final Map<String, ?> overrides) {
    return new ConfigLoader(ConfigFactory.parseMap(overrides, "overrides"));
  }

  /**
   * Create a new loader that will provide a configuration that has been loaded from the provided
   * file.
   *
   * @param configFile A file object that points to the configuration file to load
   * @return A newly instantiated loader
   * @throws com.typesafe.config.ConfigException.IO if the file is missing
   */
  @Nonnull
  public static ConfigLoader fromFile(final File configFile) {
    return new ConfigLoader(ConfigFactory.parseFileAnySyntax(configFile, DEFAULT_PARSE_OPTIONS));
  }

  @Nonnull
  public Config config() {
    return config;
  }
}

// This file is part of ShardTSDB.
// Copyright (C) 2026  The ShardTSDB Authors.
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
package net.shardtsdb.utils;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

/**
 * ShardTSDB configuration.
 * <p>
 * Holds the user configurable variables of a query node. Defaults are set
 * for every known key in {@link #setDefaults()} after an optional file
 * was loaded, so file and override values always win.
 * <p>
 * The numeric getters throw a NumberFormatException if the property is
 * missing or cannot be parsed.
 * <p>
 * Components that need private tweaks should use the
 * {@link #Config(Config)} copy constructor and never modify the parent.
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** Default total shard count. */
  public static final String SHARDING_TOTAL_SHARDS_KEY =
      "shardtsdb.query.sharding.total_shards";

  /** Prefix of per tenant total shard counts, followed by the tenant. */
  public static final String SHARDING_TENANT_SHARDS_PREFIX =
      SHARDING_TOTAL_SHARDS_KEY + ".";

  /** How long to wait on a fan-out in ms. */
  public static final String SHARDING_TIMEOUT_KEY =
      "shardtsdb.query.sharding.timeout";

  /** Threads of the shard dispatch pool, 0 for an unbounded pool. */
  public static final String SHARDING_FANOUT_THREADS_KEY =
      "shardtsdb.query.sharding.fanout_threads";

  /** The name of the file searched for in the default locations. */
  public static final String DEFAULT_FILE = "shardtsdb.conf";

  /** The properties configured to their defaults or modified by users. */
  protected final Properties properties = new Properties();

  /** Tracks the location of the file that was actually loaded. */
  private String config_location;

  /**
   * Constructor that initializes default configuration values. May attempt
   * to search for a config file if configured.
   * @param auto_load_config When set to true, attempts to search for a
   * config file in the default locations
   * @throws IOException Thrown if unable to read or parse one of the
   * default config files
   */
  public Config(final boolean auto_load_config) throws IOException {
    if (auto_load_config) {
      loadConfig();
    }
    setDefaults();
  }

  /**
   * Constructor that initializes default values and attempts to load the
   * given properties file.
   * @param file Path to the file to load
   * @throws FileNotFoundException Thrown if the file wasn't found
   * @throws IOException Thrown if unable to read or parse the file
   */
  public Config(final String file) throws FileNotFoundException, IOException {
    loadConfig(file);
    setDefaults();
  }

  /**
   * Copy constructor. Does not re-read the file but keeps the location so
   * the copy may reload it.
   * @param parent Parent configuration object to load from
   */
  public Config(final Config parent) {
    // copy so changes to the local props don't affect the parent
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    setDefaults();
  }

  /**
   * Overrides a property. Meant for initialization and tests.
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * @param property The property to load
   * @return The property value or null if missing
   */
  public final String getString(final String property) {
    return properties.getProperty(property);
  }

  /**
   * @param property The property to load
   * @return A parsed integer
   * @throws NumberFormatException if the property is missing or could not
   * be parsed
   */
  public final int getInt(final String property) {
    return Integer.parseInt(trimmed(property));
  }

  /**
   * @param property The property to load
   * @return A parsed long
   * @throws NumberFormatException if the property is missing or could not
   * be parsed
   */
  public final long getLong(final String property) {
    return Long.parseLong(trimmed(property));
  }

  /**
   * @param property The property to load
   * @return A parsed double
   * @throws NumberFormatException if the property is missing or could not
   * be parsed
   */
  public final double getDouble(final String property) {
    return Double.parseDouble(trimmed(property));
  }

  /**
   * Returns the given property as a boolean.
   * <p>
   * Property values are case insensitive and "1", "true" and "yes" result
   * in true. Any other value, including an empty string, is false.
   * @param property The property to load
   * @return A parsed boolean
   * @throws NullPointerException if the property was not found
   */
  public final boolean getBoolean(final String property) {
    final String raw = properties.getProperty(property);
    if (raw == null) {
      throw new NullPointerException("No such property: " + property);
    }
    final String val = raw.trim().toUpperCase();
    return val.equals("1") || val.equals("TRUE") || val.equals("YES");
  }

  /**
   * @param property The property to search for
   * @return True if the property exists and is not an empty string
   */
  public final boolean hasProperty(final String property) {
    return !Strings.isNullOrEmpty(properties.getProperty(property));
  }

  /** @return The path of the loaded file or null. */
  public final String configLocation() {
    return config_location;
  }

  /**
   * @return A string with the configured properties for debugging
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty()) {
      return "No configuration settings stored";
    }
    final StringBuilder response = new StringBuilder("ShardTSDB Configuration:\n")
        .append("File [")
        .append(config_location)
        .append("]\n");
    final Enumeration<?> e = properties.propertyNames();
    while (e.hasMoreElements()) {
      final String key = (String) e.nextElement();
      response.append("Key [")
              .append(key)
              .append("]  Value [")
              .append(properties.getProperty(key))
              .append("]\n");
    }
    return response.toString();
  }

  /**
   * Loads default entries that were not provided by a file or command
   * line. Called from the constructors.
   */
  protected void setDefaults() {
    final Map<String, String> map = new HashMap<String, String>();
    map.put(SHARDING_TOTAL_SHARDS_KEY, "16");
    map.put(SHARDING_TIMEOUT_KEY, "120000");
    map.put(SHARDING_FANOUT_THREADS_KEY, "0");
    for (final Map.Entry<String, String> entry : map.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
  }

  /**
   * Searches a list of locations for a valid shardtsdb.conf file. If none
   * is found the defaults and overrides are used.
   * <p>
   * Locations are ./shardtsdb.conf, /etc/shardtsdb.conf,
   * /etc/shardtsdb/shardtsdb.conf and /opt/shardtsdb/shardtsdb.conf.
   * @throws IOException Thrown if there was an issue reading a file
   */
  protected void loadConfig() throws IOException {
    if (!Strings.isNullOrEmpty(config_location)) {
      loadConfig(config_location);
      return;
    }

    final ArrayList<String> file_locations = new ArrayList<String>();
    file_locations.add(DEFAULT_FILE);
    file_locations.add("/etc/" + DEFAULT_FILE);
    file_locations.add("/etc/shardtsdb/" + DEFAULT_FILE);
    file_locations.add("/opt/shardtsdb/" + DEFAULT_FILE);

    for (final String file : file_locations) {
      final Properties loaded = new Properties();
      try (final InputStream file_stream = new FileInputStream(file)) {
        loaded.load(file_stream);
      } catch (FileNotFoundException e) {
        LOG.debug("Unable to find " + file);
        continue;
      }
      properties.clear();
      properties.putAll(loaded);
      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
      return;
    }
    LOG.info("No configuration found, will use defaults");
  }

  /**
   * Loads the configuration from the given location.
   * @param file Path to the file to load
   * @throws IOException Thrown if there was an issue reading the file
   * @throws FileNotFoundException Thrown if the config file was not found
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    try (final InputStream file_stream = new FileInputStream(file)) {
      properties.clear();
      properties.load(file_stream);
    }
    LOG.info("Successfully loaded configuration file: " + file);
    config_location = file;
  }

  private String trimmed(final String property) {
    final String value = properties.getProperty(property);
    if (value == null) {
      throw new NumberFormatException("No such property: " + property);
    }
    return value.trim();
  }
}

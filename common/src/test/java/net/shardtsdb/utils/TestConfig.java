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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.FileNotFoundException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.io.Files;

import net.shardtsdb.common.Const;

public class TestConfig {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void defaults() throws Exception {
    Config config = new Config(false);
    assertEquals(16, config.getInt(Config.SHARDING_TOTAL_SHARDS_KEY));
    assertEquals(120000, config.getLong(Config.SHARDING_TIMEOUT_KEY));
    assertEquals(0, config.getInt(Config.SHARDING_FANOUT_THREADS_KEY));
    assertNull(config.configLocation());
    assertFalse(config.hasProperty("nope"));
  }

  @Test
  public void overrideConfig() throws Exception {
    Config config = new Config(false);
    config.overrideConfig(Config.SHARDING_TOTAL_SHARDS_KEY, " 4 ");
    config.overrideConfig("some.double", "1.5");
    config.overrideConfig("some.flag", "Yes");
    config.overrideConfig("other.flag", "nope");
    config.overrideConfig("empty", "");

    assertEquals(4, config.getInt(Config.SHARDING_TOTAL_SHARDS_KEY));
    assertEquals(1.5, config.getDouble("some.double"), 0.0001);
    assertTrue(config.getBoolean("some.flag"));
    assertFalse(config.getBoolean("other.flag"));
    assertFalse(config.hasProperty("empty"));
    assertEquals("1.5", config.getString("some.double"));
    assertTrue(config.dumpConfiguration().contains("Key [some.flag]"));
  }

  @Test
  public void missingProperties() throws Exception {
    Config config = new Config(false);
    try {
      config.getInt("nope");
      fail("Expected NumberFormatException");
    } catch (NumberFormatException e) { }

    try {
      config.getLong("nope");
      fail("Expected NumberFormatException");
    } catch (NumberFormatException e) { }

    try {
      config.getBoolean("nope");
      fail("Expected NullPointerException");
    } catch (NullPointerException e) { }

    config.overrideConfig("bad", "x");
    try {
      config.getInt("bad");
      fail("Expected NumberFormatException");
    } catch (NumberFormatException e) { }
  }

  @Test
  public void loadFile() throws Exception {
    File file = folder.newFile("shardtsdb.conf");
    Files.asCharSink(file, Const.UTF8_CHARSET).write(
        Config.SHARDING_TOTAL_SHARDS_KEY + " = 8\n"
        + Config.SHARDING_TENANT_SHARDS_PREFIX + "team-a = 2\n");
    Config config = new Config(file.getPath());
    assertEquals(8, config.getInt(Config.SHARDING_TOTAL_SHARDS_KEY));
    assertEquals(2, config.getInt(
        Config.SHARDING_TENANT_SHARDS_PREFIX + "team-a"));
    // defaults fill in what the file lacks
    assertEquals(120000, config.getLong(Config.SHARDING_TIMEOUT_KEY));
    assertEquals(file.getPath(), config.configLocation());

    Config copy = new Config(config);
    copy.overrideConfig(Config.SHARDING_TOTAL_SHARDS_KEY, "32");
    assertEquals(32, copy.getInt(Config.SHARDING_TOTAL_SHARDS_KEY));
    assertEquals(8, config.getInt(Config.SHARDING_TOTAL_SHARDS_KEY));
    assertEquals(file.getPath(), copy.configLocation());
  }

  @Test
  public void loadMissingFile() throws Exception {
    try {
      new Config(new File(folder.getRoot(), "nope.conf").getPath());
      fail("Expected FileNotFoundException");
    } catch (FileNotFoundException e) { }
  }
}

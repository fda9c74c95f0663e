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
package net.shardtsdb.storage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.shardtsdb.common.Const;
import net.shardtsdb.data.ChunkSeries;
import net.shardtsdb.data.Labels;
import net.shardtsdb.data.SampleIterator;
import net.shardtsdb.data.SeriesSet;
import net.shardtsdb.data.chunk.DeltaChunk;
import net.shardtsdb.query.LabelMatcher;
import net.shardtsdb.query.SelectHints;
import net.shardtsdb.query.sharding.ShardDescriptor;
import net.shardtsdb.utils.Config;

public class TestMockDataStore {
  private static final long BASE_TIME = 1483228800000L;
  private static final SelectHints ALL = new SelectHints(BASE_TIME,
      BASE_TIME + 2 * MockDataStore.ROW_WIDTH, 60000);

  private Config config;

  @Before
  public void before() throws Exception {
    config = new Config(false);
    config.overrideConfig(MockDataStore.TIMESTAMP_KEY,
        Long.toString(BASE_TIME));
    config.overrideConfig(MockDataStore.HOURS_KEY, "2");
  }

  @Test
  public void ctor() throws Exception {
    try {
      new MockDataStore(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    config.overrideConfig(MockDataStore.REPLICAS_KEY, "0");
    try {
      new MockDataStore(config);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    config.overrideConfig(MockDataStore.REPLICAS_KEY, "1");
    config.overrideConfig(MockDataStore.INTERVAL_KEY, "0");
    try {
      new MockDataStore(config);
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }

  @Test
  public void generate() throws Exception {
    final MockDataStore store = new MockDataStore(config);
    assertEquals(BASE_TIME, store.startTimestamp());
    assertEquals(MockDataStore.METRICS.size()
        * MockDataStore.DATACENTERS.size() * MockDataStore.HOSTS,
        store.seriesCount());

    assertFalse(new MockDataStore(config, false).seriesCount() > 0);
  }

  @Test
  public void selectByMetric() throws Exception {
    final MockDataStore store = new MockDataStore(config);
    final SeriesSet set = store.select(ALL, Lists.newArrayList(
        LabelMatcher.equal(Const.METRIC_NAME_LABEL, "sys_cpu_user")));
    Labels previous = null;
    int series = 0;
    while (set.next()) {
      final ChunkSeries at = (ChunkSeries) set.at();
      assertEquals("sys_cpu_user", at.labels().get(Const.METRIC_NAME_LABEL));
      if (previous != null) {
        assertTrue(previous.compareTo(at.labels()) < 0);
      }
      previous = at.labels();
      assertEquals(2, at.chunks().size());

      final SampleIterator it = at.iterator();
      assertTrue(it.next());
      assertEquals(BASE_TIME, it.timestamp());
      final int host = Integer.parseInt(at.labels().get("host")
          .substring(3)) - 1;
      assertEquals(host, it.value(), 0.0001);
      int samples = 1;
      while (it.next()) {
        samples++;
      }
      assertNull(it.error());
      assertEquals(120, samples);
      series++;
    }
    assertNull(set.error());
    assertEquals(16, series);
  }

  @Test
  public void selectRegex() throws Exception {
    final MockDataStore store = new MockDataStore(config);
    final SeriesSet set = store.select(ALL, Lists.newArrayList(
        LabelMatcher.equal(Const.METRIC_NAME_LABEL, "web_requests"),
        new LabelMatcher(LabelMatcher.Type.REGEX, "dc", "L.*"),
        new LabelMatcher(LabelMatcher.Type.NOT_EQUAL, "host", "web01")));
    int series = 0;
    while (set.next()) {
      assertTrue(set.at().labels().get("dc").startsWith("L"));
      assertFalse(set.at().labels().get("host").equals("web01"));
      series++;
    }
    assertEquals(6, series);
  }

  @Test
  public void selectTimeRange() throws Exception {
    final MockDataStore store = new MockDataStore(config);
    final SeriesSet set = store.select(new SelectHints(BASE_TIME,
        BASE_TIME + 1800000, 60000), Lists.newArrayList(
            LabelMatcher.equal(Const.METRIC_NAME_LABEL, "sys_if_in")));
    assertTrue(set.next());
    assertEquals(1, ((ChunkSeries) set.at()).chunks().size());

    final SeriesSet none = store.select(new SelectHints(
        BASE_TIME + 3 * MockDataStore.ROW_WIDTH,
        BASE_TIME + 4 * MockDataStore.ROW_WIDTH, 60000), Lists.newArrayList(
            LabelMatcher.equal(Const.METRIC_NAME_LABEL, "sys_if_in")));
    assertFalse(none.next());
    assertNull(none.error());
  }

  @Test
  public void selectByShard() throws Exception {
    final MockDataStore store = new MockDataStore(config);
    final Set<Labels> seen = Sets.newHashSet();
    int total = 0;
    for (int i = 0; i < 3; i++) {
      final ShardDescriptor shard = new ShardDescriptor(i, 3);
      final SeriesSet set = store.select(ALL, Lists.newArrayList(
          LabelMatcher.equal(Const.METRIC_NAME_LABEL, "sys_cpu_user"),
          shard.matcher()));
      while (set.next()) {
        assertTrue(shard.owns(set.at().labels()));
        assertTrue(seen.add(set.at().labels()));
        assertNull(set.at().labels().get(Const.QUERY_SHARD_LABEL));
        total++;
      }
      assertNull(set.error());
    }
    assertEquals(16, total);
  }

  @Test
  public void selectBadShardMatcher() throws Exception {
    final MockDataStore store = new MockDataStore(config);
    final SeriesSet set = store.select(ALL, Lists.newArrayList(
        LabelMatcher.equal(Const.METRIC_NAME_LABEL, "sys_cpu_user"),
        new LabelMatcher(LabelMatcher.Type.REGEX, Const.QUERY_SHARD_LABEL,
            "1_of_.*")));
    assertFalse(set.next());
    assertTrue(set.error() instanceof IllegalArgumentException);
  }

  @Test
  public void replicasAreDeduplicated() throws Exception {
    config.overrideConfig(MockDataStore.REPLICAS_KEY, "3");
    final MockDataStore store = new MockDataStore(config);
    final SeriesSet set = store.select(ALL, Lists.newArrayList(
        LabelMatcher.equal(Const.METRIC_NAME_LABEL, "sys_cpu_user"),
        LabelMatcher.equal("dc", "PHX"),
        LabelMatcher.equal("host", "web01")));
    assertTrue(set.next());
    final ChunkSeries series = (ChunkSeries) set.at();
    assertEquals(6, series.chunks().size());
    final SampleIterator it = series.iterator();
    int samples = 0;
    long last = Long.MIN_VALUE;
    while (it.next()) {
      assertTrue(it.timestamp() > last);
      last = it.timestamp();
      samples++;
    }
    assertEquals(120, samples);
    assertFalse(set.next());
  }

  @Test
  public void write() throws Exception {
    final MockDataStore store = new MockDataStore(config, false);
    final Labels labels = Labels.of(Const.METRIC_NAME_LABEL, "up",
        "job", "api");
    store.write(labels, BASE_TIME, 1);
    store.write(labels, BASE_TIME + 15000, 2);
    store.write(labels, BASE_TIME + MockDataStore.ROW_WIDTH, 3);
    assertEquals(1, store.seriesCount());

    try {
      store.write(labels, BASE_TIME + 1000, 4);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    final SeriesSet set = store.select(ALL, Lists.newArrayList(
        LabelMatcher.equal("job", "api")));
    assertTrue(set.next());
    assertEquals(2, ((ChunkSeries) set.at()).chunks().size());
    final List<Long> timestamps = Lists.newArrayList();
    final SampleIterator it = set.at().iterator();
    while (it.next()) {
      timestamps.add(it.timestamp());
    }
    assertEquals(Lists.newArrayList(BASE_TIME, BASE_TIME + 15000,
        BASE_TIME + MockDataStore.ROW_WIDTH), timestamps);
  }

  @Test
  public void addChunk() throws Exception {
    final MockDataStore store = new MockDataStore(config, false);
    final Labels labels = Labels.of(Const.METRIC_NAME_LABEL, "up");
    final DeltaChunk.Appender appender = DeltaChunk.newAppender();
    appender.append(BASE_TIME + 30000, 7);
    appender.append(BASE_TIME + 60000, 8);
    store.write(labels, BASE_TIME, 6);
    store.addChunk(labels, appender.build());

    final SeriesSet set = store.select(ALL, Lists.newArrayList(
        LabelMatcher.equal(Const.METRIC_NAME_LABEL, "up")));
    assertTrue(set.next());
    assertEquals(2, ((ChunkSeries) set.at()).chunks().size());
    final SampleIterator it = set.at().iterator();
    final List<Double> values = Lists.newArrayList();
    while (it.next()) {
      values.add(it.value());
    }
    assertEquals(Lists.newArrayList(6.0, 7.0, 8.0), values);
  }
}

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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.shardtsdb.common.Const;
import net.shardtsdb.data.Chunk;
import net.shardtsdb.data.ChunkSeries;
import net.shardtsdb.data.Labels;
import net.shardtsdb.data.SeriesSet;
import net.shardtsdb.data.chunk.DeltaChunk;
import net.shardtsdb.data.iterators.ChunkSeriesSet;
import net.shardtsdb.data.iterators.SeriesSets;
import net.shardtsdb.query.LabelMatcher;
import net.shardtsdb.query.Queryable;
import net.shardtsdb.query.SelectHints;
import net.shardtsdb.query.sharding.ShardDescriptor;
import net.shardtsdb.utils.Config;

/**
 * A simple store that generates a set of series to query as well as stores
 * new values (must be written in time order) all in memory. It's meant for
 * testing the query path.
 * <p>
 * Each series is kept as one chunk per {@link #ROW_WIDTH} row. With more
 * than one replica every chunk is returned once per replica, the way
 * overlapping blocks would be, so readers have to deduplicate.
 * <p>
 * Selecting with a shard matcher returns only the series owned by that
 * shard.
 */
public class MockDataStore implements Queryable {
  private static final Logger LOG = LoggerFactory.getLogger(
      MockDataStore.class);

  public static final long ROW_WIDTH = 3600000;
  public static final long HOSTS = 4;
  public static final long INTERVAL = 60000;
  public static final long HOURS = 24;
  public static final List<String> DATACENTERS = Lists.newArrayList(
      "PHX", "LGA", "LAX", "DEN");
  public static final List<String> METRICS = Lists.newArrayList(
      "sys_cpu_user", "sys_if_out", "sys_if_in", "web_requests");

  public static final String TIMESTAMP_KEY = "MockDataStore.timestamp";
  public static final String HOURS_KEY = "MockDataStore.hours";
  public static final String HOSTS_KEY = "MockDataStore.hosts";
  public static final String INTERVAL_KEY = "MockDataStore.interval";
  public static final String REPLICAS_KEY = "MockDataStore.replicas";

  /** The super inefficient in-memory db. Guarded by itself. */
  private final Map<Labels, MockSpan> database = Maps.newTreeMap();

  private final int replicas;

  /** The first generated timestamp. */
  private final long start_timestamp;

  /**
   * Ctor generating mock data.
   * @param config The config to read the MockDataStore keys from.
   */
  public MockDataStore(final Config config) {
    this(config, true);
  }

  /**
   * Default ctor.
   * @param config The config to read the MockDataStore keys from.
   * @param generate Whether to populate the store with mock data.
   */
  public MockDataStore(final Config config, final boolean generate) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    long start = System.currentTimeMillis() - 2 * ROW_WIDTH;
    start = start - start % ROW_WIDTH;
    if (config.hasProperty(TIMESTAMP_KEY)) {
      start = config.getLong(TIMESTAMP_KEY);
    }
    start_timestamp = start;
    replicas = config.hasProperty(REPLICAS_KEY)
        ? config.getInt(REPLICAS_KEY) : 1;
    if (replicas < 1) {
      throw new IllegalArgumentException("Replicas must be at least 1.");
    }
    if (generate) {
      generateMockData(config);
    }
  }

  /**
   * Writes a value. Values of a series must be written in time order.
   * @param labels The series labels.
   * @param timestamp The timestamp in ms.
   * @param value The value.
   * @throws IllegalArgumentException if the value is out of order.
   */
  public void write(final Labels labels,
                    final long timestamp,
                    final double value) {
    synchronized (database) {
      MockSpan span = database.get(labels);
      if (span == null) {
        span = new MockSpan();
        database.put(labels, span);
      }
      span.addValue(timestamp, value);
    }
  }

  /**
   * Stores an already encoded chunk as is, next to whatever the series
   * holds.
   * @param labels The series labels.
   * @param chunk The chunk.
   */
  public void addChunk(final Labels labels, final Chunk chunk) {
    synchronized (database) {
      MockSpan span = database.get(labels);
      if (span == null) {
        span = new MockSpan();
        database.put(labels, span);
      }
      span.extra_chunks.add(chunk);
    }
  }

  /** @return The timestamp of the first generated sample. */
  public long startTimestamp() {
    return start_timestamp;
  }

  /** @return The number of series stored. */
  public int seriesCount() {
    synchronized (database) {
      return database.size();
    }
  }

  @Override
  public SeriesSet select(final SelectHints hints,
                          final List<LabelMatcher> matchers) {
    final ShardDescriptor shard;
    try {
      shard = ShardDescriptor.fromMatchers(matchers);
    } catch (IllegalArgumentException e) {
      return SeriesSets.error(e);
    }

    final List<ChunkSeries> results = Lists.newArrayList();
    synchronized (database) {
      for (final Map.Entry<Labels, MockSpan> entry : database.entrySet()) {
        if (!matches(entry.getKey(), matchers)) {
          continue;
        }
        if (shard != null && !shard.owns(entry.getKey())) {
          continue;
        }
        final List<Chunk> chunks = entry.getValue().chunks(hints.start(),
            hints.end());
        if (chunks.isEmpty()) {
          continue;
        }
        results.add(new ChunkSeries(entry.getKey(), chunks));
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Selected " + results.size() + " series for " + matchers
          + " " + hints);
    }
    return new ChunkSeriesSet(results);
  }

  private static boolean matches(final Labels labels,
                                 final List<LabelMatcher> matchers) {
    for (final LabelMatcher matcher : matchers) {
      if (matcher.name().equals(Const.QUERY_SHARD_LABEL)) {
        continue;
      }
      if (!matcher.matches(labels)) {
        return false;
      }
    }
    return true;
  }

  private void generateMockData(final Config config) {
    final long hours = config.hasProperty(HOURS_KEY)
        ? config.getLong(HOURS_KEY) : HOURS;
    final long hosts = config.hasProperty(HOSTS_KEY)
        ? config.getLong(HOSTS_KEY) : HOSTS;
    long interval = INTERVAL;
    if (config.hasProperty(INTERVAL_KEY)) {
      interval = config.getLong(INTERVAL_KEY);
      if (interval <= 0) {
        throw new IllegalStateException("Interval can't be 0 or less.");
      }
    }

    for (int t = 0; t < hours; t++) {
      for (final String metric : METRICS) {
        for (final String dc : DATACENTERS) {
          for (int h = 0; h < hosts; h++) {
            final Labels labels = Labels.of(
                Const.METRIC_NAME_LABEL, metric,
                "dc", dc,
                "host", String.format("web%02d", h + 1));
            for (long i = 0; i < (ROW_WIDTH / interval); i++) {
              write(labels, start_timestamp + (i * interval) + (t * ROW_WIDTH),
                  t + h + i);
            }
          }
        }
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Generated " + database.size() + " mock series over "
          + hours + " hours");
    }
  }

  /** The rows of one series. */
  private class MockSpan {
    private final List<MockRow> rows = Lists.newArrayList();
    private final List<Chunk> extra_chunks = Lists.newArrayList();

    void addValue(final long timestamp, final double value) {
      final long base_time = timestamp - Math.floorMod(timestamp, ROW_WIDTH);
      for (final MockRow row : rows) {
        if (row.base_timestamp == base_time) {
          row.appender.append(timestamp, value);
          row.chunk = null;
          return;
        }
      }
      final MockRow row = new MockRow(base_time);
      row.appender.append(timestamp, value);
      rows.add(row);
    }

    List<Chunk> chunks(final long start, final long end) {
      final List<Chunk> chunks = Lists.newArrayList();
      for (final MockRow row : rows) {
        final Chunk chunk = row.chunk();
        if (chunk.maxTime() >= start && chunk.minTime() <= end) {
          for (int i = 0; i < replicas; i++) {
            chunks.add(chunk);
          }
        }
      }
      for (final Chunk chunk : extra_chunks) {
        if (chunk.maxTime() >= start && chunk.minTime() <= end) {
          chunks.add(chunk);
        }
      }
      return chunks.isEmpty() ? Collections.<Chunk>emptyList() : chunks;
    }
  }

  /** One {@link #ROW_WIDTH} of a series. */
  private static class MockRow {
    private final long base_timestamp;
    private final DeltaChunk.Appender appender = DeltaChunk.newAppender();
    private DeltaChunk chunk;

    MockRow(final long base_timestamp) {
      this.base_timestamp = base_timestamp;
    }

    DeltaChunk chunk() {
      if (chunk == null) {
        chunk = appender.build();
      }
      return chunk;
    }
  }
}

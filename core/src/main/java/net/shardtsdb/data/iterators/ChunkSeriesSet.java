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
package net.shardtsdb.data.iterators;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.shardtsdb.data.Chunk;
import net.shardtsdb.data.ChunkSeries;
import net.shardtsdb.data.ChunkedSeries;
import net.shardtsdb.data.Labels;
import net.shardtsdb.data.SeriesSet;

/**
 * A series set over label sorted storage entries. Storage may return the
 * same series as several consecutive entries, e.g. one per block, so
 * consecutive entries with equal labels are pooled into one series.
 */
public class ChunkSeriesSet implements SeriesSet {
  private final List<ChunkedSeries> entries;
  private final List<String> warnings;
  private int next_idx;
  private ChunkSeries current;

  /**
   * @param entries Entries sorted by labels, equal labels adjacent.
   */
  public ChunkSeriesSet(final List<? extends ChunkedSeries> entries) {
    this(entries, Collections.<String>emptyList());
  }

  public ChunkSeriesSet(final List<? extends ChunkedSeries> entries,
                        final Collection<String> warnings) {
    if (entries == null) {
      throw new IllegalArgumentException("Entries cannot be null.");
    }
    this.entries = ImmutableList.copyOf(entries);
    this.warnings = warnings == null ? Collections.<String>emptyList()
        : ImmutableList.copyOf(warnings);
  }

  @Override
  public boolean next() {
    if (next_idx >= entries.size()) {
      current = null;
      return false;
    }
    final Labels labels = entries.get(next_idx).labels();
    final List<Chunk> chunks = Lists.newArrayList(entries.get(next_idx).chunks());
    next_idx++;
    while (next_idx < entries.size()
        && entries.get(next_idx).labels().equals(labels)) {
      chunks.addAll(entries.get(next_idx).chunks());
      next_idx++;
    }
    current = new ChunkSeries(labels, chunks);
    return true;
  }

  @Override
  public ChunkSeries at() {
    return current;
  }

  @Override
  public Exception error() {
    return null;
  }

  @Override
  public Collection<String> warnings() {
    return warnings;
  }
}

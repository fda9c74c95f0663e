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
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.shardtsdb.data.Chunk;
import net.shardtsdb.data.ChunkSeries;
import net.shardtsdb.data.ChunkedSeries;
import net.shardtsdb.data.Labels;
import net.shardtsdb.data.Series;
import net.shardtsdb.data.SeriesSet;

/**
 * Merges label sorted series sets into one label sorted set.
 * <p>
 * A series present in a single input passes through untouched. A series
 * present in several inputs is emitted once with the chunks of every
 * input pooled into a single {@link ChunkSeries}, so its points are merged
 * and deduplicated by {@link SeriesMergeIterator}. Inputs must therefore
 * hold {@link ChunkedSeries}.
 * <p>
 * An error in any input ends the merged set with that error.
 */
public class MergingSeriesSet implements SeriesSet {
  private final List<SeriesSet> sets;
  private final PriorityQueue<Head> heads;
  private boolean initialized;
  private Series current;
  private Exception error;

  public MergingSeriesSet(final List<? extends SeriesSet> sets) {
    if (sets == null) {
      throw new IllegalArgumentException("Sets cannot be null.");
    }
    this.sets = ImmutableList.copyOf(sets);
    heads = new PriorityQueue<Head>(Math.max(1, sets.size()));
  }

  @Override
  public boolean next() {
    if (error != null) {
      return false;
    }
    if (!initialized) {
      initialized = true;
      for (int i = 0; i < sets.size(); i++) {
        if (!advance(i)) {
          return false;
        }
      }
    }
    if (heads.isEmpty()) {
      current = null;
      return false;
    }

    final Head first = heads.poll();
    final List<Head> same = Lists.newArrayList(first);
    while (!heads.isEmpty() && heads.peek().labels.equals(first.labels)) {
      same.add(heads.poll());
    }

    if (same.size() == 1) {
      current = first.series;
    } else {
      final List<Chunk> chunks = Lists.newArrayList();
      for (final Head head : same) {
        if (!(head.series instanceof ChunkedSeries)) {
          error = new IllegalStateException("Cannot merge series "
              + head.labels + " that is not backed by chunks: "
              + head.series.getClass());
          current = null;
          return false;
        }
        chunks.addAll(((ChunkedSeries) head.series).chunks());
      }
      current = new ChunkSeries(first.labels, chunks);
    }

    for (final Head head : same) {
      if (!advance(head.index)) {
        current = null;
        return false;
      }
    }
    return true;
  }

  @Override
  public Series at() {
    return current;
  }

  @Override
  public Exception error() {
    return error;
  }

  @Override
  public Collection<String> warnings() {
    final Set<String> warnings = Sets.newTreeSet();
    for (final SeriesSet set : sets) {
      warnings.addAll(set.warnings());
    }
    return warnings;
  }

  /**
   * Moves input {@code idx} forward and queues its next series.
   * @return False if the input failed.
   */
  private boolean advance(final int idx) {
    final SeriesSet set = sets.get(idx);
    if (set.next()) {
      final Series series = set.at();
      heads.add(new Head(idx, series));
      return true;
    }
    if (set.error() != null) {
      error = set.error();
      return false;
    }
    return true;
  }

  /** The current series of one input. */
  private static class Head implements Comparable<Head> {
    private final int index;
    private final Series series;
    private final Labels labels;

    Head(final int index, final Series series) {
      this.index = index;
      this.series = series;
      labels = series.labels();
    }

    @Override
    public int compareTo(final Head other) {
      return ComparisonChain.start()
          .compare(labels, other.labels)
          .compare(index, other.index)
          .result();
    }
  }
}

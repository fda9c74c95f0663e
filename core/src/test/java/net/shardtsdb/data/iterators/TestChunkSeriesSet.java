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

import static net.shardtsdb.data.iterators.TestSeriesMergeIterator.chunk;
import static net.shardtsdb.data.iterators.TestSeriesMergeIterator.sineChunk;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.shardtsdb.data.Chunk;
import net.shardtsdb.data.ChunkSeries;
import net.shardtsdb.data.ChunkedSeries;
import net.shardtsdb.data.Labels;
import net.shardtsdb.data.SampleIterator;
import net.shardtsdb.data.Series;

public class TestChunkSeriesSet {
  private static final long NOW = 1700000000000L;
  private static final int[] CALL_AT_EVERY = new int[] { 1, 3, 100, 971, 1000 };

  /** How a verification loop moves the iterator to the wanted timestamp. */
  private static interface Advance {
    boolean advance(final SampleIterator it, final long want_ts);
  }

  private static class NextAdvance implements Advance {
    @Override
    public boolean advance(final SampleIterator it, final long want_ts) {
      return it.next();
    }
  }

  private static class SeekAdvance implements Advance {
    @Override
    public boolean advance(final SampleIterator it, final long want_ts) {
      return it.seek(want_ts);
    }
  }

  private static class AlternatingAdvance implements Advance {
    private boolean seek;

    @Override
    public boolean advance(final SampleIterator it, final long want_ts) {
      seek = !seek;
      if (seek) {
        return it.seek(want_ts);
      }
      return it.next();
    }
  }

  @Test
  public void consumeWithNext() throws Exception {
    for (final int every : CALL_AT_EVERY) {
      verifySet(every, new NextAdvance());
    }
  }

  @Test
  public void consumeWithSeek() throws Exception {
    for (final int every : CALL_AT_EVERY) {
      verifySet(every, new SeekAdvance());
    }
  }

  @Test
  public void consumeAlternating() throws Exception {
    for (final int every : CALL_AT_EVERY) {
      verifySet(every, new AlternatingAdvance());
    }
  }

  @Test
  public void emptySet() throws Exception {
    final ChunkSeriesSet set = new ChunkSeriesSet(
        Collections.<ChunkedSeries>emptyList());
    assertFalse(set.next());
    assertNull(set.at());
    assertNull(set.error());
    assertTrue(set.warnings().isEmpty());
  }

  @Test
  public void warnings() throws Exception {
    final ChunkSeriesSet set = new ChunkSeriesSet(
        Collections.<ChunkedSeries>emptyList(),
        Lists.newArrayList("partial data"));
    assertEquals(Lists.newArrayList("partial data"),
        Lists.newArrayList(set.warnings()));
    assertTrue(new ChunkSeriesSet(Collections.<ChunkedSeries>emptyList(), null)
        .warnings().isEmpty());
  }

  @Test
  public void warningsFromSortedSet() throws Exception {
    final ChunkSeriesSet set = new ChunkSeriesSet(
        Collections.<ChunkedSeries>emptyList(),
        Sets.newTreeSet(Lists.newArrayList("b", "a")));
    assertEquals(Lists.newArrayList("a", "b"),
        Lists.newArrayList(set.warnings()));
  }

  @Test
  public void ctorNull() throws Exception {
    try {
      new ChunkSeriesSet(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void poolsConsecutiveEntries() throws Exception {
    final Labels a = Labels.of("__name__", "a");
    final Labels b = Labels.of("__name__", "b");
    final ChunkSeriesSet set = new ChunkSeriesSet(Lists.newArrayList(
        new ChunkSeries(a, Lists.newArrayList(chunk(1, 1))),
        new ChunkSeries(a, Lists.newArrayList(chunk(2, 2), chunk(3, 3))),
        new ChunkSeries(b, Lists.newArrayList(chunk(1, 1)))));
    assertTrue(set.next());
    assertEquals(a, set.at().labels());
    assertEquals(3, set.at().chunks().size());
    assertTrue(set.next());
    assertEquals(b, set.at().labels());
    assertEquals(1, set.at().chunks().size());
    assertFalse(set.next());
  }

  private void verifySet(final int call_at_every, final Advance advance) {
    final ChunkSeriesSet set = buildSet();
    verifyNextSeries(set, Labels.of("__name__", "first", "a", "a"), 3,
        new long[][] { { NOW, NOW + 99999 }, { NOW + 100000, NOW + 199999 } },
        66668, call_at_every, advance);
    verifyNextSeries(set, Labels.of("__name__", "second"), 5,
        new long[][] { { NOW, NOW + 599995 } },
        120000, call_at_every, advance);
    verifyNextSeries(set, Labels.of("__name__", "overlapping"), 5,
        new long[][] { { NOW, NOW + 14995 } },
        3000, call_at_every, advance);
    verifyNextSeries(set, Labels.of("__name__", "overlapping2"), 5,
        new long[][] { { NOW, NOW + 9995 }, { NOW + 20000, NOW + 29995 } },
        4000, call_at_every, advance);
    verifyNextSeries(set, Labels.of("__name__", "many_empty_chunks"), 5,
        new long[][] { { NOW, NOW + 29995 } },
        6000, call_at_every, advance);
    verifyNextSeries(set, Labels.of("__name__",
        "overlapping_chunks_with_additional_samples_in_sequence"), 1,
        new long[][] { { NOW, NOW + 7 } },
        8, call_at_every, advance);
    assertFalse(set.next());
    assertNull(set.error());
  }

  private static void verifyNextSeries(final ChunkSeriesSet set,
                                       final Labels labels,
                                       final long step,
                                       final long[][] ranges,
                                       final int samples,
                                       final int call_at_every,
                                       final Advance advance) {
    assertTrue(set.next());
    final Series series = set.at();
    assertEquals(labels, series.labels());

    int count = 0;
    final SampleIterator it = series.iterator();
    for (final long[] range : ranges) {
      for (long want = range[0]; want <= range[1]; want += step) {
        assertTrue("Missing " + want + " in " + labels,
            advance.advance(it, want));
        if (count % call_at_every == 0) {
          assertEquals(want, it.timestamp());
          assertEquals(Math.sin(want), it.value(), 0.0);
        }
        count++;
      }
    }
    assertEquals(samples, count);
    assertNull(it.error());
  }

  private static ChunkSeriesSet buildSet() {
    final List<ChunkSeries> entries = Lists.newArrayList();
    final Labels first = Labels.of("__name__", "first", "a", "a");
    entries.add(series(first, sineChunk(NOW, NOW + 99999, 3)));
    // continuation with the exact same labels
    entries.add(series(first, sineChunk(NOW + 100000, NOW + 199999, 3)));

    entries.add(series(Labels.of("__name__", "second"),
        sineChunk(NOW + 400000, NOW + 599995, 5),
        sineChunk(NOW + 200000, NOW + 399995, 5),
        sineChunk(NOW, NOW + 199995, 5)));

    final Labels overlapping = Labels.of("__name__", "overlapping");
    entries.add(series(overlapping, sineChunk(NOW, NOW + 9995, 5)));
    entries.add(series(overlapping, sineChunk(NOW + 5000, NOW + 14995, 5)));

    final Labels overlapping2 = Labels.of("__name__", "overlapping2");
    entries.add(series(overlapping2, sineChunk(NOW + 3000, NOW + 6995, 5)));
    entries.add(series(overlapping2, sineChunk(NOW, NOW + 9995, 5)));
    entries.add(series(overlapping2, sineChunk(NOW, NOW - 5, 5)));
    entries.add(series(overlapping2, sineChunk(NOW + 20000, NOW + 29995, 5)));

    entries.add(series(Labels.of("__name__", "many_empty_chunks"),
        sineChunk(NOW, NOW - 5, 5),
        sineChunk(NOW, NOW + 9995, 5),
        sineChunk(NOW + 10000, NOW + 9995, 5),
        sineChunk(NOW + 10000, NOW + 9995, 5),
        sineChunk(NOW + 10000, NOW + 19995, 5),
        sineChunk(NOW + 20000, NOW + 19995, 5),
        sineChunk(NOW + 20000, NOW + 19995, 5),
        sineChunk(NOW + 20000, NOW + 19995, 5),
        sineChunk(NOW + 20000, NOW + 29995, 5),
        sineChunk(NOW + 30000, NOW + 29995, 5)));

    entries.add(series(Labels.of("__name__",
        "overlapping_chunks_with_additional_samples_in_sequence"),
        sineChunk(NOW, NOW + 1, 1),
        sineChunk(NOW, NOW + 2, 1),
        sineChunk(NOW, NOW + 3, 1),
        sineChunk(NOW, NOW + 4, 1),
        sineChunk(NOW + 5, NOW + 5, 1),
        sineChunk(NOW + 5, NOW + 6, 1),
        sineChunk(NOW + 5, NOW + 7, 1)));
    return new ChunkSeriesSet(entries);
  }

  private static ChunkSeries series(final Labels labels, final Chunk... chunks) {
    return new ChunkSeries(labels, Lists.newArrayList(chunks));
  }
}

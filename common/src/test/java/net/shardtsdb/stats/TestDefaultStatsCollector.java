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
package net.shardtsdb.stats;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.shardtsdb.stats.DefaultStatsCollector.DefaultCounter;
import net.shardtsdb.stats.DefaultStatsCollector.DefaultHistogram;

public class TestDefaultStatsCollector {

  @Test
  public void counters() throws Exception {
    DefaultStatsCollector stats = new DefaultStatsCollector();
    DefaultCounter counter = stats.counter("queries", "Queries served.");
    assertSame(counter, stats.counter("queries", "ignored"));
    assertEquals("Queries served.", counter.description());

    counter.increment();
    counter.add(41);
    assertEquals(42, counter.value());
    assertEquals(42, stats.counterValue("queries"));
    assertEquals(0, stats.counterValue("nope"));

    try {
      counter.add(-1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void prefix() throws Exception {
    DefaultStatsCollector stats = new DefaultStatsCollector("tsd");
    stats.counter("queries", "Queries served.").increment();
    assertEquals(1, stats.counterValue("queries"));
    stats.dump();
  }

  @Test
  public void histograms() throws Exception {
    DefaultStatsCollector stats = new DefaultStatsCollector();
    assertNull(stats.getHistogram("per_query"));
    DefaultHistogram histogram = stats.histogram("per_query", "Per query.");
    assertSame(histogram, stats.getHistogram("per_query"));

    for (int i = 1; i <= 100; i++) {
      histogram.observe(i);
    }
    assertEquals(100, histogram.count());
    assertEquals(100, histogram.max(), 0.0001);
    assertEquals(5050, histogram.sum(), 0.0001);
    assertEquals(50.5, histogram.percentile(50), 0.0001);
  }

  @Test
  public void histogramWindow() throws Exception {
    DefaultHistogram histogram = new DefaultStatsCollector()
        .histogram("h", "h");
    for (int i = 0; i < DefaultStatsCollector.WINDOW_SIZE + 10; i++) {
      histogram.observe(1);
    }
    assertEquals(DefaultStatsCollector.WINDOW_SIZE + 10, histogram.count());
    assertEquals(DefaultStatsCollector.WINDOW_SIZE, histogram.sum(), 0.0001);
  }
}

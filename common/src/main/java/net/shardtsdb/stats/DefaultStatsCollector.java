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

import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Maps;

/**
 * An in-process collector. Counters live on atomics and histograms keep a
 * bounded window of observations in {@link DescriptiveStatistics}.
 */
public class DefaultStatsCollector implements StatsCollector {
  private static final Logger LOG = LoggerFactory.getLogger(
      DefaultStatsCollector.class);

  /** How many observations a histogram keeps. */
  public static final int WINDOW_SIZE = 1024;

  private final String prefix;
  private final ConcurrentMap<String, DefaultCounter> counters =
      Maps.newConcurrentMap();
  private final ConcurrentMap<String, DefaultHistogram> histograms =
      Maps.newConcurrentMap();

  public DefaultStatsCollector() {
    this("");
  }

  /**
   * @param prefix A prefix added to every metric name, e.g. {@code tsd}.
   */
  public DefaultStatsCollector(final String prefix) {
    this.prefix = prefix == null ? "" : prefix;
  }

  @Override
  public DefaultCounter counter(final String name, final String description) {
    final String key = key(name);
    DefaultCounter counter = counters.get(key);
    if (counter == null) {
      counter = new DefaultCounter(description);
      final DefaultCounter extant = counters.putIfAbsent(key, counter);
      if (extant != null) {
        counter = extant;
      }
    }
    return counter;
  }

  @Override
  public DefaultHistogram histogram(final String name,
                                    final String description) {
    final String key = key(name);
    DefaultHistogram histogram = histograms.get(key);
    if (histogram == null) {
      histogram = new DefaultHistogram(description);
      final DefaultHistogram extant = histograms.putIfAbsent(key, histogram);
      if (extant != null) {
        histogram = extant;
      }
    }
    return histogram;
  }

  /**
   * @param name The metric name without the prefix.
   * @return The counter value or 0 if the counter was never created.
   */
  public long counterValue(final String name) {
    final DefaultCounter counter = counters.get(key(name));
    return counter == null ? 0 : counter.value();
  }

  /**
   * @param name The metric name without the prefix.
   * @return The histogram or null if it was never created.
   */
  public DefaultHistogram getHistogram(final String name) {
    return histograms.get(key(name));
  }

  /** Logs every metric at INFO. */
  public void dump() {
    for (final Map.Entry<String, DefaultCounter> entry : counters.entrySet()) {
      LOG.info(entry.getKey() + " " + entry.getValue().value());
    }
    for (final Map.Entry<String, DefaultHistogram> entry
        : histograms.entrySet()) {
      final DefaultHistogram histogram = entry.getValue();
      LOG.info(entry.getKey() + " count=" + histogram.count()
          + " 50pct=" + histogram.percentile(50)
          + " 95pct=" + histogram.percentile(95)
          + " max=" + histogram.max());
    }
  }

  private String key(final String name) {
    return prefix.isEmpty() ? name : prefix + "." + name;
  }

  public static class DefaultCounter implements Counter {
    private final String description;
    private final AtomicLong value = new AtomicLong();

    DefaultCounter(final String description) {
      this.description = description;
    }

    @Override
    public void increment() {
      value.incrementAndGet();
    }

    @Override
    public void add(final long value) {
      if (value < 0) {
        throw new IllegalArgumentException("Counters cannot decrease.");
      }
      this.value.addAndGet(value);
    }

    public long value() {
      return value.get();
    }

    public String description() {
      return description;
    }
  }

  public static class DefaultHistogram implements Histogram {
    private final String description;
    private final DescriptiveStatistics stats =
        new DescriptiveStatistics(WINDOW_SIZE);
    private long count;

    DefaultHistogram(final String description) {
      this.description = description;
    }

    @Override
    public synchronized void observe(final double value) {
      stats.addValue(value);
      count++;
    }

    /** @return The total number of observations, not just the window. */
    public synchronized long count() {
      return count;
    }

    public synchronized double percentile(final double p) {
      return stats.getPercentile(p);
    }

    public synchronized double max() {
      return stats.getMax();
    }

    public synchronized double sum() {
      return stats.getSum();
    }

    public String description() {
      return description;
    }
  }
}

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

/**
 * Hands out metric handles. Components fetch their handles once and keep
 * them, so lookups stay off the request path. Asking twice for the same
 * name returns the same handle.
 */
public interface StatsCollector {

  /**
   * @param name The metric name.
   * @param description A description of the metric.
   * @return A monotonic counter.
   */
  public Counter counter(final String name, final String description);

  /**
   * @param name The metric name.
   * @param description A description of the metric.
   * @return A histogram.
   */
  public Histogram histogram(final String name, final String description);

  /** A monotonic counter. */
  public static interface Counter {
    public void increment();

    public void add(final long value);
  }

  /** A distribution of observed values. */
  public static interface Histogram {
    public void observe(final double value);
  }
}

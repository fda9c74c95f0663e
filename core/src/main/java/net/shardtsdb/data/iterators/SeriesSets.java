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

import net.shardtsdb.data.Series;
import net.shardtsdb.data.SeriesSet;

/**
 * Trivial series set implementations.
 */
public final class SeriesSets {

  private SeriesSets() { }

  /**
   * @param error A non-null error.
   * @return A set without series that reports the error.
   */
  public static SeriesSet error(final Exception error) {
    if (error == null) {
      throw new IllegalArgumentException("Error cannot be null.");
    }
    return new SeriesSet() {
      @Override
      public boolean next() {
        return false;
      }

      @Override
      public Series at() {
        throw new IllegalStateException("No series in an errored set.");
      }

      @Override
      public Exception error() {
        return error;
      }

      @Override
      public Collection<String> warnings() {
        return Collections.emptyList();
      }
    };
  }

  /**
   * @param series Series already sorted by labels.
   * @return A set iterating the list.
   */
  public static SeriesSet fromList(final List<? extends Series> series) {
    final List<Series> copy = ImmutableList.copyOf(series);
    return new SeriesSet() {
      private int idx = -1;

      @Override
      public boolean next() {
        if (idx + 1 >= copy.size()) {
          idx = copy.size();
          return false;
        }
        idx++;
        return true;
      }

      @Override
      public Series at() {
        return copy.get(idx);
      }

      @Override
      public Exception error() {
        return null;
      }

      @Override
      public Collection<String> warnings() {
        return Collections.emptyList();
      }
    };
  }
}

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
package net.shardtsdb.query.ast;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Strings;

/**
 * Parses and formats durations such as {@code 1h30m} or {@code 500ms}.
 */
public final class Durations {
  public static final long MILLISECOND = 1L;
  public static final long SECOND = 1000L;
  public static final long MINUTE = 60 * SECOND;
  public static final long HOUR = 60 * MINUTE;
  public static final long DAY = 24 * HOUR;
  public static final long WEEK = 7 * DAY;
  public static final long YEAR = 365 * DAY;

  private static final Pattern FULL = Pattern.compile(
      "(?:[0-9]+(?:ms|s|m|h|d|w|y))+");
  private static final Pattern PART = Pattern.compile(
      "([0-9]+)(ms|s|m|h|d|w|y)");

  private static final long[] UNITS = { YEAR, WEEK, DAY, HOUR, MINUTE,
      SECOND, MILLISECOND };
  private static final String[] SUFFIXES = { "y", "w", "d", "h", "m", "s",
      "ms" };

  private Durations() { }

  /**
   * @param duration A duration string.
   * @return The duration in milliseconds.
   * @throws IllegalArgumentException if the string is not a duration.
   */
  public static long parse(final String duration) {
    if (Strings.isNullOrEmpty(duration)
        || !FULL.matcher(duration).matches()) {
      throw new IllegalArgumentException("Not a valid duration: " + duration);
    }
    final Matcher matcher = PART.matcher(duration);
    long total = 0;
    while (matcher.find()) {
      final long amount = Long.parseLong(matcher.group(1));
      total = Math.addExact(total,
          Math.multiplyExact(amount, unit(matcher.group(2))));
    }
    return total;
  }

  /**
   * @param ms A non-negative duration in milliseconds.
   * @return The canonical text, largest units first, {@code 0s} for zero.
   */
  public static String format(final long ms) {
    if (ms < 0) {
      throw new IllegalArgumentException("Duration cannot be negative: " + ms);
    }
    if (ms == 0) {
      return "0s";
    }
    final StringBuilder buf = new StringBuilder();
    long remaining = ms;
    for (int i = 0; i < UNITS.length; i++) {
      if (remaining >= UNITS[i]) {
        buf.append(remaining / UNITS[i]).append(SUFFIXES[i]);
        remaining %= UNITS[i];
      }
    }
    return buf.toString();
  }

  private static long unit(final String suffix) {
    for (int i = 0; i < SUFFIXES.length; i++) {
      if (SUFFIXES[i].equals(suffix)) {
        return UNITS[i];
      }
    }
    throw new IllegalArgumentException("Unknown duration unit: " + suffix);
  }
}

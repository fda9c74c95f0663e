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

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.shardtsdb.common.Const;
import net.shardtsdb.query.LabelMatcher;

/**
 * Selects series by metric name and label matchers.
 */
public final class VectorSelector implements Expr {
  private final String name;
  private final List<LabelMatcher> matchers;
  private final long offset;

  /**
   * Default ctor.
   * @param name An optional metric name, may be null.
   * @param matchers Matchers other than the metric name, not null.
   * @param offset An offset in ms, may be negative.
   */
  public VectorSelector(final String name,
                        final List<LabelMatcher> matchers,
                        final long offset) {
    if (matchers == null) {
      throw new IllegalArgumentException("Matchers cannot be null.");
    }
    if (name == null && matchers.isEmpty()) {
      throw new IllegalArgumentException("A selector needs a name or "
          + "at least one matcher.");
    }
    this.name = name;
    this.matchers = ImmutableList.copyOf(matchers);
    this.offset = offset;
  }

  /** @return The metric name or null. */
  public String name() {
    return name;
  }

  /** @return The matchers, without the metric name. */
  public List<LabelMatcher> matchers() {
    return matchers;
  }

  /** @return Every matcher including one for the metric name. */
  public List<LabelMatcher> allMatchers() {
    if (name == null) {
      return matchers;
    }
    final List<LabelMatcher> all = Lists.newArrayListWithCapacity(
        matchers.size() + 1);
    all.add(LabelMatcher.equal(Const.METRIC_NAME_LABEL, name));
    all.addAll(matchers);
    return all;
  }

  public long offset() {
    return offset;
  }

  /**
   * @param matcher A matcher to add.
   * @return A copy with the matcher appended.
   */
  public VectorSelector withMatcher(final LabelMatcher matcher) {
    final List<LabelMatcher> copy = Lists.newArrayList(matchers);
    copy.add(matcher);
    return new VectorSelector(name, copy, offset);
  }

  public VectorSelector withOffset(final long offset) {
    return new VectorSelector(name, matchers, offset);
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitVectorSelector(this);
  }

  @Override
  public ValueType type() {
    return ValueType.VECTOR;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VectorSelector)) {
      return false;
    }
    final VectorSelector other = (VectorSelector) o;
    return Objects.equal(name, other.name)
        && matchers.equals(other.matchers)
        && offset == other.offset;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, matchers, offset);
  }

  @Override
  public String toString() {
    return selectorText() + offsetText(offset);
  }

  /** @return The selector without its offset. */
  String selectorText() {
    final StringBuilder buf = new StringBuilder();
    if (name != null) {
      buf.append(name);
    }
    if (!matchers.isEmpty() || name == null) {
      buf.append("{")
         .append(Joiner.on(", ").join(matchers))
         .append("}");
    }
    return buf.toString();
  }

  /**
   * @param offset An offset in ms.
   * @return The offset clause with a leading space or an empty string.
   */
  static String offsetText(final long offset) {
    if (offset == 0) {
      return "";
    }
    return offset < 0 ? " offset -" + Durations.format(-offset)
        : " offset " + Durations.format(offset);
  }
}

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
package net.shardtsdb.query;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.shardtsdb.data.Labels;

/**
 * Matches a single label of a series. A missing label matches as the empty
 * string. Regular expressions are fully anchored.
 */
public final class LabelMatcher {

  public static enum Type {
    EQUAL("="),
    NOT_EQUAL("!="),
    REGEX("=~"),
    NOT_REGEX("!~");

    private final String operator;

    private Type(final String operator) {
      this.operator = operator;
    }

    public String operator() {
      return operator;
    }

    /**
     * @param operator An operator string.
     * @return The matching type.
     * @throws IllegalArgumentException if the operator is unknown.
     */
    public static Type fromOperator(final String operator) {
      for (final Type type : values()) {
        if (type.operator.equals(operator)) {
          return type;
        }
      }
      throw new IllegalArgumentException("Unknown matcher operator: "
          + operator);
    }
  }

  private final Type type;
  private final String name;
  private final String value;
  private final Pattern pattern;

  /**
   * Default ctor.
   * @param type A non-null type.
   * @param name A non-empty label name.
   * @param value A non-null value or expression.
   * @throws IllegalArgumentException if the regular expression is invalid.
   */
  public LabelMatcher(final Type type, final String name, final String value) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null.");
    }
    this.type = type;
    this.name = name;
    this.value = value;
    if (type == Type.REGEX || type == Type.NOT_REGEX) {
      try {
        pattern = Pattern.compile("^(?:" + value + ")$", Pattern.DOTALL);
      } catch (PatternSyntaxException e) {
        throw new IllegalArgumentException("Invalid regular expression: "
            + value, e);
      }
    } else {
      pattern = null;
    }
  }

  public static LabelMatcher equal(final String name, final String value) {
    return new LabelMatcher(Type.EQUAL, name, value);
  }

  public Type type() {
    return type;
  }

  public String name() {
    return name;
  }

  public String value() {
    return value;
  }

  /**
   * @param label_value The label value or null if missing.
   * @return Whether the value satisfies the matcher.
   */
  public boolean matches(final String label_value) {
    final String v = label_value == null ? "" : label_value;
    switch (type) {
    case EQUAL:
      return value.equals(v);
    case NOT_EQUAL:
      return !value.equals(v);
    case REGEX:
      return pattern.matcher(v).matches();
    case NOT_REGEX:
      return !pattern.matcher(v).matches();
    default:
      throw new IllegalStateException("Unhandled type: " + type);
    }
  }

  /**
   * @param labels A label set.
   * @return Whether the set satisfies the matcher.
   */
  public boolean matches(final Labels labels) {
    return matches(labels.get(name));
  }

  /** @return True if the matcher matches the empty string. */
  public boolean matchesEmpty() {
    return matches((String) null);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LabelMatcher)) {
      return false;
    }
    final LabelMatcher other = (LabelMatcher) o;
    return type == other.type
        && name.equals(other.name)
        && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, name, value);
  }

  @Override
  public String toString() {
    return name + type.operator + "\"" + Labels.escape(value) + "\"";
  }
}

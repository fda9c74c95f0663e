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

import net.shardtsdb.data.Labels;

/**
 * A string literal.
 */
public final class StringLiteral implements Expr {
  private final String value;

  public StringLiteral(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null.");
    }
    this.value = value;
  }

  public String value() {
    return value;
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitString(this);
  }

  @Override
  public ValueType type() {
    return ValueType.STRING;
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof StringLiteral
        && value.equals(((StringLiteral) o).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return "\"" + Labels.escape(value) + "\"";
  }
}

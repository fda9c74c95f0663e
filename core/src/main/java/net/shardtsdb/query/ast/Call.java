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

/**
 * A function call, e.g. {@code rate(foo[5m])}.
 */
public final class Call implements Expr {
  private final Functions.FunctionDef function;
  private final List<Expr> args;

  public Call(final Functions.FunctionDef function, final List<Expr> args) {
    if (function == null) {
      throw new IllegalArgumentException("Function cannot be null.");
    }
    if (args == null) {
      throw new IllegalArgumentException("Args cannot be null.");
    }
    this.function = function;
    this.args = ImmutableList.copyOf(args);
  }

  public Functions.FunctionDef function() {
    return function;
  }

  public String name() {
    return function.name();
  }

  public List<Expr> args() {
    return args;
  }

  public Call withArgs(final List<Expr> args) {
    return new Call(function, args);
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitCall(this);
  }

  @Override
  public ValueType type() {
    return function.returnType();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Call)) {
      return false;
    }
    final Call other = (Call) o;
    return function.name().equals(other.function.name())
        && args.equals(other.args);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(function.name(), args);
  }

  @Override
  public String toString() {
    return function.name() + "(" + Joiner.on(", ").join(args) + ")";
  }
}

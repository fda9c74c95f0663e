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

/**
 * A parenthesized expression.
 */
public final class ParenExpr implements Expr {
  private final Expr expr;

  public ParenExpr(final Expr expr) {
    if (expr == null) {
      throw new IllegalArgumentException("Expression cannot be null.");
    }
    this.expr = expr;
  }

  public Expr expr() {
    return expr;
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitParen(this);
  }

  @Override
  public ValueType type() {
    return expr.type();
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof ParenExpr && expr.equals(((ParenExpr) o).expr);
  }

  @Override
  public int hashCode() {
    return 31 + expr.hashCode();
  }

  @Override
  public String toString() {
    return "(" + expr + ")";
  }
}

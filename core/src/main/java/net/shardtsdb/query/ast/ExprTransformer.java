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

import com.google.common.collect.Lists;

/**
 * A visitor that rebuilds a tree bottom up. Every method returns a node of
 * the same variant with transformed children; subclasses override the
 * variants they change.
 */
public class ExprTransformer implements ExprVisitor<Expr> {

  @Override
  public Expr visitNumber(final NumberLiteral expr) {
    return expr;
  }

  @Override
  public Expr visitString(final StringLiteral expr) {
    return expr;
  }

  @Override
  public Expr visitVectorSelector(final VectorSelector expr) {
    return expr;
  }

  @Override
  public Expr visitMatrixSelector(final MatrixSelector expr) {
    final Expr selector = expr.selector().accept(this);
    if (!(selector instanceof VectorSelector)) {
      throw new IllegalStateException("Matrix selectors must wrap a vector "
          + "selector, got " + selector);
    }
    return new MatrixSelector((VectorSelector) selector, expr.range());
  }

  @Override
  public Expr visitSubquery(final SubqueryExpr expr) {
    return new SubqueryExpr(expr.expr().accept(this), expr.range(),
        expr.step(), expr.offset());
  }

  @Override
  public Expr visitAggregate(final AggregateExpr expr) {
    return new AggregateExpr(expr.op(), expr.expr().accept(this),
        expr.param() == null ? null : expr.param().accept(this),
        expr.grouping(), expr.without());
  }

  @Override
  public Expr visitBinary(final BinaryExpr expr) {
    return expr.withOperands(expr.lhs().accept(this),
        expr.rhs().accept(this));
  }

  @Override
  public Expr visitCall(final Call expr) {
    final List<Expr> args = Lists.newArrayListWithCapacity(
        expr.args().size());
    for (final Expr arg : expr.args()) {
      args.add(arg.accept(this));
    }
    return expr.withArgs(args);
  }

  @Override
  public Expr visitParen(final ParenExpr expr) {
    return new ParenExpr(expr.expr().accept(this));
  }

  @Override
  public Expr visitUnary(final UnaryExpr expr) {
    return new UnaryExpr(expr.expr().accept(this));
  }
}

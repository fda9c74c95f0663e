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
package net.shardtsdb.query.sharding;

import net.shardtsdb.query.ast.Expr;
import net.shardtsdb.query.ast.ExprTransformer;
import net.shardtsdb.query.ast.VectorSelector;

/**
 * Binds every selector of an expression to one shard.
 */
class ShardLabeler extends ExprTransformer {
  private final ShardDescriptor shard;

  ShardLabeler(final ShardDescriptor shard) {
    this.shard = shard;
  }

  @Override
  public Expr visitVectorSelector(final VectorSelector expr) {
    if (!Shardability.isShardableSelector(expr)) {
      throw new ShardingException("Selector " + expr
          + " cannot be bound to shard " + shard);
    }
    return expr.withMatcher(shard.matcher());
  }
}

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
package net.shardtsdb.common;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Constants shared across the project.
 */
public final class Const {

  /** The default character set used for label hashing and payloads. */
  public static final Charset UTF8_CHARSET = StandardCharsets.UTF_8;

  /** Hash function used for series label sets. Must stay stable across
   * releases as shard ownership depends on it. */
  public static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

  /** The reserved label holding the metric name. */
  public static final String METRIC_NAME_LABEL = "__name__";

  /** The reserved label holding a shard descriptor. */
  public static final String QUERY_SHARD_LABEL = "__query_shard__";

  /** The metric name of a selector carrying embedded queries. */
  public static final String EMBEDDED_QUERIES_METRIC = "__embedded_queries__";

  /** The label of an embedded selector carrying the encoded queries. */
  public static final String EMBEDDED_QUERIES_LABEL = "__queries__";

  /** Raw bits of the staleness marker. */
  public static final long STALE_NAN_BITS = 0x7ff0000000000002L;

  /** A NaN value with the staleness bit pattern. Compare with
   * {@link Double#doubleToRawLongBits(double)}, never with ==. */
  public static final double STALE_NAN = Double.longBitsToDouble(STALE_NAN_BITS);

  private Const() { }
}

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
package net.shardtsdb.data.chunk;

import java.io.IOException;

/**
 * Reported by chunk iterators when a payload is truncated or malformed.
 */
public class ChunkDecodeException extends IOException {
  private static final long serialVersionUID = -1652853216093760118L;

  /** Message used when the payload ended before the header said it would. */
  public static final String EOF = "EOF";

  public ChunkDecodeException(final String msg) {
    super(msg);
  }
}

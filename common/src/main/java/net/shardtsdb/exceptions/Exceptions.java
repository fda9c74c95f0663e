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
package net.shardtsdb.exceptions;

import com.google.common.base.Throwables;
import com.stumbleupon.async.DeferredGroupException;

/**
 * Helpers for classifying errors.
 */
public final class Exceptions {

  private Exceptions() { }

  /**
   * Whether retrying might succeed. API errors answer by their type,
   * timeouts and storage failures are recoverable.
   * @param t A non-null throwable.
   * @return True if the error is recoverable.
   */
  public static boolean isRecoverable(final Throwable t) {
    for (final Throwable cause : Throwables.getCausalChain(t)) {
      if (cause instanceof ApiException) {
        return ((ApiException) cause).isRecoverable();
      }
      if (cause instanceof QueryTimeoutException
          || cause instanceof StorageException) {
        return true;
      }
    }
    return false;
  }

  /**
   * Walks a causal chain looking for the first instance of a type.
   * @param t A non-null throwable.
   * @param type The type to look for.
   * @return The matching cause or null.
   */
  public static <T extends Throwable> T find(final Throwable t,
                                            final Class<T> type) {
    for (final Throwable cause : Throwables.getCausalChain(t)) {
      if (type.isInstance(cause)) {
        return type.cast(cause);
      }
    }
    return null;
  }

  /**
   * Unwraps {@link DeferredGroupException}s down to the first real cause.
   * @param t A non-null throwable.
   * @return The underlying throwable.
   */
  public static Throwable unwrap(final Throwable t) {
    Throwable ex = t;
    while (ex instanceof DeferredGroupException && ex.getCause() != null) {
      ex = ex.getCause();
    }
    return ex;
  }
}

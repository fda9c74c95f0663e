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
package net.shardtsdb.query.execution;

import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.TimeoutException;

import net.shardtsdb.exceptions.ApiException;
import net.shardtsdb.exceptions.ApiException.ErrorType;
import net.shardtsdb.exceptions.Exceptions;
import net.shardtsdb.exceptions.QueryCanceledException;

/**
 * A single assignment slot for the outcome of a group of asynchronous tasks
 * plus a bounded wait for them to finish.
 * <p>
 * Producers call {@link #setResult(Object)} or {@link #setError(Exception)}
 * and then {@link #done()}. The first result wins. The first error wins
 * too, unless a later one is recoverable while the stored one is not.
 * A consumer calls {@link #join()}, which waits at most the timeout given
 * at construction.
 * <p>
 * Thread safe.
 * @param <T> The type of result.
 */
public class Promise<T> {
  /** Message of the timeout exception. */
  public static final String TIMEOUT_MESSAGE =
      "timed out while waiting for promise";

  private final long timeout_ms;
  private final boolean propagate_errors;
  private final Deferred<Object> done_signal = new Deferred<Object>();

  /** Guarded by this. */
  private T result;
  private boolean has_result;
  private Exception error;
  private boolean done;

  /**
   * Ctor propagating errors.
   * @param timeout_ms How long {@link #join()} may wait in ms, must be
   * greater than 0.
   */
  public Promise(final long timeout_ms) {
    this(timeout_ms, true);
  }

  /**
   * Default ctor.
   * @param timeout_ms How long {@link #join()} may wait in ms, must be
   * greater than 0.
   * @param propagate_errors Whether errors set on the promise are reported
   * by {@link #join()}. When false they are dropped.
   */
  public Promise(final long timeout_ms, final boolean propagate_errors) {
    if (timeout_ms <= 0) {
      throw new IllegalArgumentException("Timeout must be greater than 0.");
    }
    this.timeout_ms = timeout_ms;
    this.propagate_errors = propagate_errors;
  }

  /**
   * Stores the result if none was stored yet.
   * @param result The result, may be null.
   * @return True if the value was stored, false if a result already was.
   */
  public synchronized boolean setResult(final T result) {
    if (has_result) {
      return false;
    }
    this.result = result;
    has_result = true;
    return true;
  }

  /**
   * Records an error. A null error is ignored.
   * @param e The error.
   */
  public synchronized void setError(final Exception e) {
    if (e == null || !propagate_errors) {
      return;
    }
    if (error == null) {
      error = e;
      return;
    }
    if (!Exceptions.isRecoverable(error) && Exceptions.isRecoverable(e)) {
      error = e;
    }
  }

  /**
   * Marks the promise as done and wakes up a waiting {@link #join()}. Calls
   * after the first are ignored.
   */
  public void done() {
    synchronized (this) {
      if (done) {
        return;
      }
      done = true;
    }
    done_signal.callback(null);
  }

  public synchronized boolean isDone() {
    return done;
  }

  /** @return The error recorded so far, may be null. */
  public synchronized Exception error() {
    return error;
  }

  /**
   * Waits for {@link #done()} up to the timeout.
   * @return The stored result, null if none was set.
   * @throws PromiseTimeoutException if the timeout elapsed first. This takes
   * precedence over any recorded error.
   * @throws QueryCanceledException if the waiting thread was interrupted.
   * @throws Exception the recorded error, if any.
   */
  public T join() throws Exception {
    try {
      done_signal.join(timeout_ms);
    } catch (TimeoutException e) {
      throw new PromiseTimeoutException(TIMEOUT_MESSAGE);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryCanceledException("Interrupted while waiting for promise",
          e);
    }
    synchronized (this) {
      if (error != null) {
        throw error;
      }
      return result;
    }
  }

  /**
   * Waits like {@link #join()} and converts a failure into an API error:
   * recoverable errors become {@link ErrorType#INTERNAL}, everything else
   * {@link ErrorType#BAD_DATA}.
   * @return The stored result, null if none was set.
   * @throws ApiException on failure.
   */
  public T joinAsApiError() {
    try {
      return join();
    } catch (Exception e) {
      if (e instanceof ApiException) {
        throw (ApiException) e;
      }
      throw new ApiException(Exceptions.isRecoverable(e) ? ErrorType.INTERNAL
          : ErrorType.BAD_DATA, e.getMessage(), e);
    }
  }
}

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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.shardtsdb.stats.QueryStats;

/**
 * Request scoped state: the tenants a request acts for, an optional
 * deadline, cancellation and per request stats.
 * <p>
 * Child contexts share the parent's tenants, deadline and stats and are
 * canceled whenever the parent is. Canceling a child leaves the parent
 * alone.
 */
public class QueryContext {
  private static final Logger LOG = LoggerFactory.getLogger(QueryContext.class);

  /** Deadline value meaning "no deadline". */
  public static final long NO_DEADLINE = Long.MAX_VALUE;

  private final List<String> tenants;
  private final long deadline;
  private final QueryStats stats;

  /** Guarded by this. */
  private boolean cancelled;
  private String cancel_reason;
  private final List<Runnable> listeners = Lists.newArrayList();

  /**
   * Default ctor.
   * @param tenants The tenants, possibly empty but not null.
   * @param deadline An absolute deadline in ms since the epoch or
   * {@link #NO_DEADLINE}.
   */
  public QueryContext(final List<String> tenants, final long deadline) {
    this(tenants, deadline, new QueryStats());
  }

  private QueryContext(final List<String> tenants,
                       final long deadline,
                       final QueryStats stats) {
    if (tenants == null) {
      throw new IllegalArgumentException("Tenants cannot be null.");
    }
    this.tenants = ImmutableList.copyOf(tenants);
    this.deadline = deadline;
    this.stats = stats;
  }

  /**
   * @param tenants The tenants.
   * @return A context without a deadline.
   */
  public static QueryContext forTenants(final String... tenants) {
    return new QueryContext(Lists.newArrayList(tenants), NO_DEADLINE);
  }

  public List<String> tenants() {
    return tenants;
  }

  public long deadline() {
    return deadline;
  }

  public QueryStats stats() {
    return stats;
  }

  /**
   * @param now The current time in ms.
   * @return Milliseconds left before the deadline, never negative, or
   * {@link Long#MAX_VALUE} when there is no deadline.
   */
  public long remainingMs(final long now) {
    if (deadline == NO_DEADLINE) {
      return Long.MAX_VALUE;
    }
    return Math.max(0, deadline - now);
  }

  /**
   * Creates a child that is canceled along with this context.
   * @return The child context.
   */
  public QueryContext newChild() {
    final QueryContext child = new QueryContext(tenants, deadline, stats);
    onCancel(new Runnable() {
      @Override
      public void run() {
        child.cancel(cancelReason());
      }
    });
    return child;
  }

  /**
   * Cancels the context and runs listeners once. Later calls are no-ops.
   * @param reason An optional reason.
   */
  public void cancel(final String reason) {
    final List<Runnable> to_run;
    synchronized (this) {
      if (cancelled) {
        return;
      }
      cancelled = true;
      cancel_reason = reason;
      to_run = Lists.newArrayList(listeners);
      listeners.clear();
    }
    for (final Runnable listener : to_run) {
      try {
        listener.run();
      } catch (RuntimeException e) {
        LOG.error("Cancellation listener failed", e);
      }
    }
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  public synchronized String cancelReason() {
    return cancel_reason;
  }

  /**
   * Registers a listener run on cancellation. If the context is already
   * canceled the listener runs right away on the calling thread.
   * @param listener A non-null listener.
   */
  public void onCancel(final Runnable listener) {
    if (listener == null) {
      throw new IllegalArgumentException("Listener cannot be null.");
    }
    synchronized (this) {
      if (!cancelled) {
        listeners.add(listener);
        return;
      }
    }
    listener.run();
  }
}

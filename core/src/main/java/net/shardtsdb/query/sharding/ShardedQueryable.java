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

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.stumbleupon.async.Callback;

import net.shardtsdb.common.Const;
import net.shardtsdb.data.Chunk;
import net.shardtsdb.data.ChunkSeries;
import net.shardtsdb.data.Labels;
import net.shardtsdb.data.Sample;
import net.shardtsdb.data.SampleStream;
import net.shardtsdb.data.SeriesSet;
import net.shardtsdb.data.chunk.DeltaChunk;
import net.shardtsdb.data.iterators.ChunkSeriesSet;
import net.shardtsdb.data.iterators.MergingSeriesSet;
import net.shardtsdb.data.iterators.SeriesSets;
import net.shardtsdb.exceptions.ApiException;
import net.shardtsdb.exceptions.QueryCanceledException;
import net.shardtsdb.exceptions.QueryTimeoutException;
import net.shardtsdb.query.LabelMatcher;
import net.shardtsdb.query.QueryContext;
import net.shardtsdb.query.QueryHandler;
import net.shardtsdb.query.QueryRequest;
import net.shardtsdb.query.QueryResponse;
import net.shardtsdb.query.Queryable;
import net.shardtsdb.query.ResultType;
import net.shardtsdb.query.SelectHints;
import net.shardtsdb.query.execution.Promise;
import net.shardtsdb.query.sharding.EmbeddedQueries.EmbeddedQuery;

/**
 * A {@link Queryable} that serves the embedded selectors of a sharded query
 * by sending each embedded query to the next handler and merging the
 * results back into series.
 * <p>
 * All queries of one select run concurrently on the executor. The select
 * fails as a whole if any of them fails, times out or the request is
 * canceled; partial results are never returned. The first failure cancels
 * the queries still in flight.
 * <p>
 * One instance serves one request and may be selected from concurrently.
 */
public class ShardedQueryable implements Queryable {
  private static final Logger LOG = LoggerFactory.getLogger(
      ShardedQueryable.class);

  private static final Comparator<ChunkSeries> BY_LABELS =
      new Comparator<ChunkSeries>() {
    @Override
    public int compare(final ChunkSeries a, final ChunkSeries b) {
      return a.labels().compareTo(b.labels());
    }
  };

  private final QueryContext context;
  private final QueryRequest request;
  private final QueryHandler next;
  private final ExecutorService executor;
  private final long timeout_ms;

  /** Guarded by itself. */
  private final Map<String, Set<String>> headers = Maps.newTreeMap();
  /** Guarded by itself. */
  private final Set<String> warnings = Sets.newTreeSet();

  /**
   * Default ctor.
   * @param context The context of the sharded request.
   * @param request The sharded request. Embedded queries inherit its range.
   * @param next The handler executing embedded queries.
   * @param executor The pool dispatching embedded queries.
   * @param timeout_ms Upper bound in ms on waiting for the queries of one
   * select. The context deadline applies when it is earlier.
   */
  public ShardedQueryable(final QueryContext context,
                          final QueryRequest request,
                          final QueryHandler next,
                          final ExecutorService executor,
                          final long timeout_ms) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    if (next == null) {
      throw new IllegalArgumentException("Next handler cannot be null.");
    }
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null.");
    }
    if (timeout_ms <= 0) {
      throw new IllegalArgumentException("Timeout must be greater than 0.");
    }
    this.context = context;
    this.request = request;
    this.next = next;
    this.executor = executor;
    this.timeout_ms = timeout_ms;
  }

  @Override
  public SeriesSet select(final SelectHints hints,
                          final List<LabelMatcher> matchers) {
    final EmbeddedQueries embedded;
    try {
      embedded = EmbeddedQueries.fromMatchers(matchers);
    } catch (IllegalArgumentException e) {
      return SeriesSets.error(new ShardingException(
          "Unable to decode embedded queries from " + matchers, e));
    }
    if (embedded == null) {
      return SeriesSets.error(new ShardingException(
          "Only embedded queries can be selected, got " + matchers));
    }

    final List<QueryResponse> responses;
    try {
      responses = execute(embedded.queries());
    } catch (Exception e) {
      return SeriesSets.error(e);
    }

    final List<SeriesSet> sets = Lists.newArrayListWithCapacity(
        responses.size());
    for (int i = 0; i < responses.size(); i++) {
      final String shard = embedded.shardLabels()
          ? embedded.queries().get(i).shard() : null;
      sets.add(toSeriesSet(responses.get(i), shard));
    }
    return new MergingSeriesSet(sets);
  }

  /** @return Response headers of all embedded queries executed so far. */
  public SortedMap<String, SortedSet<String>> responseHeaders() {
    final ImmutableSortedMap.Builder<String, SortedSet<String>> builder =
        ImmutableSortedMap.naturalOrder();
    synchronized (headers) {
      for (final Map.Entry<String, Set<String>> entry : headers.entrySet()) {
        builder.put(entry.getKey(), ImmutableSortedSet.copyOf(
            entry.getValue()));
      }
    }
    return builder.build();
  }

  /** @return Warnings of all embedded queries executed so far. */
  public SortedSet<String> warnings() {
    synchronized (warnings) {
      return ImmutableSortedSet.copyOf(warnings);
    }
  }

  /**
   * Runs the queries concurrently and waits for all of them.
   * @param queries The queries to run.
   * @return The successful responses in the order of the queries.
   * @throws Exception the error picked by the {@link Promise} if any query
   * failed, a timeout or a cancellation.
   */
  List<QueryResponse> execute(final List<EmbeddedQuery> queries)
      throws Exception {
    final long wait_ms = Math.min(timeout_ms,
        context.remainingMs(System.currentTimeMillis()));
    if (wait_ms <= 0) {
      throw new QueryTimeoutException("Query deadline exceeded before "
          + "executing " + queries.size() + " embedded queries");
    }

    final QueryContext child = context.newChild();
    final Promise<List<QueryResponse>> promise =
        new Promise<List<QueryResponse>>(wait_ms);
    final Fanout fanout = new Fanout(queries, child, promise);

    context.onCancel(new Runnable() {
      @Override
      public void run() {
        promise.setError(new QueryCanceledException("Query was canceled: "
            + context.cancelReason()));
        promise.done();
      }
    });

    for (int i = 0; i < queries.size(); i++) {
      try {
        executor.execute(fanout.new ShardTask(i));
      } catch (RejectedExecutionException e) {
        fanout.fail(e);
        break;
      }
    }

    try {
      final List<QueryResponse> responses = promise.join();
      if (context.isCancelled()) {
        throw new QueryCanceledException("Query was canceled: "
            + context.cancelReason());
      }
      return responses;
    } catch (Exception e) {
      child.cancel("embedded query failed: " + e.getMessage());
      throw e;
    }
  }

  /**
   * Shared state of the queries of one select.
   */
  private class Fanout {
    private final List<EmbeddedQuery> queries;
    private final QueryContext child;
    private final Promise<List<QueryResponse>> promise;
    private final AtomicReferenceArray<QueryResponse> responses;
    private final AtomicInteger outstanding;

    Fanout(final List<EmbeddedQuery> queries,
           final QueryContext child,
           final Promise<List<QueryResponse>> promise) {
      this.queries = queries;
      this.child = child;
      this.promise = promise;
      responses = new AtomicReferenceArray<QueryResponse>(queries.size());
      outstanding = new AtomicInteger(queries.size());
    }

    void fail(final Exception e) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Embedded query failed, canceling the others", e);
      }
      promise.setError(e);
      child.cancel("embedded query failed: " + e.getMessage());
      promise.done();
    }

    void complete(final int index, final QueryResponse response) {
      if (!response.isSuccess()) {
        fail(new ApiException(response.errorType(), response.error()));
        return;
      }
      if (!responses.compareAndSet(index, null, response)) {
        LOG.warn("Ignoring a second response for embedded query " + index);
        return;
      }
      synchronized (headers) {
        for (final Map.Entry<String, SortedSet<String>> entry
            : response.headers().entrySet()) {
          Set<String> values = headers.get(entry.getKey());
          if (values == null) {
            values = Sets.newTreeSet();
            headers.put(entry.getKey(), values);
          }
          values.addAll(entry.getValue());
        }
      }
      synchronized (warnings) {
        warnings.addAll(response.warnings());
      }
      if (outstanding.decrementAndGet() == 0) {
        final List<QueryResponse> results = Lists.newArrayListWithCapacity(
            responses.length());
        for (int i = 0; i < responses.length(); i++) {
          results.add(responses.get(i));
        }
        promise.setResult(results);
        promise.done();
      }
    }

    /**
     * Executes one embedded query.
     */
    class ShardTask implements Runnable {
      private final int index;

      ShardTask(final int index) {
        this.index = index;
      }

      @Override
      public void run() {
        if (child.isCancelled()) {
          return;
        }

        class ResponseCB implements Callback<Object, QueryResponse> {
          @Override
          public Object call(final QueryResponse response) throws Exception {
            complete(index, response);
            return null;
          }
        }

        class ErrorCB implements Callback<Object, Exception> {
          @Override
          public Object call(final Exception e) throws Exception {
            fail(e);
            return null;
          }
        }

        try {
          next.handle(child, request.withQuery(queries.get(index).query()))
              .addCallbacks(new ResponseCB(), new ErrorCB());
        } catch (RuntimeException e) {
          fail(e);
        }
      }
    }
  }

  /**
   * Converts the result of one embedded query into a label sorted set.
   * @param response A successful response.
   * @param shard The shard label value to add to every series or null.
   * @return The series set.
   */
  SeriesSet toSeriesSet(final QueryResponse response, final String shard) {
    if (response.resultType() != ResultType.MATRIX
        && response.resultType() != ResultType.VECTOR) {
      return SeriesSets.error(new ShardingException("Unexpected result type "
          + response.resultType() + " of an embedded query"));
    }
    final List<ChunkSeries> series = Lists.newArrayListWithCapacity(
        response.result().size());
    for (final SampleStream stream : response.result()) {
      if (stream.samples().isEmpty()) {
        continue;
      }
      Labels labels = stream.labels();
      if (shard != null) {
        labels = labels.toBuilder()
            .set(Const.QUERY_SHARD_LABEL, shard)
            .build();
      }
      series.add(new ChunkSeries(labels, toChunks(stream.samples())));
    }
    Collections.sort(series, BY_LABELS);
    return new ChunkSeriesSet(series, response.warnings());
  }

  /**
   * Encodes samples into chunks. A stale marker is inserted one step after
   * a sample whenever the next sample is more than a step away, and one
   * step after the last sample if that is still within the range, so that
   * a lookback never extends a value past the step it was produced for.
   * @param samples The samples, in any order.
   * @return The chunks.
   */
  List<Chunk> toChunks(final Collection<Sample> samples) {
    final List<Sample> sorted = Lists.newArrayList(samples);
    Collections.sort(sorted, new Comparator<Sample>() {
      @Override
      public int compare(final Sample a, final Sample b) {
        return Long.compare(a.timestamp(), b.timestamp());
      }
    });

    final long step = request.step();
    final List<Chunk> chunks = Lists.newArrayList();
    final ChunkBuilder builder = new ChunkBuilder(chunks);
    boolean first = true;
    long last = 0;
    for (final Sample sample : sorted) {
      if (!first) {
        if (sample.timestamp() <= last) {
          continue;
        }
        if (sample.timestamp() - last > step) {
          builder.append(last + step, Const.STALE_NAN);
        }
      }
      builder.append(sample.timestamp(), sample.value());
      last = sample.timestamp();
      first = false;
    }
    if (!first && last + step <= request.end()) {
      builder.append(last + step, Const.STALE_NAN);
    }
    builder.flush();
    return chunks;
  }

  /** Starts a new chunk whenever the current one fills up. */
  private static class ChunkBuilder {
    private final List<Chunk> chunks;
    private DeltaChunk.Appender appender = DeltaChunk.newAppender();

    ChunkBuilder(final List<Chunk> chunks) {
      this.chunks = chunks;
    }

    void append(final long timestamp, final double value) {
      if (appender.isFull()) {
        flush();
      }
      appender.append(timestamp, value);
    }

    void flush() {
      if (appender.count() > 0) {
        chunks.add(appender.build());
        appender = DeltaChunk.newAppender();
      }
    }
  }
}

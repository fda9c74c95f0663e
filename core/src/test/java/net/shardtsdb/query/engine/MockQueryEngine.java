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
package net.shardtsdb.query.engine;

import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.stumbleupon.async.Deferred;

import net.shardtsdb.common.Const;
import net.shardtsdb.data.Labels;
import net.shardtsdb.data.Sample;
import net.shardtsdb.data.SampleIterator;
import net.shardtsdb.data.SampleStream;
import net.shardtsdb.data.Series;
import net.shardtsdb.data.SeriesSet;
import net.shardtsdb.exceptions.ApiException;
import net.shardtsdb.exceptions.ApiException.ErrorType;
import net.shardtsdb.exceptions.QueryCanceledException;
import net.shardtsdb.exceptions.StorageException;
import net.shardtsdb.query.QueryContext;
import net.shardtsdb.query.Queryable;
import net.shardtsdb.query.ResultType;
import net.shardtsdb.query.SelectHints;
import net.shardtsdb.query.ast.AggregateExpr;
import net.shardtsdb.query.ast.BinaryExpr;
import net.shardtsdb.query.ast.Call;
import net.shardtsdb.query.ast.Expr;
import net.shardtsdb.query.ast.ExprVisitor;
import net.shardtsdb.query.ast.MatrixSelector;
import net.shardtsdb.query.ast.NumberLiteral;
import net.shardtsdb.query.ast.ParenExpr;
import net.shardtsdb.query.ast.StringLiteral;
import net.shardtsdb.query.ast.SubqueryExpr;
import net.shardtsdb.query.ast.UnaryExpr;
import net.shardtsdb.query.ast.ValueType;
import net.shardtsdb.query.ast.VectorMatching;
import net.shardtsdb.query.ast.VectorSelector;
import net.shardtsdb.query.ql.ExprParser;

/**
 * A small synchronous range query evaluator for tests. It covers
 * selectors with a five minute lookback and stale markers, range
 * functions, the common aggregations, binary operations with one to one
 * or set matching and a handful of per series functions. Anything else
 * fails with an {@link UnsupportedOperationException}.
 */
public class MockQueryEngine implements QueryEngine {
  public static final long LOOKBACK = 300000;

  private static final Set<String> NAME = ImmutableSet.of(
      Const.METRIC_NAME_LABEL);

  private final ExprParser parser = new ExprParser();

  @Override
  public Deferred<EvaluationResult> execute(final QueryContext context,
                                            final Queryable queryable,
                                            final String query,
                                            final long start,
                                            final long end,
                                            final long step) {
    try {
      final Expr expr = parser.parse(query);
      return Deferred.fromResult(new Evaluation(context, queryable, start,
          end, step).run(expr));
    } catch (Exception e) {
      return Deferred.fromError(e);
    }
  }

  /** One output element of an instant vector. */
  static class Element {
    final Labels labels;
    final double value;

    Element(final Labels labels, final double value) {
      this.labels = labels;
      this.value = value;
    }
  }

  /** Samples of a series loaded for the whole query. */
  static class Loaded {
    final Labels labels;
    final long[] timestamps;
    final double[] values;

    Loaded(final Labels labels, final List<Sample> samples) {
      this.labels = labels;
      timestamps = new long[samples.size()];
      values = new double[samples.size()];
      for (int i = 0; i < samples.size(); i++) {
        timestamps[i] = samples.get(i).timestamp();
        values[i] = samples.get(i).value();
      }
    }

    /** @return Index of the last sample at or before the timestamp or -1. */
    int floor(final long timestamp) {
      int lo = 0;
      int hi = timestamps.length - 1;
      int found = -1;
      while (lo <= hi) {
        final int mid = (lo + hi) >>> 1;
        if (timestamps[mid] <= timestamp) {
          found = mid;
          lo = mid + 1;
        } else {
          hi = mid - 1;
        }
      }
      return found;
    }
  }

  /** The samples of a series within a range. */
  static class Window {
    final Labels labels;
    final List<Sample> samples;

    Window(final Labels labels, final List<Sample> samples) {
      this.labels = labels;
      this.samples = samples;
    }
  }

  private static class Evaluation implements ExprVisitor<Object> {
    private final QueryContext context;
    private final Queryable queryable;
    private final long start;
    private final long end;
    private final long step;
    private final Map<VectorSelector, List<Loaded>> cache =
        new IdentityHashMap<VectorSelector, List<Loaded>>();
    private final Set<String> warnings = Sets.newTreeSet();
    private long now;

    Evaluation(final QueryContext context,
               final Queryable queryable,
               final long start,
               final long end,
               final long step) {
      this.context = context;
      this.queryable = queryable;
      this.start = start;
      this.end = end;
      this.step = step;
    }

    EvaluationResult run(final Expr expr) {
      if (expr.type() == ValueType.MATRIX || expr.type() == ValueType.STRING) {
        throw new ApiException(ErrorType.BAD_DATA, "invalid expression type "
            + expr.type().description() + " for range query");
      }
      final Map<Labels, List<Sample>> output = Maps.newTreeMap();
      for (now = start; now <= end; now += step) {
        if (context != null && context.isCancelled()) {
          throw new QueryCanceledException("Query was canceled: "
              + context.cancelReason());
        }
        final Object value = expr.accept(this);
        if (value instanceof Double) {
          add(output, Labels.EMPTY, (Double) value);
        } else {
          for (final Element element : vector(value)) {
            add(output, element.labels, element.value);
          }
        }
      }
      final List<SampleStream> streams = Lists.newArrayList();
      for (final Map.Entry<Labels, List<Sample>> entry : output.entrySet()) {
        streams.add(new SampleStream(entry.getKey(), entry.getValue()));
      }
      return new EvaluationResult(ResultType.MATRIX, streams,
          Lists.newArrayList(warnings));
    }

    private void add(final Map<Labels, List<Sample>> output,
                     final Labels labels,
                     final double value) {
      List<Sample> samples = output.get(labels);
      if (samples == null) {
        samples = Lists.newArrayList();
        output.put(labels, samples);
      }
      if (samples.isEmpty()
          || samples.get(samples.size() - 1).timestamp() < now) {
        samples.add(new Sample(now, value));
      }
    }

    @Override
    public Object visitNumber(final NumberLiteral expr) {
      return expr.value();
    }

    @Override
    public Object visitString(final StringLiteral expr) {
      return expr.value();
    }

    @Override
    public Object visitVectorSelector(final VectorSelector expr) {
      final long at = now - expr.offset();
      final List<Element> result = Lists.newArrayList();
      for (final Loaded series : load(expr, 0)) {
        final int idx = series.floor(at);
        if (idx < 0 || series.timestamps[idx] <= at - LOOKBACK
            || Sample.isStaleMarker(series.values[idx])) {
          continue;
        }
        result.add(new Element(series.labels, series.values[idx]));
      }
      return result;
    }

    @Override
    public Object visitMatrixSelector(final MatrixSelector expr) {
      final long at = now - expr.selector().offset();
      final List<Window> result = Lists.newArrayList();
      for (final Loaded series : load(expr.selector(), expr.range())) {
        final List<Sample> samples = Lists.newArrayList();
        for (int i = series.floor(at); i >= 0
            && series.timestamps[i] > at - expr.range(); i--) {
          if (!Sample.isStaleMarker(series.values[i])) {
            samples.add(new Sample(series.timestamps[i], series.values[i]));
          }
        }
        if (!samples.isEmpty()) {
          Collections.reverse(samples);
          result.add(new Window(series.labels, samples));
        }
      }
      return result;
    }

    @Override
    public Object visitSubquery(final SubqueryExpr expr) {
      throw new UnsupportedOperationException("Subqueries are not supported");
    }

    @Override
    public Object visitAggregate(final AggregateExpr expr) {
      final List<Element> input = vector(expr.expr().accept(this));
      final Map<Labels, List<Element>> groups = Maps.newTreeMap();
      for (final Element element : input) {
        final Labels key;
        if (expr.without()) {
          key = element.labels.without(NAME).without(expr.grouping());
        } else {
          key = element.labels.keep(expr.grouping());
        }
        List<Element> group = groups.get(key);
        if (group == null) {
          group = Lists.newArrayList();
          groups.put(key, group);
        }
        group.add(element);
      }

      final List<Element> result = Lists.newArrayList();
      for (final Map.Entry<Labels, List<Element>> entry : groups.entrySet()) {
        final List<Element> group = entry.getValue();
        switch (expr.op()) {
        case "sum":
          result.add(new Element(entry.getKey(), sum(group)));
          break;
        case "count":
          result.add(new Element(entry.getKey(), group.size()));
          break;
        case "avg":
          result.add(new Element(entry.getKey(), sum(group) / group.size()));
          break;
        case "group":
          result.add(new Element(entry.getKey(), 1));
          break;
        case "min":
        case "max":
          double extreme = group.get(0).value;
          for (final Element element : group) {
            extreme = expr.op().equals("min")
                ? Math.min(extreme, element.value)
                : Math.max(extreme, element.value);
          }
          result.add(new Element(entry.getKey(), extreme));
          break;
        case "topk":
        case "bottomk":
          final int k = (int) scalar(expr.param().accept(this));
          final boolean top = expr.op().equals("topk");
          final List<Element> sorted = Lists.newArrayList(group);
          Collections.sort(sorted, new Comparator<Element>() {
            @Override
            public int compare(final Element a, final Element b) {
              final int cmp = top ? Double.compare(b.value, a.value)
                  : Double.compare(a.value, b.value);
              return cmp != 0 ? cmp : a.labels.compareTo(b.labels);
            }
          });
          result.addAll(sorted.subList(0, Math.min(k, sorted.size())));
          break;
        default:
          throw new UnsupportedOperationException("Aggregation " + expr.op()
              + " is not supported");
        }
      }
      return result;
    }

    @Override
    public Object visitBinary(final BinaryExpr expr) {
      final Object lhs = expr.lhs().accept(this);
      final Object rhs = expr.rhs().accept(this);
      final boolean comparison = BinaryExpr.COMPARISON.contains(expr.op());

      if (lhs instanceof Double && rhs instanceof Double) {
        return apply(expr.op(), (Double) lhs, (Double) rhs);
      }
      if (lhs instanceof Double || rhs instanceof Double) {
        final boolean scalar_left = lhs instanceof Double;
        final List<Element> result = Lists.newArrayList();
        for (final Element element : vector(scalar_left ? rhs : lhs)) {
          final double value = scalar_left
              ? apply(expr.op(), (Double) lhs, element.value)
              : apply(expr.op(), element.value, (Double) rhs);
          if (comparison && !expr.returnBool()) {
            if (value == 1) {
              result.add(element);
            }
          } else {
            result.add(new Element(element.labels.without(NAME), value));
          }
        }
        return result;
      }

      final List<Element> left = vector(lhs);
      final List<Element> right = vector(rhs);
      final VectorMatching matching = expr.matching();
      if (BinaryExpr.SET.contains(expr.op())) {
        return setOperation(expr.op(), left, right, matching);
      }
      if (matching != null
          && matching.cardinality() != VectorMatching.Cardinality.ONE_TO_ONE) {
        throw new UnsupportedOperationException("Only one to one matching "
            + "is supported");
      }
      final Map<Labels, Element> by_signature = Maps.newHashMap();
      for (final Element element : right) {
        by_signature.put(signature(element.labels, matching), element);
      }
      final List<Element> result = Lists.newArrayList();
      for (final Element element : left) {
        final Labels sig = signature(element.labels, matching);
        final Element other = by_signature.get(sig);
        if (other == null) {
          continue;
        }
        final double value = apply(expr.op(), element.value, other.value);
        if (comparison && !expr.returnBool()) {
          if (value == 1) {
            result.add(element);
          }
          continue;
        }
        final Labels labels = matching != null && matching.on() ? sig
            : element.labels.without(NAME);
        result.add(new Element(labels, value));
      }
      return result;
    }

    @Override
    public Object visitCall(final Call expr) {
      final String name = expr.name();
      switch (name) {
      case "time":
        return now / 1000.0;
      case "vector":
        return Lists.newArrayList(new Element(Labels.EMPTY,
            scalar(expr.args().get(0).accept(this))));
      case "scalar":
        final List<Element> input = vector(expr.args().get(0).accept(this));
        return input.size() == 1 ? input.get(0).value : Double.NaN;
      case "absent":
        return vector(expr.args().get(0).accept(this)).isEmpty()
            ? Lists.newArrayList(new Element(Labels.EMPTY, 1))
            : Lists.<Element>newArrayList();
      case "absent_over_time":
        return windows(expr.args().get(0).accept(this)).isEmpty()
            ? Lists.newArrayList(new Element(Labels.EMPTY, 1))
            : Lists.<Element>newArrayList();
      }

      if (expr.args().size() > 0
          && expr.args().get(0).type() == ValueType.MATRIX) {
        final List<Window> windows = windows(expr.args().get(0).accept(this));
        final long range = ((MatrixSelector) expr.args().get(0)).range();
        final List<Element> result = Lists.newArrayList();
        for (final Window window : windows) {
          final Double value = overTime(name, window.samples, range);
          if (value != null) {
            result.add(new Element(window.labels.without(NAME), value));
          }
        }
        return result;
      }

      final List<Element> input = vector(expr.args().get(0).accept(this));
      final List<Element> result = Lists.newArrayList();
      for (final Element element : input) {
        final double value;
        switch (name) {
        case "abs":
          value = Math.abs(element.value);
          break;
        case "ceil":
          value = Math.ceil(element.value);
          break;
        case "floor":
          value = Math.floor(element.value);
          break;
        case "sqrt":
          value = Math.sqrt(element.value);
          break;
        case "exp":
          value = Math.exp(element.value);
          break;
        case "ln":
          value = Math.log(element.value);
          break;
        case "sgn":
          value = Math.signum(element.value);
          break;
        case "clamp_min":
          value = Math.max(element.value,
              scalar(expr.args().get(1).accept(this)));
          break;
        case "clamp_max":
          value = Math.min(element.value,
              scalar(expr.args().get(1).accept(this)));
          break;
        default:
          throw new UnsupportedOperationException("Function " + name
              + " is not supported");
        }
        result.add(new Element(element.labels.without(NAME), value));
      }
      return result;
    }

    @Override
    public Object visitParen(final ParenExpr expr) {
      return expr.expr().accept(this);
    }

    @Override
    public Object visitUnary(final UnaryExpr expr) {
      final Object value = expr.expr().accept(this);
      if (value instanceof Double) {
        return -(Double) value;
      }
      final List<Element> result = Lists.newArrayList();
      for (final Element element : vector(value)) {
        result.add(new Element(element.labels.without(NAME), -element.value));
      }
      return result;
    }

    private List<Loaded> load(final VectorSelector selector, final long range) {
      List<Loaded> loaded = cache.get(selector);
      if (loaded != null) {
        return loaded;
      }
      final SelectHints hints = new SelectHints(
          start - selector.offset() - Math.max(range, LOOKBACK),
          end - selector.offset(), step);
      final SeriesSet set = queryable.select(hints, selector.allMatchers());
      loaded = Lists.newArrayList();
      while (set.next()) {
        final Series series = set.at();
        final SampleIterator iterator = series.iterator();
        final List<Sample> samples = Lists.newArrayList();
        while (iterator.next()) {
          samples.add(new Sample(iterator.timestamp(), iterator.value()));
        }
        if (iterator.error() != null) {
          throw propagate(iterator.error());
        }
        loaded.add(new Loaded(series.labels(), samples));
      }
      if (set.error() != null) {
        throw propagate(set.error());
      }
      warnings.addAll(set.warnings());
      cache.put(selector, loaded);
      return loaded;
    }

    private static RuntimeException propagate(final Exception e) {
      if (e instanceof RuntimeException) {
        return (RuntimeException) e;
      }
      return new StorageException(e.getMessage(), e);
    }

    @SuppressWarnings("unchecked")
    private static List<Element> vector(final Object value) {
      return (List<Element>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Window> windows(final Object value) {
      return (List<Window>) value;
    }

    private static double scalar(final Object value) {
      return (Double) value;
    }

    private static double sum(final List<Element> group) {
      double sum = 0;
      for (final Element element : group) {
        sum += element.value;
      }
      return sum;
    }

    private static Double overTime(final String name,
                                   final List<Sample> samples,
                                   final long range) {
      final Sample first = samples.get(0);
      final Sample last = samples.get(samples.size() - 1);
      switch (name) {
      case "sum_over_time":
      case "avg_over_time":
        double sum = 0;
        for (final Sample sample : samples) {
          sum += sample.value();
        }
        return name.equals("sum_over_time") ? sum : sum / samples.size();
      case "count_over_time":
        return (double) samples.size();
      case "present_over_time":
        return 1.0;
      case "last_over_time":
        return last.value();
      case "min_over_time":
      case "max_over_time":
        double extreme = first.value();
        for (final Sample sample : samples) {
          extreme = name.equals("min_over_time")
              ? Math.min(extreme, sample.value())
              : Math.max(extreme, sample.value());
        }
        return extreme;
      case "delta":
      case "increase":
        if (samples.size() < 2) {
          return null;
        }
        return last.value() - first.value();
      case "rate":
        if (samples.size() < 2) {
          return null;
        }
        return (last.value() - first.value()) / (range / 1000.0);
      default:
        throw new UnsupportedOperationException("Function " + name
            + " is not supported");
      }
    }

    private static Labels signature(final Labels labels,
                                    final VectorMatching matching) {
      if (matching == null || matching.labels().isEmpty() && !matching.on()) {
        return labels.without(NAME);
      }
      return matching.on() ? labels.keep(matching.labels())
          : labels.without(NAME).without(matching.labels());
    }

    private static List<Element> setOperation(final String op,
                                              final List<Element> left,
                                              final List<Element> right,
                                              final VectorMatching matching) {
      final Set<Labels> right_signatures = Sets.newHashSet();
      for (final Element element : right) {
        right_signatures.add(signature(element.labels, matching));
      }
      final List<Element> result = Lists.newArrayList();
      if (op.equals("or")) {
        final Set<Labels> left_signatures = Sets.newHashSet();
        for (final Element element : left) {
          left_signatures.add(signature(element.labels, matching));
          result.add(element);
        }
        for (final Element element : right) {
          if (!left_signatures.contains(signature(element.labels, matching))) {
            result.add(element);
          }
        }
        return result;
      }
      final boolean keep_matching = op.equals("and");
      for (final Element element : left) {
        if (right_signatures.contains(signature(element.labels, matching))
            == keep_matching) {
          result.add(element);
        }
      }
      return result;
    }

    private static double apply(final String op,
                                final double lhs,
                                final double rhs) {
      switch (op) {
      case "+":
        return lhs + rhs;
      case "-":
        return lhs - rhs;
      case "*":
        return lhs * rhs;
      case "/":
        return lhs / rhs;
      case "%":
        return lhs % rhs;
      case "^":
        return Math.pow(lhs, rhs);
      case "==":
        return lhs == rhs ? 1 : 0;
      case "!=":
        return lhs != rhs ? 1 : 0;
      case ">":
        return lhs > rhs ? 1 : 0;
      case "<":
        return lhs < rhs ? 1 : 0;
      case ">=":
        return lhs >= rhs ? 1 : 0;
      case "<=":
        return lhs <= rhs ? 1 : 0;
      default:
        throw new UnsupportedOperationException("Operator " + op
            + " is not supported");
      }
    }
  }
}

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

import static net.shardtsdb.query.ast.ValueType.MATRIX;
import static net.shardtsdb.query.ast.ValueType.SCALAR;
import static net.shardtsdb.query.ast.ValueType.STRING;
import static net.shardtsdb.query.ast.ValueType.VECTOR;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The catalog of supported functions.
 * <p>
 * A function is flagged per series when each output series is computed
 * from exactly one input series and keeps that series' identity apart
 * from the metric name. Only such functions can run on disjoint subsets
 * of the input and have their outputs concatenated.
 */
public final class Functions {

  /** The signature of a function. */
  public static final class FunctionDef {
    private final String name;
    private final List<ValueType> arg_types;
    private final int optional_args;
    private final boolean variadic;
    private final ValueType return_type;
    private final boolean per_series;

    FunctionDef(final String name,
                final ValueType return_type,
                final boolean per_series,
                final int optional_args,
                final boolean variadic,
                final ValueType... arg_types) {
      this.name = name;
      this.return_type = return_type;
      this.per_series = per_series;
      this.optional_args = optional_args;
      this.variadic = variadic;
      this.arg_types = ImmutableList.copyOf(Arrays.asList(arg_types));
    }

    public String name() {
      return name;
    }

    public List<ValueType> argTypes() {
      return arg_types;
    }

    /** @return How many trailing arguments may be omitted. */
    public int optionalArgs() {
      return optional_args;
    }

    /** @return Whether the last argument type may repeat. */
    public boolean isVariadic() {
      return variadic;
    }

    public ValueType returnType() {
      return return_type;
    }

    public boolean isPerSeries() {
      return per_series;
    }

    /**
     * @param idx An argument index.
     * @return The expected type of the argument.
     */
    public ValueType argType(final int idx) {
      if (idx < arg_types.size()) {
        return arg_types.get(idx);
      }
      return arg_types.get(arg_types.size() - 1);
    }

    /** @return The smallest legal argument count. */
    public int minArgs() {
      return arg_types.size() - optional_args;
    }

    /** @return The largest legal argument count, -1 if unbounded. */
    public int maxArgs() {
      return variadic ? -1 : arg_types.size();
    }
  }

  private static final Map<String, FunctionDef> FUNCTIONS;
  static {
    final ImmutableMap.Builder<String, FunctionDef> builder =
        ImmutableMap.builder();
    for (final FunctionDef def : new FunctionDef[] {
        perSeries("abs", VECTOR, VECTOR),
        new FunctionDef("absent", VECTOR, false, 0, false, VECTOR),
        new FunctionDef("absent_over_time", VECTOR, false, 0, false, MATRIX),
        perSeries("avg_over_time", VECTOR, MATRIX),
        perSeries("ceil", VECTOR, VECTOR),
        perSeries("changes", VECTOR, MATRIX),
        perSeries("clamp", VECTOR, VECTOR, SCALAR, SCALAR),
        perSeries("clamp_max", VECTOR, VECTOR, SCALAR),
        perSeries("clamp_min", VECTOR, VECTOR, SCALAR),
        perSeries("count_over_time", VECTOR, MATRIX),
        new FunctionDef("day_of_month", VECTOR, true, 1, false, VECTOR),
        new FunctionDef("day_of_week", VECTOR, true, 1, false, VECTOR),
        new FunctionDef("days_in_month", VECTOR, true, 1, false, VECTOR),
        perSeries("delta", VECTOR, MATRIX),
        perSeries("deriv", VECTOR, MATRIX),
        perSeries("exp", VECTOR, VECTOR),
        perSeries("floor", VECTOR, VECTOR),
        new FunctionDef("histogram_quantile", VECTOR, false, 0, false,
            SCALAR, VECTOR),
        perSeries("holt_winters", VECTOR, MATRIX, SCALAR, SCALAR),
        new FunctionDef("hour", VECTOR, true, 1, false, VECTOR),
        perSeries("idelta", VECTOR, MATRIX),
        perSeries("increase", VECTOR, MATRIX),
        perSeries("irate", VECTOR, MATRIX),
        new FunctionDef("label_join", VECTOR, false, 0, true,
            VECTOR, STRING, STRING, STRING),
        new FunctionDef("label_replace", VECTOR, false, 0, false,
            VECTOR, STRING, STRING, STRING, STRING),
        perSeries("last_over_time", VECTOR, MATRIX),
        perSeries("ln", VECTOR, VECTOR),
        perSeries("log10", VECTOR, VECTOR),
        perSeries("log2", VECTOR, VECTOR),
        perSeries("max_over_time", VECTOR, MATRIX),
        perSeries("min_over_time", VECTOR, MATRIX),
        new FunctionDef("minute", VECTOR, true, 1, false, VECTOR),
        new FunctionDef("month", VECTOR, true, 1, false, VECTOR),
        perSeries("predict_linear", VECTOR, MATRIX, SCALAR),
        perSeries("present_over_time", VECTOR, MATRIX),
        perSeries("quantile_over_time", VECTOR, SCALAR, MATRIX),
        perSeries("rate", VECTOR, MATRIX),
        perSeries("resets", VECTOR, MATRIX),
        new FunctionDef("round", VECTOR, true, 1, false, VECTOR, SCALAR),
        new FunctionDef("scalar", SCALAR, false, 0, false, VECTOR),
        perSeries("sgn", VECTOR, VECTOR),
        new FunctionDef("sort", VECTOR, false, 0, false, VECTOR),
        new FunctionDef("sort_desc", VECTOR, false, 0, false, VECTOR),
        perSeries("sqrt", VECTOR, VECTOR),
        perSeries("stddev_over_time", VECTOR, MATRIX),
        perSeries("stdvar_over_time", VECTOR, MATRIX),
        perSeries("sum_over_time", VECTOR, MATRIX),
        new FunctionDef("time", SCALAR, false, 0, false),
        perSeries("timestamp", VECTOR, VECTOR),
        new FunctionDef("vector", VECTOR, false, 0, false, SCALAR),
        new FunctionDef("year", VECTOR, true, 1, false, VECTOR) }) {
      builder.put(def.name(), def);
    }
    FUNCTIONS = builder.build();
  }

  private Functions() { }

  /**
   * @param name A function name.
   * @return The definition or null if the function is unknown.
   */
  public static FunctionDef get(final String name) {
    return FUNCTIONS.get(name);
  }

  private static FunctionDef perSeries(final String name,
                                       final ValueType return_type,
                                       final ValueType... arg_types) {
    return new FunctionDef(name, return_type, true, 0, false, arg_types);
  }
}

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
package net.shardtsdb.query.ql;

import java.util.Collections;
import java.util.List;

import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.TerminalNode;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.shardtsdb.common.Const;
import net.shardtsdb.query.LabelMatcher;
import net.shardtsdb.query.ast.AggregateExpr;
import net.shardtsdb.query.ast.BinaryExpr;
import net.shardtsdb.query.ast.Call;
import net.shardtsdb.query.ast.Durations;
import net.shardtsdb.query.ast.Expr;
import net.shardtsdb.query.ast.Functions;
import net.shardtsdb.query.ast.Functions.FunctionDef;
import net.shardtsdb.query.ast.MatrixSelector;
import net.shardtsdb.query.ast.NumberLiteral;
import net.shardtsdb.query.ast.ParenExpr;
import net.shardtsdb.query.ast.StringLiteral;
import net.shardtsdb.query.ast.SubqueryExpr;
import net.shardtsdb.query.ast.UnaryExpr;
import net.shardtsdb.query.ast.ValueType;
import net.shardtsdb.query.ast.VectorMatching;
import net.shardtsdb.query.ast.VectorMatching.Cardinality;
import net.shardtsdb.query.ast.VectorSelector;

/**
 * Turns query text into a type checked {@link Expr} tree. Lexing and
 * parsing use the ANTLR generated {@link MetricQLParser}; the parse tree is
 * converted by a visitor that also checks operand and argument types.
 * <p>
 * Instances are stateless and thread safe.
 */
public class ExprParser {

  /** Aggregations that take a parameter before the expression. */
  private static final List<String> PARAMETERIZED = Lists.newArrayList(
      "topk", "bottomk", "quantile", "count_values");

  /**
   * Parses and type checks a query.
   * @param query The query text.
   * @return The root of the tree.
   * @throws QueryParseException if the query is invalid.
   */
  public Expr parse(final String query) {
    if (Strings.isNullOrEmpty(query) || query.trim().isEmpty()) {
      throw new QueryParseException("Query cannot be null or empty.");
    }
    final ParseErrorListener error_listener = new ParseErrorListener();
    final MetricQLLexer lexer = new MetricQLLexer(CharStreams.fromString(query));
    lexer.removeErrorListeners();
    lexer.addErrorListener(error_listener);

    final MetricQLParser parser = new MetricQLParser(new CommonTokenStream(lexer));
    parser.setErrorHandler(new BailErrorStrategy());
    parser.removeErrorListeners();
    parser.addErrorListener(error_listener);

    final ParserRuleContext tree;
    try {
      tree = parser.query();
    } catch (ParseCancellationException e) {
      throw new QueryParseException(describe(e), e);
    }
    return new AstBuilder().visit(tree);
  }

  private static String describe(final ParseCancellationException e) {
    if (e.getCause() instanceof RecognitionException) {
      final Token token = ((RecognitionException) e.getCause())
          .getOffendingToken();
      if (token != null) {
        return String.format("%d:%d: unexpected %s", token.getLine(),
            token.getCharPositionInLine(), token.getType() == Token.EOF
                ? "end of input" : "'" + token.getText() + "'");
      }
    }
    return "syntax error: " + e.getMessage();
  }

  /**
   * Builds the AST bottom up, checking types as it goes.
   */
  static class AstBuilder extends MetricQLBaseVisitor<Expr> {

    @Override
    public Expr visitQuery(final MetricQLParser.QueryContext ctx) {
      return visit(ctx.expression());
    }

    @Override
    public Expr visitRangeExpr(final MetricQLParser.RangeExprContext ctx) {
      final Expr inner = visit(ctx.expression());
      if (!(inner instanceof VectorSelector)) {
        throw error(ctx, "ranges are only allowed for vector selectors");
      }
      final VectorSelector selector = (VectorSelector) inner;
      if (selector.offset() != 0) {
        throw error(ctx, "offset must follow the range");
      }
      return new MatrixSelector(selector, duration(ctx, ctx.DURATION()));
    }

    @Override
    public Expr visitSubqueryExpr(final MetricQLParser.SubqueryExprContext ctx) {
      final Expr inner = visit(ctx.expression());
      expectType(ctx, inner, ValueType.VECTOR, "subquery");
      final List<TerminalNode> durations = ctx.DURATION();
      final long range = duration(ctx, durations.get(0));
      final long step = durations.size() > 1
          ? duration(ctx, durations.get(1)) : 0;
      return new SubqueryExpr(inner, range, step, 0);
    }

    @Override
    public Expr visitOffsetExpr(final MetricQLParser.OffsetExprContext ctx) {
      final Expr inner = visit(ctx.expression());
      long offset = duration(ctx, ctx.DURATION());
      if (ctx.SUB() != null) {
        offset = -offset;
      }
      if (inner instanceof VectorSelector
          && ((VectorSelector) inner).offset() == 0) {
        return ((VectorSelector) inner).withOffset(offset);
      }
      if (inner instanceof MatrixSelector
          && ((MatrixSelector) inner).selector().offset() == 0) {
        final MatrixSelector matrix = (MatrixSelector) inner;
        return new MatrixSelector(matrix.selector().withOffset(offset),
            matrix.range());
      }
      if (inner instanceof SubqueryExpr
          && ((SubqueryExpr) inner).offset() == 0) {
        return ((SubqueryExpr) inner).withOffset(offset);
      }
      throw error(ctx, "offset modifier must be preceded by a selector "
          + "or subquery and used only once");
    }

    @Override
    public Expr visitBinaryExpr(final MetricQLParser.BinaryExprContext ctx) {
      final Expr lhs = visit(ctx.expression(0));
      final Expr rhs = visit(ctx.expression(1));
      final String op = ctx.op.getText();
      for (final Expr operand : new Expr[] { lhs, rhs }) {
        if (operand.type() != ValueType.SCALAR
            && operand.type() != ValueType.VECTOR) {
          throw error(ctx, "binary expression must contain only scalar and "
              + "instant vector types, got " + operand.type().description());
        }
      }
      final boolean both_vectors = lhs.type() == ValueType.VECTOR
          && rhs.type() == ValueType.VECTOR;
      final MetricQLParser.BinaryModifierContext modifier =
          ctx.binaryModifier();
      final boolean return_bool = modifier != null && modifier.BOOL() != null;

      if (return_bool && !BinaryExpr.COMPARISON.contains(op)) {
        throw error(ctx, "bool modifier can only be used on comparison "
            + "operators");
      }
      if (BinaryExpr.COMPARISON.contains(op) && !return_bool
          && lhs.type() == ValueType.SCALAR
          && rhs.type() == ValueType.SCALAR) {
        throw error(ctx, "comparisons between scalars must use the bool "
            + "modifier");
      }
      if (BinaryExpr.SET.contains(op) && !both_vectors) {
        throw error(ctx, "set operator " + op + " not allowed in binary "
            + "scalar expression");
      }

      VectorMatching matching = null;
      if (both_vectors) {
        Cardinality cardinality = BinaryExpr.SET.contains(op)
            ? Cardinality.MANY_TO_MANY : Cardinality.ONE_TO_ONE;
        List<String> labels = null;
        List<String> include = null;
        boolean on = false;
        if (modifier != null && (modifier.ON() != null
            || modifier.IGNORING() != null)) {
          on = modifier.ON() != null;
          labels = labelNames(modifier.labelNameList(0));
          if (modifier.groupSide != null) {
            if (BinaryExpr.SET.contains(op)) {
              throw error(ctx, "no grouping allowed for " + op
                  + " operation");
            }
            cardinality = modifier.groupSide.getType()
                == MetricQLParser.GROUP_LEFT
                ? Cardinality.MANY_TO_ONE : Cardinality.ONE_TO_MANY;
            include = modifier.labelNameList().size() > 1
                ? labelNames(modifier.labelNameList(1))
                : Collections.<String>emptyList();
          }
        }
        matching = new VectorMatching(cardinality, labels, on, include);
      } else if (modifier != null && (modifier.ON() != null
          || modifier.IGNORING() != null)) {
        throw error(ctx, "vector matching only allowed between instant "
            + "vectors");
      }
      return new BinaryExpr(op, lhs, rhs, matching, return_bool);
    }

    @Override
    public Expr visitUnaryExpr(final MetricQLParser.UnaryExprContext ctx) {
      final Expr inner = visit(ctx.expression());
      if (inner.type() != ValueType.SCALAR
          && inner.type() != ValueType.VECTOR) {
        throw error(ctx, "unary expression only allowed on expressions of "
            + "type scalar or instant vector, got "
            + inner.type().description());
      }
      if (ctx.op.getType() == MetricQLParser.ADD) {
        return inner;
      }
      if (inner instanceof NumberLiteral) {
        return new NumberLiteral(-((NumberLiteral) inner).value());
      }
      return new UnaryExpr(inner);
    }

    @Override
    public Expr visitParenExpr(final MetricQLParser.ParenExprContext ctx) {
      return new ParenExpr(visit(ctx.expression()));
    }

    @Override
    public Expr visitAggregateExpr(final MetricQLParser.AggregateExprContext ctx) {
      final MetricQLParser.AggregationContext agg = ctx.aggregation();
      final String op = agg.AGGREGATION_OP().getText();
      final List<MetricQLParser.ExpressionContext> params =
          agg.parameterList().expression();
      final boolean parameterized = PARAMETERIZED.contains(op);
      if (params.size() != (parameterized ? 2 : 1)) {
        throw error(ctx, "wrong number of arguments for aggregate " + op
            + ": expected " + (parameterized ? 2 : 1) + ", got "
            + params.size());
      }
      Expr param = null;
      if (parameterized) {
        param = visit(params.get(0));
        expectType(ctx, param, op.equals("count_values")
            ? ValueType.STRING : ValueType.SCALAR, "aggregation parameter");
      }
      final Expr expr = visit(params.get(params.size() - 1));
      expectType(ctx, expr, ValueType.VECTOR, "aggregation");

      List<String> grouping = null;
      boolean without = false;
      if (agg.grouping() != null) {
        without = agg.grouping().WITHOUT() != null;
        grouping = labelNames(agg.grouping().labelNameList());
      }
      return new AggregateExpr(op, expr, param, grouping, without);
    }

    @Override
    public Expr visitCallExpr(final MetricQLParser.CallExprContext ctx) {
      final MetricQLParser.FunctionContext fn = ctx.function();
      final String name = fn.IDENTIFIER().getText();
      final FunctionDef def = Functions.get(name);
      if (def == null) {
        throw error(ctx, "unknown function with name \"" + name + "\"");
      }
      final List<Expr> args = Lists.newArrayList();
      for (final MetricQLParser.ExpressionContext arg : fn.expression()) {
        args.add(visit(arg));
      }
      if (args.size() < def.minArgs()
          || (def.maxArgs() >= 0 && args.size() > def.maxArgs())) {
        throw error(ctx, "wrong number of arguments for function " + name
            + ": got " + args.size());
      }
      for (int i = 0; i < args.size(); i++) {
        expectType(ctx, args.get(i), def.argType(i), "call to function "
            + name);
      }
      return new Call(def, args);
    }

    @Override
    public Expr visitSelectorExpr(final MetricQLParser.SelectorExprContext ctx) {
      final MetricQLParser.VectorSelectorContext sel = ctx.vectorSelector();
      String name = sel.IDENTIFIER() == null ? null
          : sel.IDENTIFIER().getText();
      final List<LabelMatcher> matchers = Lists.newArrayList();
      if (sel.labelMatchers() != null) {
        for (final MetricQLParser.LabelMatcherContext m
            : sel.labelMatchers().labelMatcher()) {
          final String label = m.labelName().getText();
          final String value = unquote(m, m.STRING().getText());
          final LabelMatcher matcher;
          try {
            matcher = new LabelMatcher(
                LabelMatcher.Type.fromOperator(m.op.getText()), label, value);
          } catch (IllegalArgumentException e) {
            throw error(m, e.getMessage());
          }
          if (name == null && label.equals(Const.METRIC_NAME_LABEL)
              && matcher.type() == LabelMatcher.Type.EQUAL) {
            name = value;
            continue;
          }
          if (name != null && label.equals(Const.METRIC_NAME_LABEL)
              && matcher.type() == LabelMatcher.Type.EQUAL) {
            throw error(m, "metric name must not be set twice: \"" + name
                + "\" or \"" + value + "\"");
          }
          matchers.add(matcher);
        }
      }
      if (name == null) {
        boolean non_empty = false;
        for (final LabelMatcher matcher : matchers) {
          if (!matcher.matchesEmpty()) {
            non_empty = true;
            break;
          }
        }
        if (!non_empty) {
          throw error(ctx, "vector selector must contain at least one "
              + "non-empty matcher");
        }
      }
      return new VectorSelector(name, matchers, 0);
    }

    @Override
    public Expr visitNumberLiteral(final MetricQLParser.NumberLiteralContext ctx) {
      final String text = ctx.NUMBER().getText();
      final String lower = text.toLowerCase();
      if (lower.equals("inf")) {
        return new NumberLiteral(Double.POSITIVE_INFINITY);
      }
      if (lower.equals("nan")) {
        return new NumberLiteral(Double.NaN);
      }
      try {
        if (lower.startsWith("0x")) {
          return new NumberLiteral(Long.parseLong(text.substring(2), 16));
        }
        return new NumberLiteral(Double.parseDouble(text));
      } catch (NumberFormatException e) {
        throw error(ctx, "invalid number " + text);
      }
    }

    @Override
    public Expr visitStringLiteral(final MetricQLParser.StringLiteralContext ctx) {
      return new StringLiteral(unquote(ctx, ctx.STRING().getText()));
    }

    private static long duration(final ParserRuleContext ctx,
                                 final TerminalNode node) {
      try {
        return Durations.parse(node.getText());
      } catch (IllegalArgumentException e) {
        throw error(ctx, e.getMessage());
      } catch (ArithmeticException e) {
        throw error(ctx, "duration out of range: " + node.getText());
      }
    }

    private static List<String> labelNames(
        final MetricQLParser.LabelNameListContext ctx) {
      final List<String> names = Lists.newArrayList();
      for (final MetricQLParser.LabelNameContext name : ctx.labelName()) {
        names.add(name.getText());
      }
      return names;
    }

    private static void expectType(final ParserRuleContext ctx,
                                   final Expr expr,
                                   final ValueType expected,
                                   final String context) {
      if (expr.type() != expected) {
        throw error(ctx, "expected type " + expected.description() + " in "
            + context + ", got " + expr.type().description());
      }
    }

    private static QueryParseException error(final ParserRuleContext ctx,
                                             final String msg) {
      final Token start = ctx.getStart();
      return new QueryParseException(String.format("%d:%d: %s",
          start.getLine(), start.getCharPositionInLine(), msg));
    }

    /**
     * Strips the quotes of a string token and resolves escapes. Back tick
     * quoted strings are raw.
     */
    static String unquote(final ParserRuleContext ctx, final String token) {
      final char quote = token.charAt(0);
      final String body = token.substring(1, token.length() - 1);
      if (quote == '`') {
        return body;
      }
      final StringBuilder buf = new StringBuilder(body.length());
      for (int i = 0; i < body.length(); i++) {
        final char c = body.charAt(i);
        if (c != '\\') {
          buf.append(c);
          continue;
        }
        if (++i >= body.length()) {
          throw error(ctx, "dangling escape in string " + token);
        }
        final char e = body.charAt(i);
        switch (e) {
        case 'n':
          buf.append('\n');
          break;
        case 't':
          buf.append('\t');
          break;
        case 'r':
          buf.append('\r');
          break;
        case 'a':
          buf.append('\u0007');
          break;
        case 'b':
          buf.append('\b');
          break;
        case 'f':
          buf.append('\f');
          break;
        case 'v':
          buf.append('\u000b');
          break;
        case '\\':
        case '"':
        case '\'':
          buf.append(e);
          break;
        case 'x':
        case 'u':
          final int digits = e == 'x' ? 2 : 4;
          if (i + 1 + digits > body.length()) {
            throw error(ctx, "truncated escape in string " + token);
          }
          try {
            buf.append((char) Integer.parseInt(
                body.substring(i + 1, i + 1 + digits), 16));
          } catch (NumberFormatException ex) {
            throw error(ctx, "invalid escape in string " + token);
          }
          i += digits;
          break;
        default:
          throw error(ctx, "unknown escape sequence \\" + e + " in string "
              + token);
        }
      }
      return buf.toString();
    }
  }
}

/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.pil.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.Expression;
import net.hydromatic.pil.ast.FunctionValueDefinition;
import net.hydromatic.pil.ast.Polynomial;
import net.hydromatic.pil.compile.AnalyzeException;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes values of witness columns that are defined by a query, by asking
 * a {@link QueryCallback}.
 *
 * <p>The query expression is evaluated on the row being derived, with its
 * parameter bound to the row index, and rendered to a string. Tuples render
 * as {@code (a, b)}, strings in double quotes, and a match expression as its
 * selected arm.
 */
public class QueryProcessor {
  private final QueryCallback callback;
  private final List<Analyzed.Definition> columns;

  public QueryProcessor(Analyzed analyzed, QueryCallback callback) {
    this.callback = requireNonNull(callback);
    final ImmutableList.Builder<Analyzed.Definition> b =
        ImmutableList.builder();
    for (Analyzed.Definition definition
        : analyzed.committedPolysInSourceOrder()) {
      if (definition.value != null
          && definition.value.kind == FunctionValueDefinition.Kind.QUERY) {
        if (definition.poly.isArray()) {
          throw new AnalyzeException("array of committed polynomials "
              + definition.poly.absoluteName + " cannot have a query",
              definition.poly.source);
        }
        b.add(definition);
      }
    }
    this.columns = b.build();
  }

  /** Returns the columns defined by a query, in source order. */
  public List<Analyzed.Definition> columns() {
    return columns;
  }

  /** Computes the value of a query column on the next row of a row pair.
   * If the value is already known, returns an empty complete value. */
  public EvalValue process(Analyzed.Definition definition, RowPair rowPair) {
    final Polynomial poly = definition.poly;
    final int id = Math.toIntExact(poly.id);
    if (rowPair.nextValue(id) != null) {
      return EvalValue.complete();
    }
    final ExpressionEvaluator evaluator =
        rowPair.evaluator(true)
            .withLocals(ImmutableList.of(FieldElement.of(rowPair.row)));
    final StringBuilder buf = new StringBuilder();
    final @Nullable IncompleteCause cause =
        render(requireNonNull(definition.value).expression(), evaluator, buf);
    if (cause != null) {
      return EvalValue.incomplete(cause);
    }
    final String query = buf.toString();
    final FieldElement answer = callback.answer(query);
    if (answer == null) {
      return EvalValue.incomplete(
          IncompleteCause.noQueryAnswer(query, poly.absoluteName));
    }
    return EvalValue.complete(
        ImmutableList.of(EvalValue.entry(id, Constraint.assignment(answer))));
  }

  /** Renders a query expression, appending it to a buffer.
   *
   * @return null if successful, otherwise the reason why the expression
   * could not be rendered */
  static @Nullable IncompleteCause render(Expression e,
      ExpressionEvaluator evaluator, StringBuilder buf) {
    switch (e.op) {
    case TUPLE:
      buf.append('(');
      final List<Expression> items = ((Expression.Tuple) e).items;
      for (int i = 0; i < items.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        final @Nullable IncompleteCause cause =
            render(items.get(i), evaluator, buf);
        if (cause != null) {
          return cause;
        }
      }
      buf.append(')');
      return null;

    case STRING:
      Expression.StringLiteral.quote(buf, ((Expression.StringLiteral) e).value);
      return null;

    case MATCH_EXPRESSION:
      final Expression.Match match = (Expression.Match) e;
      final AffineResult scrutinee = evaluator.evaluate(match.scrutinee);
      if (!scrutinee.isAffine()) {
        return scrutinee.cause();
      }
      if (!scrutinee.isConstant()) {
        return IncompleteCause.of(
            IncompleteCause.Kind.NON_CONSTANT_QUERY_MATCH_SCRUTINEE);
      }
      final FieldElement value = scrutinee.expression().constantValue();
      for (Expression.MatchArm arm : match.arms) {
        if (arm.matches(value)) {
          return render(arm.value, evaluator, buf);
        }
      }
      return IncompleteCause.of(IncompleteCause.Kind.NO_MATCH_ARM_FOUND);

    default:
      final AffineResult result = evaluator.evaluate(e);
      if (!result.isAffine()) {
        return result.cause();
      }
      if (!result.isConstant()) {
        return IncompleteCause.expressionEvaluationUnimplemented(
            "non-constant value " + e + " in query");
      }
      buf.append(result.expression().constantValue());
      return null;
    }
  }
}

// End QueryProcessor.java

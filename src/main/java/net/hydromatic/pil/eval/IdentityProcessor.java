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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.Expression;
import net.hydromatic.pil.ast.Identity;
import net.hydromatic.pil.ast.Op;
import net.hydromatic.pil.ast.PolynomialType;
import net.hydromatic.pil.ast.SelectedExpressions;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Processes identities on a {@link RowPair}, deriving constraints on the
 * cells of the next row.
 *
 * <p>An identity that refers to the next row is evaluated on the current and
 * next rows. An identity that does not is evaluated on the next row alone.
 */
public class IdentityProcessor {
  private final Analyzed analyzed;
  private final FixedData fixedData;
  private final FixedLookup fixedLookup;

  public IdentityProcessor(Analyzed analyzed, FixedData fixedData,
      FixedLookup fixedLookup) {
    this.analyzed = requireNonNull(analyzed);
    this.fixedData = requireNonNull(fixedData);
    this.fixedLookup = requireNonNull(fixedLookup);
  }

  /** Processes an identity.
   *
   * @throws EvalException if the identity cannot hold */
  public EvalValue process(Identity identity, RowPair rowPair) {
    final ExpressionEvaluator evaluator =
        rowPair.evaluator(!identity.containsNextReference(analyzed));
    switch (identity.kind) {
    case POLYNOMIAL:
      return processPolynomial(identity, rowPair, evaluator);
    case PLOOKUP:
      if (isFixedLookup(identity.right)) {
        return processFixedLookup(identity, evaluator);
      }
      return EvalValue.complete();
    case PERMUTATION:
    case CONNECT:
      return EvalValue.complete();
    default:
      throw new AssertionError("unknown kind " + identity.kind);
    }
  }

  private EvalValue processPolynomial(Identity identity, RowPair rowPair,
      ExpressionEvaluator evaluator) {
    final AffineResult result =
        evaluator.evaluate(identity.expressionForPolyId());
    if (!result.isAffine()) {
      return EvalValue.incomplete(result.cause());
    }
    final AffineExpression expression = result.expression();
    if (expression.isConstant() && !expression.constantValue().isZero()) {
      throw new EvalException(
          EvalError.constraintUnsatisfiable(identity.source + ": " + identity
              + " evaluates to " + expression + " on row " + rowPair.row));
    }
    return expression.solveWithBitConstraints(rowPair.bitConstraints());
  }

  /** Returns whether the right side of a plookup consists only of fixed
   * columns on the current row, so that it can be answered by a
   * {@link FixedLookup}. */
  boolean isFixedLookup(SelectedExpressions right) {
    if (right.expressions.isEmpty()) {
      return false;
    }
    if (right.selector != null && !isFixedColumn(right.selector)) {
      return false;
    }
    return right.expressions.stream().allMatch(this::isFixedColumn);
  }

  private boolean isFixedColumn(Expression e) {
    if (e.op != Op.POLYNOMIAL_REFERENCE) {
      return false;
    }
    final Expression.Reference reference = (Expression.Reference) e;
    return !reference.poly.next
        && analyzed.definition(reference.poly.name).poly.polyType
            == PolynomialType.CONSTANT;
  }

  private static String columnName(Expression e) {
    return ((Expression.Reference) e).poly.columnName();
  }

  private EvalValue processFixedLookup(Identity identity,
      ExpressionEvaluator evaluator) {
    final @Nullable Expression selector = identity.left.selector;
    if (selector != null) {
      final AffineResult result = evaluator.evaluate(selector);
      if (!result.isAffine()) {
        return EvalValue.incomplete(result.cause());
      }
      if (!result.isConstant()) {
        return EvalValue.incomplete(
            IncompleteCause.of(
                IncompleteCause.Kind.NON_CONSTANT_LEFT_SELECTOR));
      }
      if (result.expression().constantValue().isZero()) {
        return EvalValue.complete();
      }
    }

    final List<AffineExpression> left = new ArrayList<>();
    @Nullable IncompleteCause cause = null;
    for (Expression e : identity.left.expressions) {
      final AffineResult result = evaluator.evaluate(e);
      if (result.isAffine()) {
        left.add(result.expression());
      } else {
        cause = cause == null ? result.cause() : cause.combine(result.cause());
      }
    }
    if (cause != null) {
      return EvalValue.incomplete(cause);
    }

    final List<String> columns = new ArrayList<>();
    final List<@Nullable FieldElement> known = new ArrayList<>();
    for (int i = 0; i < left.size(); i++) {
      columns.add(columnName(identity.right.expressions.get(i)));
      final AffineExpression e = left.get(i);
      known.add(e.isConstant() ? e.constantValue() : null);
    }
    if (identity.right.selector != null) {
      columns.add(columnName(identity.right.selector));
      known.add(FieldElement.ONE);
    }

    final FixedLookup.LookupResult lookup =
        fixedLookup.lookup(ImmutableList.copyOf(columns), known);
    switch (lookup.kind) {
    case NONE:
      throw new EvalException(EvalError.FIXED_LOOKUP_FAILED);
    case MULTIPLE:
      return EvalValue.incomplete(
          IncompleteCause.of(IncompleteCause.Kind.MULTIPLE_LOOKUP_MATCHES));
    case UNIQUE:
      final EvalValue value = EvalValue.complete();
      for (int i = 0; i < left.size(); i++) {
        final AffineExpression e = left.get(i);
        if (e.isConstant()) {
          continue;
        }
        final FieldElement fixedValue =
            fixedData.value(columns.get(i), lookup.row());
        final AffineExpression equation =
            e.minus(AffineExpression.constant(fixedValue));
        if (equation.nonzeroVariables().size() != 1) {
          value.combine(
              EvalValue.incomplete(
                  IncompleteCause.of(IncompleteCause.Kind.SOLVING_FAILED)));
        } else {
          value.combine(equation.solve());
        }
      }
      return value;
    default:
      throw new AssertionError("unknown kind " + lookup.kind);
    }
  }
}

// End IdentityProcessor.java

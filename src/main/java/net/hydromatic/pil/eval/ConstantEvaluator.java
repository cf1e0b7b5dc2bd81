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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.Expression;
import net.hydromatic.pil.ast.FunctionValueDefinition;
import net.hydromatic.pil.ast.Polynomial;
import net.hydromatic.pil.ast.PolynomialReference;
import net.hydromatic.pil.ast.PolynomialType;
import net.hydromatic.pil.ast.RepeatedArray;
import net.hydromatic.pil.compile.AnalyzeException;
import net.hydromatic.pil.number.FieldElement;

/**
 * Computes the values of the constant polynomials of a program.
 *
 * <p>Polynomials are computed in source order. A mapping may refer to the
 * row index (its parameter), to named constants, and to constant
 * polynomials declared before it.
 */
public class ConstantEvaluator {
  private ConstantEvaluator() {}

  /** Generates the fixed columns of a program, using the program's
   * degree. */
  public static FixedData generate(Analyzed analyzed) {
    final Long degree = analyzed.degree();
    return generate(analyzed, degree == null ? 0L : degree);
  }

  /** Generates the fixed columns of a program with a given number of
   * rows. */
  public static FixedData generate(Analyzed analyzed, long degree) {
    final Map<String, List<FieldElement>> columns = new LinkedHashMap<>();
    for (Analyzed.Definition definition
        : analyzed.constantPolysInSourceOrder()) {
      final Polynomial poly = definition.poly;
      final FunctionValueDefinition value = definition.value;
      if (value == null) {
        throw new AnalyzeException("constant polynomial "
            + poly.absoluteName + " has no definition", poly.source);
      }
      if (poly.isArray()) {
        throw new AnalyzeException("array of constant polynomials "
            + poly.absoluteName + " cannot have a definition", poly.source);
      }
      final List<FieldElement> values;
      switch (value.kind) {
      case MAPPING:
        values = generateMapping(analyzed, columns, poly, value.expression(),
            degree);
        break;
      case ARRAY:
        values = generateArray(analyzed, columns, poly, value.arrays(),
            degree);
        break;
      case QUERY:
        throw new AnalyzeException("constant polynomial "
            + poly.absoluteName + " cannot be defined by a query",
            poly.source);
      default:
        throw new AssertionError("unknown kind " + value.kind);
      }
      columns.put(poly.absoluteName, values);
    }
    return new FixedData(degree, columns);
  }

  private static List<FieldElement> generateMapping(Analyzed analyzed,
      Map<String, List<FieldElement>> columns, Polynomial poly,
      Expression expression, long degree) {
    final List<FieldElement> values = new ArrayList<>();
    for (long row = 0; row < degree; row++) {
      final FieldElement rowValue = FieldElement.of(row);
      values.add(
          evaluateConstant(
              evaluator(analyzed, columns, row)
                  .withLocals(ImmutableList.of(rowValue)),
              poly, expression));
    }
    return values;
  }

  private static List<FieldElement> generateArray(Analyzed analyzed,
      Map<String, List<FieldElement>> columns, Polynomial poly,
      List<RepeatedArray> arrays, long degree) {
    final long size = arrays.stream().mapToLong(RepeatedArray::size).sum();
    if (size != degree) {
      throw new AnalyzeException("array for " + poly.absoluteName + " has "
          + size + " values but the degree is " + degree, poly.source);
    }
    final ExpressionEvaluator evaluator = evaluator(analyzed, columns, -1);
    final List<FieldElement> values = new ArrayList<>();
    for (RepeatedArray array : arrays) {
      final List<FieldElement> segment = new ArrayList<>();
      for (Expression e : array.values) {
        segment.add(evaluateConstant(evaluator, poly, e));
      }
      for (long i = 0; i < array.repetitions; i++) {
        values.addAll(segment);
      }
    }
    return values;
  }

  private static FieldElement evaluateConstant(ExpressionEvaluator evaluator,
      Polynomial poly, Expression e) {
    final AffineResult result = evaluator.evaluate(e);
    if (!result.isAffine()) {
      throw new AnalyzeException("cannot evaluate " + e + " in definition of "
          + poly.absoluteName + ": " + result.cause(), poly.source);
    }
    if (!result.isConstant()) {
      throw new AnalyzeException("value " + e + " in definition of "
          + poly.absoluteName + " is not constant", poly.source);
    }
    return result.expression().constantValue();
  }

  /** Creates an evaluator whose references resolve to the already computed
   * constant columns at a given row; if the row is negative, references are
   * not allowed. */
  private static ExpressionEvaluator evaluator(Analyzed analyzed,
      Map<String, List<FieldElement>> columns, long row) {
    return new ExpressionEvaluator(analyzed, new SymbolicVariables() {
      @Override public AffineResult value(Polynomial poly,
          PolynomialReference reference) {
        final List<FieldElement> values = columns.get(poly.absoluteName);
        if (poly.polyType != PolynomialType.CONSTANT || values == null
            || row < 0) {
          return AffineResult.incomplete(
              IncompleteCause.expressionEvaluationUnimplemented(
                  "reference to " + reference + " in a constant"));
        }
        final long r = row + (reference.next ? 1 : 0);
        return AffineResult.of(
            AffineExpression.constant(
                values.get((int) Math.floorMod(r, (long) values.size()))));
      }

      @Override public AffineResult publicValue(String name) {
        return AffineResult.incomplete(
            IncompleteCause.expressionEvaluationUnimplemented(
                "reference to public value " + name + " in a constant"));
      }
    });
  }
}

// End ConstantEvaluator.java

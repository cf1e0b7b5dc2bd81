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

import static net.hydromatic.pil.ast.ExpressionBuilder.pil;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.Expression;
import net.hydromatic.pil.ast.Identity;
import net.hydromatic.pil.ast.Op;
import net.hydromatic.pil.ast.Polynomial;
import net.hydromatic.pil.ast.PolynomialType;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Determines bit constraints on witness columns that hold on every row.
 *
 * <p>Two patterns are recognized:
 *
 * <ul>
 *   <li>{@code x * (1 - x) = 0}, and variants, constrain {@code x} to one
 *   bit;
 *   <li>{@code {x} in {BYTE}}, where fixed column {@code BYTE} holds every
 *   value from 0 to 2<sup>k</sup> - 1 and nothing else, constrains
 *   {@code x} to {@code k} bits.
 * </ul>
 */
public class GlobalConstraints {
  private GlobalConstraints() {}

  /** Returns the bit constraints that hold on every row. */
  public static SimpleBitConstraintSet determine(Analyzed analyzed,
      FixedData fixedData) {
    final Map<String, BitConstraint> fixedConstraints = new HashMap<>();
    for (String name : fixedData.columnNames()) {
      final BitConstraint constraint =
          rangeConstraint(requireColumn(fixedData, name));
      if (constraint != null) {
        fixedConstraints.put(name, constraint);
      }
    }

    SimpleBitConstraintSet set = SimpleBitConstraintSet.EMPTY;
    for (Identity identity : analyzed.identitiesInSourceOrder()) {
      switch (identity.kind) {
      case POLYNOMIAL:
        final @Nullable Polynomial boolPoly =
            booleanColumn(analyzed, identity.expressionForPolyId());
        if (boolPoly != null) {
          set = set.with(Math.toIntExact(boolPoly.id),
              BitConstraint.fromMaxBit(0));
        }
        break;
      case PLOOKUP:
        if (identity.left.selector != null
            || identity.right.selector != null
            || identity.left.expressions.size() != 1
            || identity.right.expressions.size() != 1) {
          break;
        }
        final Expression.@Nullable Reference left =
            plainReference(analyzed, identity.left.expressions.get(0),
                PolynomialType.COMMITTED);
        final Expression.@Nullable Reference right =
            plainReference(analyzed, identity.right.expressions.get(0),
                PolynomialType.CONSTANT);
        if (left == null || right == null) {
          break;
        }
        final BitConstraint constraint =
            fixedConstraints.get(right.poly.columnName());
        if (constraint != null) {
          final Polynomial poly = analyzed.definition(left.poly.name).poly;
          set = set.with(Math.toIntExact(poly.id + left.poly.offset()),
              constraint);
        }
        break;
      default:
        break;
      }
    }
    return set;
  }

  private static List<FieldElement> requireColumn(FixedData fixedData,
      String name) {
    final List<FieldElement> values = fixedData.column(name);
    if (values == null) {
      throw new IllegalArgumentException("unknown fixed column " + name);
    }
    return values;
  }

  /** If a column holds exactly the values from 0 to 2<sup>k</sup> - 1, for
   * some {@code k > 0}, returns a constraint of {@code k} bits. */
  static @Nullable BitConstraint rangeConstraint(List<FieldElement> values) {
    final Set<FieldElement> distinct = new HashSet<>(values);
    if (distinct.size() < 2) {
      return null;
    }
    final BigInteger max = distinct.stream()
        .map(FieldElement::toBigInteger)
        .max(BigInteger::compareTo)
        .orElse(BigInteger.ZERO);
    final BigInteger count = max.add(BigInteger.ONE);
    if (count.bitCount() != 1
        || !count.equals(BigInteger.valueOf(distinct.size()))) {
      return null;
    }
    return BitConstraint.fromMaxBit(count.getLowestSetBit() - 1);
  }

  /** If an expression has the form {@code x * (1 - x)}, or a variant, where
   * {@code x} is a scalar witness column on the current row, returns the
   * polynomial of {@code x}. */
  private static @Nullable Polynomial booleanColumn(Analyzed analyzed,
      Expression e) {
    if (e.op != Op.BINARY_OPERATION) {
      return null;
    }
    final Expression.BinaryOperation binary = (Expression.BinaryOperation) e;
    for (Expression operand : new Expression[] {binary.left, binary.right}) {
      final Expression.@Nullable Reference x =
          plainReference(analyzed, operand, PolynomialType.COMMITTED);
      if (x == null || x.poly.index != null) {
        continue;
      }
      final Expression one = pil.number(1);
      if (e.equals(pil.times(x, pil.minus(one, x)))
          || e.equals(pil.times(pil.minus(one, x), x))
          || e.equals(pil.times(x, pil.minus(x, one)))
          || e.equals(pil.times(pil.minus(x, one), x))) {
        return analyzed.definition(x.poly.name).poly;
      }
    }
    return null;
  }

  /** If an expression is a reference to the current row of a column of a
   * given type, returns it. */
  private static Expression.@Nullable Reference plainReference(
      Analyzed analyzed, Expression e, PolynomialType polyType) {
    if (e.op != Op.POLYNOMIAL_REFERENCE) {
      return null;
    }
    final Expression.Reference reference = (Expression.Reference) e;
    if (reference.poly.next
        || analyzed.definition(reference.poly.name).poly.polyType
            != polyType) {
      return null;
    }
    return reference;
  }
}

// End GlobalConstraints.java

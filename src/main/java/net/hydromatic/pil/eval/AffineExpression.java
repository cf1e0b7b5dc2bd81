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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.IntFunction;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Affine expression {@code c1 * x1 + ... + cn * xn + offset} over unknown
 * columns, identified by id.
 *
 * <p>Coefficients are never zero; a column whose coefficient cancels out is
 * removed.
 */
public final class AffineExpression {
  public static final AffineExpression ZERO = constant(FieldElement.ZERO);

  public final SortedMap<Integer, FieldElement> coefficients;
  public final FieldElement offset;

  private AffineExpression(Map<Integer, FieldElement> coefficients,
      FieldElement offset) {
    this.coefficients = ImmutableSortedMap.copyOf(coefficients);
    this.offset = requireNonNull(offset);
  }

  public static AffineExpression constant(FieldElement value) {
    return new AffineExpression(ImmutableSortedMap.of(), value);
  }

  /** Returns an expression that is just the given variable. */
  public static AffineExpression variable(int id) {
    return new AffineExpression(ImmutableSortedMap.of(id, FieldElement.ONE),
        FieldElement.ZERO);
  }

  public boolean isConstant() {
    return coefficients.isEmpty();
  }

  /** Returns the value of a constant expression. */
  public FieldElement constantValue() {
    checkState(isConstant(), "not constant: %s", this);
    return offset;
  }

  /** Returns the ids of the variables, in ascending order. */
  public List<Integer> nonzeroVariables() {
    return ImmutableList.copyOf(coefficients.keySet());
  }

  public AffineExpression plus(AffineExpression o) {
    final SortedMap<Integer, FieldElement> map = new TreeMap<>(coefficients);
    o.coefficients.forEach((id, c) -> {
      final FieldElement sum = map.getOrDefault(id, FieldElement.ZERO).plus(c);
      if (sum.isZero()) {
        map.remove(id);
      } else {
        map.put(id, sum);
      }
    });
    return new AffineExpression(map, offset.plus(o.offset));
  }

  public AffineExpression minus(AffineExpression o) {
    return plus(o.negate());
  }

  public AffineExpression negate() {
    return times(FieldElement.ONE.negate());
  }

  public AffineExpression times(FieldElement factor) {
    if (factor.isZero()) {
      return ZERO;
    }
    final SortedMap<Integer, FieldElement> map = new TreeMap<>();
    coefficients.forEach((id, c) -> map.put(id, c.times(factor)));
    return new AffineExpression(map, offset.times(factor));
  }

  /** Solves {@code this = 0}, ignoring bit constraints.
   *
   * <p>With no variables, the result is complete if the offset is zero.
   * With one variable, the result assigns it. With more, the equation has
   * several solutions.
   *
   * @throws EvalException if the equation has no solution */
  public EvalValue solve() {
    switch (coefficients.size()) {
    case 0:
      if (offset.isZero()) {
        return EvalValue.complete();
      }
      throw new EvalException(EvalError.constraintUnsatisfiable(toString()));
    case 1:
      final int id = coefficients.firstKey();
      final FieldElement value =
          offset.negate().divide(coefficients.get(id));
      return EvalValue.complete(
          ImmutableList.of(EvalValue.entry(id, Constraint.assignment(value))));
    default:
      return EvalValue.incomplete(
          IncompleteCause.of(IncompleteCause.Kind.MULTIPLE_LINEAR_SOLUTIONS));
    }
  }

  /** Solves {@code this = 0}, using bit constraints of the variables if the
   * equation alone does not determine them.
   *
   * <p>First tries {@link #solve()}. If that does not determine the
   * variables, tries to transfer bit constraints from all other variables
   * to the single variable that does not have one. Failing that, tries to
   * decompose the negated offset into the disjoint bit ranges of the
   * variables.
   *
   * @throws EvalException if the equation has no solution, or if the bits
   * of the offset are not covered by the bit constraints */
  public EvalValue solveWithBitConstraints(BitConstraintSet constraints) {
    final EvalValue value = solve();
    if (value.isComplete()) {
      return value;
    }
    final EvalValue transferred = transferConstraints(constraints);
    if (transferred != null) {
      return transferred;
    }
    return solveThroughBitConstraints(constraints);
  }

  /** If exactly one variable has no bit constraint, has coefficient 1 or
   * -1, and the other terms have disjoint bit constraints, returns the bit
   * constraint that variable must satisfy; otherwise null. */
  private @Nullable EvalValue transferConstraints(
      BitConstraintSet constraints) {
    Integer unconstrained = null;
    for (int id : coefficients.keySet()) {
      if (constraints.bitConstraint(id) == null) {
        if (unconstrained != null) {
          return null;
        }
        unconstrained = id;
      }
    }
    if (unconstrained == null) {
      return null;
    }
    final FieldElement coefficient = coefficients.get(unconstrained);
    final FieldElement dividend;
    if (coefficient.isOne()) {
      dividend = FieldElement.ONE.negate();
    } else if (coefficient.negate().isOne()) {
      dividend = FieldElement.ONE;
    } else {
      return null;
    }
    BitConstraint result = BitConstraint.fromValue(offset.times(dividend));
    for (Map.Entry<Integer, FieldElement> e : coefficients.entrySet()) {
      if (e.getKey().equals(unconstrained)) {
        continue;
      }
      final BitConstraint multiple =
          requireNonNull(constraints.bitConstraint(e.getKey()))
              .multiple(e.getValue().times(dividend));
      if (multiple == null || !multiple.isDisjoint(result)) {
        return null;
      }
      result = result.disjunction(multiple);
    }
    return EvalValue.incompleteWithConstraints(
        ImmutableList.of(
            EvalValue.entry(unconstrained, Constraint.bitConstraint(result))),
        IncompleteCause.of(IncompleteCause.Kind.NOT_CONCRETE));
  }

  private EvalValue solveThroughBitConstraints(
      BitConstraintSet constraints) {
    final List<Integer> unconstrained = new ArrayList<>();
    for (int id : coefficients.keySet()) {
      if (constraints.bitConstraint(id) == null) {
        unconstrained.add(id);
      }
    }
    if (!unconstrained.isEmpty()) {
      return EvalValue.incomplete(
          IncompleteCause.bitUnconstrained(unconstrained));
    }

    // Each variable occupies a range of bits, shifted by its coefficient.
    final List<Map.Entry<Integer, BitConstraint>> masks = new ArrayList<>();
    BitConstraint covered = BitConstraint.fromMask(BigInteger.ZERO);
    for (Map.Entry<Integer, FieldElement> e : coefficients.entrySet()) {
      final BitConstraint shifted =
          requireNonNull(constraints.bitConstraint(e.getKey()))
              .multiple(e.getValue());
      if (shifted == null) {
        return EvalValue.incomplete(
            IncompleteCause.bitUnconstrained(ImmutableList.of(e.getKey())));
      }
      if (!shifted.isDisjoint(covered)) {
        return EvalValue.incomplete(
            IncompleteCause.of(
                IncompleteCause.Kind.OVERLAPPING_BIT_CONSTRAINTS));
      }
      covered = covered.disjunction(shifted);
      masks.add(Maps.immutableEntry(e.getKey(), shifted));
    }

    final BigInteger target = offset.negate().toBigInteger();
    if (target.andNot(covered.mask()).signum() != 0) {
      throw new EvalException(EvalError.CONFLICTING_BIT_CONSTRAINTS);
    }
    final ImmutableList.Builder<Map.Entry<Integer, Constraint>> b =
        ImmutableList.builder();
    for (Map.Entry<Integer, BitConstraint> e : masks) {
      final FieldElement coefficient = coefficients.get(e.getKey());
      final BigInteger bits = target.and(e.getValue().mask());
      final FieldElement value = FieldElement.of(
          bits.shiftRight(coefficient.toBigInteger().getLowestSetBit()));
      b.add(EvalValue.entry(e.getKey(), Constraint.assignment(value)));
    }
    return EvalValue.complete(b.build());
  }

  @Override public int hashCode() {
    return Objects.hash(coefficients, offset);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof AffineExpression
            && coefficients.equals(((AffineExpression) o).coefficients)
            && offset.equals(((AffineExpression) o).offset);
  }

  @Override public String toString() {
    return describe(id -> "#" + id);
  }

  /** Renders this expression, naming variables by a given function. */
  public String describe(IntFunction<String> namer) {
    final StringBuilder buf = new StringBuilder();
    coefficients.forEach((id, c) -> {
      if (buf.length() > 0) {
        buf.append(" + ");
      }
      if (!c.isOne()) {
        buf.append(c).append(" * ");
      }
      buf.append(namer.apply(id));
    });
    if (buf.length() == 0) {
      buf.append(offset);
    } else if (!offset.isZero()) {
      buf.append(" + ").append(offset);
    }
    return buf.toString();
  }
}

// End AffineExpression.java

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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.Polynomial;
import net.hydromatic.pil.ast.PolynomialReference;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Values of the witness columns on two consecutive rows: the current row,
 * whose values are settled, and the next row, whose values are being
 * derived.
 *
 * <p>Unknown cells of the next row are the variables of the affine
 * expressions that identities evaluate to; a variable's id is the id of its
 * witness column. Unknown cells of the current row cannot be solved for.
 *
 * <p>Not thread-safe.
 */
public class RowPair implements SymbolicVariables {
  private final Analyzed analyzed;
  private final FixedData fixedData;
  private final List<String> witnessNames;
  private final Map<String, FieldElement> publics;
  /** Index of the next row; the current row is {@code row - 1}, wrapping
   * around the degree. */
  public final long row;
  private final @Nullable FieldElement[] current;
  private final @Nullable FieldElement[] next;
  private SimpleBitConstraintSet bitConstraints;

  /** Shifted view, in which references to the current row refer to the next
   * row. */
  private final SymbolicVariables shifted = new SymbolicVariables() {
    @Override public AffineResult value(Polynomial poly,
        PolynomialReference reference) {
      if (reference.next) {
        return unimplemented("reference " + reference
            + " two rows ahead");
      }
      return RowPair.this.value(poly, reference.withNext(true));
    }

    @Override public AffineResult publicValue(String name) {
      return RowPair.this.publicValue(name);
    }
  };

  /** Creates a row pair.
   *
   * @param analyzed       Program
   * @param fixedData      Values of fixed columns
   * @param witnessNames   Names of the witness columns, indexed by id
   * @param publics        Values of public declarations known so far
   * @param row            Index of the next row
   * @param current        Values of the current row; nulls for unknown
   * @param bitConstraints Bit constraints that hold on every row
   */
  public RowPair(Analyzed analyzed, FixedData fixedData,
      List<String> witnessNames, Map<String, FieldElement> publics, long row,
      @Nullable FieldElement[] current,
      SimpleBitConstraintSet bitConstraints) {
    checkArgument(current.length == witnessNames.size(),
        "expected %s values, got %s", witnessNames.size(), current.length);
    this.analyzed = requireNonNull(analyzed);
    this.fixedData = requireNonNull(fixedData);
    this.witnessNames = ImmutableList.copyOf(witnessNames);
    this.publics = requireNonNull(publics);
    this.row = row;
    this.current = current.clone();
    this.next = new FieldElement[current.length];
    this.bitConstraints = requireNonNull(bitConstraints);
  }

  /** Returns an evaluator for expressions on this pair of rows.
   *
   * @param shifted Whether references to the current row should refer to
   *                the next row; used for identities that do not refer to
   *                the next row, so that they constrain the row being
   *                derived */
  public ExpressionEvaluator evaluator(boolean shifted) {
    return new ExpressionEvaluator(analyzed, shifted ? this.shifted : this);
  }

  @Override public AffineResult value(Polynomial poly,
      PolynomialReference reference) {
    final long offset = reference.offset();
    final String columnName = poly.columnName(offset);
    switch (poly.polyType) {
    case CONSTANT:
      return constant(
          fixedData.value(columnName, reference.next ? row : row - 1));
    case COMMITTED:
      final int id = Math.toIntExact(poly.id + offset);
      checkArgument(id < next.length, "unknown witness column %s", id);
      if (reference.next) {
        final FieldElement value = next[id];
        return value != null
            ? constant(value)
            : AffineResult.of(AffineExpression.variable(id));
      } else {
        final FieldElement value = current[id];
        return value != null
            ? constant(value)
            : AffineResult.incomplete(
                IncompleteCause.previousValueUnknown(columnName));
      }
    default:
      return unimplemented("reference to " + poly);
    }
  }

  @Override public AffineResult publicValue(String name) {
    final FieldElement value = publics.get(name);
    return value != null
        ? constant(value)
        : unimplemented("public value " + name + " is not yet known");
  }

  public BitConstraintSet bitConstraints() {
    return bitConstraints;
  }

  /** Applies the constraints of a value to the next row.
   *
   * @return whether anything was learned
   * @throws EvalException if an assignment contradicts a known value */
  public boolean apply(EvalValue value) {
    boolean progress = false;
    for (Map.Entry<Integer, Constraint> e : value.constraints()) {
      final int id = e.getKey();
      final Constraint constraint = e.getValue();
      switch (constraint.kind) {
      case ASSIGNMENT:
        final FieldElement previous = next[id];
        if (previous == null) {
          next[id] = constraint.value();
          progress = true;
        } else if (!previous.equals(constraint.value())) {
          throw new EvalException(
              EvalError.constraintUnsatisfiable(witnessNames.get(id)
                  + " on row " + row + " is " + previous + " but "
                  + constraint.value() + " was derived"));
        }
        break;
      case BIT_CONSTRAINT:
        final BitConstraint known = bitConstraints.bitConstraint(id);
        final BitConstraint merged = known == null
            ? constraint.bits()
            : known.conjunction(constraint.bits());
        if (!merged.equals(known)) {
          bitConstraints = bitConstraints.with(id, merged);
          progress = true;
        }
        break;
      default:
        throw new AssertionError("unknown kind " + constraint.kind);
      }
    }
    return progress;
  }

  /** Sets an unknown cell of the next row. */
  public void setNext(int id, FieldElement value) {
    checkArgument(next[id] == null, "%s is already known",
        witnessNames.get(id));
    next[id] = requireNonNull(value);
  }

  public @Nullable FieldElement nextValue(int id) {
    return next[id];
  }

  /** Returns a copy of the values of the next row. */
  public @Nullable FieldElement[] nextRow() {
    return next.clone();
  }

  /** Returns whether every cell of the next row is known. */
  public boolean isComplete() {
    return unknownColumns().isEmpty();
  }

  /** Returns the names of the witness columns whose value on the next row is
   * not known. */
  public List<String> unknownColumns() {
    final List<String> list = new ArrayList<>();
    for (int i = 0; i < next.length; i++) {
      if (next[i] == null) {
        list.add(witnessNames.get(i));
      }
    }
    return list;
  }

  private static AffineResult constant(FieldElement value) {
    return AffineResult.of(AffineExpression.constant(value));
  }

  private static AffineResult unimplemented(String detail) {
    return AffineResult.incomplete(
        IncompleteCause.expressionEvaluationUnimplemented(detail));
  }

  @Override public String toString() {
    return "row " + row + ": current " + Arrays.toString(current)
        + ", next " + Arrays.toString(next);
  }
}

// End RowPair.java

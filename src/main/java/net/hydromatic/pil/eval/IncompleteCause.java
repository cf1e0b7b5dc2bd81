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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reason why an evaluation could not fully resolve.
 *
 * <p>An incomplete evaluation is not an error. It tells the caller that
 * retrying, after other identities have resolved more unknowns, might
 * succeed. {@link #isRetryable()} says whether that is plausible.
 *
 * <p>Causes are combined, never overwritten, so that a report of
 * non-convergence lists every obstruction encountered.
 */
public final class IncompleteCause {
  public final Kind kind;
  private final @Nullable String detail;
  private final @Nullable String column;
  private final List<Integer> indices;
  private final List<IncompleteCause> causes;

  private IncompleteCause(Kind kind, @Nullable String detail,
      @Nullable String column, List<Integer> indices,
      List<IncompleteCause> causes) {
    this.kind = requireNonNull(kind);
    this.detail = detail;
    this.column = column;
    this.indices = ImmutableList.copyOf(indices);
    this.causes = ImmutableList.copyOf(causes);
  }

  /** Creates a cause that has no payload. */
  public static IncompleteCause of(Kind kind) {
    checkArgument(!kind.hasPayload, "%s requires a payload", kind);
    return new IncompleteCause(kind, null, null, ImmutableList.of(),
        ImmutableList.of());
  }

  /** The value of a column on the current row is not known, so a value on
   * the next row cannot be derived. Example: {@code x' = x} where {@code x}
   * is unknown. */
  public static IncompleteCause previousValueUnknown(String column) {
    return new IncompleteCause(Kind.PREVIOUS_VALUE_UNKNOWN, null,
        requireNonNull(column), ImmutableList.of(), ImmutableList.of());
  }

  /** Some variables of an expression are not bit-constrained. Example:
   * {@code x + y == 0x3} with {@code x | 0x1}. */
  public static IncompleteCause bitUnconstrained(List<Integer> indices) {
    return new IncompleteCause(Kind.BIT_UNCONSTRAINED, null, null, indices,
        ImmutableList.of());
  }

  /** The oracle had no answer to a query for a column. */
  public static IncompleteCause noQueryAnswer(String query, String column) {
    return new IncompleteCause(Kind.NO_QUERY_ANSWER, requireNonNull(query),
        requireNonNull(column), ImmutableList.of(), ImmutableList.of());
  }

  /** An expression cannot be evaluated. */
  public static IncompleteCause expressionEvaluationUnimplemented(
      String detail) {
    return new IncompleteCause(Kind.EXPRESSION_EVALUATION_UNIMPLEMENTED,
        requireNonNull(detail), null, ImmutableList.of(), ImmutableList.of());
  }

  /** Creates a cause that aggregates several others. Nested aggregates are
   * flattened, so the result never contains a {@link Kind#MULTIPLE}. */
  public static IncompleteCause multiple(List<IncompleteCause> causes) {
    checkArgument(!causes.isEmpty(), "no causes");
    final ImmutableList.Builder<IncompleteCause> b = ImmutableList.builder();
    for (IncompleteCause cause : causes) {
      b.addAll(cause.elements());
    }
    return new IncompleteCause(Kind.MULTIPLE, null, null, ImmutableList.of(),
        b.build());
  }

  /** Combines this cause with another, accumulating both.
   *
   * <p>The result is always a {@link Kind#MULTIPLE} whose elements are the
   * elements of this followed by the elements of {@code other}. */
  public IncompleteCause combine(IncompleteCause other) {
    return multiple(ImmutableList.of(this, other));
  }

  /** Returns the causes this cause consists of: the elements if it is a
   * {@link Kind#MULTIPLE}, otherwise just this. */
  public List<IncompleteCause> elements() {
    return kind == Kind.MULTIPLE ? causes : ImmutableList.of(this);
  }

  /** Returns whether retrying, after other progress has been made, might
   * resolve this cause. */
  public boolean isRetryable() {
    switch (kind) {
    case QUADRATIC_TERM:
    case DIVISION_TERM:
    case EXPONENTIATION_TERM:
    case NO_MATCH_ARM_FOUND:
      return false;
    case PREVIOUS_VALUE_UNKNOWN:
    case BIT_UNCONSTRAINED:
    case OVERLAPPING_BIT_CONSTRAINTS:
    case MULTIPLE_LOOKUP_MATCHES:
    case MULTIPLE_LINEAR_SOLUTIONS:
    case NO_PROGRESS_TRANSFERRING:
    case NO_QUERY_ANSWER:
    case NON_CONSTANT_QUERY_MATCH_SCRUTINEE:
    case NON_CONSTANT_LEFT_SELECTOR:
    case NON_CONSTANT_WRITE_VALUE:
    case EXPRESSION_EVALUATION_UNIMPLEMENTED:
    case SOLVING_FAILED:
    case NOT_CONCRETE:
      return true;
    case MULTIPLE:
      return causes.stream().anyMatch(IncompleteCause::isRetryable);
    default:
      throw new AssertionError("unknown kind " + kind);
    }
  }

  /** Returns the name of the column of a
   * {@link Kind#PREVIOUS_VALUE_UNKNOWN} or {@link Kind#NO_QUERY_ANSWER}. */
  public String column() {
    checkState(column != null, "%s has no column", kind);
    return column;
  }

  /** Returns the query of a {@link Kind#NO_QUERY_ANSWER}, or the detail of an
   * {@link Kind#EXPRESSION_EVALUATION_UNIMPLEMENTED}. */
  public String detail() {
    checkState(detail != null, "%s has no detail", kind);
    return detail;
  }

  /** Returns the indices of the variables of a
   * {@link Kind#BIT_UNCONSTRAINED}. */
  public List<Integer> indices() {
    checkState(kind == Kind.BIT_UNCONSTRAINED, "%s has no indices", kind);
    return indices;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, detail, column, indices, causes);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof IncompleteCause
            && kind == ((IncompleteCause) o).kind
            && Objects.equals(detail, ((IncompleteCause) o).detail)
            && Objects.equals(column, ((IncompleteCause) o).column)
            && indices.equals(((IncompleteCause) o).indices)
            && causes.equals(((IncompleteCause) o).causes);
  }

  @Override
  public String toString() {
    final String name =
        CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, kind.name());
    switch (kind) {
    case PREVIOUS_VALUE_UNKNOWN:
      return name + "(" + column + ")";
    case BIT_UNCONSTRAINED:
      return name + "(" + indices + ")";
    case NO_QUERY_ANSWER:
      return name + "(" + detail + ", " + column + ")";
    case EXPRESSION_EVALUATION_UNIMPLEMENTED:
      return name + "(" + detail + ")";
    case MULTIPLE:
      return name + "(" + causes + ")";
    case OVERLAPPING_BIT_CONSTRAINTS:
    case MULTIPLE_LOOKUP_MATCHES:
    case MULTIPLE_LINEAR_SOLUTIONS:
    case NO_PROGRESS_TRANSFERRING:
    case QUADRATIC_TERM:
    case DIVISION_TERM:
    case EXPONENTIATION_TERM:
    case NON_CONSTANT_QUERY_MATCH_SCRUTINEE:
    case NON_CONSTANT_LEFT_SELECTOR:
    case NON_CONSTANT_WRITE_VALUE:
    case NO_MATCH_ARM_FOUND:
    case SOLVING_FAILED:
    case NOT_CONCRETE:
      return name;
    default:
      throw new AssertionError("unknown kind " + kind);
    }
  }

  /** Kind of incomplete cause. */
  public enum Kind {
    /** Value of a witness column on the current row is not known when
     * trying to derive a value on the next row. Retrying after that row
     * resolves may help. */
    PREVIOUS_VALUE_UNKNOWN(true),
    /** Some variables of an expression are not bit-constrained, so the
     * expression cannot be decomposed into bits. */
    BIT_UNCONSTRAINED(true),
    /** Bit constraints of the variables of an expression overlap. Example:
     * {@code x + y == 0x3} with {@code x | 0x3} and {@code y | 0x3}. */
    OVERLAPPING_BIT_CONSTRAINTS(false),
    /** Several rows match a lookup. Example:
     * {@code {x, 1} in [{1, 1}, {2, 1}]}. */
    MULTIPLE_LOOKUP_MATCHES(false),
    /** An affine constraint does not have a unique solution. Example:
     * {@code x + y == 0}. */
    MULTIPLE_LINEAR_SOLUTIONS(false),
    /** A pass over the identities made no progress. */
    NO_PROGRESS_TRANSFERRING(false),
    /** Quadratic term in what should be an affine expression. Example:
     * {@code a * b + 2 * c + d}. */
    QUADRATIC_TERM(false),
    /** Division by a non-constant in what should be an affine expression.
     * Example: {@code a / b + 2 * c + d}. */
    DIVISION_TERM(false),
    /** Exponentiation in what should be an affine expression. Example:
     * {@code a ** b + 2 * c + d}. */
    EXPONENTIATION_TERM(false),
    /** The oracle had no answer for a query; arguments are the query and
     * the column. */
    NO_QUERY_ANSWER(true),
    /** The scrutinee of a match is not constant. Example: evaluating
     * {@code match x { 1 => 1, _ => 0 }} where {@code x} is unknown. */
    NON_CONSTANT_QUERY_MATCH_SCRUTINEE(false),
    /** The left selector of a lookup is not constant. Example:
     * {@code x { 1 } in { ONE }} where {@code x} is unknown. */
    NON_CONSTANT_LEFT_SELECTOR(false),
    /** A value to be written is not constant. */
    NON_CONSTANT_WRITE_VALUE(false),
    /** An expression cannot be evaluated. */
    EXPRESSION_EVALUATION_UNIMPLEMENTED(true),
    /** The scrutinee of a match is constant but matches no arm. Example:
     * {@code match x { 1 => 2, 3 => 4 }} where {@code x == 0}. */
    NO_MATCH_ARM_FOUND(false),
    /** Every solving approach has been tried and failed. */
    SOLVING_FAILED(false),
    /** Some knowledge was learned, but not a concrete value. Example:
     * {@code Y = X} where {@code Y} is boolean; we learn that {@code X} is
     * boolean, but not its value. */
    NOT_CONCRETE(false),
    /** Several causes found together. */
    MULTIPLE(true);

    /** Whether causes of this kind carry data, and therefore must be created
     * by a dedicated factory method rather than {@link #of(Kind)}. */
    final boolean hasPayload;

    Kind(boolean hasPayload) {
      this.hasPayload = hasPayload;
    }
  }
}

// End IncompleteCause.java

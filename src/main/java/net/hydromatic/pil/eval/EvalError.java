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
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Hard failure of an evaluation.
 *
 * <p>Unlike an {@link IncompleteCause}, an error means that retrying will
 * not help. Errors travel to callers inside an {@link EvalException}.
 */
public final class EvalError {
  public static final EvalError ROWS_EXHAUSTED =
      new EvalError(Kind.ROWS_EXHAUSTED, null, ImmutableList.of());
  public static final EvalError CONFLICTING_BIT_CONSTRAINTS =
      new EvalError(Kind.CONFLICTING_BIT_CONSTRAINTS, null,
          ImmutableList.of());
  public static final EvalError FIXED_LOOKUP_FAILED =
      new EvalError(Kind.FIXED_LOOKUP_FAILED, null, ImmutableList.of());

  public final Kind kind;
  private final @Nullable String detail;
  private final List<EvalError> errors;

  private EvalError(Kind kind, @Nullable String detail,
      List<EvalError> errors) {
    this.kind = requireNonNull(kind);
    this.detail = detail;
    this.errors = ImmutableList.copyOf(errors);
  }

  /** Creates an error saying that an affine constraint cannot hold. The
   * detail is usually the rendered constraint. */
  public static EvalError constraintUnsatisfiable(String detail) {
    return new EvalError(Kind.CONSTRAINT_UNSATISFIABLE, requireNonNull(detail),
        ImmutableList.of());
  }

  /** Creates an error with a free-form message. */
  public static EvalError generic(String message) {
    return new EvalError(Kind.GENERIC, requireNonNull(message),
        ImmutableList.of());
  }

  /** Creates an error that aggregates several others. Nested aggregates are
   * flattened. */
  public static EvalError multiple(List<EvalError> errors) {
    checkArgument(!errors.isEmpty(), "no errors");
    final ImmutableList.Builder<EvalError> b = ImmutableList.builder();
    for (EvalError error : errors) {
      b.addAll(error.elements());
    }
    return new EvalError(Kind.MULTIPLE, null, b.build());
  }

  /** Combines this error with another; the elements of this come first. */
  public EvalError combine(EvalError other) {
    return multiple(ImmutableList.of(this, other));
  }

  /** Returns the errors this error consists of: the elements if it is a
   * {@link Kind#MULTIPLE}, otherwise just this. */
  public List<EvalError> elements() {
    return kind == Kind.MULTIPLE ? errors : ImmutableList.of(this);
  }

  /** Returns whether this error makes the whole generation fail, as opposed
   * to just the current attempt. */
  public boolean isFatal() {
    switch (kind) {
    case ROWS_EXHAUSTED:
    case CONSTRAINT_UNSATISFIABLE:
    case CONFLICTING_BIT_CONSTRAINTS:
      return true;
    case FIXED_LOOKUP_FAILED:
    case GENERIC:
      return false;
    case MULTIPLE:
      return errors.stream().anyMatch(EvalError::isFatal);
    default:
      throw new AssertionError("unknown kind " + kind);
    }
  }

  /** Returns a human-readable message. The message of a
   * {@link Kind#MULTIPLE} is the messages of its elements, one per line. */
  public String message() {
    switch (kind) {
    case ROWS_EXHAUSTED:
      return "Table rows exhausted";
    case CONSTRAINT_UNSATISFIABLE:
      return "Linear constraint is not satisfiable: " + detail;
    case CONFLICTING_BIT_CONSTRAINTS:
      return "Bit constraints in the expression are conflicting or do not "
          + "match the constant / offset.";
    case FIXED_LOOKUP_FAILED:
      return "Lookup into fixed columns failed: no match";
    case GENERIC:
      return requireNonNull(detail);
    case MULTIPLE:
      final StringBuilder buf = new StringBuilder();
      for (EvalError error : errors) {
        if (buf.length() > 0) {
          buf.append('\n');
        }
        buf.append(error.message());
      }
      return buf.toString();
    default:
      throw new AssertionError("unknown kind " + kind);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, detail, errors);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof EvalError
            && kind == ((EvalError) o).kind
            && Objects.equals(detail, ((EvalError) o).detail)
            && errors.equals(((EvalError) o).errors);
  }

  @Override
  public String toString() {
    return message();
  }

  /** Kind of evaluation error. */
  public enum Kind {
    /** A row beyond the degree was requested. */
    ROWS_EXHAUSTED,
    /** An affine constraint has no solution. */
    CONSTRAINT_UNSATISFIABLE,
    /** Bit constraints contradict each other or the constant. */
    CONFLICTING_BIT_CONSTRAINTS,
    /** No row of the fixed columns matches a lookup. */
    FIXED_LOOKUP_FAILED,
    GENERIC,
    MULTIPLE
  }
}

// End EvalError.java

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

import java.util.Objects;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Fact learned about a single column: either its concrete value, or a
 * constraint on its bits. */
public final class Constraint {
  public final Kind kind;
  private final @Nullable FieldElement value;
  private final @Nullable BitConstraint bitConstraint;

  private Constraint(Kind kind, @Nullable FieldElement value,
      @Nullable BitConstraint bitConstraint) {
    this.kind = kind;
    this.value = value;
    this.bitConstraint = bitConstraint;
  }

  /** Creates a constraint that assigns a value to a column. */
  public static Constraint assignment(FieldElement value) {
    return new Constraint(Kind.ASSIGNMENT, requireNonNull(value), null);
  }

  /** Creates a constraint that restricts the bits of a column. */
  public static Constraint bitConstraint(BitConstraint bitConstraint) {
    return new Constraint(Kind.BIT_CONSTRAINT, null,
        requireNonNull(bitConstraint));
  }

  /** Returns the value of an assignment. */
  public FieldElement value() {
    checkState(value != null, "not an assignment: %s", this);
    return value;
  }

  /** Returns the bit constraint of a bit constraint. */
  public BitConstraint bits() {
    checkState(bitConstraint != null, "not a bit constraint: %s", this);
    return bitConstraint;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value, bitConstraint);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Constraint
            && kind == ((Constraint) o).kind
            && Objects.equals(value, ((Constraint) o).value)
            && Objects.equals(bitConstraint, ((Constraint) o).bitConstraint);
  }

  @Override
  public String toString() {
    switch (kind) {
    case ASSIGNMENT:
      return " = " + value;
    case BIT_CONSTRAINT:
      return ":& " + bitConstraint;
    default:
      throw new AssertionError("unknown kind " + kind);
    }
  }

  /** Kind of constraint. */
  public enum Kind {
    ASSIGNMENT,
    BIT_CONSTRAINT
  }
}

// End Constraint.java

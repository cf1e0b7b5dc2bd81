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
package net.hydromatic.pil.ast;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Definition of the values of a polynomial.
 *
 * <p>A {@link Kind#MAPPING} computes the value on each row from an expression
 * whose local variable 0 is the row index; an {@link Kind#ARRAY} lists the
 * values explicitly; a {@link Kind#QUERY} asks an external oracle for the
 * value on each row.
 */
public class FunctionValueDefinition {
  public final Kind kind;
  private final @Nullable Expression expression;
  private final List<RepeatedArray> arrays;

  private FunctionValueDefinition(Kind kind, @Nullable Expression expression,
      List<RepeatedArray> arrays) {
    this.kind = requireNonNull(kind);
    this.expression = expression;
    this.arrays = ImmutableList.copyOf(arrays);
  }

  /** Creates a definition that computes each row from an expression. */
  public static FunctionValueDefinition mapping(Expression expression) {
    return new FunctionValueDefinition(Kind.MAPPING,
        requireNonNull(expression), ImmutableList.of());
  }

  /** Creates a definition from explicit, possibly repeated, values. */
  public static FunctionValueDefinition array(List<RepeatedArray> arrays) {
    return new FunctionValueDefinition(Kind.ARRAY, null, arrays);
  }

  /** Creates a definition whose values are requested from an oracle. */
  public static FunctionValueDefinition query(Expression expression) {
    return new FunctionValueDefinition(Kind.QUERY,
        requireNonNull(expression), ImmutableList.of());
  }

  /** Returns the expression of a mapping or query. */
  public Expression expression() {
    checkState(expression != null, "%s has no expression", kind);
    return expression;
  }

  /** Returns the segments of an array definition. */
  public List<RepeatedArray> arrays() {
    checkState(kind == Kind.ARRAY, "%s is not an array", kind);
    return arrays;
  }

  /** Returns the total number of values in an array definition. */
  public long arraySize() {
    return arrays().stream().mapToLong(RepeatedArray::size).sum();
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, expression, arrays);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FunctionValueDefinition
            && kind == ((FunctionValueDefinition) o).kind
            && Objects.equals(expression,
                ((FunctionValueDefinition) o).expression)
            && arrays.equals(((FunctionValueDefinition) o).arrays);
  }

  @Override
  public String toString() {
    switch (kind) {
    case MAPPING:
      return "(i) { " + expression + " }";
    case ARRAY:
      return " = " + arrays;
    case QUERY:
      return "(i) query " + expression;
    default:
      throw new AssertionError("unknown kind " + kind);
    }
  }

  /** Kind of definition. */
  public enum Kind {
    MAPPING,
    ARRAY,
    QUERY
  }
}

// End FunctionValueDefinition.java

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
import java.util.Objects;

/**
 * Constraint that must hold on every active row.
 *
 * <p>For a {@link IdentityKind#POLYNOMIAL} identity, the selector of
 * {@link #left} holds the expression that must be zero, and both sides have
 * no expressions.
 */
public class Identity {
  /** Identifier, unique among identities of the same kind. */
  public final long id;
  public final IdentityKind kind;
  public final SourceRef source;
  public final SelectedExpressions left;
  public final SelectedExpressions right;

  public Identity(long id, IdentityKind kind, SourceRef source,
      SelectedExpressions left, SelectedExpressions right) {
    this.id = id;
    this.kind = requireNonNull(kind);
    this.source = requireNonNull(source);
    this.left = requireNonNull(left);
    this.right = requireNonNull(right);
  }

  /** Creates a polynomial identity, asserting that an expression is zero. */
  public static Identity polynomial(long id, SourceRef source,
      Expression expression) {
    return new Identity(id, IdentityKind.POLYNOMIAL, source,
        new SelectedExpressions(expression, ImmutableList.of()),
        SelectedExpressions.EMPTY);
  }

  /** Returns the expression of a polynomial identity. */
  public Expression expressionForPolyId() {
    checkState(kind == IdentityKind.POLYNOMIAL && left.selector != null,
        "not a polynomial identity: %s", this);
    return left.selector;
  }

  /** Returns whether this identity refers to the next row anywhere. */
  public boolean containsNextReference() {
    return left.containsNextReference() || right.containsNextReference();
  }

  /** Returns whether this identity refers to the next row anywhere,
   * including inside the definitions of intermediate polynomials. */
  public boolean containsNextReference(Analyzed analyzed) {
    return left.containsNextReference(analyzed)
        || right.containsNextReference(analyzed);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, kind, left, right);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Identity
            && id == ((Identity) o).id
            && kind == ((Identity) o).kind
            && left.equals(((Identity) o).left)
            && right.equals(((Identity) o).right);
  }

  @Override
  public String toString() {
    switch (kind) {
    case POLYNOMIAL:
      return expressionForPolyId() + " = 0";
    case PLOOKUP:
    case PERMUTATION:
    case CONNECT:
      return left + kind.padded + right;
    default:
      throw new AssertionError("unknown kind " + kind);
    }
  }
}

// End Identity.java

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

import java.util.function.UnaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of evaluating an expression symbolically: an affine expression, or
 * the reason why one could not be obtained. */
public final class AffineResult {
  private final @Nullable AffineExpression expression;
  private final @Nullable IncompleteCause cause;

  private AffineResult(@Nullable AffineExpression expression,
      @Nullable IncompleteCause cause) {
    this.expression = expression;
    this.cause = cause;
  }

  public static AffineResult of(AffineExpression expression) {
    return new AffineResult(expression, null);
  }

  public static AffineResult incomplete(IncompleteCause cause) {
    return new AffineResult(null, cause);
  }

  public static AffineResult incomplete(IncompleteCause.Kind kind) {
    return incomplete(IncompleteCause.of(kind));
  }

  public boolean isAffine() {
    return expression != null;
  }

  /** Returns whether the result is a constant expression. */
  public boolean isConstant() {
    return expression != null && expression.isConstant();
  }

  public AffineExpression expression() {
    checkState(expression != null, "incomplete: %s", cause);
    return expression;
  }

  public IncompleteCause cause() {
    checkState(cause != null, "not incomplete");
    return cause;
  }

  /** Applies a function to the expression, if there is one. */
  public AffineResult map(UnaryOperator<AffineExpression> f) {
    return expression == null ? this : of(f.apply(expression));
  }

  @Override public String toString() {
    return expression != null ? expression.toString()
        : "Incomplete(" + cause + ")";
  }
}

// End AffineResult.java

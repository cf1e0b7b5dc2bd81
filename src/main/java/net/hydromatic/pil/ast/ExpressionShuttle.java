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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Visits and transforms an {@link Expression}.
 *
 * <p>The default implementations rebuild each node from the transformed
 * children, returning the original node if no child changed.
 */
public class ExpressionShuttle {
  public Expression visit(Expression.Constant constant) {
    return constant;
  }

  public Expression visit(Expression.Reference reference) {
    return reference;
  }

  public Expression visit(Expression.LocalVariable localVariable) {
    return localVariable;
  }

  public Expression visit(Expression.PublicReference publicReference) {
    return publicReference;
  }

  public Expression visit(Expression.NumberLiteral literal) {
    return literal;
  }

  public Expression visit(Expression.StringLiteral literal) {
    return literal;
  }

  public Expression visit(Expression.Tuple tuple) {
    return tuple.copy(visitList(tuple.items));
  }

  public Expression visit(Expression.BinaryOperation operation) {
    return operation.copy(operation.left.accept(this),
        operation.right.accept(this));
  }

  public Expression visit(Expression.UnaryOperation operation) {
    return operation.copy(operation.expression.accept(this));
  }

  public Expression visit(Expression.FunctionCall call) {
    return call.copy(call.name, visitList(call.args));
  }

  public Expression visit(Expression.Match match) {
    final ImmutableList.Builder<Expression.MatchArm> arms =
        ImmutableList.builder();
    match.arms.forEach(arm -> arms.add(arm.copy(arm.value.accept(this))));
    return match.copy(match.scrutinee.accept(this), arms.build());
  }

  /** Transforms each expression in a list. */
  protected List<Expression> visitList(List<Expression> expressions) {
    final ImmutableList.Builder<Expression> b = ImmutableList.builder();
    expressions.forEach(e -> b.add(e.accept(this)));
    return b.build();
  }
}

// End ExpressionShuttle.java

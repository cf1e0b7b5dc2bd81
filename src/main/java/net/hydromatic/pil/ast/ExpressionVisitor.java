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

/**
 * Visits each node of an {@link Expression}.
 *
 * <p>The default implementations visit every child; override the methods
 * for the nodes you are interested in.
 */
public class ExpressionVisitor {
  public void visit(Expression.Constant constant) {
  }

  public void visit(Expression.Reference reference) {
  }

  public void visit(Expression.LocalVariable localVariable) {
  }

  public void visit(Expression.PublicReference publicReference) {
  }

  public void visit(Expression.NumberLiteral literal) {
  }

  public void visit(Expression.StringLiteral literal) {
  }

  public void visit(Expression.Tuple tuple) {
    tuple.items.forEach(e -> e.accept(this));
  }

  public void visit(Expression.BinaryOperation operation) {
    operation.left.accept(this);
    operation.right.accept(this);
  }

  public void visit(Expression.UnaryOperation operation) {
    operation.expression.accept(this);
  }

  public void visit(Expression.FunctionCall call) {
    call.args.forEach(e -> e.accept(this));
  }

  public void visit(Expression.Match match) {
    match.scrutinee.accept(this);
    match.arms.forEach(arm -> arm.value.accept(this));
  }
}

// End ExpressionVisitor.java

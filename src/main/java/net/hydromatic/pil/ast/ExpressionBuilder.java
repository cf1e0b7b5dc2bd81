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
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds expressions. */
public enum ExpressionBuilder {
  /** The singleton instance of the expression builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  pil;

  /** Creates a reference to a named constant, such as "%N". */
  public Expression.Constant constant(String name) {
    return new Expression.Constant(name);
  }

  /** Creates a reference to a polynomial. */
  public Expression.Reference ref(PolynomialReference poly) {
    return new Expression.Reference(poly);
  }

  /** Creates a reference to the current row of a scalar polynomial. */
  public Expression.Reference ref(String name) {
    return ref(new PolynomialReference(name, null, false));
  }

  /** Creates a reference to the next row of a scalar polynomial. */
  public Expression.Reference next(String name) {
    return ref(new PolynomialReference(name, null, true));
  }

  /** Creates a reference to an element of an array polynomial. */
  public Expression.Reference ref(String name, long index, boolean next) {
    return ref(new PolynomialReference(name, index, next));
  }

  public Expression.LocalVariable local(int index) {
    return new Expression.LocalVariable(index);
  }

  public Expression.PublicReference publicRef(String name) {
    return new Expression.PublicReference(name);
  }

  public Expression.NumberLiteral number(FieldElement value) {
    return new Expression.NumberLiteral(value);
  }

  public Expression.NumberLiteral number(long value) {
    return number(FieldElement.of(value));
  }

  public Expression.StringLiteral string(String value) {
    return new Expression.StringLiteral(value);
  }

  public Expression.Tuple tuple(List<Expression> items) {
    return new Expression.Tuple(ImmutableList.copyOf(items));
  }

  public Expression.Tuple tuple(Expression... items) {
    return new Expression.Tuple(ImmutableList.copyOf(items));
  }

  public Expression.BinaryOperation binary(Expression left,
      BinaryOperator operator, Expression right) {
    return new Expression.BinaryOperation(left, operator, right);
  }

  public Expression.BinaryOperation plus(Expression left, Expression right) {
    return binary(left, BinaryOperator.ADD, right);
  }

  public Expression.BinaryOperation minus(Expression left,
      Expression right) {
    return binary(left, BinaryOperator.SUB, right);
  }

  public Expression.BinaryOperation times(Expression left,
      Expression right) {
    return binary(left, BinaryOperator.MUL, right);
  }

  public Expression.UnaryOperation unary(UnaryOperator operator,
      Expression expression) {
    return new Expression.UnaryOperation(operator, expression);
  }

  public Expression.UnaryOperation negate(Expression expression) {
    return unary(UnaryOperator.MINUS, expression);
  }

  public Expression.FunctionCall call(String name, List<Expression> args) {
    return new Expression.FunctionCall(name, ImmutableList.copyOf(args));
  }

  public Expression.FunctionCall call(String name, Expression... args) {
    return new Expression.FunctionCall(name, ImmutableList.copyOf(args));
  }

  public Expression.Match match(Expression scrutinee,
      List<Expression.MatchArm> arms) {
    return new Expression.Match(scrutinee, ImmutableList.copyOf(arms));
  }

  public Expression.Match match(Expression scrutinee,
      Expression.MatchArm... arms) {
    return new Expression.Match(scrutinee, ImmutableList.copyOf(arms));
  }

  /** Creates a match arm; a null pattern matches any value. */
  public Expression.MatchArm arm(@Nullable FieldElement pattern,
      Expression value) {
    return new Expression.MatchArm(pattern, value);
  }

  public Expression.MatchArm arm(long pattern, Expression value) {
    return arm(FieldElement.of(pattern), value);
  }

  /** Creates the default arm of a match, "_ => value". */
  public Expression.MatchArm wildcardArm(Expression value) {
    return arm(null, value);
  }

  /** Returns the expression "left - right", which is zero when an equation
   * "left = right" holds. */
  public Expression equation(Expression left, Expression right) {
    return minus(left, right);
  }
}

// End ExpressionBuilder.java

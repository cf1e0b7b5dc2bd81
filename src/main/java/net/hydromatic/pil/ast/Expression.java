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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.pil.ast.ExpressionBuilder.pil;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expression in an analyzed PIL program.
 *
 * <p>The set of sub-classes is closed; each is identified by its {@link Op}.
 * Code that needs to handle every kind of expression switches on {@link #op}
 * and throws {@link AssertionError} in the {@code default} branch.
 *
 * <p>This class also functions as a namespace, so that we can keep the class
 * names of the sub-classes short. Use {@link ExpressionBuilder#pil} to create
 * instances.
 */
public abstract class Expression {
  /** Precedence of atoms; they never need parentheses. */
  static final int ATOM = 99;

  public final Op op;

  Expression(Op op) {
    this.op = requireNonNull(op);
  }

  /** Converts this expression to a PIL string. */
  @Override
  public final String toString() {
    return unparse(new StringBuilder(), 0, 0).toString();
  }

  /** Appends this expression to a builder, with parentheses if its operator
   * binds more loosely than the surrounding context. */
  abstract StringBuilder unparse(StringBuilder buf, int left, int right);

  /** Accepts a visitor, calling the {@code visit} method appropriate to the
   * type of this expression. */
  public abstract void accept(ExpressionVisitor visitor);

  /** Accepts a shuttle, calling the {@code visit} method appropriate to the
   * type of this expression, and returning the result. */
  public abstract Expression accept(ExpressionShuttle shuttle);

  /** Returns whether this expression contains a reference to the value of a
   * polynomial on the next row. */
  public boolean containsNextReference() {
    final boolean[] found = {false};
    accept(
        new ExpressionVisitor() {
          @Override
          public void visit(Reference reference) {
            found[0] |= reference.poly.next;
          }
        });
    return found[0];
  }

  /** Returns whether this expression refers to the value of a polynomial on
   * the next row, either directly or through the definition of an
   * intermediate polynomial. */
  public boolean containsNextReference(Analyzed analyzed) {
    final boolean[] found = {false};
    final Set<String> expanded = new HashSet<>();
    accept(
        new ExpressionVisitor() {
          @Override
          public void visit(Reference reference) {
            if (found[0]) {
              return;
            }
            if (reference.poly.next) {
              found[0] = true;
              return;
            }
            final Analyzed.@Nullable Definition definition =
                analyzed.definitions.get(reference.poly.name);
            if (definition != null
                && definition.poly.polyType == PolynomialType.INTERMEDIATE
                && definition.value != null
                && definition.value.kind
                    == FunctionValueDefinition.Kind.MAPPING
                && expanded.add(reference.poly.name)) {
              definition.value.expression().accept(this);
            }
          }
        });
    return found[0];
  }

  /** Reference to a named constant.
   *
   * <p>For example, "%N" in "pol commit x; x' = x + %N". */
  public static class Constant extends Expression {
    public final String name;

    Constant(String name) {
      super(Op.CONSTANT);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Constant && name.equals(((Constant) o).name);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(name);
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expression accept(ExpressionShuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Reference to a polynomial. */
  public static class Reference extends Expression {
    public final PolynomialReference poly;

    Reference(PolynomialReference poly) {
      super(Op.POLYNOMIAL_REFERENCE);
      this.poly = requireNonNull(poly);
    }

    @Override
    public int hashCode() {
      return poly.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Reference && poly.equals(((Reference) o).poly);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(poly);
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expression accept(ExpressionShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this reference with a given polynomial,
     * or this if the polynomial is the same. */
    public Reference copy(PolynomialReference poly) {
      return poly.equals(this.poly) ? this : new Reference(poly);
    }
  }

  /** Reference to a parameter of the enclosing function definition.
   *
   * <p>For example, "i" in "pol constant EVEN(i) { 2 * i }" is local
   * variable 0. */
  public static class LocalVariable extends Expression {
    public final int index;

    LocalVariable(int index) {
      super(Op.LOCAL_VARIABLE_REFERENCE);
      this.index = index;
    }

    @Override
    public int hashCode() {
      return index;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof LocalVariable
              && index == ((LocalVariable) o).index;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append('$').append(index);
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expression accept(ExpressionShuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Reference to a public declaration, for example ":out". */
  public static class PublicReference extends Expression {
    public final String name;

    PublicReference(String name) {
      super(Op.PUBLIC_REFERENCE);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof PublicReference
              && name.equals(((PublicReference) o).name);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(':').append(name);
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expression accept(ExpressionShuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Field element literal. */
  public static class NumberLiteral extends Expression {
    public final FieldElement value;

    NumberLiteral(FieldElement value) {
      super(Op.NUMBER);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof NumberLiteral
              && value.equals(((NumberLiteral) o).value);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(value);
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expression accept(ExpressionShuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** String literal. Occurs in queries, for example
   * {@code ("input", i)}. */
  public static class StringLiteral extends Expression {
    public final String value;

    StringLiteral(String value) {
      super(Op.STRING);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof StringLiteral
              && value.equals(((StringLiteral) o).value);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return quote(buf, value);
    }

    /** Appends a string in double quotes, escaping backslashes and
     * quotes. */
    public static StringBuilder quote(StringBuilder buf, String s) {
      buf.append('"');
      for (int i = 0; i < s.length(); i++) {
        final char c = s.charAt(i);
        if (c == '"' || c == '\\') {
          buf.append('\\');
        }
        buf.append(c);
      }
      return buf.append('"');
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expression accept(ExpressionShuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Tuple. */
  public static class Tuple extends Expression {
    public final List<Expression> items;

    Tuple(ImmutableList<Expression> items) {
      super(Op.TUPLE);
      this.items = requireNonNull(items);
    }

    @Override
    public int hashCode() {
      return items.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Tuple && items.equals(((Tuple) o).items);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return appendList(buf.append('('), items).append(')');
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expression accept(ExpressionShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this tuple with given items,
     * or this if the items are the same. */
    public Tuple copy(List<Expression> items) {
      return items.equals(this.items) ? this : pil.tuple(items);
    }
  }

  /** Call to a binary operator, for example "x + 1". */
  public static class BinaryOperation extends Expression {
    public final Expression left;
    public final BinaryOperator operator;
    public final Expression right;

    BinaryOperation(Expression left, BinaryOperator operator,
        Expression right) {
      super(Op.BINARY_OPERATION);
      this.left = requireNonNull(left);
      this.operator = requireNonNull(operator);
      this.right = requireNonNull(right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, operator, right);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof BinaryOperation
              && left.equals(((BinaryOperation) o).left)
              && operator == ((BinaryOperation) o).operator
              && right.equals(((BinaryOperation) o).right);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (left > operator.left || operator.right < right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      this.left.unparse(buf, left, operator.left);
      buf.append(operator.padded);
      return this.right.unparse(buf, operator.right, right);
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expression accept(ExpressionShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this operation with given operands,
     * or this if the operands are the same. */
    public BinaryOperation copy(Expression left, Expression right) {
      return left.equals(this.left) && right.equals(this.right)
          ? this
          : new BinaryOperation(left, operator, right);
    }
  }

  /** Call to a unary operator, for example "-x". */
  public static class UnaryOperation extends Expression {
    public final UnaryOperator operator;
    public final Expression expression;

    UnaryOperation(UnaryOperator operator, Expression expression) {
      super(Op.UNARY_OPERATION);
      this.operator = requireNonNull(operator);
      this.expression = requireNonNull(expression);
    }

    @Override
    public int hashCode() {
      return Objects.hash(operator, expression);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof UnaryOperation
              && operator == ((UnaryOperation) o).operator
              && expression.equals(((UnaryOperation) o).expression);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (left > UnaryOperator.PRECEDENCE) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      buf.append(operator.symbol);
      return expression.unparse(buf, UnaryOperator.PRECEDENCE, right);
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expression accept(ExpressionShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this operation with a given operand,
     * or this if the operand is the same. */
    public UnaryOperation copy(Expression expression) {
      return expression.equals(this.expression)
          ? this
          : new UnaryOperation(operator, expression);
    }
  }

  /** Call to a non-macro function, such as a constant polynomial,
   * for example "BYTE(i + 1)". */
  public static class FunctionCall extends Expression {
    public final String name;
    public final List<Expression> args;

    FunctionCall(String name, ImmutableList<Expression> args) {
      super(Op.FUNCTION_CALL);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionCall
              && name.equals(((FunctionCall) o).name)
              && args.equals(((FunctionCall) o).args);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return appendList(buf.append(name).append('('), args).append(')');
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expression accept(ExpressionShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this call with a given name and arguments,
     * or this if they are the same. */
    public FunctionCall copy(String name, List<Expression> args) {
      return name.equals(this.name) && args.equals(this.args)
          ? this
          : pil.call(name, args);
    }
  }

  /** Match expression.
   *
   * <p>For example, "match i { 0 => 1, _ => 0 }" has two arms; the second,
   * which has no pattern, is the default arm. */
  public static class Match extends Expression {
    public final Expression scrutinee;
    public final List<MatchArm> arms;

    Match(Expression scrutinee, ImmutableList<MatchArm> arms) {
      super(Op.MATCH_EXPRESSION);
      this.scrutinee = requireNonNull(scrutinee);
      this.arms = requireNonNull(arms);
    }

    @Override
    public int hashCode() {
      return Objects.hash(scrutinee, arms);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Match
              && scrutinee.equals(((Match) o).scrutinee)
              && arms.equals(((Match) o).arms);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      buf.append("match ");
      scrutinee.unparse(buf, 0, 0).append(" {");
      for (int i = 0; i < arms.size(); i++) {
        final MatchArm arm = arms.get(i);
        buf.append(i == 0 ? " " : ", ")
            .append(arm.pattern == null ? "_" : arm.pattern)
            .append(" => ");
        arm.value.unparse(buf, 0, 0);
      }
      return buf.append(" }");
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expression accept(ExpressionShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this match with a given scrutinee and arms,
     * or this if they are the same. */
    public Match copy(Expression scrutinee, List<MatchArm> arms) {
      return scrutinee.equals(this.scrutinee) && arms.equals(this.arms)
          ? this
          : pil.match(scrutinee, arms);
    }
  }

  /** Arm of a {@link Match}. If {@link #pattern} is null, the arm matches
   * any value. */
  public static class MatchArm {
    public final @Nullable FieldElement pattern;
    public final Expression value;

    MatchArm(@Nullable FieldElement pattern, Expression value) {
      this.pattern = pattern;
      this.value = requireNonNull(value);
    }

    /** Returns whether this arm applies to a given scrutinee value. */
    public boolean matches(FieldElement scrutinee) {
      return pattern == null || pattern.equals(scrutinee);
    }

    /** Creates a copy of this arm with a given value,
     * or this if the value is the same. */
    public MatchArm copy(Expression value) {
      return value.equals(this.value) ? this : new MatchArm(pattern, value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(pattern, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof MatchArm
              && Objects.equals(pattern, ((MatchArm) o).pattern)
              && value.equals(((MatchArm) o).value);
    }

    @Override
    public String toString() {
      return (pattern == null ? "_" : pattern) + " => " + value;
    }
  }

  private static StringBuilder appendList(StringBuilder buf,
      List<Expression> expressions) {
    for (int i = 0; i < expressions.size(); i++) {
      expressions.get(i).unparse(buf.append(i == 0 ? "" : ", "), 0, 0);
    }
    return buf;
  }
}

// End Expression.java

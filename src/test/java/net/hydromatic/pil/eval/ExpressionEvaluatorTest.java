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

import static net.hydromatic.pil.Programs.program;
import static net.hydromatic.pil.ast.ExpressionBuilder.pil;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.BinaryOperator;
import net.hydromatic.pil.ast.Expression;
import net.hydromatic.pil.ast.Polynomial;
import net.hydromatic.pil.ast.PolynomialReference;
import net.hydromatic.pil.ast.UnaryOperator;
import net.hydromatic.pil.eval.IncompleteCause.Kind;
import net.hydromatic.pil.number.FieldElement;
import org.junit.jupiter.api.Test;

/** Tests {@link ExpressionEvaluator}. */
public class ExpressionEvaluatorTest {
  /** Program with witness columns x, y, w, an intermediate column
   * z = x + 2 * y, and a constant %K = 5. */
  private static final Analyzed ANALYZED = program()
      .constant("%K", pil.number(5))
      .namespace("Main", 4)
      .commit("x", "y", "w")
      .intermediate("z", pil.plus(pil.ref("x"),
          pil.times(pil.number(2), pil.ref("y"))))
      .publicValue("out", "x", 0)
      .analyze();

  /** Variables: on the current row, x is 3, y is unknown but solvable
   * (variable 1), and w is unknown and not solvable. On the next row,
   * column i is variable 100 + i. Public value "out" is 42. */
  private static final SymbolicVariables VARIABLES =
      new SymbolicVariables() {
        @Override public AffineResult value(Polynomial poly,
            PolynomialReference reference) {
          if (reference.next) {
            return AffineResult.of(
                AffineExpression.variable((int) poly.id + 100));
          }
          switch (poly.absoluteName) {
          case "Main.x":
            return AffineResult.of(
                AffineExpression.constant(FieldElement.of(3)));
          case "Main.y":
            return AffineResult.of(AffineExpression.variable(1));
          default:
            return AffineResult.incomplete(
                IncompleteCause.previousValueUnknown(poly.absoluteName));
          }
        }

        @Override public AffineResult publicValue(String name) {
          return AffineResult.of(
              AffineExpression.constant(FieldElement.of(42)));
        }
      };

  private static final Expression X = pil.ref("Main.x");
  private static final Expression Y = pil.ref("Main.y");
  private static final Expression W = pil.ref("Main.w");

  private static AffineResult evaluate(Expression e) {
    return new ExpressionEvaluator(ANALYZED, VARIABLES).evaluate(e);
  }

  private static Expression op(Expression left, BinaryOperator operator,
      Expression right) {
    return pil.binary(left, operator, right);
  }

  private static Expression n(long value) {
    return pil.number(value);
  }

  /** Evaluates an expression that should be constant, and returns its
   * value as a string. */
  private static String constant(Expression e) {
    final AffineResult result = evaluate(e);
    assertThat(result.isConstant(), is(true));
    return result.expression().constantValue().toString();
  }

  private static Kind cause(Expression e) {
    final AffineResult result = evaluate(e);
    assertThat(result.isAffine(), is(false));
    return result.cause().kind;
  }

  @Test void testConstants() {
    assertThat(constant(pil.plus(pil.times(pil.constant("%K"), n(2)), n(1))),
        is("11"));
    assertThat(constant(pil.negate(n(1))), is("18446744069414584320"));
    assertThat(constant(pil.unary(UnaryOperator.PLUS, n(1))), is("1"));
    assertThat(constant(pil.publicRef("out")), is("42"));
    assertThat(cause(pil.constant("%M")),
        is(Kind.EXPRESSION_EVALUATION_UNIMPLEMENTED));
  }

  @Test void testAffine() {
    assertThat(evaluate(pil.plus(X, Y)).expression(), hasToString("#1 + 3"));
    assertThat(evaluate(pil.times(pil.minus(Y, X), n(2))).expression(),
        hasToString("2 * #1 + 18446744069414584315"));
    assertThat(evaluate(pil.next("Main.w")).expression(),
        hasToString("#102"));
  }

  /** Tests that references to an intermediate polynomial are replaced by
   * its definition, on the next row if the reference is to the next
   * row. */
  @Test void testIntermediate() {
    assertThat(evaluate(pil.ref("Main.z")).expression(),
        hasToString("2 * #1 + 3"));
    assertThat(evaluate(pil.next("Main.z")).expression(),
        hasToString("#100 + 2 * #101"));
  }

  /** Tests that a product with a constant zero factor is zero, even if the
   * other factor cannot be evaluated. */
  @Test void testMultiplyByZero() {
    assertThat(constant(pil.times(W, n(0))), is("0"));
    assertThat(constant(pil.times(pil.minus(X, n(3)), pil.times(Y, Y))),
        is("0"));
    assertThat(cause(pil.times(W, n(1))), is(Kind.PREVIOUS_VALUE_UNKNOWN));
  }

  @Test void testNonAffine() {
    assertThat(cause(pil.times(Y, Y)), is(Kind.QUADRATIC_TERM));
    assertThat(cause(op(n(6), BinaryOperator.DIV, Y)),
        is(Kind.DIVISION_TERM));
    assertThat(cause(op(Y, BinaryOperator.POW, n(2))),
        is(Kind.EXPONENTIATION_TERM));
    assertThat(cause(op(Y, BinaryOperator.BINARY_AND, n(1))),
        is(Kind.EXPRESSION_EVALUATION_UNIMPLEMENTED));
    assertThat(cause(pil.call("f", n(1))),
        is(Kind.EXPRESSION_EVALUATION_UNIMPLEMENTED));
    assertThat(cause(pil.string("s")),
        is(Kind.EXPRESSION_EVALUATION_UNIMPLEMENTED));
  }

  /** Tests that if both operands are incomplete, the result carries both
   * causes, left first. */
  @Test void testBothIncomplete() {
    final AffineResult result = evaluate(pil.plus(W, pil.times(Y, Y)));
    assertThat(result.cause(),
        hasToString("Multiple([PreviousValueUnknown(Main.w), "
            + "QuadraticTerm])"));
  }

  @Test void testOperators() {
    assertThat(evaluate(op(Y, BinaryOperator.DIV, n(2))).expression()
            .plus(evaluate(op(Y, BinaryOperator.DIV, n(2))).expression())
            .minus(evaluate(Y).expression())
            .isConstant(),
        is(true));
    assertThat(constant(op(n(2), BinaryOperator.POW, n(10))), is("1024"));
    assertThat(constant(op(n(7), BinaryOperator.MOD, n(4))), is("3"));
    assertThat(constant(op(n(6), BinaryOperator.BINARY_AND, n(3))), is("2"));
    assertThat(constant(op(n(6), BinaryOperator.BINARY_OR, n(3))), is("7"));
    assertThat(constant(op(n(6), BinaryOperator.BINARY_XOR, n(3))), is("5"));
    assertThat(constant(op(n(1), BinaryOperator.SHL, n(4))), is("16"));
    assertThat(constant(op(n(16), BinaryOperator.SHR, n(2))), is("4"));
    assertThat(constant(op(n(1), BinaryOperator.SHL, n(64))),
        is("4294967295"));
    assertThat(cause(op(n(1), BinaryOperator.SHL, n(1000))),
        is(Kind.EXPRESSION_EVALUATION_UNIMPLEMENTED));
    assertThat(cause(op(n(1), BinaryOperator.MOD, n(0))),
        is(Kind.EXPRESSION_EVALUATION_UNIMPLEMENTED));
  }

  /** Tests that comparisons and logical operators yield 1 or 0. */
  @Test void testBooleans() {
    assertThat(constant(op(n(3), BinaryOperator.LESS, n(5))), is("1"));
    assertThat(constant(op(n(5), BinaryOperator.LESS_EQUAL, n(5))), is("1"));
    assertThat(constant(op(n(3), BinaryOperator.GREATER, n(5))), is("0"));
    assertThat(constant(op(n(3), BinaryOperator.GREATER_EQUAL, n(5))),
        is("0"));
    assertThat(constant(op(X, BinaryOperator.EQUAL, n(3))), is("1"));
    assertThat(constant(op(X, BinaryOperator.NOT_EQUAL, n(3))), is("0"));
    assertThat(constant(op(n(1), BinaryOperator.LOGICAL_AND, n(0))),
        is("0"));
    assertThat(constant(op(n(1), BinaryOperator.LOGICAL_OR, n(0))), is("1"));
    assertThat(constant(pil.unary(UnaryOperator.LOGICAL_NOT, n(0))),
        is("1"));
    assertThat(constant(pil.unary(UnaryOperator.LOGICAL_NOT, n(7))),
        is("0"));
    // -1 is the largest field element, so it is not less than 0
    assertThat(constant(op(pil.negate(n(1)), BinaryOperator.LESS, n(0))),
        is("0"));
  }

  @Test void testMatch() {
    assertThat(
        constant(
            pil.match(X, pil.arm(1, n(10)), pil.arm(3, n(30)),
                pil.wildcardArm(n(0)))),
        is("30"));
    assertThat(
        constant(pil.match(n(7), pil.arm(1, n(10)), pil.wildcardArm(n(0)))),
        is("0"));
    assertThat(cause(pil.match(Y, pil.arm(1, n(10)))),
        is(Kind.NON_CONSTANT_QUERY_MATCH_SCRUTINEE));
    assertThat(cause(pil.match(X, pil.arm(1, n(10)), pil.arm(2, n(20)))),
        is(Kind.NO_MATCH_ARM_FOUND));
    assertThat(cause(pil.match(W, pil.arm(1, n(10)))),
        is(Kind.PREVIOUS_VALUE_UNKNOWN));
  }

  @Test void testLocals() {
    final ExpressionEvaluator evaluator =
        new ExpressionEvaluator(ANALYZED, VARIABLES)
            .withLocals(ImmutableList.of(FieldElement.of(9)));
    assertThat(
        evaluator.evaluate(pil.times(pil.local(0), n(2))).expression()
            .constantValue(),
        is(FieldElement.of(18)));
    final AffineResult unbound = evaluator.evaluate(pil.local(1));
    assertThat(unbound.cause().detail(),
        startsWith("unbound local variable"));
  }
}

// End ExpressionEvaluatorTest.java

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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.BinaryOperator;
import net.hydromatic.pil.ast.Expression;
import net.hydromatic.pil.ast.ExpressionShuttle;
import net.hydromatic.pil.ast.FunctionValueDefinition;
import net.hydromatic.pil.ast.Polynomial;
import net.hydromatic.pil.ast.PolynomialType;
import net.hydromatic.pil.eval.IncompleteCause.Kind;
import net.hydromatic.pil.number.FieldElement;

/**
 * Evaluates expressions symbolically, to affine expressions over the unknown
 * columns of a {@link SymbolicVariables} context.
 *
 * <p>Named constants come from the program. References to intermediate
 * polynomials are expanded in place. Every other reference is resolved by
 * the context.
 */
public class ExpressionEvaluator {
  private static final BigInteger MAX_SHIFT =
      BigInteger.valueOf(FieldElement.BITS * 2);

  private final Analyzed analyzed;
  private final SymbolicVariables variables;
  private final List<FieldElement> locals;

  public ExpressionEvaluator(Analyzed analyzed,
      SymbolicVariables variables) {
    this(analyzed, variables, ImmutableList.of());
  }

  private ExpressionEvaluator(Analyzed analyzed, SymbolicVariables variables,
      List<FieldElement> locals) {
    this.analyzed = requireNonNull(analyzed);
    this.variables = requireNonNull(variables);
    this.locals = ImmutableList.copyOf(locals);
  }

  /** Returns an evaluator that binds local variables (parameters of a
   * mapping) to values. */
  public ExpressionEvaluator withLocals(List<FieldElement> locals) {
    return new ExpressionEvaluator(analyzed, variables, locals);
  }

  /** Evaluates an expression. */
  public AffineResult evaluate(Expression e) {
    switch (e.op) {
    case CONSTANT:
      final String name = ((Expression.Constant) e).name;
      final FieldElement constant = analyzed.constant(name);
      if (constant == null) {
        return unimplemented("unknown constant " + name);
      }
      return constant(constant);

    case POLYNOMIAL_REFERENCE:
      return evaluateReference((Expression.Reference) e);

    case LOCAL_VARIABLE_REFERENCE:
      final int index = ((Expression.LocalVariable) e).index;
      if (index >= locals.size()) {
        return unimplemented("unbound local variable " + e);
      }
      return constant(locals.get(index));

    case PUBLIC_REFERENCE:
      return variables.publicValue(((Expression.PublicReference) e).name);

    case NUMBER:
      return constant(((Expression.NumberLiteral) e).value);

    case STRING:
    case TUPLE:
      return unimplemented(e.toString());

    case BINARY_OPERATION:
      final Expression.BinaryOperation binary =
          (Expression.BinaryOperation) e;
      return evaluateBinary(evaluate(binary.left), binary,
          evaluate(binary.right));

    case UNARY_OPERATION:
      return evaluateUnary((Expression.UnaryOperation) e);

    case FUNCTION_CALL:
      return unimplemented("function call " + e);

    case MATCH_EXPRESSION:
      return evaluateMatch((Expression.Match) e);

    default:
      throw new AssertionError("unknown op " + e.op);
    }
  }

  private AffineResult evaluateReference(Expression.Reference reference) {
    final Analyzed.Definition definition =
        analyzed.definition(reference.poly.name);
    final Polynomial poly = definition.poly;
    if (poly.polyType != PolynomialType.INTERMEDIATE) {
      return variables.value(poly, reference.poly);
    }
    final FunctionValueDefinition value = definition.value;
    if (value == null
        || value.kind != FunctionValueDefinition.Kind.MAPPING) {
      return unimplemented("intermediate polynomial without definition "
          + reference);
    }
    Expression expression = value.expression();
    if (reference.poly.next) {
      if (expression.containsNextReference(analyzed)) {
        return unimplemented("next row of " + reference
            + ", which refers to the next row");
      }
      expression = expression.accept(NextShuttle.INSTANCE);
    }
    return evaluate(expression);
  }

  private AffineResult evaluateMatch(Expression.Match match) {
    final AffineResult scrutinee = evaluate(match.scrutinee);
    if (!scrutinee.isAffine()) {
      return scrutinee;
    }
    if (!scrutinee.isConstant()) {
      return AffineResult.incomplete(Kind.NON_CONSTANT_QUERY_MATCH_SCRUTINEE);
    }
    final FieldElement value = scrutinee.expression().constantValue();
    for (Expression.MatchArm arm : match.arms) {
      if (arm.matches(value)) {
        return evaluate(arm.value);
      }
    }
    return AffineResult.incomplete(Kind.NO_MATCH_ARM_FOUND);
  }

  private AffineResult evaluateUnary(Expression.UnaryOperation unary) {
    final AffineResult result = evaluate(unary.expression);
    switch (unary.operator) {
    case PLUS:
      return result;
    case MINUS:
      return result.map(AffineExpression::negate);
    case LOGICAL_NOT:
      if (!result.isAffine()) {
        return result;
      }
      if (!result.isConstant()) {
        return unimplemented("logical not of non-constant " + unary);
      }
      return bool(result.expression().constantValue().isZero());
    default:
      throw new AssertionError("unknown operator " + unary.operator);
    }
  }

  private AffineResult evaluateBinary(AffineResult left,
      Expression.BinaryOperation binary, AffineResult right) {
    if (binary.operator == BinaryOperator.MUL
        && (isZero(left) || isZero(right))) {
      return constant(FieldElement.ZERO);
    }
    if (!left.isAffine() || !right.isAffine()) {
      if (!left.isAffine() && !right.isAffine()) {
        return AffineResult.incomplete(left.cause().combine(right.cause()));
      }
      return left.isAffine() ? right : left;
    }
    final AffineExpression l = left.expression();
    final AffineExpression r = right.expression();
    switch (binary.operator) {
    case ADD:
      return AffineResult.of(l.plus(r));
    case SUB:
      return AffineResult.of(l.minus(r));
    case MUL:
      if (l.isConstant()) {
        return AffineResult.of(r.times(l.constantValue()));
      }
      if (r.isConstant()) {
        return AffineResult.of(l.times(r.constantValue()));
      }
      return AffineResult.incomplete(Kind.QUADRATIC_TERM);
    case DIV:
      if (r.isConstant() && !r.constantValue().isZero()) {
        return AffineResult.of(l.times(r.constantValue().inverse()));
      }
      return AffineResult.incomplete(Kind.DIVISION_TERM);
    case POW:
      if (l.isConstant() && r.isConstant()) {
        return constant(
            l.constantValue().pow(r.constantValue().toBigInteger()));
      }
      return AffineResult.incomplete(Kind.EXPONENTIATION_TERM);
    default:
      break;
    }
    if (!l.isConstant() || !r.isConstant()) {
      return unimplemented("operator" + binary.operator.padded
          + "on non-constant operands in " + binary);
    }
    final BigInteger a = l.constantValue().toBigInteger();
    final BigInteger b = r.constantValue().toBigInteger();
    switch (binary.operator) {
    case MOD:
      if (b.signum() == 0) {
        return unimplemented("modulo zero in " + binary);
      }
      return constant(a.mod(b));
    case BINARY_AND:
      return constant(a.and(b));
    case BINARY_OR:
      return constant(a.or(b));
    case BINARY_XOR:
      return constant(a.xor(b));
    case SHL:
    case SHR:
      if (b.compareTo(MAX_SHIFT) > 0) {
        return unimplemented("shift too large in " + binary);
      }
      return constant(binary.operator == BinaryOperator.SHL
          ? a.shiftLeft(b.intValue())
          : a.shiftRight(b.intValue()));
    case LOGICAL_AND:
      return bool(a.signum() != 0 && b.signum() != 0);
    case LOGICAL_OR:
      return bool(a.signum() != 0 || b.signum() != 0);
    case LESS:
      return bool(a.compareTo(b) < 0);
    case LESS_EQUAL:
      return bool(a.compareTo(b) <= 0);
    case EQUAL:
      return bool(a.equals(b));
    case NOT_EQUAL:
      return bool(!a.equals(b));
    case GREATER_EQUAL:
      return bool(a.compareTo(b) >= 0);
    case GREATER:
      return bool(a.compareTo(b) > 0);
    default:
      throw new AssertionError("unknown operator " + binary.operator);
    }
  }

  private static AffineResult constant(FieldElement value) {
    return AffineResult.of(AffineExpression.constant(value));
  }

  private static AffineResult constant(BigInteger value) {
    return constant(FieldElement.of(value));
  }

  private static AffineResult bool(boolean b) {
    return constant(b ? FieldElement.ONE : FieldElement.ZERO);
  }

  private static AffineResult unimplemented(String detail) {
    return AffineResult.incomplete(
        IncompleteCause.expressionEvaluationUnimplemented(detail));
  }

  /** Returns whether a result is the constant zero. A product with such a
   * factor is zero even if the other factor is not known. */
  private static boolean isZero(AffineResult result) {
    return result.isConstant()
        && result.expression().constantValue().isZero();
  }

  /** Shuttle that converts references to the current row into references
   * to the next row. */
  private static class NextShuttle extends ExpressionShuttle {
    static final NextShuttle INSTANCE = new NextShuttle();

    @Override public Expression visit(Expression.Reference reference) {
      return reference.copy(reference.poly.withNext(true));
    }
  }
}

// End ExpressionEvaluator.java

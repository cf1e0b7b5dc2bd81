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
package net.hydromatic.pil;

import static net.hydromatic.pil.ast.ExpressionBuilder.pil;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.Expression;
import net.hydromatic.pil.ast.SelectedExpressions;
import net.hydromatic.pil.ast.SourceRef;
import net.hydromatic.pil.compile.PilAnalyzer;
import net.hydromatic.pil.compile.PilAst;
import net.hydromatic.pil.compile.PilAst.ArrayExpression;
import net.hydromatic.pil.compile.PilAst.FunctionDefinition;

/** Sample programs, and a builder that makes it concise to write more. */
public class Programs {
  private Programs() {}

  /** Returns a builder of a program. */
  public static ProgramBuilder program() {
    return new ProgramBuilder();
  }

  /** Fibonacci sequence. Written in PIL,
   *
   * <blockquote><pre>
   * namespace Fibonacci(%N);
   * pol constant ISLAST = [0]* + [1];
   * pol commit x, y;
   * ISLAST * (y' - 1) = 0;
   * ISLAST * (x' - 1) = 0;
   * (1 - ISLAST) * (x' - y) = 0;
   * (1 - ISLAST) * (y' - (x + y)) = 0;
   * </pre></blockquote>
   */
  public static Analyzed fibonacci(int degree) {
    final Expression isLast = pil.ref("ISLAST");
    final Expression notLast = pil.minus(pil.number(1), isLast);
    return program()
        .constant("%N", pil.number(degree))
        .namespace("Fibonacci", pil.constant("%N"))
        .fixedArray("ISLAST",
            ArrayExpression.concat(
                ArrayExpression.repeated(ImmutableList.of(pil.number(0))),
                ArrayExpression.value(ImmutableList.of(pil.number(1)))))
        .commit("x", "y")
        .identity(pil.times(isLast, pil.minus(pil.next("y"), pil.number(1))))
        .identity(pil.times(isLast, pil.minus(pil.next("x"), pil.number(1))))
        .identity(pil.times(notLast, pil.minus(pil.next("x"), pil.ref("y"))))
        .identity(
            pil.times(notLast,
                pil.minus(pil.next("y"),
                    pil.plus(pil.ref("x"), pil.ref("y")))))
        .analyze();
  }

  /** Builds a program one statement at a time; each statement is on its own
   * line of a file called "test.pil". */
  public static class ProgramBuilder {
    private final ImmutableList.Builder<PilAst.Statement> statements =
        ImmutableList.builder();
    private int line = 1;

    private SourceRef next() {
      return new SourceRef("test.pil", line++);
    }

    public ProgramBuilder add(PilAst.Statement statement) {
      statements.add(statement);
      return this;
    }

    public ProgramBuilder namespace(String name, Expression degree) {
      return add(new PilAst.Namespace(next(), name, degree));
    }

    public ProgramBuilder namespace(String name, int degree) {
      return namespace(name, pil.number(degree));
    }

    public ProgramBuilder constant(String name, Expression value) {
      return add(new PilAst.ConstantDefinition(next(), name, value));
    }

    public ProgramBuilder commit(String... names) {
      final ImmutableList.Builder<PilAst.PolynomialName> b =
          ImmutableList.builder();
      for (String name : names) {
        b.add(PilAst.PolynomialName.of(name));
      }
      return add(new PilAst.PolynomialCommitDeclaration(next(), b.build(),
          null));
    }

    /** Declares an array of committed polynomials, "pol commit x[n]". */
    public ProgramBuilder commitArray(String name, int size) {
      return add(
          new PilAst.PolynomialCommitDeclaration(next(),
              ImmutableList.of(
                  new PilAst.PolynomialName(name, pil.number(size))),
              null));
    }

    /** Declares a committed polynomial whose values come from a query with
     * parameter "i", the row. */
    public ProgramBuilder query(String name, Expression query) {
      return add(
          new PilAst.PolynomialCommitDeclaration(next(),
              ImmutableList.of(PilAst.PolynomialName.of(name)),
              FunctionDefinition.query(ImmutableList.of("i"), query)));
    }

    /** Declares constant polynomials without a definition. */
    public ProgramBuilder fixed(String... names) {
      final ImmutableList.Builder<PilAst.PolynomialName> b =
          ImmutableList.builder();
      for (String name : names) {
        b.add(PilAst.PolynomialName.of(name));
      }
      return add(new PilAst.PolynomialConstantDeclaration(next(), b.build()));
    }

    /** Defines a constant polynomial by a mapping with parameter "i", the
     * row. */
    public ProgramBuilder fixedMapping(String name, Expression body) {
      return add(
          new PilAst.PolynomialConstantDefinition(next(), name,
              FunctionDefinition.mapping(ImmutableList.of("i"), body)));
    }

    public ProgramBuilder fixedArray(String name, ArrayExpression array) {
      return add(
          new PilAst.PolynomialConstantDefinition(next(), name,
              FunctionDefinition.array(array)));
    }

    /** Defines a constant polynomial by a list of values. */
    public ProgramBuilder fixedValues(String name, long... values) {
      final ImmutableList.Builder<Expression> b = ImmutableList.builder();
      for (long value : values) {
        b.add(pil.number(value));
      }
      return fixedArray(name, ArrayExpression.value(b.build()));
    }

    public ProgramBuilder intermediate(String name, Expression expression) {
      return add(new PilAst.PolynomialDefinition(next(), name, expression));
    }

    public ProgramBuilder publicValue(String name, String poly, int row) {
      return add(
          new PilAst.PublicDeclaration(next(), name,
              pil.ref(poly).poly, pil.number(row)));
    }

    /** Adds a polynomial identity "e = 0". */
    public ProgramBuilder identity(Expression e) {
      return add(new PilAst.PolynomialIdentity(next(), e));
    }

    /** Adds a polynomial identity "left = right". */
    public ProgramBuilder equation(Expression left, Expression right) {
      return identity(pil.equation(left, right));
    }

    public ProgramBuilder lookup(SelectedExpressions left,
        SelectedExpressions right) {
      return add(new PilAst.PlookupIdentity(next(), left, right));
    }

    public ProgramBuilder permutation(SelectedExpressions left,
        SelectedExpressions right) {
      return add(new PilAst.PermutationIdentity(next(), left, right));
    }

    public ProgramBuilder connect(List<Expression> left,
        List<Expression> right) {
      return add(new PilAst.ConnectIdentity(next(), left, right));
    }

    public PilAst.Program build() {
      return new PilAst.Program(statements.build());
    }

    /** Builds and analyzes the program. */
    public Analyzed analyze() {
      return PilAnalyzer.analyze(build());
    }
  }
}

// End Programs.java

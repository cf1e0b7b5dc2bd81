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
package net.hydromatic.pil.compile;

import static net.hydromatic.pil.Programs.program;
import static net.hydromatic.pil.ast.ExpressionBuilder.pil;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.pil.Programs;
import net.hydromatic.pil.Programs.ProgramBuilder;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.BinaryOperator;
import net.hydromatic.pil.ast.FunctionValueDefinition;
import net.hydromatic.pil.ast.Identity;
import net.hydromatic.pil.ast.IdentityKind;
import net.hydromatic.pil.ast.PolynomialType;
import net.hydromatic.pil.ast.SelectedExpressions;
import net.hydromatic.pil.ast.SourceRef;
import net.hydromatic.pil.compile.PilAst.ArrayExpression;
import net.hydromatic.pil.number.FieldElement;
import org.junit.jupiter.api.Test;

/** Tests {@link PilAnalyzer}. */
public class PilAnalyzerTest {
  /** Analyzes a program that is expected to be invalid, and returns the
   * description of the error, "file:line Error: message". */
  private static String error(ProgramBuilder builder) {
    final AnalyzeException e =
        assertThrows(AnalyzeException.class, builder::analyze);
    return e.describeTo(new StringBuilder()).toString();
  }

  /** Tests that polynomials get ids in declaration order, one sequence per
   * polynomial type, and that names are made absolute. */
  @Test void testIds() {
    final Analyzed analyzed = Programs.fibonacci(8);
    assertThat(analyzed.definition("Fibonacci.x").poly.id, is(0L));
    assertThat(analyzed.definition("Fibonacci.y").poly.id, is(1L));
    assertThat(analyzed.definition("Fibonacci.ISLAST").poly.id, is(0L));
    assertThat(analyzed.definition("Fibonacci.ISLAST").poly.polyType,
        is(PolynomialType.CONSTANT));
    assertThat(analyzed.definition("Fibonacci.x").poly.degree, is(8L));
  }

  /** Tests that "[0]* + [1]" becomes a segment of 0s that fills all rows
   * but the last. */
  @Test void testRepeatedArray() {
    final Analyzed analyzed = Programs.fibonacci(8);
    final FunctionValueDefinition value =
        analyzed.definition("Fibonacci.ISLAST").value;
    assertThat(value.kind, is(FunctionValueDefinition.Kind.ARRAY));
    assertThat(value.arrays(), hasToString("[[0] * 7, [1]]"));
    assertThat(value.arraySize(), is(8L));

    // With one row, the repeated segment is repeated zero times, and is
    // dropped
    final Analyzed analyzed1 = Programs.fibonacci(1);
    assertThat(analyzed1.definition("Fibonacci.ISLAST").value.arrays(),
        hasToString("[[1]]"));
  }

  @Test void testArrayErrors() {
    final ArrayExpression threes =
        ArrayExpression.repeated(
            ImmutableList.of(pil.number(1), pil.number(2), pil.number(3)));
    assertThat(
        error(program().namespace("Main", 4).fixedArray("A", threes)),
        is("test.pil:2 Error: repeated array of size 3 in definition of "
            + "Main.A cannot fill 4 rows"));

    final ArrayExpression twoRepeated =
        ArrayExpression.concat(
            ArrayExpression.repeated(ImmutableList.of(pil.number(0))),
            ArrayExpression.repeated(ImmutableList.of(pil.number(1))));
    assertThat(
        error(program().namespace("Main", 4).fixedArray("A", twoRepeated)),
        is("test.pil:2 Error: definition of Main.A has more than one "
            + "repeated array"));

    assertThat(
        error(program().namespace("Main", 4).fixedValues("A", 1, 2, 3)),
        is("test.pil:2 Error: array for Main.A has 3 values but the degree "
            + "is 4"));
  }

  /** Tests constants, which may refer to earlier constants, and may be
   * used as the degree of a namespace. */
  @Test void testConstants() {
    final Analyzed analyzed = program()
        .constant("%K", pil.number(3))
        .constant("%N",
            pil.binary(pil.number(2), BinaryOperator.POW, pil.constant("%K")))
        .namespace("Main", pil.constant("%N"))
        .commit("x")
        .identity(pil.minus(pil.ref("x"), pil.constant("%K")))
        .analyze();
    assertThat(analyzed.constant("%N"), is(FieldElement.of(8)));
    assertThat(analyzed.degree(), is(8L));
    assertThat(analyzed.identities.get(0), hasToString("Main.x - %K = 0"));
  }

  @Test void testConstantErrors() {
    assertThat(
        error(program()
            .namespace("Main", 4)
            .commit("x")
            .constant("%N", pil.plus(pil.ref("x"), pil.number(1)))),
        is("test.pil:3 Error: constant expression x + 1 must not refer to "
            + "polynomial x"));
    assertThat(
        error(program()
            .constant("%N", pil.number(1))
            .constant("%N", pil.number(2))),
        is("test.pil:2 Error: duplicate constant %N"));
    assertThat(
        error(program()
            .namespace("Main", 4)
            .commit("x")
            .identity(pil.minus(pil.ref("x"), pil.constant("%M")))),
        is("test.pil:3 Error: unknown constant %M"));
  }

  /** Tests that a namespace qualifies the names declared after it, and that
   * a qualified name refers to another namespace. */
  @Test void testNamespaces() {
    final Analyzed analyzed = program()
        .namespace("A", 4)
        .commit("x")
        .namespace("B", 4)
        .commit("x")
        .identity(pil.minus(pil.ref("x"), pil.ref("A.x")))
        .analyze();
    assertThat(analyzed.definitions.keySet(), hasToString("[A.x, B.x]"));
    assertThat(analyzed.definition("B.x").poly.id, is(1L));
    assertThat(analyzed.identities.get(0), hasToString("B.x - A.x = 0"));
  }

  @Test void testDeclarationErrors() {
    assertThat(error(program().commit("x")),
        is("test.pil:1 Error: polynomial x is declared outside a namespace "
            + "with a degree"));
    assertThat(error(program().namespace("Main", 4).commit("x", "x")),
        is("test.pil:2 Error: duplicate polynomial Main.x"));
    assertThat(
        error(program()
            .namespace("Main", 4)
            .commit("x")
            .identity(pil.minus(pil.ref("x"), pil.next("w")))),
        is("test.pil:3 Error: unknown polynomial w"));
    assertThat(
        error(program()
            .namespace("Main", 4)
            .publicValue("out", "x", 0)),
        is("test.pil:2 Error: unknown polynomial x"));
  }

  /** Tests references to elements of arrays. */
  @Test void testArrayReferences() {
    final Analyzed analyzed = program()
        .namespace("Main", 4)
        .commitArray("a", 3)
        .identity(
            pil.minus(pil.ref("a", 2, true), pil.ref("a", 0, false)))
        .analyze();
    assertThat(analyzed.identities.get(0),
        hasToString("Main.a[2]' - Main.a[0] = 0"));

    assertThat(
        error(program()
            .namespace("Main", 4)
            .commitArray("a", 3)
            .identity(pil.ref("a"))),
        is("test.pil:3 Error: array Main.a must be indexed"));
    assertThat(
        error(program()
            .namespace("Main", 4)
            .commitArray("a", 3)
            .identity(pil.ref("a", 3, false))),
        is("test.pil:3 Error: index 3 of Main.a is out of bounds"));
    assertThat(
        error(program()
            .namespace("Main", 4)
            .commit("b")
            .identity(pil.ref("b", 0, false))),
        is("test.pil:3 Error: Main.b is not an array"));
  }

  /** Tests that parameters of mappings and queries become local
   * variables. */
  @Test void testFunctions() {
    final Analyzed analyzed = program()
        .namespace("Main", 4)
        .fixedMapping("EVEN", pil.times(pil.number(2), pil.ref("i")))
        .query("x", pil.tuple(pil.string("input"), pil.ref("i")))
        .analyze();
    final FunctionValueDefinition even =
        analyzed.definition("Main.EVEN").value;
    assertThat(even.kind, is(FunctionValueDefinition.Kind.MAPPING));
    assertThat(even.expression(), hasToString("2 * $0"));
    final FunctionValueDefinition x = analyzed.definition("Main.x").value;
    assertThat(x.kind, is(FunctionValueDefinition.Kind.QUERY));
    assertThat(x.expression(), hasToString("(\"input\", $0)"));
    assertThat(analyzed.definition("Main.x").poly.polyType,
        is(PolynomialType.COMMITTED));
  }

  @Test void testFunctionErrors() {
    assertThat(
        error(program()
            .namespace("Main", 4)
            .add(
                new PilAst.PolynomialConstantDefinition(
                    new SourceRef("test.pil", 2),
                    "Q",
                    PilAst.FunctionDefinition.query(ImmutableList.of("i"),
                        pil.ref("i"))))),
        is("test.pil:2 Error: constant polynomial Q cannot be defined by a "
            + "query"));
    assertThat(
        error(program()
            .namespace("Main", 4)
            .fixedMapping("F", pil.next("i"))),
        is("test.pil:2 Error: parameter i cannot be indexed or shifted"));
  }

  /** Tests that each kind of identity has its own sequence of ids, and that
   * connect identities have no selectors. */
  @Test void testIdentities() {
    final Analyzed analyzed = program()
        .namespace("Main", 4)
        .fixedValues("BYTE", 0, 1, 2, 3)
        .commit("x", "y")
        .identity(pil.minus(pil.ref("x"), pil.ref("y")))
        .lookup(SelectedExpressions.of(pil.ref("x")),
            SelectedExpressions.of(pil.ref("BYTE")))
        .identity(pil.minus(pil.next("x"), pil.ref("y")))
        .permutation(SelectedExpressions.of(pil.ref("x")),
            SelectedExpressions.of(pil.ref("y")))
        .connect(ImmutableList.of(pil.ref("x")),
            ImmutableList.of(pil.ref("y")))
        .analyze();
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (Identity identity : analyzed.identitiesInSourceOrder()) {
      b.add(identity.kind + " " + identity.id + ": " + identity);
    }
    assertThat(b.build(),
        is(
            ImmutableList.of("POLYNOMIAL 0: Main.x - Main.y = 0",
                "PLOOKUP 0: { Main.x } in { Main.BYTE }",
                "POLYNOMIAL 1: Main.x' - Main.y = 0",
                "PERMUTATION 0: { Main.x } is { Main.y }",
                "CONNECT 0: { Main.x } connect { Main.y }")));
    assertThat(analyzed.identities.get(4).kind, is(IdentityKind.CONNECT));
    assertThat(analyzed.identities.get(4).left.selector == null, is(true));
  }

  @Test void testIdentityErrors() {
    assertThat(
        error(program()
            .namespace("Main", 4)
            .commit("x", "y")
            .lookup(SelectedExpressions.of(pil.ref("x")),
                SelectedExpressions.of(pil.ref("x"), pil.ref("y")))),
        is("test.pil:3 Error: left side of in identity has 1 expressions, "
            + "right side has 2"));
  }

  /** Tests public declarations, and references to them. */
  @Test void testPublicDeclarations() {
    final Analyzed analyzed = program()
        .namespace("Main", 4)
        .commit("x", "y")
        .publicValue("first", "x", 0)
        .identity(pil.minus(pil.ref("y"), pil.publicRef("first")))
        .analyze();
    assertThat(analyzed.publicDeclarations.get("first"),
        hasToString("public first = Main.x(0)"));
    assertThat(analyzed.identities.get(0),
        hasToString("Main.y - :first = 0"));

    assertThat(
        error(program()
            .namespace("Main", 4)
            .commit("x")
            .identity(pil.minus(pil.ref("x"), pil.publicRef("last")))),
        is("test.pil:3 Error: unknown public value last"));
    assertThat(
        error(program()
            .namespace("Main", 4)
            .commit("x")
            .publicValue("p", "x", 0)
            .publicValue("p", "x", 1)),
        is("test.pil:4 Error: duplicate public declaration p"));
  }
}

// End PilAnalyzerTest.java

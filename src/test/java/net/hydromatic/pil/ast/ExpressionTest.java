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

import static net.hydromatic.pil.Programs.program;
import static net.hydromatic.pil.ast.ExpressionBuilder.pil;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.pil.number.FieldElement;
import org.junit.jupiter.api.Test;

/** Tests {@link Expression} and its visitors. */
public class ExpressionTest {
  private final Expression x = pil.ref("x");
  private final Expression y = pil.ref("y");
  private final Expression z = pil.ref("z");

  /** Tests that expressions are rendered with only the parentheses that
   * precedence requires. */
  @Test void testUnparse() {
    assertThat(pil.plus(x, pil.times(y, z)), hasToString("x + y * z"));
    assertThat(pil.times(pil.plus(x, y), z), hasToString("(x + y) * z"));
    assertThat(pil.minus(pil.minus(x, y), z), hasToString("x - y - z"));
    assertThat(pil.minus(x, pil.minus(y, z)), hasToString("x - (y - z)"));
    assertThat(pil.negate(pil.plus(x, y)), hasToString("-(x + y)"));
    assertThat(pil.negate(x), hasToString("-x"));
    assertThat(
        pil.binary(x, BinaryOperator.POW,
            pil.binary(y, BinaryOperator.POW, z)),
        hasToString("x ** y ** z"));
    assertThat(
        pil.binary(pil.binary(x, BinaryOperator.POW, y), BinaryOperator.POW,
            z),
        hasToString("(x ** y) ** z"));
    assertThat(
        pil.binary(pil.binary(x, BinaryOperator.BINARY_AND, y),
            BinaryOperator.EQUAL, pil.number(0)),
        hasToString("x & y == 0"));
  }

  @Test void testUnparseAtoms() {
    assertThat(pil.next("x"), hasToString("x'"));
    assertThat(pil.ref("a", 2, true), hasToString("a[2]'"));
    assertThat(pil.local(0), hasToString("$0"));
    assertThat(pil.publicRef("out"), hasToString(":out"));
    assertThat(pil.constant("%N"), hasToString("%N"));
    assertThat(pil.number(-1), hasToString("18446744069414584320"));
    assertThat(pil.string("say \"hi\""), hasToString("\"say \\\"hi\\\"\""));
    assertThat(pil.tuple(pil.string("input"), pil.local(0)),
        hasToString("(\"input\", $0)"));
    assertThat(pil.call("f", x, pil.number(1)), hasToString("f(x, 1)"));
    assertThat(
        pil.match(x, pil.arm(1, pil.number(2)),
            pil.wildcardArm(pil.number(3))),
        hasToString("match x { 1 => 2, _ => 3 }"));
  }

  @Test void testContainsNextReference() {
    assertThat(pil.plus(x, y).containsNextReference(), is(false));
    assertThat(pil.plus(x, pil.times(pil.number(2), pil.next("y")))
            .containsNextReference(),
        is(true));
    assertThat(
        pil.match(x, pil.wildcardArm(pil.next("z"))).containsNextReference(),
        is(true));
  }

  /** Tests that references to the next row are found inside the definitions
   * of intermediate polynomials, however deeply nested. */
  @Test void testContainsNextReferenceThroughIntermediate() {
    final Analyzed analyzed = program()
        .namespace("Main", 4)
        .commit("a")
        .intermediate("D", pil.minus(pil.next("a"), pil.ref("a")))
        .intermediate("E", pil.times(pil.number(2), pil.ref("D")))
        .intermediate("F", pil.plus(pil.ref("a"), pil.number(1)))
        .analyze();
    final Expression e = pil.ref("Main.E");
    assertThat(e.containsNextReference(), is(false));
    assertThat(e.containsNextReference(analyzed), is(true));
    assertThat(pil.ref("Main.F").containsNextReference(analyzed), is(false));
    assertThat(pil.next("Main.F").containsNextReference(analyzed),
        is(true));
  }

  /** Tests that a visitor reaches every reference, in order. */
  @Test void testVisitor() {
    final Expression e =
        pil.match(pil.plus(x, pil.negate(y)),
            pil.arm(0, pil.tuple(z, pil.call("f", pil.next("w")))));
    final List<String> names = new ArrayList<>();
    e.accept(
        new ExpressionVisitor() {
          @Override public void visit(Expression.Reference reference) {
            names.add(reference.poly.toString());
          }
        });
    assertThat(names, is(ImmutableList.of("x", "y", "z", "w'")));
  }

  /** Tests a shuttle that renames references, and that a shuttle that
   * changes nothing returns the same expression. */
  @Test void testShuttle() {
    final ExpressionShuttle rename =
        new ExpressionShuttle() {
          @Override public Expression visit(Expression.Reference reference) {
            return reference.copy(
                reference.poly.withName("Main." + reference.poly.name));
          }
        };
    final Expression e = pil.times(pil.plus(x, pil.next("y")), pil.number(3));
    assertThat(e.accept(rename),
        hasToString("(Main.x + Main.y') * 3"));

    final ExpressionShuttle identity = new ExpressionShuttle();
    final Expression e2 = e.accept(identity);
    assertThat(e2 == e, is(true));
  }

  @Test void testMatchArm() {
    final Expression.MatchArm arm = pil.arm(5, x);
    assertThat(arm.matches(FieldElement.of(5)), is(true));
    assertThat(arm.matches(FieldElement.of(6)), is(false));
    assertThat(pil.wildcardArm(x).matches(FieldElement.of(6)), is(true));
  }
}

// End ExpressionTest.java

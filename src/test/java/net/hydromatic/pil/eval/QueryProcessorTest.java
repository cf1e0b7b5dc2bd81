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
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.BinaryOperator;
import net.hydromatic.pil.ast.SourceRef;
import net.hydromatic.pil.compile.AnalyzeException;
import net.hydromatic.pil.compile.PilAst;
import net.hydromatic.pil.number.FieldElement;
import org.junit.jupiter.api.Test;

/** Tests {@link QueryProcessor}. */
public class QueryProcessorTest {
  /** Program with three query columns:
   *
   * <blockquote><pre>
   * pol commit x(i) query ("input", i);
   * pol commit y(i) query match i % 2 { 0 => ("even", i), _ => ("odd", i) };
   * pol commit z(i) query ("prev", x);
   * </pre></blockquote>
   */
  private static final Analyzed QUERIES = program()
      .namespace("Main", 4)
      .query("x", pil.tuple(pil.string("input"), pil.ref("i")))
      .query("y",
          pil.match(
              pil.binary(pil.ref("i"), BinaryOperator.MOD, pil.number(2)),
              pil.arm(0, pil.tuple(pil.string("even"), pil.ref("i"))),
              pil.wildcardArm(pil.tuple(pil.string("odd"), pil.ref("i")))))
      .query("z", pil.tuple(pil.string("prev"), pil.ref("x")))
      .commit("w")
      .analyze();
  private static final FixedData FIXED = ConstantEvaluator.generate(QUERIES);
  private static final List<String> NAMES =
      ImmutableList.of("Main.x", "Main.y", "Main.z", "Main.w");

  private static RowPair rowPair(long row) {
    return new RowPair(QUERIES, FIXED, NAMES, ImmutableMap.of(), row,
        new FieldElement[NAMES.size()], SimpleBitConstraintSet.EMPTY);
  }

  @Test void testColumns() {
    final QueryProcessor processor =
        new QueryProcessor(QUERIES, QueryCallback.none());
    final List<String> names = new ArrayList<>();
    processor.columns().forEach(d -> names.add(d.poly.absoluteName));
    assertThat(names, is(ImmutableList.of("Main.x", "Main.y", "Main.z")));
  }

  /** Tests that queries are rendered with the row as their argument, and
   * that the answer is assigned to the column. */
  @Test void testQuery() {
    final List<String> queries = new ArrayList<>();
    final QueryCallback callback = query -> {
      queries.add(query);
      return FieldElement.of(queries.size() * 10);
    };
    final QueryProcessor processor = new QueryProcessor(QUERIES, callback);
    final RowPair rowPair = rowPair(3);
    final List<Analyzed.Definition> columns = processor.columns();
    assertThat(processor.process(columns.get(0), rowPair),
        hasToString("Complete [#0 = 10]"));
    assertThat(processor.process(columns.get(1), rowPair),
        hasToString("Complete [#1 = 20]"));
    assertThat(queries,
        is(ImmutableList.of("(\"input\", 3)", "(\"odd\", 3)")));
  }

  /** Tests that a query that refers to a column whose value is not yet
   * known cannot be rendered until the value is known. */
  @Test void testQueryOfUnknown() {
    final Map<String, FieldElement> answers =
        ImmutableMap.of("(\"prev\", 7)", FieldElement.of(70));
    final QueryProcessor processor =
        new QueryProcessor(QUERIES, answers::get);
    final RowPair rowPair = rowPair(2);
    final Analyzed.Definition z = processor.columns().get(2);
    final EvalValue value = processor.process(z, rowPair);
    assertThat(value.status().cause().kind,
        is(IncompleteCause.Kind.EXPRESSION_EVALUATION_UNIMPLEMENTED));

    rowPair.setNext(0, FieldElement.of(7));
    final EvalValue value2 = processor.process(z, rowPair);
    assertThat(value2, hasToString("Complete [#2 = 70]"));
    rowPair.apply(value2);

    // Once the value is known, the query is not asked again
    assertThat(processor.process(z, rowPair), hasToString("Complete []"));
  }

  @Test void testNoAnswer() {
    final QueryProcessor processor =
        new QueryProcessor(QUERIES, QueryCallback.none());
    final EvalValue value =
        processor.process(processor.columns().get(1), rowPair(0));
    assertThat(value.isEmpty(), is(true));
    assertThat(value.status().cause(),
        is(IncompleteCause.noQueryAnswer("(\"even\", 0)", "Main.y")));
  }

  /** Tests that a match without a matching arm cannot be rendered. */
  @Test void testNoMatchArm() {
    final Analyzed analyzed = program()
        .namespace("Main", 4)
        .query("x",
            pil.match(pil.ref("i"), pil.arm(0, pil.string("zero"))))
        .analyze();
    final QueryProcessor processor =
        new QueryProcessor(analyzed, QueryCallback.none());
    final RowPair rowPair =
        new RowPair(analyzed, ConstantEvaluator.generate(analyzed),
            ImmutableList.of("Main.x"), ImmutableMap.of(), 1,
            new FieldElement[1], SimpleBitConstraintSet.EMPTY);
    final EvalValue value =
        processor.process(processor.columns().get(0), rowPair);
    assertThat(value.status().cause().kind,
        is(IncompleteCause.Kind.NO_MATCH_ARM_FOUND));
    assertThat(value.status().cause().isRetryable(), is(false));
  }

  /** Tests that an array of committed polynomials cannot have a query. */
  @Test void testArrayQuery() {
    final Analyzed analyzed = program()
        .namespace("Main", 4)
        .add(
            new PilAst.PolynomialCommitDeclaration(
                new SourceRef("test.pil", 2),
                ImmutableList.of(
                    new PilAst.PolynomialName("a", pil.number(2))),
                PilAst.FunctionDefinition.query(ImmutableList.of("i"),
                    pil.tuple(pil.string("a"), pil.ref("i")))))
        .analyze();
    final AnalyzeException e =
        assertThrows(AnalyzeException.class,
            () -> new QueryProcessor(analyzed, QueryCallback.none()));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is("test.pil:2 Error: array of committed polynomials Main.a cannot "
            + "have a query"));
  }

  /** Tests rendering of strings with quotes, and of nested tuples. */
  @Test void testRender() {
    final ExpressionEvaluator evaluator = rowPair(1).evaluator(true)
        .withLocals(ImmutableList.of(FieldElement.of(1)));
    final StringBuilder buf = new StringBuilder();
    final IncompleteCause cause =
        QueryProcessor.render(
            pil.tuple(pil.string("a \"b\""),
                pil.tuple(pil.number(-1), pil.local(0))),
            evaluator, buf);
    assertThat(cause == null, is(true));
    assertThat(buf.toString(),
        is("(\"a \\\"b\\\"\", (18446744069414584320, 1))"));
  }
}

// End QueryProcessorTest.java

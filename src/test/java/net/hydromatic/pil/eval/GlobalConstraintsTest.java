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
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.Expression;
import net.hydromatic.pil.ast.SelectedExpressions;
import net.hydromatic.pil.number.FieldElement;
import org.junit.jupiter.api.Test;

/** Tests {@link GlobalConstraints}. */
public class GlobalConstraintsTest {
  private static List<FieldElement> values(long... values) {
    final ImmutableList.Builder<FieldElement> b = ImmutableList.builder();
    for (long value : values) {
      b.add(FieldElement.of(value));
    }
    return b.build();
  }

  @Test void testRangeConstraint() {
    assertThat(GlobalConstraints.rangeConstraint(values(0, 1, 2, 3)),
        hasToString("0x3"));
    assertThat(GlobalConstraints.rangeConstraint(values(3, 2, 1, 0)),
        hasToString("0x3"));
    assertThat(GlobalConstraints.rangeConstraint(values(0, 1, 1, 0)),
        hasToString("0x1"));

    // Does not start at zero
    assertThat(GlobalConstraints.rangeConstraint(values(1, 2, 3, 4)),
        nullValue());
    // Only one value
    assertThat(GlobalConstraints.rangeConstraint(values(0, 0)),
        nullValue());
    // Not a power of two
    assertThat(GlobalConstraints.rangeConstraint(values(0, 1, 2)),
        nullValue());
    // Has a gap
    assertThat(GlobalConstraints.rangeConstraint(values(0, 1, 3, 3)),
        nullValue());
  }

  @Test void testDetermine() {
    final Expression one = pil.number(1);
    final Expression b = pil.ref("b");
    final Expression c = pil.ref("c");
    final Analyzed analyzed = program()
        .namespace("Main", 4)
        .fixedValues("BYTE2", 0, 1, 2, 3)
        .fixedValues("ODD", 1, 3, 5, 7)
        .commit("a", "b", "c", "d", "e", "f")
        .lookup(SelectedExpressions.of(pil.ref("a")),
            SelectedExpressions.of(pil.ref("BYTE2")))
        .identity(pil.times(b, pil.minus(one, b)))
        .identity(pil.times(pil.minus(c, one), c))
        // Not a plain reference
        .lookup(SelectedExpressions.of(pil.plus(pil.ref("d"), one)),
            SelectedExpressions.of(pil.ref("BYTE2")))
        // Not a range
        .lookup(SelectedExpressions.of(pil.ref("e")),
            SelectedExpressions.of(pil.ref("ODD")))
        // Different columns
        .identity(pil.times(pil.ref("f"), pil.minus(one, b)))
        .analyze();
    final SimpleBitConstraintSet set =
        GlobalConstraints.determine(analyzed,
            ConstantEvaluator.generate(analyzed));
    assertThat(set.bitConstraint(0), is(BitConstraint.fromMaxBit(1)));
    assertThat(set.bitConstraint(1), is(BitConstraint.fromMaxBit(0)));
    assertThat(set.bitConstraint(2), is(BitConstraint.fromMaxBit(0)));
    assertThat(set.bitConstraint(3), nullValue());
    assertThat(set.bitConstraint(4), nullValue());
    assertThat(set.bitConstraint(5), nullValue());
  }

  /** Tests that a lookup with a selector does not constrain a column on
   * every row. */
  @Test void testSelectedLookup() {
    final Analyzed analyzed = program()
        .namespace("Main", 4)
        .fixedValues("BYTE2", 0, 1, 2, 3)
        .commit("s", "a")
        .lookup(SelectedExpressions.selected(pil.ref("s"), pil.ref("a")),
            SelectedExpressions.of(pil.ref("BYTE2")))
        .analyze();
    final SimpleBitConstraintSet set =
        GlobalConstraints.determine(analyzed,
            ConstantEvaluator.generate(analyzed));
    assertThat(set, is(SimpleBitConstraintSet.EMPTY));
  }
}

// End GlobalConstraintsTest.java

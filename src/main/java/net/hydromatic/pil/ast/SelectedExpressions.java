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
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One side of an identity: a tuple of expressions, gated by an optional
 * selector.
 *
 * <p>If there is no selector, the side is active on every row.
 */
public class SelectedExpressions {
  public static final SelectedExpressions EMPTY =
      new SelectedExpressions(null, ImmutableList.of());

  public final @Nullable Expression selector;
  public final List<Expression> expressions;

  public SelectedExpressions(@Nullable Expression selector,
      List<Expression> expressions) {
    this.selector = selector;
    this.expressions = ImmutableList.copyOf(expressions);
  }

  /** Creates a side with no selector. */
  public static SelectedExpressions of(Expression... expressions) {
    return new SelectedExpressions(null, ImmutableList.copyOf(expressions));
  }

  /** Creates a side with a selector. */
  public static SelectedExpressions selected(Expression selector,
      Expression... expressions) {
    return new SelectedExpressions(selector,
        ImmutableList.copyOf(expressions));
  }

  /** Returns whether any expression, or the selector, refers to the next
   * row. */
  public boolean containsNextReference() {
    return selector != null && selector.containsNextReference()
        || expressions.stream().anyMatch(Expression::containsNextReference);
  }

  /** Returns whether any expression, or the selector, refers to the next
   * row, looking into the definitions of intermediate polynomials. */
  public boolean containsNextReference(Analyzed analyzed) {
    return selector != null && selector.containsNextReference(analyzed)
        || expressions.stream()
            .anyMatch(e -> e.containsNextReference(analyzed));
  }

  @Override
  public int hashCode() {
    return Objects.hash(selector, expressions);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SelectedExpressions
            && Objects.equals(selector, ((SelectedExpressions) o).selector)
            && expressions.equals(((SelectedExpressions) o).expressions);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    if (selector != null) {
      b.append(selector).append(' ');
    }
    b.append("{ ");
    for (int i = 0; i < expressions.size(); i++) {
      b.append(i == 0 ? "" : ", ").append(expressions.get(i));
    }
    return b.append(" }").toString();
  }
}

// End SelectedExpressions.java

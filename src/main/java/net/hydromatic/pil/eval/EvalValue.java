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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of evaluating an identity or query: the constraints learned, in the
 * order they were derived, and whether evaluation was complete.
 *
 * <p>Values are combined, never overwritten. {@link #combine} mutates the
 * receiver and is the only mutator.
 */
public class EvalValue {
  private final List<Map.Entry<Integer, Constraint>> constraints;
  private EvalStatus status;

  private EvalValue(List<Map.Entry<Integer, Constraint>> constraints,
      EvalStatus status) {
    this.constraints = new ArrayList<>(constraints);
    this.status = status;
  }

  /** Creates a complete value. */
  public static EvalValue complete(
      List<Map.Entry<Integer, Constraint>> constraints) {
    return new EvalValue(constraints, EvalStatus.COMPLETE);
  }

  /** Creates a complete value with no constraints. */
  public static EvalValue complete() {
    return complete(ImmutableList.of());
  }

  /** Creates an incomplete value with no constraints. */
  public static EvalValue incomplete(IncompleteCause cause) {
    return incompleteWithConstraints(ImmutableList.of(), cause);
  }

  /** Creates an incomplete value that nevertheless learned something. */
  public static EvalValue incompleteWithConstraints(
      List<Map.Entry<Integer, Constraint>> constraints,
      IncompleteCause cause) {
    return new EvalValue(constraints, EvalStatus.incomplete(cause));
  }

  /** Creates an entry for a constraint on a column. */
  public static Map.Entry<Integer, Constraint> entry(int columnId,
      Constraint constraint) {
    return Maps.immutableEntry(columnId, constraint);
  }

  /** Returns the constraints learned, in derivation order. */
  public List<Map.Entry<Integer, Constraint>> constraints() {
    return Collections.unmodifiableList(constraints);
  }

  public EvalStatus status() {
    return status;
  }

  public boolean isComplete() {
    return status.isComplete();
  }

  /** Returns whether no constraint has been learned. */
  public boolean isEmpty() {
    return constraints.isEmpty();
  }

  /** Merges another value into this one: appends its constraints and
   * combines the statuses. */
  public void combine(EvalValue other) {
    constraints.addAll(other.constraints);
    status = status.combine(other.status);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append(status).append(" [");
    for (int i = 0; i < constraints.size(); i++) {
      final Map.Entry<Integer, Constraint> e = constraints.get(i);
      if (i > 0) {
        buf.append(", ");
      }
      buf.append('#').append(e.getKey()).append(e.getValue());
    }
    return buf.append(']').toString();
  }
}

// End EvalValue.java

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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementation of {@link BitConstraintSet} backed by an immutable map. */
public class SimpleBitConstraintSet implements BitConstraintSet {
  public static final SimpleBitConstraintSet EMPTY =
      new SimpleBitConstraintSet(ImmutableMap.of());

  private final ImmutableMap<Integer, BitConstraint> map;

  private SimpleBitConstraintSet(Map<Integer, BitConstraint> map) {
    this.map = ImmutableMap.copyOf(map);
  }

  public static SimpleBitConstraintSet of(Map<Integer, BitConstraint> map) {
    return map.isEmpty() ? EMPTY : new SimpleBitConstraintSet(map);
  }

  @Override public @Nullable BitConstraint bitConstraint(int columnId) {
    return map.get(columnId);
  }

  /** Returns a set that has, in addition, a constraint on a column. If the
   * column already has a constraint, the two are conjoined. */
  public SimpleBitConstraintSet with(int columnId, BitConstraint constraint) {
    final Map<Integer, BitConstraint> map2 = new HashMap<>(map);
    map2.merge(columnId, constraint, BitConstraint::conjunction);
    return new SimpleBitConstraintSet(map2);
  }

  @Override public String toString() {
    return map.toString();
  }
}

// End SimpleBitConstraintSet.java

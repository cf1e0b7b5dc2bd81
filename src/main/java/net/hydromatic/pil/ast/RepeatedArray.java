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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Sequence of values that is repeated a number of times.
 *
 * <p>For example, {@code [1, 2]*} in a column of degree 8 is the sequence
 * {@code [1, 2]} repeated 4 times.
 */
public class RepeatedArray {
  public final List<Expression> values;
  public final long repetitions;

  public RepeatedArray(List<Expression> values, long repetitions) {
    this.values = ImmutableList.copyOf(values);
    this.repetitions = repetitions;
    checkInvariants();
  }

  private void checkInvariants() {
    checkArgument(repetitions >= 0, "negative repetitions %s", repetitions);
    checkArgument(repetitions != 0 || values.isEmpty(),
        "zero repetitions of non-empty array");
    checkArgument(!values.isEmpty() || repetitions <= 1,
        "empty array repeated %s times", repetitions);
  }

  /** Returns the number of elements in this array, including
   * repetitions. */
  public long size() {
    checkInvariants();
    return values.size() * repetitions;
  }

  /** Returns the element at a given position, including repetitions. */
  public Expression get(long i) {
    checkArgument(i >= 0 && i < size(), "index %s out of range", i);
    return values.get((int) (i % values.size()));
  }

  @Override
  public int hashCode() {
    return Objects.hash(values, repetitions);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof RepeatedArray
            && values.equals(((RepeatedArray) o).values)
            && repetitions == ((RepeatedArray) o).repetitions;
  }

  @Override
  public String toString() {
    return values + (repetitions == 1 ? "" : " * " + repetitions);
  }
}

// End RepeatedArray.java

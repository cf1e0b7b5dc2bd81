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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Values of the fixed (constant) columns of a program.
 *
 * <p>Columns are held in the order their polynomials were declared. Row
 * indices wrap around the degree, so row {@code -1} is the last row.
 */
public class FixedData {
  public final long degree;
  private final ImmutableMap<String, List<FieldElement>> columns;

  public FixedData(long degree, Map<String, List<FieldElement>> columns) {
    this.degree = degree;
    final ImmutableMap.Builder<String, List<FieldElement>> b =
        ImmutableMap.builder();
    columns.forEach((name, values) -> {
      checkArgument(values.size() == degree,
          "column %s has %s values, expected %s", name, values.size(),
          degree);
      b.put(name, ImmutableList.copyOf(values));
    });
    this.columns = b.build();
  }

  /** Returns the names of the columns, in declaration order. */
  public Set<String> columnNames() {
    return columns.keySet();
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  /** Returns the values of a column, or null if there is no such column. */
  public @Nullable List<FieldElement> column(String name) {
    return columns.get(name);
  }

  /** Returns the value of a column at a row, wrapping around the degree. */
  public FieldElement value(String name, long row) {
    final List<FieldElement> values = columns.get(name);
    checkArgument(values != null, "unknown fixed column %s", name);
    return values.get((int) Math.floorMod(row, degree));
  }

  @Override public String toString() {
    return columns.toString();
  }
}

// End FixedData.java

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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Implementation of {@link FixedLookup} over {@link FixedData}.
 *
 * <p>For each combination of looked-up columns and known columns, builds an
 * index from the known values to the matching rows on first use.
 */
public class IndexedFixedLookup implements FixedLookup {
  private final FixedData fixedData;
  private final Map<IndexKey, ListMultimap<List<FieldElement>, Long>> indexes =
      new HashMap<>();

  public IndexedFixedLookup(FixedData fixedData) {
    this.fixedData = requireNonNull(fixedData);
  }

  @Override public LookupResult lookup(List<String> columns,
      List<@Nullable FieldElement> known) {
    final boolean[] isKnown = new boolean[columns.size()];
    final List<FieldElement> key = new ArrayList<>();
    for (int i = 0; i < columns.size(); i++) {
      final FieldElement value = known.get(i);
      if (value != null) {
        isKnown[i] = true;
        key.add(value);
      }
    }
    final List<Long> rows =
        indexes.computeIfAbsent(
            new IndexKey(ImmutableList.copyOf(columns), isKnown),
            this::buildIndex)
        .get(key);
    switch (rows.size()) {
    case 0:
      return LookupResult.NONE;
    case 1:
      return LookupResult.unique(rows.get(0));
    default:
      return LookupResult.MULTIPLE;
    }
  }

  /** Builds an index from the values of the known columns to the rows that
   * have them. Of rows that agree in every column, only the first is
   * kept. */
  private ListMultimap<List<FieldElement>, Long> buildIndex(IndexKey k) {
    final List<List<FieldElement>> values = new ArrayList<>();
    for (String column : k.columns) {
      values.add(
          requireNonNull(fixedData.column(column),
              () -> "unknown fixed column " + column));
    }
    final ImmutableListMultimap.Builder<List<FieldElement>, Long> b =
        ImmutableListMultimap.builder();
    final Set<List<FieldElement>> seen = new HashSet<>();
    for (int row = 0; row < fixedData.degree; row++) {
      final List<FieldElement> key = new ArrayList<>();
      final List<FieldElement> full = new ArrayList<>();
      for (int i = 0; i < k.columns.size(); i++) {
        final FieldElement value = values.get(i).get(row);
        full.add(value);
        if (k.known[i]) {
          key.add(value);
        }
      }
      if (seen.add(full)) {
        b.put(key, (long) row);
      }
    }
    return b.build();
  }

  /** Identifies an index: the looked-up columns and which are known. */
  private static class IndexKey {
    final List<String> columns;
    final boolean[] known;

    IndexKey(List<String> columns, boolean[] known) {
      this.columns = columns;
      this.known = known;
    }

    @Override public int hashCode() {
      return columns.hashCode() * 31 + Arrays.hashCode(known);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IndexKey
              && columns.equals(((IndexKey) o).columns)
              && Arrays.equals(known, ((IndexKey) o).known);
    }
  }
}

// End IndexedFixedLookup.java

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

import static com.google.common.base.Preconditions.checkState;

import java.util.List;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Looks up rows of fixed columns that match partially known values. */
public interface FixedLookup {
  /** Finds the rows of the given fixed columns whose values match the known
   * values.
   *
   * @param columns Names of fixed columns
   * @param known   For each column, its required value, or null if the value
   *                is not known
   * @return Whether there is a unique match, no match, or several matches;
   * rows whose values agree in every column count as one match */
  LookupResult lookup(List<String> columns,
      List<@Nullable FieldElement> known);

  /** Result of a lookup. */
  final class LookupResult {
    public static final LookupResult NONE = new LookupResult(Kind.NONE, -1);
    public static final LookupResult MULTIPLE =
        new LookupResult(Kind.MULTIPLE, -1);

    public final Kind kind;
    private final long row;

    private LookupResult(Kind kind, long row) {
      this.kind = kind;
      this.row = row;
    }

    /** Creates a result with exactly one matching row. */
    public static LookupResult unique(long row) {
      return new LookupResult(Kind.UNIQUE, row);
    }

    /** Returns the matching row of a unique result. */
    public long row() {
      checkState(kind == Kind.UNIQUE, "not unique: %s", kind);
      return row;
    }

    @Override public String toString() {
      return kind == Kind.UNIQUE ? "UNIQUE(" + row + ")" : kind.name();
    }

    /** Kind of lookup result. */
    public enum Kind {
      UNIQUE,
      NONE,
      MULTIPLE
    }
  }
}

// End FixedLookup.java

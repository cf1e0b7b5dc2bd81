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
import static java.util.Objects.requireNonNull;

import java.util.Locale;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Declaration of a polynomial (column), or of an array of them. */
public class Polynomial {
  /** Identifier; unique among polynomials of the same type. The elements of
   * an array occupy ids {@code id} to {@code id + length - 1}. */
  public final long id;
  public final SourceRef source;
  public final String absoluteName;
  public final PolynomialType polyType;
  public final long degree;
  public final @Nullable Long length;

  public Polynomial(long id, SourceRef source, String absoluteName,
      PolynomialType polyType, long degree, @Nullable Long length) {
    this.id = id;
    this.source = requireNonNull(source);
    this.absoluteName = requireNonNull(absoluteName);
    this.polyType = requireNonNull(polyType);
    this.degree = degree;
    this.length = length;
    checkArgument(id >= 0, "negative id %s", id);
    checkArgument(degree >= 0, "negative degree %s", degree);
    checkArgument(length == null || length > 0, "invalid length %s", length);
  }

  public boolean isArray() {
    return length != null;
  }

  /** Returns the number of columns this declaration occupies: its length if
   * it is an array, otherwise 1. */
  public long columnCount() {
    return length == null ? 1 : length;
  }

  /** Returns the name of the column at a given offset in this polynomial,
   * e.g. "a[2]"; the absolute name if it is not an array. */
  public String columnName(long offset) {
    checkArgument(offset >= 0 && offset < columnCount(),
        "offset %s out of range for %s", offset, absoluteName);
    return isArray() ? absoluteName + "[" + offset + "]" : absoluteName;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, absoluteName, polyType);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Polynomial
            && id == ((Polynomial) o).id
            && absoluteName.equals(((Polynomial) o).absoluteName)
            && polyType == ((Polynomial) o).polyType
            && degree == ((Polynomial) o).degree
            && Objects.equals(length, ((Polynomial) o).length);
  }

  @Override
  public String toString() {
    return "pol " + polyType.name().toLowerCase(Locale.ROOT) + " "
        + absoluteName + (length == null ? "" : "[" + length + "]");
  }
}

// End Polynomial.java

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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reference to a polynomial, optionally to one element of an array
 * polynomial, and optionally to its value on the next row.
 *
 * <p>For example, {@code x}, {@code x'} and {@code a[2]'}.
 */
public class PolynomialReference {
  public final String name;
  public final @Nullable Long index;
  public final boolean next;

  public PolynomialReference(String name, @Nullable Long index, boolean next) {
    this.name = requireNonNull(name);
    this.index = index;
    this.next = next;
    checkArgument(!name.isEmpty(), "empty name");
    checkArgument(index == null || index >= 0, "negative index %s", index);
  }

  /** Creates a reference to a scalar polynomial on the current row. */
  public static PolynomialReference of(String name) {
    return new PolynomialReference(name, null, false);
  }

  /** Returns the offset of the referenced element within its polynomial;
   * 0 for a scalar. */
  public long offset() {
    return index == null ? 0 : index;
  }

  /** Returns a copy of this reference with a given name, or this if the
   * name is the same. */
  public PolynomialReference withName(String name) {
    return name.equals(this.name)
        ? this
        : new PolynomialReference(name, index, next);
  }

  /** Returns a copy of this reference that refers to the next row, or this
   * if it already does. */
  public PolynomialReference withNext(boolean next) {
    return next == this.next
        ? this
        : new PolynomialReference(name, index, next);
  }

  /** Returns the name of the referenced column, e.g. "a[2]"; ignores
   * whether the reference is to the next row. */
  public String columnName() {
    return index == null ? name : name + "[" + index + "]";
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, index, next);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof PolynomialReference
            && name.equals(((PolynomialReference) o).name)
            && Objects.equals(index, ((PolynomialReference) o).index)
            && next == ((PolynomialReference) o).next;
  }

  @Override
  public String toString() {
    return next ? columnName() + "'" : columnName();
  }
}

// End PolynomialReference.java

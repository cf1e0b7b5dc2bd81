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

/**
 * Declaration of a public value: the value of one polynomial at one row.
 *
 * <p>For example, "public out = Main.y(7);".
 */
public class PublicDeclaration {
  public final long id;
  public final SourceRef source;
  public final String name;
  public final PolynomialReference polynomial;
  /** The evaluation point of the polynomial, not the array index. */
  public final long index;

  public PublicDeclaration(long id, SourceRef source, String name,
      PolynomialReference polynomial, long index) {
    this.id = id;
    this.source = requireNonNull(source);
    this.name = requireNonNull(name);
    this.polynomial = requireNonNull(polynomial);
    this.index = index;
    checkArgument(index >= 0, "negative row %s", index);
    checkArgument(!polynomial.next, "public value must not refer to next row");
  }

  @Override
  public String toString() {
    return "public " + name + " = " + polynomial + "(" + index + ")";
  }
}

// End PublicDeclaration.java

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

import net.hydromatic.pil.ast.Polynomial;
import net.hydromatic.pil.ast.PolynomialReference;

/** Context in which an {@link ExpressionEvaluator} resolves references to
 * columns and to public values. */
public interface SymbolicVariables {
  /** Returns the value of a committed or constant polynomial, as a constant
   * if it is known, as a variable if it is an unknown that may be solved
   * for, or as an incomplete result otherwise.
   *
   * @param poly Declaration of the referenced polynomial
   * @param reference Reference, with the index of the array element and
   *                  whether it refers to the next row */
  AffineResult value(Polynomial poly, PolynomialReference reference);

  /** Returns the value of a public declaration. */
  AffineResult publicValue(String name);
}

// End SymbolicVariables.java

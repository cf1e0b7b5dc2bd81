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

/** Kinds of {@link Expression}. */
public enum Op {
  /** Reference to a named constant, such as "%N". */
  CONSTANT,
  /** Reference to a polynomial, such as "x", "x'" or "a[2]". */
  POLYNOMIAL_REFERENCE,
  /** Reference to a parameter of a function definition, by ordinal. */
  LOCAL_VARIABLE_REFERENCE,
  /** Reference to a public declaration, such as ":out". */
  PUBLIC_REFERENCE,
  NUMBER,
  STRING,
  TUPLE,
  BINARY_OPERATION,
  UNARY_OPERATION,
  /** Call to a non-macro function, such as a constant polynomial. */
  FUNCTION_CALL,
  MATCH_EXPRESSION
}

// End Op.java

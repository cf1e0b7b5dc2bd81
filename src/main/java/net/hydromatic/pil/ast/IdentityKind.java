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

/** Kind of {@link Identity}. */
public enum IdentityKind {
  /** An expression that must be zero on every row. */
  POLYNOMIAL(" = "),
  /** Set membership: the left tuple occurs among the right tuples. */
  PLOOKUP(" in "),
  /** The selected left tuples are a permutation of the right ones. */
  PERMUTATION(" is "),
  /** Wires columns together. */
  CONNECT(" connect ");

  /** Padded keyword used when rendering an identity. */
  public final String padded;

  IdentityKind(String padded) {
    this.padded = padded;
  }
}

// End IdentityKind.java

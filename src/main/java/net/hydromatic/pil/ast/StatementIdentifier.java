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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Identifies a statement of an analyzed program, so that statements can be
 * listed in the order in which they appear in the source.
 *
 * @see Analyzed#sourceOrder
 */
public class StatementIdentifier {
  public final Kind kind;
  private final @Nullable String name;
  private final int index;

  private StatementIdentifier(Kind kind, @Nullable String name, int index) {
    this.kind = requireNonNull(kind);
    this.name = name;
    this.index = index;
  }

  /** Identifies the definition of a polynomial, by name. */
  public static StatementIdentifier definition(String name) {
    return new StatementIdentifier(Kind.DEFINITION, requireNonNull(name), -1);
  }

  /** Identifies a public declaration, by name. */
  public static StatementIdentifier publicDeclaration(String name) {
    return new StatementIdentifier(Kind.PUBLIC_DECLARATION,
        requireNonNull(name), -1);
  }

  /** Identifies an identity, by its position in
   * {@link Analyzed#identities}. */
  public static StatementIdentifier identity(int index) {
    return new StatementIdentifier(Kind.IDENTITY, null, index);
  }

  /** Returns the name of a definition or public declaration. */
  public String name() {
    checkState(name != null, "%s has no name", kind);
    return name;
  }

  /** Returns the position of an identity. */
  public int index() {
    checkState(kind == Kind.IDENTITY, "%s has no index", kind);
    return index;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, name, index);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof StatementIdentifier
            && kind == ((StatementIdentifier) o).kind
            && Objects.equals(name, ((StatementIdentifier) o).name)
            && index == ((StatementIdentifier) o).index;
  }

  @Override
  public String toString() {
    return kind == Kind.IDENTITY ? kind + "(" + index + ")"
        : kind + "(" + name + ")";
  }

  /** Kind of statement. */
  public enum Kind {
    DEFINITION,
    PUBLIC_DECLARATION,
    IDENTITY
  }
}

// End StatementIdentifier.java

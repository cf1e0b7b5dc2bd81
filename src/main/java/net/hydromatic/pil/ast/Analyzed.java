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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Analyzed PIL program.
 *
 * <p>Built once, by lowering a parsed program, and immutable thereafter.
 *
 * <p>The maps of definitions and public declarations are sorted by name,
 * which has nothing to do with the order of the statements in the source
 * file. Code that needs source order, for example to lay out columns, must
 * use {@link #sourceOrder}.
 */
public class Analyzed {
  /** Constants. They are not namespaced. */
  public final SortedMap<String, FieldElement> constants;
  public final SortedMap<String, Definition> definitions;
  public final SortedMap<String, PublicDeclaration> publicDeclarations;
  public final List<Identity> identities;
  /** The order in which definitions, public declarations and identities
   * appear in the source. */
  public final List<StatementIdentifier> sourceOrder;

  public Analyzed(Map<String, FieldElement> constants,
      Map<String, Definition> definitions,
      Map<String, PublicDeclaration> publicDeclarations,
      List<Identity> identities,
      List<StatementIdentifier> sourceOrder) {
    this.constants = ImmutableSortedMap.copyOf(constants);
    this.definitions = ImmutableSortedMap.copyOf(definitions);
    this.publicDeclarations = ImmutableSortedMap.copyOf(publicDeclarations);
    this.identities = ImmutableList.copyOf(identities);
    this.sourceOrder = ImmutableList.copyOf(sourceOrder);
    for (StatementIdentifier statement : this.sourceOrder) {
      switch (statement.kind) {
      case DEFINITION:
        checkArgument(this.definitions.containsKey(statement.name()),
            "unknown definition %s", statement.name());
        break;
      case PUBLIC_DECLARATION:
        checkArgument(this.publicDeclarations.containsKey(statement.name()),
            "unknown public declaration %s", statement.name());
        break;
      case IDENTITY:
        checkArgument(statement.index() < this.identities.size(),
            "unknown identity %s", statement.index());
        break;
      default:
        throw new AssertionError("unknown kind " + statement.kind);
      }
    }
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the number of committed polynomials (with multiplicities for
   * arrays). */
  public long commitmentCount() {
    return declarationTypeCount(PolynomialType.COMMITTED);
  }

  /** Returns the number of intermediate polynomials (with multiplicities for
   * arrays). */
  public long intermediateCount() {
    return declarationTypeCount(PolynomialType.INTERMEDIATE);
  }

  /** Returns the number of constant polynomials (with multiplicities for
   * arrays). */
  public long constantCount() {
    return declarationTypeCount(PolynomialType.CONSTANT);
  }

  public List<Definition> constantPolysInSourceOrder() {
    return definitionsInSourceOrder(PolynomialType.CONSTANT);
  }

  public List<Definition> committedPolysInSourceOrder() {
    return definitionsInSourceOrder(PolynomialType.COMMITTED);
  }

  /** Returns the definitions of polynomials of a given type, in the order
   * they occur in the source. */
  public List<Definition> definitionsInSourceOrder(PolynomialType polyType) {
    final ImmutableList.Builder<Definition> b = ImmutableList.builder();
    for (StatementIdentifier statement : sourceOrder) {
      if (statement.kind == StatementIdentifier.Kind.DEFINITION) {
        final Definition definition =
            requireNonNull(definitions.get(statement.name()));
        if (definition.poly.polyType == polyType) {
          b.add(definition);
        }
      }
    }
    return b.build();
  }

  /** Returns the identities in the order they occur in the source. */
  public List<Identity> identitiesInSourceOrder() {
    final ImmutableList.Builder<Identity> b = ImmutableList.builder();
    for (StatementIdentifier statement : sourceOrder) {
      if (statement.kind == StatementIdentifier.Kind.IDENTITY) {
        b.add(identities.get(statement.index()));
      }
    }
    return b.build();
  }

  /** Returns the public declarations in the order they occur in the
   * source. */
  public List<PublicDeclaration> publicDeclarationsInSourceOrder() {
    final ImmutableList.Builder<PublicDeclaration> b =
        ImmutableList.builder();
    for (StatementIdentifier statement : sourceOrder) {
      if (statement.kind == StatementIdentifier.Kind.PUBLIC_DECLARATION) {
        b.add(requireNonNull(publicDeclarations.get(statement.name())));
      }
    }
    return b.build();
  }

  /** Looks up the definition of a polynomial by absolute name. Throws if not
   * found; never returns null. */
  public Definition definition(String name) {
    final Definition definition = definitions.get(name);
    if (definition == null) {
      throw new IllegalArgumentException("polynomial " + name + " not found");
    }
    return definition;
  }

  /** Looks up a constant by name, or returns null. */
  public @Nullable FieldElement constant(String name) {
    return constants.get(name);
  }

  /** Returns the degree shared by all polynomials, or null if there are no
   * polynomials. */
  public @Nullable Long degree() {
    Long degree = null;
    for (Definition definition : definitions.values()) {
      final long d = definition.poly.degree;
      checkState(degree == null || degree == d,
          "polynomials have different degrees: %s and %s", degree, d);
      degree = d;
    }
    return degree;
  }

  private long declarationTypeCount(PolynomialType polyType) {
    long count = 0;
    for (Definition definition : definitions.values()) {
      if (definition.poly.polyType == polyType) {
        count += definition.poly.columnCount();
      }
    }
    return count;
  }

  /** A polynomial and, if it has one, the definition of its values. */
  public static class Definition {
    public final Polynomial poly;
    public final @Nullable FunctionValueDefinition value;

    public Definition(Polynomial poly,
        @Nullable FunctionValueDefinition value) {
      this.poly = requireNonNull(poly);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Objects.hash(poly, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Definition
              && poly.equals(((Definition) o).poly)
              && Objects.equals(value, ((Definition) o).value);
    }

    @Override
    public String toString() {
      return value == null ? poly.toString() : poly + "" + value;
    }
  }

  /** Builds an {@link Analyzed}, recording the order in which statements
   * are added. */
  public static class Builder {
    private final Map<String, FieldElement> constants = new HashMap<>();
    private final Map<String, Definition> definitions = new HashMap<>();
    private final Map<String, PublicDeclaration> publicDeclarations =
        new HashMap<>();
    private final List<Identity> identities = new ArrayList<>();
    private final List<StatementIdentifier> sourceOrder = new ArrayList<>();

    private Builder() {}

    public Builder constant(String name, FieldElement value) {
      checkArgument(constants.put(name, value) == null,
          "duplicate constant %s", name);
      return this;
    }

    public Builder definition(Polynomial poly,
        @Nullable FunctionValueDefinition value) {
      final String name = poly.absoluteName;
      checkArgument(definitions.put(name, new Definition(poly, value)) == null,
          "duplicate polynomial %s", name);
      sourceOrder.add(StatementIdentifier.definition(name));
      return this;
    }

    public Builder publicDeclaration(PublicDeclaration declaration) {
      checkArgument(
          publicDeclarations.put(declaration.name, declaration) == null,
          "duplicate public declaration %s", declaration.name);
      sourceOrder.add(
          StatementIdentifier.publicDeclaration(declaration.name));
      return this;
    }

    public Builder identity(Identity identity) {
      sourceOrder.add(StatementIdentifier.identity(identities.size()));
      identities.add(identity);
      return this;
    }

    /** Returns whether a polynomial of the given name has been added. */
    public boolean hasDefinition(String name) {
      return definitions.containsKey(name);
    }

    public Analyzed build() {
      return new Analyzed(constants, definitions, publicDeclarations,
          identities, sourceOrder);
    }
  }
}

// End Analyzed.java

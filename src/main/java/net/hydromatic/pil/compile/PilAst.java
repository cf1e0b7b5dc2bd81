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
package net.hydromatic.pil.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.pil.ast.Expression;
import net.hydromatic.pil.ast.PolynomialReference;
import net.hydromatic.pil.ast.SelectedExpressions;
import net.hydromatic.pil.ast.SourceRef;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Abstract syntax tree of a PIL program, as produced by a parser.
 *
 * <p>Expressions are {@link Expression} trees whose names are not yet
 * resolved: a polynomial reference holds the name as written (relative to
 * the current namespace, or absolute if it contains a dot), and a reference
 * to a parameter of a function definition is a polynomial reference whose
 * name is the parameter's name. {@link PilAnalyzer} resolves them.
 */
public class PilAst {
  private PilAst() {}

  /** A program; a list of statements. */
  public static class Program {
    public final List<Statement> statements;

    public Program(List<Statement> statements) {
      this.statements = ImmutableList.copyOf(statements);
    }

    public static Program of(Statement... statements) {
      return new Program(ImmutableList.copyOf(statements));
    }
  }

  /** Base class for all statements. */
  public abstract static class Statement {
    public final SourceRef source;

    protected Statement(SourceRef source) {
      this.source = requireNonNull(source);
    }
  }

  /** Namespace declaration, {@code namespace Main(%N);}. Subsequent
   * declarations are in the namespace and have its degree. */
  public static class Namespace extends Statement {
    public final String name;
    public final Expression degree;

    public Namespace(SourceRef source, String name, Expression degree) {
      super(source);
      this.name = requireNonNull(name);
      this.degree = requireNonNull(degree);
    }

    @Override public String toString() {
      return "namespace " + name + "(" + degree + ");";
    }
  }

  /** Constant definition, {@code constant %N = 16;}. */
  public static class ConstantDefinition extends Statement {
    public final String name;
    public final Expression value;

    public ConstantDefinition(SourceRef source, String name,
        Expression value) {
      super(source);
      checkArgument(name.startsWith("%"),
          "constant name must start with %: %s", name);
      this.name = name;
      this.value = requireNonNull(value);
    }

    @Override public String toString() {
      return "constant " + name + " = " + value + ";";
    }
  }

  /** Name of a polynomial in a declaration, with an optional array size. */
  public static class PolynomialName {
    public final String name;
    public final @Nullable Expression arraySize;

    public PolynomialName(String name, @Nullable Expression arraySize) {
      this.name = requireNonNull(name);
      this.arraySize = arraySize;
    }

    public static PolynomialName of(String name) {
      return new PolynomialName(name, null);
    }

    @Override public String toString() {
      return arraySize == null ? name : name + "[" + arraySize + "]";
    }
  }

  /** Declaration of committed (witness) polynomials,
   * {@code pol commit x, y;}, optionally with a query,
   * {@code pol commit x(i) query ("input", i);}. */
  public static class PolynomialCommitDeclaration extends Statement {
    public final List<PolynomialName> names;
    public final @Nullable FunctionDefinition definition;

    public PolynomialCommitDeclaration(SourceRef source,
        List<PolynomialName> names, @Nullable FunctionDefinition definition) {
      super(source);
      this.names = ImmutableList.copyOf(names);
      this.definition = definition;
      checkArgument(!this.names.isEmpty(), "no names");
    }
  }

  /** Declaration of constant (fixed) polynomials without a definition,
   * {@code pol constant A, B;}. */
  public static class PolynomialConstantDeclaration extends Statement {
    public final List<PolynomialName> names;

    public PolynomialConstantDeclaration(SourceRef source,
        List<PolynomialName> names) {
      super(source);
      this.names = ImmutableList.copyOf(names);
      checkArgument(!this.names.isEmpty(), "no names");
    }
  }

  /** Definition of a constant (fixed) polynomial,
   * {@code pol constant EVEN(i) { 2 * i };} or
   * {@code pol constant ISLAST = [0]* + [1];}. */
  public static class PolynomialConstantDefinition extends Statement {
    public final String name;
    public final FunctionDefinition definition;

    public PolynomialConstantDefinition(SourceRef source, String name,
        FunctionDefinition definition) {
      super(source);
      this.name = requireNonNull(name);
      this.definition = requireNonNull(definition);
    }
  }

  /** Definition of an intermediate polynomial, {@code pol z = x * y;}. */
  public static class PolynomialDefinition extends Statement {
    public final String name;
    public final Expression expression;

    public PolynomialDefinition(SourceRef source, String name,
        Expression expression) {
      super(source);
      this.name = requireNonNull(name);
      this.expression = requireNonNull(expression);
    }
  }

  /** Public declaration, {@code public out = x(7);}. */
  public static class PublicDeclaration extends Statement {
    public final String name;
    public final PolynomialReference polynomial;
    public final Expression index;

    public PublicDeclaration(SourceRef source, String name,
        PolynomialReference polynomial, Expression index) {
      super(source);
      this.name = requireNonNull(name);
      this.polynomial = requireNonNull(polynomial);
      this.index = requireNonNull(index);
    }
  }

  /** Polynomial identity, {@code left = right;}, held as the expression
   * {@code left - right}. */
  public static class PolynomialIdentity extends Statement {
    public final Expression expression;

    public PolynomialIdentity(SourceRef source, Expression expression) {
      super(source);
      this.expression = requireNonNull(expression);
    }
  }

  /** Plookup identity, {@code s { a, b } in t { c, d };}. */
  public static class PlookupIdentity extends Statement {
    public final SelectedExpressions left;
    public final SelectedExpressions right;

    public PlookupIdentity(SourceRef source, SelectedExpressions left,
        SelectedExpressions right) {
      super(source);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }
  }

  /** Permutation identity, {@code s { a, b } is t { c, d };}. */
  public static class PermutationIdentity extends Statement {
    public final SelectedExpressions left;
    public final SelectedExpressions right;

    public PermutationIdentity(SourceRef source, SelectedExpressions left,
        SelectedExpressions right) {
      super(source);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }
  }

  /** Connect identity, {@code { a, b } connect { c, d };}. */
  public static class ConnectIdentity extends Statement {
    public final List<Expression> left;
    public final List<Expression> right;

    public ConnectIdentity(SourceRef source, List<Expression> left,
        List<Expression> right) {
      super(source);
      this.left = ImmutableList.copyOf(left);
      this.right = ImmutableList.copyOf(right);
    }
  }

  /** Definition of the values of a polynomial: a mapping from the row
   * index, a query, or an array. */
  public static class FunctionDefinition {
    public final Kind kind;
    public final List<String> params;
    private final @Nullable Expression body;
    private final @Nullable ArrayExpression array;

    private FunctionDefinition(Kind kind, List<String> params,
        @Nullable Expression body, @Nullable ArrayExpression array) {
      this.kind = requireNonNull(kind);
      this.params = ImmutableList.copyOf(params);
      this.body = body;
      this.array = array;
    }

    public static FunctionDefinition mapping(List<String> params,
        Expression body) {
      return new FunctionDefinition(Kind.MAPPING, params,
          requireNonNull(body), null);
    }

    public static FunctionDefinition query(List<String> params,
        Expression body) {
      return new FunctionDefinition(Kind.QUERY, params,
          requireNonNull(body), null);
    }

    public static FunctionDefinition array(ArrayExpression array) {
      return new FunctionDefinition(Kind.ARRAY, ImmutableList.of(), null,
          requireNonNull(array));
    }

    /** Returns the body of a mapping or query. */
    public Expression body() {
      return requireNonNull(body, "body");
    }

    /** Returns the expression of an array. */
    public ArrayExpression array() {
      return requireNonNull(array, "array");
    }

    /** Kind of function definition. */
    public enum Kind {
      MAPPING,
      QUERY,
      ARRAY
    }
  }

  /** Array of values; a list of values, a list of values repeated to fill
   * the space that is left, or a concatenation of arrays. */
  public static class ArrayExpression {
    public final Kind kind;
    public final List<Expression> values;
    public final List<ArrayExpression> parts;

    private ArrayExpression(Kind kind, List<Expression> values,
        List<ArrayExpression> parts) {
      this.kind = requireNonNull(kind);
      this.values = ImmutableList.copyOf(values);
      this.parts = ImmutableList.copyOf(parts);
    }

    /** Creates an array, {@code [1, 2, 3]}. */
    public static ArrayExpression value(List<Expression> values) {
      return new ArrayExpression(Kind.VALUE, values, ImmutableList.of());
    }

    /** Creates an array that repeats its values to fill the remaining
     * rows, {@code [1, 2]*}. */
    public static ArrayExpression repeated(List<Expression> values) {
      return new ArrayExpression(Kind.REPEATED, values, ImmutableList.of());
    }

    /** Creates the concatenation of arrays, {@code [0]* + [1]}. */
    public static ArrayExpression concat(ArrayExpression... parts) {
      return new ArrayExpression(Kind.CONCAT, ImmutableList.of(),
          ImmutableList.copyOf(parts));
    }

    /** Kind of array expression. */
    public enum Kind {
      VALUE,
      REPEATED,
      CONCAT
    }
  }
}

// End PilAst.java

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

import static net.hydromatic.pil.ast.ExpressionBuilder.pil;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.Expression;
import net.hydromatic.pil.ast.ExpressionShuttle;
import net.hydromatic.pil.ast.ExpressionVisitor;
import net.hydromatic.pil.ast.FunctionValueDefinition;
import net.hydromatic.pil.ast.Identity;
import net.hydromatic.pil.ast.IdentityKind;
import net.hydromatic.pil.ast.Polynomial;
import net.hydromatic.pil.ast.PolynomialReference;
import net.hydromatic.pil.ast.PolynomialType;
import net.hydromatic.pil.ast.PublicDeclaration;
import net.hydromatic.pil.ast.RepeatedArray;
import net.hydromatic.pil.ast.SelectedExpressions;
import net.hydromatic.pil.ast.SourceRef;
import net.hydromatic.pil.eval.AffineResult;
import net.hydromatic.pil.eval.ExpressionEvaluator;
import net.hydromatic.pil.eval.IncompleteCause;
import net.hydromatic.pil.eval.SymbolicVariables;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lowers a {@link PilAst.Program} into an {@link Analyzed} program.
 *
 * <p>The first pass declares every polynomial, assigning ids per
 * polynomial type (the elements of an array get consecutive ids), and
 * evaluates the constants and degrees. The second pass resolves the
 * expressions of definitions and identities, and adds everything to the
 * program in source order.
 */
public class PilAnalyzer {
  /** Namespace of declarations that precede the first namespace
   * statement. */
  public static final String DEFAULT_NAMESPACE = "Global";

  private final Map<String, FieldElement> constants = new LinkedHashMap<>();
  private final Map<String, Polynomial> polynomials = new HashMap<>();
  private final Set<String> publicNames = new HashSet<>();
  private final Map<PolynomialType, Long> polyCounters =
      new EnumMap<>(PolynomialType.class);
  private final Map<IdentityKind, Long> identityCounters =
      new EnumMap<>(IdentityKind.class);
  private long publicCounter;
  private final Analyzed.Builder builder = Analyzed.builder();

  private PilAnalyzer() {}

  /** Analyzes a program.
   *
   * @throws AnalyzeException if the program is invalid */
  public static Analyzed analyze(PilAst.Program program) {
    final PilAnalyzer analyzer = new PilAnalyzer();
    analyzer.declare(program);
    analyzer.lower(program);
    return analyzer.builder.build();
  }

  /** First pass: declares polynomials, constants and public values. */
  private void declare(PilAst.Program program) {
    String namespace = DEFAULT_NAMESPACE;
    @Nullable Long degree = null;
    for (PilAst.Statement statement : program.statements) {
      final SourceRef source = statement.source;
      if (statement instanceof PilAst.Namespace) {
        final PilAst.Namespace ns = (PilAst.Namespace) statement;
        namespace = ns.name;
        degree = evaluateDegree(ns.degree, source);
      } else if (statement instanceof PilAst.ConstantDefinition) {
        final PilAst.ConstantDefinition c =
            (PilAst.ConstantDefinition) statement;
        if (constants.containsKey(c.name)) {
          throw new AnalyzeException("duplicate constant " + c.name, source);
        }
        final FieldElement value = evaluateConstant(c.value, source);
        constants.put(c.name, value);
        builder.constant(c.name, value);
      } else if (statement instanceof PilAst.PolynomialCommitDeclaration) {
        final PilAst.PolynomialCommitDeclaration d =
            (PilAst.PolynomialCommitDeclaration) statement;
        if (d.definition != null) {
          if (d.definition.kind != PilAst.FunctionDefinition.Kind.QUERY) {
            throw new AnalyzeException("committed polynomial can only be "
                + "defined by a query", source);
          }
          if (d.names.size() != 1) {
            throw new AnalyzeException("query must define exactly one "
                + "polynomial", source);
          }
        }
        for (PilAst.PolynomialName name : d.names) {
          declarePolynomial(PolynomialType.COMMITTED, name, namespace, degree,
              source);
        }
      } else if (statement instanceof PilAst.PolynomialConstantDeclaration) {
        for (PilAst.PolynomialName name
            : ((PilAst.PolynomialConstantDeclaration) statement).names) {
          declarePolynomial(PolynomialType.CONSTANT, name, namespace, degree,
              source);
        }
      } else if (statement instanceof PilAst.PolynomialConstantDefinition) {
        final PilAst.PolynomialConstantDefinition d =
            (PilAst.PolynomialConstantDefinition) statement;
        if (d.definition.kind == PilAst.FunctionDefinition.Kind.QUERY) {
          throw new AnalyzeException("constant polynomial " + d.name
              + " cannot be defined by a query", source);
        }
        declarePolynomial(PolynomialType.CONSTANT,
            PilAst.PolynomialName.of(d.name), namespace, degree, source);
      } else if (statement instanceof PilAst.PolynomialDefinition) {
        declarePolynomial(PolynomialType.INTERMEDIATE,
            PilAst.PolynomialName.of(
                ((PilAst.PolynomialDefinition) statement).name),
            namespace, degree, source);
      } else if (statement instanceof PilAst.PublicDeclaration) {
        final String name = ((PilAst.PublicDeclaration) statement).name;
        if (!publicNames.add(name)) {
          throw new AnalyzeException("duplicate public declaration " + name,
              source);
        }
      }
    }
  }

  private void declarePolynomial(PolynomialType polyType,
      PilAst.PolynomialName name, String namespace, @Nullable Long degree,
      SourceRef source) {
    if (degree == null) {
      throw new AnalyzeException("polynomial " + name.name
          + " is declared outside a namespace with a degree", source);
    }
    final String absoluteName = absoluteName(namespace, name.name);
    if (polynomials.containsKey(absoluteName)) {
      throw new AnalyzeException("duplicate polynomial " + absoluteName,
          source);
    }
    final @Nullable Long length;
    if (name.arraySize == null) {
      length = null;
    } else {
      length = evaluateDegree(name.arraySize, source);
      if (length == 0) {
        throw new AnalyzeException("array " + absoluteName
            + " must have at least one element", source);
      }
    }
    final long id = polyCounters.getOrDefault(polyType, 0L);
    final Polynomial poly =
        new Polynomial(id, source, absoluteName, polyType, degree, length);
    polyCounters.put(polyType, id + poly.columnCount());
    polynomials.put(absoluteName, poly);
  }

  /** Second pass: resolves expressions and builds the program in source
   * order. */
  private void lower(PilAst.Program program) {
    String namespace = DEFAULT_NAMESPACE;
    for (PilAst.Statement statement : program.statements) {
      final SourceRef source = statement.source;
      if (statement instanceof PilAst.Namespace) {
        namespace = ((PilAst.Namespace) statement).name;
      } else if (statement instanceof PilAst.ConstantDefinition) {
        // evaluated in the first pass
        continue;
      } else if (statement instanceof PilAst.PolynomialCommitDeclaration) {
        final PilAst.PolynomialCommitDeclaration d =
            (PilAst.PolynomialCommitDeclaration) statement;
        for (PilAst.PolynomialName name : d.names) {
          final @Nullable FunctionValueDefinition value =
              d.definition == null
              ? null
              : FunctionValueDefinition.query(
                  resolve(d.definition.body(), namespace,
                      d.definition.params, source));
          builder.definition(polynomial(namespace, name.name), value);
        }
      } else if (statement instanceof PilAst.PolynomialConstantDeclaration) {
        for (PilAst.PolynomialName name
            : ((PilAst.PolynomialConstantDeclaration) statement).names) {
          builder.definition(polynomial(namespace, name.name), null);
        }
      } else if (statement instanceof PilAst.PolynomialConstantDefinition) {
        final PilAst.PolynomialConstantDefinition d =
            (PilAst.PolynomialConstantDefinition) statement;
        final Polynomial poly = polynomial(namespace, d.name);
        builder.definition(poly,
            lowerFunction(poly, d.definition, namespace, source));
      } else if (statement instanceof PilAst.PolynomialDefinition) {
        final PilAst.PolynomialDefinition d =
            (PilAst.PolynomialDefinition) statement;
        builder.definition(polynomial(namespace, d.name),
            FunctionValueDefinition.mapping(
                resolve(d.expression, namespace, ImmutableList.of(),
                    source)));
      } else if (statement instanceof PilAst.PublicDeclaration) {
        final PilAst.PublicDeclaration d =
            (PilAst.PublicDeclaration) statement;
        final Expression.Reference reference =
            (Expression.Reference) resolve(pil.ref(d.polynomial), namespace,
                ImmutableList.of(), source);
        if (reference.poly.next) {
          throw new AnalyzeException("public declaration " + d.name
              + " must not refer to the next row", source);
        }
        builder.publicDeclaration(
            new PublicDeclaration(publicCounter++, source, d.name,
                reference.poly, evaluateDegree(d.index, source)));
      } else if (statement instanceof PilAst.PolynomialIdentity) {
        builder.identity(
            Identity.polynomial(nextIdentityId(IdentityKind.POLYNOMIAL),
                source,
                resolve(((PilAst.PolynomialIdentity) statement).expression,
                    namespace, ImmutableList.of(), source)));
      } else if (statement instanceof PilAst.PlookupIdentity) {
        final PilAst.PlookupIdentity i = (PilAst.PlookupIdentity) statement;
        addIdentity(IdentityKind.PLOOKUP, i.left, i.right, namespace,
            source);
      } else if (statement instanceof PilAst.PermutationIdentity) {
        final PilAst.PermutationIdentity i =
            (PilAst.PermutationIdentity) statement;
        addIdentity(IdentityKind.PERMUTATION, i.left, i.right, namespace,
            source);
      } else if (statement instanceof PilAst.ConnectIdentity) {
        final PilAst.ConnectIdentity i = (PilAst.ConnectIdentity) statement;
        addIdentity(IdentityKind.CONNECT,
            new SelectedExpressions(null, i.left),
            new SelectedExpressions(null, i.right), namespace, source);
      } else {
        throw new AssertionError("unknown statement " + statement);
      }
    }
  }

  private void addIdentity(IdentityKind kind, SelectedExpressions left,
      SelectedExpressions right, String namespace, SourceRef source) {
    if (left.expressions.size() != right.expressions.size()) {
      throw new AnalyzeException("left side of" + kind.padded + "identity "
          + "has " + left.expressions.size() + " expressions, right side has "
          + right.expressions.size(), source);
    }
    builder.identity(
        new Identity(nextIdentityId(kind), kind, source,
            resolve(left, namespace, source),
            resolve(right, namespace, source)));
  }

  private long nextIdentityId(IdentityKind kind) {
    final long id = identityCounters.getOrDefault(kind, 0L);
    identityCounters.put(kind, id + 1);
    return id;
  }

  private FunctionValueDefinition lowerFunction(Polynomial poly,
      PilAst.FunctionDefinition definition, String namespace,
      SourceRef source) {
    switch (definition.kind) {
    case MAPPING:
      return FunctionValueDefinition.mapping(
          resolve(definition.body(), namespace, definition.params, source));
    case ARRAY:
      return FunctionValueDefinition.array(
          lowerArray(poly, definition.array(), namespace, source));
    case QUERY:
      return FunctionValueDefinition.query(
          resolve(definition.body(), namespace, definition.params, source));
    default:
      throw new AssertionError("unknown kind " + definition.kind);
    }
  }

  /** Converts an array expression into segments. A repeated segment is
   * repeated as often as needed to fill the rows that the other segments
   * leave; it must fill them exactly. */
  private List<RepeatedArray> lowerArray(Polynomial poly,
      PilAst.ArrayExpression array, String namespace, SourceRef source) {
    final List<PilAst.ArrayExpression> segments = new ArrayList<>();
    flatten(array, segments);
    long fixedSize = 0;
    int repeatedCount = 0;
    for (PilAst.ArrayExpression segment : segments) {
      if (segment.kind == PilAst.ArrayExpression.Kind.REPEATED) {
        ++repeatedCount;
        if (segment.values.isEmpty()) {
          throw new AnalyzeException("repeated array in definition of "
              + poly.absoluteName + " must not be empty", source);
        }
      } else {
        fixedSize += segment.values.size();
      }
    }
    if (repeatedCount > 1) {
      throw new AnalyzeException("definition of " + poly.absoluteName
          + " has more than one repeated array", source);
    }
    if (repeatedCount == 0 && fixedSize != poly.degree) {
      throw new AnalyzeException("array for " + poly.absoluteName + " has "
          + fixedSize + " values but the degree is " + poly.degree, source);
    }
    final ImmutableList.Builder<RepeatedArray> b = ImmutableList.builder();
    for (PilAst.ArrayExpression segment : segments) {
      final List<Expression> values = new ArrayList<>();
      for (Expression value : segment.values) {
        values.add(resolve(value, namespace, ImmutableList.of(), source));
      }
      if (segment.kind != PilAst.ArrayExpression.Kind.REPEATED) {
        b.add(new RepeatedArray(values, 1));
        continue;
      }
      final long remaining = poly.degree - fixedSize;
      if (remaining < 0 || remaining % values.size() != 0) {
        throw new AnalyzeException("repeated array of size " + values.size()
            + " in definition of " + poly.absoluteName + " cannot fill "
            + remaining + " rows", source);
      }
      if (remaining > 0) {
        b.add(new RepeatedArray(values, remaining / values.size()));
      }
    }
    return b.build();
  }

  private static void flatten(PilAst.ArrayExpression array,
      List<PilAst.ArrayExpression> segments) {
    if (array.kind == PilAst.ArrayExpression.Kind.CONCAT) {
      array.parts.forEach(part -> flatten(part, segments));
    } else {
      segments.add(array);
    }
  }

  private static String absoluteName(String namespace, String name) {
    return name.contains(".") ? name : namespace + "." + name;
  }

  private Polynomial polynomial(String namespace, String name) {
    final Polynomial poly = polynomials.get(absoluteName(namespace, name));
    if (poly == null) {
      throw new AssertionError("not declared: " + name);
    }
    return poly;
  }

  private SelectedExpressions resolve(SelectedExpressions selected,
      String namespace, SourceRef source) {
    final @Nullable Expression selector = selected.selector == null
        ? null
        : resolve(selected.selector, namespace, ImmutableList.of(), source);
    final List<Expression> expressions = new ArrayList<>();
    for (Expression e : selected.expressions) {
      expressions.add(resolve(e, namespace, ImmutableList.of(), source));
    }
    return new SelectedExpressions(selector, expressions);
  }

  /** Resolves the names in an expression. */
  private Expression resolve(Expression e, String namespace,
      List<String> params, SourceRef source) {
    return e.accept(new Resolver(namespace, params, source));
  }

  /** Evaluates an expression that may only refer to constants. */
  private FieldElement evaluateConstant(Expression e, SourceRef source) {
    e.accept(new ExpressionVisitor() {
      @Override public void visit(Expression.Reference reference) {
        throw new AnalyzeException("constant expression " + e
            + " must not refer to polynomial " + reference, source);
      }

      @Override public void visit(Expression.LocalVariable localVariable) {
        throw new AnalyzeException("constant expression " + e
            + " must not refer to a parameter", source);
      }

      @Override public void visit(
          Expression.PublicReference publicReference) {
        throw new AnalyzeException("constant expression " + e
            + " must not refer to public value " + publicReference, source);
      }
    });
    final Analyzed constantsOnly = new Analyzed(constants, ImmutableMap.of(),
        ImmutableMap.of(), ImmutableList.of(), ImmutableList.of());
    final AffineResult result =
        new ExpressionEvaluator(constantsOnly, NoVariables.INSTANCE)
            .evaluate(e);
    if (!result.isAffine()) {
      throw new AnalyzeException("cannot evaluate constant expression " + e
          + ": " + result.cause(), source);
    }
    return result.expression().constantValue();
  }

  /** Evaluates an expression that must be a non-negative integer, such as a
   * degree, an array size or a row index. */
  private long evaluateDegree(Expression e, SourceRef source) {
    final FieldElement value = evaluateConstant(e, source);
    try {
      return value.toDegree();
    } catch (IllegalArgumentException ex) {
      throw new AnalyzeException("value " + value + " of " + e
          + " is too large", source);
    }
  }

  /** Context for constant expressions, which has no variables. */
  private enum NoVariables implements SymbolicVariables {
    INSTANCE;

    @Override public AffineResult value(Polynomial poly,
        PolynomialReference reference) {
      return AffineResult.incomplete(
          IncompleteCause.expressionEvaluationUnimplemented(
              "reference to " + reference));
    }

    @Override public AffineResult publicValue(String name) {
      return AffineResult.incomplete(
          IncompleteCause.expressionEvaluationUnimplemented(
              "reference to public value " + name));
    }
  }

  /** Shuttle that resolves the names in an expression: makes polynomial
   * names absolute, converts references to parameters into local
   * variables, and checks that constants and public values exist. */
  private class Resolver extends ExpressionShuttle {
    private final String namespace;
    private final List<String> params;
    private final SourceRef source;

    Resolver(String namespace, List<String> params, SourceRef source) {
      this.namespace = namespace;
      this.params = params;
      this.source = source;
    }

    @Override public Expression visit(Expression.Reference reference) {
      final PolynomialReference poly = reference.poly;
      if (params.contains(poly.name)) {
        if (poly.index != null || poly.next) {
          throw new AnalyzeException("parameter " + poly.name
              + " cannot be indexed or shifted", source);
        }
        return pil.local(params.indexOf(poly.name));
      }
      final String absoluteName = absoluteName(namespace, poly.name);
      final Polynomial declared = polynomials.get(absoluteName);
      if (declared == null) {
        throw new AnalyzeException("unknown polynomial " + poly.name, source);
      }
      if (declared.isArray()) {
        if (poly.index == null) {
          throw new AnalyzeException("array " + absoluteName
              + " must be indexed", source);
        }
        if (poly.index < 0 || poly.index >= declared.columnCount()) {
          throw new AnalyzeException("index " + poly.index + " of "
              + absoluteName + " is out of bounds", source);
        }
      } else if (poly.index != null) {
        throw new AnalyzeException(absoluteName + " is not an array",
            source);
      }
      return reference.copy(poly.withName(absoluteName));
    }

    @Override public Expression visit(Expression.Constant constant) {
      if (!constants.containsKey(constant.name)) {
        throw new AnalyzeException("unknown constant " + constant.name,
            source);
      }
      return constant;
    }

    @Override public Expression visit(
        Expression.PublicReference publicReference) {
      if (!publicNames.contains(publicReference.name)) {
        throw new AnalyzeException("unknown public value "
            + publicReference.name, source);
      }
      return publicReference;
    }

    @Override public Expression visit(Expression.FunctionCall call) {
      final String absoluteName = absoluteName(namespace, call.name);
      if (!polynomials.containsKey(absoluteName)) {
        throw new AnalyzeException("unknown function " + call.name, source);
      }
      return call.copy(absoluteName, visitList(call.args));
    }
  }
}

// End PilAnalyzer.java
